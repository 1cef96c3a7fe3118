package org.groundslash.base.util.grounder;

import static org.groundslash.base.test.AspFixtures.anon;
import static org.groundslash.base.test.AspFixtures.atom;
import static org.groundslash.base.test.AspFixtures.body;
import static org.groundslash.base.test.AspFixtures.choiceElement;
import static org.groundslash.base.test.AspFixtures.cmp;
import static org.groundslash.base.test.AspFixtures.element;
import static org.groundslash.base.test.AspFixtures.guard;
import static org.groundslash.base.test.AspFixtures.n;
import static org.groundslash.base.test.AspFixtures.not;
import static org.groundslash.base.test.AspFixtures.plus;
import static org.groundslash.base.test.AspFixtures.terms;
import static org.groundslash.base.test.AspFixtures.v;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;

import org.groundslash.base.util.asp.grammar.AspAggregate;
import org.groundslash.base.util.asp.grammar.AspAggregateFunction;
import org.groundslash.base.util.asp.grammar.AspAtom;
import org.groundslash.base.util.asp.grammar.AspLiteral;
import org.groundslash.base.util.asp.grammar.AspPool;
import org.groundslash.base.util.asp.grammar.AspStatement;
import org.groundslash.base.util.asp.grammar.AspVariable;
import org.groundslash.base.util.grounder.exceptions.UnsafeVariableException;
import org.junit.Test;

public class SafetyCheckerTests
{
  private static AspStatement rule(AspAtom xiHead, AspLiteral... xiBody)
  {
    return AspPool.getRule(AspPool.getDisjunction(Collections.singletonList(xiHead)), Arrays.asList(xiBody));
  }

  private static void assertUnsafe(AspStatement xiStatement, AspVariable xiExpected)
  {
    try
    {
      SafetyChecker.check(xiStatement);
      fail(xiStatement + " should be unsafe");
    }
    catch (UnsafeVariableException lEx)
    {
      assertEquals(xiExpected, lEx.getVariable());
      assertEquals(xiStatement, lEx.getStatement().get());
    }
  }

  @Test
  public void testSafeRules() throws Exception
  {
    SafetyChecker.check(rule(atom("p", v("X"), plus(v("Y"), n(1))),
                             atom("q", v("X")),
                             atom("r", v("Y")),
                             not(atom("s", v("X"))),
                             cmp(v("X"), "<", v("Y"))));
    SafetyChecker.check(rule(atom("p")));
    SafetyChecker.check(AspPool.getConstraint(body(atom("q", v("X")), not(atom("r", v("X"))))));
  }

  @Test
  public void testFirstUnsafeVariableIsReported() throws Exception
  {
    assertUnsafe(rule(atom("p", v("X"), v("Y")), atom("r")), v("X"));
    assertUnsafe(rule(atom("p", v("X"), v("Y")), atom("r", v("X"))), v("Y"));
  }

  @Test
  public void testAnonymousVariableMustBeRenamed() throws Exception
  {
    assertUnsafe(rule(atom("p", anon()), atom("q", v("X"))), v("_"));
    assertUnsafe(rule(atom("p", v("X")), atom("q", v("X")), not(atom("r", anon()))), v("_"));
  }

  @Test
  public void testOnlyPositiveAtomsBind() throws Exception
  {
    assertUnsafe(rule(atom("p", v("X")), not(atom("q", v("X")))), v("X"));
    assertUnsafe(rule(atom("p", v("X")), atom("q", v("Y")), cmp(v("X"), "=", v("Y"))), v("X"));
    assertUnsafe(AspPool.getConstraint(body(atom("q", v("X")), not(atom("r", v("Z"))))), v("Z"));
  }

  @Test
  public void testArithmeticDoesNotBind() throws Exception
  {
    assertUnsafe(rule(atom("p", v("X")), atom("q", plus(v("X"), n(1)))), v("X"));
  }

  @Test
  public void testAggregateLocalVariables() throws Exception
  {
    AspAggregate lSafe = AspPool.getAggregate(AspAggregateFunction.COUNT,
                                              Arrays.asList(element(terms(v("X")), atom("q", v("X"), v("G")))),
                                              null,
                                              guard(">", n(0)));
    SafetyChecker.check(rule(atom("p", v("G")), atom("g", v("G")), lSafe));

    AspAggregate lUnbound = AspPool.getAggregate(AspAggregateFunction.COUNT,
                                                 Arrays.asList(element(terms(v("X")), atom("q", v("Y")))),
                                                 null,
                                                 guard(">", n(0)));
    assertUnsafe(rule(atom("p"), lUnbound), v("X"));

    AspAggregate lUnboundGuard = AspPool.getAggregate(AspAggregateFunction.SUM,
                                                      Arrays.asList(element(terms(v("X")), atom("q", v("X")))),
                                                      guard("<=", v("B")),
                                                      null);
    assertUnsafe(rule(atom("p"), lUnboundGuard), v("B"));
  }

  @Test
  public void testElementVariablesDoNotLeak() throws Exception
  {
    AspAggregate lCount = AspPool.getAggregate(AspAggregateFunction.COUNT,
                                               Arrays.asList(element(terms(v("X")), atom("q", v("X")))),
                                               null,
                                               guard(">", n(0)));
    assertUnsafe(rule(atom("p", v("X")), lCount), v("X"));
  }

  @Test
  public void testChoiceElements() throws Exception
  {
    SafetyChecker.check(AspPool.getRule(AspPool.getChoice(Arrays.asList(choiceElement(atom("p", v("X")),
                                                                                      atom("q", v("X")))),
                                                          null,
                                                          null),
                                        body()));
    assertUnsafe(AspPool.getRule(AspPool.getChoice(Arrays.asList(choiceElement(atom("p", v("X")))), null, null),
                                 body()),
                 v("X"));
  }

  @Test
  public void testNppInputs() throws Exception
  {
    SafetyChecker.check(AspPool.getRule(AspPool.getNpp(AspPool.getConstant("digit"), terms(v("X")), terms(n(0))),
                                        body(atom("img", v("X")))));
    assertUnsafe(AspPool.getRule(AspPool.getNpp(AspPool.getConstant("digit"), terms(v("X")), terms(n(0))), body()),
                 v("X"));
  }

  @Test
  public void testWeakConstraintParts() throws Exception
  {
    SafetyChecker.check(AspPool.getWeakConstraint(body(atom("c", v("X"), v("W"))), v("W"), n(1), terms(v("X"))));
    assertUnsafe(AspPool.getWeakConstraint(body(atom("c", v("X"))), v("W"), n(1), terms(v("X"))), v("W"));
    assertUnsafe(AspPool.getWeakConstraint(body(atom("c", v("X"))), n(1), n(1), terms(v("T"))), v("T"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNestedAggregatesAreRejected() throws Exception
  {
    AspAggregate lInner = AspPool.getAggregate(AspAggregateFunction.COUNT,
                                               Collections.singletonList(element(terms(n(1)), atom("r"))),
                                               null,
                                               null);
    AspAggregate lOuter = AspPool.getAggregate(AspAggregateFunction.COUNT,
                                               Collections.singletonList(element(terms(n(1)), lInner)),
                                               null,
                                               null);
    SafetyChecker.check(rule(atom("p"), lOuter));
  }
}
