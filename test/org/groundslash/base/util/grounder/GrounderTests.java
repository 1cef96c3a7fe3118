package org.groundslash.base.util.grounder;

import static org.groundslash.base.test.AspFixtures.anon;
import static org.groundslash.base.test.AspFixtures.atom;
import static org.groundslash.base.test.AspFixtures.body;
import static org.groundslash.base.test.AspFixtures.c;
import static org.groundslash.base.test.AspFixtures.choiceElement;
import static org.groundslash.base.test.AspFixtures.cmp;
import static org.groundslash.base.test.AspFixtures.element;
import static org.groundslash.base.test.AspFixtures.guard;
import static org.groundslash.base.test.AspFixtures.n;
import static org.groundslash.base.test.AspFixtures.negAtom;
import static org.groundslash.base.test.AspFixtures.not;
import static org.groundslash.base.test.AspFixtures.plus;
import static org.groundslash.base.test.AspFixtures.render;
import static org.groundslash.base.test.AspFixtures.terms;
import static org.groundslash.base.test.AspFixtures.v;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;

import org.groundslash.base.util.asp.grammar.AspAggregate;
import org.groundslash.base.util.asp.grammar.AspAggregateFunction;
import org.groundslash.base.util.asp.grammar.AspChoice;
import org.groundslash.base.util.asp.grammar.AspPool;
import org.groundslash.base.util.asp.grammar.AspProgram;
import org.groundslash.base.util.asp.grammar.AspStatement;
import org.groundslash.base.util.asp.transforms.AspProgramBuilder;
import org.groundslash.base.util.grounder.GrounderConfiguration.CfgItem;
import org.groundslash.base.util.grounder.exceptions.AggregateBoundTypeException;
import org.groundslash.base.util.grounder.exceptions.NonTerminationGuardException;
import org.groundslash.base.util.grounder.exceptions.NppArityMismatchException;
import org.groundslash.base.util.grounder.exceptions.UndefinedArithmeticException;
import org.groundslash.base.util.grounder.exceptions.UnsafeVariableException;
import org.junit.After;
import org.junit.Test;

public class GrounderTests
{
  @After
  public void tearDown()
  {
    GrounderConfiguration.utOverrideCfgVal(CfgItem.SIMPLIFY_CERTAIN_NEGATION, null);
  }

  private static AspProgram transitiveClosure()
  {
    return new AspProgramBuilder().addFact(atom("edge", n(1), n(2)))
                                  .addFact(atom("edge", n(2), n(3)))
                                  .addFact(atom("edge", n(3), n(4)))
                                  .addRule(atom("path", v("X"), v("Y")), body(atom("edge", v("X"), v("Y"))))
                                  .addRule(atom("path", v("X"), v("Z")),
                                           body(atom("path", v("X"), v("Y")), atom("edge", v("Y"), v("Z"))))
                                  .build();
  }

  @Test
  public void testTransitiveClosure() throws Exception
  {
    GroundProgram lGround = Grounder.ground(transitiveClosure());

    assertEquals(Arrays.asList("edge(1,2).",
                               "edge(2,3).",
                               "edge(3,4).",
                               "path(1,2) :- edge(1,2).",
                               "path(2,3) :- edge(2,3).",
                               "path(3,4) :- edge(3,4).",
                               "path(1,3) :- path(1,2), edge(2,3).",
                               "path(2,4) :- path(2,3), edge(3,4).",
                               "path(1,4) :- path(1,3), edge(3,4)."),
                 render(lGround.getStatements()));
    assertEquals(9, lGround.getPossibleAtoms().size());
    assertEquals(lGround.getPossibleAtoms(), lGround.getCertainAtoms());
    assertEquals(2, lGround.getComponents());

    // One pass for edge/2; path/2 needs two passes to derive everything and one more to see nothing change.
    assertEquals(4, lGround.getPasses());
  }

  @Test
  public void testGroundingIsDeterministic() throws Exception
  {
    assertEquals(Grounder.ground(transitiveClosure()).toString(), Grounder.ground(transitiveClosure()).toString());
  }

  @Test
  public void testNegationOfUndefinedPredicate() throws Exception
  {
    AspProgram lProgram = new AspProgramBuilder().addRule(atom("a"), body(not(atom("b")))).build();

    GroundProgram lGround = Grounder.ground(lProgram);

    assertEquals(Arrays.asList("a :- not b."), render(lGround.getStatements()));
    assertTrue(lGround.getCertainAtoms().contains(atom("a")));
  }

  @Test
  public void testNegationOfCertainAtomDropsInstance() throws Exception
  {
    AspProgram lProgram = new AspProgramBuilder().addFact(atom("b"))
                                                 .addRule(atom("a"), body(not(atom("b"))))
                                                 .build();

    GroundProgram lGround = Grounder.ground(lProgram);

    assertEquals(Arrays.asList("b."), render(lGround.getStatements()));
    assertFalse(lGround.getPossibleAtoms().contains(atom("a")));
  }

  @Test
  public void testNegationOfCertainAtomKeptWhenNotSimplifying() throws Exception
  {
    GrounderConfiguration.utOverrideCfgVal(CfgItem.SIMPLIFY_CERTAIN_NEGATION, "false");
    AspProgram lProgram = new AspProgramBuilder().addFact(atom("b"))
                                                 .addRule(atom("a"), body(not(atom("b"))))
                                                 .build();

    GroundProgram lGround = Grounder.ground(lProgram);

    assertEquals(Arrays.asList("b.", "a :- not b."), render(lGround.getStatements()));
    assertTrue(lGround.getPossibleAtoms().contains(atom("a")));
    assertFalse(lGround.getCertainAtoms().contains(atom("a")));
  }

  @Test
  public void testUnstratifiedProgram() throws Exception
  {
    AspProgram lProgram = new AspProgramBuilder().addRule(atom("a"), body(not(atom("b"))))
                                                 .addRule(atom("b"), body(not(atom("a"))))
                                                 .build();

    GroundProgram lGround = Grounder.ground(lProgram);

    assertEquals(Arrays.asList("a :- not b.", "b :- not a."), render(lGround.getStatements()));
    assertEquals(2, lGround.getPossibleAtoms().size());
    assertTrue(lGround.getCertainAtoms().isEmpty());
  }

  @Test
  public void testDisjunction() throws Exception
  {
    AspProgram lProgram = new AspProgramBuilder().addFact(atom("c"))
                                                 .addDisjunctiveRule(Arrays.asList(atom("a"), atom("b")), body(atom("c")))
                                                 .build();

    GroundProgram lGround = Grounder.ground(lProgram);

    assertEquals(Arrays.asList("c.", "a | b :- c."), render(lGround.getStatements()));
    assertTrue(lGround.getPossibleAtoms().contains(atom("b")));
    assertFalse(lGround.getCertainAtoms().contains(atom("a")));
    assertFalse(lGround.getCertainAtoms().contains(atom("b")));
  }

  @Test
  public void testClassicalNegation() throws Exception
  {
    AspProgram lProgram = new AspProgramBuilder().addFact(negAtom("p", c("a")))
                                                 .addRule(atom("q", v("X")), body(negAtom("p", v("X"))))
                                                 .addRule(atom("r", v("X")), body(atom("p", v("X"))))
                                                 .build();

    GroundProgram lGround = Grounder.ground(lProgram);

    assertEquals(Arrays.asList("-p(a).", "q(a) :- -p(a)."), render(lGround.getStatements()));
    assertTrue(lGround.getCertainAtoms().contains(atom("q", c("a"))));
  }

  @Test
  public void testConstraints() throws Exception
  {
    AspProgram lProgram = new AspProgramBuilder().addFact(atom("p"))
                                                 .addConstraint(body(atom("p")))
                                                 .addConstraint(body(atom("q")))
                                                 .build();

    GroundProgram lGround = Grounder.ground(lProgram);

    // The violated constraint is kept; the one over an impossible atom has no instance.
    assertEquals(Arrays.asList("p.", ":- p."), render(lGround.getStatements()));
  }

  @Test
  public void testWeakConstraints() throws Exception
  {
    AspProgram lProgram = new AspProgramBuilder().addFact(atom("cost", c("a"), n(3)))
                                                 .addWeakConstraint(body(atom("cost", v("X"), v("C"))),
                                                                    v("C"),
                                                                    plus(n(0), n(1)),
                                                                    terms(v("X")))
                                                 .build();

    GroundProgram lGround = Grounder.ground(lProgram);

    assertEquals(Arrays.asList("cost(a,3).", ":~ cost(a,3). [3@1, a]"), render(lGround.getStatements()));
  }

  @Test
  public void testWeakConstraintNeedsNumericWeight() throws Exception
  {
    AspProgram lProgram = new AspProgramBuilder().addFact(atom("cost", c("a"), c("high")))
                                                 .addWeakConstraint(body(atom("cost", v("X"), v("C"))),
                                                                    v("C"),
                                                                    n(1),
                                                                    terms(v("X")))
                                                 .build();
    try
    {
      Grounder.ground(lProgram);
      fail("Expected a non-numeric weight to be rejected");
    }
    catch (UndefinedArithmeticException lEx)
    {
      assertEquals(c("high"), lEx.getTerm());
      assertEquals(lProgram.getStatements().get(1), lEx.getStatement().get());
    }
  }

  @Test
  public void testQuery() throws Exception
  {
    AspProgram lProgram = new AspProgramBuilder().addFact(atom("q", n(1)))
                                                 .addRule(atom("q", plus(v("X"), n(1))),
                                                          body(atom("q", v("X")), cmp(v("X"), "<", n(2))))
                                                 .setQuery(atom("q", n(2)))
                                                 .build();

    GroundProgram lGround = Grounder.ground(lProgram);

    assertEquals(atom("q", n(2)), lGround.getQuery().get());
    assertEquals(Collections.singleton(atom("q", n(2))), lGround.getQueryAnswers());
    assertTrue(lGround.isQueryCertain());
  }

  @Test
  public void testQueryWithVariables() throws Exception
  {
    AspProgram lProgram = new AspProgramBuilder().addFact(atom("q", n(1)))
                                                 .addFact(atom("r", n(2)))
                                                 .addChoiceRule(AspPool.getChoice(Arrays.asList(choiceElement(atom("q", v("X")),
                                                                                                              atom("r", v("X")))),
                                                                                  null,
                                                                                  null),
                                                                body())
                                                 .setQuery(atom("q", v("Y")))
                                                 .build();

    GroundProgram lGround = Grounder.ground(lProgram);

    assertEquals(2, lGround.getQueryAnswers().size());
    assertTrue(lGround.getQueryAnswers().contains(atom("q", n(2))));
    assertTrue(lGround.isQueryCertain());

    AspProgram lUnanswerable = new AspProgramBuilder().addFact(atom("q", n(1))).setQuery(atom("s", v("Y"))).build();
    assertTrue(Grounder.ground(lUnanswerable).getQueryAnswers().isEmpty());
    assertFalse(Grounder.ground(lUnanswerable).isQueryCertain());
  }

  @Test
  public void testQueryWithAnonymousVariable() throws Exception
  {
    AspProgram lProgram = new AspProgramBuilder().addFact(atom("q", n(1)))
                                                 .addFact(atom("q", n(2)))
                                                 .addFact(atom("r", n(3)))
                                                 .setQuery(atom("q", anon()))
                                                 .build();

    GroundProgram lGround = Grounder.ground(lProgram);

    assertEquals(2, lGround.getQueryAnswers().size());
    assertTrue(lGround.getQueryAnswers().contains(atom("q", n(1))));
    assertTrue(lGround.getQueryAnswers().contains(atom("q", n(2))));
    assertTrue(lGround.isQueryCertain());
  }

  @Test(expected = UnsafeVariableException.class)
  public void testUnrenamedAnonymousVariableIsUnsafe() throws Exception
  {
    AspStatement lRule = AspPool.getRule(AspPool.getDisjunction(Collections.singletonList(atom("p", anon()))),
                                         body(atom("q", v("X"))));
    AspProgram lProgram = new AspProgram(Arrays.asList(lRule, AspPool.getFact(atom("q", c("a")))), null);
    Grounder.ground(lProgram);
  }

  @Test
  public void testCountAggregate() throws Exception
  {
    AspAggregate lCount = AspPool.getAggregate(AspAggregateFunction.COUNT,
                                               Arrays.asList(element(terms(v("X")), atom("q", v("X")))),
                                               null,
                                               guard(">=", n(2)));
    AspProgram lProgram = new AspProgramBuilder().addFact(atom("q", n(3)))
                                                 .addFact(atom("q", n(1)))
                                                 .addFact(atom("q", n(2)))
                                                 .addRule(atom("p"), body(lCount))
                                                 .build();

    GroundProgram lGround = Grounder.ground(lProgram);

    assertEquals("p :- #count{1:q(1);2:q(2);3:q(3)} >= 2.", lGround.getStatements().get(3).toString());
    assertTrue(lGround.getPossibleAtoms().contains(atom("p")));
    assertFalse(lGround.getCertainAtoms().contains(atom("p")));
  }

  @Test
  public void testAggregateElementsUseOuterBindings() throws Exception
  {
    AspAggregate lSum = AspPool.getAggregate(AspAggregateFunction.SUM,
                                             Arrays.asList(element(terms(v("W"), v("I")), atom("w", v("G"), v("I"), v("W")))),
                                             null,
                                             guard(">", n(4)));
    AspProgram lProgram = new AspProgramBuilder().addFact(atom("g", c("x")))
                                                 .addFact(atom("w", c("x"), c("i"), n(3)))
                                                 .addFact(atom("w", c("x"), c("j"), n(2)))
                                                 .addFact(atom("w", c("y"), c("k"), n(9)))
                                                 .addRule(atom("heavy", v("G")), body(atom("g", v("G")), lSum))
                                                 .build();

    GroundProgram lGround = Grounder.ground(lProgram);

    assertEquals("heavy(x) :- g(x), #sum{2,j:w(x,j,2);3,i:w(x,i,3)} > 4.", lGround.getStatements().get(4).toString());
  }

  @Test(expected = AggregateBoundTypeException.class)
  public void testCountBoundMustBeNumeric() throws Exception
  {
    AspAggregate lCount = AspPool.getAggregate(AspAggregateFunction.COUNT,
                                               Arrays.asList(element(terms(v("X")), atom("q", v("X")))),
                                               null,
                                               guard(">=", c("a")));
    Grounder.ground(new AspProgramBuilder().addFact(atom("q", n(1))).addRule(atom("p"), body(lCount)).build());
  }

  @Test
  public void testMaxBoundMayBeSymbolic() throws Exception
  {
    AspAggregate lMax = AspPool.getAggregate(AspAggregateFunction.MAX,
                                             Arrays.asList(element(terms(v("X")), atom("q", v("X")))),
                                             null,
                                             guard("<", c("z")));
    GroundProgram lGround = Grounder.ground(new AspProgramBuilder().addFact(atom("q", c("a")))
                                                                   .addRule(atom("p"), body(lMax))
                                                                   .build());

    assertEquals("p :- #max{a:q(a)} < z.", lGround.getStatements().get(1).toString());
  }

  @Test(expected = UndefinedArithmeticException.class)
  public void testSumWeightMustBeNumeric() throws Exception
  {
    AspAggregate lSum = AspPool.getAggregate(AspAggregateFunction.SUM,
                                             Arrays.asList(element(terms(v("X")), atom("q", v("X")))),
                                             null,
                                             guard(">=", n(1)));
    Grounder.ground(new AspProgramBuilder().addFact(atom("q", c("a"))).addRule(atom("p"), body(lSum)).build());
  }

  @Test(expected = AggregateBoundTypeException.class)
  public void testChoiceBoundMustBeNumeric() throws Exception
  {
    AspChoice lChoice = AspPool.getChoice(Arrays.asList(choiceElement(atom("p", v("X")), atom("q", v("X")))),
                                          null,
                                          guard("<=", c("two")));
    Grounder.ground(new AspProgramBuilder().addFact(atom("q", n(1))).addChoiceRule(lChoice, body()).build());
  }

  @Test
  public void testNppArityMismatch() throws Exception
  {
    AspProgram lProgram = new AspProgramBuilder().addFact(atom("img", c("i1")))
                                                 .addNppRule(AspPool.getNpp(c("digit"), terms(v("X")), terms(n(0), n(1))),
                                                             body(atom("img", v("X"))))
                                                 .addRule(atom("r"), body(atom("digit", c("i1"))))
                                                 .build();
    try
    {
      Grounder.ground(lProgram);
      fail("Expected an NPP arity mismatch");
    }
    catch (NppArityMismatchException lEx)
    {
      assertEquals(lProgram.getStatements().get(2), lEx.getStatement().get());
    }
  }

  @Test
  public void testNppOutcomesAreNotCertain() throws Exception
  {
    AspProgram lProgram = new AspProgramBuilder().addFact(atom("img", c("i1")))
                                                 .addNppRule(AspPool.getNpp(c("coin"), terms(v("X")), terms(c("h"), c("t"))),
                                                             body(atom("img", v("X"))))
                                                 .addRule(atom("heads", v("X")), body(atom("coin", v("X"), c("h"))))
                                                 .build();

    GroundProgram lGround = Grounder.ground(lProgram);

    assertEquals(Arrays.asList("img(i1).", "#npp(coin(i1),[h,t]) :- img(i1).", "heads(i1) :- coin(i1,h)."),
                 render(lGround.getStatements()));
    assertFalse(lGround.getCertainAtoms().contains(atom("heads", c("i1"))));
  }

  private static AspProgram naturals()
  {
    return new AspProgramBuilder().addFact(atom("nat", n(0)))
                                  .addRule(atom("nat", plus(v("X"), n(1))),
                                           body(atom("nat", v("X")), cmp(v("X"), "<", n(100))))
                                  .build();
  }

  @Test(expected = NonTerminationGuardException.class)
  public void testPassLimit() throws Exception
  {
    Grounder.ground(naturals(), new GroundingLimits(5, -1));
  }

  @Test
  public void testLargeTimeLimit() throws Exception
  {
    GroundProgram lGround = Grounder.ground(transitiveClosure(), new GroundingLimits(-1, Long.MAX_VALUE));

    assertEquals(9, lGround.getStatements().size());
  }

  @Test
  public void testLongRecursion() throws Exception
  {
    GroundProgram lGround = Grounder.ground(naturals(), GroundingLimits.UNLIMITED);

    assertEquals(101, lGround.getPossibleAtoms().size());
    assertTrue(lGround.getCertainAtoms().contains(atom("nat", n(100))));
    assertEquals(101, lGround.getStatements().size());
    assertEquals("nat(100) :- nat(99), 99<100.", lGround.getStatements().get(100).toString());
  }
}
