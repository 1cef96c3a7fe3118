package org.groundslash.base.util.grounder;

import static org.groundslash.base.test.AspFixtures.atom;
import static org.groundslash.base.test.AspFixtures.body;
import static org.groundslash.base.test.AspFixtures.choiceElement;
import static org.groundslash.base.test.AspFixtures.element;
import static org.groundslash.base.test.AspFixtures.guard;
import static org.groundslash.base.test.AspFixtures.n;
import static org.groundslash.base.test.AspFixtures.not;
import static org.groundslash.base.test.AspFixtures.terms;
import static org.groundslash.base.test.AspFixtures.v;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.groundslash.base.util.asp.grammar.AspAggregate;
import org.groundslash.base.util.asp.grammar.AspAggregateFunction;
import org.groundslash.base.util.asp.grammar.AspPool;
import org.groundslash.base.util.asp.grammar.AspSignature;
import org.groundslash.base.util.asp.grammar.AspStatement;
import org.groundslash.base.util.asp.transforms.AspProgramBuilder;
import org.junit.Test;

import com.google.common.collect.ImmutableSet;

public class DependencyStratifierTests
{
  private static AspSignature sig(String xiName)
  {
    return atom(xiName).getSignature();
  }

  @Test
  public void testChainIsOrderedBottomUp() throws Exception
  {
    List<AspStatement> lStatements = new AspProgramBuilder().addRule(atom("a"), body(atom("b")))
                                                            .addRule(atom("b"), body(atom("c")))
                                                            .addFact(atom("c"))
                                                            .build()
                                                            .getStatements();

    Stratification lStratification = DependencyStratifier.stratify(lStatements);

    List<Stratification.Component> lComponents = lStratification.getComponents();
    assertEquals(3, lComponents.size());
    assertEquals(ImmutableSet.of(sig("c")), lComponents.get(0).getSignatures());
    assertEquals(ImmutableSet.of(sig("b")), lComponents.get(1).getSignatures());
    assertEquals(ImmutableSet.of(sig("a")), lComponents.get(2).getSignatures());
    assertEquals(Arrays.asList(2), lComponents.get(0).getStatements());
    assertFalse(lComponents.get(2).isRecursive());
    assertTrue(lStratification.isStratified());
    assertTrue(lStratification.getHeadless().isEmpty());
  }

  @Test
  public void testMutualRecursionFormsOneComponent() throws Exception
  {
    List<AspStatement> lStatements = new AspProgramBuilder().addRule(atom("p"), body(atom("q")))
                                                            .addRule(atom("q"), body(atom("p")))
                                                            .addRule(atom("q"), body(atom("r")))
                                                            .addFact(atom("r"))
                                                            .build()
                                                            .getStatements();

    List<Stratification.Component> lComponents = DependencyStratifier.stratify(lStatements).getComponents();

    assertEquals(2, lComponents.size());
    assertEquals(ImmutableSet.of(sig("r")), lComponents.get(0).getSignatures());
    assertEquals(ImmutableSet.of(sig("p"), sig("q")), lComponents.get(1).getSignatures());
    assertEquals(Arrays.asList(0, 1, 2), lComponents.get(1).getStatements());
    assertTrue(lComponents.get(1).isRecursive());
    assertTrue(lComponents.get(1).isStratified());
  }

  @Test
  public void testSelfRecursion() throws Exception
  {
    List<AspStatement> lStatements = new AspProgramBuilder().addFact(atom("n", n(0)))
                                                            .addRule(atom("n", v("X")), body(atom("n", v("X"))))
                                                            .build()
                                                            .getStatements();

    Stratification.Component lComponent = DependencyStratifier.stratify(lStatements).getComponents().get(0);
    assertTrue(lComponent.isRecursive());
    assertEquals(Arrays.asList(0, 1), lComponent.getStatements());
  }

  @Test
  public void testNegativeCycleIsUnstratified() throws Exception
  {
    List<AspStatement> lStatements = new AspProgramBuilder().addRule(atom("a"), body(not(atom("b"))))
                                                            .addRule(atom("b"), body(not(atom("a"))))
                                                            .build()
                                                            .getStatements();

    Stratification lStratification = DependencyStratifier.stratify(lStatements);

    assertEquals(1, lStratification.getComponents().size());
    assertFalse(lStratification.getComponents().get(0).isStratified());
    assertFalse(lStratification.isStratified());
  }

  @Test
  public void testHeadlessAndUndefined() throws Exception
  {
    List<AspStatement> lStatements = new AspProgramBuilder().addFact(atom("p"))
                                                            .addConstraint(body(atom("p"), not(atom("q"))))
                                                            .addWeakConstraint(body(atom("p")), n(1), n(0), terms())
                                                            .addRule(atom("s"), body(not(atom("t"))))
                                                            .build()
                                                            .getStatements();

    Stratification lStratification = DependencyStratifier.stratify(lStatements);

    assertEquals(Arrays.asList(1, 2), lStratification.getHeadless());
    assertEquals(ImmutableSet.of(sig("q"), sig("t")), lStratification.getUndefined());
    assertEquals(2, lStratification.getComponents().size());
  }

  @Test
  public void testConditionsAreDependencies() throws Exception
  {
    AspAggregate lCount = AspPool.getAggregate(AspAggregateFunction.COUNT,
                                               Arrays.asList(element(terms(v("X")), atom("w", v("X")))),
                                               null,
                                               guard(">", n(0)));
    List<AspStatement> lStatements =
      new AspProgramBuilder().addChoiceRule(AspPool.getChoice(Arrays.asList(choiceElement(atom("p", v("X")),
                                                                                          atom("q", v("X")))),
                                                              null,
                                                              null),
                                            body())
                             .addRule(atom("r"), body(lCount))
                             .addFact(atom("q", n(1)))
                             .addFact(atom("w", n(1)))
                             .build()
                             .getStatements();

    List<Stratification.Component> lComponents = DependencyStratifier.stratify(lStatements).getComponents();

    assertEquals(4, lComponents.size());
    assertEquals(ImmutableSet.of(atom("q", v("X")).getSignature()), lComponents.get(0).getSignatures());
    assertEquals(ImmutableSet.of(atom("p", v("X")).getSignature()), lComponents.get(1).getSignatures());
    assertEquals(ImmutableSet.of(atom("w", v("X")).getSignature()), lComponents.get(2).getSignatures());
    assertEquals(ImmutableSet.of(sig("r")), lComponents.get(3).getSignatures());
  }

  @Test
  public void testDisjunctiveHeadsShareAComponent() throws Exception
  {
    List<AspStatement> lStatements = new AspProgramBuilder().addDisjunctiveRule(Arrays.asList(atom("a"), atom("b")),
                                                                                body())
                                                            .build()
                                                            .getStatements();

    List<Stratification.Component> lComponents = DependencyStratifier.stratify(lStatements).getComponents();
    assertEquals(1, lComponents.size());
    assertEquals(ImmutableSet.of(sig("a"), sig("b")), lComponents.get(0).getSignatures());
  }
}
