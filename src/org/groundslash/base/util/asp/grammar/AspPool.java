
package org.groundslash.base.util.asp.grammar;

import java.util.Collections;
import java.util.List;

import com.google.common.collect.Interner;
import com.google.common.collect.Interners;

/**
 * The AspPool is the single source of ASP objects.  Structurally equal objects obtained from the pool are identical,
 * which keeps the (very large) sets of ground atoms built during grounding compact.
 *
 * The pool holds its objects weakly, so objects that are no longer referenced anywhere else are reclaimed.
 */
public final class AspPool
{
  private static final Interner<Asp> POOL = Interners.newWeakInterner();

  private static final AspAnonymousVariable ANONYMOUS = intern(new AspAnonymousVariable());

  private AspPool()
  {
    // Static access only.
  }

  @SuppressWarnings("unchecked")
  private static <T extends Asp> T intern(T xiAsp)
  {
    return (T)POOL.intern(xiAsp);
  }

  /**
   * Swap an object (typically one that has just been deserialized) for the pooled version of itself.
   */
  public static Asp immerse(Asp xiAsp)
  {
    return POOL.intern(xiAsp);
  }

  //---------------------------------------------------------------------------------------------------------------
  // Terms
  //---------------------------------------------------------------------------------------------------------------

  public static AspConstant getConstant(String xiValue)
  {
    return intern(new AspConstant(xiValue));
  }

  public static AspNumber getNumber(long xiValue)
  {
    return intern(new AspNumber(xiValue));
  }

  public static AspString getString(String xiValue)
  {
    return intern(new AspString(xiValue));
  }

  public static AspVariable getVariable(String xiName)
  {
    return intern(new AspVariable(xiName));
  }

  public static AspAnonymousVariable getAnonymousVariable()
  {
    return ANONYMOUS;
  }

  public static AspFunction getFunction(AspConstant xiName, List<AspTerm> xiBody)
  {
    return intern(new AspFunction(xiName, xiBody));
  }

  public static AspArithmetic getArithmetic(AspArithmeticOperator xiOperator, List<AspTerm> xiOperands)
  {
    return intern(new AspArithmetic(xiOperator, xiOperands));
  }

  //---------------------------------------------------------------------------------------------------------------
  // Literals
  //---------------------------------------------------------------------------------------------------------------

  public static AspAtom getAtom(AspConstant xiName)
  {
    return getAtom(xiName, Collections.<AspTerm>emptyList(), false);
  }

  public static AspAtom getAtom(AspConstant xiName, List<AspTerm> xiBody)
  {
    return getAtom(xiName, xiBody, false);
  }

  public static AspAtom getAtom(AspConstant xiName, List<AspTerm> xiBody, boolean xiNegated)
  {
    return intern(new AspAtom(xiName, xiBody, xiNegated));
  }

  public static AspNot getNot(AspLiteral xiBody)
  {
    return intern(new AspNot(xiBody));
  }

  public static AspComparison getComparison(AspRelationalOperator xiOperator, AspTerm xiLeft, AspTerm xiRight)
  {
    return intern(new AspComparison(xiOperator, xiLeft, xiRight));
  }

  public static AspGuard getGuard(AspRelationalOperator xiOperator, AspTerm xiBound)
  {
    return intern(new AspGuard(xiOperator, xiBound));
  }

  public static AspAggregateElement getAggregateElement(List<AspTerm> xiTerms, List<AspLiteral> xiCondition)
  {
    return intern(new AspAggregateElement(xiTerms, xiCondition));
  }

  /**
   * @param xiLeftGuard  - the left guard, or null for none.
   * @param xiRightGuard - the right guard, or null for none.
   */
  public static AspAggregate getAggregate(AspAggregateFunction xiFunction,
                                          List<AspAggregateElement> xiElements,
                                          AspGuard xiLeftGuard,
                                          AspGuard xiRightGuard)
  {
    return intern(new AspAggregate(xiFunction, xiElements, xiLeftGuard, xiRightGuard));
  }

  //---------------------------------------------------------------------------------------------------------------
  // Heads
  //---------------------------------------------------------------------------------------------------------------

  public static AspDisjunction getDisjunction(List<AspAtom> xiAtoms)
  {
    return intern(new AspDisjunction(xiAtoms));
  }

  public static AspChoiceElement getChoiceElement(AspAtom xiAtom, List<AspLiteral> xiCondition)
  {
    return intern(new AspChoiceElement(xiAtom, xiCondition));
  }

  public static AspChoice getChoice(List<AspChoiceElement> xiElements, AspGuard xiLeftGuard, AspGuard xiRightGuard)
  {
    return intern(new AspChoice(xiElements, xiLeftGuard, xiRightGuard));
  }

  public static AspNpp getNpp(AspConstant xiName, List<AspTerm> xiInputs, List<AspTerm> xiOutcomes)
  {
    return intern(new AspNpp(xiName, xiInputs, xiOutcomes));
  }

  //---------------------------------------------------------------------------------------------------------------
  // Statements
  //---------------------------------------------------------------------------------------------------------------

  public static AspRule getRule(AspHead xiHead, List<AspLiteral> xiBody)
  {
    return intern(new AspRule(xiHead, xiBody));
  }

  public static AspRule getFact(AspAtom xiAtom)
  {
    return getRule(getDisjunction(Collections.singletonList(xiAtom)), Collections.<AspLiteral>emptyList());
  }

  public static AspRule getConstraint(List<AspLiteral> xiBody)
  {
    return getRule(getDisjunction(Collections.<AspAtom>emptyList()), xiBody);
  }

  public static AspWeakConstraint getWeakConstraint(List<AspLiteral> xiBody,
                                                    AspTerm xiWeight,
                                                    AspTerm xiLevel,
                                                    List<AspTerm> xiTerms)
  {
    return intern(new AspWeakConstraint(xiBody, xiWeight, xiLevel, xiTerms));
  }
}
