
package org.groundslash.base.util.grounder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.groundslash.base.util.asp.ArithmeticEvaluator;
import org.groundslash.base.util.asp.AspTermOrder;
import org.groundslash.base.util.asp.Substitution;
import org.groundslash.base.util.asp.grammar.AspAggregate;
import org.groundslash.base.util.asp.grammar.AspAggregateElement;
import org.groundslash.base.util.asp.grammar.AspAggregateFunction;
import org.groundslash.base.util.asp.grammar.AspGuard;
import org.groundslash.base.util.asp.grammar.AspLiteral;
import org.groundslash.base.util.asp.grammar.AspNumber;
import org.groundslash.base.util.asp.grammar.AspPool;
import org.groundslash.base.util.asp.grammar.AspStatement;
import org.groundslash.base.util.asp.grammar.AspTerm;
import org.groundslash.base.util.grounder.exceptions.AggregateBoundTypeException;
import org.groundslash.base.util.grounder.exceptions.GroundingException;
import org.groundslash.base.util.grounder.exceptions.UndefinedArithmeticException;

/**
 * Expands the elements of an aggregate under the substitution of the enclosing rule.
 *
 * Every extension of the substitution that satisfies an element's condition yields one ground element.  The result
 * carries all ground elements (sorted by term tuple, then by condition) and its reduced guards.  Whether the aggregate
 * holds is left to the consumer.
 */
final class AggregateGrounder
{
  /**
   * Canonical order of ground elements.
   */
  static final Comparator<AspAggregateElement> ELEMENT_ORDER = new Comparator<AspAggregateElement>()
  {
    @Override
    public int compare(AspAggregateElement xiLeft, AspAggregateElement xiRight)
    {
      int lResult = AspTermOrder.INSTANCE.compareLists(xiLeft.getTerms(), xiRight.getTerms());
      if (lResult == 0)
      {
        lResult = xiLeft.getCondition().toString().compareTo(xiRight.getCondition().toString());
      }
      return lResult;
    }
  };

  private final Instantiator mInstantiator;

  AggregateGrounder(Instantiator xiInstantiator)
  {
    mInstantiator = xiInstantiator;
  }

  AspAggregate ground(AspAggregate xiAggregate, Substitution xiSubst, AspStatement xiSource)
    throws GroundingException
  {
    AspAggregateFunction lFunction = xiAggregate.getFunction();
    AspGuard lLeft = groundGuard(xiAggregate.getLeftGuard().orElse(null), lFunction, xiSubst, xiSource);
    AspGuard lRight = groundGuard(xiAggregate.getRightGuard().orElse(null), lFunction, xiSubst, xiSource);

    Set<AspAggregateElement> lElements = new LinkedHashSet<>();
    for (AspAggregateElement lElement : xiAggregate.getElements())
    {
      for (Substitution lLocal : mInstantiator.enumerate(lElement.getCondition(), xiSubst))
      {
        List<AspLiteral> lCondition = mInstantiator.groundLiterals(lElement.getCondition(), lLocal, xiSource);
        if (lCondition == null)
        {
          continue;
        }
        List<AspTerm> lTerms = ArithmeticEvaluator.reduceTerms(lLocal.applyTerms(lElement.getTerms()));
        AspAggregateElement lGround = AspPool.getAggregateElement(lTerms, lCondition);
        if (lFunction == AspAggregateFunction.SUM)
        {
          AspTerm lWeight = lGround.contribution(lFunction);
          if (!(lWeight instanceof AspNumber))
          {
            throw new UndefinedArithmeticException("Non-numeric #sum weight", lWeight);
          }
        }
        lElements.add(lGround);
      }
    }

    List<AspAggregateElement> lSorted = new ArrayList<>(lElements);
    Collections.sort(lSorted, ELEMENT_ORDER);
    return AspPool.getAggregate(lFunction, lSorted, lLeft, lRight);
  }

  private static AspGuard groundGuard(AspGuard xiGuard,
                                      AspAggregateFunction xiFunction,
                                      Substitution xiSubst,
                                      AspStatement xiSource) throws GroundingException
  {
    AspGuard lGuard = ArithmeticEvaluator.reduce(xiSubst.apply(xiGuard));
    if ((lGuard != null) && xiFunction.requiresNumericBounds())
    {
      checkNumericBound(lGuard, xiSource);
    }
    return lGuard;
  }

  /**
   * @throws AggregateBoundTypeException if a ground bound isn't a number.
   */
  static void checkNumericBound(AspGuard xiGuard, AspStatement xiSource) throws AggregateBoundTypeException
  {
    AspTerm lBound = xiGuard.getBound();
    if (lBound.isGround() && !(lBound instanceof AspNumber))
    {
      throw new AggregateBoundTypeException(lBound, xiSource);
    }
  }
}
