
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
import org.groundslash.base.util.asp.grammar.AspAtom;
import org.groundslash.base.util.asp.grammar.AspChoice;
import org.groundslash.base.util.asp.grammar.AspChoiceElement;
import org.groundslash.base.util.asp.grammar.AspGuard;
import org.groundslash.base.util.asp.grammar.AspLiteral;
import org.groundslash.base.util.asp.grammar.AspPool;
import org.groundslash.base.util.asp.grammar.AspStatement;
import org.groundslash.base.util.grounder.exceptions.GroundingException;

/**
 * Expands the elements of a choice head under the substitution of the enclosing rule.  Ground elements are sorted by
 * atom, then by condition.  Bounds must be numbers.
 */
final class ChoiceGrounder
{
  static final Comparator<AspChoiceElement> ELEMENT_ORDER = new Comparator<AspChoiceElement>()
  {
    @Override
    public int compare(AspChoiceElement xiLeft, AspChoiceElement xiRight)
    {
      AspAtom lLeft = xiLeft.getAtom();
      AspAtom lRight = xiRight.getAtom();
      int lResult = lLeft.getSignature().compareTo(lRight.getSignature());
      if (lResult == 0)
      {
        lResult = AspTermOrder.INSTANCE.compareLists(lLeft.getBody(), lRight.getBody());
      }
      if (lResult == 0)
      {
        lResult = xiLeft.getCondition().toString().compareTo(xiRight.getCondition().toString());
      }
      return lResult;
    }
  };

  private final Instantiator mInstantiator;

  ChoiceGrounder(Instantiator xiInstantiator)
  {
    mInstantiator = xiInstantiator;
  }

  AspChoice ground(AspChoice xiChoice, Substitution xiSubst, AspStatement xiSource) throws GroundingException
  {
    AspGuard lLeft = ArithmeticEvaluator.reduce(xiSubst.apply(xiChoice.getLeftGuard().orElse(null)));
    AspGuard lRight = ArithmeticEvaluator.reduce(xiSubst.apply(xiChoice.getRightGuard().orElse(null)));
    if (lLeft != null)
    {
      AggregateGrounder.checkNumericBound(lLeft, xiSource);
    }
    if (lRight != null)
    {
      AggregateGrounder.checkNumericBound(lRight, xiSource);
    }

    Set<AspChoiceElement> lElements = new LinkedHashSet<>();
    for (AspChoiceElement lElement : xiChoice.getElements())
    {
      for (Substitution lLocal : mInstantiator.enumerate(lElement.getCondition(), xiSubst))
      {
        List<AspLiteral> lCondition = mInstantiator.groundLiterals(lElement.getCondition(), lLocal, xiSource);
        if (lCondition != null)
        {
          AspAtom lAtom = ArithmeticEvaluator.reduce(lLocal.apply(lElement.getAtom()));
          lElements.add(AspPool.getChoiceElement(lAtom, lCondition));
        }
      }
    }

    List<AspChoiceElement> lSorted = new ArrayList<>(lElements);
    Collections.sort(lSorted, ELEMENT_ORDER);
    return AspPool.getChoice(lSorted, lLeft, lRight);
  }
}
