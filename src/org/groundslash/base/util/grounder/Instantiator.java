
package org.groundslash.base.util.grounder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.groundslash.base.util.asp.ArithmeticEvaluator;
import org.groundslash.base.util.asp.AspMatcher;
import org.groundslash.base.util.asp.AspTermOrder;
import org.groundslash.base.util.asp.Substitution;
import org.groundslash.base.util.asp.grammar.AspAggregate;
import org.groundslash.base.util.asp.grammar.AspAtom;
import org.groundslash.base.util.asp.grammar.AspChoice;
import org.groundslash.base.util.asp.grammar.AspComparison;
import org.groundslash.base.util.asp.grammar.AspDisjunction;
import org.groundslash.base.util.asp.grammar.AspHead;
import org.groundslash.base.util.asp.grammar.AspLiteral;
import org.groundslash.base.util.asp.grammar.AspNot;
import org.groundslash.base.util.asp.grammar.AspNpp;
import org.groundslash.base.util.asp.grammar.AspNumber;
import org.groundslash.base.util.asp.grammar.AspPool;
import org.groundslash.base.util.asp.grammar.AspRule;
import org.groundslash.base.util.asp.grammar.AspStatement;
import org.groundslash.base.util.asp.grammar.AspTerm;
import org.groundslash.base.util.asp.grammar.AspWeakConstraint;
import org.groundslash.base.util.grounder.exceptions.GroundingException;
import org.groundslash.base.util.grounder.exceptions.UndefinedArithmeticException;

/**
 * Instantiates statements against the atoms of a {@link GroundingContext}.
 *
 * Substitutions are enumerated by joining the positive body atoms, left to right, against the possible atoms.
 * Builtin comparisons prune the join as soon as they become ground.  Each complete substitution is then applied to
 * the whole statement, with all arithmetic reduced:
 *
 * <ul>
 * <li>comparisons that fail drop the instance (those that hold are kept in the ground body);</li>
 * <li>a default-negated atom that is certain drops the instance, otherwise the literal is kept for the consumer;</li>
 * <li>aggregates, choice heads and NPP heads are expanded by their own grounders.</li>
 * </ul>
 *
 * The instantiator never changes the atom sets - deriving head atoms is up to the caller.
 */
public final class Instantiator
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final GroundingContext  mContext;
  private final AggregateGrounder mAggregateGrounder;
  private final ChoiceGrounder    mChoiceGrounder;
  private final NppGrounder       mNppGrounder;

  public Instantiator(GroundingContext xiContext)
  {
    mContext = xiContext;
    mAggregateGrounder = new AggregateGrounder(this);
    mChoiceGrounder = new ChoiceGrounder(this);
    mNppGrounder = new NppGrounder();
  }

  GroundingContext getContext()
  {
    return mContext;
  }

  /**
   * @return all ground instances of a (safe) statement that the current atom sets support, in enumeration order and
   *         without duplicates.
   *
   * @throws GroundingException if the statement can't be grounded.
   */
  public List<AspStatement> instantiate(AspStatement xiStatement) throws GroundingException
  {
    try
    {
      Set<AspStatement> lInstances = new LinkedHashSet<>();
      for (Substitution lSubst : enumerate(xiStatement.getBody(), Substitution.EMPTY))
      {
        List<AspLiteral> lBody = groundLiterals(xiStatement.getBody(), lSubst, xiStatement);
        if (lBody == null)
        {
          continue;
        }

        if (xiStatement instanceof AspRule)
        {
          AspHead lHead = groundHead(((AspRule)xiStatement).getHead(), lSubst, xiStatement);
          lInstances.add(AspPool.getRule(lHead, lBody));
        }
        else if (xiStatement instanceof AspWeakConstraint)
        {
          AspWeakConstraint lConstraint = (AspWeakConstraint)xiStatement;
          lInstances.add(AspPool.getWeakConstraint(lBody,
                                                   numeric(lConstraint.getWeight(), lSubst, "weight"),
                                                   numeric(lConstraint.getLevel(), lSubst, "level"),
                                                   ArithmeticEvaluator.reduceTerms(
                                                                 lSubst.applyTerms(lConstraint.getTerms()))));
        }
        else
        {
          throw new RuntimeException("Unwanted AspStatement type");
        }
      }

      LOGGER.trace(lInstances.size() + " instance(s) of " + xiStatement);
      return new ArrayList<>(lInstances);
    }
    catch (UndefinedArithmeticException lEx)
    {
      throw lEx.inStatement(xiStatement);
    }
  }

  private AspHead groundHead(AspHead xiHead, Substitution xiSubst, AspStatement xiSource) throws GroundingException
  {
    if (xiHead instanceof AspDisjunction)
    {
      List<AspAtom> lAtoms = new ArrayList<>();
      for (AspAtom lAtom : xiHead.getAtoms())
      {
        lAtoms.add(ArithmeticEvaluator.reduce(xiSubst.apply(lAtom)));
      }
      return AspPool.getDisjunction(lAtoms);
    }
    else if (xiHead instanceof AspChoice)
    {
      return mChoiceGrounder.ground((AspChoice)xiHead, xiSubst, xiSource);
    }
    else if (xiHead instanceof AspNpp)
    {
      return mNppGrounder.ground((AspNpp)xiHead, xiSubst);
    }
    throw new RuntimeException("Unwanted AspHead type");
  }

  private static AspTerm numeric(AspTerm xiTerm, Substitution xiSubst, String xiRole)
    throws UndefinedArithmeticException
  {
    AspTerm lReduced = ArithmeticEvaluator.reduce(xiSubst.apply(xiTerm));
    if (!(lReduced instanceof AspNumber))
    {
      throw new UndefinedArithmeticException("Non-numeric " + xiRole, lReduced);
    }
    return lReduced;
  }

  //---------------------------------------------------------------------------------------------------------------
  // Joining
  //---------------------------------------------------------------------------------------------------------------

  /**
   * @return every extension of the given substitution under which all positive atoms among the literals are possible
   *         and all comparisons among them hold.  Default negation and aggregates are ignored here.
   *
   * @param xiLiterals - a rule body or an element condition.
   * @param xiInitial  - bindings already made (e.g. by the enclosing rule body).
   */
  List<Substitution> enumerate(List<AspLiteral> xiLiterals, Substitution xiInitial) throws UndefinedArithmeticException
  {
    List<AspAtom> lPositive = new ArrayList<>();
    List<AspComparison> lComparisons = new ArrayList<>();
    for (AspLiteral lLiteral : xiLiterals)
    {
      if (lLiteral instanceof AspAtom)
      {
        lPositive.add((AspAtom)lLiteral);
      }
      else if (lLiteral instanceof AspComparison)
      {
        lComparisons.add((AspComparison)lLiteral);
      }
    }

    List<Substitution> lPartial = filter(Collections.singletonList(xiInitial), lComparisons);
    for (AspAtom lAtom : lPositive)
    {
      if (lPartial.isEmpty())
      {
        break;
      }

      Set<Substitution> lNext = new LinkedHashSet<>();
      for (Substitution lSubst : lPartial)
      {
        AspAtom lPattern = lSubst.apply(lAtom);
        if (lPattern.isGround())
        {
          if (mContext.isPossible(ArithmeticEvaluator.reduce(lPattern)))
          {
            lNext.add(lSubst);
          }
          continue;
        }

        for (AspAtom lCandidate : mContext.getPossible(lAtom.getSignature()))
        {
          Substitution lMatch = AspMatcher.match(lPattern, lCandidate, lSubst);
          if (lMatch != null)
          {
            lNext.add(lMatch);
          }
        }
      }
      lPartial = filter(new ArrayList<>(lNext), lComparisons);
    }

    // Arithmetic positions may have been accepted before their variables were bound.  Check them now.
    List<Substitution> lResult = new ArrayList<>(lPartial.size());
    for (Substitution lSubst : lPartial)
    {
      if (verify(lSubst, lPositive))
      {
        lResult.add(lSubst);
      }
    }
    return lResult;
  }

  private List<Substitution> filter(List<Substitution> xiPartial, List<AspComparison> xiComparisons)
    throws UndefinedArithmeticException
  {
    if (xiComparisons.isEmpty())
    {
      return xiPartial;
    }

    List<Substitution> lResult = new ArrayList<>(xiPartial.size());
    for (Substitution lSubst : xiPartial)
    {
      boolean lPass = true;
      for (AspComparison lComparison : xiComparisons)
      {
        AspComparison lApplied = (AspComparison)lSubst.apply(lComparison);
        if (lApplied.isGround() && !holds(lApplied))
        {
          lPass = false;
          break;
        }
      }
      if (lPass)
      {
        lResult.add(lSubst);
      }
    }
    return lResult;
  }

  private boolean verify(Substitution xiSubst, List<AspAtom> xiPositive) throws UndefinedArithmeticException
  {
    for (AspAtom lAtom : xiPositive)
    {
      AspAtom lGround = xiSubst.apply(lAtom);
      if (!lGround.isGround() || !mContext.isPossible(ArithmeticEvaluator.reduce(lGround)))
      {
        return false;
      }
    }
    return true;
  }

  /**
   * @return whether a ground comparison holds under the total order over ground terms.
   */
  static boolean holds(AspComparison xiComparison) throws UndefinedArithmeticException
  {
    AspComparison lReduced = ArithmeticEvaluator.reduce(xiComparison);
    int lOrder = AspTermOrder.INSTANCE.compare(lReduced.getLeft(), lReduced.getRight());
    return lReduced.getOperator().holds(lOrder);
  }

  //---------------------------------------------------------------------------------------------------------------
  // Literal instantiation
  //---------------------------------------------------------------------------------------------------------------

  /**
   * @return the literals with the substitution applied and arithmetic reduced, or null if the instance is to be
   *         dropped (a comparison fails, or a default-negated atom is certain).
   */
  List<AspLiteral> groundLiterals(List<AspLiteral> xiLiterals, Substitution xiSubst, AspStatement xiSource)
    throws GroundingException
  {
    List<AspLiteral> lResult = new ArrayList<>(xiLiterals.size());
    for (AspLiteral lLiteral : xiLiterals)
    {
      if (lLiteral instanceof AspAtom)
      {
        lResult.add(ArithmeticEvaluator.reduce(xiSubst.apply((AspAtom)lLiteral)));
      }
      else if (lLiteral instanceof AspComparison)
      {
        AspComparison lComparison = ArithmeticEvaluator.reduce((AspComparison)xiSubst.apply(lLiteral));
        if (!holds(lComparison))
        {
          return null;
        }
        lResult.add(lComparison);
      }
      else if (lLiteral instanceof AspNot)
      {
        AspLiteral lInner = ((AspNot)lLiteral).getBody();
        if (lInner instanceof AspAtom)
        {
          AspAtom lAtom = ArithmeticEvaluator.reduce(xiSubst.apply((AspAtom)lInner));
          if (mContext.simplifyCertainNegation() && mContext.isCertain(lAtom))
          {
            return null;
          }
          lResult.add(AspPool.getNot(lAtom));
        }
        else if (lInner instanceof AspAggregate)
        {
          lResult.add(AspPool.getNot(mAggregateGrounder.ground((AspAggregate)lInner, xiSubst, xiSource)));
        }
        else
        {
          throw new RuntimeException("Unwanted AspLiteral type");
        }
      }
      else if (lLiteral instanceof AspAggregate)
      {
        lResult.add(mAggregateGrounder.ground((AspAggregate)lLiteral, xiSubst, xiSource));
      }
      else
      {
        throw new RuntimeException("Unwanted AspLiteral type");
      }
    }
    return lResult;
  }

  //---------------------------------------------------------------------------------------------------------------
  // Certainty
  //---------------------------------------------------------------------------------------------------------------

  /**
   * @return whether the body of a ground statement certainly holds: every positive atom is certain, every
   *         default-negated atom belongs to a completed predicate and is impossible, and there are no aggregates.
   */
  public boolean isBodyCertain(List<AspLiteral> xiGroundBody)
  {
    for (AspLiteral lLiteral : xiGroundBody)
    {
      if (lLiteral instanceof AspAtom)
      {
        if (!mContext.isCertain((AspAtom)lLiteral))
        {
          return false;
        }
      }
      else if (lLiteral instanceof AspNot)
      {
        AspLiteral lInner = ((AspNot)lLiteral).getBody();
        if (!(lInner instanceof AspAtom) ||
            !mContext.isCompleted(((AspAtom)lInner).getSignature()) ||
            mContext.isPossible((AspAtom)lInner))
        {
          return false;
        }
      }
      else if (lLiteral instanceof AspAggregate)
      {
        return false;
      }
    }
    return true;
  }

  /**
   * @return the atom a ground rule certainly derives, or null if it derives none for certain.
   */
  public AspAtom getCertainHead(AspRule xiGroundRule)
  {
    AspHead lHead = xiGroundRule.getHead();
    if ((lHead instanceof AspDisjunction) &&
        (lHead.getAtoms().size() == 1) &&
        isBodyCertain(xiGroundRule.getBody()))
    {
      return lHead.getAtoms().get(0);
    }
    return null;
  }
}
