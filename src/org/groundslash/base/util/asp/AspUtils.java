
package org.groundslash.base.util.asp;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

import org.groundslash.base.util.asp.grammar.Asp;
import org.groundslash.base.util.asp.grammar.AspAggregate;
import org.groundslash.base.util.asp.grammar.AspAggregateElement;
import org.groundslash.base.util.asp.grammar.AspAnonymousVariable;
import org.groundslash.base.util.asp.grammar.AspArithmetic;
import org.groundslash.base.util.asp.grammar.AspAtom;
import org.groundslash.base.util.asp.grammar.AspChoice;
import org.groundslash.base.util.asp.grammar.AspChoiceElement;
import org.groundslash.base.util.asp.grammar.AspComparison;
import org.groundslash.base.util.asp.grammar.AspDisjunction;
import org.groundslash.base.util.asp.grammar.AspFunction;
import org.groundslash.base.util.asp.grammar.AspGuard;
import org.groundslash.base.util.asp.grammar.AspLiteral;
import org.groundslash.base.util.asp.grammar.AspNot;
import org.groundslash.base.util.asp.grammar.AspNpp;
import org.groundslash.base.util.asp.grammar.AspPool;
import org.groundslash.base.util.asp.grammar.AspRule;
import org.groundslash.base.util.asp.grammar.AspTerm;
import org.groundslash.base.util.asp.grammar.AspVariable;
import org.groundslash.base.util.asp.grammar.AspWeakConstraint;

public class AspUtils
{
  private AspUtils()
  {
  }

  /**
   * @return every variable in the given object, in order of first appearance.
   */
  public static Set<AspVariable> getVariables(Asp asp)
  {
    Set<AspTerm> leaves = new LinkedHashSet<>();
    collectVariables(asp, leaves);
    return namedOnly(leaves);
  }

  public static Set<AspVariable> getVariables(Collection<? extends Asp> asps)
  {
    Set<AspTerm> leaves = new LinkedHashSet<>();
    collectAll(asps, leaves);
    return namedOnly(leaves);
  }

  /**
   * @return whether the anonymous variable occurs anywhere in the given object.
   */
  public static boolean hasAnonymousVariable(Asp asp)
  {
    Set<AspTerm> leaves = new LinkedHashSet<>();
    collectVariables(asp, leaves);
    return leaves.contains(AspPool.getAnonymousVariable());
  }

  private static Set<AspVariable> namedOnly(Set<AspTerm> leaves)
  {
    Set<AspVariable> variables = new LinkedHashSet<>();
    for (AspTerm leaf : leaves)
    {
      if (leaf instanceof AspVariable)
      {
        variables.add((AspVariable)leaf);
      }
    }
    return variables;
  }

  /**
   * @return the variables that a positive atom binds - those outside arithmetic terms.
   */
  public static Set<AspVariable> getBindingVariables(AspAtom atom)
  {
    Set<AspVariable> variables = new LinkedHashSet<>();
    for (AspTerm term : atom.getBody())
    {
      collectBindingVariables(term, variables);
    }
    return variables;
  }

  /**
   * @return the variables bound by the positive atoms among the given literals.
   */
  public static Set<AspVariable> getBindingVariables(Collection<AspLiteral> literals)
  {
    Set<AspVariable> variables = new LinkedHashSet<>();
    for (AspLiteral literal : literals)
    {
      if (literal instanceof AspAtom)
      {
        variables.addAll(getBindingVariables((AspAtom)literal));
      }
    }
    return variables;
  }

  private static void collectBindingVariables(AspTerm term, Set<AspVariable> variables)
  {
    if (term instanceof AspVariable)
    {
      variables.add((AspVariable)term);
    }
    else if (term instanceof AspFunction)
    {
      for (AspTerm argument : ((AspFunction)term).getBody())
      {
        collectBindingVariables(argument, variables);
      }
    }
  }

  private static void collectVariables(Asp asp, Set<AspTerm> variables)
  {
    if ((asp == null) || asp.isGround())
    {
      return;
    }

    if ((asp instanceof AspVariable) || (asp instanceof AspAnonymousVariable))
    {
      variables.add((AspTerm)asp);
    }
    else if (asp instanceof AspFunction)
    {
      collectAll(((AspFunction)asp).getBody(), variables);
    }
    else if (asp instanceof AspArithmetic)
    {
      collectAll(((AspArithmetic)asp).getOperands(), variables);
    }
    else if (asp instanceof AspAtom)
    {
      collectAll(((AspAtom)asp).getBody(), variables);
    }
    else if (asp instanceof AspNot)
    {
      collectVariables(((AspNot)asp).getBody(), variables);
    }
    else if (asp instanceof AspComparison)
    {
      collectVariables(((AspComparison)asp).getLeft(), variables);
      collectVariables(((AspComparison)asp).getRight(), variables);
    }
    else if (asp instanceof AspAggregate)
    {
      AspAggregate aggregate = (AspAggregate)asp;
      collectVariables(aggregate.getLeftGuard().orElse(null), variables);
      collectAll(aggregate.getElements(), variables);
      collectVariables(aggregate.getRightGuard().orElse(null), variables);
    }
    else if (asp instanceof AspAggregateElement)
    {
      collectAll(((AspAggregateElement)asp).getTerms(), variables);
      collectAll(((AspAggregateElement)asp).getCondition(), variables);
    }
    else if (asp instanceof AspGuard)
    {
      collectVariables(((AspGuard)asp).getBound(), variables);
    }
    else if (asp instanceof AspDisjunction)
    {
      collectAll(((AspDisjunction)asp).getAtoms(), variables);
    }
    else if (asp instanceof AspChoice)
    {
      AspChoice choice = (AspChoice)asp;
      collectVariables(choice.getLeftGuard().orElse(null), variables);
      collectAll(choice.getElements(), variables);
      collectVariables(choice.getRightGuard().orElse(null), variables);
    }
    else if (asp instanceof AspChoiceElement)
    {
      collectVariables(((AspChoiceElement)asp).getAtom(), variables);
      collectAll(((AspChoiceElement)asp).getCondition(), variables);
    }
    else if (asp instanceof AspNpp)
    {
      collectAll(((AspNpp)asp).getInputs(), variables);
      collectAll(((AspNpp)asp).getOutcomes(), variables);
    }
    else if (asp instanceof AspRule)
    {
      collectVariables(((AspRule)asp).getHead(), variables);
      collectAll(((AspRule)asp).getBody(), variables);
    }
    else if (asp instanceof AspWeakConstraint)
    {
      AspWeakConstraint constraint = (AspWeakConstraint)asp;
      collectAll(constraint.getBody(), variables);
      collectVariables(constraint.getWeight(), variables);
      collectVariables(constraint.getLevel(), variables);
      collectAll(constraint.getTerms(), variables);
    }
    else if (!(asp instanceof AspTerm))
    {
      throw new RuntimeException("Unwanted Asp type");
    }
  }

  private static void collectAll(Collection<? extends Asp> asps, Set<AspTerm> variables)
  {
    for (Asp asp : asps)
    {
      collectVariables(asp, variables);
    }
  }
}
