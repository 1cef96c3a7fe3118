
package org.groundslash.base.util.asp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.groundslash.base.util.asp.grammar.AspAggregate;
import org.groundslash.base.util.asp.grammar.AspAggregateElement;
import org.groundslash.base.util.asp.grammar.AspAnonymousVariable;
import org.groundslash.base.util.asp.grammar.AspArithmetic;
import org.groundslash.base.util.asp.grammar.AspAtom;
import org.groundslash.base.util.asp.grammar.AspChoice;
import org.groundslash.base.util.asp.grammar.AspChoiceElement;
import org.groundslash.base.util.asp.grammar.AspComparison;
import org.groundslash.base.util.asp.grammar.AspConstant;
import org.groundslash.base.util.asp.grammar.AspDisjunction;
import org.groundslash.base.util.asp.grammar.AspFunction;
import org.groundslash.base.util.asp.grammar.AspGuard;
import org.groundslash.base.util.asp.grammar.AspHead;
import org.groundslash.base.util.asp.grammar.AspLiteral;
import org.groundslash.base.util.asp.grammar.AspNot;
import org.groundslash.base.util.asp.grammar.AspNpp;
import org.groundslash.base.util.asp.grammar.AspNumber;
import org.groundslash.base.util.asp.grammar.AspPool;
import org.groundslash.base.util.asp.grammar.AspRule;
import org.groundslash.base.util.asp.grammar.AspStatement;
import org.groundslash.base.util.asp.grammar.AspString;
import org.groundslash.base.util.asp.grammar.AspTerm;
import org.groundslash.base.util.asp.grammar.AspVariable;
import org.groundslash.base.util.asp.grammar.AspWeakConstraint;

/**
 * An immutable, finite mapping from variables to ground terms.
 *
 * Because every value is ground, a substitution is trivially idempotent and acyclic: applying it twice is the same
 * as applying it once.  Iteration order is the order in which variables were bound.
 */
public final class Substitution
{
  public static final Substitution EMPTY = new Substitution(Collections.<AspVariable, AspTerm>emptyMap());

  private final Map<AspVariable, AspTerm> map;

  private Substitution(Map<AspVariable, AspTerm> map)
  {
    this.map = map;
  }

  public AspTerm get(AspVariable variable)
  {
    return map.get(variable);
  }

  public boolean contains(AspVariable variable)
  {
    return map.containsKey(variable);
  }

  public Map<AspVariable, AspTerm> asMap()
  {
    return Collections.unmodifiableMap(map);
  }

  public int size()
  {
    return map.size();
  }

  public boolean isEmpty()
  {
    return map.isEmpty();
  }

  /**
   * @return a substitution that also maps the given variable to the given term.
   *
   * @param variable - the variable, which must not already be bound to a different term.
   * @param term     - a ground term.
   */
  public Substitution extend(AspVariable variable, AspTerm term)
  {
    if (!term.isGround())
    {
      throw new IllegalArgumentException("Cannot bind " + variable + " to non-ground term " + term);
    }
    AspTerm existing = map.get(variable);
    if (existing != null)
    {
      if (!existing.equals(term))
      {
        throw new IllegalArgumentException("Variable " + variable + " is already bound to " + existing);
      }
      return this;
    }
    Map<AspVariable, AspTerm> newMap = new LinkedHashMap<>(map);
    newMap.put(variable, term);
    return new Substitution(newMap);
  }

  /**
   * @return the union of this substitution and another one.
   * @throws IllegalArgumentException if the two map some variable to different terms.
   */
  public Substitution compose(Substitution other)
  {
    if (other.isEmpty())
    {
      return this;
    }
    Map<AspVariable, AspTerm> newMap = new LinkedHashMap<>(map);
    for (Map.Entry<AspVariable, AspTerm> entry : other.map.entrySet())
    {
      AspTerm existing = newMap.put(entry.getKey(), entry.getValue());
      if ((existing != null) && !existing.equals(entry.getValue()))
      {
        throw new IllegalArgumentException("Conflicting bindings for " + entry.getKey() + ": " + existing +
                                           " and " + entry.getValue());
      }
    }
    return new Substitution(newMap);
  }

  //---------------------------------------------------------------------------------------------------------------
  // Application.  None of these reduce arithmetic; see ArithmeticEvaluator.
  //---------------------------------------------------------------------------------------------------------------

  public AspTerm apply(AspTerm term)
  {
    if (term.isGround())
    {
      return term;
    }
    if (term instanceof AspVariable)
    {
      AspTerm value = map.get(term);
      return (value == null) ? term : value;
    }
    else if (term instanceof AspFunction)
    {
      AspFunction function = (AspFunction)term;
      return AspPool.getFunction(function.getName(), applyTerms(function.getBody()));
    }
    else if (term instanceof AspArithmetic)
    {
      AspArithmetic arithmetic = (AspArithmetic)term;
      return AspPool.getArithmetic(arithmetic.getOperator(), applyTerms(arithmetic.getOperands()));
    }
    else if ((term instanceof AspAnonymousVariable) ||
             (term instanceof AspConstant) ||
             (term instanceof AspNumber) ||
             (term instanceof AspString))
    {
      return term;
    }
    throw new RuntimeException("Unwanted AspTerm type");
  }

  public List<AspTerm> applyTerms(List<AspTerm> terms)
  {
    List<AspTerm> result = new ArrayList<>(terms.size());
    for (AspTerm term : terms)
    {
      result.add(apply(term));
    }
    return result;
  }

  public AspAtom apply(AspAtom atom)
  {
    if (atom.isGround())
    {
      return atom;
    }
    return AspPool.getAtom(atom.getName(), applyTerms(atom.getBody()), atom.isNegated());
  }

  public AspLiteral apply(AspLiteral literal)
  {
    if (literal.isGround())
    {
      return literal;
    }
    if (literal instanceof AspAtom)
    {
      return apply((AspAtom)literal);
    }
    else if (literal instanceof AspNot)
    {
      return AspPool.getNot(apply(((AspNot)literal).getBody()));
    }
    else if (literal instanceof AspComparison)
    {
      AspComparison comparison = (AspComparison)literal;
      return AspPool.getComparison(comparison.getOperator(),
                                   apply(comparison.getLeft()),
                                   apply(comparison.getRight()));
    }
    else if (literal instanceof AspAggregate)
    {
      AspAggregate aggregate = (AspAggregate)literal;
      List<AspAggregateElement> elements = new ArrayList<>(aggregate.getElements().size());
      for (AspAggregateElement element : aggregate.getElements())
      {
        elements.add(apply(element));
      }
      return AspPool.getAggregate(aggregate.getFunction(),
                                  elements,
                                  apply(aggregate.getLeftGuard().orElse(null)),
                                  apply(aggregate.getRightGuard().orElse(null)));
    }
    throw new RuntimeException("Unwanted AspLiteral type");
  }

  public List<AspLiteral> applyLiterals(List<AspLiteral> literals)
  {
    List<AspLiteral> result = new ArrayList<>(literals.size());
    for (AspLiteral literal : literals)
    {
      result.add(apply(literal));
    }
    return result;
  }

  /**
   * @return the guard with the substitution applied, or null if the guard is null.
   */
  public AspGuard apply(AspGuard guard)
  {
    if ((guard == null) || guard.isGround())
    {
      return guard;
    }
    return AspPool.getGuard(guard.getOperator(), apply(guard.getBound()));
  }

  public AspAggregateElement apply(AspAggregateElement element)
  {
    if (element.isGround())
    {
      return element;
    }
    return AspPool.getAggregateElement(applyTerms(element.getTerms()), applyLiterals(element.getCondition()));
  }

  public AspChoiceElement apply(AspChoiceElement element)
  {
    if (element.isGround())
    {
      return element;
    }
    return AspPool.getChoiceElement(apply(element.getAtom()), applyLiterals(element.getCondition()));
  }

  public AspHead apply(AspHead head)
  {
    if (head.isGround())
    {
      return head;
    }
    if (head instanceof AspDisjunction)
    {
      List<AspAtom> atoms = new ArrayList<>();
      for (AspAtom atom : head.getAtoms())
      {
        atoms.add(apply(atom));
      }
      return AspPool.getDisjunction(atoms);
    }
    else if (head instanceof AspChoice)
    {
      AspChoice choice = (AspChoice)head;
      List<AspChoiceElement> elements = new ArrayList<>(choice.getElements().size());
      for (AspChoiceElement element : choice.getElements())
      {
        elements.add(apply(element));
      }
      return AspPool.getChoice(elements,
                               apply(choice.getLeftGuard().orElse(null)),
                               apply(choice.getRightGuard().orElse(null)));
    }
    else if (head instanceof AspNpp)
    {
      AspNpp npp = (AspNpp)head;
      return AspPool.getNpp(npp.getName(), applyTerms(npp.getInputs()), applyTerms(npp.getOutcomes()));
    }
    throw new RuntimeException("Unwanted AspHead type");
  }

  public AspStatement apply(AspStatement statement)
  {
    if (statement instanceof AspRule)
    {
      AspRule rule = (AspRule)statement;
      return AspPool.getRule(apply(rule.getHead()), applyLiterals(rule.getBody()));
    }
    else if (statement instanceof AspWeakConstraint)
    {
      AspWeakConstraint constraint = (AspWeakConstraint)statement;
      return AspPool.getWeakConstraint(applyLiterals(constraint.getBody()),
                                       apply(constraint.getWeight()),
                                       apply(constraint.getLevel()),
                                       applyTerms(constraint.getTerms()));
    }
    throw new RuntimeException("Unwanted AspStatement type");
  }

  @Override
  public boolean equals(Object other)
  {
    return (other instanceof Substitution) && map.equals(((Substitution)other).map);
  }

  @Override
  public int hashCode()
  {
    return map.hashCode();
  }

  @Override
  public String toString()
  {
    return map.toString();
  }
}
