
package org.groundslash.base.util.asp.transforms;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.groundslash.base.util.asp.grammar.AspAggregate;
import org.groundslash.base.util.asp.grammar.AspAggregateElement;
import org.groundslash.base.util.asp.grammar.AspAggregateFunction;
import org.groundslash.base.util.asp.grammar.AspAnonymousVariable;
import org.groundslash.base.util.asp.grammar.AspArithmetic;
import org.groundslash.base.util.asp.grammar.AspAtom;
import org.groundslash.base.util.asp.grammar.AspChoice;
import org.groundslash.base.util.asp.grammar.AspChoiceElement;
import org.groundslash.base.util.asp.grammar.AspComparison;
import org.groundslash.base.util.asp.grammar.AspDisjunction;
import org.groundslash.base.util.asp.grammar.AspFunction;
import org.groundslash.base.util.asp.grammar.AspGuard;
import org.groundslash.base.util.asp.grammar.AspHead;
import org.groundslash.base.util.asp.grammar.AspLiteral;
import org.groundslash.base.util.asp.grammar.AspNot;
import org.groundslash.base.util.asp.grammar.AspNpp;
import org.groundslash.base.util.asp.grammar.AspPool;
import org.groundslash.base.util.asp.grammar.AspProgram;
import org.groundslash.base.util.asp.grammar.AspRule;
import org.groundslash.base.util.asp.grammar.AspStatement;
import org.groundslash.base.util.asp.grammar.AspTerm;
import org.groundslash.base.util.asp.grammar.AspWeakConstraint;
import org.groundslash.base.util.grounder.exceptions.UnknownAggregateFunctionException;

/**
 * Builds an {@link AspProgram} from the pieces a front-end hands over, normalising them on the way in.
 *
 * <ul>
 * <li>Every occurrence of the anonymous variable becomes a fresh, distinct variable (<code>_1</code>,
 *     <code>_2</code>, ...).</li>
 * <li>Absent guards, conditions and bodies are represented as null guards and empty lists, never as sentinel
 *     terms.</li>
 * <li>Aggregate function symbols are resolved here, so the grounder never sees an unknown one.</li>
 * </ul>
 */
public class AspProgramBuilder
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final List<AspStatement> statements    = new ArrayList<>();
  private AspAtom                  query         = null;
  private int                      nextAnonymous = 1;

  public AspProgramBuilder addFact(AspAtom atom)
  {
    if (!atom.isGround())
    {
      throw new IllegalArgumentException("Fact " + atom + " is not ground");
    }
    statements.add(AspPool.getFact(atom));
    return this;
  }

  public AspProgramBuilder addRule(AspAtom head, List<AspLiteral> body)
  {
    return addDisjunctiveRule(Collections.singletonList(head), body);
  }

  public AspProgramBuilder addDisjunctiveRule(List<AspAtom> head, List<AspLiteral> body)
  {
    if (head.isEmpty())
    {
      throw new IllegalArgumentException("A rule needs at least one head atom - use addConstraint instead");
    }
    List<AspAtom> atoms = new ArrayList<>(head.size());
    for (AspAtom atom : head)
    {
      atoms.add(rename(atom));
    }
    statements.add(AspPool.getRule(AspPool.getDisjunction(atoms), renameLiterals(body)));
    return this;
  }

  public AspProgramBuilder addConstraint(List<AspLiteral> body)
  {
    statements.add(AspPool.getConstraint(renameLiterals(body)));
    return this;
  }

  public AspProgramBuilder addChoiceRule(AspChoice choice, List<AspLiteral> body)
  {
    List<AspChoiceElement> elements = new ArrayList<>(choice.getElements().size());
    for (AspChoiceElement element : choice.getElements())
    {
      elements.add(AspPool.getChoiceElement(rename(element.getAtom()), renameLiterals(element.getCondition())));
    }
    AspChoice renamed = AspPool.getChoice(elements,
                                          rename(choice.getLeftGuard().orElse(null)),
                                          rename(choice.getRightGuard().orElse(null)));
    statements.add(AspPool.getRule(renamed, renameLiterals(body)));
    return this;
  }

  public AspProgramBuilder addNppRule(AspNpp npp, List<AspLiteral> body)
  {
    if (npp.getOutcomes().isEmpty())
    {
      throw new IllegalArgumentException("NPP declaration " + npp + " has no outcomes");
    }
    AspNpp renamed = AspPool.getNpp(npp.getName(), renameTerms(npp.getInputs()), npp.getOutcomes());
    statements.add(AspPool.getRule(renamed, renameLiterals(body)));
    return this;
  }

  public AspProgramBuilder addWeakConstraint(List<AspLiteral> body, AspTerm weight, AspTerm level, List<AspTerm> terms)
  {
    statements.add(AspPool.getWeakConstraint(renameLiterals(body),
                                             rename(weight),
                                             rename(level),
                                             renameTerms(terms)));
    return this;
  }

  /**
   * Add ready-made statements, e.g. the output of an earlier grounding run.  They are normalised like any other.
   */
  public AspProgramBuilder addStatements(List<? extends AspStatement> statementList)
  {
    for (AspStatement statement : statementList)
    {
      if (statement instanceof AspRule)
      {
        addRule((AspRule)statement);
      }
      else if (statement instanceof AspWeakConstraint)
      {
        AspWeakConstraint constraint = (AspWeakConstraint)statement;
        addWeakConstraint(constraint.getBody(), constraint.getWeight(), constraint.getLevel(), constraint.getTerms());
      }
      else
      {
        throw new RuntimeException("Unwanted AspStatement type");
      }
    }
    return this;
  }

  public AspProgramBuilder setQuery(AspAtom atom)
  {
    query = (atom == null) ? null : rename(atom);
    return this;
  }

  public AspProgram build()
  {
    LOGGER.debug("Built program with " + statements.size() + " statements" +
                 (query == null ? "" : " and query " + query));
    return new AspProgram(statements, query);
  }

  /**
   * Construct an aggregate from the function symbol the front-end produced.
   *
   * @param symbol     - the function, e.g. "#sum" or "sum".
   * @param elements   - the elements (possibly empty).
   * @param leftGuard  - the left guard, or null.
   * @param rightGuard - the right guard, or null.
   *
   * @throws UnknownAggregateFunctionException if the symbol doesn't name a supported function.
   */
  public static AspAggregate aggregate(String symbol,
                                       List<AspAggregateElement> elements,
                                       AspGuard leftGuard,
                                       AspGuard rightGuard) throws UnknownAggregateFunctionException
  {
    AspAggregateFunction function = AspAggregateFunction.fromSymbol(symbol);
    return AspPool.getAggregate(function, elements, leftGuard, rightGuard);
  }

  private void addRule(AspRule rule)
  {
    AspHead head = rule.getHead();
    if (head instanceof AspDisjunction)
    {
      AspDisjunction disjunction = (AspDisjunction)head;
      if (disjunction.isEmpty())
      {
        addConstraint(rule.getBody());
      }
      else
      {
        addDisjunctiveRule(disjunction.getAtoms(), rule.getBody());
      }
    }
    else if (head instanceof AspChoice)
    {
      addChoiceRule((AspChoice)head, rule.getBody());
    }
    else if (head instanceof AspNpp)
    {
      addNppRule((AspNpp)head, rule.getBody());
    }
    else
    {
      throw new RuntimeException("Unwanted AspHead type");
    }
  }

  //---------------------------------------------------------------------------------------------------------------
  // Anonymous variable renaming
  //---------------------------------------------------------------------------------------------------------------

  private AspTerm rename(AspTerm term)
  {
    if (term instanceof AspAnonymousVariable)
    {
      return AspPool.getVariable("_" + nextAnonymous++);
    }
    else if (term instanceof AspFunction)
    {
      AspFunction function = (AspFunction)term;
      return AspPool.getFunction(function.getName(), renameTerms(function.getBody()));
    }
    else if (term instanceof AspArithmetic)
    {
      AspArithmetic arithmetic = (AspArithmetic)term;
      return AspPool.getArithmetic(arithmetic.getOperator(), renameTerms(arithmetic.getOperands()));
    }
    return term;
  }

  private List<AspTerm> renameTerms(List<AspTerm> terms)
  {
    List<AspTerm> result = new ArrayList<>(terms.size());
    for (AspTerm term : terms)
    {
      result.add(rename(term));
    }
    return result;
  }

  private AspAtom rename(AspAtom atom)
  {
    return AspPool.getAtom(atom.getName(), renameTerms(atom.getBody()), atom.isNegated());
  }

  private AspGuard rename(AspGuard guard)
  {
    return (guard == null) ? null : AspPool.getGuard(guard.getOperator(), rename(guard.getBound()));
  }

  private AspLiteral rename(AspLiteral literal)
  {
    if (literal instanceof AspAtom)
    {
      return rename((AspAtom)literal);
    }
    else if (literal instanceof AspNot)
    {
      return AspPool.getNot(rename(((AspNot)literal).getBody()));
    }
    else if (literal instanceof AspComparison)
    {
      AspComparison comparison = (AspComparison)literal;
      return AspPool.getComparison(comparison.getOperator(),
                                   rename(comparison.getLeft()),
                                   rename(comparison.getRight()));
    }
    else if (literal instanceof AspAggregate)
    {
      AspAggregate aggregate = (AspAggregate)literal;
      List<AspAggregateElement> elements = new ArrayList<>(aggregate.getElements().size());
      for (AspAggregateElement element : aggregate.getElements())
      {
        elements.add(AspPool.getAggregateElement(renameTerms(element.getTerms()),
                                                 renameLiterals(element.getCondition())));
      }
      return AspPool.getAggregate(aggregate.getFunction(),
                                  elements,
                                  rename(aggregate.getLeftGuard().orElse(null)),
                                  rename(aggregate.getRightGuard().orElse(null)));
    }
    throw new RuntimeException("Unwanted AspLiteral type");
  }

  private List<AspLiteral> renameLiterals(List<AspLiteral> literals)
  {
    List<AspLiteral> result = new ArrayList<>(literals.size());
    for (AspLiteral literal : literals)
    {
      result.add(rename(literal));
    }
    return result;
  }
}
