
package org.groundslash.base.util.grounder;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.groundslash.base.util.asp.AspUtils;
import org.groundslash.base.util.asp.grammar.Asp;
import org.groundslash.base.util.asp.grammar.AspAggregate;
import org.groundslash.base.util.asp.grammar.AspAggregateElement;
import org.groundslash.base.util.asp.grammar.AspAtom;
import org.groundslash.base.util.asp.grammar.AspChoice;
import org.groundslash.base.util.asp.grammar.AspChoiceElement;
import org.groundslash.base.util.asp.grammar.AspComparison;
import org.groundslash.base.util.asp.grammar.AspDisjunction;
import org.groundslash.base.util.asp.grammar.AspHead;
import org.groundslash.base.util.asp.grammar.AspLiteral;
import org.groundslash.base.util.asp.grammar.AspNot;
import org.groundslash.base.util.asp.grammar.AspNpp;
import org.groundslash.base.util.asp.grammar.AspPool;
import org.groundslash.base.util.asp.grammar.AspProgram;
import org.groundslash.base.util.asp.grammar.AspRule;
import org.groundslash.base.util.asp.grammar.AspStatement;
import org.groundslash.base.util.asp.grammar.AspVariable;
import org.groundslash.base.util.asp.grammar.AspWeakConstraint;
import org.groundslash.base.util.grounder.exceptions.UnsafeVariableException;

/**
 * Static safety analysis.
 *
 * A variable is safe if it occurs, outside any arithmetic term, in a positive atom of the statement's body.  A
 * variable local to an aggregate or choice element may instead be bound by a positive atom of that element's own
 * condition.  Default negation, builtin comparisons and arithmetic never make a variable safe.  A statement is safe
 * if and only if every variable in it is safe.
 */
public final class SafetyChecker
{
  private static final Logger LOGGER = LogManager.getLogger();

  private SafetyChecker()
  {
  }

  /**
   * Check every statement of a program.
   *
   * @throws UnsafeVariableException for the first unsafe statement, naming its first unsafe variable.
   */
  public static void check(AspProgram xiProgram) throws UnsafeVariableException
  {
    for (AspStatement lStatement : xiProgram.getStatements())
    {
      check(lStatement);
    }
    if (xiProgram.getQuery().isPresent() && AspUtils.hasAnonymousVariable(xiProgram.getQuery().get()))
    {
      throw new IllegalArgumentException("Query " + xiProgram.getQuery().get() + " has not been normalised");
    }
    LOGGER.debug("All " + xiProgram.getStatements().size() + " statements are safe");
  }

  /**
   * Check a single statement.  An anonymous variable that the builder has not renamed is always unsafe.
   *
   * @throws UnsafeVariableException naming the first unsafe variable, in order of appearance.
   */
  public static void check(AspStatement xiStatement) throws UnsafeVariableException
  {
    if (AspUtils.hasAnonymousVariable(xiStatement))
    {
      LOGGER.debug("Anonymous variable left in " + xiStatement);
      throw new UnsafeVariableException(AspPool.getVariable("_"), xiStatement);
    }

    Set<AspVariable> lSafe = AspUtils.getBindingVariables(xiStatement.getBody());

    if (xiStatement instanceof AspRule)
    {
      checkHead(((AspRule)xiStatement).getHead(), lSafe, xiStatement);
      checkBody(xiStatement.getBody(), lSafe, xiStatement);
    }
    else if (xiStatement instanceof AspWeakConstraint)
    {
      AspWeakConstraint lConstraint = (AspWeakConstraint)xiStatement;
      checkBody(lConstraint.getBody(), lSafe, xiStatement);
      checkPart(lConstraint.getWeight(), lSafe, xiStatement);
      checkPart(lConstraint.getLevel(), lSafe, xiStatement);
      for (Asp lTerm : lConstraint.getTerms())
      {
        checkPart(lTerm, lSafe, xiStatement);
      }
    }
    else
    {
      throw new RuntimeException("Unwanted AspStatement type");
    }
  }

  private static void checkHead(AspHead xiHead, Set<AspVariable> xiSafe, AspStatement xiStatement)
    throws UnsafeVariableException
  {
    if ((xiHead instanceof AspDisjunction) || (xiHead instanceof AspNpp))
    {
      checkPart(xiHead, xiSafe, xiStatement);
    }
    else if (xiHead instanceof AspChoice)
    {
      AspChoice lChoice = (AspChoice)xiHead;
      checkPart(lChoice.getLeftGuard().orElse(null), xiSafe, xiStatement);
      for (AspChoiceElement lElement : lChoice.getElements())
      {
        Set<AspVariable> lLocal = withLocal(xiSafe, lElement.getCondition());
        checkPart(lElement.getAtom(), lLocal, xiStatement);
        checkConditions(lElement.getCondition(), lLocal, xiStatement);
      }
      checkPart(lChoice.getRightGuard().orElse(null), xiSafe, xiStatement);
    }
    else
    {
      throw new RuntimeException("Unwanted AspHead type");
    }
  }

  private static void checkBody(List<AspLiteral> xiBody, Set<AspVariable> xiSafe, AspStatement xiStatement)
    throws UnsafeVariableException
  {
    for (AspLiteral lLiteral : xiBody)
    {
      AspLiteral lInner = (lLiteral instanceof AspNot) ? ((AspNot)lLiteral).getBody() : lLiteral;
      if (lInner instanceof AspAggregate)
      {
        checkAggregate((AspAggregate)lInner, xiSafe, xiStatement);
      }
      else
      {
        checkPart(lLiteral, xiSafe, xiStatement);
      }
    }
  }

  private static void checkAggregate(AspAggregate xiAggregate, Set<AspVariable> xiSafe, AspStatement xiStatement)
    throws UnsafeVariableException
  {
    checkPart(xiAggregate.getLeftGuard().orElse(null), xiSafe, xiStatement);
    for (AspAggregateElement lElement : xiAggregate.getElements())
    {
      Set<AspVariable> lLocal = withLocal(xiSafe, lElement.getCondition());
      for (Asp lTerm : lElement.getTerms())
      {
        checkPart(lTerm, lLocal, xiStatement);
      }
      checkConditions(lElement.getCondition(), lLocal, xiStatement);
    }
    checkPart(xiAggregate.getRightGuard().orElse(null), xiSafe, xiStatement);
  }

  private static void checkConditions(List<AspLiteral> xiCondition,
                                      Set<AspVariable> xiSafe,
                                      AspStatement xiStatement) throws UnsafeVariableException
  {
    for (AspLiteral lLiteral : xiCondition)
    {
      if (!(lLiteral instanceof AspAtom) && !(lLiteral instanceof AspNot) && !(lLiteral instanceof AspComparison))
      {
        throw new IllegalArgumentException("Aggregates may not be nested in element conditions: " + xiStatement);
      }
      checkPart(lLiteral, xiSafe, xiStatement);
    }
  }

  private static Set<AspVariable> withLocal(Set<AspVariable> xiSafe, List<AspLiteral> xiCondition)
  {
    Set<AspVariable> lLocal = new LinkedHashSet<>(xiSafe);
    lLocal.addAll(AspUtils.getBindingVariables(xiCondition));
    return lLocal;
  }

  private static void checkPart(Asp xiPart, Set<AspVariable> xiSafe, AspStatement xiStatement)
    throws UnsafeVariableException
  {
    if (xiPart == null)
    {
      return;
    }
    for (AspVariable lVariable : AspUtils.getVariables(xiPart))
    {
      if (!xiSafe.contains(lVariable))
      {
        LOGGER.debug("Variable " + lVariable + " is unsafe in " + xiStatement);
        throw new UnsafeVariableException(lVariable, xiStatement);
      }
    }
  }
}
