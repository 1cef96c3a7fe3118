
package org.groundslash.base.util.grounder;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.groundslash.base.util.asp.ArithmeticEvaluator;
import org.groundslash.base.util.asp.Substitution;
import org.groundslash.base.util.asp.grammar.AspAggregate;
import org.groundslash.base.util.asp.grammar.AspAggregateElement;
import org.groundslash.base.util.asp.grammar.AspAtom;
import org.groundslash.base.util.asp.grammar.AspChoice;
import org.groundslash.base.util.asp.grammar.AspChoiceElement;
import org.groundslash.base.util.asp.grammar.AspConstant;
import org.groundslash.base.util.asp.grammar.AspHead;
import org.groundslash.base.util.asp.grammar.AspLiteral;
import org.groundslash.base.util.asp.grammar.AspNot;
import org.groundslash.base.util.asp.grammar.AspNpp;
import org.groundslash.base.util.asp.grammar.AspPool;
import org.groundslash.base.util.asp.grammar.AspProgram;
import org.groundslash.base.util.asp.grammar.AspRule;
import org.groundslash.base.util.asp.grammar.AspStatement;
import org.groundslash.base.util.grounder.exceptions.NppArityMismatchException;
import org.groundslash.base.util.grounder.exceptions.UndefinedArithmeticException;

/**
 * Grounds NPP declarations.  Only the input terms are instantiated; the outcome labels are carried through exactly as
 * declared.
 */
final class NppGrounder
{
  AspNpp ground(AspNpp xiNpp, Substitution xiSubst) throws UndefinedArithmeticException
  {
    return AspPool.getNpp(xiNpp.getName(),
                          ArithmeticEvaluator.reduceTerms(xiSubst.applyTerms(xiNpp.getInputs())),
                          xiNpp.getOutcomes());
  }

  /**
   * Check that every declaration of an NPP predicate agrees on the number of inputs, and that every other use of the
   * predicate has one more argument than that.
   *
   * @throws NppArityMismatchException for the first statement that disagrees.
   */
  static void validate(AspProgram xiProgram) throws NppArityMismatchException
  {
    Map<AspConstant, Integer> lInputs = new HashMap<>();
    for (AspStatement lStatement : xiProgram.getStatements())
    {
      if ((lStatement instanceof AspRule) && (((AspRule)lStatement).getHead() instanceof AspNpp))
      {
        AspNpp lNpp = (AspNpp)((AspRule)lStatement).getHead();
        Integer lPrevious = lInputs.put(lNpp.getName(), lNpp.getInputs().size());
        if ((lPrevious != null) && (lPrevious != lNpp.getInputs().size()))
        {
          throw new NppArityMismatchException(lNpp.getName().getValue(),
                                              lPrevious + 1,
                                              lNpp.getInputs().size() + 1,
                                              lStatement);
        }
      }
    }
    if (lInputs.isEmpty())
    {
      return;
    }

    for (AspStatement lStatement : xiProgram.getStatements())
    {
      if (lStatement instanceof AspRule)
      {
        AspHead lHead = ((AspRule)lStatement).getHead();
        if (lHead instanceof AspChoice)
        {
          for (AspChoiceElement lElement : ((AspChoice)lHead).getElements())
          {
            checkAtom(lElement.getAtom(), lInputs, lStatement);
            checkLiterals(lElement.getCondition(), lInputs, lStatement);
          }
        }
        else if (!(lHead instanceof AspNpp))
        {
          for (AspAtom lAtom : lHead.getAtoms())
          {
            checkAtom(lAtom, lInputs, lStatement);
          }
        }
      }
      checkLiterals(lStatement.getBody(), lInputs, lStatement);
    }
    if (xiProgram.getQuery().isPresent())
    {
      checkAtom(xiProgram.getQuery().get(), lInputs, null);
    }
  }

  private static void checkLiterals(List<AspLiteral> xiLiterals,
                                    Map<AspConstant, Integer> xiInputs,
                                    AspStatement xiStatement) throws NppArityMismatchException
  {
    for (AspLiteral lLiteral : xiLiterals)
    {
      AspLiteral lInner = (lLiteral instanceof AspNot) ? ((AspNot)lLiteral).getBody() : lLiteral;
      if (lInner instanceof AspAtom)
      {
        checkAtom((AspAtom)lInner, xiInputs, xiStatement);
      }
      else if (lInner instanceof AspAggregate)
      {
        for (AspAggregateElement lElement : ((AspAggregate)lInner).getElements())
        {
          checkLiterals(lElement.getCondition(), xiInputs, xiStatement);
        }
      }
    }
  }

  private static void checkAtom(AspAtom xiAtom, Map<AspConstant, Integer> xiInputs, AspStatement xiStatement)
    throws NppArityMismatchException
  {
    Integer lInputs = xiInputs.get(xiAtom.getName());
    if ((lInputs != null) && (xiAtom.arity() != lInputs + 1))
    {
      throw new NppArityMismatchException(xiAtom.getName().getValue(), lInputs + 1, xiAtom.arity(), xiStatement);
    }
  }
}
