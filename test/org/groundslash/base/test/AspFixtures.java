package org.groundslash.base.test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.groundslash.base.util.asp.grammar.AspAggregateElement;
import org.groundslash.base.util.asp.grammar.AspArithmeticOperator;
import org.groundslash.base.util.asp.grammar.AspAtom;
import org.groundslash.base.util.asp.grammar.AspChoiceElement;
import org.groundslash.base.util.asp.grammar.AspComparison;
import org.groundslash.base.util.asp.grammar.AspConstant;
import org.groundslash.base.util.asp.grammar.AspFunction;
import org.groundslash.base.util.asp.grammar.AspGuard;
import org.groundslash.base.util.asp.grammar.AspLiteral;
import org.groundslash.base.util.asp.grammar.AspNot;
import org.groundslash.base.util.asp.grammar.AspNumber;
import org.groundslash.base.util.asp.grammar.AspPool;
import org.groundslash.base.util.asp.grammar.AspRelationalOperator;
import org.groundslash.base.util.asp.grammar.AspStatement;
import org.groundslash.base.util.asp.grammar.AspString;
import org.groundslash.base.util.asp.grammar.AspTerm;
import org.groundslash.base.util.asp.grammar.AspVariable;

/**
 * Shorthand for building programs in tests, standing in for a parser.
 */
public final class AspFixtures
{
  private AspFixtures()
  {
  }

  public static AspConstant c(String xiValue)
  {
    return AspPool.getConstant(xiValue);
  }

  public static AspNumber n(long xiValue)
  {
    return AspPool.getNumber(xiValue);
  }

  public static AspString str(String xiValue)
  {
    return AspPool.getString(xiValue);
  }

  public static AspVariable v(String xiName)
  {
    return AspPool.getVariable(xiName);
  }

  public static AspTerm anon()
  {
    return AspPool.getAnonymousVariable();
  }

  public static AspFunction f(String xiName, AspTerm... xiArgs)
  {
    return AspPool.getFunction(c(xiName), Arrays.asList(xiArgs));
  }

  public static AspTerm plus(AspTerm xiLeft, AspTerm xiRight)
  {
    return AspPool.getArithmetic(AspArithmeticOperator.PLUS, Arrays.asList(xiLeft, xiRight));
  }

  public static AspTerm minus(AspTerm xiLeft, AspTerm xiRight)
  {
    return AspPool.getArithmetic(AspArithmeticOperator.MINUS, Arrays.asList(xiLeft, xiRight));
  }

  public static AspTerm times(AspTerm xiLeft, AspTerm xiRight)
  {
    return AspPool.getArithmetic(AspArithmeticOperator.TIMES, Arrays.asList(xiLeft, xiRight));
  }

  public static AspTerm div(AspTerm xiLeft, AspTerm xiRight)
  {
    return AspPool.getArithmetic(AspArithmeticOperator.DIV, Arrays.asList(xiLeft, xiRight));
  }

  public static AspTerm neg(AspTerm xiOperand)
  {
    return AspPool.getArithmetic(AspArithmeticOperator.NEGATE, Arrays.<AspTerm>asList(xiOperand));
  }

  public static AspAtom atom(String xiName, AspTerm... xiArgs)
  {
    return AspPool.getAtom(c(xiName), Arrays.asList(xiArgs));
  }

  /**
   * @return a classically negated atom, -name(args).
   */
  public static AspAtom negAtom(String xiName, AspTerm... xiArgs)
  {
    return AspPool.getAtom(c(xiName), Arrays.asList(xiArgs), true);
  }

  public static AspNot not(AspLiteral xiLiteral)
  {
    return AspPool.getNot(xiLiteral);
  }

  public static AspComparison cmp(AspTerm xiLeft, String xiOperator, AspTerm xiRight)
  {
    return AspPool.getComparison(AspRelationalOperator.fromSymbol(xiOperator), xiLeft, xiRight);
  }

  public static AspGuard guard(String xiOperator, AspTerm xiBound)
  {
    return AspPool.getGuard(AspRelationalOperator.fromSymbol(xiOperator), xiBound);
  }

  public static List<AspLiteral> body(AspLiteral... xiLiterals)
  {
    return new ArrayList<>(Arrays.asList(xiLiterals));
  }

  public static List<AspTerm> terms(AspTerm... xiTerms)
  {
    return new ArrayList<>(Arrays.asList(xiTerms));
  }

  public static AspAggregateElement element(List<AspTerm> xiTerms, AspLiteral... xiCondition)
  {
    return AspPool.getAggregateElement(xiTerms, Arrays.asList(xiCondition));
  }

  public static AspChoiceElement choiceElement(AspAtom xiAtom, AspLiteral... xiCondition)
  {
    return AspPool.getChoiceElement(xiAtom, Arrays.asList(xiCondition));
  }

  /**
   * @return the rendered form of each statement, in order.
   */
  public static List<String> render(List<? extends AspStatement> xiStatements)
  {
    List<String> lResult = new ArrayList<>(xiStatements.size());
    for (AspStatement lStatement : xiStatements)
    {
      lResult.add(lStatement.toString());
    }
    return lResult;
  }
}
