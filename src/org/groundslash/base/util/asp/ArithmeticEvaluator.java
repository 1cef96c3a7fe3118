
package org.groundslash.base.util.asp;

import java.util.ArrayList;
import java.util.List;

import org.groundslash.base.util.asp.grammar.AspArithmetic;
import org.groundslash.base.util.asp.grammar.AspAtom;
import org.groundslash.base.util.asp.grammar.AspComparison;
import org.groundslash.base.util.asp.grammar.AspFunction;
import org.groundslash.base.util.asp.grammar.AspGuard;
import org.groundslash.base.util.asp.grammar.AspNumber;
import org.groundslash.base.util.asp.grammar.AspPool;
import org.groundslash.base.util.asp.grammar.AspTerm;
import org.groundslash.base.util.grounder.exceptions.UndefinedArithmeticException;

/**
 * Reduces ground arithmetic to numbers.
 *
 * A ground arithmetic term is evaluated eagerly with 64-bit integer arithmetic (division rounds towards negative
 * infinity).  A term with any non-ground operand is returned unchanged, to be reduced again once the enclosing
 * substitution is complete.  Functions are structural: their arguments are reduced but the function itself never is.
 * Reduction is idempotent.
 */
public final class ArithmeticEvaluator
{
  private ArithmeticEvaluator()
  {
  }

  public static AspTerm reduce(AspTerm term) throws UndefinedArithmeticException
  {
    if (term instanceof AspArithmetic)
    {
      if (!term.isGround())
      {
        return term;
      }
      return AspPool.getNumber(evaluate((AspArithmetic)term));
    }
    else if (term instanceof AspFunction)
    {
      AspFunction function = (AspFunction)term;
      if (!containsArithmetic(function))
      {
        return function;
      }
      return AspPool.getFunction(function.getName(), reduceTerms(function.getBody()));
    }
    return term;
  }

  public static List<AspTerm> reduceTerms(List<AspTerm> terms) throws UndefinedArithmeticException
  {
    List<AspTerm> result = new ArrayList<>(terms.size());
    for (AspTerm term : terms)
    {
      result.add(reduce(term));
    }
    return result;
  }

  public static AspAtom reduce(AspAtom atom) throws UndefinedArithmeticException
  {
    boolean changed = false;
    List<AspTerm> body = new ArrayList<>(atom.arity());
    for (AspTerm term : atom.getBody())
    {
      AspTerm reduced = reduce(term);
      changed |= (reduced != term);
      body.add(reduced);
    }
    return changed ? AspPool.getAtom(atom.getName(), body, atom.isNegated()) : atom;
  }

  public static AspComparison reduce(AspComparison comparison) throws UndefinedArithmeticException
  {
    return AspPool.getComparison(comparison.getOperator(),
                                 reduce(comparison.getLeft()),
                                 reduce(comparison.getRight()));
  }

  /**
   * @return the guard with its bound reduced, or null if the guard is null.
   */
  public static AspGuard reduce(AspGuard guard) throws UndefinedArithmeticException
  {
    if (guard == null)
    {
      return null;
    }
    return AspPool.getGuard(guard.getOperator(), reduce(guard.getBound()));
  }

  /**
   * @return the value of a ground arithmetic term.
   */
  private static long evaluate(AspArithmetic arithmetic) throws UndefinedArithmeticException
  {
    long left = value(arithmetic, arithmetic.getLeft());
    try
    {
      switch (arithmetic.getOperator())
      {
        case NEGATE:
          return Math.negateExact(left);
        case PLUS:
          return Math.addExact(left, value(arithmetic, arithmetic.getRight()));
        case MINUS:
          return Math.subtractExact(left, value(arithmetic, arithmetic.getRight()));
        case TIMES:
          return Math.multiplyExact(left, value(arithmetic, arithmetic.getRight()));
        case DIV:
          long right = value(arithmetic, arithmetic.getRight());
          if (right == 0)
          {
            throw new UndefinedArithmeticException("Division by zero", arithmetic);
          }
          if ((left == Long.MIN_VALUE) && (right == -1))
          {
            throw new ArithmeticException("long overflow");
          }
          return Math.floorDiv(left, right);
        default:
          throw new IllegalStateException("Unknown arithmetic operator " + arithmetic.getOperator().name());
      }
    }
    catch (ArithmeticException e)
    {
      throw new UndefinedArithmeticException("Integer overflow", arithmetic);
    }
  }

  private static long value(AspArithmetic parent, AspTerm operand) throws UndefinedArithmeticException
  {
    AspTerm reduced = reduce(operand);
    if (!(reduced instanceof AspNumber))
    {
      throw new UndefinedArithmeticException("Non-numeric operand " + reduced, parent);
    }
    return ((AspNumber)reduced).getValue();
  }

  private static boolean containsArithmetic(AspTerm term)
  {
    if (term instanceof AspArithmetic)
    {
      return true;
    }
    if (term instanceof AspFunction)
    {
      for (AspTerm argument : ((AspFunction)term).getBody())
      {
        if (containsArithmetic(argument))
        {
          return true;
        }
      }
    }
    return false;
  }
}
