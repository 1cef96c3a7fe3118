
package org.groundslash.base.util.asp;

import java.util.Comparator;
import java.util.List;

import org.groundslash.base.util.asp.grammar.AspConstant;
import org.groundslash.base.util.asp.grammar.AspFunction;
import org.groundslash.base.util.asp.grammar.AspNumber;
import org.groundslash.base.util.asp.grammar.AspString;
import org.groundslash.base.util.asp.grammar.AspTerm;

/**
 * The total order over reduced ground terms: numbers (by value) &lt; strings &lt; constants (both lexicographic) &lt;
 * functions (by arity, then name, then arguments left to right).
 *
 * Comparing a variable or an unreduced arithmetic term is an IllegalArgumentException.
 */
public final class AspTermOrder implements Comparator<AspTerm>
{
  public static final AspTermOrder INSTANCE = new AspTermOrder();

  private AspTermOrder()
  {
  }

  @Override
  public int compare(AspTerm left, AspTerm right)
  {
    int rankComparison = Integer.compare(left.orderRank(), right.orderRank());
    if (rankComparison != 0)
    {
      return rankComparison;
    }

    if (left instanceof AspNumber)
    {
      return Long.compare(((AspNumber)left).getValue(), ((AspNumber)right).getValue());
    }
    else if (left instanceof AspString)
    {
      return ((AspString)left).getValue().compareTo(((AspString)right).getValue());
    }
    else if (left instanceof AspConstant)
    {
      return ((AspConstant)left).getValue().compareTo(((AspConstant)right).getValue());
    }
    else if (left instanceof AspFunction)
    {
      AspFunction leftFunction = (AspFunction)left;
      AspFunction rightFunction = (AspFunction)right;
      int result = Integer.compare(leftFunction.arity(), rightFunction.arity());
      if (result == 0)
      {
        result = compare(leftFunction.getName(), rightFunction.getName());
      }
      if (result == 0)
      {
        result = compareLists(leftFunction.getBody(), rightFunction.getBody());
      }
      return result;
    }
    throw new RuntimeException("Unwanted AspTerm type");
  }

  /**
   * Lexicographic comparison of two term tuples; a proper prefix sorts first.
   */
  public int compareLists(List<AspTerm> left, List<AspTerm> right)
  {
    int common = Math.min(left.size(), right.size());
    for (int i = 0; i < common; i++)
    {
      int result = compare(left.get(i), right.get(i));
      if (result != 0)
      {
        return result;
      }
    }
    return Integer.compare(left.size(), right.size());
  }
}
