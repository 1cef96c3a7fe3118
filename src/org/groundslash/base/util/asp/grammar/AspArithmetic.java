
package org.groundslash.base.util.asp.grammar;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * An <i>arithmetic</i> term applies an {@link AspArithmeticOperator} to one (unary minus) or two operands.  Ground
 * arithmetic terms are reduced to {@link AspNumber}s by the grounder; see
 * {@link org.groundslash.base.util.asp.ArithmeticEvaluator}.
 *
 * See {@link Asp} for a complete description of the ASP hierarchy.
 */
@SuppressWarnings("serial")
public final class AspArithmetic extends AspTerm
{

  private final AspArithmeticOperator  operator;
  private final ImmutableList<AspTerm> operands;
  private transient Boolean            ground;

  AspArithmetic(AspArithmeticOperator operator, List<AspTerm> operands)
  {
    if (operands.size() != operator.arity())
    {
      throw new IllegalArgumentException("Operator " + operator.name() + " takes " + operator.arity() +
                                         " operand(s), not " + operands.size());
    }
    this.operator = operator;
    this.operands = ImmutableList.copyOf(operands);
    ground = null;
  }

  public AspArithmeticOperator getOperator()
  {
    return operator;
  }

  public List<AspTerm> getOperands()
  {
    return operands;
  }

  public AspTerm getLeft()
  {
    return operands.get(0);
  }

  public AspTerm getRight()
  {
    return operands.get(operands.size() - 1);
  }

  @Override
  public boolean isGround()
  {
    if (ground == null)
    {
      boolean result = true;
      for (AspTerm operand : operands)
      {
        result &= operand.isGround();
      }
      ground = result;
    }

    return ground;
  }

  @Override
  public int orderRank()
  {
    throw new IllegalArgumentException("Total order is undefined for unreduced arithmetic term " + this);
  }

  @Override
  public boolean equals(Object other)
  {
    if (!(other instanceof AspArithmetic))
    {
      return false;
    }
    AspArithmetic arithmetic = (AspArithmetic)other;
    return operator == arithmetic.operator && operands.equals(arithmetic.operands);
  }

  @Override
  public int hashCode()
  {
    return 31 * operator.hashCode() + operands.hashCode();
  }

  @Override
  public String toString()
  {
    if (operator == AspArithmeticOperator.NEGATE)
    {
      return "-(" + operands.get(0) + ")";
    }
    return "(" + operands.get(0) + operator + operands.get(1) + ")";
  }

}
