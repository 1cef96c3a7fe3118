
package org.groundslash.base.util.asp.grammar;

/**
 * Arithmetic operators.  {@link #NEGATE} is the only unary operator.
 */
public enum AspArithmeticOperator
{
  NEGATE("-", 1),
  PLUS("+", 2),
  MINUS("-", 2),
  TIMES("*", 2),
  DIV("/", 2);

  private final String mSymbol;
  private final int    mArity;

  private AspArithmeticOperator(String xiSymbol, int xiArity)
  {
    mSymbol = xiSymbol;
    mArity = xiArity;
  }

  public int arity()
  {
    return mArity;
  }

  @Override
  public String toString()
  {
    return mSymbol;
  }
}
