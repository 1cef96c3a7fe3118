
package org.groundslash.base.util.asp.grammar;

/**
 * Relational operators used by builtin comparisons and by aggregate / choice guards.
 */
public enum AspRelationalOperator
{
  EQUAL("="),
  UNEQUAL("!="),
  LESS("<"),
  GREATER(">"),
  LESS_OR_EQUAL("<="),
  GREATER_OR_EQUAL(">=");

  private final String mSymbol;

  private AspRelationalOperator(String xiSymbol)
  {
    mSymbol = xiSymbol;
  }

  /**
   * @return whether the relation holds, given the result of comparing the left operand to the right one.
   *
   * @param xiComparison - the sign of (left - right) under the total order over ground terms.
   */
  public boolean holds(int xiComparison)
  {
    switch (this)
    {
      case EQUAL:            return xiComparison == 0;
      case UNEQUAL:          return xiComparison != 0;
      case LESS:             return xiComparison < 0;
      case GREATER:          return xiComparison > 0;
      case LESS_OR_EQUAL:    return xiComparison <= 0;
      case GREATER_OR_EQUAL: return xiComparison >= 0;
      default:
        throw new IllegalStateException("Unknown relational operator " + name());
    }
  }

  public static AspRelationalOperator fromSymbol(String xiSymbol)
  {
    for (AspRelationalOperator lOperator : values())
    {
      if (lOperator.mSymbol.equals(xiSymbol))
      {
        return lOperator;
      }
    }
    throw new IllegalArgumentException("Unknown relational operator '" + xiSymbol + "'");
  }

  @Override
  public String toString()
  {
    return mSymbol;
  }
}
