
package org.groundslash.base.util.asp.grammar;

import org.groundslash.base.util.grounder.exceptions.UnknownAggregateFunctionException;

/**
 * The aggregate functions understood by the grounder.
 */
public enum AspAggregateFunction
{
  COUNT("#count", true),
  SUM("#sum", true),
  MAX("#max", false),
  MIN("#min", false);

  private final String  mSymbol;
  private final boolean mNumericBounds;

  private AspAggregateFunction(String xiSymbol, boolean xiNumericBounds)
  {
    mSymbol = xiSymbol;
    mNumericBounds = xiNumericBounds;
  }

  /**
   * @return whether bounds on this function must be numbers.  #max and #min compare their bounds under the total
   *         order over ground terms, so any ground term will do.
   */
  public boolean requiresNumericBounds()
  {
    return mNumericBounds;
  }

  /**
   * Look up an aggregate function by the symbol the front-end produced for it.
   *
   * @param xiSymbol - the symbol, with or without the leading '#' (e.g. "#count" or "count").
   *
   * @return the function.
   * @throws UnknownAggregateFunctionException if there is no such function.
   */
  public static AspAggregateFunction fromSymbol(String xiSymbol) throws UnknownAggregateFunctionException
  {
    String lSymbol = xiSymbol.startsWith("#") ? xiSymbol : "#" + xiSymbol;
    for (AspAggregateFunction lFunction : values())
    {
      if (lFunction.mSymbol.equals(lSymbol))
      {
        return lFunction;
      }
    }
    throw new UnknownAggregateFunctionException(xiSymbol);
  }

  @Override
  public String toString()
  {
    return mSymbol;
  }
}
