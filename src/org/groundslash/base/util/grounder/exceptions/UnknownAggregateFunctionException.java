
package org.groundslash.base.util.grounder.exceptions;

/**
 * The front-end handed over an aggregate function other than #count, #sum, #max or #min.
 */
public class UnknownAggregateFunctionException extends GroundingException
{
  private static final long serialVersionUID = 1L;

  private final String mSymbol;

  public UnknownAggregateFunctionException(String xiSymbol)
  {
    super("Unknown aggregate function '" + xiSymbol + "'", null);
    mSymbol = xiSymbol;
  }

  public String getSymbol()
  {
    return mSymbol;
  }
}
