
package org.groundslash.base.util.asp.grammar;

/**
 * A <i>string</i> is a quoted constant.  The stored value excludes the quotes.
 *
 * See {@link Asp} for a complete description of the ASP hierarchy.
 */
@SuppressWarnings("serial")
public final class AspString extends AspTerm
{

  private final String value;

  AspString(String value)
  {
    this.value = value;
  }

  public String getValue()
  {
    return value;
  }

  @Override
  public boolean isGround()
  {
    return true;
  }

  @Override
  public int orderRank()
  {
    return 1;
  }

  @Override
  public boolean equals(Object other)
  {
    return (other instanceof AspString) && ((AspString)other).value.equals(value);
  }

  @Override
  public int hashCode()
  {
    return 31 * value.hashCode() + 1;
  }

  @Override
  public String toString()
  {
    return "\"" + value + "\"";
  }

}
