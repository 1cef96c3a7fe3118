
package org.groundslash.base.util.asp.grammar;

/**
 * A <i>number</i> is an integer constant.
 *
 * See {@link Asp} for a complete description of the ASP hierarchy.
 */
@SuppressWarnings("serial")
public final class AspNumber extends AspTerm
{

  private final long value;

  AspNumber(long value)
  {
    this.value = value;
  }

  public long getValue()
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
    return 0;
  }

  @Override
  public boolean equals(Object other)
  {
    return (other instanceof AspNumber) && ((AspNumber)other).value == value;
  }

  @Override
  public int hashCode()
  {
    return Long.hashCode(value);
  }

  @Override
  public String toString()
  {
    return Long.toString(value);
  }

}
