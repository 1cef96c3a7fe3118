
package org.groundslash.base.util.asp.grammar;

/**
 * A <i>constant</i> is a symbolic "word" of the program, starting with a lower-case letter.  Constants also name
 * predicates and functions.
 *
 * See {@link Asp} for a complete description of the ASP hierarchy.
 */
@SuppressWarnings("serial")
public final class AspConstant extends AspTerm
{

  private final String value;

  AspConstant(String value)
  {
    this.value = value.intern();
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
    return 2;
  }

  @Override
  public boolean equals(Object other)
  {
    return (other instanceof AspConstant) && ((AspConstant)other).value.equals(value);
  }

  @Override
  public int hashCode()
  {
    return value.hashCode();
  }

  @Override
  public String toString()
  {
    return value;
  }

}
