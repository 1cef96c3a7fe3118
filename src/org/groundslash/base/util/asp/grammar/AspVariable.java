
package org.groundslash.base.util.asp.grammar;

/**
 * A <i>variable</i> is a "word" in a rule starting with an upper-case letter (or, once the builder has renamed
 * anonymous variables, with an underscore).  It can stand for any ground term.
 *
 * See {@link Asp} for a complete description of the ASP hierarchy.
 */
@SuppressWarnings("serial")
public final class AspVariable extends AspTerm
{

  private final String name;

  AspVariable(String name)
  {
    this.name = name.intern();
  }

  public String getName()
  {
    return name;
  }

  @Override
  public boolean isGround()
  {
    return false;
  }

  @Override
  public int orderRank()
  {
    throw new IllegalArgumentException("Total order is undefined for variable " + name);
  }

  @Override
  public boolean equals(Object other)
  {
    return (other instanceof AspVariable) && ((AspVariable)other).name.equals(name);
  }

  @Override
  public int hashCode()
  {
    return 17 * name.hashCode();
  }

  @Override
  public String toString()
  {
    return name;
  }

}
