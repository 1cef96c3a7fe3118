
package org.groundslash.base.util.asp.grammar;

/**
 * The <i>anonymous variable</i>, written <code>_</code>.  Every occurrence is distinct from every other, so
 * {@link org.groundslash.base.util.asp.transforms.AspProgramBuilder} replaces each occurrence with a fresh
 * {@link AspVariable} before the grounder sees it.
 *
 * See {@link Asp} for a complete description of the ASP hierarchy.
 */
@SuppressWarnings("serial")
public final class AspAnonymousVariable extends AspTerm
{
  AspAnonymousVariable()
  {
  }

  @Override
  public boolean isGround()
  {
    return false;
  }

  @Override
  public int orderRank()
  {
    throw new IllegalArgumentException("Total order is undefined for the anonymous variable");
  }

  @Override
  public boolean equals(Object other)
  {
    return (other instanceof AspAnonymousVariable);
  }

  @Override
  public int hashCode()
  {
    return 95;
  }

  @Override
  public String toString()
  {
    return "_";
  }

}
