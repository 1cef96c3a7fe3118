
package org.groundslash.base.util.asp.grammar;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

/**
 * A program: an ordered list of statements plus an optional query atom.  Programs are produced by
 * {@link org.groundslash.base.util.asp.transforms.AspProgramBuilder}, which normalises them into the canonical form
 * the grounder expects.
 */
public final class AspProgram implements Serializable
{
  private static final long serialVersionUID = 1L;

  private final ImmutableList<AspStatement> mStatements;
  private final AspAtom                     mQuery;

  public AspProgram(List<AspStatement> xiStatements, AspAtom xiQuery)
  {
    mStatements = ImmutableList.copyOf(xiStatements);
    mQuery = xiQuery;
  }

  public List<AspStatement> getStatements()
  {
    return mStatements;
  }

  public Optional<AspAtom> getQuery()
  {
    return Optional.ofNullable(mQuery);
  }

  @Override
  public boolean equals(Object xiOther)
  {
    if (!(xiOther instanceof AspProgram))
    {
      return false;
    }
    AspProgram lOther = (AspProgram)xiOther;
    return mStatements.equals(lOther.mStatements) && getQuery().equals(lOther.getQuery());
  }

  @Override
  public int hashCode()
  {
    return mStatements.hashCode() * 31 + getQuery().hashCode();
  }

  @Override
  public String toString()
  {
    StringBuilder lBuilder = new StringBuilder();
    for (AspStatement lStatement : mStatements)
    {
      lBuilder.append(lStatement).append("\n");
    }
    if (mQuery != null)
    {
      lBuilder.append(mQuery).append("?\n");
    }
    return lBuilder.toString();
  }
}
