
package org.groundslash.base.util.grounder;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.groundslash.base.util.asp.grammar.AspAtom;
import org.groundslash.base.util.asp.grammar.AspStatement;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * The result of grounding a program: a variable-free, duplicate-free list of statements, together with the atoms that
 * were found to be possible and certain along the way.
 *
 * Instances are immutable.  {@link #toString()} renders one statement per line.
 */
public final class GroundProgram implements Serializable
{
  private static final long serialVersionUID = 1L;

  private final ImmutableList<AspStatement> mStatements;
  private final ImmutableSet<AspAtom>       mPossible;
  private final ImmutableSet<AspAtom>       mCertain;
  private final AspAtom                     mQuery;
  private final ImmutableSet<AspAtom>       mQueryAnswers;
  private final int                         mPasses;
  private final int                         mComponents;

  GroundProgram(List<AspStatement> xiStatements,
                Set<AspAtom> xiPossible,
                Set<AspAtom> xiCertain,
                AspAtom xiQuery,
                Set<AspAtom> xiQueryAnswers,
                int xiPasses,
                int xiComponents)
  {
    mStatements = ImmutableList.copyOf(xiStatements);
    mPossible = ImmutableSet.copyOf(xiPossible);
    mCertain = ImmutableSet.copyOf(xiCertain);
    mQuery = xiQuery;
    mQueryAnswers = ImmutableSet.copyOf(xiQueryAnswers);
    mPasses = xiPasses;
    mComponents = xiComponents;
  }

  public List<AspStatement> getStatements()
  {
    return mStatements;
  }

  /**
   * @return every ground atom that some statement of this program can derive.
   */
  public Set<AspAtom> getPossibleAtoms()
  {
    return mPossible;
  }

  /**
   * @return the ground atoms that hold in every answer set (if there is one).
   */
  public Set<AspAtom> getCertainAtoms()
  {
    return mCertain;
  }

  public Optional<AspAtom> getQuery()
  {
    return Optional.ofNullable(mQuery);
  }

  /**
   * @return the possible atoms that match the query (empty if there is no query).
   */
  public Set<AspAtom> getQueryAnswers()
  {
    return mQueryAnswers;
  }

  /**
   * @return whether some answer to the query is certain.
   */
  public boolean isQueryCertain()
  {
    for (AspAtom lAnswer : mQueryAnswers)
    {
      if (mCertain.contains(lAnswer))
      {
        return true;
      }
    }
    return false;
  }

  /**
   * @return the number of fixpoint passes taken.
   */
  public int getPasses()
  {
    return mPasses;
  }

  /**
   * @return the number of dependency components grounded.
   */
  public int getComponents()
  {
    return mComponents;
  }

  @Override
  public boolean equals(Object xiOther)
  {
    if (!(xiOther instanceof GroundProgram))
    {
      return false;
    }
    GroundProgram lOther = (GroundProgram)xiOther;
    return ImmutableSet.copyOf(mStatements).equals(ImmutableSet.copyOf(lOther.mStatements)) &&
           getQuery().equals(lOther.getQuery());
  }

  @Override
  public int hashCode()
  {
    return ImmutableSet.copyOf(mStatements).hashCode() * 31 + getQuery().hashCode();
  }

  @Override
  public String toString()
  {
    StringBuilder lBuilder = new StringBuilder();
    for (AspStatement lStatement : mStatements)
    {
      lBuilder.append(lStatement).append("\n");
    }
    return lBuilder.toString();
  }
}
