
package org.groundslash.base.util.grounder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.groundslash.base.util.asp.grammar.AspStatement;

/**
 * Collects ground statements as they are emitted, collapsing structural duplicates.  The frozen output lists
 * statements grouped by the source statement they came from, in source order.
 */
public final class GroundProgramAssembler
{
  private final Map<Integer, List<AspStatement>> mBySource = new TreeMap<>();
  private final Set<AspStatement>                mSeen     = new LinkedHashSet<>();

  /**
   * @return whether the statement was new.
   *
   * @param xiSource    - index of the source statement this one was instantiated from.
   * @param xiStatement - a ground statement.
   */
  public boolean add(int xiSource, AspStatement xiStatement)
  {
    if (!xiStatement.isGround())
    {
      throw new IllegalArgumentException("Attempt to emit non-ground statement " + xiStatement);
    }
    if (!mSeen.add(xiStatement))
    {
      return false;
    }
    List<AspStatement> lGroup = mBySource.get(xiSource);
    if (lGroup == null)
    {
      lGroup = new ArrayList<>();
      mBySource.put(xiSource, lGroup);
    }
    lGroup.add(xiStatement);
    return true;
  }

  public void addAll(int xiSource, Collection<? extends AspStatement> xiStatements)
  {
    for (AspStatement lStatement : xiStatements)
    {
      add(xiSource, lStatement);
    }
  }

  public int size()
  {
    return mSeen.size();
  }

  /**
   * @return the statements emitted so far, grouped by source statement.
   */
  public List<AspStatement> freeze()
  {
    List<AspStatement> lResult = new ArrayList<>(mSeen.size());
    for (List<AspStatement> lGroup : mBySource.values())
    {
      lResult.addAll(lGroup);
    }
    return lResult;
  }
}
