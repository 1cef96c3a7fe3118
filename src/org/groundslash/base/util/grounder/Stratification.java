
package org.groundslash.base.util.grounder;

import java.util.List;
import java.util.Set;

import org.groundslash.base.util.asp.grammar.AspSignature;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * The evaluation order produced by the {@link DependencyStratifier}: components in dependency order, followed by the
 * statements with no head (constraints and weak constraints), which depend on everything and derive nothing.
 */
public final class Stratification
{
  /**
   * A strongly connected component of the predicate dependency graph, together with the rules that define its
   * predicates.
   */
  public static final class Component
  {
    private final ImmutableSet<AspSignature> mSignatures;
    private final ImmutableList<Integer>     mStatements;
    private final boolean                    mRecursive;
    private final boolean                    mStratified;

    Component(Set<AspSignature> xiSignatures, List<Integer> xiStatements, boolean xiRecursive, boolean xiStratified)
    {
      mSignatures = ImmutableSet.copyOf(xiSignatures);
      mStatements = ImmutableList.copyOf(xiStatements);
      mRecursive = xiRecursive;
      mStratified = xiStratified;
    }

    public Set<AspSignature> getSignatures()
    {
      return mSignatures;
    }

    /**
     * @return the indices (into the program) of the statements defining this component's predicates, in source
     *         order.
     */
    public List<Integer> getStatements()
    {
      return mStatements;
    }

    /**
     * @return whether some predicate of this component depends (directly or not) on itself, in which case the
     *         component must be iterated to a fixpoint.
     */
    public boolean isRecursive()
    {
      return mRecursive;
    }

    /**
     * @return whether no predicate of this component depends negatively on another one of its predicates.
     */
    public boolean isStratified()
    {
      return mStratified;
    }

    @Override
    public String toString()
    {
      return mSignatures + (mRecursive ? " (recursive" + (mStratified ? ")" : ", unstratified)") : "");
    }
  }

  private final ImmutableList<Component>   mComponents;
  private final ImmutableList<Integer>     mHeadless;
  private final ImmutableSet<AspSignature> mUndefined;

  Stratification(List<Component> xiComponents, List<Integer> xiHeadless, Set<AspSignature> xiUndefined)
  {
    mComponents = ImmutableList.copyOf(xiComponents);
    mHeadless = ImmutableList.copyOf(xiHeadless);
    mUndefined = ImmutableSet.copyOf(xiUndefined);
  }

  public List<Component> getComponents()
  {
    return mComponents;
  }

  /**
   * @return the indices of statements that derive no atom, in source order.
   */
  public List<Integer> getHeadless()
  {
    return mHeadless;
  }

  /**
   * @return the predicates that occur in some body but are defined by no statement.  No atom of theirs is ever
   *         possible.
   */
  public Set<AspSignature> getUndefined()
  {
    return mUndefined;
  }

  /**
   * @return whether the whole program is stratified.
   */
  public boolean isStratified()
  {
    for (Component lComponent : mComponents)
    {
      if (!lComponent.isStratified())
      {
        return false;
      }
    }
    return true;
  }
}
