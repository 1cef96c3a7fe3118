
package org.groundslash.base.util.asp.grammar;

import java.util.List;

import org.apache.commons.lang.StringUtils;

import com.google.common.collect.ImmutableList;

/**
 * An <i>aggregate element</i>: a tuple of terms plus a condition (a conjunction of atoms, default-negated atoms and
 * comparisons), written <code>t1,...,tn : c1,...,cm</code>.  Variables that occur only inside an element are local to
 * it and must be bound by the element's own condition.
 *
 * See {@link Asp} for a complete description of the ASP hierarchy.
 */
@SuppressWarnings("serial")
public final class AspAggregateElement extends Asp
{

  private final ImmutableList<AspTerm>    terms;
  private final ImmutableList<AspLiteral> condition;
  private transient Boolean               ground;

  AspAggregateElement(List<AspTerm> terms, List<AspLiteral> condition)
  {
    this.terms = ImmutableList.copyOf(terms);
    this.condition = ImmutableList.copyOf(condition);
    ground = null;
  }

  public List<AspTerm> getTerms()
  {
    return terms;
  }

  public List<AspLiteral> getCondition()
  {
    return condition;
  }

  /**
   * @return the contribution this (ground) element makes to an aggregate with the given function: 1 for #count, and
   *         the first term of the tuple (the weight, or the value compared) for everything else.  Returns null for an
   *         element with an empty tuple under any function but #count.
   *
   * @param function - the aggregate function.
   */
  public AspTerm contribution(AspAggregateFunction function)
  {
    if (function == AspAggregateFunction.COUNT)
    {
      return AspPool.getNumber(1);
    }
    return terms.isEmpty() ? null : terms.get(0);
  }

  @Override
  public boolean isGround()
  {
    if (ground == null)
    {
      boolean result = true;
      for (AspTerm term : terms)
      {
        result &= term.isGround();
      }
      for (AspLiteral literal : condition)
      {
        result &= literal.isGround();
      }
      ground = result;
    }

    return ground;
  }

  @Override
  public boolean equals(Object other)
  {
    if (!(other instanceof AspAggregateElement))
    {
      return false;
    }
    AspAggregateElement element = (AspAggregateElement)other;
    return terms.equals(element.terms) && condition.equals(element.condition);
  }

  @Override
  public int hashCode()
  {
    return terms.hashCode() * 31 + condition.hashCode();
  }

  @Override
  public String toString()
  {
    String result = StringUtils.join(terms, ",");
    if (!condition.isEmpty())
    {
      result += ":" + StringUtils.join(condition, ",");
    }
    return result;
  }

}
