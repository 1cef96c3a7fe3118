
package org.groundslash.base.util.asp.grammar;

import java.util.List;

import org.apache.commons.lang.StringUtils;

import com.google.common.collect.ImmutableList;

/**
 * A <i>weak constraint</i>, written <code>:~ b1, ..., bn. [w@l, t1, ..., tk]</code>.  Every ground instance whose
 * body holds costs <code>w</code> at priority level <code>l</code>; the terms distinguish instances that would
 * otherwise be counted once.
 *
 * See {@link Asp} for a complete description of the ASP hierarchy.
 */
@SuppressWarnings("serial")
public final class AspWeakConstraint extends AspStatement
{

  private final ImmutableList<AspLiteral> body;
  private final AspTerm                   weight;
  private final AspTerm                   level;
  private final ImmutableList<AspTerm>    terms;
  private transient Boolean               ground;

  AspWeakConstraint(List<AspLiteral> body, AspTerm weight, AspTerm level, List<AspTerm> terms)
  {
    this.body = ImmutableList.copyOf(body);
    this.weight = weight;
    this.level = level;
    this.terms = ImmutableList.copyOf(terms);
    ground = null;
  }

  @Override
  public List<AspLiteral> getBody()
  {
    return body;
  }

  public AspTerm getWeight()
  {
    return weight;
  }

  public AspTerm getLevel()
  {
    return level;
  }

  public List<AspTerm> getTerms()
  {
    return terms;
  }

  @Override
  public boolean isGround()
  {
    if (ground == null)
    {
      boolean result = weight.isGround() && level.isGround();
      for (AspTerm term : terms)
      {
        result &= term.isGround();
      }
      for (AspLiteral literal : body)
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
    if (!(other instanceof AspWeakConstraint))
    {
      return false;
    }
    AspWeakConstraint constraint = (AspWeakConstraint)other;
    return body.equals(constraint.body) &&
           weight.equals(constraint.weight) &&
           level.equals(constraint.level) &&
           terms.equals(constraint.terms);
  }

  @Override
  public int hashCode()
  {
    return ((body.hashCode() * 31 + weight.hashCode()) * 31 + level.hashCode()) * 31 + terms.hashCode();
  }

  @Override
  public String toString()
  {
    StringBuilder sb = new StringBuilder(":~ ");
    sb.append(StringUtils.join(body, ", ")).append(". [").append(weight).append("@").append(level);
    for (AspTerm term : terms)
    {
      sb.append(", ").append(term);
    }
    return sb.append("]").toString();
  }

}
