
package org.groundslash.base.util.asp.grammar;

import java.util.List;

import org.apache.commons.lang.StringUtils;

import com.google.common.collect.ImmutableList;

/**
 * A <i>choice element</i>: an atom plus a condition, written <code>p(X) : q(X)</code>.
 *
 * See {@link Asp} for a complete description of the ASP hierarchy.
 */
@SuppressWarnings("serial")
public final class AspChoiceElement extends Asp
{

  private final AspAtom                   atom;
  private final ImmutableList<AspLiteral> condition;
  private transient Boolean               ground;

  AspChoiceElement(AspAtom atom, List<AspLiteral> condition)
  {
    this.atom = atom;
    this.condition = ImmutableList.copyOf(condition);
    ground = null;
  }

  public AspAtom getAtom()
  {
    return atom;
  }

  public List<AspLiteral> getCondition()
  {
    return condition;
  }

  @Override
  public boolean isGround()
  {
    if (ground == null)
    {
      boolean result = atom.isGround();
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
    if (!(other instanceof AspChoiceElement))
    {
      return false;
    }
    AspChoiceElement element = (AspChoiceElement)other;
    return atom.equals(element.atom) && condition.equals(element.condition);
  }

  @Override
  public int hashCode()
  {
    return atom.hashCode() * 31 + condition.hashCode();
  }

  @Override
  public String toString()
  {
    if (condition.isEmpty())
    {
      return atom.toString();
    }
    return atom + ":" + StringUtils.join(condition, ",");
  }

}
