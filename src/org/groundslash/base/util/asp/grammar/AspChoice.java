
package org.groundslash.base.util.asp.grammar;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.apache.commons.lang.StringUtils;

import com.google.common.collect.ImmutableList;

/**
 * A <i>choice</i> head, e.g. <code>1 &lt;= { p(X) : q(X) } &lt;= 2</code>.  Any subset of the element atoms (within
 * the optional cardinality bounds) may hold.  An absent guard means "no bound on that side".
 *
 * See {@link Asp} for a complete description of the ASP hierarchy.
 */
@SuppressWarnings("serial")
public final class AspChoice extends AspHead
{

  private final ImmutableList<AspChoiceElement> elements;
  private final AspGuard                        leftGuard;
  private final AspGuard                        rightGuard;
  private transient Boolean                     ground;

  AspChoice(List<AspChoiceElement> elements, AspGuard leftGuard, AspGuard rightGuard)
  {
    this.elements = ImmutableList.copyOf(elements);
    this.leftGuard = leftGuard;
    this.rightGuard = rightGuard;
    ground = null;
  }

  public List<AspChoiceElement> getElements()
  {
    return elements;
  }

  public Optional<AspGuard> getLeftGuard()
  {
    return Optional.ofNullable(leftGuard);
  }

  public Optional<AspGuard> getRightGuard()
  {
    return Optional.ofNullable(rightGuard);
  }

  @Override
  public List<AspAtom> getAtoms()
  {
    List<AspAtom> atoms = new ArrayList<>(elements.size());
    for (AspChoiceElement element : elements)
    {
      atoms.add(element.getAtom());
    }
    return atoms;
  }

  @Override
  public boolean isGround()
  {
    if (ground == null)
    {
      boolean result = ((leftGuard == null) || leftGuard.isGround()) &&
                       ((rightGuard == null) || rightGuard.isGround());
      for (AspChoiceElement element : elements)
      {
        result &= element.isGround();
      }
      ground = result;
    }

    return ground;
  }

  @Override
  public boolean equals(Object other)
  {
    if (!(other instanceof AspChoice))
    {
      return false;
    }
    AspChoice choice = (AspChoice)other;
    return elements.equals(choice.elements) &&
           Optional.ofNullable(leftGuard).equals(choice.getLeftGuard()) &&
           Optional.ofNullable(rightGuard).equals(choice.getRightGuard());
  }

  @Override
  public int hashCode()
  {
    int result = elements.hashCode();
    result = result * 31 + (leftGuard == null ? 0 : leftGuard.hashCode());
    return result * 31 + (rightGuard == null ? 0 : rightGuard.hashCode());
  }

  @Override
  public String toString()
  {
    StringBuilder sb = new StringBuilder();
    if (leftGuard != null)
    {
      sb.append(leftGuard.toLeftString()).append(" ");
    }
    sb.append("{").append(StringUtils.join(elements, ";")).append("}");
    if (rightGuard != null)
    {
      sb.append(" ").append(rightGuard.toRightString());
    }
    return sb.toString();
  }

}
