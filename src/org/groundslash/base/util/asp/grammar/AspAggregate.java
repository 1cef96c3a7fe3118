
package org.groundslash.base.util.asp.grammar;

import java.util.List;
import java.util.Optional;

import org.apache.commons.lang.StringUtils;

import com.google.common.collect.ImmutableList;

/**
 * An <i>aggregate</i> literal: a function over a set of <i>elements</i> with optional left and right <i>guards</i>,
 * e.g. <code>1 &lt;= #count{X : p(X)} &lt; 3</code>.  An absent guard means "no bound on that side".
 *
 * The grounder expands the elements of an aggregate but never decides whether the aggregate holds; that is left to
 * the consumer of the ground program.
 *
 * See {@link Asp} for a complete description of the ASP hierarchy.
 */
@SuppressWarnings("serial")
public final class AspAggregate extends AspLiteral
{

  private final AspAggregateFunction               function;
  private final ImmutableList<AspAggregateElement> elements;
  private final AspGuard                           leftGuard;
  private final AspGuard                           rightGuard;
  private transient Boolean                        ground;

  AspAggregate(AspAggregateFunction function,
               List<AspAggregateElement> elements,
               AspGuard leftGuard,
               AspGuard rightGuard)
  {
    this.function = function;
    this.elements = ImmutableList.copyOf(elements);
    this.leftGuard = leftGuard;
    this.rightGuard = rightGuard;
    ground = null;
  }

  public AspAggregateFunction getFunction()
  {
    return function;
  }

  public List<AspAggregateElement> getElements()
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
  public boolean isGround()
  {
    if (ground == null)
    {
      boolean result = ((leftGuard == null) || leftGuard.isGround()) &&
                       ((rightGuard == null) || rightGuard.isGround());
      for (AspAggregateElement element : elements)
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
    if (!(other instanceof AspAggregate))
    {
      return false;
    }
    AspAggregate aggregate = (AspAggregate)other;
    return function == aggregate.function &&
           elements.equals(aggregate.elements) &&
           Optional.ofNullable(leftGuard).equals(aggregate.getLeftGuard()) &&
           Optional.ofNullable(rightGuard).equals(aggregate.getRightGuard());
  }

  @Override
  public int hashCode()
  {
    int result = function.hashCode() * 31 + elements.hashCode();
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
    sb.append(function).append("{").append(StringUtils.join(elements, ";")).append("}");
    if (rightGuard != null)
    {
      sb.append(" ").append(rightGuard.toRightString());
    }
    return sb.toString();
  }

}
