
package org.groundslash.base.util.asp.grammar;

import java.util.List;

import org.apache.commons.lang.StringUtils;

import com.google.common.collect.ImmutableList;

/**
 * A <i>rule</i>: a <i>head</i> that holds whenever every literal of the <i>body</i> holds.  Facts have an empty body;
 * constraints have an empty disjunction as their head.
 *
 * See {@link Asp} for a complete description of the ASP hierarchy.
 */
@SuppressWarnings("serial")
public final class AspRule extends AspStatement
{

  private final AspHead                   head;
  private final ImmutableList<AspLiteral> body;
  private transient Boolean               ground;

  AspRule(AspHead head, List<AspLiteral> body)
  {
    this.head = head;
    this.body = ImmutableList.copyOf(body);
    ground = null;
  }

  public AspHead getHead()
  {
    return head;
  }

  @Override
  public List<AspLiteral> getBody()
  {
    return body;
  }

  public int arity()
  {
    return body.size();
  }

  /**
   * @return whether this rule is a constraint (i.e. it has an empty head).
   */
  public boolean isConstraint()
  {
    return (head instanceof AspDisjunction) && ((AspDisjunction)head).isEmpty();
  }

  /**
   * @return whether this rule is a fact: a single ground atom with no body.
   */
  public boolean isFact()
  {
    return body.isEmpty() && (head instanceof AspDisjunction) && (head.getAtoms().size() == 1) && head.isGround();
  }

  @Override
  public boolean isGround()
  {
    if (ground == null)
    {
      boolean result = head.isGround();
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
    if (!(other instanceof AspRule))
    {
      return false;
    }
    AspRule rule = (AspRule)other;
    return head.equals(rule.head) && body.equals(rule.body);
  }

  @Override
  public int hashCode()
  {
    return head.hashCode() * 31 + body.hashCode();
  }

  @Override
  public String toString()
  {
    if (isConstraint())
    {
      return ":- " + StringUtils.join(body, ", ") + ".";
    }
    if (body.isEmpty())
    {
      return head + ".";
    }
    return head + " :- " + StringUtils.join(body, ", ") + ".";
  }

}
