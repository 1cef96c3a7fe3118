
package org.groundslash.base.util.asp.grammar;

import java.util.List;

import org.apache.commons.lang.StringUtils;

import com.google.common.collect.ImmutableList;

/**
 * An <i>atom</i> is something that can be true or false in an answer set.  It is made up of a name (which is a
 * <i>constant</i>), (optionally) a body consisting of <i>terms</i> and a classical-negation flag.  An atom with no
 * body is written without parentheses.
 *
 * See {@link Asp} for a complete description of the ASP hierarchy.
 */
@SuppressWarnings("serial")
public final class AspAtom extends AspLiteral
{

  private final AspConstant            name;
  private final ImmutableList<AspTerm> body;
  private final boolean                negated;
  private transient Boolean            ground;

  AspAtom(AspConstant name, List<AspTerm> body, boolean negated)
  {
    this.name = name;
    this.body = ImmutableList.copyOf(body);
    this.negated = negated;
    ground = null;
  }

  public int arity()
  {
    return body.size();
  }

  public AspTerm get(int index)
  {
    return body.get(index);
  }

  public AspConstant getName()
  {
    return name;
  }

  public List<AspTerm> getBody()
  {
    return body;
  }

  /**
   * @return whether this is a classically negated atom (written <code>-p(...)</code>).
   */
  public boolean isNegated()
  {
    return negated;
  }

  public AspSignature getSignature()
  {
    return new AspSignature(name, body.size(), negated);
  }

  @Override
  public boolean isGround()
  {
    if (ground == null)
    {
      boolean result = true;
      for (AspTerm term : body)
      {
        if (!term.isGround())
        {
          result = false;
          break;
        }
      }
      ground = result;
    }

    return ground;
  }

  @Override
  public boolean equals(Object other)
  {
    if (!(other instanceof AspAtom))
    {
      return false;
    }
    AspAtom atom = (AspAtom)other;
    return negated == atom.negated && name.equals(atom.name) && body.equals(atom.body);
  }

  @Override
  public int hashCode()
  {
    return (31 * name.hashCode() + body.hashCode()) * 2 + (negated ? 1 : 0);
  }

  @Override
  public String toString()
  {
    String prefix = negated ? "-" : "";
    if (body.isEmpty())
    {
      return prefix + name;
    }
    return prefix + name + "(" + StringUtils.join(body, ",") + ")";
  }

}
