
package org.groundslash.base.util.asp.grammar;

import java.util.List;

import org.apache.commons.lang.StringUtils;

import com.google.common.collect.ImmutableList;

/**
 * A <i>function</i> is a complex <i>term</i> that contains other <i>terms</i>.  It has a name (which is a
 * <i>constant</i>) and a body consisting of other <i>terms</i>, much like an <i>atom</i>.  Unlike an <i>atom</i>,
 * however, it does not have a truth value.  Functions are structural: they are never evaluated.
 *
 * See {@link Asp} for a complete description of the ASP hierarchy.
 */
@SuppressWarnings("serial")
public final class AspFunction extends AspTerm
{

  private final ImmutableList<AspTerm> body;
  private transient Boolean            ground;
  private final AspConstant            name;

  AspFunction(AspConstant name, List<AspTerm> body)
  {
    this.name = name;
    this.body = ImmutableList.copyOf(body);
    ground = null;
  }

  public int arity()
  {
    return body.size();
  }

  private boolean computeGround()
  {
    for (AspTerm term : body)
    {
      if (!term.isGround())
      {
        return false;
      }
    }

    return true;
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

  @Override
  public boolean isGround()
  {
    if (ground == null)
    {
      ground = computeGround();
    }

    return ground;
  }

  @Override
  public int orderRank()
  {
    return 3;
  }

  @Override
  public boolean equals(Object other)
  {
    if (!(other instanceof AspFunction))
    {
      return false;
    }
    AspFunction function = (AspFunction)other;
    return name.equals(function.name) && body.equals(function.body);
  }

  @Override
  public int hashCode()
  {
    return 31 * name.hashCode() + body.hashCode();
  }

  @Override
  public String toString()
  {
    return name + "(" + StringUtils.join(body, ",") + ")";
  }

}
