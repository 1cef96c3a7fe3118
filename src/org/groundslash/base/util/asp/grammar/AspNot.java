
package org.groundslash.base.util.asp.grammar;

/**
 * A <i>not</i> is a default-negated <i>atom</i> or <i>aggregate</i>.
 *
 * See {@link Asp} for a complete description of the ASP hierarchy.
 */
@SuppressWarnings("serial")
public final class AspNot extends AspLiteral
{

  private final AspLiteral  body;
  private transient Boolean ground;

  AspNot(AspLiteral body)
  {
    if (!(body instanceof AspAtom) && !(body instanceof AspAggregate))
    {
      throw new IllegalArgumentException("Only atoms and aggregates can be default-negated: " + body);
    }
    this.body = body;
    ground = null;
  }

  public AspLiteral getBody()
  {
    return body;
  }

  @Override
  public boolean isGround()
  {
    if (ground == null)
    {
      ground = body.isGround();
    }

    return ground;
  }

  @Override
  public boolean equals(Object other)
  {
    return (other instanceof AspNot) && ((AspNot)other).body.equals(body);
  }

  @Override
  public int hashCode()
  {
    return 7 * body.hashCode() + 3;
  }

  @Override
  public String toString()
  {
    return "not " + body;
  }

}
