
package org.groundslash.base.util.asp.grammar;

/**
 * A <i>guard</i> bounds an aggregate or choice: a relational operator plus a bound term.  Whether the guard is on the
 * left (<code>1 &lt;= #count{...}</code>) or the right (<code>#count{...} &lt;= 2</code>) is recorded by the
 * owning aggregate or choice, not by the guard itself.
 *
 * See {@link Asp} for a complete description of the ASP hierarchy.
 */
@SuppressWarnings("serial")
public final class AspGuard extends Asp
{

  private final AspRelationalOperator operator;
  private final AspTerm               bound;

  AspGuard(AspRelationalOperator operator, AspTerm bound)
  {
    this.operator = operator;
    this.bound = bound;
  }

  public AspRelationalOperator getOperator()
  {
    return operator;
  }

  public AspTerm getBound()
  {
    return bound;
  }

  @Override
  public boolean isGround()
  {
    return bound.isGround();
  }

  @Override
  public boolean equals(Object other)
  {
    if (!(other instanceof AspGuard))
    {
      return false;
    }
    AspGuard guard = (AspGuard)other;
    return operator == guard.operator && bound.equals(guard.bound);
  }

  @Override
  public int hashCode()
  {
    return operator.hashCode() * 31 + bound.hashCode();
  }

  /**
   * @return the guard as it is written on the left of an aggregate, e.g. "1 <=".
   */
  public String toLeftString()
  {
    return bound + " " + operator;
  }

  /**
   * @return the guard as it is written on the right of an aggregate, e.g. "<= 2".
   */
  public String toRightString()
  {
    return operator + " " + bound;
  }

  @Override
  public String toString()
  {
    return toRightString();
  }

}
