
package org.groundslash.base.util.asp.grammar;

/**
 * A builtin <i>comparison</i> between two terms, e.g. <code>X&lt;Y</code>.  Comparisons never bind variables; they
 * only filter substitutions.
 *
 * See {@link Asp} for a complete description of the ASP hierarchy.
 */
@SuppressWarnings("serial")
public final class AspComparison extends AspLiteral
{

  private final AspRelationalOperator operator;
  private final AspTerm               left;
  private final AspTerm               right;

  AspComparison(AspRelationalOperator operator, AspTerm left, AspTerm right)
  {
    this.operator = operator;
    this.left = left;
    this.right = right;
  }

  public AspRelationalOperator getOperator()
  {
    return operator;
  }

  public AspTerm getLeft()
  {
    return left;
  }

  public AspTerm getRight()
  {
    return right;
  }

  @Override
  public boolean isGround()
  {
    return left.isGround() && right.isGround();
  }

  @Override
  public boolean equals(Object other)
  {
    if (!(other instanceof AspComparison))
    {
      return false;
    }
    AspComparison comparison = (AspComparison)other;
    return operator == comparison.operator && left.equals(comparison.left) && right.equals(comparison.right);
  }

  @Override
  public int hashCode()
  {
    return (operator.hashCode() * 31 + left.hashCode()) * 31 + right.hashCode();
  }

  @Override
  public String toString()
  {
    return left.toString() + operator + right;
  }

}
