
package org.groundslash.base.util.grounder.exceptions;

import org.groundslash.base.util.asp.grammar.AspStatement;
import org.groundslash.base.util.asp.grammar.AspTerm;

/**
 * A ground arithmetic term has no value: division by zero, overflow, or an operand (or #sum weight) that is not a
 * number.
 */
public class UndefinedArithmeticException extends GroundingException
{
  private static final long serialVersionUID = 1L;

  private final String  mReason;
  private final AspTerm mTerm;

  public UndefinedArithmeticException(String xiReason, AspTerm xiTerm)
  {
    this(xiReason, xiTerm, null);
  }

  public UndefinedArithmeticException(String xiReason, AspTerm xiTerm, AspStatement xiStatement)
  {
    super(xiReason + ": " + xiTerm, xiStatement);
    mReason = xiReason;
    mTerm = xiTerm;
  }

  public AspTerm getTerm()
  {
    return mTerm;
  }

  /**
   * @return this exception if it already names a statement, otherwise a copy that names the given one.
   */
  public UndefinedArithmeticException inStatement(AspStatement xiStatement)
  {
    if (getStatement().isPresent())
    {
      return this;
    }
    UndefinedArithmeticException lResult = new UndefinedArithmeticException(mReason, mTerm, xiStatement);
    lResult.setStackTrace(getStackTrace());
    return lResult;
  }
}
