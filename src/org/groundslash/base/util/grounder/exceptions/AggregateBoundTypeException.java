
package org.groundslash.base.util.grounder.exceptions;

import org.groundslash.base.util.asp.grammar.AspStatement;
import org.groundslash.base.util.asp.grammar.AspTerm;

/**
 * A #count / #sum aggregate or a choice has a ground bound that is not a number.
 */
public class AggregateBoundTypeException extends GroundingException
{
  private static final long serialVersionUID = 1L;

  private final AspTerm mBound;

  public AggregateBoundTypeException(AspTerm xiBound, AspStatement xiStatement)
  {
    super("Non-numeric bound " + xiBound, xiStatement);
    mBound = xiBound;
  }

  public AspTerm getBound()
  {
    return mBound;
  }
}
