
package org.groundslash.base.util.grounder.exceptions;

import org.groundslash.base.util.asp.grammar.AspStatement;
import org.groundslash.base.util.asp.grammar.AspVariable;

/**
 * A statement uses a variable that no positive body atom binds.
 */
public class UnsafeVariableException extends GroundingException
{
  private static final long serialVersionUID = 1L;

  private final AspVariable mVariable;

  public UnsafeVariableException(AspVariable xiVariable, AspStatement xiStatement)
  {
    super("Unsafe variable " + xiVariable, xiStatement);
    mVariable = xiVariable;
  }

  public AspVariable getVariable()
  {
    return mVariable;
  }
}
