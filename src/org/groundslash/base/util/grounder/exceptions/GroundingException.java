
package org.groundslash.base.util.grounder.exceptions;

import java.util.Optional;

import org.groundslash.base.util.asp.grammar.AspStatement;

/**
 * Abstract class for exceptions that abort a grounding run.  No partial ground program is ever returned alongside one
 * of these.
 */
public abstract class GroundingException extends Exception
{
  private static final long serialVersionUID = 1L;

  private final AspStatement mStatement;

  protected GroundingException(String xiMessage, AspStatement xiStatement)
  {
    super(xiStatement == null ? xiMessage : xiMessage + " in statement: " + xiStatement);
    mStatement = xiStatement;
  }

  /**
   * @return the statement that caused the failure, where there is one.
   */
  public Optional<AspStatement> getStatement()
  {
    return Optional.ofNullable(mStatement);
  }
}
