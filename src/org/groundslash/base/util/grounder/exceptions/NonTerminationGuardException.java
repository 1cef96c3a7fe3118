
package org.groundslash.base.util.grounder.exceptions;

/**
 * Grounding exceeded the caller's pass or wall-clock budget.
 */
public class NonTerminationGuardException extends GroundingException
{
  private static final long serialVersionUID = 1L;

  public NonTerminationGuardException(String xiMessage)
  {
    super(xiMessage, null);
  }
}
