
package org.groundslash.base.util.grounder.exceptions;

import org.groundslash.base.util.asp.grammar.AspStatement;

/**
 * An NPP declaration disagrees with another declaration, or with some other use of its output predicate, over the
 * number of arguments.
 */
public class NppArityMismatchException extends GroundingException
{
  private static final long serialVersionUID = 1L;

  public NppArityMismatchException(String xiPredicate, int xiExpected, int xiActual, AspStatement xiStatement)
  {
    super("Predicate " + xiPredicate + " used with arity " + xiActual + " but its NPP declaration implies " +
          xiExpected, xiStatement);
  }
}
