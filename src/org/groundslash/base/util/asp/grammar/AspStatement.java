
package org.groundslash.base.util.asp.grammar;

import java.util.List;

/**
 * A top-level statement of a program: a <i>rule</i> or a <i>weak constraint</i>.
 *
 * See {@link Asp} for a complete description of the ASP hierarchy.
 */
@SuppressWarnings("serial")
public abstract class AspStatement extends Asp
{
  AspStatement()
  {
  }

  public abstract List<AspLiteral> getBody();
}
