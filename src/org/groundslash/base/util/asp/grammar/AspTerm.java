
package org.groundslash.base.util.asp.grammar;

/**
 * A term is a <i>number</i>, <i>string</i>, <i>constant</i>, <i>variable</i>, <i>anonymous variable</i>,
 * <i>function</i> or <i>arithmetic</i> term.  It's what fills one "slot" in the body of an <i>atom</i>.
 *
 * See {@link Asp} for a complete description of the ASP hierarchy.
 */
@SuppressWarnings("serial")
public abstract class AspTerm extends Asp
{
  AspTerm()
  {
  }

  /**
   * @return the rank of this kind of term in the total order over ground terms.  Numbers precede strings, which
   *         precede constants, which precede functions.
   */
  public abstract int orderRank();
}
