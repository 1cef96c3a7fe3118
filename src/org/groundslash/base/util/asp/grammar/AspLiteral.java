
package org.groundslash.base.util.asp.grammar;

/**
 * A <i>literal</i> is a condition in a <i>rule</i> body (or in the condition of an aggregate or choice element).  This
 * can be an <i>atom</i>, a <i>not</i>, a builtin <i>comparison</i> or an <i>aggregate</i>.
 *
 * See {@link Asp} for a complete description of the ASP hierarchy.
 */
@SuppressWarnings("serial")
public abstract class AspLiteral extends Asp
{
  AspLiteral()
  {
  }

  /* Placeholder ancestor class of AspAtom, AspNot, AspComparison and AspAggregate. */
}
