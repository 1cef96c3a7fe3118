
package org.groundslash.base.util.asp.grammar;

import java.util.List;

/**
 * The <i>head</i> of a rule: a <i>disjunction</i> of atoms (empty for a constraint, a single atom for a normal rule),
 * a <i>choice</i> or an <i>NPP declaration</i>.
 *
 * See {@link Asp} for a complete description of the ASP hierarchy.
 */
@SuppressWarnings("serial")
public abstract class AspHead extends Asp
{
  AspHead()
  {
  }

  /**
   * @return the atoms this head can make true.  For a choice these are the element atoms (whose conditions are
   *         ignored) and for an NPP declaration one atom per outcome.
   */
  public abstract List<AspAtom> getAtoms();
}
