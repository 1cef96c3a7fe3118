
package org.groundslash.base.util.asp.grammar;

import java.util.List;

import org.apache.commons.lang.StringUtils;

import com.google.common.collect.ImmutableList;

/**
 * A <i>disjunction</i> of atoms, written <code>a | b | c</code>.  A normal rule has a disjunction with exactly one
 * atom; a constraint has an empty one.
 *
 * See {@link Asp} for a complete description of the ASP hierarchy.
 */
@SuppressWarnings("serial")
public final class AspDisjunction extends AspHead
{

  private final ImmutableList<AspAtom> atoms;
  private transient Boolean            ground;

  AspDisjunction(List<AspAtom> atoms)
  {
    this.atoms = ImmutableList.copyOf(atoms);
    ground = null;
  }

  @Override
  public List<AspAtom> getAtoms()
  {
    return atoms;
  }

  public boolean isEmpty()
  {
    return atoms.isEmpty();
  }

  @Override
  public boolean isGround()
  {
    if (ground == null)
    {
      boolean result = true;
      for (AspAtom atom : atoms)
      {
        result &= atom.isGround();
      }
      ground = result;
    }

    return ground;
  }

  @Override
  public boolean equals(Object other)
  {
    return (other instanceof AspDisjunction) && ((AspDisjunction)other).atoms.equals(atoms);
  }

  @Override
  public int hashCode()
  {
    return atoms.hashCode() + 11;
  }

  @Override
  public String toString()
  {
    return StringUtils.join(atoms, " | ");
  }

}
