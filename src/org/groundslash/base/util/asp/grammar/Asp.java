
package org.groundslash.base.util.asp.grammar;

import java.io.Serializable;

/**
 * Class at the root of the ASP hierarchy.  All parts of a program handed to the grounder are represented by objects
 * that are part of this hierarchy.
 *
 * <h1>The ASP hierarchy</h1>
 *
 * <ul>
 *
 * <li><b>Statement</b>: A top-level unit of a program.  Either a <i>rule</i> (a <i>head</i> and a <i>body</i>) or a
 *     <i>weak constraint</i> (a body plus a weight, a level and a tuple of terms).<ul>
 *
 *   <li><b>Fact</b>: A rule with a ground, single-atom head and an empty body.
 *
 *   <li><b>Constraint</b>: A rule with an empty head (an empty disjunction).</ul>
 *
 * <li><b>Head</b>: What a rule concludes.  A <i>disjunction</i> of atoms (a normal rule has exactly one), a
 *     <i>choice</i> or an <i>NPP declaration</i>.
 *
 * <li><b>Literal</b>: A condition in a rule body.  This can be an <i>atom</i>, a <i>not</i> (default negation of an
 *     atom or aggregate), a builtin <i>comparison</i> or an <i>aggregate</i>.<ul>
 *
 *   <li><b>Atom</b>: A predicate name plus (optionally) a body of <i>terms</i>, possibly classically negated
 *       (written <code>-p(...)</code>).
 *
 *   <li><b>Aggregate</b>: <code>#count</code>, <code>#sum</code>, <code>#max</code> or <code>#min</code> over a set of
 *       <i>elements</i>, each a tuple of terms plus a condition, with optional left and right <i>guards</i>.</ul>
 *
 * <li><b>Term</b>: What fills one "slot" of an atom.  A <i>number</i>, <i>string</i>, symbolic <i>constant</i>,
 *     <i>variable</i>, <i>anonymous variable</i>, <i>function</i> or <i>arithmetic</i> term.
 *
 * </ul>
 *
 * <h1>Other terms</h1>
 *
 * <ul>
 *   <li><b>Ground</b>: An ASP object is <i>ground</i> if it contains no variables.  Ground arithmetic is not
 *       necessarily reduced - see {@link org.groundslash.base.util.asp.ArithmeticEvaluator}.
 *   <li><b>Signature</b>: The name, arity and classical-negation flag of an atom.  Two atoms belong to the same
 *       predicate if and only if they have the same signature.
 * </ul>
 *
 * All objects are immutable and are obtained through {@link AspPool}, which guarantees that structurally equal objects
 * are also identical.
 */
@SuppressWarnings("serial")
public abstract class Asp implements Serializable
{
  Asp()
  {
  }

  /**
   * @return whether this ASP object is in ground form - i.e. variable-free.
   */
  public abstract boolean isGround();

  @Override
  public abstract String toString();

  /**
   * This method is used by deserialization to ensure that Asp objects loaded
   * from an ObjectInputStream are the versions that exist in the AspPool.
   */
  protected Object readResolve()
  {
    return AspPool.immerse(this);
  }

}
