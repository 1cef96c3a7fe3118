
package org.groundslash.base.util.asp;

import org.groundslash.base.util.asp.grammar.AspArithmetic;
import org.groundslash.base.util.asp.grammar.AspAtom;
import org.groundslash.base.util.asp.grammar.AspFunction;
import org.groundslash.base.util.asp.grammar.AspTerm;
import org.groundslash.base.util.asp.grammar.AspVariable;
import org.groundslash.base.util.grounder.exceptions.UndefinedArithmeticException;

/**
 * One-way matching of a (possibly non-ground) pattern against a ground target.  Unlike unification, only the
 * pattern's variables are ever bound, and the target is never inspected for variables.
 *
 * Arithmetic positions are compared once the substitution makes them ground.  An arithmetic position whose variables
 * are bound elsewhere (e.g. by a later atom of the same body) is accepted provisionally; callers must check the fully
 * substituted pattern again before relying on the match.
 */
public final class AspMatcher
{
  private AspMatcher()
  {
  }

  /**
   * @return the extension of the given substitution that maps the pattern to the target, or null if there is none.
   *
   * @param pattern - the atom to match.
   * @param target  - a ground atom.
   * @param subst   - the bindings made so far.
   */
  public static Substitution match(AspAtom pattern, AspAtom target, Substitution subst)
    throws UndefinedArithmeticException
  {
    if ((pattern.isNegated() != target.isNegated()) ||
        (pattern.arity() != target.arity()) ||
        !pattern.getName().equals(target.getName()))
    {
      return null;
    }

    // Bind plain positions first, so that arithmetic positions can use the bindings.
    Substitution result = subst;
    for (int i = 0; (i < pattern.arity()) && (result != null); i++)
    {
      if (!(pattern.get(i) instanceof AspArithmetic))
      {
        result = match(pattern.get(i), target.get(i), result);
      }
    }
    for (int i = 0; (i < pattern.arity()) && (result != null); i++)
    {
      if (pattern.get(i) instanceof AspArithmetic)
      {
        result = match(pattern.get(i), target.get(i), result);
      }
    }
    return result;
  }

  public static Substitution match(AspTerm pattern, AspTerm target, Substitution subst)
    throws UndefinedArithmeticException
  {
    if (pattern.isGround())
    {
      return ArithmeticEvaluator.reduce(pattern).equals(target) ? subst : null;
    }

    if (pattern instanceof AspVariable)
    {
      AspVariable variable = (AspVariable)pattern;
      AspTerm bound = subst.get(variable);
      if (bound == null)
      {
        return subst.extend(variable, target);
      }
      return bound.equals(target) ? subst : null;
    }
    else if (pattern instanceof AspFunction)
    {
      if (!(target instanceof AspFunction))
      {
        return null;
      }
      AspFunction patternFunction = (AspFunction)pattern;
      AspFunction targetFunction = (AspFunction)target;
      if ((patternFunction.arity() != targetFunction.arity()) ||
          !patternFunction.getName().equals(targetFunction.getName()))
      {
        return null;
      }
      Substitution result = subst;
      for (int i = 0; (i < patternFunction.arity()) && (result != null); i++)
      {
        result = match(patternFunction.get(i), targetFunction.get(i), result);
      }
      return result;
    }
    else if (pattern instanceof AspArithmetic)
    {
      AspTerm substituted = subst.apply(pattern);
      if (!substituted.isGround())
      {
        return subst;
      }
      return ArithmeticEvaluator.reduce(substituted).equals(target) ? subst : null;
    }
    throw new RuntimeException("Unwanted AspTerm type");
  }
}
