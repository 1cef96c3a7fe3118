
package org.groundslash.base.util.grounder;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.groundslash.base.util.asp.grammar.AspAtom;
import org.groundslash.base.util.asp.grammar.AspSignature;
import org.groundslash.base.util.grounder.exceptions.NonTerminationGuardException;

import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;

/**
 * The mutable state of a single grounding run.  One context is created per call to
 * {@link Grounder#ground(org.groundslash.base.util.asp.grammar.AspProgram, GroundingLimits)} and is never shared.
 *
 * Both atom sets only ever grow.  Every certain atom is also possible.
 */
public final class GroundingContext
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final SetMultimap<AspSignature, AspAtom> mPossible  = LinkedHashMultimap.create();
  private final Set<AspAtom>                       mCertain   = new LinkedHashSet<>();
  private final Set<AspSignature>                  mCompleted = new LinkedHashSet<>();
  private final GroundProgramAssembler             mAssembler = new GroundProgramAssembler();

  private final GroundingLimits mLimits;
  private final boolean         mSimplifyCertainNegation;
  private final long            mStartTime;
  private int                   mPasses;

  public GroundingContext(GroundingLimits xiLimits, boolean xiSimplifyCertainNegation)
  {
    mLimits = xiLimits;
    mSimplifyCertainNegation = xiSimplifyCertainNegation;
    mStartTime = System.currentTimeMillis();
  }

  /**
   * @return whether the atom is possible, i.e. some (emitted or yet to be emitted) ground rule may derive it.
   */
  public boolean isPossible(AspAtom xiAtom)
  {
    return mPossible.containsEntry(xiAtom.getSignature(), xiAtom);
  }

  /**
   * @return the possible atoms with the given signature, in the order they were derived.
   */
  public Collection<AspAtom> getPossible(AspSignature xiSignature)
  {
    return mPossible.get(xiSignature);
  }

  public Collection<AspAtom> getAllPossible()
  {
    return mPossible.values();
  }

  /**
   * @return whether the atom was added (i.e. it wasn't already possible).
   */
  public boolean addPossible(AspAtom xiAtom)
  {
    return mPossible.put(xiAtom.getSignature(), xiAtom);
  }

  public boolean isCertain(AspAtom xiAtom)
  {
    return mCertain.contains(xiAtom);
  }

  public Set<AspAtom> getCertain()
  {
    return mCertain;
  }

  /**
   * Record an atom as certainly true (which also makes it possible).
   *
   * @return whether either atom set changed.
   */
  public boolean addCertain(AspAtom xiAtom)
  {
    boolean lChanged = addPossible(xiAtom);
    return mCertain.add(xiAtom) || lChanged;
  }

  /**
   * @return whether every rule that can derive atoms with this signature has already been grounded to a fixpoint.
   */
  public boolean isCompleted(AspSignature xiSignature)
  {
    return mCompleted.contains(xiSignature);
  }

  public void markCompleted(Collection<AspSignature> xiSignatures)
  {
    mCompleted.addAll(xiSignatures);
  }

  public boolean simplifyCertainNegation()
  {
    return mSimplifyCertainNegation;
  }

  public GroundProgramAssembler getAssembler()
  {
    return mAssembler;
  }

  /**
   * Account for the start of another fixpoint pass.
   *
   * @throws NonTerminationGuardException if the pass or time budget is exhausted.
   */
  public void startPass() throws NonTerminationGuardException
  {
    mPasses++;
    if (mLimits.hasPassLimit() && (mPasses > mLimits.getMaxPasses()))
    {
      LOGGER.warn("Abandoning grounding after " + mLimits.getMaxPasses() + " passes");
      throw new NonTerminationGuardException("Pass limit of " + mLimits.getMaxPasses() + " exceeded");
    }
    checkDeadline();
  }

  /**
   * @throws NonTerminationGuardException if the time budget is exhausted.
   */
  public void checkDeadline() throws NonTerminationGuardException
  {
    if (mLimits.hasTimeLimit() && (System.currentTimeMillis() - mStartTime > mLimits.getTimeLimitMillis()))
    {
      LOGGER.warn("Abandoning grounding after " + mLimits.getTimeLimitMillis() + "ms");
      throw new NonTerminationGuardException("Time limit of " + mLimits.getTimeLimitMillis() + "ms exceeded");
    }
  }

  public int getPasses()
  {
    return mPasses;
  }
}
