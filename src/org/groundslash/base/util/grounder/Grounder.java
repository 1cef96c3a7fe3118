
package org.groundslash.base.util.grounder;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.groundslash.base.util.asp.ArithmeticEvaluator;
import org.groundslash.base.util.asp.AspMatcher;
import org.groundslash.base.util.asp.Substitution;
import org.groundslash.base.util.asp.grammar.AspAtom;
import org.groundslash.base.util.asp.grammar.AspProgram;
import org.groundslash.base.util.asp.grammar.AspRule;
import org.groundslash.base.util.asp.grammar.AspStatement;
import org.groundslash.base.util.grounder.GrounderConfiguration.CfgItem;
import org.groundslash.base.util.grounder.exceptions.GroundingException;

/**
 * Translates a program into an equivalent variable-free program.
 *
 * <ol>
 * <li>Every statement is checked for safety, and NPP declarations for consistent arity.</li>
 * <li>The predicates are split into dependency components, in evaluation order.</li>
 * <li>Each component's rules are instantiated over and over until a pass derives no new atom.  The instances of that
 *     last pass are emitted and the component's predicates are marked complete.</li>
 * <li>Constraints and weak constraints are instantiated once, against the final atom sets.</li>
 * </ol>
 *
 * Either the complete ground program is returned or an exception is thrown - never anything in between.
 */
public final class Grounder
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final AspProgram       mProgram;
  private final GroundingContext mContext;
  private final Instantiator     mInstantiator;

  private Grounder(AspProgram xiProgram, GroundingLimits xiLimits)
  {
    mProgram = xiProgram;
    mContext = new GroundingContext(xiLimits, GrounderConfiguration.getCfgBool(CfgItem.SIMPLIFY_CERTAIN_NEGATION));
    mInstantiator = new Instantiator(mContext);
  }

  /**
   * Ground a program within the limits set by the grounder configuration.
   */
  public static GroundProgram ground(AspProgram xiProgram) throws GroundingException
  {
    return ground(xiProgram, GroundingLimits.fromConfiguration());
  }

  /**
   * Ground a program within the given limits.
   *
   * @param xiProgram - the program.
   * @param xiLimits  - pass and time budget for the run.
   *
   * @return the ground program.
   * @throws GroundingException if the program is invalid or the budget is exceeded.
   */
  public static GroundProgram ground(AspProgram xiProgram, GroundingLimits xiLimits) throws GroundingException
  {
    return new Grounder(xiProgram, xiLimits).run();
  }

  private GroundProgram run() throws GroundingException
  {
    long lStartTime = System.currentTimeMillis();
    List<AspStatement> lStatements = mProgram.getStatements();
    LOGGER.debug("Grounding " + lStatements.size() + " statements");

    SafetyChecker.check(mProgram);
    NppGrounder.validate(mProgram);

    Stratification lStratification = DependencyStratifier.stratify(lStatements);
    if (!lStratification.isStratified())
    {
      LOGGER.debug("Program is not stratified");
    }

    mContext.markCompleted(lStratification.getUndefined());
    for (Stratification.Component lComponent : lStratification.getComponents())
    {
      groundComponent(lComponent, lStatements);
    }

    GroundProgramAssembler lAssembler = mContext.getAssembler();
    for (int lIndex : lStratification.getHeadless())
    {
      AspStatement lStatement = lStatements.get(lIndex);
      for (AspStatement lInstance : mInstantiator.instantiate(lStatement))
      {
        if ((lInstance instanceof AspRule) &&
            ((AspRule)lInstance).isConstraint() &&
            mInstantiator.isBodyCertain(lInstance.getBody()))
        {
          LOGGER.warn("Constraint instance " + lInstance + " is violated in every answer set");
        }
        lAssembler.add(lIndex, lInstance);
      }
    }

    AspAtom lQuery = mProgram.getQuery().orElse(null);
    Set<AspAtom> lAnswers = answer(lQuery);

    GroundProgram lResult = new GroundProgram(lAssembler.freeze(),
                                              new LinkedHashSet<>(mContext.getAllPossible()),
                                              mContext.getCertain(),
                                              lQuery,
                                              lAnswers,
                                              mContext.getPasses(),
                                              lStratification.getComponents().size());
    LOGGER.info("Grounded " + lStatements.size() + " statements into " + lResult.getStatements().size() +
                " in " + (System.currentTimeMillis() - lStartTime) + "ms (" + lResult.getComponents() +
                " components, " + mContext.getPasses() + " passes)");
    return lResult;
  }

  private void groundComponent(Stratification.Component xiComponent, List<AspStatement> xiStatements)
    throws GroundingException
  {
    LOGGER.debug("Grounding component " + xiComponent);
    List<List<AspStatement>> lInstances;
    boolean lChanged;
    int lPasses = 0;
    do
    {
      mContext.startPass();
      lPasses++;
      lChanged = false;
      lInstances = new ArrayList<>(xiComponent.getStatements().size());
      for (int lIndex : xiComponent.getStatements())
      {
        mContext.checkDeadline();
        List<AspStatement> lRuleInstances = mInstantiator.instantiate(xiStatements.get(lIndex));
        lInstances.add(lRuleInstances);
        for (AspStatement lInstance : lRuleInstances)
        {
          lChanged |= derive((AspRule)lInstance);
        }
      }
    }
    while (lChanged && xiComponent.isRecursive());

    for (int lii = 0; lii < lInstances.size(); lii++)
    {
      mContext.getAssembler().addAll(xiComponent.getStatements().get(lii), lInstances.get(lii));
    }
    mContext.markCompleted(xiComponent.getSignatures());
    LOGGER.trace("Component converged after " + lPasses + " pass(es)");
  }

  /**
   * Add the atoms a ground rule can derive to the context.
   *
   * @return whether the context changed.
   */
  private boolean derive(AspRule xiInstance)
  {
    boolean lChanged = false;
    AspAtom lCertain = mInstantiator.getCertainHead(xiInstance);
    if (lCertain != null)
    {
      lChanged |= mContext.addCertain(lCertain);
    }
    for (AspAtom lAtom : xiInstance.getHead().getAtoms())
    {
      lChanged |= mContext.addPossible(lAtom);
    }
    return lChanged;
  }

  private Set<AspAtom> answer(AspAtom xiQuery) throws GroundingException
  {
    Set<AspAtom> lAnswers = new LinkedHashSet<>();
    if (xiQuery == null)
    {
      return lAnswers;
    }
    for (AspAtom lCandidate : mContext.getPossible(xiQuery.getSignature()))
    {
      Substitution lMatch = AspMatcher.match(xiQuery, lCandidate, Substitution.EMPTY);
      if ((lMatch != null) && ArithmeticEvaluator.reduce(lMatch.apply(xiQuery)).equals(lCandidate))
      {
        lAnswers.add(lCandidate);
      }
    }
    LOGGER.debug("Query " + xiQuery + " has " + lAnswers.size() + " answer(s)");
    return lAnswers;
  }
}
