
package org.groundslash.base.util.grounder;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.groundslash.base.util.asp.grammar.AspAggregate;
import org.groundslash.base.util.asp.grammar.AspAggregateElement;
import org.groundslash.base.util.asp.grammar.AspAtom;
import org.groundslash.base.util.asp.grammar.AspChoice;
import org.groundslash.base.util.asp.grammar.AspChoiceElement;
import org.groundslash.base.util.asp.grammar.AspComparison;
import org.groundslash.base.util.asp.grammar.AspDisjunction;
import org.groundslash.base.util.asp.grammar.AspHead;
import org.groundslash.base.util.asp.grammar.AspLiteral;
import org.groundslash.base.util.asp.grammar.AspNot;
import org.groundslash.base.util.asp.grammar.AspNpp;
import org.groundslash.base.util.asp.grammar.AspRule;
import org.groundslash.base.util.asp.grammar.AspSignature;
import org.groundslash.base.util.asp.grammar.AspStatement;

import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;

/**
 * Builds the predicate dependency graph of a program and orders its strongly connected components so that every
 * component comes after the components it depends on.
 *
 * Edges run from each head predicate of a rule to each predicate in its body (including those inside aggregates and
 * element conditions) and are labelled positive or negative.  The predicates in a single disjunctive or choice head
 * depend on one another.  Negative cycles are not rejected: an unstratified component is still grounded as a whole.
 */
public final class DependencyStratifier
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final List<AspStatement>                      mStatements;
  private final Set<AspSignature>                       mNodes    = new LinkedHashSet<>();
  private final SetMultimap<AspSignature, AspSignature> mPositive = LinkedHashMultimap.create();
  private final SetMultimap<AspSignature, AspSignature> mNegative = LinkedHashMultimap.create();
  private final SetMultimap<AspSignature, Integer>      mDefining = LinkedHashMultimap.create();
  private final List<Integer>                           mHeadless = new ArrayList<>();

  private DependencyStratifier(List<AspStatement> xiStatements)
  {
    mStatements = xiStatements;
  }

  /**
   * @return the evaluation order for the given statements.
   */
  public static Stratification stratify(List<AspStatement> xiStatements)
  {
    DependencyStratifier lStratifier = new DependencyStratifier(xiStatements);
    lStratifier.buildGraph();
    return lStratifier.order();
  }

  //---------------------------------------------------------------------------------------------------------------
  // Graph construction
  //---------------------------------------------------------------------------------------------------------------

  private void buildGraph()
  {
    for (int lIndex = 0; lIndex < mStatements.size(); lIndex++)
    {
      AspStatement lStatement = mStatements.get(lIndex);
      Set<AspSignature> lHeads = new LinkedHashSet<>();
      if (lStatement instanceof AspRule)
      {
        lHeads.addAll(headSignatures(((AspRule)lStatement).getHead()));
      }

      if (lHeads.isEmpty())
      {
        mHeadless.add(lIndex);
        addBodyNodes(lStatement.getBody());
        continue;
      }

      mNodes.addAll(lHeads);
      for (AspSignature lHead : lHeads)
      {
        mDefining.put(lHead, lIndex);
        for (AspSignature lOther : lHeads)
        {
          if (!lHead.equals(lOther))
          {
            mPositive.put(lHead, lOther);
          }
        }
      }

      AspHead lHead = ((AspRule)lStatement).getHead();
      if (lHead instanceof AspChoice)
      {
        for (AspChoiceElement lElement : ((AspChoice)lHead).getElements())
        {
          addEdges(lHeads, lElement.getCondition(), false);
        }
      }
      addEdges(lHeads, lStatement.getBody(), false);
    }
  }

  private static Set<AspSignature> headSignatures(AspHead xiHead)
  {
    Set<AspSignature> lSignatures = new LinkedHashSet<>();
    if (xiHead instanceof AspNpp)
    {
      lSignatures.add(((AspNpp)xiHead).getOutputSignature());
    }
    else if ((xiHead instanceof AspDisjunction) || (xiHead instanceof AspChoice))
    {
      for (AspAtom lAtom : xiHead.getAtoms())
      {
        lSignatures.add(lAtom.getSignature());
      }
    }
    else
    {
      throw new RuntimeException("Unwanted AspHead type");
    }
    return lSignatures;
  }

  private void addEdges(Set<AspSignature> xiHeads, List<AspLiteral> xiBody, boolean xiNegated)
  {
    for (AspLiteral lLiteral : xiBody)
    {
      if (lLiteral instanceof AspAtom)
      {
        AspSignature lSignature = ((AspAtom)lLiteral).getSignature();
        mNodes.add(lSignature);
        for (AspSignature lHead : xiHeads)
        {
          (xiNegated ? mNegative : mPositive).put(lHead, lSignature);
        }
      }
      else if (lLiteral instanceof AspNot)
      {
        addEdges(xiHeads, Collections.singletonList(((AspNot)lLiteral).getBody()), true);
      }
      else if (lLiteral instanceof AspAggregate)
      {
        for (AspAggregateElement lElement : ((AspAggregate)lLiteral).getElements())
        {
          addEdges(xiHeads, lElement.getCondition(), xiNegated);
        }
      }
      else if (!(lLiteral instanceof AspComparison))
      {
        throw new RuntimeException("Unwanted AspLiteral type");
      }
    }
  }

  private void addBodyNodes(List<AspLiteral> xiBody)
  {
    addEdges(new HashSet<AspSignature>(), xiBody, false);
  }

  //---------------------------------------------------------------------------------------------------------------
  // Ordering (iterative Tarjan)
  //---------------------------------------------------------------------------------------------------------------

  private Set<AspSignature> successors(AspSignature xiNode)
  {
    Set<AspSignature> lSuccessors = new LinkedHashSet<>(mPositive.get(xiNode));
    lSuccessors.addAll(mNegative.get(xiNode));
    return lSuccessors;
  }

  private Stratification order()
  {
    Map<AspSignature, Integer> lIndex = new HashMap<>();
    Map<AspSignature, Integer> lLowLink = new HashMap<>();
    Set<AspSignature> lOnStack = new HashSet<>();
    Deque<AspSignature> lStack = new ArrayDeque<>();
    Deque<AspSignature> lCallStack = new ArrayDeque<>();
    Deque<Iterator<AspSignature>> lIterators = new ArrayDeque<>();
    List<Stratification.Component> lComponents = new ArrayList<>();
    int lNextIndex = 0;

    for (AspSignature lRoot : mNodes)
    {
      if (lIndex.containsKey(lRoot))
      {
        continue;
      }

      lIndex.put(lRoot, lNextIndex);
      lLowLink.put(lRoot, lNextIndex);
      lNextIndex++;
      lStack.push(lRoot);
      lOnStack.add(lRoot);
      lCallStack.push(lRoot);
      lIterators.push(successors(lRoot).iterator());

      while (!lCallStack.isEmpty())
      {
        AspSignature lNode = lCallStack.peek();
        Iterator<AspSignature> lIterator = lIterators.peek();

        if (lIterator.hasNext())
        {
          AspSignature lNext = lIterator.next();
          if (!lIndex.containsKey(lNext))
          {
            lIndex.put(lNext, lNextIndex);
            lLowLink.put(lNext, lNextIndex);
            lNextIndex++;
            lStack.push(lNext);
            lOnStack.add(lNext);
            lCallStack.push(lNext);
            lIterators.push(successors(lNext).iterator());
          }
          else if (lOnStack.contains(lNext))
          {
            lLowLink.put(lNode, Math.min(lLowLink.get(lNode), lIndex.get(lNext)));
          }
          continue;
        }

        // All successors visited.
        lCallStack.pop();
        lIterators.pop();
        if (!lCallStack.isEmpty())
        {
          AspSignature lParent = lCallStack.peek();
          lLowLink.put(lParent, Math.min(lLowLink.get(lParent), lLowLink.get(lNode)));
        }

        if (lLowLink.get(lNode).equals(lIndex.get(lNode)))
        {
          Set<AspSignature> lMembers = new LinkedHashSet<>();
          AspSignature lMember;
          do
          {
            lMember = lStack.pop();
            lOnStack.remove(lMember);
            lMembers.add(lMember);
          }
          while (!lMember.equals(lNode));
          lComponents.add(makeComponent(lMembers));
        }
      }
    }

    // Components for predicates that no rule defines carry no statements.
    List<Stratification.Component> lUseful = new ArrayList<>();
    Set<AspSignature> lUndefined = new LinkedHashSet<>();
    for (Stratification.Component lComponent : lComponents)
    {
      if (lComponent.getStatements().isEmpty())
      {
        lUndefined.addAll(lComponent.getSignatures());
      }
      else
      {
        LOGGER.trace("Component " + lUseful.size() + ": " + lComponent);
        lUseful.add(lComponent);
      }
    }
    LOGGER.debug("Stratified " + mNodes.size() + " predicates into " + lUseful.size() + " components");
    return new Stratification(lUseful, mHeadless, lUndefined);
  }

  private Stratification.Component makeComponent(Set<AspSignature> xiMembers)
  {
    boolean lRecursive = xiMembers.size() > 1;
    boolean lStratified = true;
    Set<Integer> lStatements = new HashSet<>();
    for (AspSignature lMember : xiMembers)
    {
      lStatements.addAll(mDefining.get(lMember));
      for (AspSignature lTarget : mPositive.get(lMember))
      {
        lRecursive |= xiMembers.contains(lTarget);
      }
      for (AspSignature lTarget : mNegative.get(lMember))
      {
        if (xiMembers.contains(lTarget))
        {
          lRecursive = true;
          lStratified = false;
        }
      }
    }

    List<Integer> lOrdered = new ArrayList<>(lStatements);
    Collections.sort(lOrdered);
    return new Stratification.Component(xiMembers, lOrdered, lRecursive, lStratified);
  }
}
