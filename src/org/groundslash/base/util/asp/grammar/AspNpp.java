
package org.groundslash.base.util.asp.grammar;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang.StringUtils;

import com.google.common.collect.ImmutableList;

/**
 * A neural-predicate (<i>NPP</i>) declaration, written <code>#npp(digit(X),[0,1,...,9])</code>.  It stands for the
 * atoms <code>digit(X,0)</code> to <code>digit(X,9)</code>, exactly one of which holds; which one is decided
 * downstream by a neural network.  Only the input terms are grounded - the outcome labels are carried through
 * unchanged.
 *
 * See {@link Asp} for a complete description of the ASP hierarchy.
 */
@SuppressWarnings("serial")
public final class AspNpp extends AspHead
{

  private final AspConstant            name;
  private final ImmutableList<AspTerm> inputs;
  private final ImmutableList<AspTerm> outcomes;
  private transient Boolean            ground;

  AspNpp(AspConstant name, List<AspTerm> inputs, List<AspTerm> outcomes)
  {
    this.name = name;
    this.inputs = ImmutableList.copyOf(inputs);
    this.outcomes = ImmutableList.copyOf(outcomes);
    ground = null;
  }

  public AspConstant getName()
  {
    return name;
  }

  public List<AspTerm> getInputs()
  {
    return inputs;
  }

  public List<AspTerm> getOutcomes()
  {
    return outcomes;
  }

  /**
   * @return the signature of the output atoms: the declared inputs plus one slot for the outcome.
   */
  public AspSignature getOutputSignature()
  {
    return new AspSignature(name, inputs.size() + 1, false);
  }

  @Override
  public List<AspAtom> getAtoms()
  {
    List<AspAtom> atoms = new ArrayList<>(outcomes.size());
    for (AspTerm outcome : outcomes)
    {
      List<AspTerm> body = new ArrayList<>(inputs.size() + 1);
      body.addAll(inputs);
      body.add(outcome);
      atoms.add(AspPool.getAtom(name, body));
    }
    return atoms;
  }

  @Override
  public boolean isGround()
  {
    if (ground == null)
    {
      boolean result = true;
      for (AspTerm term : inputs)
      {
        result &= term.isGround();
      }
      for (AspTerm term : outcomes)
      {
        result &= term.isGround();
      }
      ground = result;
    }

    return ground;
  }

  @Override
  public boolean equals(Object other)
  {
    if (!(other instanceof AspNpp))
    {
      return false;
    }
    AspNpp npp = (AspNpp)other;
    return name.equals(npp.name) && inputs.equals(npp.inputs) && outcomes.equals(npp.outcomes);
  }

  @Override
  public int hashCode()
  {
    return (name.hashCode() * 31 + inputs.hashCode()) * 31 + outcomes.hashCode();
  }

  @Override
  public String toString()
  {
    return "#npp(" + name + "(" + StringUtils.join(inputs, ",") + "),[" + StringUtils.join(outcomes, ",") + "])";
  }

}
