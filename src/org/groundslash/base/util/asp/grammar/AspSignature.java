
package org.groundslash.base.util.asp.grammar;

import java.io.Serializable;

/**
 * The predicate an atom belongs to: its name, its arity and whether it is classically negated.
 */
public final class AspSignature implements Serializable, Comparable<AspSignature>
{
  private static final long serialVersionUID = 1L;

  private final AspConstant mName;
  private final int         mArity;
  private final boolean     mNegated;

  public AspSignature(AspConstant xiName, int xiArity, boolean xiNegated)
  {
    mName = xiName;
    mArity = xiArity;
    mNegated = xiNegated;
  }

  public AspConstant getName()
  {
    return mName;
  }

  public int getArity()
  {
    return mArity;
  }

  public boolean isNegated()
  {
    return mNegated;
  }

  @Override
  public int compareTo(AspSignature xiOther)
  {
    int lResult = mName.getValue().compareTo(xiOther.mName.getValue());
    if (lResult == 0)
    {
      lResult = Integer.compare(mArity, xiOther.mArity);
    }
    if (lResult == 0)
    {
      lResult = Boolean.compare(mNegated, xiOther.mNegated);
    }
    return lResult;
  }

  @Override
  public boolean equals(Object xiOther)
  {
    if (!(xiOther instanceof AspSignature))
    {
      return false;
    }
    AspSignature lOther = (AspSignature)xiOther;
    return mName.equals(lOther.mName) && mArity == lOther.mArity && mNegated == lOther.mNegated;
  }

  @Override
  public int hashCode()
  {
    return (mName.hashCode() * 31 + mArity) * 2 + (mNegated ? 1 : 0);
  }

  @Override
  public String toString()
  {
    return (mNegated ? "-" : "") + mName + "/" + mArity;
  }
}
