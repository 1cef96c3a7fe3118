
package org.groundslash.base.util.grounder;

import org.groundslash.base.util.grounder.GrounderConfiguration.CfgItem;

/**
 * Caller-imposed budget for one grounding run.  Exceeding either limit aborts the run.
 */
public final class GroundingLimits
{
  /**
   * No limits at all.
   */
  public static final GroundingLimits UNLIMITED = new GroundingLimits(-1, -1);

  private final long mMaxPasses;
  private final long mTimeLimitMillis;

  /**
   * @param xiMaxPasses       - maximum number of fixpoint passes, or a negative number for no limit.
   * @param xiTimeLimitMillis - wall-clock budget in milliseconds, or a negative number for no limit.
   */
  public GroundingLimits(long xiMaxPasses, long xiTimeLimitMillis)
  {
    mMaxPasses = xiMaxPasses;
    mTimeLimitMillis = xiTimeLimitMillis;
  }

  /**
   * @return the limits set by the grounder configuration.
   */
  public static GroundingLimits fromConfiguration()
  {
    return new GroundingLimits(GrounderConfiguration.getCfgInt(CfgItem.MAX_PASSES),
                               GrounderConfiguration.getCfgInt(CfgItem.TIME_LIMIT_MS));
  }

  public boolean hasPassLimit()
  {
    return mMaxPasses >= 0;
  }

  public long getMaxPasses()
  {
    return mMaxPasses;
  }

  public boolean hasTimeLimit()
  {
    return mTimeLimitMillis >= 0;
  }

  public long getTimeLimitMillis()
  {
    return mTimeLimitMillis;
  }

  @Override
  public String toString()
  {
    return "passes <= " + (hasPassLimit() ? mMaxPasses : "inf") +
           ", time <= " + (hasTimeLimit() ? mTimeLimitMillis + "ms" : "inf");
  }
}
