package org.groundslash.base.util.grounder;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.groundslash.base.util.grounder.GrounderConfiguration.CfgItem;
import org.junit.After;
import org.junit.Test;

public class GrounderConfigurationTests
{
  @After
  public void tearDown()
  {
    System.clearProperty(GrounderConfiguration.SYSTEM_PROPERTY_PREFIX + CfgItem.MAX_PASSES);
    GrounderConfiguration.utOverrideCfgVal(CfgItem.MAX_PASSES, null);
    GrounderConfiguration.utOverrideCfgVal(CfgItem.TIME_LIMIT_MS, null);
    GrounderConfiguration.utOverrideCfgVal(CfgItem.SIMPLIFY_CERTAIN_NEGATION, null);
  }

  @Test
  public void testDefaults() throws Exception
  {
    assertEquals(-1, GrounderConfiguration.getCfgInt(CfgItem.MAX_PASSES));
    assertEquals(-1, GrounderConfiguration.getCfgInt(CfgItem.TIME_LIMIT_MS));
    assertTrue(GrounderConfiguration.getCfgBool(CfgItem.SIMPLIFY_CERTAIN_NEGATION));

    GroundingLimits lLimits = GroundingLimits.fromConfiguration();
    assertFalse(lLimits.hasPassLimit());
    assertFalse(lLimits.hasTimeLimit());
  }

  @Test
  public void testOverride() throws Exception
  {
    GrounderConfiguration.utOverrideCfgVal(CfgItem.MAX_PASSES, "50");
    GrounderConfiguration.utOverrideCfgVal(CfgItem.TIME_LIMIT_MS, " 2000 ");

    GroundingLimits lLimits = GroundingLimits.fromConfiguration();
    assertTrue(lLimits.hasPassLimit());
    assertEquals(50, lLimits.getMaxPasses());
    assertEquals(2000, lLimits.getTimeLimitMillis());
    assertEquals("passes <= 50, time <= 2000ms", lLimits.toString());

    GrounderConfiguration.utOverrideCfgVal(CfgItem.MAX_PASSES, null);
    assertEquals(-1, GrounderConfiguration.getCfgInt(CfgItem.MAX_PASSES));
  }

  @Test
  public void testSystemPropertyWins() throws Exception
  {
    GrounderConfiguration.utOverrideCfgVal(CfgItem.MAX_PASSES, "50");
    System.setProperty(GrounderConfiguration.SYSTEM_PROPERTY_PREFIX + "MAX_PASSES", "7");

    assertEquals(7, GrounderConfiguration.getCfgInt(CfgItem.MAX_PASSES));
    assertEquals("7", GrounderConfiguration.getCfgStr(CfgItem.MAX_PASSES));
  }

  @Test
  public void testLogConfig() throws Exception
  {
    GrounderConfiguration.utOverrideCfgVal(CfgItem.SIMPLIFY_CERTAIN_NEGATION, "false");
    GrounderConfiguration.logConfig();
    assertFalse(GrounderConfiguration.getCfgBool(CfgItem.SIMPLIFY_CERTAIN_NEGATION));
  }
}
