
package org.groundslash.base.util.grounder;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map.Entry;
import java.util.Properties;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Class giving access to grounder configuration.
 *
 * Values are read from the (optional) classpath resource <code>grounder.properties</code>.  A system property
 * <code>groundslash.KEY</code> takes precedence over the file.
 */
public class GrounderConfiguration
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * Name of the classpath resource holding configuration.
   */
  public static final String RESOURCE_NAME = "grounder.properties";

  /**
   * Prefix for system properties that override configuration.
   */
  public static final String SYSTEM_PROPERTY_PREFIX = "groundslash.";

  /**
   * Available configuration items.
   */
  public static enum CfgItem
  {
    /**
     * Maximum number of fixpoint passes (over all components) in a single grounding run.  -1 for no limit.
     */
    MAX_PASSES(-1),

    /**
     * Wall-clock budget for a single grounding run, in milliseconds.  -1 for no limit.
     */
    TIME_LIMIT_MS(-1),

    /**
     * Whether to drop rule instances with a default-negated literal over an atom that is certainly true.
     */
    SIMPLIFY_CERTAIN_NEGATION(true);

    /**
     * Default value, as a string.
     */
    public final String mDefault;

    private CfgItem(int xiDefault)
    {
      mDefault = "" + xiDefault;
    }

    private CfgItem(boolean xiDefault)
    {
      mDefault = xiDefault ? "true" : "false";
    }
  }

  private static final Properties GROUNDER_PROPERTIES = new Properties();
  static
  {
    try (InputStream lPropStream = GrounderConfiguration.class.getClassLoader().getResourceAsStream(RESOURCE_NAME))
    {
      if (lPropStream != null)
      {
        GROUNDER_PROPERTIES.load(lPropStream);
      }
    }
    catch (IOException lEx)
    {
      LOGGER.warn("Invalid grounder configuration in " + RESOURCE_NAME, lEx);
    }
  }

  /**
   * @return the specified String configuration value, or the default if not configured.
   *
   * @param xiKey - the configuration item.
   */
  public static String getCfgStr(CfgItem xiKey)
  {
    String lOverride = System.getProperty(SYSTEM_PROPERTY_PREFIX + xiKey.toString());
    if (lOverride != null)
    {
      return lOverride;
    }
    return GROUNDER_PROPERTIES.getProperty(xiKey.toString(), xiKey.mDefault);
  }

  /**
   * @return the specified integer configuration value, or the default if not configured.
   *
   * @param xiKey - the configuration item.
   */
  public static int getCfgInt(CfgItem xiKey)
  {
    return Integer.parseInt(getCfgStr(xiKey).trim());
  }

  /**
   * @return the specified boolean configuration value, or the default if not configured.
   *
   * @param xiKey - the configuration item.
   */
  public static boolean getCfgBool(CfgItem xiKey)
  {
    return Boolean.parseBoolean(getCfgStr(xiKey).trim());
  }

  /**
   * Log all grounder configuration.
   */
  public static void logConfig()
  {
    LOGGER.info("Running with grounder properties:");
    for (Entry<Object, Object> e : GROUNDER_PROPERTIES.entrySet())
    {
      String lKey = (String)e.getKey();

      // Check that this is a known configuration parameter (and not a typo in the config file).
      try
      {
        CfgItem lItem = CfgItem.valueOf(lKey);
        LOGGER.info("\t" + lKey + " = " + e.getValue() + " (default: " + lItem.mDefault + ")");
      }
      catch (IllegalArgumentException lEx)
      {
        LOGGER.warn("Unknown configuration parameter: '" + lKey + "'");
      }
    }
    for (CfgItem lItem : CfgItem.values())
    {
      LOGGER.debug("\t" + lItem + " is " + getCfgStr(lItem));
    }
  }

  /**
   * UT-only method for overriding configuration.
   *
   * @param xiKey - the property to override.
   * @param xiValue - the new value, or null to revert to the default.
   */
  public static void utOverrideCfgVal(CfgItem xiKey, String xiValue)
  {
    if (xiValue == null)
    {
      GROUNDER_PROPERTIES.remove(xiKey.toString());
    }
    else
    {
      GROUNDER_PROPERTIES.setProperty(xiKey.toString(), xiValue);
    }
  }
}
