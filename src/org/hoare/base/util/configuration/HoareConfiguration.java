package org.hoare.base.util.configuration;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map.Entry;
import java.util.Properties;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Class giving access to configuration.
 *
 * Values come from the classpath resource {@link #RESOURCE_NAME}, if present.  Any value can be overridden with a JVM
 * system property named after the item, prefixed with {@link #SYSTEM_PROPERTY_PREFIX} - for example
 * <code>-Dhoare.STRICT_PARSING=false</code>.
 *
 * <p>Values are checked once, when loaded.  An invalid value is logged and the item falls back to its default.
 */
public class HoareConfiguration
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * Name of the classpath resource holding configuration.
   */
  public static final String RESOURCE_NAME = "hoare.properties";

  /**
   * Prefix for system properties that override configuration.
   */
  public static final String SYSTEM_PROPERTY_PREFIX = "hoare.";

  /**
   * Available configuration items.
   */
  public static enum CfgItem
  {
    /**
     * Whether the parser rejects tokens left over after a complete formula.  When false, they are silently ignored.
     */
    STRICT_PARSING(true),

    /**
     * Maximum depth of operator nesting that the parser accepts.
     */
    MAX_FORMULA_DEPTH(1000);

    /**
     * Default value, as a string.
     */
    public final String mDefault;

    private final boolean mBoolean;

    private CfgItem(int xiDefault)
    {
      mDefault = "" + xiDefault;
      mBoolean = false;
    }

    private CfgItem(boolean xiDefault)
    {
      mDefault = xiDefault ? "true" : "false";
      mBoolean = true;
    }

    /**
     * @return whether the specified value is acceptable for this item.  Boolean items take <code>true</code> or
     * <code>false</code>; integer items take a positive integer.
     *
     * @param xiValue - the value.
     */
    boolean isValid(String xiValue)
    {
      String lValue = xiValue.trim();

      if (mBoolean)
      {
        return lValue.equalsIgnoreCase("true") || lValue.equalsIgnoreCase("false");
      }

      try
      {
        return Integer.parseInt(lValue) > 0;
      }
      catch (NumberFormatException lEx)
      {
        return false;
      }
    }
  }

  // Effective configuration, and the configuration as loaded (before any unit test overrides).
  private static final Properties PROPERTIES = new Properties();
  private static final Properties LOADED = new Properties();
  static
  {
    apply(readSources());
  }

  /**
   * @return the configuration from {@link #RESOURCE_NAME}, with system property overrides applied.
   */
  private static Properties readSources()
  {
    Properties lProperties = new Properties();

    try (InputStream lPropStream = HoareConfiguration.class.getClassLoader().getResourceAsStream(RESOURCE_NAME))
    {
      if (lPropStream != null)
      {
        lProperties.load(lPropStream);
      }
      else
      {
        LOGGER.debug("No " + RESOURCE_NAME + " on the classpath - using defaults");
      }
    }
    catch (IOException lEx)
    {
      LOGGER.warn("Invalid configuration in " + RESOURCE_NAME + " - using defaults", lEx);
    }

    for (CfgItem lItem : CfgItem.values())
    {
      String lOverride = System.getProperty(SYSTEM_PROPERTY_PREFIX + lItem);
      if (lOverride != null)
      {
        lProperties.setProperty(lItem.toString(), lOverride);
      }
    }

    return lProperties;
  }

  /**
   * Make the specified configuration current, dropping any invalid values.
   *
   * @param xiProperties - the configuration.
   */
  private static synchronized void apply(Properties xiProperties)
  {
    Properties lChecked = new Properties();
    lChecked.putAll(xiProperties);

    for (CfgItem lItem : CfgItem.values())
    {
      String lValue = lChecked.getProperty(lItem.toString());
      if ((lValue != null) && !lItem.isValid(lValue))
      {
        LOGGER.warn("Invalid value '" + lValue + "' for " + lItem + " - using default (" + lItem.mDefault + ")");
        lChecked.remove(lItem.toString());
      }
    }

    LOADED.clear();
    LOADED.putAll(lChecked);
    PROPERTIES.clear();
    PROPERTIES.putAll(lChecked);
  }

  /**
   * @return the specified String configuration value, or the default if not configured.
   *
   * @param xiKey - the item.
   */
  public static String getCfgStr(CfgItem xiKey)
  {
    return PROPERTIES.getProperty(xiKey.toString(), xiKey.mDefault).trim();
  }

  /**
   * @return the specified integer configuration value, or the default if not configured.
   *
   * @param xiKey - the item.
   */
  public static int getCfgInt(CfgItem xiKey)
  {
    return Integer.parseInt(getCfgStr(xiKey));
  }

  /**
   * @return the specified boolean configuration value, or the default if not configured.
   *
   * @param xiKey - the item.
   */
  public static boolean getCfgBool(CfgItem xiKey)
  {
    return Boolean.parseBoolean(getCfgStr(xiKey));
  }

  /**
   * Log all configuration.
   */
  public static void logConfig()
  {
    LOGGER.info("Running with properties:");
    for (Entry<Object, Object> e : PROPERTIES.entrySet())
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
  }

  /**
   * UT-only method for overriding configuration.
   *
   * @param xiKey - the property to override.
   * @param xiValue - the new value.
   */
  public static void utOverrideCfgVal(CfgItem xiKey, String xiValue)
  {
    PROPERTIES.setProperty(xiKey.toString(), xiValue);
  }

  /**
   * UT-only method for reverting an override.
   *
   * @param xiKey - the property to revert to its loaded value (or its default, if it wasn't configured).
   */
  public static void utResetCfgVal(CfgItem xiKey)
  {
    String lLoaded = LOADED.getProperty(xiKey.toString());
    if (lLoaded == null)
    {
      PROPERTIES.remove(xiKey.toString());
    }
    else
    {
      PROPERTIES.setProperty(xiKey.toString(), lLoaded);
    }
  }

  /**
   * UT-only method for replacing the loaded configuration, as if it had been read from {@link #RESOURCE_NAME}.
   *
   * @param xiProperties - the configuration to load.
   */
  public static void utLoad(Properties xiProperties)
  {
    apply(xiProperties);
  }

  /**
   * UT-only method for reloading the configuration from {@link #RESOURCE_NAME} and system properties.
   */
  public static void utReload()
  {
    apply(readSources());
  }
}
