package psp.encounter.input;

import java.io.File;
import java.net.MalformedURLException;
import java.net.URL;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.XMLConfiguration;
import org.apache.log4j.Logger;
import psp.encounter.output.LogHistogram2D.Normalization;
import psp.encounter.utils.ResampleMode;
import psp.encounter.utils.TauWindow;

/**
 * Configuration file including the parameters that control the derived-variable calculations.
 * These include the histogram tau windows and value range, the default resampling mode,
 * the strahl energy channel selection for electron pitch-angle data, the angular separation
 * used to form occurrence bins, and where the angular bin cache is kept.
 *
 * Any key absent from the XML file (or a file that cannot be parsed at all) leaves the
 * corresponding default in place.
 */
public class Configuration {

  private static Configuration instance;

  static final String DEFAULT_CONFIG_PATH = "encounter-suite-config.xml";
  private static final Logger logger = Logger.getLogger(Configuration.class);

  private String loadedConfigPath = DEFAULT_CONFIG_PATH;

  private List<TauWindow> histogramTaus = TauWindow.parseAll("30s,2m,20m,90m,4h,12h");
  private double logMin = -3.;
  private double logMax = 3.;
  private int valueBins = 120;
  private Normalization normalization = Normalization.DENSITY_TOTAL;
  private double cMax = 1E-3;

  private ResampleMode resampleMode = ResampleMode.NEAREST;

  private double strahlCutoff = epochSecondsOf("2021-11-15");
  private int strahlEarlyIndex = 8;
  private int strahlLateIndex = 10;

  private List<TauWindow> hammerheadTaus = TauWindow.parseAll("30s,1m,2m,20m,90m,4h,12h");

  private double maxAngularSeparation = 1.;
  private int windowDays = 3;
  private double cacheTolerance = 1E-3;

  private String binCachePath = "ham_bin_data.json";

  private Configuration(URL configLocation) {
    logger.info("Attempting reading in config file from " + configLocation);
    try {
      XMLConfiguration config = new XMLConfiguration(configLocation);

      String[] tauParams = config.getStringArray("Histogram.Taus");
      if (tauParams.length > 0) {
        histogramTaus = TauWindow.parseAll(String.join(",", tauParams));
      }
      logMin = config.getDouble("Histogram.LogMin", logMin);
      logMax = config.getDouble("Histogram.LogMax", logMax);
      valueBins = config.getInt("Histogram.ValueBins", valueBins);
      String normalizationParam = config.getString("Histogram.Normalization");
      if (normalizationParam != null) {
        normalization = Normalization.valueOf(normalizationParam.trim());
      }
      cMax = config.getDouble("Histogram.CMax", cMax);

      String modeParam = config.getString("Resample.Mode");
      if (modeParam != null) {
        resampleMode = ResampleMode.valueOf(modeParam.trim());
      }

      String cutoffParam = config.getString("Electron.StrahlCutoff");
      if (cutoffParam != null) {
        strahlCutoff = epochSecondsOf(cutoffParam.trim());
      }
      strahlEarlyIndex = config.getInt("Electron.EarlyIndex", strahlEarlyIndex);
      strahlLateIndex = config.getInt("Electron.LateIndex", strahlLateIndex);

      String[] hamTauParams = config.getStringArray("Hammerhead.Taus");
      if (hamTauParams.length > 0) {
        hammerheadTaus = TauWindow.parseAll(String.join(",", hamTauParams));
      }

      maxAngularSeparation = config.getDouble("Angular.MaxSeparation", maxAngularSeparation);
      windowDays = config.getInt("Angular.WindowDays", windowDays);
      cacheTolerance = config.getDouble("Angular.CacheTolerance", cacheTolerance);

      String cachePathParam = config.getString("LocalPaths.BinCachePath");
      if (cachePathParam != null) {
        binCachePath = cachePathParam;
      }

      loadedConfigPath = configLocation.toString();
      logger.info("Successfully loaded in configuration: " + loadedConfigPath);
    } catch (ConfigurationException e) {
      logger.error("Error encountered while reading XML file, load failed, using defaults", e);
    } catch (IllegalArgumentException | DateTimeParseException e) {
      // unknown enum names, malformed tau labels or dates; keep whatever was read before it
      logger.error("Invalid value in configuration " + configLocation
          + ", remaining values use defaults", e);
    }
  }

  private static double epochSecondsOf(String isoDate) {
    return LocalDate.parse(isoDate).atStartOfDay(ZoneOffset.UTC).toEpochSecond();
  }

  /**
   * Gets the current instance of the configuration, or creates one if none exists.
   * The configuration file is looked for in the working directory first; if it is not there,
   * the copy embedded in the program's resources is used.
   *
   * @return the current configuration instance
   */
  synchronized public static Configuration getInstance() {
    return getInstance(System.getProperty("user.dir") + File.separator + DEFAULT_CONFIG_PATH);
  }

  /**
   * Gets the current instance of the configuration, or creates one from a specified file if none
   * exists.
   *
   * @param configLocation Configuration file location to read from
   * @return the current configuration instance
   */
  synchronized public static Configuration getInstance(String configLocation) {
    if (instance == null) {
      instance = load(configLocation);
    }
    return instance;
  }

  /**
   * Read a configuration file without touching the shared instance. If the file does not exist,
   * the embedded configuration is read instead.
   *
   * @param configLocation Path of the XML file to read
   * @return New configuration holding the file's values (or defaults)
   */
  public static Configuration load(String configLocation) {
    File config = new File(configLocation);
    if (config.exists()) {
      try {
        return new Configuration(config.toURI().toURL());
      } catch (MalformedURLException e) {
        logger.warn("Could not form a URL from config location " + configLocation, e);
      }
    } else {
      logger.info("No config file at " + configLocation + ", using embedded configuration");
    }
    URL embedded = Configuration.class.getClassLoader().getResource(DEFAULT_CONFIG_PATH);
    if (embedded == null) {
      logger.error("Major error: config XML file not part of resources!!");
      embedded = Configuration.class.getResource("/" + DEFAULT_CONFIG_PATH);
    }
    return new Configuration(embedded);
  }

  /**
   * @return Location the configuration values were read from
   */
  public String getLoadedConfigPath() {
    return loadedConfigPath;
  }

  /**
   * Gets the tau windows over which wave-power histograms are computed.
   *
   * The property is defined from Configuration.Histogram.Taus as a comma-separated list of
   * labels such as "30s" or "4h".
   * @return Tau windows in the order listed
   */
  public List<TauWindow> getHistogramTaus() {
    return Collections.unmodifiableList(new ArrayList<>(histogramTaus));
  }

  /**
   * Gets the lower bound of the log10 value axis (Configuration.Histogram.LogMin, default -3)
   * @return lowest exponent binned
   */
  public double getLogMin() {
    return logMin;
  }

  /**
   * Gets the upper bound of the log10 value axis (Configuration.Histogram.LogMax, default 3)
   * @return highest exponent binned
   */
  public double getLogMax() {
    return logMax;
  }

  public int getValueBins() {
    return valueBins;
  }

  public Normalization getNormalization() {
    return normalization;
  }

  /**
   * Gets the clip level above which histogram cells are set invalid (default 1E-3). NaN means
   * no clip is applied.
   *
   * The property is defined from Configuration.Histogram.CMax
   * @return clip level, or NaN
   */
  public double getCMax() {
    return cMax;
  }

  public ResampleMode getResampleMode() {
    return resampleMode;
  }

  /**
   * Gets the time (epoch seconds) at which the electron strahl energy channel changes.
   * Data starting before this time uses the early index, later data the late index.
   *
   * The property is defined from Configuration.Electron.StrahlCutoff as an ISO date
   * @return Cutoff in epoch seconds
   */
  public double getStrahlCutoff() {
    return strahlCutoff;
  }

  public int getStrahlEarlyIndex() {
    return strahlEarlyIndex;
  }

  public int getStrahlLateIndex() {
    return strahlLateIndex;
  }

  /**
   * Gets the tau windows over which detection counts are histogrammed.
   *
   * The property is defined from Configuration.Hammerhead.Taus
   * @return Tau windows in the order listed
   */
  public List<TauWindow> getHammerheadTaus() {
    return Collections.unmodifiableList(new ArrayList<>(hammerheadTaus));
  }

  /**
   * Gets the largest great-circle separation (degrees) allowed between the first and last
   * position in one angular occurrence bin.
   *
   * The property is defined from Configuration.Angular.MaxSeparation
   * @return separation in degrees
   */
  public double getMaxAngularSeparation() {
    return maxAngularSeparation;
  }

  /**
   * Gets the half-width (days) of the analysis window around perihelion
   * @return days on either side of perihelion
   */
  public int getWindowDays() {
    return windowDays;
  }

  public double getCacheTolerance() {
    return cacheTolerance;
  }

  /**
   * Gets the location of the angular bin JSON cache (Configuration.LocalPaths.BinCachePath)
   * @return path to the cache file
   */
  public String getBinCachePath() {
    return binCachePath;
  }
}
