package fit.ageing.input;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.XMLConfiguration;
import org.apache.log4j.Logger;

/**
 * Application settings that are kept between runs: the peak detection parameters used when
 * slicing reference channels, whether debug plots are written and where to, and the default
 * folder that results are written into. Settings come from an XML file; if no file exists at the
 * requested location the copy embedded in the jar is written out there first.
 */
public class Configuration {

  public static final String DEFAULT_CONFIG_PATH = "ageing-analysis-config.xml";

  public static final double DEFAULT_PROMINENCE_PERCENT = 15.;
  public static final int DEFAULT_MERGE_THRESHOLD = 5;

  private static Configuration instance;

  private static final Logger logger = Logger.getLogger(Configuration.class);

  private String loadedConfigPath = DEFAULT_CONFIG_PATH;

  private double prominencePercent = DEFAULT_PROMINENCE_PERCENT;
  private int mergeThreshold = DEFAULT_MERGE_THRESHOLD;

  private boolean debugPlots = false;
  private String debugPlotFolder = "debug_plots";

  private String defaultOutputFolder = "ageing_analysis_results";

  private Configuration(String configLocation) {
    logger.info("Attempting reading in config file from " + configLocation);
    try {
      XMLConfiguration config = new XMLConfiguration(configLocation);

      prominencePercent = config.getDouble("PeakDetection.ProminencePercent",
          DEFAULT_PROMINENCE_PERCENT);
      mergeThreshold = config.getInt("PeakDetection.MergeThreshold", DEFAULT_MERGE_THRESHOLD);

      debugPlots = config.getBoolean("Debug.Plots", false);
      String plotFolderParam = config.getString("Debug.PlotFolder");
      if (plotFolderParam != null) {
        debugPlotFolder = plotFolderParam;
      }

      String outputFolderParam = config.getString("LocalPaths.OutputPath");
      if (outputFolderParam != null) {
        defaultOutputFolder = outputFolderParam;
      }

      File loadedFile = config.getFile();
      if (loadedFile != null) {
        try {
          loadedConfigPath = loadedFile.getCanonicalPath();
        } catch (IOException e) {
          logger.warn("Could not resolve canonical path of " + loadedFile, e);
          loadedConfigPath = loadedFile.getAbsolutePath();
        }
      }
      logger.info("Successfully loaded in configuration: " + loadedConfigPath);
    } catch (ConfigurationException e) {
      logger.error("Error encountered while reading XML file, load failed, using defaults", e);
    } catch (RuntimeException e) {
      // malformed numbers or booleans in an otherwise readable file
      logger.error("Invalid value in XML file " + configLocation + ", using defaults", e);
      resetDefaults();
    }
  }

  private void resetDefaults() {
    prominencePercent = DEFAULT_PROMINENCE_PERCENT;
    mergeThreshold = DEFAULT_MERGE_THRESHOLD;
    debugPlots = false;
    debugPlotFolder = "debug_plots";
    defaultOutputFolder = "ageing_analysis_results";
  }

  private static boolean copyEmbedXML(String pathToPlaceFile) {
    File fileOut = new File(pathToPlaceFile);
    try (InputStream stream =
        Configuration.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_PATH)) {
      if (stream == null) {
        logger.error("Major error: config XML file not part of resources!!");
        return false;
      }
      logger.info("Copying over embedded jar file to absolute path " + fileOut.getAbsolutePath());
      Files.copy(stream, fileOut.toPath());
      return true;
    } catch (IOException e) {
      logger.warn("Could not copy over the file...", e);
    }
    return false;
  }

  /**
   * Gets the current instance of the configuration, or creates one from the working directory's
   * settings file if none exists
   *
   * @return the current configuration instance
   */
  public static synchronized Configuration getInstance() {
    return getInstance(System.getProperty("user.dir") + File.separator + DEFAULT_CONFIG_PATH);
  }

  /**
   * Gets the current instance of the configuration, or creates one from a specified file if none
   * exists. A missing file is initialized from the embedded default settings.
   *
   * @param configLocation Configuration file location to read from
   * @return the current configuration instance
   */
  public static synchronized Configuration getInstance(String configLocation) {
    if (instance == null) {
      instance = load(configLocation);
    }
    return instance;
  }

  /**
   * Read settings from a file without touching the shared instance. A missing file is
   * initialized from the embedded default settings where possible; otherwise defaults are used.
   *
   * @param configLocation Configuration file location to read from
   * @return configuration read from the given file
   */
  public static Configuration load(String configLocation) {
    File config = new File(configLocation);
    if (!config.exists()) {
      boolean success = copyEmbedXML(configLocation);
      if (!success) {
        logger.warn("Could not find or write to specified config location: " + configLocation);
      }
    }
    return new Configuration(configLocation);
  }

  /**
   * Gets the prominence threshold for reference peak detection, as a percentage of the largest
   * value of the scanned trace. Defaults to 15.
   *
   * The property is defined from Configuration.PeakDetection.ProminencePercent
   *
   * @return prominence percentage
   */
  public double getProminencePercent() {
    return prominencePercent;
  }

  public void setProminencePercent(double replacement) {
    if (replacement <= 0. || replacement > 100.) {
      throw new IllegalArgumentException(
          "Prominence percent must be in (0, 100], got " + replacement);
    }
    prominencePercent = replacement;
  }

  /**
   * Gets the largest difference (in samples) between the bases of two detected peaks for them
   * to be treated as one peak. Defaults to 5.
   *
   * The property is defined from Configuration.PeakDetection.MergeThreshold
   *
   * @return merge threshold in samples
   */
  public int getMergeThreshold() {
    return mergeThreshold;
  }

  public void setMergeThreshold(int replacement) {
    if (replacement < 0) {
      throw new IllegalArgumentException("Merge threshold must not be negative, got "
          + replacement);
    }
    mergeThreshold = replacement;
  }

  /**
   * Whether the extraction and fitting stages write plots of each channel.
   *
   * The property is defined from Configuration.Debug.Plots as a boolean
   *
   * @return true if debug plots are enabled
   */
  public boolean writeDebugPlots() {
    return debugPlots;
  }

  public void setWriteDebugPlots(boolean trueIfUsed) {
    debugPlots = trueIfUsed;
  }

  public String getDebugPlotFolder() {
    return debugPlotFolder;
  }

  public void setDebugPlotFolder(String replacement) {
    debugPlotFolder = replacement;
  }

  /**
   * Gets the folder results are written to when no output file is given.
   *
   * The property is defined from Configuration.LocalPaths.OutputPath
   *
   * @return The folder where result files are placed by default.
   */
  public String getDefaultOutputFolder() {
    return defaultOutputFolder;
  }

  public void setDefaultOutputFolder(String replacement) {
    defaultOutputFolder = replacement;
  }

  public String getLoadedConfigPath() {
    return loadedConfigPath;
  }

  /**
   * Writes out the current configuration to the file it was loaded from.
   */
  public void saveCurrentConfig() {
    try {
      XMLConfiguration config = new XMLConfiguration(loadedConfigPath);

      config.setProperty("PeakDetection.ProminencePercent", prominencePercent);
      config.setProperty("PeakDetection.MergeThreshold", mergeThreshold);
      config.setProperty("Debug.Plots", debugPlots);
      config.setProperty("Debug.PlotFolder", debugPlotFolder);
      config.setProperty("LocalPaths.OutputPath", defaultOutputFolder);

      config.save();
    } catch (ConfigurationException e) {
      logger.error("Could not save configuration to " + loadedConfigPath, e);
    }
  }

}
