package fit.ageing.input;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fit.ageing.entities.Dataset;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.log4j.Logger;

/**
 * Dataset configuration of an analysis run, read from a JSON file of the form
 *
 * <pre>
 * {
 *   "basePath": "optional/global/base",
 *   "inputs": [
 *     {
 *       "date": "2022-01-01",
 *       "basePath": "relative/or/absolute",
 *       "files": {"PMA0": "pma0.txt", "PMC3": "pmc3.txt"},
 *       "refCH": {"PM": "PMA0", "CH": [1, 2]},
 *       "validateHeader": false,
 *       "integratedCharge": {"PMA0": {"CH01": 1.5}}
 *     }
 *   ]
 * }
 * </pre>
 *
 * Entries whose resolved base path does not exist are skipped with a warning. The remaining
 * entries are kept sorted by date.
 */
public class AnalysisConfig {

  private static final Logger logger = Logger.getLogger(AnalysisConfig.class);

  private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

  private final List<DatasetConfig> datasets;

  private AnalysisConfig(List<DatasetConfig> datasets) {
    this.datasets = Collections.unmodifiableList(datasets);
  }

  /**
   * Read a dataset configuration, resolving relative paths against the working directory
   *
   * @param configFile JSON configuration file
   * @return parsed configuration
   * @throws IOException if the file cannot be read or is not valid JSON
   * @throws IllegalArgumentException if required fields are missing or malformed
   */
  public static AnalysisConfig load(File configFile) throws IOException {
    return load(configFile, new File(System.getProperty("user.dir")));
  }

  /**
   * Read a dataset configuration, resolving relative paths against the given root folder
   *
   * @param configFile JSON configuration file
   * @param rootDir folder that relative base paths are resolved against
   * @return parsed configuration
   * @throws IOException if the file cannot be read or is not valid JSON
   * @throws IllegalArgumentException if required fields are missing or malformed
   */
  public static AnalysisConfig load(File configFile, File rootDir) throws IOException {
    logger.debug("Loading configuration from " + configFile.getAbsolutePath());
    JsonNode root = JSON_MAPPER.readTree(configFile);
    return fromJson(root, rootDir);
  }

  /**
   * Build a configuration from an already parsed JSON document
   *
   * @param root JSON document
   * @param rootDir folder that relative base paths are resolved against
   * @return parsed configuration
   */
  public static AnalysisConfig fromJson(JsonNode root, File rootDir) {
    if (root == null || !root.isObject() || !root.has("inputs")) {
      throw new IllegalArgumentException("inputs field not found in config file");
    }
    JsonNode inputs = root.get("inputs");
    if (!inputs.isArray()) {
      throw new IllegalArgumentException("inputs field must be a list of datasets");
    }
    logger.debug("Found " + inputs.size() + " input datasets in configuration");

    File globalBase = null;
    String globalBasePath = root.path("basePath").asText("");
    if (!globalBasePath.isEmpty()) {
      globalBase = resolve(rootDir, globalBasePath);
      logger.debug("Global basePath resolved to " + globalBase.getPath());
    } else {
      logger.debug("No global basePath specified");
    }

    List<DatasetConfig> datasets = new ArrayList<>();
    for (JsonNode input : inputs) {
      String date = input.path("date").asText("");
      if (date.isEmpty()) {
        throw new IllegalArgumentException("date field missing in one of the input datasets");
      }

      File basePath = resolveBasePath(rootDir, globalBase, input.path("basePath").asText(""));
      if (!basePath.exists()) {
        logger.warn("basePath " + basePath.getPath() + " does not exist. Skipping dataset "
            + date + ".");
        continue;
      }

      Map<String, String> files = new LinkedHashMap<>();
      JsonNode filesNode = input.path("files");
      Iterator<Map.Entry<String, JsonNode>> fileEntries = filesNode.fields();
      while (fileEntries.hasNext()) {
        Map.Entry<String, JsonNode> entry = fileEntries.next();
        files.put(entry.getKey(), entry.getValue().asText());
      }

      JsonNode refCh = input.has("refCH") ? input.get("refCH") : JSON_MAPPER.createObjectNode();
      if (!refCh.isObject()) {
        throw new IllegalArgumentException("refCH field must be a dictionary");
      }
      if (refCh.path("PM").isMissingNode() || refCh.path("PM").isNull()) {
        throw new IllegalArgumentException("refCH field missing PM key (reference PM)");
      }
      if (refCh.path("CH").isMissingNode() || refCh.path("CH").isNull()) {
        throw new IllegalArgumentException(
            "refCH field missing CH key (list of reference channels)");
      }
      String referencePm = refCh.get("PM").asText();
      List<Integer> referenceChannels = readChannelNumbers(refCh.get("CH"), date);

      boolean validateHeader = input.path("validateHeader").asBoolean(false);

      Map<String, Map<String, Double>> integratedCharge = null;
      if (input.has("integratedCharge") && !input.get("integratedCharge").isNull()) {
        integratedCharge = readIntegratedCharge(input.get("integratedCharge"), date);
      }

      DatasetConfig dataset = new DatasetConfig(date, basePath, files, referencePm,
          referenceChannels, validateHeader, integratedCharge);
      datasets.add(dataset);
      logger.debug("Added dataset " + dataset);
    }

    Collections.sort(datasets, new Comparator<DatasetConfig>() {
      @Override
      public int compare(DatasetConfig first, DatasetConfig second) {
        return first.getDate().compareTo(second.getDate());
      }
    });

    if (datasets.isEmpty()) {
      logger.warn("No valid datasets found in the configuration.");
    } else {
      logger.info("Config loaded successfully: " + datasets.size() + " datasets found.");
    }
    return new AnalysisConfig(datasets);
  }

  private static File resolve(File rootDir, String path) {
    File file = new File(path);
    if (file.isAbsolute()) {
      return normalize(file);
    }
    return normalize(new File(rootDir, path));
  }

  private static File normalize(File file) {
    return file.toPath().toAbsolutePath().normalize().toFile();
  }

  /**
   * Combine the global and the dataset base path. An absolute dataset path wins; a relative one
   * is taken relative to the global path if there is one, else relative to the root folder.
   * With neither path set the root folder is used.
   */
  static File resolveBasePath(File rootDir, File globalBase, String datasetBasePath) {
    if (!datasetBasePath.isEmpty()) {
      File datasetBase = new File(datasetBasePath);
      if (datasetBase.isAbsolute()) {
        return normalize(datasetBase);
      }
      if (globalBase != null) {
        return normalize(new File(globalBase, datasetBasePath));
      }
      return resolve(rootDir, datasetBasePath);
    }
    if (globalBase != null) {
      return globalBase;
    }
    return normalize(rootDir);
  }

  private static List<Integer> readChannelNumbers(JsonNode node, String date) {
    List<Integer> numbers = new ArrayList<>();
    if (node.isArray()) {
      for (JsonNode number : node) {
        numbers.add(readChannelNumber(number, date));
      }
    } else {
      numbers.add(readChannelNumber(node, date));
    }
    return numbers;
  }

  private static int readChannelNumber(JsonNode node, String date) {
    if (node.canConvertToInt() && node.isIntegralNumber()) {
      return node.asInt();
    }
    if (node.isTextual() && node.asText().trim().matches("\\d{1,9}")) {
      return Integer.parseInt(node.asText().trim());
    }
    throw new IllegalArgumentException("refCH channel '" + node.asText()
        + "' of dataset " + date + " is not a channel number");
  }

  /**
   * Read integrated charge data, {PM: {channel: value}}. Malformed data is dropped as a whole,
   * with a warning, and the analysis goes on without it.
   */
  private static Map<String, Map<String, Double>> readIntegratedCharge(JsonNode node,
      String date) {
    if (!node.isObject()) {
      logger.warn("Integrated charge data format validation failed for dataset " + date
          + ". Continuing analysis without integrated charge data.");
      return null;
    }
    Map<String, Map<String, Double>> charges = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> pms = node.fields();
    while (pms.hasNext()) {
      Map.Entry<String, JsonNode> pm = pms.next();
      if (!pm.getValue().isObject()) {
        logger.warn("Integrated charge data for " + pm.getKey() + " in dataset " + date
            + " is not a mapping of channels. Continuing analysis without integrated charge "
            + "data.");
        return null;
      }
      Map<String, Double> channels = new LinkedHashMap<>();
      Iterator<Map.Entry<String, JsonNode>> values = pm.getValue().fields();
      while (values.hasNext()) {
        Map.Entry<String, JsonNode> value = values.next();
        if (!value.getValue().isNumber()) {
          logger.warn("Integrated charge for " + pm.getKey() + " " + value.getKey()
              + " in dataset " + date + " is not a number. Continuing analysis without "
              + "integrated charge data.");
          return null;
        }
        channels.put(InputValidation.normalizeChannelName(value.getKey()),
            value.getValue().asDouble());
      }
      charges.put(InputValidation.normalizePmName(pm.getKey()), channels);
    }
    return charges;
  }

  /**
   * Get the configured datasets, sorted by date
   *
   * @return dataset configurations
   */
  public List<DatasetConfig> getDatasets() {
    return datasets;
  }

  /**
   * Build the datasets of this configuration, validating each module's trace file
   *
   * @return datasets sorted by date, with modules but no channels yet
   * @throws IOException if a trace file is missing or invalid
   */
  public List<Dataset> createDatasets() throws IOException {
    List<Dataset> result = new ArrayList<>();
    for (DatasetConfig config : datasets) {
      result.add(config.createDataset());
    }
    Collections.sort(result, Dataset.BY_DATE);
    return result;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("AnalysisConfig(datasets=[");
    for (DatasetConfig dataset : datasets) {
      sb.append("\n  ").append(dataset);
    }
    sb.append("\n])");
    return sb.toString();
  }
}
