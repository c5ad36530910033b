package fit.ageing.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fit.ageing.entities.AgeingFactor;
import fit.ageing.entities.Channel;
import fit.ageing.entities.Dataset;
import fit.ageing.entities.Module;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import org.apache.log4j.Logger;

/**
 * Writes analysis results as a JSON document, reads such documents back, and flattens them into
 * CSV tables with one row per channel. The document has the form
 *
 * <pre>
 * {
 *   "datasets": [
 *     {"date": ..., "reference_means": {"gaussian_mean": ..., "weighted_mean": ...},
 *      "modules": [{"identifier": ..., "channels": [...]}]}
 *   ],
 *   "metadata": {"generated_at": ..., "version": "1.0.0", "analysis_type": "ageing_analysis"}
 * }
 * </pre>
 *
 * Channels whose means are not numbers print "N/A" in place of their means and factors, as do
 * single unavailable factors.
 */
public class ResultWriter {

  public static final String VERSION = "1.0.0";
  public static final String ANALYSIS_TYPE = "ageing_analysis";
  public static final String FILE_PREFIX = "ageing_analysis_results_";

  public static final String[] CSV_COLUMNS = {"date", "module", "channel", "gaussian_mean",
      "weighted_mean", "gaussian_ageing_factor", "weighted_ageing_factor",
      "normalized_gauss_ageing_factor", "normalized_weighted_ageing_factor"};

  private static final DateTimeFormatter FILE_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

  private static final Logger logger = Logger.getLogger(ResultWriter.class);

  private static final ObjectMapper JSON_MAPPER =
      new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  private ResultWriter() {
  }

  /**
   * Build the results document for a set of analyzed datasets
   *
   * @param datasets Analyzed datasets
   * @param includeSignalData Whether to include each channel's signal series
   * @return JSON results document
   */
  public static ObjectNode toJson(List<Dataset> datasets, boolean includeSignalData) {
    ObjectNode root = JSON_MAPPER.createObjectNode();
    ArrayNode datasetArray = root.putArray("datasets");
    for (Dataset dataset : datasets) {
      datasetArray.add(datasetToJson(dataset, includeSignalData));
    }
    ObjectNode metadata = root.putObject("metadata");
    metadata.put("generated_at", LocalDateTime.now().toString());
    metadata.put("version", VERSION);
    metadata.put("analysis_type", ANALYSIS_TYPE);
    return root;
  }

  static ObjectNode datasetToJson(Dataset dataset, boolean includeSignalData) {
    ObjectNode node = JSON_MAPPER.createObjectNode();
    node.put("date", dataset.getDate());
    ObjectNode referenceMeans = node.putObject("reference_means");
    referenceMeans.put("gaussian_mean", dataset.getReferenceGaussianMean());
    referenceMeans.put("weighted_mean", dataset.getReferenceWeightedMean());
    ArrayNode modules = node.putArray("modules");
    for (Module module : dataset.getModules()) {
      ObjectNode moduleNode = modules.addObject();
      moduleNode.put("identifier", module.getIdentifier());
      ArrayNode channels = moduleNode.putArray("channels");
      for (Channel channel : module.getChannels()) {
        channels.add(channelToJson(channel, includeSignalData));
      }
    }
    return node;
  }

  static ObjectNode channelToJson(Channel channel, boolean includeSignalData) {
    ObjectNode node = JSON_MAPPER.createObjectNode();
    node.put("name", channel.getName());
    if (!channel.hasValidMeans()) {
      node.put("means", AgeingFactor.NOT_AVAILABLE);
      node.put("ageing_factors", AgeingFactor.NOT_AVAILABLE);
      return node;
    }

    ObjectNode means = node.putObject("means");
    means.put("gaussian_mean", channel.getGaussianMean());
    means.put("weighted_mean", channel.getWeightedMean());

    ObjectNode factors = node.putObject("ageing_factors");
    putFactor(factors, "gaussian_ageing_factor", channel.getGaussianAgeingFactor());
    putFactor(factors, "weighted_ageing_factor", channel.getWeightedAgeingFactor());
    putFactor(factors, "normalized_gauss_ageing_factor",
        channel.getNormalizedGaussAgeingFactor());
    putFactor(factors, "normalized_weighted_ageing_factor",
        channel.getNormalizedWeightedAgeingFactor());

    if (channel.getIntegratedCharge() != null) {
      node.put("integratedCharge", channel.getIntegratedCharge());
    }
    if (includeSignalData && channel.getSignal() != null) {
      ArrayNode signal = node.putArray("signal_data");
      for (double point : channel.getSignal().getData()) {
        signal.add(point);
      }
      if (channel.getTotalSignal() != null) {
        ArrayNode total = node.putArray("total_signal_data");
        for (double point : channel.getTotalSignal().getData()) {
          total.add(point);
        }
      }
    }
    return node;
  }

  private static void putFactor(ObjectNode node, String name, AgeingFactor factor) {
    if (factor.isAvailable()) {
      node.put(name, factor.getValue());
    } else {
      node.put(name, AgeingFactor.NOT_AVAILABLE);
    }
  }

  /**
   * Write the results of an analysis to a file, creating its folder if needed
   *
   * @param datasets Analyzed datasets
   * @param outputFile File to write
   * @param includeSignalData Whether to include each channel's signal series
   * @return The file written
   * @throws IOException if the file cannot be written
   */
  public static File write(List<Dataset> datasets, File outputFile, boolean includeSignalData)
      throws IOException {
    createParent(outputFile);
    JSON_MAPPER.writeValue(outputFile, toJson(datasets, includeSignalData));
    logger.info("Results saved successfully to " + outputFile.getPath());
    return outputFile;
  }

  /**
   * Write the results of an analysis to a timestamped file in the given folder
   *
   * @param datasets Analyzed datasets
   * @param outputFolder Folder to write into
   * @param includeSignalData Whether to include each channel's signal series
   * @return The file written
   * @throws IOException if the file cannot be written
   */
  public static File writeToFolder(List<Dataset> datasets, File outputFolder,
      boolean includeSignalData) throws IOException {
    return write(datasets, defaultFile(outputFolder, ".json"), includeSignalData);
  }

  /**
   * Name of a timestamped result file in a folder
   *
   * @param outputFolder Folder the file goes in
   * @param extension File extension, including the dot
   * @return result file
   */
  public static File defaultFile(File outputFolder, String extension) {
    String timestamp = LocalDateTime.now().format(FILE_TIMESTAMP);
    return new File(outputFolder, FILE_PREFIX + timestamp + extension);
  }

  /**
   * Read a results document back from a file
   *
   * @param resultsFile File to read
   * @return results document
   * @throws IOException if the file cannot be read or is not valid JSON
   */
  public static JsonNode load(File resultsFile) throws IOException {
    JsonNode results = JSON_MAPPER.readTree(resultsFile);
    logger.info("Results loaded successfully from " + resultsFile.getPath());
    return results;
  }

  /**
   * Flatten a results document to a CSV file, one row per channel. Values missing from the
   * document are written as "N/A".
   *
   * @param results Results document
   * @param csvFile File to write
   * @return The file written
   * @throws IOException if the file cannot be written
   */
  public static File exportCsv(JsonNode results, File csvFile) throws IOException {
    createParent(csvFile);
    int rows = 0;
    try (BufferedWriter bw = Files.newBufferedWriter(csvFile.toPath(), StandardCharsets.UTF_8);
        PrintWriter writer = new PrintWriter(bw)) {
      writer.println(String.join(",", CSV_COLUMNS));
      for (JsonNode dataset : results.path("datasets")) {
        String date = dataset.path("date").asText("unknown");
        for (JsonNode module : dataset.path("modules")) {
          String identifier = module.path("identifier").asText("unknown");
          for (JsonNode channel : module.path("channels")) {
            JsonNode means = channel.path("means");
            JsonNode factors = channel.path("ageing_factors");
            String[] row = {
                date,
                identifier,
                channel.path("name").asText("unknown"),
                csvValue(means.path("gaussian_mean")),
                csvValue(means.path("weighted_mean")),
                csvValue(factors.path("gaussian_ageing_factor")),
                csvValue(factors.path("weighted_ageing_factor")),
                csvValue(factors.path("normalized_gauss_ageing_factor")),
                csvValue(factors.path("normalized_weighted_ageing_factor"))};
            for (int i = 0; i < row.length; ++i) {
              row[i] = escapeCsv(row[i]);
            }
            writer.println(String.join(",", row));
            ++rows;
          }
        }
      }
      if (writer.checkError()) {
        throw new IOException("Error writing CSV file " + csvFile.getPath());
      }
    }
    logger.info("Results exported to CSV (" + rows + " rows): " + csvFile.getPath());
    return csvFile;
  }

  private static String csvValue(JsonNode value) {
    if (value.isMissingNode() || value.isNull()) {
      return AgeingFactor.NOT_AVAILABLE;
    }
    return value.asText();
  }

  private static String escapeCsv(String value) {
    if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
      return "\"" + value.replace("\"", "\"\"") + "\"";
    }
    return value;
  }

  private static void createParent(File file) throws IOException {
    File parent = file.getAbsoluteFile().getParentFile();
    if (parent != null && !parent.exists() && !parent.mkdirs()) {
      throw new IOException("Could not create folder " + parent.getPath());
    }
  }

}
