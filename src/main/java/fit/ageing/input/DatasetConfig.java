package fit.ageing.input;

import fit.ageing.entities.Dataset;
import fit.ageing.entities.Module;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.log4j.Logger;

/**
 * One entry of the dataset configuration's "inputs" list, with its base path already resolved.
 * Holds everything needed to build the {@link Dataset} for one calibration run.
 */
public class DatasetConfig {

  private static final Logger logger = Logger.getLogger(DatasetConfig.class);

  private final String date;
  private final File basePath;
  private final Map<String, String> files;
  private final String referencePm;
  private final List<Integer> referenceChannels;
  private final boolean validateHeader;
  private final Map<String, Map<String, Double>> integratedCharge;

  /**
   * @param date Date of the calibration run
   * @param basePath Resolved folder the module files are relative to
   * @param files Module identifier to file name mapping, in configuration order
   * @param referencePm Identifier of the reference module
   * @param referenceChannels Channel numbers of the reference channels
   * @param validateHeader Whether header validation was requested
   * @param integratedCharge Integrated charge per PM and channel, may be null
   */
  public DatasetConfig(String date, File basePath, Map<String, String> files,
      String referencePm, List<Integer> referenceChannels, boolean validateHeader,
      Map<String, Map<String, Double>> integratedCharge) {
    this.date = date;
    this.basePath = basePath;
    this.files = Collections.unmodifiableMap(new LinkedHashMap<>(files));
    this.referencePm = referencePm;
    this.referenceChannels = Collections.unmodifiableList(new ArrayList<>(referenceChannels));
    this.validateHeader = validateHeader;
    if (integratedCharge == null) {
      this.integratedCharge = Collections.emptyMap();
    } else {
      this.integratedCharge = Collections.unmodifiableMap(new LinkedHashMap<>(integratedCharge));
    }
  }

  public String getDate() {
    return date;
  }

  public File getBasePath() {
    return basePath;
  }

  public Map<String, String> getFiles() {
    return files;
  }

  public String getReferencePm() {
    return referencePm;
  }

  public List<Integer> getReferenceChannels() {
    return referenceChannels;
  }

  public boolean validateHeader() {
    return validateHeader;
  }

  public Map<String, Map<String, Double>> getIntegratedCharge() {
    return integratedCharge;
  }

  /**
   * Get the integrated charge values configured for a module. PM names are compared after
   * normalization, so "pma0" in the configuration matches module PMA0.
   *
   * @param identifier module identifier
   * @return channel name to integrated charge mapping, empty if none is configured
   */
  public Map<String, Double> getIntegratedCharge(String identifier) {
    String normalized = InputValidation.normalizePmName(identifier);
    for (Map.Entry<String, Map<String, Double>> entry : integratedCharge.entrySet()) {
      if (InputValidation.normalizePmName(entry.getKey()).equals(normalized)) {
        return entry.getValue();
      }
    }
    return Collections.emptyMap();
  }

  /**
   * Build the dataset for this configuration entry, checking the module identifiers and each
   * module's trace file on the way
   *
   * @return dataset with one (channel-less) module per configured file
   * @throws IOException if a trace file is missing or fails validation
   * @throws IllegalArgumentException if an identifier is invalid or the reference module is
   *     not among the files
   */
  public Dataset createDataset() throws IOException {
    List<Module> modules = new ArrayList<>();
    for (Map.Entry<String, String> entry : files.entrySet()) {
      String identifier = entry.getKey();
      if (!InputValidation.isValidModuleIdentifier(identifier)) {
        throw new IllegalArgumentException("Invalid file identifier '" + identifier
            + "'. Expected format is PMA0-PMA9 or PMC0-PMC9.");
      }
      File file = new File(basePath, entry.getValue().trim());
      InputValidation.validateTraceFile(file, identifier, validateHeader);

      boolean reference = identifier.equals(referencePm);
      Map<String, Double> charges = getIntegratedCharge(identifier);
      if (!charges.isEmpty()) {
        logger.debug("Found integrated charge data for module " + identifier);
      }
      modules.add(new Module(identifier, file.getPath(), reference,
          reference ? referenceChannels : null, charges));
      logger.debug("Module " + identifier + " loaded successfully from " + file.getPath());
    }
    Dataset dataset = new Dataset(date, modules, referencePm);
    logger.debug("Dataset " + date + " loaded successfully with " + modules.size() + " modules");
    return dataset;
  }

  @Override
  public String toString() {
    return "DatasetConfig(date=" + date + ", basePath=" + basePath + ", files=" + files
        + ", refCH={PM=" + referencePm + ", CH=" + referenceChannels + "})";
  }
}
