package fit.ageing.entities;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * One calibration run, identified by its date. A dataset holds the modules read from that run's
 * trace files, exactly one of which is the reference module, and the reference means computed
 * from the reference module's reference channels.
 *
 * Datasets are immutable; {@link #withModules(List)} and {@link #withReferenceMeans(double,
 * double)} return copies. The reference module is looked up by identifier rather than held
 * as a separate handle, so replacing the module list can never leave a stale reference behind.
 */
public class Dataset {

  /**
   * Orders datasets chronologically by their date strings (ISO dates sort lexically)
   */
  public static final Comparator<Dataset> BY_DATE = new Comparator<Dataset>() {
    @Override
    public int compare(Dataset first, Dataset second) {
      return first.getDate().compareTo(second.getDate());
    }
  };

  private final String date;
  private final List<Module> modules;
  private final String referenceModuleIdentifier;
  private final double referenceGaussianMean;
  private final double referenceWeightedMean;

  /**
   * Create a dataset, checking that exactly one module is the reference module
   *
   * @param date Date of the calibration run
   * @param modules Modules of the run
   * @param referenceModuleIdentifier Identifier of the reference PM (refCH.PM)
   * @throws IllegalArgumentException if the reference module is missing or duplicated
   */
  public Dataset(String date, List<Module> modules, String referenceModuleIdentifier) {
    this(date, modules, referenceModuleIdentifier, 0., 0.);
  }

  private Dataset(String date, List<Module> modules, String referenceModuleIdentifier,
      double referenceGaussianMean, double referenceWeightedMean) {
    this.date = date;
    this.modules = Collections.unmodifiableList(new ArrayList<>(modules));
    this.referenceModuleIdentifier = referenceModuleIdentifier;
    this.referenceGaussianMean = referenceGaussianMean;
    this.referenceWeightedMean = referenceWeightedMean;

    int matches = 0;
    for (Module module : this.modules) {
      if (module.getIdentifier().equals(referenceModuleIdentifier)) {
        ++matches;
      }
    }
    if (matches == 0) {
      throw new IllegalArgumentException("Reference module " + referenceModuleIdentifier
          + " not in files for dataset " + date);
    }
    if (matches > 1) {
      throw new IllegalArgumentException("Reference module " + referenceModuleIdentifier
          + " appears " + matches + " times in dataset " + date);
    }
  }

  public Dataset withModules(List<Module> newModules) {
    return new Dataset(date, newModules, referenceModuleIdentifier,
        referenceGaussianMean, referenceWeightedMean);
  }

  public Dataset withReferenceMeans(double gaussianMean, double weightedMean) {
    return new Dataset(date, modules, referenceModuleIdentifier, gaussianMean, weightedMean);
  }

  public String getDate() {
    return date;
  }

  public List<Module> getModules() {
    return modules;
  }

  public String getReferenceModuleIdentifier() {
    return referenceModuleIdentifier;
  }

  /**
   * Get the reference module of this dataset
   *
   * @return the module whose identifier is the configured reference PM
   */
  public Module getReferenceModule() {
    for (Module module : modules) {
      if (module.getIdentifier().equals(referenceModuleIdentifier)) {
        return module;
      }
    }
    // unreachable, checked on construction
    throw new IllegalStateException("Reference module " + referenceModuleIdentifier
        + " not in dataset " + date);
  }

  /**
   * Find a module by its identifier
   *
   * @param identifier PM identifier
   * @return the module, or null if the dataset has none with that identifier
   */
  public Module getModule(String identifier) {
    for (Module module : modules) {
      if (module.getIdentifier().equals(identifier)) {
        return module;
      }
    }
    return null;
  }

  public double getReferenceGaussianMean() {
    return referenceGaussianMean;
  }

  public double getReferenceWeightedMean() {
    return referenceWeightedMean;
  }

  /**
   * Total number of channels over all modules
   *
   * @return channel count
   */
  public int getChannelCount() {
    int count = 0;
    for (Module module : modules) {
      count += module.getChannels().size();
    }
    return count;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("Dataset(date=").append(date).append(", modules=[");
    for (int i = 0; i < modules.size(); ++i) {
      sb.append(modules.get(i));
      if (i + 1 < modules.size()) {
        sb.append(", ");
      }
    }
    sb.append("], reference_module=").append(referenceModuleIdentifier).append(")");
    return sb.toString();
  }
}
