package fit.ageing.output;

import fit.ageing.entities.AgeingFactor;
import fit.ageing.entities.Channel;
import fit.ageing.entities.Dataset;
import fit.ageing.entities.Module;
import fit.ageing.utils.NumericUtils;
import java.text.DecimalFormat;
import java.util.List;

/**
 * Counts of what an analysis covered, and the mean normalized Gaussian ageing factor over every
 * channel where one is available. Channels whose means are not numbers are left out of the mean,
 * as they are reported as "N/A" in the results. Rendered as the report printed when a run ends.
 */
public class AnalysisSummary {

  private final int datasetCount;
  private final int moduleCount;
  private final int channelCount;
  private final int availableFactorCount;
  private final double meanNormalizedGaussFactor;

  public AnalysisSummary(List<Dataset> datasets) {
    int modules = 0;
    int channels = 0;
    int available = 0;
    double total = 0.;
    for (Dataset dataset : datasets) {
      modules += dataset.getModules().size();
      for (Module module : dataset.getModules()) {
        channels += module.getChannels().size();
        for (Channel channel : module.getChannels()) {
          AgeingFactor factor = channel.getNormalizedGaussAgeingFactor();
          if (channel.hasValidMeans() && factor.isAvailable()) {
            total += factor.getValue();
            ++available;
          }
        }
      }
    }
    datasetCount = datasets.size();
    moduleCount = modules;
    channelCount = channels;
    availableFactorCount = available;
    meanNormalizedGaussFactor = available == 0 ? Double.NaN : total / available;
  }

  public int getDatasetCount() {
    return datasetCount;
  }

  public int getModuleCount() {
    return moduleCount;
  }

  public int getChannelCount() {
    return channelCount;
  }

  /**
   * Number of channels that have a normalized Gaussian ageing factor
   *
   * @return count of available factors
   */
  public int getAvailableFactorCount() {
    return availableFactorCount;
  }

  /**
   * Mean of the available normalized Gaussian ageing factors
   *
   * @return mean factor, or NaN if no channel has one
   */
  public double getMeanNormalizedGaussFactor() {
    return meanNormalizedGaussFactor;
  }

  @Override
  public String toString() {
    DecimalFormat df = NumericUtils.DECIMAL_FORMAT.get();
    StringBuilder sb = new StringBuilder();
    sb.append("Analysis summary:\n");
    sb.append("  Datasets processed: ").append(datasetCount).append('\n');
    sb.append("  Modules processed: ").append(moduleCount).append('\n');
    sb.append("  Channels processed: ").append(channelCount).append('\n');
    sb.append("  Mean normalized Gaussian ageing factor: ");
    if (availableFactorCount == 0) {
      sb.append(AgeingFactor.NOT_AVAILABLE);
    } else {
      sb.append(df.format(meanNormalizedGaussFactor));
      sb.append(" (over ").append(availableFactorCount).append(" channels)");
    }
    return sb.toString();
  }

}
