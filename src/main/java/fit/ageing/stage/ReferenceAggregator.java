package fit.ageing.stage;

import fit.ageing.entities.Channel;
import fit.ageing.entities.Dataset;
import fit.ageing.entities.Module;
import java.util.ArrayList;
import java.util.List;
import org.apache.log4j.Logger;

/**
 * Averages the statistics of the reference module's reference channels into the dataset's
 * reference means. A channel with a NaN statistic is left out of both averages.
 */
public class ReferenceAggregator extends AnalysisStage {

  private static final Logger logger = Logger.getLogger(ReferenceAggregator.class);

  @Override
  public String getName() {
    return "reference mean calculation";
  }

  /**
   * {@inheritDoc}
   *
   * @throws IllegalStateException if no reference channel has usable statistics
   */
  @Override
  protected Dataset backend(final Dataset dataset) {
    Module referenceModule = dataset.getReferenceModule();
    logger.info("Extracting reference means from reference module: " + referenceModule);

    List<Double> gaussianMeans = new ArrayList<>();
    List<Double> weightedMeans = new ArrayList<>();
    for (Channel channel : referenceModule.getReferenceChannels()) {
      if (!channel.hasValidMeans()) {
        logger.warn("Reference channel: " + channel + " contains NaN values.");
        continue;
      }
      logger.debug("Extracting reference means from reference channel: " + channel);
      gaussianMeans.add(channel.getGaussianMean());
      weightedMeans.add(channel.getWeightedMean());
    }

    if (gaussianMeans.size() != weightedMeans.size()) {
      throw new IllegalStateException("Reference channels contain insufficient data for "
          + "calculation. Gaussian means: " + gaussianMeans.size() + ", Weighted means: "
          + weightedMeans.size());
    }
    if (gaussianMeans.isEmpty()) {
      throw new IllegalStateException("Reference channels contain no data for calculation.");
    }

    double gaussianMean = average(gaussianMeans);
    double weightedMean = average(weightedMeans);
    logger.info("Reference Gaussian mean: " + gaussianMean + ", Reference Weighted mean: "
        + weightedMean);
    return dataset.withReferenceMeans(gaussianMean, weightedMean);
  }

  private static double average(List<Double> values) {
    double total = 0.;
    for (double value : values) {
      total += value;
    }
    return total / values.size();
  }

}
