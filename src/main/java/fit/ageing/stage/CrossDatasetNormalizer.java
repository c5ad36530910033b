package fit.ageing.stage;

import fit.ageing.entities.AgeingFactor;
import fit.ageing.entities.Channel;
import fit.ageing.entities.Dataset;
import fit.ageing.entities.Module;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.log4j.Logger;

/**
 * Normalizes the ageing factors of all datasets against the earliest one. Each channel's raw
 * factors are divided by the same channel's raw factors in the baseline dataset, which is the
 * first dataset in date order.
 *
 * Normalization never fails: a channel missing from the baseline, a zero or unavailable baseline
 * factor, or an unavailable factor of the channel itself gives an unavailable normalized factor.
 */
public class CrossDatasetNormalizer {

  private static final Logger logger = Logger.getLogger(CrossDatasetNormalizer.class);

  /**
   * Normalize a set of datasets
   *
   * @param datasets Datasets with raw ageing factors set, in any order
   * @return Copies of the datasets in date order, with normalized factors set
   */
  public List<Dataset> normalize(List<Dataset> datasets) {
    List<Dataset> sorted = new ArrayList<>(datasets);
    Collections.sort(sorted, Dataset.BY_DATE);
    if (sorted.isEmpty()) {
      logger.warn("No datasets to normalize.");
      return sorted;
    }

    Dataset baseline = sorted.get(0);
    logger.info("Normalizing ageing factors against dataset " + baseline.getDate());
    Map<String, Channel> divisors = new HashMap<>();
    for (Module module : baseline.getModules()) {
      for (Channel channel : module.getChannels()) {
        divisors.put(key(module, channel), channel);
      }
    }

    List<Dataset> normalized = new ArrayList<>();
    for (Dataset dataset : sorted) {
      List<Module> modules = new ArrayList<>();
      for (Module module : dataset.getModules()) {
        List<Channel> channels = new ArrayList<>();
        for (Channel channel : module.getChannels()) {
          Channel divisor = divisors.get(key(module, channel));
          AgeingFactor gaussian = AgeingFactor.UNAVAILABLE;
          AgeingFactor weighted = AgeingFactor.UNAVAILABLE;
          if (divisor == null) {
            logger.warn("No baseline factors for " + module.getIdentifier() + " "
                + channel.getName() + " in dataset " + dataset.getDate());
          } else {
            gaussian = channel.getGaussianAgeingFactor()
                .divide(divisor.getGaussianAgeingFactor());
            weighted = channel.getWeightedAgeingFactor()
                .divide(divisor.getWeightedAgeingFactor());
          }
          channels.add(channel.withNormalizedAgeingFactors(gaussian, weighted));
        }
        modules.add(module.withChannels(channels));
      }
      normalized.add(dataset.withModules(modules));
    }
    logger.info("Normalized ageing factors of " + normalized.size() + " datasets");
    return normalized;
  }

  private static String key(Module module, Channel channel) {
    return module.getIdentifier() + "/" + channel.getName();
  }

}
