package fit.ageing.stage;

import fit.ageing.entities.AgeingFactor;
import fit.ageing.entities.Channel;
import fit.ageing.entities.Dataset;
import fit.ageing.entities.Module;
import java.util.ArrayList;
import java.util.List;
import org.apache.log4j.Logger;

/**
 * Divides the statistics of every channel of a dataset, reference channels included, by the
 * dataset's reference means to give the channel's raw ageing factors.
 */
public class AgeingCalculator extends AnalysisStage {

  private static final Logger logger = Logger.getLogger(AgeingCalculator.class);

  @Override
  public String getName() {
    return "ageing factor calculation";
  }

  /**
   * {@inheritDoc}
   *
   * @throws ArithmeticException if either reference mean of the dataset is zero
   */
  @Override
  protected Dataset backend(final Dataset dataset) {
    double referenceGaussian = dataset.getReferenceGaussianMean();
    double referenceWeighted = dataset.getReferenceWeightedMean();
    if (referenceGaussian == 0. || referenceWeighted == 0.) {
      throw new ArithmeticException("Reference mean is zero for dataset " + dataset.getDate()
          + " (Gaussian " + referenceGaussian + ", weighted " + referenceWeighted + ")");
    }

    List<Module> modules = new ArrayList<>();
    for (Module module : dataset.getModules()) {
      List<Channel> channels = new ArrayList<>();
      for (Channel channel : module.getChannels()) {
        AgeingFactor gaussian = AgeingFactor.of(channel.getGaussianMean() / referenceGaussian);
        AgeingFactor weighted = AgeingFactor.of(channel.getWeightedMean() / referenceWeighted);
        channels.add(channel.withAgeingFactors(gaussian, weighted));
        logger.debug(module.getIdentifier() + " " + channel.getName() + ": Gaussian ageing "
            + "factor = " + gaussian + ", weighted ageing factor = " + weighted);
      }
      modules.add(module.withChannels(channels));
    }
    logger.info("Ageing factors calculated for dataset " + dataset.getDate());
    return dataset.withModules(modules);
  }

}
