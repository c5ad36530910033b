package fit.ageing.stage;

import fit.ageing.entities.Channel;
import fit.ageing.entities.Dataset;
import fit.ageing.entities.Module;
import fit.ageing.utils.GaussianFitter;
import fit.ageing.utils.NumericUtils;
import fit.ageing.utils.ReportingUtils;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.log4j.Logger;
import org.jfree.chart.JFreeChart;

/**
 * Computes the two statistics of every channel: the mean of a Gaussian fitted to the channel's
 * signal, and the signal's intensity-weighted mean. Either statistic that comes out as exactly 0
 * is computed again on the channel's noise series, if it has one, and that second result is
 * kept whatever it is.
 *
 * Channels that needed the noise series or still ended with a zero statistic are counted as
 * warnings for their module. Warnings are logged and never stop the analysis.
 */
public class DistributionFitter extends AnalysisStage {

  private static final Logger logger = Logger.getLogger(DistributionFitter.class);

  private final File plotFolder;
  private final Map<String, Integer> warningCounts;

  public DistributionFitter() {
    this(null);
  }

  /**
   * @param plotFolder Folder to write debug plots under, or null for no plots
   */
  public DistributionFitter(File plotFolder) {
    this.plotFolder = plotFolder;
    warningCounts = new LinkedHashMap<>();
  }

  @Override
  public String getName() {
    return "Gaussian fit";
  }

  @Override
  protected Dataset backend(final Dataset dataset) {
    warningCounts.clear();
    int totalWarnings = 0;
    List<Module> modules = new ArrayList<>();

    for (Module module : dataset.getModules()) {
      fireStateChange("Fitting channels of " + module.getIdentifier());
      int moduleWarnings = 0;
      List<Channel> channels = new ArrayList<>();

      for (Channel channel : module.getChannels()) {
        File plotFile = plotFile(dataset.getDate(), module.getIdentifier(), channel.getName());

        double[] signal = channel.getSignal().getData();
        double[] fitted = signal;
        GaussianFitter fitter = new GaussianFitter(fitted);
        double gaussianMean = fitter.getMean();
        boolean fallback = false;
        if (gaussianMean == 0. && channel.hasNoise()) {
          logger.warn("Retrying Gaussian fit of " + module.getIdentifier() + " "
              + channel.getName() + " with noise data.");
          fitted = channel.getNoise().getData();
          fitter = new GaussianFitter(fitted);
          gaussianMean = fitter.getMean();
          fallback = true;
        }
        writeFitPlot(plotFile, channel, fitted, fitter);

        double weightedMean = NumericUtils.weightedMean(signal);
        if (weightedMean == 0. && channel.hasNoise()) {
          logger.warn("Retrying weighted mean calculation of " + module.getIdentifier() + " "
              + channel.getName() + " with noise data.");
          weightedMean = NumericUtils.weightedMean(channel.getNoise().getData());
          fallback = true;
        }

        if (fallback || gaussianMean == 0. || weightedMean == 0.) {
          ++moduleWarnings;
        }
        channels.add(channel.withMeans(gaussianMean, weightedMean));
        logger.debug("Processed " + module.getIdentifier() + " - channel: " + channel
            + " Gaussian mean = " + gaussianMean + ", Weighted mean = " + weightedMean);
      }

      if (moduleWarnings > 0) {
        logger.warn("Gaussian fit and weighted mean calculation completed with "
            + moduleWarnings + " warnings for " + module + ".");
      }
      warningCounts.put(module.getIdentifier(), moduleWarnings);
      totalWarnings += moduleWarnings;
      modules.add(module.withChannels(channels));
    }

    if (totalWarnings > 0) {
      logger.warn("Gaussian fit and weighted mean calculation completed with "
          + totalWarnings + " warnings for dataset " + dataset.getDate() + ".");
    } else {
      logger.info("Gaussian fit and weighted mean calculation completed with no warnings "
          + "for dataset " + dataset.getDate() + ".");
    }
    return dataset.withModules(modules);
  }

  /**
   * Get the warning count of each module from the most recent run. Later runs do not change
   * the returned map.
   *
   * @return module identifier to warning count mapping
   */
  public Map<String, Integer> getWarningCounts() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(warningCounts));
  }

  /**
   * Total number of warnings over all modules from the most recent run
   *
   * @return warning count
   */
  public int getWarningCount() {
    int total = 0;
    for (int count : warningCounts.values()) {
      total += count;
    }
    return total;
  }

  private File plotFile(String date, String identifier, String channelName) {
    if (plotFolder == null) {
      return null;
    }
    File folder = new File(plotFolder, "gaussian_fit" + File.separator + date
        + File.separator + identifier);
    return new File(folder, channelName + "_gaussian_fit.png");
  }

  private void writeFitPlot(File plotFile, Channel channel, double[] data,
      GaussianFitter fitter) {
    if (plotFile == null) {
      return;
    }
    String title = "Gaussian Fit - " + plotFile.getParentFile().getName() + " - "
        + channel.getName() + (channel.isReference() ? " Reference" : "");
    JFreeChart chart =
        ReportingUtils.createFitChart(title, data, fitter.getParameters());
    try {
      ReportingUtils.writeChartToPNG(chart, plotFile);
      logger.debug("Debug plot saved: " + plotFile.getPath());
    } catch (IOException e) {
      logger.error("Could not write debug plot " + plotFile.getPath(), e);
    }
  }

}
