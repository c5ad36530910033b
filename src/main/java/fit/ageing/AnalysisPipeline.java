package fit.ageing;

import fit.ageing.entities.Dataset;
import fit.ageing.input.Configuration;
import fit.ageing.stage.AnalysisStage;
import fit.ageing.stage.CrossDatasetNormalizer;
import fit.ageing.stage.DistributionFitter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import javax.swing.event.ChangeListener;
import org.apache.log4j.Logger;

/**
 * Runs the full analysis over a set of datasets. Each dataset goes through the stages listed in
 * {@link StageFactory}, in order and one dataset at a time, starting with the earliest; once all
 * datasets are done their ageing factors are normalized against the earliest dataset.
 *
 * Any stage failure aborts the run with an {@link AnalysisException} naming the dataset. The run
 * can be cancelled through the progress callback; this is checked before each dataset, so the
 * dataset in progress is always finished first.
 */
public class AnalysisPipeline {

  private static final Logger logger = Logger.getLogger(AnalysisPipeline.class);

  private final Configuration config;
  private final Map<String, Map<String, Integer>> warningCounts;

  /**
   * @param config Settings providing the peak detection parameters and debug plot options
   */
  public AnalysisPipeline(Configuration config) {
    this.config = config;
    warningCounts = new LinkedHashMap<>();
  }

  /**
   * Analyze a set of datasets
   *
   * @param datasets Datasets holding modules (without channels), in any order
   * @param callback Receiver of progress reports, also asked whether to cancel
   * @return Fully analyzed copies of the datasets, in date order
   * @throws AnalysisException if a stage fails on any dataset
   * @throws CancellationException if the callback cancelled the run
   */
  public List<Dataset> run(List<Dataset> datasets, final ProgressCallback callback) {
    List<Dataset> sorted = new ArrayList<>(datasets);
    Collections.sort(sorted, Dataset.BY_DATE);
    warningCounts.clear();

    StageFactory[] stageTypes = StageFactory.values();
    // one step per stage per dataset, plus normalization
    final int totalSteps = sorted.size() * stageTypes.length + 1;
    int step = 0;

    List<Dataset> processed = new ArrayList<>();
    for (Dataset dataset : sorted) {
      if (callback.isCancelled()) {
        logger.info("Analysis cancelled before dataset " + dataset.getDate());
        throw new CancellationException("Analysis cancelled before dataset "
            + dataset.getDate());
      }
      logger.info("Processing dataset " + dataset.getDate() + "...");

      Dataset current = dataset;
      for (StageFactory stageType : stageTypes) {
        final int percent = percent(step, totalSteps);
        final AnalysisStage stage = stageType.createStage(config);
        ChangeListener listener = e -> callback.updateProgress(percent, stage.getStatus());
        stage.addChangeListener(listener);
        try {
          current = stage.runOnDataset(current);
        } catch (AnalysisException e) {
          throw e;
        } catch (RuntimeException e) {
          logger.error("Error in " + stage.getName() + " for dataset " + dataset.getDate(), e);
          throw new AnalysisException(dataset.getDate(), e.getMessage(), e);
        } finally {
          stage.removeChangeListener(listener);
        }
        if (stage instanceof DistributionFitter) {
          warningCounts.put(dataset.getDate(), ((DistributionFitter) stage).getWarningCounts());
        }
        ++step;
      }
      processed.add(current);
      logger.info("Dataset " + dataset.getDate() + " processed.");
    }

    callback.updateProgress(percent(step, totalSteps), "Normalizing ageing factors...");
    List<Dataset> normalized = new CrossDatasetNormalizer().normalize(processed);
    callback.updateProgress(100, "Analysis complete");
    return normalized;
  }

  /**
   * Analyze a set of datasets without reporting progress
   *
   * @param datasets Datasets holding modules (without channels)
   * @return Fully analyzed copies of the datasets, in date order
   */
  public List<Dataset> run(List<Dataset> datasets) {
    return run(datasets, ProgressCallback.NONE);
  }

  /**
   * Get the fit warning counts of the last run, per dataset date and module identifier
   *
   * @return nested map of warning counts
   */
  public Map<String, Map<String, Integer>> getWarningCounts() {
    return Collections.unmodifiableMap(warningCounts);
  }

  private static int percent(int step, int totalSteps) {
    return (int) (100L * step / totalSteps);
  }

}
