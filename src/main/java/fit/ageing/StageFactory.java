package fit.ageing;

import fit.ageing.input.Configuration;
import fit.ageing.stage.AgeingCalculator;
import fit.ageing.stage.AnalysisStage;
import fit.ageing.stage.DistributionFitter;
import fit.ageing.stage.ReferenceAggregator;
import fit.ageing.stage.TraceExtractor;
import java.io.File;

/**
 * Enumerated type defining the stages run on each dataset, in the order they run, and creating
 * the associated AnalysisStage from the application settings.
 *
 * If adding a new stage, make sure to also create a new extension for AnalysisStage. The
 * pipeline runs the stages in the order they are listed here.
 */
public enum StageFactory {

  EXTRACT("Trace extraction") {
    @Override
    public AnalysisStage createStage(Configuration config) {
      return new TraceExtractor(config.getProminencePercent(), config.getMergeThreshold(),
          plotFolder(config));
    }
  },
  FIT("Gaussian fit") {
    @Override
    public AnalysisStage createStage(Configuration config) {
      return new DistributionFitter(plotFolder(config));
    }
  },
  REFERENCE("Reference means") {
    @Override
    public AnalysisStage createStage(Configuration config) {
      return new ReferenceAggregator();
    }
  },
  AGEING("Ageing factors") {
    @Override
    public AnalysisStage createStage(Configuration config) {
      return new AgeingCalculator();
    }
  };

  private final String name;

  StageFactory(String name) {
    this.name = name;
  }

  private static File plotFolder(Configuration config) {
    if (!config.writeDebugPlots()) {
      return null;
    }
    return new File(config.getDebugPlotFolder());
  }

  /**
   * Instantiate a stage with its parameters taken from the settings
   *
   * @param config Application settings
   * @return Stage ready to run on a dataset
   */
  public abstract AnalysisStage createStage(Configuration config);

  /**
   * Get the full name of this stage.
   *
   * @return The full name of this stage
   */
  public String getName() {
    return name;
  }

}
