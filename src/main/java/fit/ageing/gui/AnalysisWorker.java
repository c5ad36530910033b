package fit.ageing.gui;

import fit.ageing.AnalysisException;
import fit.ageing.AnalysisPipeline;
import fit.ageing.ProgressCallback;
import fit.ageing.entities.Dataset;
import fit.ageing.input.TraceFile.TraceFormatException;
import fit.ageing.utils.PeakDetectionException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import javax.swing.SwingWorker;
import org.apache.log4j.Logger;

/**
 * Runs an analysis off the event dispatch thread for a host UI. Progress messages are published
 * to the listener on the event dispatch thread and the percentage is exposed through the
 * worker's "progress" property. Cancelling the worker stops the analysis before its next
 * dataset.
 */
public class AnalysisWorker extends SwingWorker<List<Dataset>, String>
    implements ProgressCallback {

  /**
   * Receives the outcome of a background analysis. All methods are called on the event dispatch
   * thread.
   */
  public interface AnalysisListener {

    void progressMessage(String message);

    void analysisFinished(List<Dataset> results);

    void analysisFailed(String message);
  }

  private static final Logger logger = Logger.getLogger(AnalysisWorker.class);

  private final AnalysisPipeline pipeline;
  private final List<Dataset> datasets;
  private final AnalysisListener listener;

  /**
   * @param pipeline Pipeline holding the analysis settings
   * @param datasets Datasets to analyze
   * @param listener Receiver of progress and of the outcome
   */
  public AnalysisWorker(AnalysisPipeline pipeline, List<Dataset> datasets,
      AnalysisListener listener) {
    this.pipeline = pipeline;
    this.datasets = new ArrayList<>(datasets);
    this.listener = listener;
  }

  @Override
  protected List<Dataset> doInBackground() {
    return pipeline.run(datasets, this);
  }

  @Override
  public void updateProgress(int percent, String message) {
    setProgress(Math.max(0, Math.min(100, percent)));
    publish(message);
  }

  @Override
  protected void process(List<String> messages) {
    for (String message : messages) {
      listener.progressMessage(message);
    }
  }

  @Override
  protected void done() {
    try {
      listener.analysisFinished(get());
    } catch (CancellationException ex) {
      logger.info("Analysis cancelled");
      listener.analysisFailed("CANCELLED");
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      logger.error("Analysis failed", cause);
      listener.analysisFailed(errorMessage(cause));
    } catch (InterruptedException ex) {
      logger.error("Analysis interrupted", ex);
      Thread.currentThread().interrupt();
      listener.analysisFailed(ex.getMessage() == null ? "CANCELLED" : ex.getMessage());
    }
  }

  /**
   * Text shown to the user when a background analysis fails
   *
   * @param cause Exception thrown by the analysis
   * @return explanation of the failure
   */
  static String errorMessage(Throwable cause) {
    if (cause instanceof CancellationException) {
      return "CANCELLED";
    }
    StringBuilder text = new StringBuilder();
    Throwable source = cause;
    if (cause instanceof AnalysisException) {
      AnalysisException ae = (AnalysisException) cause;
      text.append("Analysis could not be completed for dataset ").append(ae.getDate());
      if (ae.getModuleIdentifier() != null) {
        text.append(" (module ").append(ae.getModuleIdentifier()).append(')');
      }
      text.append(".\n");
      if (cause.getCause() != null) {
        source = cause.getCause();
      }
    }
    if (source instanceof PeakDetectionException) {
      text.append("A reference channel trace did not show the two expected peaks.\n");
      text.append("Check the reference channels given for that dataset.\n");
    } else if (source instanceof TraceFormatException) {
      text.append("A trace file does not have the expected column layout.\n");
    } else if (source instanceof IOException) {
      text.append("A trace file could not be read.\n");
    } else if (source instanceof IllegalStateException) {
      text.append("No reference channel produced usable statistics.\n");
    }
    if (text.length() > 0) {
      text.append("Here is the error message returned by the backend:\n");
    }
    text.append(cause.getMessage() == null ? cause.toString() : cause.getMessage());
    return text.toString();
  }

}
