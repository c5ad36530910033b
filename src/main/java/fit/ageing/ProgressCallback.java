package fit.ageing;

/**
 * Receives progress reports from a running analysis, and tells the analysis whether it should
 * stop. Cancellation is only checked between datasets.
 */
public interface ProgressCallback {

  /**
   * Callback that ignores progress and never cancels
   */
  ProgressCallback NONE = (percent, message) -> {
  };

  /**
   * Called whenever the analysis moves on
   *
   * @param percent Share of the work done so far, 0 to 100
   * @param message Description of the current step
   */
  void updateProgress(int percent, String message);

  /**
   * Whether the analysis should stop before starting on the next dataset
   *
   * @return true to stop the analysis
   */
  default boolean isCancelled() {
    return false;
  }

}
