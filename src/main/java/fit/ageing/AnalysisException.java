package fit.ageing;

/**
 * Thrown when a dataset cannot be analyzed. The message names the dataset date, and the
 * module identifier when the failure is tied to one module's trace file, so the failing input
 * can be found without a stack trace.
 */
public class AnalysisException extends RuntimeException {

  private final String date;
  private final String moduleIdentifier;

  /**
   * @param date Date of the dataset being analyzed
   * @param moduleIdentifier Identifier of the failing module, or null if no one module failed
   * @param message Description of the failure
   * @param cause Underlying exception
   */
  public AnalysisException(String date, String moduleIdentifier, String message,
      Throwable cause) {
    super("Dataset " + date + ": " + message, cause);
    this.date = date;
    this.moduleIdentifier = moduleIdentifier;
  }

  public AnalysisException(String date, String message, Throwable cause) {
    this(date, null, message, cause);
  }

  public String getDate() {
    return date;
  }

  /**
   * Get the identifier of the module whose processing failed
   *
   * @return module identifier, or null if the failure is not tied to one module
   */
  public String getModuleIdentifier() {
    return moduleIdentifier;
  }
}
