package fit.ageing.utils;

/**
 * Thrown when a reference channel trace does not show exactly the two peaks expected of it, or
 * when its maximum lies at the edge of the scanned range.
 */
public class PeakDetectionException extends Exception {

  private final int firstColumn;
  private final int secondColumn;

  public PeakDetectionException(String message, int firstColumn, int secondColumn) {
    super(message + " (columns " + firstColumn + " and " + secondColumn + ")");
    this.firstColumn = firstColumn;
    this.secondColumn = secondColumn;
  }

  public int getFirstColumn() {
    return firstColumn;
  }

  public int getSecondColumn() {
    return secondColumn;
  }
}
