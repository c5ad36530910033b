package fit.ageing.utils;

/**
 * A local maximum of a trace with its prominence and the two prominence bases, i.e., the lowest
 * points on either side before the trace rises above the peak again.
 */
public class Peak {

  private final int position;
  private final int leftBase;
  private final int rightBase;
  private final double prominence;

  public Peak(int position, int leftBase, int rightBase, double prominence) {
    this.position = position;
    this.leftBase = leftBase;
    this.rightBase = rightBase;
    this.prominence = prominence;
  }

  public int getPosition() {
    return position;
  }

  public int getLeftBase() {
    return leftBase;
  }

  public int getRightBase() {
    return rightBase;
  }

  public double getProminence() {
    return prominence;
  }

  /**
   * Check whether another peak is a split detection of this one, meaning both its left and its
   * right base lie fewer than the given number of samples away from this peak's bases
   *
   * @param other peak to compare against
   * @param threshold base distance in samples, exclusive
   * @return true if the two peaks should be merged
   */
  public boolean isDuplicateOf(Peak other, int threshold) {
    return Math.abs(leftBase - other.leftBase) < threshold
        && Math.abs(rightBase - other.rightBase) < threshold;
  }

  /**
   * Merge two detections of the same peak. Position and bases are the (integer) averages of the
   * two peaks' values.
   *
   * @param other peak to merge with this one
   * @return merged peak
   */
  public Peak mergeWith(Peak other) {
    return new Peak((position + other.position) / 2,
        (leftBase + other.leftBase) / 2,
        (rightBase + other.rightBase) / 2,
        Math.max(prominence, other.prominence));
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Peak)) {
      return false;
    }
    Peak peak = (Peak) other;
    return position == peak.position && leftBase == peak.leftBase
        && rightBase == peak.rightBase;
  }

  @Override
  public int hashCode() {
    return (position * 31 + leftBase) * 31 + rightBase;
  }

  @Override
  public String toString() {
    return "Peak(position=" + position + ", bases=[" + leftBase + ", " + rightBase
        + "], prominence=" + prominence + ")";
  }
}
