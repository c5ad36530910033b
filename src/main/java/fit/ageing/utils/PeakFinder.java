package fit.ageing.utils;

import java.util.ArrayList;
import java.util.List;

/**
 * Peak detection over a sampled trace. Peaks are local maxima, where a flat top counts as one
 * peak placed at its middle sample (rounded down). Each peak gets a prominence, the height of the
 * peak above the higher of the lowest points found on either side before the trace climbs above
 * the peak again; those lowest points are the peak's bases.
 *
 * The first and last samples of a trace are never reported as peaks.
 */
public class PeakFinder {

  private PeakFinder() {
  }

  /**
   * Find all local maxima of a trace, with their prominences and bases
   *
   * @param trace samples to search
   * @return peaks in order of position
   */
  public static List<Peak> findPeaks(double[] trace) {
    List<Peak> peaks = new ArrayList<>();
    for (int position : localMaxima(trace)) {
      peaks.add(withProminence(trace, position));
    }
    return peaks;
  }

  /**
   * Find the local maxima of a trace whose prominence is at least the given value
   *
   * @param trace samples to search
   * @param minProminence smallest prominence a peak can have to be kept
   * @return peaks in order of position
   */
  public static List<Peak> findPeaks(double[] trace, double minProminence) {
    List<Peak> peaks = new ArrayList<>();
    for (Peak peak : findPeaks(trace)) {
      if (peak.getProminence() >= minProminence) {
        peaks.add(peak);
      }
    }
    return peaks;
  }

  /**
   * Merge runs of neighbouring peaks that are split detections of the same peak (see
   * {@link Peak#isDuplicateOf(Peak, int)}). A merged peak takes the place of the earlier of the
   * two and the later one is dropped; the merged peak is then compared against the next one.
   * The input list is not modified.
   *
   * @param peaks peaks in order of position
   * @param threshold base distance in samples under which two peaks are merged
   * @return new list of peaks
   */
  public static List<Peak> mergePeaks(List<Peak> peaks, int threshold) {
    List<Peak> merged = new ArrayList<>();
    for (Peak peak : peaks) {
      if (!merged.isEmpty()) {
        int last = merged.size() - 1;
        Peak previous = merged.get(last);
        if (previous.isDuplicateOf(peak, threshold)) {
          merged.set(last, previous.mergeWith(peak));
          continue;
        }
      }
      merged.add(peak);
    }
    return merged;
  }

  /**
   * Get the positions of local maxima. A point (or plateau) is a maximum when it is strictly
   * higher than the samples directly before and after it.
   *
   * @param trace samples to search
   * @return positions of the maxima, in increasing order
   */
  static List<Integer> localMaxima(double[] trace) {
    List<Integer> maxima = new ArrayList<>();
    int last = trace.length - 1;
    int i = 1;
    while (i < last) {
      if (trace[i - 1] < trace[i]) {
        int ahead = i + 1;
        while (ahead < last && trace[ahead] == trace[i]) {
          ++ahead;
        }
        if (trace[ahead] < trace[i]) {
          int leftEdge = i;
          int rightEdge = ahead - 1;
          maxima.add((leftEdge + rightEdge) / 2);
          i = ahead;
        }
      }
      ++i;
    }
    return maxima;
  }

  private static Peak withProminence(double[] trace, int position) {
    double height = trace[position];

    int leftBase = position;
    double leftMin = height;
    for (int i = position; i >= 0 && trace[i] <= height; --i) {
      if (trace[i] < leftMin) {
        leftMin = trace[i];
        leftBase = i;
      }
    }

    int rightBase = position;
    double rightMin = height;
    for (int i = position; i < trace.length && trace[i] <= height; ++i) {
      if (trace[i] < rightMin) {
        rightMin = trace[i];
        rightBase = i;
      }
    }

    return new Peak(position, leftBase, rightBase, height - Math.max(leftMin, rightMin));
  }

}
