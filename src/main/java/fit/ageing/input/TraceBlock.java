package fit.ageing.input;

import java.util.Arrays;

/**
 * Holds one summed amplifier-pair series along with a name used to trace it back to the
 * columns of the file it was read from. Indices of the data always start at 0, regardless of
 * where in the original trace the samples were taken.
 *
 * The data array is copied on construction and on access, so a block can be shared freely
 * between pipeline stages.
 */
public class TraceBlock {

  private final String name;
  private final double[] data;

  public TraceBlock(String name, double[] data) {
    this.name = name;
    this.data = data.clone();
  }

  /**
   * Create a block from a contiguous range of another series
   *
   * @param name Name of the new block
   * @param source Series to slice
   * @param from First index of the slice (inclusive)
   * @param to Last index of the slice (exclusive)
   * @return New block, re-indexed to start at 0
   */
  public static TraceBlock slice(String name, double[] source, int from, int to) {
    return new TraceBlock(name, Arrays.copyOfRange(source, from, to));
  }

  public String getName() {
    return name;
  }

  /**
   * Get a copy of the samples in this block
   *
   * @return samples, index 0..N-1
   */
  public double[] getData() {
    return data.clone();
  }

  public int size() {
    return data.length;
  }

  @Override
  public String toString() {
    return "TraceBlock(name=" + name + ", size=" + data.length + ")";
  }
}
