package fit.ageing.utils;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

/**
 * Small numeric helpers used across the extraction and fitting stages
 */
public class NumericUtils {

  public static final ThreadLocal<DecimalFormat> DECIMAL_FORMAT =
      ThreadLocal.withInitial(() -> {
        DecimalFormat format =
            new DecimalFormat("#.####", DecimalFormatSymbols.getInstance(Locale.ROOT));
        setInfinityPrintable(format);
        return format;
      });

  private NumericUtils() {
  }

  /**
   * Sets a DecimalFormat's symbols so that infinite values print as "Infinity"
   *
   * @param format formatter to modify
   */
  public static void setInfinityPrintable(DecimalFormat format) {
    DecimalFormatSymbols symbols = format.getDecimalFormatSymbols();
    symbols.setInfinity("Infinity");
    format.setDecimalFormatSymbols(symbols);
  }

  /**
   * Index of the largest value of an array; ties go to the earliest index
   *
   * @param data array to search, must not be empty
   * @return index of the first occurrence of the maximum
   */
  public static int argMax(double[] data) {
    int index = 0;
    for (int i = 1; i < data.length; ++i) {
      if (data[i] > data[index]) {
        index = i;
      }
    }
    return index;
  }

  public static double max(double[] data) {
    return data[argMax(data)];
  }

  public static double sum(double[] data) {
    double total = 0.;
    for (double point : data) {
      total += point;
    }
    return total;
  }

  /**
   * Intensity-weighted centroid of a series over x = 0..N-1, i.e., sum(x * y) / sum(y)
   *
   * @param data series values (y)
   * @return centroid, or 0 if the series sums to 0
   */
  public static double weightedMean(double[] data) {
    double total = 0.;
    double weighted = 0.;
    for (int i = 0; i < data.length; ++i) {
      total += data[i];
      weighted += i * data[i];
    }
    if (total == 0.) {
      return 0.;
    }
    return weighted / total;
  }

  /**
   * Population standard deviation of the indices 0..N-1
   *
   * @param length number of indices N
   * @return standard deviation of the index values
   */
  public static double indexStandardDeviation(int length) {
    if (length < 1) {
      return 0.;
    }
    double[] indices = new double[length];
    for (int i = 0; i < length; ++i) {
      indices[i] = i;
    }
    return new StandardDeviation(false).evaluate(indices);
  }

}
