package fit.ageing.utils;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class NumericUtilsTest {

  @Test
  public void argMaxTakesFirstOfTies() {
    assertEquals(1, NumericUtils.argMax(new double[]{1., 4., 2., 4.}));
    assertEquals(4., NumericUtils.max(new double[]{1., 4., 2., 4.}), 0.);
  }

  @Test
  public void weightedMeanIsCentroid() {
    assertEquals(1., NumericUtils.weightedMean(new double[]{0., 1., 0.}), 0.);
    assertEquals(1.5, NumericUtils.weightedMean(new double[]{0., 1., 1., 0.}), 0.);
    assertEquals(0., NumericUtils.weightedMean(new double[]{0., 0., 0.}), 0.);
  }

  @Test
  public void indexStandardDeviationIsPopulationSpread() {
    assertEquals(Math.sqrt(2. / 3.), NumericUtils.indexStandardDeviation(3), 1E-12);
    assertEquals(0., NumericUtils.indexStandardDeviation(1), 0.);
    assertEquals(0., NumericUtils.indexStandardDeviation(0), 0.);
    // indices 0..9 have population variance (100 - 1) / 12
    assertEquals(Math.sqrt(99. / 12.), NumericUtils.indexStandardDeviation(10), 1E-12);
  }

  @Test
  public void decimalFormatPrintsInfinity() {
    assertEquals("Infinity",
        NumericUtils.DECIMAL_FORMAT.get().format(Double.POSITIVE_INFINITY));
    assertEquals("1.2346", NumericUtils.DECIMAL_FORMAT.get().format(1.23456));
  }

}
