package fit.ageing.utils;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class GaussianFitterTest {

  private static double[] sampled(int length, double amplitude, double mean, double stddev) {
    double[] data = new double[length];
    for (int i = 0; i < length; ++i) {
      data[i] = GaussianFitter.gaussian(i, amplitude, mean, stddev);
    }
    return data;
  }

  @Test
  public void fitsCleanGaussian() {
    GaussianFitter fitter = new GaussianFitter(sampled(60, 50., 30., 5.));
    assertTrue(fitter.fit());
    double[] params = fitter.getParameters();
    assertEquals(50., params[0], 1E-4);
    assertEquals(30., params[1], 1E-4);
    assertEquals(5., Math.abs(params[2]), 1E-4);
    assertEquals(30., fitter.getMean(), 1E-4);
  }

  @Test
  public void fitsOffCenterPeak() {
    double mean = GaussianFitter.gaussianMean(sampled(343, 200., 110., 10.));
    assertEquals(110., mean, 1E-3);
  }

  @Test
  public void initialGuessUsesMaximumCentroidAndIndexSpread() {
    GaussianFitter fitter = new GaussianFitter(new double[]{0., 2., 0.});
    double[] guess = fitter.getInitialGuess();
    assertEquals(2., guess[0], 0.);
    assertEquals(1., guess[1], 0.);
    assertEquals(Math.sqrt(2. / 3.), guess[2], 1E-12);
  }

  @Test
  public void zeroSumGivesZeroWithoutException() {
    GaussianFitter fitter = new GaussianFitter(new double[100]);
    assertFalse(fitter.fit());
    assertNull(fitter.getParameters());
    assertEquals(0., fitter.getMean(), 0.);
    assertEquals(0., GaussianFitter.gaussianMean(new double[]{1., -1.}), 0.);
  }

  @Test
  public void tooFewPointsGivesZero() {
    assertEquals(0., GaussianFitter.gaussianMean(new double[]{1., 2.}), 0.);
    assertEquals(0., GaussianFitter.gaussianMean(new double[0]), 0.);
  }

}
