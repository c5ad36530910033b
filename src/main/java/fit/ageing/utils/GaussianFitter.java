package fit.ageing.utils;

import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.util.Pair;
import org.apache.log4j.Logger;

/**
 * Least-squares fit of a Gaussian curve, amplitude * exp(-(x - mean)^2 / (2 * stddev^2)), to a
 * series sampled at x = 0..N-1. The fit starts from the series' maximum as amplitude, its
 * intensity-weighted centroid as mean and the standard deviation of the x values as width.
 *
 * A fit that cannot be done or cannot be trusted (series summing to zero, too few points, no
 * convergence within the evaluation budget, a covariance that cannot be estimated, or a
 * non-finite result) is reported as a failure rather than as an exception.
 */
public class GaussianFitter {

  /**
   * Number of fitted parameters (amplitude, mean, standard deviation)
   */
  public static final int PARAMETER_COUNT = 3;

  // MINPACK's default budget for lmdif, 200 * (parameters + 1)
  private static final int MAX_EVALUATIONS = 200 * (PARAMETER_COUNT + 1);

  private static final double COVARIANCE_THRESHOLD = 1E-14;

  private static final Logger logger = Logger.getLogger(GaussianFitter.class);

  private final double[] data;

  private double[] fitParameters;
  private boolean fitted;

  /**
   * @param data series to fit, sampled at x = 0..N-1
   */
  public GaussianFitter(double[] data) {
    this.data = data.clone();
  }

  /**
   * Value of the Gaussian curve at a point
   *
   * @param x point to evaluate at
   * @param amplitude peak height
   * @param mean peak center
   * @param stddev peak width
   * @return curve value
   */
  public static double gaussian(double x, double amplitude, double mean, double stddev) {
    double offset = x - mean;
    return amplitude * Math.exp(-(offset * offset) / (2 * stddev * stddev));
  }

  /**
   * Fit a series and return the fitted mean
   *
   * @param data series to fit
   * @return fitted Gaussian mean, or 0 if the fit failed
   */
  public static double gaussianMean(double[] data) {
    GaussianFitter fitter = new GaussianFitter(data);
    return fitter.fit() ? fitter.getMean() : 0.;
  }

  /**
   * Run the fit. Calling this again returns the cached outcome.
   *
   * @return true if the fit succeeded
   */
  public boolean fit() {
    if (fitted) {
      return fitParameters != null;
    }
    fitted = true;
    fitParameters = solve();
    return fitParameters != null;
  }

  /**
   * Get the fitted parameters
   *
   * @return amplitude, mean and standard deviation, or null if the fit failed
   */
  public double[] getParameters() {
    return fit() ? fitParameters.clone() : null;
  }

  /**
   * Get the fitted mean
   *
   * @return fitted mean, or 0 if the fit failed
   */
  public double getMean() {
    return fit() ? fitParameters[1] : 0.;
  }

  /**
   * Get the starting point of the fit
   *
   * @return amplitude, mean and standard deviation used as the initial guess
   */
  public double[] getInitialGuess() {
    return new double[]{
        NumericUtils.max(data),
        NumericUtils.weightedMean(data),
        NumericUtils.indexStandardDeviation(data.length)};
  }

  private double[] solve() {
    if (NumericUtils.sum(data) == 0.) {
      logger.warn("Sum of values is zero. Cannot fit Gaussian distribution.");
      return null;
    }
    if (data.length < PARAMETER_COUNT) {
      logger.warn("Only " + data.length + " points, cannot fit Gaussian distribution.");
      return null;
    }

    double[] initialGuess = getInitialGuess();
    logger.debug("Initial guess: amplitude " + initialGuess[0] + ", mean " + initialGuess[1]
        + ", stddev " + initialGuess[2]);

    LeastSquaresProblem lsp = new LeastSquaresBuilder().
        start(MatrixUtils.createRealVector(initialGuess)).
        target(MatrixUtils.createRealVector(data)).
        model(this::jacobian).
        lazyEvaluation(false).
        maxEvaluations(MAX_EVALUATIONS).
        maxIterations(MAX_EVALUATIONS).
        build();

    LeastSquaresOptimizer optimizer = new LevenbergMarquardtOptimizer();

    try {
      LeastSquaresOptimizer.Optimum optimum = optimizer.optimize(lsp);
      // a covariance that cannot be estimated means the fit is not trustworthy
      optimum.getCovariances(COVARIANCE_THRESHOLD);
      double[] params = optimum.getPoint().toArray();
      for (double param : params) {
        if (!Double.isFinite(param)) {
          logger.warn("Gaussian fit produced non-finite parameters.");
          return null;
        }
      }
      logger.debug("Fitted amplitude " + params[0] + ", mean " + params[1]
          + ", stddev " + params[2]);
      return params;
    } catch (SingularMatrixException e) {
      logger.warn("Gaussian fit covariance could not be estimated.");
      return null;
    } catch (MathIllegalStateException e) {
      // ConvergenceException, TooManyEvaluationsException and TooManyIterationsException
      logger.warn("Gaussian fit failed: " + e.getMessage());
      return null;
    }
  }

  /**
   * Evaluate the curve for the given parameters along with its partial derivatives
   *
   * @param variables amplitude, mean and standard deviation
   * @return curve values and Jacobian matrix
   */
  private Pair<RealVector, RealMatrix> jacobian(RealVector variables) {
    double amplitude = variables.getEntry(0);
    double mean = variables.getEntry(1);
    double stddev = variables.getEntry(2);
    double variance = stddev * stddev;

    double[] values = new double[data.length];
    double[][] jacobian = new double[data.length][PARAMETER_COUNT];
    for (int i = 0; i < data.length; ++i) {
      double offset = i - mean;
      double exponential = Math.exp(-(offset * offset) / (2 * variance));
      values[i] = amplitude * exponential;
      jacobian[i][0] = exponential;
      jacobian[i][1] = amplitude * exponential * offset / variance;
      jacobian[i][2] = amplitude * exponential * offset * offset / (variance * stddev);
    }

    return new Pair<>(MatrixUtils.createRealVector(values),
        MatrixUtils.createRealMatrix(jacobian));
  }

}
