package fit.ageing.entities;

import fit.ageing.input.TraceBlock;

/**
 * One channel of a PM module, formed from a pair of amplifier columns in the module's trace file.
 * A channel holds the series the statistics are computed on, the noise series used as a fallback
 * for non-reference channels, and the statistics derived by each pipeline stage.
 *
 * Channels are immutable. Each stage that derives new values (means, raw ageing factors,
 * normalized ageing factors) returns a copy of the channel with those values set, leaving the
 * other derived values as they were.
 */
public class Channel {

  private final int number;
  private final String name;
  private final TraceBlock signal;
  private final TraceBlock noise;
  private final TraceBlock totalSignal;
  private final boolean reference;
  private final Double integratedCharge;

  private final double gaussianMean;
  private final double weightedMean;
  private final AgeingFactor gaussianAgeingFactor;
  private final AgeingFactor weightedAgeingFactor;
  private final AgeingFactor normalizedGaussAgeingFactor;
  private final AgeingFactor normalizedWeightedAgeingFactor;

  /**
   * Create a channel without diagnostic data
   *
   * @param number Channel number, starting at 1
   * @param signal Series to compute statistics over
   * @param noise Noise-region series (ignored for reference channels)
   * @param reference True if this is a reference channel of the reference module
   */
  public Channel(int number, TraceBlock signal, TraceBlock noise, boolean reference) {
    this(number, signal, noise, null, reference, null);
  }

  /**
   * Create a channel as produced by the trace extractor
   *
   * @param number Channel number, starting at 1
   * @param signal Series to compute statistics over
   * @param noise Noise-region series (ignored for reference channels)
   * @param totalSignal Full summed trace of the column pair, may be null
   * @param reference True if this is a reference channel of the reference module
   * @param integratedCharge Integrated charge of the channel from the configuration, may be null
   */
  public Channel(int number, TraceBlock signal, TraceBlock noise, TraceBlock totalSignal,
      boolean reference, Double integratedCharge) {
    this(number, signal, reference ? null : noise, totalSignal, reference, integratedCharge,
        0., 0., AgeingFactor.ZERO, AgeingFactor.ZERO, AgeingFactor.ZERO, AgeingFactor.ZERO);
  }

  private Channel(int number, TraceBlock signal, TraceBlock noise, TraceBlock totalSignal,
      boolean reference, Double integratedCharge, double gaussianMean, double weightedMean,
      AgeingFactor gaussianAgeingFactor, AgeingFactor weightedAgeingFactor,
      AgeingFactor normalizedGaussAgeingFactor, AgeingFactor normalizedWeightedAgeingFactor) {
    if (number < 1) {
      throw new IllegalArgumentException("Channel numbers start at 1, got " + number);
    }
    this.number = number;
    this.name = channelName(number);
    this.signal = signal;
    this.noise = noise;
    this.totalSignal = totalSignal;
    this.reference = reference;
    this.integratedCharge = integratedCharge;
    this.gaussianMean = gaussianMean;
    this.weightedMean = weightedMean;
    this.gaussianAgeingFactor = gaussianAgeingFactor;
    this.weightedAgeingFactor = weightedAgeingFactor;
    this.normalizedGaussAgeingFactor = normalizedGaussAgeingFactor;
    this.normalizedWeightedAgeingFactor = normalizedWeightedAgeingFactor;
  }

  /**
   * Produce the name of a channel from its number ("CH01", "CH02", ...)
   *
   * @param number channel number
   * @return channel name
   */
  public static String channelName(int number) {
    return String.format("CH%02d", number);
  }

  public Channel withMeans(double gaussianMean, double weightedMean) {
    return new Channel(number, signal, noise, totalSignal, reference, integratedCharge,
        gaussianMean, weightedMean, gaussianAgeingFactor, weightedAgeingFactor,
        normalizedGaussAgeingFactor, normalizedWeightedAgeingFactor);
  }

  public Channel withAgeingFactors(AgeingFactor gaussian, AgeingFactor weighted) {
    return new Channel(number, signal, noise, totalSignal, reference, integratedCharge,
        gaussianMean, weightedMean, gaussian, weighted,
        normalizedGaussAgeingFactor, normalizedWeightedAgeingFactor);
  }

  public Channel withNormalizedAgeingFactors(AgeingFactor gaussian, AgeingFactor weighted) {
    return new Channel(number, signal, noise, totalSignal, reference, integratedCharge,
        gaussianMean, weightedMean, gaussianAgeingFactor, weightedAgeingFactor,
        gaussian, weighted);
  }

  public int getNumber() {
    return number;
  }

  public String getName() {
    return name;
  }

  public TraceBlock getSignal() {
    return signal;
  }

  /**
   * Get the noise-region series of this channel
   *
   * @return noise series, or null for reference channels
   */
  public TraceBlock getNoise() {
    return noise;
  }

  public boolean hasNoise() {
    return noise != null;
  }

  /**
   * Get the full summed trace of this channel's column pair
   *
   * @return total signal, or null if not recorded
   */
  public TraceBlock getTotalSignal() {
    return totalSignal;
  }

  public boolean isReference() {
    return reference;
  }

  public Double getIntegratedCharge() {
    return integratedCharge;
  }

  public double getGaussianMean() {
    return gaussianMean;
  }

  public double getWeightedMean() {
    return weightedMean;
  }

  /**
   * True if neither mean is NaN; results print the means and factors as "N/A" otherwise
   *
   * @return whether both means hold numbers
   */
  public boolean hasValidMeans() {
    return !Double.isNaN(gaussianMean) && !Double.isNaN(weightedMean);
  }

  public AgeingFactor getGaussianAgeingFactor() {
    return gaussianAgeingFactor;
  }

  public AgeingFactor getWeightedAgeingFactor() {
    return weightedAgeingFactor;
  }

  public AgeingFactor getNormalizedGaussAgeingFactor() {
    return normalizedGaussAgeingFactor;
  }

  public AgeingFactor getNormalizedWeightedAgeingFactor() {
    return normalizedWeightedAgeingFactor;
  }

  /**
   * Index of the first of the two file columns this channel is formed from
   * (counting the bin column as column 0)
   *
   * @return first column index
   */
  public int getFirstColumn() {
    return number * 2 - 1;
  }

  public int getSecondColumn() {
    return number * 2;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("Channel(name=").append(name);
    sb.append(", columns=(").append(getFirstColumn()).append(", ");
    sb.append(getSecondColumn()).append(")");
    sb.append(", is_reference=").append(reference);
    if (integratedCharge != null) {
      sb.append(", integrated_charge=").append(integratedCharge);
    }
    sb.append(")");
    return sb.toString();
  }
}
