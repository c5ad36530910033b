package fit.ageing.entities;

/**
 * A ratio produced by the ageing calculation, which is either a number or unavailable.
 * Unavailable values are what the result files print as "N/A": they come from a missing or
 * invalid divisor during normalization and propagate through any further division.
 *
 * Non-finite numbers are never stored as numeric factors; {@link #of(double)} maps them to
 * {@link #UNAVAILABLE}.
 */
public final class AgeingFactor {

  /**
   * String printed in place of an unavailable factor
   */
  public static final String NOT_AVAILABLE = "N/A";

  public static final AgeingFactor UNAVAILABLE = new AgeingFactor(Double.NaN, false);

  public static final AgeingFactor ZERO = new AgeingFactor(0., true);

  private final double value;
  private final boolean available;

  private AgeingFactor(double value, boolean available) {
    this.value = value;
    this.available = available;
  }

  /**
   * Wrap a numeric value as a factor
   *
   * @param value ratio to wrap
   * @return numeric factor, or UNAVAILABLE if the value is NaN or infinite
   */
  public static AgeingFactor of(double value) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return UNAVAILABLE;
    }
    return new AgeingFactor(value, true);
  }

  public boolean isAvailable() {
    return available;
  }

  /**
   * Get the numeric value of this factor
   *
   * @return value of the factor
   * @throws IllegalStateException if the factor is unavailable
   */
  public double getValue() {
    if (!available) {
      throw new IllegalStateException("Ageing factor is not available");
    }
    return value;
  }

  /**
   * Divide this factor by another one. Never throws: an unavailable operand or a zero divisor
   * produces an unavailable result.
   *
   * @param divisor factor to divide by
   * @return quotient of the two factors, or UNAVAILABLE
   */
  public AgeingFactor divide(AgeingFactor divisor) {
    if (divisor == null || !available || !divisor.available || divisor.value == 0.) {
      return UNAVAILABLE;
    }
    return of(value / divisor.value);
  }

  /**
   * Representation used in serialized results: the number itself, or the "N/A" string
   *
   * @return Double or String object
   */
  public Object toResultValue() {
    if (available) {
      return value;
    }
    return NOT_AVAILABLE;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof AgeingFactor)) {
      return false;
    }
    AgeingFactor factor = (AgeingFactor) other;
    if (!available) {
      return !factor.available;
    }
    return factor.available && Double.compare(value, factor.value) == 0;
  }

  @Override
  public int hashCode() {
    return available ? Double.hashCode(value) : 0;
  }

  @Override
  public String toString() {
    return available ? Double.toString(value) : NOT_AVAILABLE;
  }
}
