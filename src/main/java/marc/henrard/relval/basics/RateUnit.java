/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.basics;

/**
 * The unit in which a rate is quoted.
 * <p>
 * Rates are never converted on a guess: every quote and curve carries its unit.
 */
public enum RateUnit {

  /** Rates in percent, 2.5 meaning 2.5%. */
  PERCENT(100d),
  /** Rates in decimal, 0.025 meaning 2.5%. */
  DECIMAL(1d);

  private static final double BP_PER_UNIT_DECIMAL = 10_000d;

  /** Number of decimal rate units in one unit of this convention. */
  private final double scale;

  private RateUnit(double scale) {
    this.scale = scale;
  }

  /**
   * Converts a rate in this unit to decimal.
   * 
   * @param rate  the rate in this unit
   * @return the decimal rate
   */
  public double toDecimal(double rate) {
    return rate / scale;
  }

  /**
   * Converts a decimal rate to this unit.
   * 
   * @param decimalRate  the decimal rate
   * @return the rate in this unit
   */
  public double fromDecimal(double decimalRate) {
    return decimalRate * scale;
  }

  /**
   * Converts a rate in this unit to another unit.
   * 
   * @param rate  the rate in this unit
   * @param target  the target unit
   * @return the rate in the target unit
   */
  public double convert(double rate, RateUnit target) {
    if (target == this) {
      return rate;
    }
    return target.fromDecimal(toDecimal(rate));
  }

  /**
   * Converts a rate difference in this unit to basis points.
   * <p>
   * This is x100 for percent and x10,000 for decimal.
   * 
   * @param rateDifference  the difference between two rates in this unit
   * @return the difference in basis points
   */
  public double toBasisPoints(double rateDifference) {
    return rateDifference * (BP_PER_UNIT_DECIMAL / scale);
  }

  /**
   * Converts basis points to a rate difference in this unit.
   * 
   * @param basisPoints  the number of basis points
   * @return the rate difference in this unit
   */
  public double fromBasisPoints(double basisPoints) {
    return basisPoints * scale / BP_PER_UNIT_DECIMAL;
  }

}
