/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.basics;

import com.opengamma.strata.collect.result.FailureReason;

/**
 * Thrown when a tenor outside the grid of a curve is requested under strict alignment.
 */
public final class OutOfRangeInterpolationException extends RelativeValueException {

  private static final long serialVersionUID = 1L;

  private final String identifier;
  private final double tenor;
  private final double firstTenor;
  private final double lastTenor;

  /**
   * Creates an instance.
   * 
   * @param identifier  the curve identifier
   * @param tenor  the requested tenor in years
   * @param firstTenor  the first tenor of the curve
   * @param lastTenor  the last tenor of the curve
   */
  public OutOfRangeInterpolationException(String identifier, double tenor, double firstTenor, double lastTenor) {
    super("Tenor {} outside range [{}, {}] of curve '{}'", tenor, firstTenor, lastTenor, identifier);
    this.identifier = identifier;
    this.tenor = tenor;
    this.firstTenor = firstTenor;
    this.lastTenor = lastTenor;
  }

  public String getIdentifier() {
    return identifier;
  }

  public double getTenor() {
    return tenor;
  }

  public double getFirstTenor() {
    return firstTenor;
  }

  public double getLastTenor() {
    return lastTenor;
  }

  @Override
  public FailureReason getFailureReason() {
    return FailureReason.NOT_APPLICABLE;
  }

}
