/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.basics;

import com.opengamma.strata.collect.result.FailureReason;

/**
 * Thrown when a zero curve cannot be bootstrapped from the par quotes of an issuer or currency.
 * <p>
 * The curve of that issuer is omitted downstream; it is never replaced by a default.
 */
public final class CurveBootstrapException extends RelativeValueException {

  private static final long serialVersionUID = 1L;

  /** The issuer or currency of the curve. */
  private final String identifier;
  /** The tenor, in years, at which the bootstrap failed, NaN when the failure is not tied to a tenor. */
  private final double tenor;

  /**
   * Creates an instance.
   * 
   * @param identifier  the issuer or currency
   * @param tenor  the offending tenor in years
   * @param reason  the description of the problem
   */
  public CurveBootstrapException(String identifier, double tenor, String reason) {
    super("Bootstrap failed for '{}' at tenor {}: {}", identifier, TenorUtils.label(tenor), reason);
    this.identifier = identifier;
    this.tenor = tenor;
  }

  /**
   * Creates an instance for a failure not tied to a tenor, like a missing convention.
   * 
   * @param identifier  the issuer or currency
   * @param reason  the description of the problem
   */
  public CurveBootstrapException(String identifier, String reason) {
    super("Bootstrap failed for '{}': {}", identifier, reason);
    this.identifier = identifier;
    this.tenor = Double.NaN;
  }

  /**
   * Creates an instance with a cause.
   * 
   * @param identifier  the issuer or currency
   * @param tenor  the offending tenor in years
   * @param cause  the underlying cause
   */
  public CurveBootstrapException(String identifier, double tenor, Throwable cause) {
    super(cause, "Bootstrap failed for '{}' at tenor {}: {}",
        identifier, TenorUtils.label(tenor), cause.getMessage());
    this.identifier = identifier;
    this.tenor = tenor;
  }

  public String getIdentifier() {
    return identifier;
  }

  public double getTenor() {
    return tenor;
  }

  @Override
  public FailureReason getFailureReason() {
    return FailureReason.CALCULATION_FAILED;
  }

}
