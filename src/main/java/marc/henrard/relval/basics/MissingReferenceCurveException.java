/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.basics;

import com.opengamma.strata.collect.result.FailureReason;

/**
 * Thrown when the reference curve required by a spread mode is not available.
 * <p>
 * The whole series of that mode is omitted for the target.
 */
public final class MissingReferenceCurveException extends RelativeValueException {

  private static final long serialVersionUID = 1L;

  private final String identifier;
  private final String reference;
  private final String mode;

  /**
   * Creates an instance.
   * 
   * @param identifier  the target issuer or currency
   * @param reference  the missing reference issuer or currency
   * @param mode  the spread mode name
   */
  public MissingReferenceCurveException(String identifier, String reference, String mode) {
    super("Reference curve '{}' missing for '{}' in mode {}", reference, identifier, mode);
    this.identifier = identifier;
    this.reference = reference;
    this.mode = mode;
  }

  public String getIdentifier() {
    return identifier;
  }

  public String getReference() {
    return reference;
  }

  public String getMode() {
    return mode;
  }

  @Override
  public FailureReason getFailureReason() {
    return FailureReason.MISSING_DATA;
  }

}
