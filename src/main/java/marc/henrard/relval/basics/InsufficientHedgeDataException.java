/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.basics;

import com.opengamma.strata.collect.result.FailureReason;

/**
 * Thrown when a hedge cannot be sized because a DV01 input is missing or not positive.
 */
public final class InsufficientHedgeDataException extends RelativeValueException {

  private static final long serialVersionUID = 1L;

  private final String position;
  private final String instrument;

  /**
   * Creates an instance.
   * 
   * @param position  the position description
   * @param instrument  the hedge instrument identifier
   * @param detail  the offending input
   */
  public InsufficientHedgeDataException(String position, String instrument, String detail) {
    super("Cannot hedge '{}' with '{}': {}", position, instrument, detail);
    this.position = position;
    this.instrument = instrument;
  }

  public String getPosition() {
    return position;
  }

  public String getInstrument() {
    return instrument;
  }

  @Override
  public FailureReason getFailureReason() {
    return FailureReason.INVALID;
  }

}
