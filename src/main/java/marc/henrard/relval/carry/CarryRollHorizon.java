/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.carry;

import com.opengamma.strata.basics.date.Tenor;

/**
 * The holding horizons of carry and roll-down.
 */
public enum CarryRollHorizon {

  /** One month, 1/12 of a year. */
  ONE_MONTH(Tenor.TENOR_1M, 1d / 12d),
  /** Three months, 1/4 of a year. */
  THREE_MONTHS(Tenor.TENOR_3M, 0.25d);

  private final Tenor tenor;
  private final double yearFraction;

  CarryRollHorizon(Tenor tenor, double yearFraction) {
    this.tenor = tenor;
    this.yearFraction = yearFraction;
  }

  /**
   * Finds the horizon of a tenor, like "1M" or "3M".
   *
   * @param text  the tenor
   * @return the horizon
   */
  public static CarryRollHorizon of(String text) {
    Tenor tenor = Tenor.parse(text.trim());
    for (CarryRollHorizon horizon : values()) {
      if (horizon.tenor.equals(tenor)) {
        return horizon;
      }
    }
    throw new IllegalArgumentException("Unknown carry and roll horizon: " + text);
  }

  public Tenor getTenor() {
    return tenor;
  }

  public double getYearFraction() {
    return yearFraction;
  }

}
