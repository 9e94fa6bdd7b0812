/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.carry;

import java.util.Objects;

import com.google.common.base.MoreObjects;
import com.opengamma.strata.collect.ArgChecker;

import marc.henrard.relval.basics.TenorUtils;

/**
 * Carry and roll-down of one grid tenor over one horizon, in basis points.
 */
public final class CarryRollEntry {

  private final double tenor;
  private final CarryRollHorizon horizon;
  private final double carryBp;
  private final double rollBp;
  /** The local slope of the curve at the tenor, in basis points per year. */
  private final double slopeBpPerYear;

  private CarryRollEntry(double tenor, CarryRollHorizon horizon, double carryBp, double rollBp, double slopeBpPerYear) {
    this.tenor = tenor;
    this.horizon = ArgChecker.notNull(horizon, "horizon");
    this.carryBp = carryBp;
    this.rollBp = rollBp;
    this.slopeBpPerYear = slopeBpPerYear;
  }

  public static CarryRollEntry of(
      double tenor,
      CarryRollHorizon horizon,
      double carryBp,
      double rollBp,
      double slopeBpPerYear) {

    return new CarryRollEntry(tenor, horizon, carryBp, rollBp, slopeBpPerYear);
  }

  public double getTenor() {
    return tenor;
  }

  public String getTenorLabel() {
    return TenorUtils.label(tenor);
  }

  public CarryRollHorizon getHorizon() {
    return horizon;
  }

  public double getCarryBp() {
    return carryBp;
  }

  public double getRollBp() {
    return rollBp;
  }

  public double getSlopeBpPerYear() {
    return slopeBpPerYear;
  }

  /**
   * Returns carry plus roll-down.
   *
   * @return the total in basis points
   */
  public double getTotalBp() {
    return carryBp + rollBp;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || obj.getClass() != getClass()) {
      return false;
    }
    CarryRollEntry other = (CarryRollEntry) obj;
    return Double.compare(tenor, other.tenor) == 0 &&
        horizon == other.horizon &&
        Double.compare(carryBp, other.carryBp) == 0 &&
        Double.compare(rollBp, other.rollBp) == 0 &&
        Double.compare(slopeBpPerYear, other.slopeBpPerYear) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(tenor, horizon, carryBp, rollBp, slopeBpPerYear);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("tenor", getTenorLabel())
        .add("horizon", horizon)
        .add("carryBp", carryBp)
        .add("rollBp", rollBp)
        .add("slopeBpPerYear", slopeBpPerYear)
        .toString();
  }

}
