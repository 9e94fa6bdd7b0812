/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.carry;

import java.util.List;
import java.util.OptionalDouble;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.opengamma.strata.collect.ArgChecker;

import marc.henrard.relval.basics.RateUnit;
import marc.henrard.relval.market.curve.AlignmentPolicy;
import marc.henrard.relval.market.curve.GridInterpolator;
import marc.henrard.relval.market.curve.YieldCurve;

/**
 * First order approximation of carry and roll-down on an unchanged curve.
 * <p>
 * For a tenor t and a horizon h, in basis points:
 * <pre>
 *   roll  = r(t - h) - r(t)
 *   carry = (r(t) - funding) * h + s(t) * h
 * </pre>
 * where s(t) is the slope of the curve on the segment starting at t (the incoming segment for the last point)
 * and the funding rate is the shortest rate of the curve unless given. When t - h is before the first point,
 * the roll uses the first rate.
 *
 * @author Marc Henrard
 */
public final class CarryRollCalculator {

  /** The default instance. */
  public static final CarryRollCalculator DEFAULT = new CarryRollCalculator(GridInterpolator.DEFAULT);

  private final GridInterpolator interpolator;

  private CarryRollCalculator(GridInterpolator interpolator) {
    this.interpolator = interpolator;
  }

  /**
   * Computes carry and roll for every grid tenor and horizon, funded at the shortest rate of the curve.
   *
   * @param curve  the curve
   * @param horizons  the horizons
   * @return the entries, by tenor then horizon
   */
  public ImmutableList<CarryRollEntry> calculate(YieldCurve curve, List<CarryRollHorizon> horizons) {
    return calculate(curve, horizons, OptionalDouble.empty());
  }

  /**
   * Computes carry and roll for every grid tenor and horizon.
   *
   * @param curve  the curve
   * @param horizons  the horizons
   * @param fundingRate  the funding rate in the unit of the curve, empty for the shortest rate of the curve
   * @return the entries, by tenor then horizon
   */
  public ImmutableList<CarryRollEntry> calculate(
      YieldCurve curve,
      List<CarryRollHorizon> horizons,
      OptionalDouble fundingRate) {

    ArgChecker.notNull(curve, "curve");
    ArgChecker.noNulls(horizons, "horizons");
    ArgChecker.notNull(fundingRate, "fundingRate");
    RateUnit unit = curve.getUnit();
    double funding = fundingRate.orElse(curve.getRates().get(0));
    ImmutableList.Builder<CarryRollEntry> entries = ImmutableList.builder();
    for (int i = 0; i < curve.size(); i++) {
      double tenor = curve.getTenors().get(i);
      double rate = curve.getRates().get(i);
      double slope = slope(curve, i);
      double slopeBpPerYear = unit.toBasisPoints(slope);
      for (CarryRollHorizon horizon : horizons) {
        double h = horizon.getYearFraction();
        double agedRate = interpolator.interpolate(curve, tenor - h, AlignmentPolicy.NEAREST);
        double rollBp = unit.toBasisPoints(agedRate - rate);
        double carryBp = unit.toBasisPoints((rate - funding) * h + slope * h);
        entries.add(CarryRollEntry.of(tenor, horizon, carryBp, rollBp, slopeBpPerYear));
      }
    }
    return entries.build();
  }

  // slope per year of the segment starting at the point, the incoming one for the last point
  private static double slope(YieldCurve curve, int index) {
    int n = curve.size();
    if (n == 1) {
      return 0d;
    }
    int start = index < n - 1 ? index : n - 2;
    double dt = curve.getTenors().get(start + 1) - curve.getTenors().get(start);
    return (curve.getRates().get(start + 1) - curve.getRates().get(start)) / dt;
  }

  //-------------------------------------------------------------------------
  /**
   * Returns the realized change of rates between a previous snapshot and the current curve.
   * <p>
   * Only tenors present on both grids are reported. The previous curve is expressed in the unit of the current one.
   *
   * @param previous  the curve of a previous snapshot
   * @param current  the current curve
   * @return the change in basis points by tenor in years
   */
  public ImmutableSortedMap<Double, Double> realizedChanges(YieldCurve previous, YieldCurve current) {
    ArgChecker.notNull(previous, "previous");
    ArgChecker.notNull(current, "current");
    ArgChecker.isTrue(previous.getIdentifier().equals(current.getIdentifier()),
        "Realized changes compare curves of '{}' and '{}'", previous.getIdentifier(), current.getIdentifier());
    ArgChecker.isTrue(previous.getKind() == current.getKind(),
        "Realized changes compare a {} curve with a {} curve", previous.getKind(), current.getKind());
    RateUnit unit = current.getUnit();
    YieldCurve aligned = previous.toUnit(unit);
    ImmutableSortedMap.Builder<Double, Double> changes = ImmutableSortedMap.naturalOrder();
    for (int i = 0; i < current.size(); i++) {
      double tenor = current.getTenors().get(i);
      OptionalDouble before = aligned.findRate(tenor);
      if (before.isPresent()) {
        changes.put(tenor, unit.toBasisPoints(current.getRates().get(i) - before.getAsDouble()));
      }
    }
    return changes.build();
  }

}
