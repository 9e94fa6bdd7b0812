/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.engine;

import java.time.Instant;
import java.util.Optional;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.opengamma.strata.collect.result.FailureItem;

import marc.henrard.relval.carry.CarryRollEntry;
import marc.henrard.relval.market.curve.YieldCurve;
import marc.henrard.relval.shape.ShapeMetric;
import marc.henrard.relval.spread.SpreadMatrix;
import marc.henrard.relval.spread.SpreadMode;
import marc.henrard.relval.spread.SpreadSeries;

/**
 * The outputs of one relative value cycle.
 * <p>
 * Maps are keyed by issuer (bond curves and analytics) or currency code (swap curves), in input order.
 * Every omission of the cycle is reported in the failures.
 */
public final class RelativeValueReport {

  private final Instant timestamp;
  private final ImmutableMap<String, YieldCurve> bondParCurves;
  private final ImmutableMap<String, YieldCurve> bondZeroCurves;
  private final ImmutableMap<String, YieldCurve> swapParCurves;
  private final ImmutableMap<String, YieldCurve> swapZeroCurves;
  private final ImmutableMap<SpreadMode, ImmutableList<SpreadSeries>> spreads;
  private final ImmutableMap<String, ImmutableList<ShapeMetric>> slopes;
  private final ImmutableMap<String, ImmutableList<ShapeMetric>> flies;
  private final ImmutableMap<String, ImmutableList<CarryRollEntry>> carryRoll;
  private final SpreadMatrix matrix;
  private final ImmutableList<FailureItem> failures;

  private RelativeValueReport(
      Instant timestamp,
      ImmutableMap<String, YieldCurve> bondParCurves,
      ImmutableMap<String, YieldCurve> bondZeroCurves,
      ImmutableMap<String, YieldCurve> swapParCurves,
      ImmutableMap<String, YieldCurve> swapZeroCurves,
      ImmutableMap<SpreadMode, ImmutableList<SpreadSeries>> spreads,
      ImmutableMap<String, ImmutableList<ShapeMetric>> slopes,
      ImmutableMap<String, ImmutableList<ShapeMetric>> flies,
      ImmutableMap<String, ImmutableList<CarryRollEntry>> carryRoll,
      SpreadMatrix matrix,
      ImmutableList<FailureItem> failures) {

    this.timestamp = timestamp;
    this.bondParCurves = bondParCurves;
    this.bondZeroCurves = bondZeroCurves;
    this.swapParCurves = swapParCurves;
    this.swapZeroCurves = swapZeroCurves;
    this.spreads = spreads;
    this.slopes = slopes;
    this.flies = flies;
    this.carryRoll = carryRoll;
    this.matrix = matrix;
    this.failures = failures;
  }

  static RelativeValueReport of(
      Instant timestamp,
      ImmutableMap<String, YieldCurve> bondParCurves,
      ImmutableMap<String, YieldCurve> bondZeroCurves,
      ImmutableMap<String, YieldCurve> swapParCurves,
      ImmutableMap<String, YieldCurve> swapZeroCurves,
      ImmutableMap<SpreadMode, ImmutableList<SpreadSeries>> spreads,
      ImmutableMap<String, ImmutableList<ShapeMetric>> slopes,
      ImmutableMap<String, ImmutableList<ShapeMetric>> flies,
      ImmutableMap<String, ImmutableList<CarryRollEntry>> carryRoll,
      SpreadMatrix matrix,
      ImmutableList<FailureItem> failures) {

    return new RelativeValueReport(timestamp, bondParCurves, bondZeroCurves, swapParCurves, swapZeroCurves,
        spreads, slopes, flies, carryRoll, matrix, failures);
  }

  public Instant getTimestamp() {
    return timestamp;
  }

  public ImmutableMap<String, YieldCurve> getBondParCurves() {
    return bondParCurves;
  }

  public ImmutableMap<String, YieldCurve> getBondZeroCurves() {
    return bondZeroCurves;
  }

  public ImmutableMap<String, YieldCurve> getSwapParCurves() {
    return swapParCurves;
  }

  public ImmutableMap<String, YieldCurve> getSwapZeroCurves() {
    return swapZeroCurves;
  }

  /**
   * Returns the spread series of a mode, one per issuer or currency for which it could be computed.
   *
   * @param mode  the mode
   * @return the series
   */
  public ImmutableList<SpreadSeries> getSpreads(SpreadMode mode) {
    return spreads.getOrDefault(mode, ImmutableList.of());
  }

  /**
   * Finds the spread series of a mode for an issuer or currency.
   *
   * @param mode  the mode
   * @param source  the issuer or currency
   * @return the series, empty if it was omitted
   */
  public Optional<SpreadSeries> findSpreads(SpreadMode mode, String source) {
    return getSpreads(mode).stream().filter(s -> s.getSource().equals(source)).findFirst();
  }

  public ImmutableMap<String, ImmutableList<ShapeMetric>> getSlopes() {
    return slopes;
  }

  public ImmutableMap<String, ImmutableList<ShapeMetric>> getFlies() {
    return flies;
  }

  public ImmutableMap<String, ImmutableList<CarryRollEntry>> getCarryRoll() {
    return carryRoll;
  }

  public SpreadMatrix getMatrix() {
    return matrix;
  }

  public ImmutableList<FailureItem> getFailures() {
    return failures;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("timestamp", timestamp)
        .add("issuers", bondParCurves.keySet())
        .add("currencies", swapParCurves.keySet())
        .add("failures", failures.size())
        .toString();
  }

}
