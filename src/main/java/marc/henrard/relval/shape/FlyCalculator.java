/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.shape;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.opengamma.strata.collect.ArgChecker;
import com.opengamma.strata.collect.result.FailureItem;
import com.opengamma.strata.collect.result.FailureReason;
import com.opengamma.strata.collect.result.ValueWithFailures;

import marc.henrard.relval.basics.OutOfRangeInterpolationException;
import marc.henrard.relval.basics.RateUnit;
import marc.henrard.relval.basics.TenorUtils;
import marc.henrard.relval.market.curve.AlignmentPolicy;
import marc.henrard.relval.market.curve.GridInterpolator;
import marc.henrard.relval.market.curve.YieldCurve;

/**
 * Computes butterflies of a curve: twice the body rate minus both wing rates, in basis points.
 * <p>
 * A positive fly means the body is cheap (high yield) against the wings.
 *
 * @author Marc Henrard
 */
public final class FlyCalculator {

  /** The standard flies: 2s5s10s. */
  public static final ImmutableList<FlyDefinition> STANDARD_FLIES = ImmutableList.of(FlyDefinition.TWOS_FIVES_TENS);

  /** The default instance. */
  public static final FlyCalculator DEFAULT = new FlyCalculator(GridInterpolator.DEFAULT);

  private final GridInterpolator interpolator;

  private FlyCalculator(GridInterpolator interpolator) {
    this.interpolator = interpolator;
  }

  /**
   * Returns the fly of three rates.
   *
   * @param shortRate  the short wing rate
   * @param midRate  the body rate
   * @param longRate  the long wing rate
   * @param unit  the unit of the rates
   * @return the fly in basis points
   */
  public static double fly(double shortRate, double midRate, double longRate, RateUnit unit) {
    return unit.toBasisPoints(2d * midRate - shortRate - longRate);
  }

  /**
   * Computes one fly.
   *
   * @param curve  the curve
   * @param definition  the fly tenors
   * @param policy  the alignment policy
   * @return the fly
   * @throws OutOfRangeInterpolationException if a tenor cannot be recovered under the policy
   */
  public ShapeMetric calculate(YieldCurve curve, FlyDefinition definition, AlignmentPolicy policy) {
    ArgChecker.notNull(curve, "curve");
    ArgChecker.notNull(definition, "definition");
    double shortRate = interpolator.interpolate(curve, TenorUtils.years(definition.getShortTenor()), policy);
    double midRate = interpolator.interpolate(curve, TenorUtils.years(definition.getMidTenor()), policy);
    double longRate = interpolator.interpolate(curve, TenorUtils.years(definition.getLongTenor()), policy);
    return ShapeMetric.of(
        definition.getName(),
        ImmutableList.of(definition.getShortTenor(), definition.getMidTenor(), definition.getLongTenor()),
        fly(shortRate, midRate, longRate, curve.getUnit()));
  }

  /**
   * Computes several flies, omitting those with a tenor that cannot be recovered.
   *
   * @param curve  the curve
   * @param definitions  the flies
   * @param policy  the alignment policy
   * @return the flies, in the order of the definitions, with the failures
   */
  public ValueWithFailures<List<ShapeMetric>> calculateAll(
      YieldCurve curve,
      List<FlyDefinition> definitions,
      AlignmentPolicy policy) {

    ArgChecker.noNulls(definitions, "definitions");
    List<ShapeMetric> metrics = new ArrayList<>();
    List<FailureItem> failures = new ArrayList<>();
    for (FlyDefinition definition : definitions) {
      try {
        metrics.add(calculate(curve, definition, policy));
      } catch (OutOfRangeInterpolationException e) {
        failures.add(FailureItem.of(FailureReason.NOT_APPLICABLE,
            "Fly {} omitted for '{}': {}", definition.getName(), curve.getIdentifier(), e.getMessage()));
      }
    }
    return ValueWithFailures.of(ImmutableList.copyOf(metrics), failures);
  }

}
