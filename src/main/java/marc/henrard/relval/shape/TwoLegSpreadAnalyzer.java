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
import marc.henrard.relval.basics.TenorUtils;
import marc.henrard.relval.market.curve.AlignmentPolicy;
import marc.henrard.relval.market.curve.GridInterpolator;
import marc.henrard.relval.market.curve.YieldCurve;

/**
 * Computes two-leg slopes of a curve, like 2s10s: rate of the long tenor minus rate of the short tenor,
 * in basis points.
 * <p>
 * A steepening curve has a growing positive slope.
 *
 * @author Marc Henrard
 */
public final class TwoLegSpreadAnalyzer {

  /** The standard pairs: 2s10s, 5s30s, 2s5s. */
  public static final ImmutableList<TenorPair> STANDARD_PAIRS =
      ImmutableList.of(TenorPair.TWOS_TENS, TenorPair.FIVES_THIRTIES, TenorPair.TWOS_FIVES);

  /** The default instance. */
  public static final TwoLegSpreadAnalyzer DEFAULT = new TwoLegSpreadAnalyzer(GridInterpolator.DEFAULT);

  private final GridInterpolator interpolator;

  private TwoLegSpreadAnalyzer(GridInterpolator interpolator) {
    this.interpolator = interpolator;
  }

  /**
   * Computes the slope of one pair.
   *
   * @param curve  the curve
   * @param pair  the tenor pair
   * @param policy  the alignment policy
   * @return the slope
   * @throws OutOfRangeInterpolationException if a tenor cannot be recovered under the policy
   */
  public ShapeMetric slope(YieldCurve curve, TenorPair pair, AlignmentPolicy policy) {
    ArgChecker.notNull(curve, "curve");
    ArgChecker.notNull(pair, "pair");
    double shortRate = interpolator.interpolate(curve, TenorUtils.years(pair.getShortTenor()), policy);
    double longRate = interpolator.interpolate(curve, TenorUtils.years(pair.getLongTenor()), policy);
    return ShapeMetric.of(
        pair.getName(),
        ImmutableList.of(pair.getShortTenor(), pair.getLongTenor()),
        curve.getUnit().toBasisPoints(longRate - shortRate));
  }

  /**
   * Computes the slopes of several pairs.
   * <p>
   * A pair with a tenor that cannot be recovered is omitted and reported as a failure.
   *
   * @param curve  the curve
   * @param pairs  the tenor pairs
   * @param policy  the alignment policy
   * @return the slopes, in the order of the pairs, with the failures
   */
  public ValueWithFailures<List<ShapeMetric>> analyze(YieldCurve curve, List<TenorPair> pairs, AlignmentPolicy policy) {
    ArgChecker.noNulls(pairs, "pairs");
    List<ShapeMetric> metrics = new ArrayList<>();
    List<FailureItem> failures = new ArrayList<>();
    for (TenorPair pair : pairs) {
      try {
        metrics.add(slope(curve, pair, policy));
      } catch (OutOfRangeInterpolationException e) {
        failures.add(FailureItem.of(FailureReason.NOT_APPLICABLE,
            "Slope {} omitted for '{}': {}", pair.getName(), curve.getIdentifier(), e.getMessage()));
      }
    }
    return ValueWithFailures.of(ImmutableList.copyOf(metrics), failures);
  }

}
