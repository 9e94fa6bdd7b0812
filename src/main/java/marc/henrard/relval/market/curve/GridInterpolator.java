/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.market.curve;

import com.opengamma.strata.collect.ArgChecker;
import com.opengamma.strata.market.curve.interpolator.BoundCurveInterpolator;
import com.opengamma.strata.market.curve.interpolator.CurveExtrapolators;
import com.opengamma.strata.market.curve.interpolator.CurveInterpolator;
import com.opengamma.strata.market.curve.interpolator.CurveInterpolators;

import marc.henrard.relval.basics.OutOfRangeInterpolationException;

/**
 * Interpolates the rate of a {@link YieldCurve} at any tenor.
 * <p>
 * A tenor on the grid, within {@link marc.henrard.relval.basics.TenorUtils#TENOR_TOLERANCE}, returns the stored
 * rate exactly. Between two grid points the rate is linear in the tenor. Outside the grid the
 * {@link AlignmentPolicy} applies: strict fails with {@link OutOfRangeInterpolationException}, nearest returns
 * the rate of the closest end point.
 *
 * @author Marc Henrard
 */
public final class GridInterpolator {

  /** The default instance, linear in tenor. */
  public static final GridInterpolator DEFAULT = new GridInterpolator(CurveInterpolators.LINEAR);

  /** The interpolator between grid points. */
  private final CurveInterpolator interpolator;

  private GridInterpolator(CurveInterpolator interpolator) {
    this.interpolator = interpolator;
  }

  /**
   * Returns the rate of the curve at the tenor.
   *
   * @param curve  the curve
   * @param tenor  the tenor in years
   * @param policy  the alignment policy for tenors outside the grid
   * @return the rate, in the unit of the curve
   * @throws OutOfRangeInterpolationException if the tenor is outside the grid and the policy is strict
   */
  public double interpolate(YieldCurve curve, double tenor, AlignmentPolicy policy) {
    ArgChecker.notNull(curve, "curve");
    ArgChecker.notNull(policy, "policy");
    ArgChecker.isFalse(Double.isNaN(tenor), "tenor is NaN");
    int index = curve.indexOf(tenor);
    if (index >= 0) {
      return curve.getRates().get(index);
    }
    if (tenor < curve.getFirstTenor() || tenor > curve.getLastTenor()) {
      if (policy == AlignmentPolicy.STRICT) {
        throw new OutOfRangeInterpolationException(
            curve.getIdentifier(), tenor, curve.getFirstTenor(), curve.getLastTenor());
      }
      return tenor < curve.getFirstTenor() ?
          curve.getRates().get(0) :
          curve.getRates().get(curve.size() - 1);
    }
    // inside the range and not on the grid, so at least two points
    BoundCurveInterpolator bound = interpolator.bind(
        curve.getTenors(), curve.getRates(), CurveExtrapolators.FLAT, CurveExtrapolators.FLAT);
    return bound.interpolate(tenor);
  }

}
