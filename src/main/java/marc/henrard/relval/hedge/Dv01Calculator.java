/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.hedge;

import com.opengamma.strata.basics.schedule.Frequency;
import com.opengamma.strata.collect.ArgChecker;

import marc.henrard.relval.basics.RateUnit;
import marc.henrard.relval.market.curve.AbstractParCurveBootstrapper;
import marc.henrard.relval.market.curve.CurveKind;
import marc.henrard.relval.market.curve.YieldCurve;

/**
 * DV01 of bonds and swaps by finite difference: the value decrease for a 1 basis point upward move.
 * <p>
 * All DV01 are positive for a long bond or a receiver swap.
 *
 * @author Marc Henrard
 */
public final class Dv01Calculator {

  /** The bump, in basis points. */
  private static final double BUMP_BP = 1d;
  private static final double PAR = 100d;

  /** Private constructor. */
  private Dv01Calculator() {
  }

  /**
   * Returns the DV01 of a bond position from a parallel shift of the zero curve of the issuer.
   *
   * @param position  the position
   * @param zeroCurve  the zero curve of the issuer
   * @return the DV01, in currency per basis point
   */
  public static double bondDv01(BondPosition position, YieldCurve zeroCurve) {
    ArgChecker.notNull(position, "position");
    ArgChecker.notNull(zeroCurve, "zeroCurve");
    ArgChecker.isTrue(zeroCurve.getKind() == CurveKind.ZERO, "Curve '{}' is not a zero curve",
        zeroCurve.getIdentifier());
    double coupon = position.getUnit().convert(position.getCoupon(), zeroCurve.getUnit());
    double price = AbstractParCurveBootstrapper.fixedCouponPrice(
        zeroCurve, position.getMaturity(), coupon, position.getCouponFrequency());
    double priceBumped = AbstractParCurveBootstrapper.fixedCouponPrice(
        zeroCurve.shiftedBy(BUMP_BP), position.getMaturity(), coupon, position.getCouponFrequency());
    return (price - priceBumped) / BUMP_BP * position.getNotional() / PAR;
  }

  /**
   * Returns the DV01 of a bond from a shift of its yield to maturity.
   * <p>
   * The bond is priced with periodic compounding at the coupon frequency, on a whole number of periods.
   *
   * @param face  the face amount
   * @param coupon  the coupon rate
   * @param yield  the yield to maturity
   * @param unit  the unit of the coupon and the yield
   * @param maturity  the time to maturity in years
   * @param frequency  the coupon frequency
   * @return the DV01, in currency per basis point
   */
  public static double yieldDv01(
      double face,
      double coupon,
      double yield,
      RateUnit unit,
      double maturity,
      Frequency frequency) {

    ArgChecker.notNull(unit, "unit");
    double price = yieldPrice(face, unit.toDecimal(coupon), unit.toDecimal(yield), maturity, frequency);
    double priceBumped = yieldPrice(
        face, unit.toDecimal(coupon), unit.toDecimal(yield) + RateUnit.DECIMAL.fromBasisPoints(BUMP_BP),
        maturity, frequency);
    return Math.abs(price - priceBumped) / BUMP_BP;
  }

  // clean price with yield compounded at the coupon frequency
  static double yieldPrice(double face, double coupon, double yield, double maturity, Frequency frequency) {
    ArgChecker.isFalse(frequency.isTerm(), "Frequency must not be term");
    int periodsPerYear = frequency.eventsPerYear();
    double couponAmount = coupon * face / periodsPerYear;
    double periodYield = yield / periodsPerYear;
    long nbPeriods = Math.round(maturity * periodsPerYear);
    if (nbPeriods <= 0) {
      return face;
    }
    double pv = 0d;
    for (int k = 1; k <= nbPeriods; k++) {
      pv += couponAmount / Math.pow(1d + periodYield, k);
    }
    return pv + face / Math.pow(1d + periodYield, nbPeriods);
  }

  /**
   * Returns the DV01 of a receiver swap per unit of notional.
   * <p>
   * The fixed rate is the par rate implied by the zero curve, the swap is valued as its fixed leg plus notional
   * against a float leg at par.
   *
   * @param swapZeroCurve  the zero swap curve
   * @param tenor  the swap tenor in years
   * @param fixedLegFrequency  the fixed leg frequency
   * @return the DV01 per unit of notional per basis point
   */
  public static double swapDv01PerUnitNotional(YieldCurve swapZeroCurve, double tenor, Frequency fixedLegFrequency) {
    ArgChecker.notNull(swapZeroCurve, "swapZeroCurve");
    double parRate = AbstractParCurveBootstrapper.impliedParRate(swapZeroCurve, tenor, fixedLegFrequency);
    double price = AbstractParCurveBootstrapper.fixedCouponPrice(swapZeroCurve, tenor, parRate, fixedLegFrequency);
    double priceBumped = AbstractParCurveBootstrapper.fixedCouponPrice(
        swapZeroCurve.shiftedBy(BUMP_BP), tenor, parRate, fixedLegFrequency);
    return (price - priceBumped) / BUMP_BP / PAR;
  }

}
