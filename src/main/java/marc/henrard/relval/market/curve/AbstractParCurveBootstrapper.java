/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.market.curve;

import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.opengamma.strata.basics.schedule.Frequency;
import com.opengamma.strata.collect.ArgChecker;
import com.opengamma.strata.collect.array.DoubleArray;
import com.opengamma.strata.math.impl.rootfinding.BrentSingleRootFinder;

import marc.henrard.relval.basics.CurveBootstrapException;
import marc.henrard.relval.basics.OutOfRangeInterpolationException;
import marc.henrard.relval.basics.RateUnit;
import marc.henrard.relval.basics.TenorUtils;

/**
 * Bootstraps zero rates from par rates of instruments paying regular fixed coupons and priced at par.
 * <p>
 * The tenors are processed in increasing order. For each tenor the instrument is a fixed coupon bond with
 * coupon equal to the par rate. The coupons paid before the tenor are discounted with the zero rates already
 * obtained, interpolated with {@link GridInterpolator} when a coupon date is not on the grid. The only unknown
 * is the discount factor of the last cash flow, obtained in closed form:
 * <pre>
 *   DF_N = (100 - sum_k c_k DF_k) / (100 + c_N)
 * </pre>
 * When a coupon date lies after the last bootstrapped tenor, its interpolated zero rate depends on the unknown
 * zero rate and the closed form does not apply; the zero rate is then obtained by root finding on the price.
 */
public abstract class AbstractParCurveBootstrapper {

  private static final Logger LOGGER = LoggerFactory.getLogger(AbstractParCurveBootstrapper.class);

  /** The par price. */
  protected static final double PAR = 100d;
  /** Bracket, in decimal, in which the zero rate is searched. */
  private static final double ZERO_RATE_LOWER = -0.50;
  private static final double ZERO_RATE_UPPER = 1.00;
  private static final double ROOT_ACCURACY = 1.0E-14;
  private static final BrentSingleRootFinder ROOT_FINDER = new BrentSingleRootFinder(ROOT_ACCURACY);
  private static final GridInterpolator INTERPOLATOR = GridInterpolator.DEFAULT;

  /**
   * Bootstraps the zero curve from a par curve.
   * <p>
   * The zero curve has the same grid and unit as the par curve.
   *
   * @param parCurve  the par curve
   * @param compounding  the compounding convention of the zero rates
   * @param frequency  the coupon frequency of the par instruments
   * @param policy  the alignment policy for intermediate coupon dates
   * @return the zero curve
   * @throws CurveBootstrapException if a discount factor cannot be obtained
   */
  protected YieldCurve bootstrapCurve(
      YieldCurve parCurve,
      CompoundingConvention compounding,
      Frequency frequency,
      AlignmentPolicy policy) {

    ArgChecker.isTrue(parCurve.getKind() == CurveKind.PAR, "Curve '{}' is not a par curve", parCurve.getIdentifier());
    String identifier = parCurve.getIdentifier();
    RateUnit unit = parCurve.getUnit();
    int nbTenors = parCurve.size();
    double[] tenors = parCurve.getTenors().toArray();
    double[] zeroRates = new double[nbTenors];
    for (int i = 0; i < nbTenors; i++) {
      double parRate = unit.toDecimal(parCurve.getRates().get(i));
      zeroRates[i] = zeroRate(identifier, tenors, zeroRates, i, parRate, compounding, frequency, policy);
    }
    LOGGER.debug("Bootstrapped {} zero rates for '{}' ({}, {})", nbTenors, identifier, compounding, frequency);
    YieldCurve zero = YieldCurve.ofZero(
        identifier, RateUnit.DECIMAL, DoubleArray.ofUnsafe(tenors), DoubleArray.ofUnsafe(zeroRates),
        compounding, frequency).toUnit(unit);
    return parCurve.getCurrency().map(zero::withCurrency).orElse(zero);
  }

  // the zero rate, in decimal, at the tenor of index 'index', the previous ones being known
  private static double zeroRate(
      String identifier,
      double[] tenors,
      double[] zeroRates,
      int index,
      double parRate,
      CompoundingConvention compounding,
      Frequency frequency,
      AlignmentPolicy policy) {

    double tenor = tenors[index];
    CouponSchedule schedule = CouponSchedule.of(tenor, frequency);
    int nbPayments = schedule.size();
    double lastKnownTenor = index == 0 ? 0d : tenors[index - 1];
    boolean closedForm = true;
    for (int j = 0; j < nbPayments - 1; j++) {
      double paymentTime = schedule.paymentTime(j);
      if (paymentTime < tenors[0] - TenorUtils.TENOR_TOLERANCE && policy == AlignmentPolicy.STRICT) {
        throw new CurveBootstrapException(identifier, tenor,
            "coupon date " + paymentTime + " before first tenor " + tenors[0] + " under strict alignment");
      }
      if (index == 0 || paymentTime > lastKnownTenor + TenorUtils.TENOR_TOLERANCE) {
        closedForm = false;
      }
    }
    if (closedForm) {
      // single cash flow on the first tenor: no curve known yet and nothing to discount
      YieldCurve known = nbPayments > 1 ?
          knownCurve(identifier, tenors, zeroRates, index, compounding, frequency) :
          null;
      double couponSum = 0d;
      for (int j = 0; j < nbPayments - 1; j++) {
        double time = schedule.paymentTime(j);
        double rate = interpolate(identifier, tenor, known, time, policy);
        couponSum += PAR * parRate * schedule.accrual(j) * compounding.discountFactor(rate, time);
      }
      double numerator = PAR - couponSum;
      double denominator = PAR + PAR * parRate * schedule.accrual(nbPayments - 1);
      if (numerator <= 0d || denominator <= 0d) {
        throw new CurveBootstrapException(identifier, tenor, "non-positive discount factor");
      }
      return compounding.checkedZeroRate(numerator / denominator, tenor);
    }
    Function<Double, Double> priceError = z -> {
      YieldCurve trial = trialCurve(identifier, tenors, zeroRates, index, z, compounding, frequency);
      return price(identifier, tenor, trial, schedule, parRate, compounding, policy) - PAR;
    };
    double errorLower = priceError.apply(ZERO_RATE_LOWER);
    double errorUpper = priceError.apply(ZERO_RATE_UPPER);
    if (errorLower * errorUpper > 0d) {
      throw new CurveBootstrapException(identifier, tenor,
          "zero rate not bracketed in [" + ZERO_RATE_LOWER + ", " + ZERO_RATE_UPPER + "]");
    }
    try {
      return ROOT_FINDER.getRoot(priceError, ZERO_RATE_LOWER, ZERO_RATE_UPPER);
    } catch (RuntimeException e) {
      throw new CurveBootstrapException(identifier, tenor, e);
    }
  }

  // price, for a notional of 100, of the fixed coupon instrument discounted with a zero curve in decimal
  private static double price(
      String identifier,
      double tenor,
      YieldCurve zeroCurve,
      CouponSchedule schedule,
      double parRate,
      CompoundingConvention compounding,
      AlignmentPolicy policy) {

    double pv = 0d;
    int nbPayments = schedule.size();
    for (int j = 0; j < nbPayments; j++) {
      double time = schedule.paymentTime(j);
      double rate = interpolate(identifier, tenor, zeroCurve, time, policy);
      double cashFlow = PAR * parRate * schedule.accrual(j) + (j == nbPayments - 1 ? PAR : 0d);
      pv += cashFlow * compounding.discountFactor(rate, time);
    }
    return pv;
  }

  private static double interpolate(
      String identifier,
      double tenor,
      YieldCurve curve,
      double time,
      AlignmentPolicy policy) {

    try {
      return INTERPOLATOR.interpolate(curve, time, policy);
    } catch (OutOfRangeInterpolationException e) {
      throw new CurveBootstrapException(identifier, tenor, e);
    }
  }

  private static YieldCurve knownCurve(
      String identifier,
      double[] tenors,
      double[] zeroRates,
      int index,
      CompoundingConvention compounding,
      Frequency frequency) {

    return YieldCurve.ofZero(identifier, RateUnit.DECIMAL,
        DoubleArray.copyOf(tenors, 0, index), DoubleArray.copyOf(zeroRates, 0, index), compounding, frequency);
  }

  private static YieldCurve trialCurve(
      String identifier,
      double[] tenors,
      double[] zeroRates,
      int index,
      double trialRate,
      CompoundingConvention compounding,
      Frequency frequency) {

    double[] trialRates = new double[index + 1];
    System.arraycopy(zeroRates, 0, trialRates, 0, index);
    trialRates[index] = trialRate;
    return YieldCurve.ofZero(identifier, RateUnit.DECIMAL,
        DoubleArray.copyOf(tenors, 0, index + 1), DoubleArray.ofUnsafe(trialRates), compounding, frequency);
  }

  //-------------------------------------------------------------------------
  /**
   * Returns the price, for a notional of 100, of a par instrument discounted with a zero curve.
   * <p>
   * The instrument pays regular coupons at the par rate with the frequency of the zero curve and redeems 100
   * at the tenor. Discounting uses the compounding of the zero curve. Repricing the quotes used to bootstrap
   * a zero curve returns 100.
   *
   * @param zeroCurve  the zero curve
   * @param tenor  the tenor of the instrument, in years
   * @param parRate  the par rate, in the unit of the zero curve
   * @return the price
   */
  public static double parPrice(YieldCurve zeroCurve, double tenor, double parRate) {
    ArgChecker.isTrue(zeroCurve.getKind() == CurveKind.ZERO, "Curve '{}' is not a zero curve",
        zeroCurve.getIdentifier());
    return fixedCouponPrice(zeroCurve, tenor, parRate, zeroCurve.getFrequency().get());
  }

  /**
   * Returns the price, for a notional of 100, of a fixed coupon instrument discounted with a zero curve.
   * <p>
   * The instrument pays regular coupons with the given frequency and redeems 100 at maturity.
   * Discounting uses the compounding of the zero curve. Coupon dates outside the curve use the nearest rate.
   *
   * @param zeroCurve  the zero curve
   * @param maturity  the maturity of the instrument, in years
   * @param couponRate  the coupon rate, in the unit of the zero curve
   * @param frequency  the coupon frequency
   * @return the price
   */
  public static double fixedCouponPrice(YieldCurve zeroCurve, double maturity, double couponRate, Frequency frequency) {
    ArgChecker.isTrue(zeroCurve.getKind() == CurveKind.ZERO, "Curve '{}' is not a zero curve",
        zeroCurve.getIdentifier());
    ArgChecker.notNull(frequency, "frequency");
    CompoundingConvention compounding = zeroCurve.getCompounding().get();
    YieldCurve decimalCurve = zeroCurve.toUnit(RateUnit.DECIMAL);
    return price(zeroCurve.getIdentifier(), maturity, decimalCurve, CouponSchedule.of(maturity, frequency),
        zeroCurve.getUnit().toDecimal(couponRate), compounding, AlignmentPolicy.NEAREST);
  }

  /**
   * Returns the par rate implied by a zero curve for an instrument with regular coupons.
   * <p>
   * The par rate is (1 - DF_N) / sum_k alpha_k DF_k, in the unit of the zero curve.
   *
   * @param zeroCurve  the zero curve
   * @param maturity  the maturity of the instrument, in years
   * @param frequency  the coupon frequency
   * @return the par rate
   */
  public static double impliedParRate(YieldCurve zeroCurve, double maturity, Frequency frequency) {
    ArgChecker.isTrue(zeroCurve.getKind() == CurveKind.ZERO, "Curve '{}' is not a zero curve",
        zeroCurve.getIdentifier());
    CompoundingConvention compounding = zeroCurve.getCompounding().get();
    YieldCurve decimalCurve = zeroCurve.toUnit(RateUnit.DECIMAL);
    CouponSchedule schedule = CouponSchedule.of(maturity, frequency);
    double annuity = 0d;
    double lastDiscountFactor = 1d;
    for (int j = 0; j < schedule.size(); j++) {
      double time = schedule.paymentTime(j);
      lastDiscountFactor = compounding.discountFactor(
          INTERPOLATOR.interpolate(decimalCurve, time, AlignmentPolicy.NEAREST), time);
      annuity += schedule.accrual(j) * lastDiscountFactor;
    }
    return zeroCurve.getUnit().fromDecimal((1d - lastDiscountFactor) / annuity);
  }

}
