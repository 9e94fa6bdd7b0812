/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.market.curve;

import com.opengamma.strata.basics.schedule.Frequency;
import com.opengamma.strata.collect.ArgChecker;
import com.opengamma.strata.collect.array.DoubleArray;

import marc.henrard.relval.basics.TenorUtils;

/**
 * Payment times and accrual factors of a par instrument with regular coupons.
 * <p>
 * The schedule is generated backward from the maturity by steps of one coupon period.
 * A front stub shorter than a period accrues pro rata. The last payment is at the maturity.
 */
final class CouponSchedule {

  private static final double MONTHS_PER_YEAR = 12d;

  /** The payment times in years, increasing. */
  private final DoubleArray paymentTimes;
  /** The accrual factors, in years, of each payment. */
  private final DoubleArray accruals;

  private CouponSchedule(DoubleArray paymentTimes, DoubleArray accruals) {
    this.paymentTimes = paymentTimes;
    this.accruals = accruals;
  }

  /**
   * Creates the schedule of an instrument.
   *
   * @param maturity  the maturity in years
   * @param frequency  the coupon frequency
   * @return the schedule
   * @throws IllegalArgumentException if the frequency is not month-based
   */
  static CouponSchedule of(double maturity, Frequency frequency) {
    ArgChecker.notNegativeOrZero(maturity, "maturity");
    TenorUtils.checkMonthBased(frequency, "frequency");
    double step = frequency.getPeriod().toTotalMonths() / MONTHS_PER_YEAR;
    int nbPeriods = (int) Math.ceil(maturity / step - TenorUtils.TENOR_TOLERANCE / step);
    nbPeriods = Math.max(nbPeriods, 1);
    double[] times = new double[nbPeriods];
    for (int i = 0; i < nbPeriods; i++) {
      times[i] = maturity - (nbPeriods - 1 - i) * step;
    }
    double[] accruals = new double[nbPeriods];
    accruals[0] = times[0];
    for (int i = 1; i < nbPeriods; i++) {
      accruals[i] = times[i] - times[i - 1];
    }
    return new CouponSchedule(DoubleArray.ofUnsafe(times), DoubleArray.ofUnsafe(accruals));
  }

  int size() {
    return paymentTimes.size();
  }

  double paymentTime(int index) {
    return paymentTimes.get(index);
  }

  double accrual(int index) {
    return accruals.get(index);
  }

}
