/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.basics;

import java.time.Period;

import com.opengamma.strata.basics.date.Tenor;
import com.opengamma.strata.basics.schedule.Frequency;
import com.opengamma.strata.collect.ArgChecker;

/**
 * Conversions between tenor labels and year fractions.
 * <p>
 * Labels are the market ones, like "3M", "2Y" or "10Y". Year fractions are the grid coordinates of the curves.
 */
public final class TenorUtils {

  /** Tolerance, in years, under which two tenors are the same grid point. */
  public static final double TENOR_TOLERANCE = 1.0E-8;

  private static final double DAYS_PER_YEAR = 365d;
  private static final double MONTHS_PER_YEAR = 12d;

  /** Private constructor. */
  private TenorUtils() {
  }

  /**
   * Returns the tenor as a year fraction.
   * <p>
   * Month and year tenors are converted exactly (6M is 0.5), day and week tenors use 365 days per year.
   * 
   * @param tenor  the tenor
   * @return the year fraction
   */
  public static double years(Tenor tenor) {
    Period period = tenor.getPeriod();
    if (period.getDays() != 0) {
      ArgChecker.isTrue(period.toTotalMonths() == 0, "Mixed tenor {} not supported", tenor);
      return period.getDays() / DAYS_PER_YEAR;
    }
    return period.toTotalMonths() / MONTHS_PER_YEAR;
  }

  /**
   * Parses a tenor label, like "6M" or "10Y", and returns the year fraction.
   * 
   * @param label  the label
   * @return the year fraction
   */
  public static double years(String label) {
    ArgChecker.notBlank(label, "label");
    return years(Tenor.parse(label.trim().toUpperCase()));
  }

  /**
   * Returns the market label of a year fraction.
   * <p>
   * Whole years are labelled in years, whole months in months; anything else uses the year fraction.
   * 
   * @param years  the year fraction
   * @return the label
   */
  public static String label(double years) {
    long wholeYears = Math.round(years);
    if (Math.abs(years - wholeYears) < TENOR_TOLERANCE && wholeYears > 0) {
      return wholeYears + "Y";
    }
    long wholeMonths = Math.round(years * MONTHS_PER_YEAR);
    if (Math.abs(years * MONTHS_PER_YEAR - wholeMonths) < TENOR_TOLERANCE * MONTHS_PER_YEAR && wholeMonths > 0) {
      return wholeMonths + "M";
    }
    return years + "Y";
  }

  /**
   * Checks if two year fractions designate the same grid point.
   * 
   * @param tenor1  the first tenor
   * @param tenor2  the second tenor
   * @return true if equal within the tenor tolerance
   */
  public static boolean sameTenor(double tenor1, double tenor2) {
    return Math.abs(tenor1 - tenor2) < TENOR_TOLERANCE;
  }

  /**
   * Checks that a coupon frequency is a whole number of months.
   * <p>
   * Coupon schedules are generated in months; term, week and day frequencies are rejected.
   *
   * @param frequency  the frequency
   * @param name  the name of the argument, for the error message
   * @return the frequency
   * @throws IllegalArgumentException if the frequency is not month-based
   */
  public static Frequency checkMonthBased(Frequency frequency, String name) {
    ArgChecker.notNull(frequency, name);
    ArgChecker.isTrue(frequency.isMonthBased(), "{} must be month-based, but was '{}'", name, frequency);
    return frequency;
  }

}
