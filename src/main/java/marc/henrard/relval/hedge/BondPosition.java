/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.hedge;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

import com.google.common.base.MoreObjects;
import com.opengamma.strata.basics.schedule.Frequency;
import com.opengamma.strata.collect.ArgChecker;

import marc.henrard.relval.basics.RateUnit;
import marc.henrard.relval.basics.TenorUtils;

/**
 * A long position in a fixed coupon government bond.
 */
public final class BondPosition {

  private final String issuer;
  private final double notional;
  /** The coupon rate, in {@link #unit}. */
  private final double coupon;
  private final RateUnit unit;
  /** The time to maturity in years. */
  private final double maturity;
  private final Frequency couponFrequency;

  private BondPosition(
      String issuer,
      double notional,
      double coupon,
      RateUnit unit,
      double maturity,
      Frequency couponFrequency) {

    this.issuer = ArgChecker.notBlank(issuer, "issuer");
    this.notional = ArgChecker.notNegativeOrZero(notional, "notional");
    this.coupon = coupon;
    this.unit = ArgChecker.notNull(unit, "unit");
    this.maturity = ArgChecker.notNegativeOrZero(maturity, "maturity");
    this.couponFrequency = TenorUtils.checkMonthBased(couponFrequency, "couponFrequency");
  }

  /**
   * Obtains a position.
   *
   * @param issuer  the issuer
   * @param notional  the notional
   * @param coupon  the coupon rate
   * @param unit  the unit of the coupon rate
   * @param maturity  the time to maturity in years
   * @param couponFrequency  the coupon frequency
   * @return the position
   */
  public static BondPosition of(
      String issuer,
      double notional,
      double coupon,
      RateUnit unit,
      double maturity,
      Frequency couponFrequency) {

    return new BondPosition(issuer, notional, coupon, unit, maturity, couponFrequency);
  }

  /**
   * Returns a short description, like "Italy 3.5% 10Y".
   *
   * @return the description
   */
  public String getDescription() {
    BigDecimal percent = BigDecimal.valueOf(unit.convert(coupon, RateUnit.PERCENT))
        .setScale(4, RoundingMode.HALF_UP)
        .stripTrailingZeros();
    return issuer + " " + percent.toPlainString() + "% " + TenorUtils.label(maturity);
  }

  public String getIssuer() {
    return issuer;
  }

  public double getNotional() {
    return notional;
  }

  public double getCoupon() {
    return coupon;
  }

  public RateUnit getUnit() {
    return unit;
  }

  public double getMaturity() {
    return maturity;
  }

  public Frequency getCouponFrequency() {
    return couponFrequency;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || obj.getClass() != getClass()) {
      return false;
    }
    BondPosition other = (BondPosition) obj;
    return issuer.equals(other.issuer) &&
        Double.compare(notional, other.notional) == 0 &&
        Double.compare(coupon, other.coupon) == 0 &&
        unit == other.unit &&
        Double.compare(maturity, other.maturity) == 0 &&
        couponFrequency.equals(other.couponFrequency);
  }

  @Override
  public int hashCode() {
    return Objects.hash(issuer, notional, coupon, unit, maturity, couponFrequency);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("issuer", issuer)
        .add("notional", notional)
        .add("coupon", coupon)
        .add("unit", unit)
        .add("maturity", maturity)
        .add("couponFrequency", couponFrequency)
        .toString();
  }

}
