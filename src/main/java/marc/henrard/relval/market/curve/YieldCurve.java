/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.market.curve;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

import com.google.common.base.MoreObjects;
import com.opengamma.strata.basics.currency.Currency;
import com.opengamma.strata.basics.schedule.Frequency;
import com.opengamma.strata.collect.ArgChecker;
import com.opengamma.strata.collect.array.DoubleArray;

import marc.henrard.relval.basics.RateUnit;
import marc.henrard.relval.basics.TenorUtils;
import marc.henrard.relval.market.quote.Quote;

/**
 * A curve of par or zero rates on a grid of tenors, for one issuer or currency.
 * <p>
 * Tenors are year fractions, strictly increasing. Rates are expressed in the {@link RateUnit} of the curve.
 * A zero curve also records the compounding convention and the coupon frequency used to derive it.
 * The curve is immutable.
 *
 * @author Marc Henrard
 */
public final class YieldCurve {

  /** The issuer or currency. */
  private final String identifier;
  private final CurveKind kind;
  private final RateUnit unit;
  private final DoubleArray tenors;
  private final DoubleArray rates;
  /** The currency, present for swap curves. */
  private final Currency currency;
  /** The compounding used in bootstrapping, present for zero curves. */
  private final CompoundingConvention compounding;
  /** The coupon frequency used in bootstrapping, present for zero curves. */
  private final Frequency frequency;

  private YieldCurve(
      String identifier,
      CurveKind kind,
      RateUnit unit,
      DoubleArray tenors,
      DoubleArray rates,
      Currency currency,
      CompoundingConvention compounding,
      Frequency frequency) {

    ArgChecker.notBlank(identifier, "identifier");
    ArgChecker.notNull(kind, "kind");
    ArgChecker.notNull(unit, "unit");
    ArgChecker.notNull(tenors, "tenors");
    ArgChecker.notNull(rates, "rates");
    ArgChecker.isTrue(tenors.size() > 0, "Curve '{}' must have at least one point", identifier);
    ArgChecker.isTrue(tenors.size() == rates.size(),
        "Curve '{}' has {} tenors and {} rates", identifier, tenors.size(), rates.size());
    ArgChecker.isTrue(tenors.get(0) > 0d, "Curve '{}' tenors must be positive", identifier);
    for (int i = 1; i < tenors.size(); i++) {
      ArgChecker.isTrue(tenors.get(i) - tenors.get(i - 1) >= TenorUtils.TENOR_TOLERANCE,
          "Curve '{}' tenors must be strictly increasing and unique, found {} after {}",
          identifier, tenors.get(i), tenors.get(i - 1));
    }
    if (kind == CurveKind.ZERO) {
      ArgChecker.notNull(compounding, "compounding");
      ArgChecker.notNull(frequency, "frequency");
    }
    this.identifier = identifier;
    this.kind = kind;
    this.unit = unit;
    this.tenors = tenors;
    this.rates = rates;
    this.currency = currency;
    this.compounding = compounding;
    this.frequency = frequency;
  }

  /**
   * Obtains a par curve.
   *
   * @param identifier  the issuer or currency
   * @param unit  the unit of the rates
   * @param tenors  the tenors, strictly increasing
   * @param rates  the par rates
   * @return the curve
   */
  public static YieldCurve ofPar(String identifier, RateUnit unit, DoubleArray tenors, DoubleArray rates) {
    return new YieldCurve(identifier, CurveKind.PAR, unit, tenors, rates, null, null, null);
  }

  /**
   * Obtains a zero curve.
   *
   * @param identifier  the issuer or currency
   * @param unit  the unit of the rates
   * @param tenors  the tenors, strictly increasing
   * @param rates  the zero rates
   * @param compounding  the compounding convention of the zero rates
   * @param frequency  the coupon frequency of the instruments bootstrapped
   * @return the curve
   */
  public static YieldCurve ofZero(
      String identifier,
      RateUnit unit,
      DoubleArray tenors,
      DoubleArray rates,
      CompoundingConvention compounding,
      Frequency frequency) {

    return new YieldCurve(identifier, CurveKind.ZERO, unit, tenors, rates, null, compounding, frequency);
  }

  /**
   * Obtains a par curve from the quotes of one issuer or currency.
   * <p>
   * The quotes are sorted by tenor. They must share the same identifier and unit and have unique tenors.
   *
   * @param quotes  the quotes
   * @return the par curve
   */
  public static YieldCurve ofQuotes(List<Quote> quotes) {
    ArgChecker.notEmpty(quotes, "quotes");
    Quote first = quotes.get(0);
    Quote[] sorted = quotes.toArray(new Quote[0]);
    Arrays.sort(sorted, Comparator.comparingDouble(Quote::getTenorYears));
    double[] tenors = new double[sorted.length];
    double[] rates = new double[sorted.length];
    for (int i = 0; i < sorted.length; i++) {
      ArgChecker.isTrue(sorted[i].getIdentifier().equals(first.getIdentifier()),
          "Quotes mix identifiers '{}' and '{}'", first.getIdentifier(), sorted[i].getIdentifier());
      ArgChecker.isTrue(sorted[i].getUnit() == first.getUnit(),
          "Quotes for '{}' mix units {} and {}", first.getIdentifier(), first.getUnit(), sorted[i].getUnit());
      tenors[i] = sorted[i].getTenorYears();
      rates[i] = sorted[i].getRate();
    }
    return ofPar(first.getIdentifier(), first.getUnit(), DoubleArray.ofUnsafe(tenors), DoubleArray.ofUnsafe(rates));
  }

  //-------------------------------------------------------------------------
  /**
   * Returns a copy of this curve tagged with a currency.
   *
   * @param currency  the currency
   * @return the tagged curve
   */
  public YieldCurve withCurrency(Currency currency) {
    ArgChecker.notNull(currency, "currency");
    return new YieldCurve(identifier, kind, unit, tenors, rates, currency, compounding, frequency);
  }

  /**
   * Returns a copy of this curve with different rates on the same grid.
   *
   * @param newRates  the new rates, in the unit of this curve
   * @return the new curve
   */
  public YieldCurve withRates(DoubleArray newRates) {
    return new YieldCurve(identifier, kind, unit, tenors, newRates, currency, compounding, frequency);
  }

  /**
   * Returns a copy of this curve with all rates shifted in parallel.
   *
   * @param basisPoints  the shift in basis points
   * @return the shifted curve
   */
  public YieldCurve shiftedBy(double basisPoints) {
    double shift = unit.fromBasisPoints(basisPoints);
    return withRates(rates.map(r -> r + shift));
  }

  /**
   * Returns a copy of this curve with the rates expressed in another unit.
   *
   * @param targetUnit  the unit
   * @return the converted curve
   */
  public YieldCurve toUnit(RateUnit targetUnit) {
    if (targetUnit == unit) {
      return this;
    }
    return new YieldCurve(
        identifier, kind, targetUnit, tenors, rates.map(r -> unit.convert(r, targetUnit)),
        currency, compounding, frequency);
  }

  //-------------------------------------------------------------------------
  public String getIdentifier() {
    return identifier;
  }

  public CurveKind getKind() {
    return kind;
  }

  public RateUnit getUnit() {
    return unit;
  }

  public DoubleArray getTenors() {
    return tenors;
  }

  public DoubleArray getRates() {
    return rates;
  }

  public Optional<Currency> getCurrency() {
    return Optional.ofNullable(currency);
  }

  public Optional<CompoundingConvention> getCompounding() {
    return Optional.ofNullable(compounding);
  }

  public Optional<Frequency> getFrequency() {
    return Optional.ofNullable(frequency);
  }

  public int size() {
    return tenors.size();
  }

  public double getFirstTenor() {
    return tenors.get(0);
  }

  public double getLastTenor() {
    return tenors.get(tenors.size() - 1);
  }

  /**
   * Returns the index of the grid point matching the tenor, or -1.
   *
   * @param tenor  the tenor in years
   * @return the index, -1 if the tenor is not on the grid
   */
  public int indexOf(double tenor) {
    int index = Arrays.binarySearch(tenors.toArrayUnsafe(), tenor);
    int insertion = index >= 0 ? index : -index - 1;
    for (int i = Math.max(0, insertion - 1); i <= Math.min(tenors.size() - 1, insertion); i++) {
      if (TenorUtils.sameTenor(tenors.get(i), tenor)) {
        return i;
      }
    }
    return -1;
  }

  /**
   * Finds the rate stored at a grid tenor, without interpolation.
   *
   * @param tenor  the tenor in years
   * @return the rate, empty if the tenor is not on the grid
   */
  public OptionalDouble findRate(double tenor) {
    int index = indexOf(tenor);
    return index < 0 ? OptionalDouble.empty() : OptionalDouble.of(rates.get(index));
  }

  /**
   * Returns the grid tenor closest to a tenor. Ties go to the shorter tenor.
   *
   * @param tenor  the tenor in years
   * @return the closest grid tenor
   */
  public double nearestTenor(double tenor) {
    double nearest = tenors.get(0);
    for (int i = 1; i < tenors.size(); i++) {
      if (Math.abs(tenors.get(i) - tenor) < Math.abs(nearest - tenor)) {
        nearest = tenors.get(i);
      }
    }
    return nearest;
  }

  //-------------------------------------------------------------------------
  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || obj.getClass() != getClass()) {
      return false;
    }
    YieldCurve other = (YieldCurve) obj;
    return identifier.equals(other.identifier) &&
        kind == other.kind &&
        unit == other.unit &&
        tenors.equals(other.tenors) &&
        rates.equals(other.rates) &&
        Objects.equals(currency, other.currency) &&
        compounding == other.compounding &&
        Objects.equals(frequency, other.frequency);
  }

  @Override
  public int hashCode() {
    return Objects.hash(identifier, kind, unit, tenors, rates, currency, compounding, frequency);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("identifier", identifier)
        .add("kind", kind)
        .add("unit", unit)
        .add("tenors", tenors)
        .add("rates", rates)
        .add("currency", currency)
        .add("compounding", compounding)
        .add("frequency", frequency)
        .omitNullValues()
        .toString();
  }

}
