/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.dataset;

import java.time.Instant;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.opengamma.strata.basics.currency.Currency;
import com.opengamma.strata.basics.schedule.Frequency;
import com.opengamma.strata.collect.array.DoubleArray;

import marc.henrard.relval.basics.RateUnit;
import marc.henrard.relval.market.curve.CompoundingConvention;
import marc.henrard.relval.market.curve.YieldCurve;
import marc.henrard.relval.market.quote.Quote;
import marc.henrard.relval.market.quote.QuoteSnapshot;

/**
 * Quotes and curves used in the tests of the relative value library.
 * <p>
 * Two government issuers, Germany (the reference) and Italy, on the grid 2Y, 5Y, 10Y, 30Y, and the EUR and USD
 * swap curves.
 */
public final class RelativeValueDataSet {

  public static final Instant SNAPSHOT_TIME = Instant.parse("2026-10-16T16:00:00Z");

  public static final String GERMANY = "Germany";
  public static final String ITALY = "Italy";

  public static final DoubleArray GOV_TENORS = DoubleArray.of(2, 5, 10, 30);
  public static final DoubleArray GERMANY_RATES = DoubleArray.of(2.00, 2.20, 2.60, 2.90);
  public static final DoubleArray ITALY_RATES = DoubleArray.of(2.50, 2.90, 3.60, 4.30);

  public static final DoubleArray SWAP_TENORS = DoubleArray.of(1, 2, 3, 5, 7, 10, 15, 20, 30);
  public static final DoubleArray EUR_SWAP_RATES = DoubleArray.of(3.40, 3.10, 2.90, 2.70, 2.65, 2.60, 2.60, 2.60, 2.50);
  public static final DoubleArray USD_SWAP_RATES = DoubleArray.of(5.20, 4.80, 4.50, 4.20, 4.10, 4.00, 4.00, 4.00, 3.90);

  /** Private constructor. */
  private RelativeValueDataSet() {
  }

  public static YieldCurve germanyPar() {
    return YieldCurve.ofPar(GERMANY, RateUnit.PERCENT, GOV_TENORS, GERMANY_RATES);
  }

  public static YieldCurve italyPar() {
    return YieldCurve.ofPar(ITALY, RateUnit.PERCENT, GOV_TENORS, ITALY_RATES);
  }

  /**
   * Returns a flat zero curve, for DV01 tests.
   *
   * @param identifier  the identifier
   * @param rate  the rate, in percent
   * @param compounding  the compounding
   * @param frequency  the frequency
   * @return the curve
   */
  public static YieldCurve flatZero(
      String identifier,
      double rate,
      CompoundingConvention compounding,
      Frequency frequency) {

    return YieldCurve.ofZero(identifier, RateUnit.PERCENT, DoubleArray.of(1, 2, 5, 10, 30),
        DoubleArray.filled(5, rate), compounding, frequency);
  }

  public static ImmutableList<Quote> quotes(String identifier, DoubleArray tenors, DoubleArray rates) {
    ImmutableList.Builder<Quote> quotes = ImmutableList.builder();
    for (int i = 0; i < tenors.size(); i++) {
      quotes.add(Quote.of(identifier, ((int) tenors.get(i)) + "Y", rates.get(i), RateUnit.PERCENT));
    }
    return quotes.build();
  }

  public static ImmutableList<Quote> eurSwapQuotes() {
    return quotes(Currency.EUR.getCode(), SWAP_TENORS, EUR_SWAP_RATES);
  }

  public static ImmutableList<Quote> usdSwapQuotes() {
    return quotes(Currency.USD.getCode(), SWAP_TENORS, USD_SWAP_RATES);
  }

  /**
   * Returns the snapshot of the two issuers and the EUR and USD swaps.
   *
   * @return the snapshot
   */
  public static QuoteSnapshot snapshot() {
    return snapshot(ImmutableMap.of(
        GERMANY, quotes(GERMANY, GOV_TENORS, GERMANY_RATES),
        ITALY, quotes(ITALY, GOV_TENORS, ITALY_RATES)));
  }

  /**
   * Returns a snapshot with given bond quotes and the EUR and USD swaps.
   *
   * @param bondQuotes  the bond quotes by issuer
   * @return the snapshot
   */
  public static QuoteSnapshot snapshot(ImmutableMap<String, ImmutableList<Quote>> bondQuotes) {
    return QuoteSnapshot.of(
        SNAPSHOT_TIME, bondQuotes, ImmutableMap.of("EUR", eurSwapQuotes(), "USD", usdSwapQuotes()));
  }

}
