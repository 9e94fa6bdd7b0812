/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.market.curve;

import java.util.Optional;

import com.google.common.collect.ImmutableMap;
import com.opengamma.strata.basics.currency.Currency;
import com.opengamma.strata.basics.schedule.Frequency;
import com.opengamma.strata.collect.ArgChecker;
import com.opengamma.strata.collect.io.CsvFile;
import com.opengamma.strata.collect.io.CsvRow;
import com.opengamma.strata.collect.io.ResourceLocator;

import marc.henrard.relval.basics.TenorUtils;

/**
 * The currency and the bond coupon frequency of each government issuer.
 * <p>
 * Loaded from a CSV file with header {@code Issuer,Currency,CouponFrequency}.
 * The currency selects the swap curve used for asset swap spreads.
 */
public final class IssuerConventions {

  private static final String STANDARD_RESOURCE = "config/issuer-conventions.csv";

  private final ImmutableMap<String, Currency> currencies;
  private final ImmutableMap<String, Frequency> couponFrequencies;

  private IssuerConventions(
      ImmutableMap<String, Currency> currencies,
      ImmutableMap<String, Frequency> couponFrequencies) {

    this.currencies = currencies;
    this.couponFrequencies = couponFrequencies;
  }

  /**
   * Loads the conventions from a CSV resource.
   *
   * @param resource  the resource
   * @return the conventions
   * @throws IllegalArgumentException if a coupon frequency is not month-based
   */
  public static IssuerConventions load(ResourceLocator resource) {
    ArgChecker.notNull(resource, "resource");
    CsvFile csv = CsvFile.of(resource.getCharSource(), true);
    ImmutableMap.Builder<String, Currency> currencies = ImmutableMap.builder();
    ImmutableMap.Builder<String, Frequency> frequencies = ImmutableMap.builder();
    for (CsvRow row : csv.rows()) {
      String issuer = row.getField("Issuer").trim();
      currencies.put(issuer, Currency.of(row.getField("Currency").trim()));
      frequencies.put(issuer, TenorUtils.checkMonthBased(
          Frequency.parse(row.getField("CouponFrequency").trim()), "CouponFrequency of " + issuer));
    }
    return new IssuerConventions(currencies.build(), frequencies.build());
  }

  /**
   * Returns the standard conventions of the G10 government issuers.
   *
   * @return the conventions
   */
  public static IssuerConventions standard() {
    return load(ResourceLocator.ofClasspath(STANDARD_RESOURCE));
  }

  /**
   * Finds the currency of an issuer.
   *
   * @param issuer  the issuer
   * @return the currency, empty if the issuer is unknown
   */
  public Optional<Currency> findCurrency(String issuer) {
    return Optional.ofNullable(currencies.get(issuer));
  }

  /**
   * Finds the bond coupon frequency of an issuer.
   *
   * @param issuer  the issuer
   * @return the frequency, empty if the issuer is unknown
   */
  public Optional<Frequency> findCouponFrequency(String issuer) {
    return Optional.ofNullable(couponFrequencies.get(issuer));
  }

  public ImmutableMap<String, Currency> getCurrencies() {
    return currencies;
  }

}
