/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.market.curve;

import java.util.Map;
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
 * The fixed leg payment frequency of the standard par swaps of each currency.
 * <p>
 * The table is configuration: it is loaded from a CSV file with header {@code Currency,FixedLegFrequency}
 * and passed to the swap bootstrapper, never looked up from a global.
 */
public final class SwapFixedLegConventions {

  /** The resource with the standard conventions. */
  private static final String STANDARD_RESOURCE = "config/swap-fixed-leg-conventions.csv";
  private static final String CURRENCY_FIELD = "Currency";
  private static final String FREQUENCY_FIELD = "FixedLegFrequency";

  private final ImmutableMap<Currency, Frequency> frequencies;

  private SwapFixedLegConventions(ImmutableMap<Currency, Frequency> frequencies) {
    frequencies.forEach(
        (currency, frequency) -> TenorUtils.checkMonthBased(frequency, "FixedLegFrequency of " + currency));
    this.frequencies = frequencies;
  }

  /**
   * Obtains the conventions from a map.
   *
   * @param frequencies  the fixed leg frequency by currency
   * @return the conventions
   * @throws IllegalArgumentException if a frequency is not month-based
   */
  public static SwapFixedLegConventions of(Map<Currency, Frequency> frequencies) {
    ArgChecker.notNull(frequencies, "frequencies");
    return new SwapFixedLegConventions(ImmutableMap.copyOf(frequencies));
  }

  /**
   * Loads the conventions from a CSV resource.
   *
   * @param resource  the resource
   * @return the conventions
   */
  public static SwapFixedLegConventions load(ResourceLocator resource) {
    CsvFile csv = CsvFile.of(resource.getCharSource(), true);
    ImmutableMap.Builder<Currency, Frequency> builder = ImmutableMap.builder();
    for (CsvRow row : csv.rows()) {
      builder.put(
          Currency.of(row.getField(CURRENCY_FIELD).trim()),
          Frequency.parse(row.getField(FREQUENCY_FIELD).trim()));
    }
    return new SwapFixedLegConventions(builder.build());
  }

  /**
   * Returns the standard conventions for the G10 currencies shipped with the library.
   * <p>
   * EUR and SEK pay annually, the other currencies semi-annually.
   *
   * @return the conventions
   */
  public static SwapFixedLegConventions standard() {
    return load(ResourceLocator.ofClasspath(STANDARD_RESOURCE));
  }

  /**
   * Returns the fixed leg frequency associated to a currency.
   *
   * @param currency  the currency
   * @return the frequency, empty if the currency is not configured
   */
  public Optional<Frequency> findFixedLegFrequency(Currency currency) {
    return Optional.ofNullable(frequencies.get(currency));
  }

  public ImmutableMap<Currency, Frequency> getFrequencies() {
    return frequencies;
  }

}
