/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.market.quote;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.opengamma.strata.collect.ArgChecker;
import com.opengamma.strata.collect.io.CsvFile;
import com.opengamma.strata.collect.io.CsvRow;
import com.opengamma.strata.collect.io.ResourceLocator;

import marc.henrard.relval.basics.RateUnit;
import marc.henrard.relval.basics.TenorUtils;

/**
 * Static quote provider loaded from a CSV file.
 * <p>
 * The file has the header {@code Identifier,Tenor,Rate,Unit} and optionally the columns
 * {@code Previous,High,Low,Change,Timestamp}. The unit is {@code PERCENT} or {@code DECIMAL}.
 * When an (identifier, tenor) pair appears more than once, the first row is kept. Tenors are compared in years,
 * so that {@code 12M} and {@code 1Y} are duplicates.
 */
public final class CsvQuoteProvider implements MarketQuoteProvider {

  private static final Logger LOGGER = LoggerFactory.getLogger(CsvQuoteProvider.class);

  private static final String IDENTIFIER_FIELD = "Identifier";
  private static final String TENOR_FIELD = "Tenor";
  private static final String RATE_FIELD = "Rate";
  private static final String UNIT_FIELD = "Unit";
  private static final String PREVIOUS_FIELD = "Previous";
  private static final String HIGH_FIELD = "High";
  private static final String LOW_FIELD = "Low";
  private static final String CHANGE_FIELD = "Change";
  private static final String TIMESTAMP_FIELD = "Timestamp";

  /** The quotes by identifier, in file order of first appearance. */
  private final ImmutableMap<String, ImmutableList<Quote>> quotes;

  private CsvQuoteProvider(ImmutableMap<String, ImmutableList<Quote>> quotes) {
    this.quotes = quotes;
  }

  /**
   * Loads the quotes from a resource.
   *
   * @param resource  the CSV resource
   * @return the provider
   */
  public static CsvQuoteProvider load(ResourceLocator resource) {
    ArgChecker.notNull(resource, "resource");
    CsvFile csv = CsvFile.of(resource.getCharSource(), true);
    Map<String, Map<String, Quote>> parsed = new LinkedHashMap<>();
    for (CsvRow row : csv.rows()) {
      Quote quote = parseRow(row);
      Map<String, Quote> byTenor = parsed.computeIfAbsent(quote.getIdentifier(), k -> new LinkedHashMap<>());
      // 12M and 1Y are the same tenor
      String tenorKey = TenorUtils.label(quote.getTenorYears());
      if (byTenor.containsKey(tenorKey)) {
        LOGGER.warn("Duplicate quote {} {} in {} ignored", quote.getIdentifier(), quote.getTenorLabel(), resource);
        continue;
      }
      byTenor.put(tenorKey, quote);
    }
    ImmutableMap.Builder<String, ImmutableList<Quote>> builder = ImmutableMap.builder();
    for (Map.Entry<String, Map<String, Quote>> entry : parsed.entrySet()) {
      List<Quote> sorted = new ArrayList<>(entry.getValue().values());
      sorted.sort(Comparator.comparingDouble(Quote::getTenorYears));
      builder.put(entry.getKey(), ImmutableList.copyOf(sorted));
    }
    return new CsvQuoteProvider(builder.build());
  }

  /**
   * Loads the quotes from a classpath resource.
   *
   * @param resourceName  the name of the resource on the classpath
   * @return the provider
   */
  public static CsvQuoteProvider ofClasspath(String resourceName) {
    return load(ResourceLocator.ofClasspath(resourceName));
  }

  /**
   * Returns the provider of the stub G10 swap curves shipped with the library.
   *
   * @return the provider
   */
  public static CsvQuoteProvider swapStub() {
    return ofClasspath("quotes/swap-quotes-stub.csv");
  }

  private static Quote parseRow(CsvRow row) {
    return Quote.builder()
        .identifier(row.getField(IDENTIFIER_FIELD).trim())
        .tenorLabel(row.getField(TENOR_FIELD))
        .rate(Double.parseDouble(row.getField(RATE_FIELD).trim()))
        .unit(RateUnit.valueOf(row.getField(UNIT_FIELD).trim().toUpperCase()))
        .previous(optionalDouble(row, PREVIOUS_FIELD))
        .high(optionalDouble(row, HIGH_FIELD))
        .low(optionalDouble(row, LOW_FIELD))
        .change(optionalDouble(row, CHANGE_FIELD))
        .timestamp(optionalField(row, TIMESTAMP_FIELD).map(Instant::parse).orElse(null))
        .build();
  }

  private static Double optionalDouble(CsvRow row, String field) {
    return optionalField(row, field)
        .map(s -> Double.valueOf(s.replace(",", "").replace("+", "").replace("%", "")))
        .orElse(null);
  }

  private static Optional<String> optionalField(CsvRow row, String field) {
    return row.findField(field).map(String::trim).filter(s -> !s.isEmpty());
  }

  //-------------------------------------------------------------------------
  @Override
  public ImmutableSet<String> identifiers() {
    return quotes.keySet();
  }

  @Override
  public ImmutableList<Quote> quotes(String identifier) {
    return quotes.getOrDefault(identifier, ImmutableList.of());
  }

}
