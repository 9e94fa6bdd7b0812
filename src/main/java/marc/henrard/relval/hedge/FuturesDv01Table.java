/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.hedge;

import java.util.Locale;
import java.util.OptionalDouble;

import com.google.common.collect.ImmutableMap;
import com.opengamma.strata.collect.ArgChecker;
import com.opengamma.strata.collect.io.CsvFile;
import com.opengamma.strata.collect.io.CsvRow;
import com.opengamma.strata.collect.io.ResourceLocator;

/**
 * Average DV01 per contract of bond futures, by exchange symbol.
 * <p>
 * Loaded from a CSV file with header {@code Symbol,Dv01PerContract[,Description]}. The values are orders of
 * magnitude for the standard contract; they do not take the cheapest-to-deliver into account.
 */
public final class FuturesDv01Table {

  private static final String STANDARD_RESOURCE = "config/futures-dv01.csv";

  private final ImmutableMap<String, Double> dv01s;

  private FuturesDv01Table(ImmutableMap<String, Double> dv01s) {
    this.dv01s = dv01s;
  }

  /**
   * Creates a table from a map.
   *
   * @param dv01s  the DV01 per contract by symbol
   * @return the table
   */
  public static FuturesDv01Table of(ImmutableMap<String, Double> dv01s) {
    ImmutableMap.Builder<String, Double> builder = ImmutableMap.builder();
    dv01s.forEach((symbol, dv01) -> builder.put(symbol.toUpperCase(Locale.ENGLISH), dv01));
    return new FuturesDv01Table(builder.build());
  }

  /**
   * Loads the table from a CSV resource.
   *
   * @param resource  the resource
   * @return the table
   */
  public static FuturesDv01Table load(ResourceLocator resource) {
    ArgChecker.notNull(resource, "resource");
    CsvFile csv = CsvFile.of(resource.getCharSource(), true);
    ImmutableMap.Builder<String, Double> builder = ImmutableMap.builder();
    for (CsvRow row : csv.rows()) {
      builder.put(row.getField("Symbol").trim().toUpperCase(Locale.ENGLISH),
          Double.parseDouble(row.getField("Dv01PerContract").trim()));
    }
    return new FuturesDv01Table(builder.build());
  }

  /**
   * Returns the table of the main Eurex and CBOT bond futures.
   *
   * @return the table
   */
  public static FuturesDv01Table standard() {
    return load(ResourceLocator.ofClasspath(STANDARD_RESOURCE));
  }

  /**
   * Finds the DV01 per contract of a future.
   *
   * @param symbol  the symbol, case insensitive
   * @return the DV01, empty if the symbol is unknown
   */
  public OptionalDouble findDv01(String symbol) {
    Double dv01 = dv01s.get(symbol.trim().toUpperCase(Locale.ENGLISH));
    return dv01 == null ? OptionalDouble.empty() : OptionalDouble.of(dv01);
  }

  public ImmutableMap<String, Double> getDv01s() {
    return dv01s;
  }

}
