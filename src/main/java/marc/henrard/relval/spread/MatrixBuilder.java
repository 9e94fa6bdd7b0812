/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.spread;

import java.util.List;
import java.util.OptionalDouble;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableTable;
import com.opengamma.strata.basics.date.Tenor;
import com.opengamma.strata.collect.ArgChecker;

import marc.henrard.relval.basics.TenorUtils;

/**
 * Builds the issuer by tenor matrix of government versus Bund spreads.
 * <p>
 * A cell is filled when the series of the issuer has a point at the display tenor. No interpolation is done;
 * other cells are absent.
 */
public final class MatrixBuilder {

  /** The standard display tenors. */
  public static final ImmutableList<Tenor> STANDARD_TENORS =
      ImmutableList.of(Tenor.TENOR_2Y, Tenor.TENOR_5Y, Tenor.TENOR_10Y, Tenor.TENOR_30Y);

  /** Private constructor. */
  private MatrixBuilder() {
  }

  /**
   * Builds the matrix. Rows are in the order of the series.
   *
   * @param series  the government versus Bund series, one per issuer
   * @param displayTenors  the column tenors
   * @return the matrix
   */
  public static SpreadMatrix build(List<SpreadSeries> series, List<Tenor> displayTenors) {
    ArgChecker.noNulls(series, "series");
    ArgChecker.notEmpty(displayTenors, "displayTenors");
    ImmutableList.Builder<String> rows = ImmutableList.builder();
    ImmutableTable.Builder<String, Tenor, Double> cells = ImmutableTable.builder();
    for (SpreadSeries s : series) {
      ArgChecker.isTrue(s.getMode() == SpreadMode.GOV_VS_BUND,
          "Matrix uses {} series, found {} for '{}'", SpreadMode.GOV_VS_BUND, s.getMode(), s.getSource());
      rows.add(s.getSource());
      for (Tenor tenor : displayTenors) {
        OptionalDouble spread = s.findSpread(TenorUtils.years(tenor));
        if (spread.isPresent()) {
          cells.put(s.getSource(), tenor, spread.getAsDouble());
        }
      }
    }
    return SpreadMatrix.of(rows.build(), ImmutableList.copyOf(displayTenors), cells.build());
  }

}
