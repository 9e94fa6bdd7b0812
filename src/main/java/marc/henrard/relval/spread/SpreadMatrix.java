/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.spread;

import java.util.OptionalDouble;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableTable;
import com.opengamma.strata.basics.date.Tenor;

/**
 * Spreads in basis points by issuer (row) and tenor (column).
 * <p>
 * A cell without data is absent: {@link #get(String, Tenor)} returns an empty optional, never zero.
 */
public final class SpreadMatrix {

  private final ImmutableList<String> rows;
  private final ImmutableList<Tenor> columns;
  private final ImmutableTable<String, Tenor, Double> cells;

  private SpreadMatrix(ImmutableList<String> rows, ImmutableList<Tenor> columns,
      ImmutableTable<String, Tenor, Double> cells) {
    this.rows = rows;
    this.columns = columns;
    this.cells = cells;
  }

  static SpreadMatrix of(ImmutableList<String> rows, ImmutableList<Tenor> columns,
      ImmutableTable<String, Tenor, Double> cells) {
    return new SpreadMatrix(rows, columns, cells);
  }

  /**
   * Returns the spread of an issuer at a tenor.
   *
   * @param row  the issuer
   * @param column  the tenor
   * @return the spread in basis points, empty if absent
   */
  public OptionalDouble get(String row, Tenor column) {
    Double value = cells.get(row, column);
    return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
  }

  public ImmutableList<String> getRows() {
    return rows;
  }

  public ImmutableList<Tenor> getColumns() {
    return columns;
  }

  /**
   * Returns the number of cells with a value.
   *
   * @return the number of present cells
   */
  public int presentCount() {
    return cells.size();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("rows", rows).add("columns", columns).add("cells", cells).toString();
  }

}
