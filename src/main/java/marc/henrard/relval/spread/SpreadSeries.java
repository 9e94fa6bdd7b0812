/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.spread;

import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.opengamma.strata.collect.ArgChecker;
import com.opengamma.strata.collect.array.DoubleArray;

import marc.henrard.relval.basics.TenorUtils;

/**
 * The spreads of one instrument curve against a reference curve, in one mode.
 * <p>
 * The points are ordered by tenor. The tenors of the source grid left out under strict alignment are listed
 * in the excluded tenors.
 */
public final class SpreadSeries {

  private final String source;
  private final String reference;
  private final SpreadMode mode;
  private final ImmutableList<SpreadPoint> points;
  private final DoubleArray excludedTenors;

  private SpreadSeries(
      String source,
      String reference,
      SpreadMode mode,
      ImmutableList<SpreadPoint> points,
      DoubleArray excludedTenors) {

    this.source = ArgChecker.notBlank(source, "source");
    this.reference = ArgChecker.notBlank(reference, "reference");
    this.mode = ArgChecker.notNull(mode, "mode");
    this.points = points;
    this.excludedTenors = excludedTenors;
  }

  /**
   * Obtains a series.
   *
   * @param source  the source issuer or currency
   * @param reference  the reference issuer or currency
   * @param mode  the spread mode
   * @param points  the points, ordered by tenor
   * @param excludedTenors  the tenors excluded from the series
   * @return the series
   */
  public static SpreadSeries of(
      String source,
      String reference,
      SpreadMode mode,
      List<SpreadPoint> points,
      DoubleArray excludedTenors) {

    ArgChecker.noNulls(points, "points");
    for (int i = 1; i < points.size(); i++) {
      ArgChecker.isTrue(points.get(i).getTenor() > points.get(i - 1).getTenor(), "Points must be ordered by tenor");
    }
    return new SpreadSeries(source, reference, mode, ImmutableList.copyOf(points), excludedTenors);
  }

  public String getSource() {
    return source;
  }

  public String getReference() {
    return reference;
  }

  public SpreadMode getMode() {
    return mode;
  }

  public ImmutableList<SpreadPoint> getPoints() {
    return points;
  }

  public DoubleArray getExcludedTenors() {
    return excludedTenors;
  }

  public int size() {
    return points.size();
  }

  /**
   * Finds the spread at a tenor of the series.
   *
   * @param tenor  the tenor in years
   * @return the spread in basis points, empty if the series has no point at the tenor
   */
  public OptionalDouble findSpread(double tenor) {
    for (SpreadPoint point : points) {
      if (TenorUtils.sameTenor(point.getTenor(), tenor)) {
        return OptionalDouble.of(point.getSpreadBp());
      }
    }
    return OptionalDouble.empty();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || obj.getClass() != getClass()) {
      return false;
    }
    SpreadSeries other = (SpreadSeries) obj;
    return source.equals(other.source) &&
        reference.equals(other.reference) &&
        mode == other.mode &&
        points.equals(other.points) &&
        excludedTenors.equals(other.excludedTenors);
  }

  @Override
  public int hashCode() {
    return Objects.hash(source, reference, mode, points, excludedTenors);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("source", source)
        .add("reference", reference)
        .add("mode", mode)
        .add("points", points)
        .add("excludedTenors", excludedTenors)
        .toString();
  }

}
