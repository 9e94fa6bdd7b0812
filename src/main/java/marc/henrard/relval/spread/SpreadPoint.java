/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.spread;

import java.util.Objects;

import com.google.common.base.MoreObjects;

import marc.henrard.relval.basics.TenorUtils;

/**
 * One point of a spread series: a tenor and a spread in basis points.
 */
public final class SpreadPoint {

  private final double tenor;
  private final double spreadBp;

  private SpreadPoint(double tenor, double spreadBp) {
    this.tenor = tenor;
    this.spreadBp = spreadBp;
  }

  /**
   * Obtains a point.
   *
   * @param tenor  the tenor in years
   * @param spreadBp  the spread in basis points
   * @return the point
   */
  public static SpreadPoint of(double tenor, double spreadBp) {
    return new SpreadPoint(tenor, spreadBp);
  }

  public double getTenor() {
    return tenor;
  }

  public String getTenorLabel() {
    return TenorUtils.label(tenor);
  }

  public double getSpreadBp() {
    return spreadBp;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || obj.getClass() != getClass()) {
      return false;
    }
    SpreadPoint other = (SpreadPoint) obj;
    return Double.compare(tenor, other.tenor) == 0 && Double.compare(spreadBp, other.spreadBp) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(tenor, spreadBp);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("tenor", getTenorLabel()).add("spreadBp", spreadBp).toString();
  }

}
