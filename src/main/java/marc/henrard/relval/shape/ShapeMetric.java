/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.shape;

import java.util.Objects;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.opengamma.strata.basics.date.Tenor;
import com.opengamma.strata.collect.ArgChecker;

/**
 * A named curve shape value, slope or fly, with its constituent tenors. The value is in basis points.
 */
public final class ShapeMetric {

  private final String name;
  private final ImmutableList<Tenor> tenors;
  private final double valueBp;

  private ShapeMetric(String name, ImmutableList<Tenor> tenors, double valueBp) {
    this.name = ArgChecker.notBlank(name, "name");
    this.tenors = tenors;
    this.valueBp = valueBp;
  }

  /**
   * Obtains a metric.
   *
   * @param name  the name, like "2s10s"
   * @param tenors  the constituent tenors, from short to long
   * @param valueBp  the value in basis points
   * @return the metric
   */
  public static ShapeMetric of(String name, ImmutableList<Tenor> tenors, double valueBp) {
    ArgChecker.notEmpty(tenors, "tenors");
    return new ShapeMetric(name, tenors, valueBp);
  }

  public String getName() {
    return name;
  }

  public ImmutableList<Tenor> getTenors() {
    return tenors;
  }

  public double getValueBp() {
    return valueBp;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || obj.getClass() != getClass()) {
      return false;
    }
    ShapeMetric other = (ShapeMetric) obj;
    return name.equals(other.name) && tenors.equals(other.tenors) && Double.compare(valueBp, other.valueBp) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, tenors, valueBp);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("name", name).add("tenors", tenors).add("valueBp", valueBp).toString();
  }

}
