/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.shape;

import java.util.Objects;

import com.google.common.base.MoreObjects;
import com.opengamma.strata.basics.date.Tenor;
import com.opengamma.strata.collect.ArgChecker;

/**
 * A named pair of tenors defining a two-leg curve slope.
 */
public final class TenorPair {

  /** The 2s10s slope. */
  public static final TenorPair TWOS_TENS = of(Tenor.TENOR_2Y, Tenor.TENOR_10Y);
  /** The 5s30s slope. */
  public static final TenorPair FIVES_THIRTIES = of(Tenor.TENOR_5Y, Tenor.TENOR_30Y);
  /** The 2s5s slope. */
  public static final TenorPair TWOS_FIVES = of(Tenor.TENOR_2Y, Tenor.TENOR_5Y);

  private final String name;
  private final Tenor shortTenor;
  private final Tenor longTenor;

  private TenorPair(String name, Tenor shortTenor, Tenor longTenor) {
    this.name = ArgChecker.notBlank(name, "name");
    this.shortTenor = ArgChecker.notNull(shortTenor, "shortTenor");
    this.longTenor = ArgChecker.notNull(longTenor, "longTenor");
    ArgChecker.isTrue(shortTenor.compareTo(longTenor) < 0, "Short tenor {} must be before long tenor {}",
        shortTenor, longTenor);
  }

  /**
   * Obtains a pair named after its tenors.
   *
   * @param shortTenor  the short tenor
   * @param longTenor  the long tenor
   * @return the pair
   */
  public static TenorPair of(Tenor shortTenor, Tenor longTenor) {
    return new TenorPair(ShapeNames.name(shortTenor, longTenor), shortTenor, longTenor);
  }

  /**
   * Parses a pair like "2Y/10Y".
   *
   * @param text  the text
   * @return the pair
   */
  public static TenorPair parse(String text) {
    String[] tenors = text.trim().split("/");
    ArgChecker.isTrue(tenors.length == 2, "Tenor pair '{}' must have the form short/long", text);
    return of(Tenor.parse(tenors[0].trim()), Tenor.parse(tenors[1].trim()));
  }

  public String getName() {
    return name;
  }

  public Tenor getShortTenor() {
    return shortTenor;
  }

  public Tenor getLongTenor() {
    return longTenor;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || obj.getClass() != getClass()) {
      return false;
    }
    TenorPair other = (TenorPair) obj;
    return name.equals(other.name) && shortTenor.equals(other.shortTenor) && longTenor.equals(other.longTenor);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, shortTenor, longTenor);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("name", name).toString();
  }

}
