/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.shape;

import java.util.Objects;

import com.google.common.base.MoreObjects;
import com.opengamma.strata.basics.date.Tenor;
import com.opengamma.strata.collect.ArgChecker;

/**
 * The three tenors of a butterfly: short wing, body and long wing.
 */
public final class FlyDefinition {

  /** The 2s5s10s fly. */
  public static final FlyDefinition TWOS_FIVES_TENS = of(Tenor.TENOR_2Y, Tenor.TENOR_5Y, Tenor.TENOR_10Y);

  private final String name;
  private final Tenor shortTenor;
  private final Tenor midTenor;
  private final Tenor longTenor;

  private FlyDefinition(String name, Tenor shortTenor, Tenor midTenor, Tenor longTenor) {
    this.name = ArgChecker.notBlank(name, "name");
    this.shortTenor = ArgChecker.notNull(shortTenor, "shortTenor");
    this.midTenor = ArgChecker.notNull(midTenor, "midTenor");
    this.longTenor = ArgChecker.notNull(longTenor, "longTenor");
    ArgChecker.isTrue(shortTenor.compareTo(midTenor) < 0 && midTenor.compareTo(longTenor) < 0,
        "Fly tenors must be increasing, found {}, {}, {}", shortTenor, midTenor, longTenor);
  }

  /**
   * Obtains a fly named after its tenors.
   *
   * @param shortTenor  the short wing
   * @param midTenor  the body
   * @param longTenor  the long wing
   * @return the fly
   */
  public static FlyDefinition of(Tenor shortTenor, Tenor midTenor, Tenor longTenor) {
    return new FlyDefinition(ShapeNames.name(shortTenor, midTenor, longTenor), shortTenor, midTenor, longTenor);
  }

  /**
   * Parses a fly like "2Y/5Y/10Y".
   *
   * @param text  the text
   * @return the fly
   */
  public static FlyDefinition parse(String text) {
    String[] tenors = text.trim().split("/");
    ArgChecker.isTrue(tenors.length == 3, "Fly '{}' must have the form short/mid/long", text);
    return of(Tenor.parse(tenors[0].trim()), Tenor.parse(tenors[1].trim()), Tenor.parse(tenors[2].trim()));
  }

  public String getName() {
    return name;
  }

  public Tenor getShortTenor() {
    return shortTenor;
  }

  public Tenor getMidTenor() {
    return midTenor;
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
    FlyDefinition other = (FlyDefinition) obj;
    return name.equals(other.name) &&
        shortTenor.equals(other.shortTenor) &&
        midTenor.equals(other.midTenor) &&
        longTenor.equals(other.longTenor);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, shortTenor, midTenor, longTenor);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("name", name).toString();
  }

}
