/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.shape;

import com.opengamma.strata.basics.date.Tenor;

/**
 * Market names of slopes and flies, like "2s10s" or "2s5s10s".
 */
final class ShapeNames {

  private ShapeNames() {
  }

  static String name(Tenor... tenors) {
    StringBuilder name = new StringBuilder();
    for (Tenor tenor : tenors) {
      String label = tenor.toString();
      name.append(label.endsWith("Y") ? label.substring(0, label.length() - 1) : label).append('s');
    }
    return name.toString();
  }

}
