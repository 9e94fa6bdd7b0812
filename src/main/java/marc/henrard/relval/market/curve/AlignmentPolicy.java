/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.market.curve;

/**
 * Rule applied when a tenor outside the range of a curve grid is requested.
 */
public enum AlignmentPolicy {

  /** Out of range tenors fail; the caller excludes the point. */
  STRICT,
  /** Out of range tenors are clamped to the closest end point of the grid. */
  NEAREST;

}
