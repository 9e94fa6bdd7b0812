/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.market.curve;

/**
 * The nature of the rates stored in a {@link YieldCurve}.
 */
public enum CurveKind {

  /** Market quoted par rates. */
  PAR,
  /** Zero-coupon rates obtained by bootstrapping. */
  ZERO;

}
