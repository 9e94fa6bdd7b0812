/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.market.curve;

import java.util.List;

import com.opengamma.strata.collect.ArgChecker;

import marc.henrard.relval.basics.CurveBootstrapException;
import marc.henrard.relval.market.quote.Quote;

/**
 * Bootstraps the zero curve of a government bond issuer from its benchmark par yields.
 * <p>
 * Each benchmark is a bond with coupon equal to its par yield, paying coupons at the frequency of the settings
 * and priced at 100.
 *
 * @author Marc Henrard
 */
public final class CurveBootstrapper extends AbstractParCurveBootstrapper {

  /** The default instance. */
  public static final CurveBootstrapper DEFAULT = new CurveBootstrapper();

  private CurveBootstrapper() {
  }

  /**
   * Bootstraps the zero curve of one issuer from its quotes.
   *
   * @param quotes  the par yield quotes of the issuer
   * @param settings  the compounding, frequency and alignment settings
   * @return the zero curve, on the same grid and in the same unit as the quotes
   * @throws CurveBootstrapException if a discount factor cannot be obtained
   */
  public YieldCurve bootstrap(List<Quote> quotes, CurveBootstrapSettings settings) {
    return bootstrap(YieldCurve.ofQuotes(quotes), settings);
  }

  /**
   * Bootstraps the zero curve of one issuer from its par curve.
   *
   * @param parCurve  the par yield curve of the issuer
   * @param settings  the compounding, frequency and alignment settings
   * @return the zero curve, on the same grid and in the same unit as the par curve
   * @throws CurveBootstrapException if a discount factor cannot be obtained
   */
  public YieldCurve bootstrap(YieldCurve parCurve, CurveBootstrapSettings settings) {
    ArgChecker.notNull(parCurve, "parCurve");
    ArgChecker.notNull(settings, "settings");
    return bootstrapCurve(parCurve, settings.getCompounding(), settings.getFrequency(), settings.getPolicy());
  }

}
