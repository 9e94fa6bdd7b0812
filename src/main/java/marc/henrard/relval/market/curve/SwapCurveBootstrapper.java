/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.market.curve;

import java.util.List;

import com.opengamma.strata.basics.currency.Currency;
import com.opengamma.strata.basics.schedule.Frequency;
import com.opengamma.strata.collect.ArgChecker;

import marc.henrard.relval.basics.CurveBootstrapException;
import marc.henrard.relval.market.quote.Quote;

/**
 * Bootstraps the zero curve of a currency from par swap rates.
 * <p>
 * The swaps are priced in a single curve framework: the floating leg is worth par, so the fixed leg plus the
 * notional is priced at par. The fixed leg frequency is the one configured for the currency in
 * {@link SwapFixedLegConventions}.
 */
public final class SwapCurveBootstrapper extends AbstractParCurveBootstrapper {

  /** The fixed leg frequencies by currency. */
  private final SwapFixedLegConventions conventions;

  private SwapCurveBootstrapper(SwapFixedLegConventions conventions) {
    this.conventions = ArgChecker.notNull(conventions, "conventions");
  }

  /**
   * Obtains a bootstrapper using the fixed leg conventions.
   *
   * @param conventions  the fixed leg frequencies by currency
   * @return the bootstrapper
   */
  public static SwapCurveBootstrapper of(SwapFixedLegConventions conventions) {
    return new SwapCurveBootstrapper(conventions);
  }

  /**
   * Bootstraps the zero curve of a currency from its par swap quotes.
   *
   * @param currency  the currency
   * @param quotes  the par swap rate quotes
   * @param compounding  the compounding convention of the zero rates
   * @param policy  the alignment policy for intermediate fixed leg payment dates
   * @return the zero curve, tagged with the currency
   * @throws CurveBootstrapException if the currency has no fixed leg convention or a discount factor cannot be obtained
   */
  public YieldCurve bootstrap(
      Currency currency,
      List<Quote> quotes,
      CompoundingConvention compounding,
      AlignmentPolicy policy) {

    return bootstrap(YieldCurve.ofQuotes(quotes).withCurrency(currency), compounding, policy);
  }

  /**
   * Bootstraps the zero curve of a currency from its par swap curve.
   * <p>
   * The par curve must be tagged with its currency.
   *
   * @param parCurve  the par swap curve
   * @param compounding  the compounding convention of the zero rates
   * @param policy  the alignment policy for intermediate fixed leg payment dates
   * @return the zero curve, tagged with the currency
   * @throws CurveBootstrapException if the currency has no fixed leg convention or a discount factor cannot be obtained
   */
  public YieldCurve bootstrap(YieldCurve parCurve, CompoundingConvention compounding, AlignmentPolicy policy) {
    ArgChecker.notNull(parCurve, "parCurve");
    Currency currency = parCurve.getCurrency()
        .orElseThrow(() -> new IllegalArgumentException(
            "Swap curve '" + parCurve.getIdentifier() + "' has no currency"));
    Frequency frequency = conventions.findFixedLegFrequency(currency)
        .orElseThrow(() -> new CurveBootstrapException(parCurve.getIdentifier(),
            "no fixed leg frequency configured for " + currency));
    return bootstrapCurve(parCurve, compounding, frequency, policy);
  }

  /**
   * Returns the fixed leg frequency used for a currency.
   *
   * @param currency  the currency
   * @return the frequency
   * @throws CurveBootstrapException if no frequency is configured for the currency
   */
  public Frequency fixedLegFrequency(Currency currency) {
    return conventions.findFixedLegFrequency(currency)
        .orElseThrow(() -> new CurveBootstrapException(currency.getCode(),
            "no fixed leg frequency configured for " + currency));
  }

}
