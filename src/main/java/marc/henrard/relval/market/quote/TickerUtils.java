/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.market.quote;

import com.opengamma.strata.basics.StandardId;
import com.opengamma.strata.basics.currency.Currency;
import com.opengamma.strata.basics.date.Tenor;
import com.opengamma.strata.market.observable.QuoteId;

/**
 * Uniform set of tickers for par rate quotes.
 * <p>
 * Available for government bonds (by issuer) and fixed versus floating swaps (by currency).
 */
public final class TickerUtils {

  /** The scheme of all tickers. */
  public static final String SCHEME = "RelVal-Ticker";

  /** Private constructor. */
  private TickerUtils() {
  }

  /**
   * Ticker for a government bond benchmark.
   *
   * @param issuer  the issuer, like "Germany"
   * @param tenor  the benchmark tenor
   * @return the ticker
   */
  public static QuoteId govBond(String issuer, Tenor tenor) {
    return QuoteId.of(StandardId.of(SCHEME, issuer.replace(' ', '_') + "-GOV-" + tenor));
  }

  /**
   * Ticker for a par swap rate.
   *
   * @param currency  the currency of the swap
   * @param tenor  the swap tenor
   * @return the ticker
   */
  public static QuoteId swap(Currency currency, Tenor tenor) {
    return QuoteId.of(StandardId.of(SCHEME, currency + "-IRS-" + tenor));
  }

  /**
   * Ticker for a par rate quote, picking the swap form when the identifier is a currency code.
   *
   * @param identifier  the issuer or currency
   * @param tenorLabel  the tenor label
   * @return the ticker
   */
  public static QuoteId parRate(String identifier, String tenorLabel) {
    Tenor tenor = Tenor.parse(tenorLabel);
    if (identifier.length() == 3 && identifier.equals(identifier.toUpperCase())) {
      return swap(Currency.of(identifier), tenor);
    }
    return govBond(identifier, tenor);
  }

}
