/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.market.quote;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Source of par rate quotes, for government bonds or swaps.
 * <p>
 * Static (file based) and live implementations share this shape, so the curve construction does not depend
 * on where the quotes come from. Implementations return materialized quotes; any network access happens
 * before the quotes are handed over.
 */
public interface MarketQuoteProvider {

  /**
   * Returns the identifiers, issuers or currencies, for which quotes are available.
   *
   * @return the identifiers
   */
  public abstract ImmutableSet<String> identifiers();

  /**
   * Returns the quotes of one issuer or currency, sorted by tenor.
   * <p>
   * An unknown identifier returns an empty list; no substitute curve is used.
   *
   * @param identifier  the issuer or currency
   * @return the quotes
   */
  public abstract ImmutableList<Quote> quotes(String identifier);

}
