/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.market.quote;

import java.time.Instant;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.opengamma.strata.collect.ArgChecker;

/**
 * The quotes of one refresh cycle: government bond quotes by issuer and swap quotes by currency.
 * <p>
 * The snapshot is materialized: it does not refer back to the providers it was built from.
 */
public final class QuoteSnapshot {

  private final Instant timestamp;
  private final ImmutableMap<String, ImmutableList<Quote>> bondQuotes;
  private final ImmutableMap<String, ImmutableList<Quote>> swapQuotes;

  private QuoteSnapshot(
      Instant timestamp,
      ImmutableMap<String, ImmutableList<Quote>> bondQuotes,
      ImmutableMap<String, ImmutableList<Quote>> swapQuotes) {

    this.timestamp = ArgChecker.notNull(timestamp, "timestamp");
    this.bondQuotes = ArgChecker.notNull(bondQuotes, "bondQuotes");
    this.swapQuotes = ArgChecker.notNull(swapQuotes, "swapQuotes");
  }

  /**
   * Obtains a snapshot from quotes grouped by identifier.
   *
   * @param timestamp  the time of the snapshot
   * @param bondQuotes  the bond quotes by issuer
   * @param swapQuotes  the swap quotes by currency
   * @return the snapshot
   */
  public static QuoteSnapshot of(
      Instant timestamp,
      ImmutableMap<String, ImmutableList<Quote>> bondQuotes,
      ImmutableMap<String, ImmutableList<Quote>> swapQuotes) {

    return new QuoteSnapshot(timestamp, bondQuotes, swapQuotes);
  }

  /**
   * Obtains a snapshot by reading all the quotes of two providers.
   * <p>
   * Identifiers without quotes are left out.
   *
   * @param timestamp  the time of the snapshot
   * @param bondProvider  the provider of government bond quotes
   * @param swapProvider  the provider of swap quotes
   * @return the snapshot
   */
  public static QuoteSnapshot of(
      Instant timestamp,
      MarketQuoteProvider bondProvider,
      MarketQuoteProvider swapProvider) {

    return new QuoteSnapshot(timestamp, materialize(bondProvider), materialize(swapProvider));
  }

  private static ImmutableMap<String, ImmutableList<Quote>> materialize(MarketQuoteProvider provider) {
    ImmutableMap.Builder<String, ImmutableList<Quote>> builder = ImmutableMap.builder();
    for (String identifier : provider.identifiers()) {
      ImmutableList<Quote> quotes = provider.quotes(identifier);
      if (!quotes.isEmpty()) {
        builder.put(identifier, quotes);
      }
    }
    return builder.build();
  }

  public Instant getTimestamp() {
    return timestamp;
  }

  public ImmutableMap<String, ImmutableList<Quote>> getBondQuotes() {
    return bondQuotes;
  }

  public ImmutableMap<String, ImmutableList<Quote>> getSwapQuotes() {
    return swapQuotes;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("timestamp", timestamp)
        .add("issuers", bondQuotes.keySet())
        .add("currencies", swapQuotes.keySet())
        .toString();
  }

}
