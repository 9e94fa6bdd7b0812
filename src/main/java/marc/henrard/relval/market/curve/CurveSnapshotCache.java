/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.market.curve;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Map.Entry;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

import com.opengamma.strata.collect.ArgChecker;

/**
 * Curves of previous refresh cycles, keyed by identifier and snapshot time.
 * <p>
 * The cache is owned by the caller and passed explicitly where needed; it is not shared state of the engine.
 * It is not thread-safe: the caller serializes refresh cycles.
 */
public final class CurveSnapshotCache {

  private final Map<String, NavigableMap<Instant, YieldCurve>> curves = new HashMap<>();
  /** The number of snapshots kept per identifier. */
  private final int depth;

  /**
   * Creates an empty cache.
   *
   * @param depth  the number of snapshots kept per identifier
   */
  public CurveSnapshotCache(int depth) {
    ArgChecker.notNegativeOrZero(depth, "depth");
    this.depth = depth;
  }

  /**
   * Stores the curve of a snapshot.
   * <p>
   * The oldest snapshots beyond the depth are dropped.
   *
   * @param timestamp  the snapshot time
   * @param curve  the curve
   */
  public void put(Instant timestamp, YieldCurve curve) {
    ArgChecker.notNull(timestamp, "timestamp");
    ArgChecker.notNull(curve, "curve");
    NavigableMap<Instant, YieldCurve> history = curves.computeIfAbsent(curve.getIdentifier(), k -> new TreeMap<>());
    history.put(timestamp, curve);
    while (history.size() > depth) {
      history.pollFirstEntry();
    }
  }

  /**
   * Finds the latest curve of an identifier strictly before a time.
   *
   * @param identifier  the issuer or currency
   * @param timestamp  the time
   * @return the curve, empty if none is cached
   */
  public Optional<YieldCurve> findBefore(String identifier, Instant timestamp) {
    NavigableMap<Instant, YieldCurve> history = curves.get(identifier);
    if (history == null) {
      return Optional.empty();
    }
    Entry<Instant, YieldCurve> entry = history.lowerEntry(timestamp);
    return entry == null ? Optional.empty() : Optional.of(entry.getValue());
  }

}
