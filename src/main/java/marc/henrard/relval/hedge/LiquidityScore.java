/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.hedge;

import java.util.Objects;
import java.util.OptionalDouble;

import com.google.common.base.MoreObjects;
import com.opengamma.strata.collect.ArgChecker;

/**
 * The liquidity of a hedge instrument and its score between 0 and 1.
 * <p>
 * The score adds three terms: 0.4 for an on-the-run instrument, up to 0.3 for a tight bid-ask and up to 0.3 for
 * a large daily volume. The bid-ask term is {@code 0.3 * 2 / max(0.5, bidAsk)} and the volume term
 * {@code 0.3 * volume / 200}, each capped at 0.3. A missing bid-ask or volume contributes nothing.
 *
 * @author Marc Henrard
 */
public final class LiquidityScore {

  /** The liquidity assumed when no market information is available: on-the-run, 1bp bid-ask, 50mm a day. */
  public static final LiquidityScore STANDARD = of(true, OptionalDouble.of(1d), OptionalDouble.of(50d));

  private static final double ON_THE_RUN_TERM = 0.4d;
  private static final double TERM_CAP = 0.3d;
  private static final double BID_ASK_FLOOR_BP = 0.5d;
  private static final double BID_ASK_SCALE_BP = 2d;
  private static final double VOLUME_SCALE_MM = 200d;

  private final boolean onTheRun;
  private final OptionalDouble bidAskBp;
  private final OptionalDouble dailyVolumeMm;

  private LiquidityScore(boolean onTheRun, OptionalDouble bidAskBp, OptionalDouble dailyVolumeMm) {
    this.onTheRun = onTheRun;
    this.bidAskBp = ArgChecker.notNull(bidAskBp, "bidAskBp");
    this.dailyVolumeMm = ArgChecker.notNull(dailyVolumeMm, "dailyVolumeMm");
  }

  /**
   * Obtains the liquidity of an instrument.
   *
   * @param onTheRun  whether the instrument is on-the-run
   * @param bidAskBp  the bid-ask in basis points, empty if unknown
   * @param dailyVolumeMm  the estimated daily volume in millions, empty if unknown
   * @return the liquidity
   */
  public static LiquidityScore of(boolean onTheRun, OptionalDouble bidAskBp, OptionalDouble dailyVolumeMm) {
    return new LiquidityScore(onTheRun, bidAskBp, dailyVolumeMm);
  }

  /**
   * Returns the score.
   *
   * @return the score, between 0 and 1
   */
  public double score() {
    double score = onTheRun ? ON_THE_RUN_TERM : 0d;
    if (bidAskBp.isPresent()) {
      score += cappedTerm(TERM_CAP * BID_ASK_SCALE_BP / Math.max(BID_ASK_FLOOR_BP, bidAskBp.getAsDouble()));
    }
    if (dailyVolumeMm.isPresent()) {
      score += cappedTerm(TERM_CAP * dailyVolumeMm.getAsDouble() / VOLUME_SCALE_MM);
    }
    return Math.min(1d, score);
  }

  private static double cappedTerm(double term) {
    return Math.max(0d, Math.min(TERM_CAP, term));
  }

  public boolean isOnTheRun() {
    return onTheRun;
  }

  public OptionalDouble getBidAskBp() {
    return bidAskBp;
  }

  public OptionalDouble getDailyVolumeMm() {
    return dailyVolumeMm;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || obj.getClass() != getClass()) {
      return false;
    }
    LiquidityScore other = (LiquidityScore) obj;
    return onTheRun == other.onTheRun &&
        bidAskBp.equals(other.bidAskBp) &&
        dailyVolumeMm.equals(other.dailyVolumeMm);
  }

  @Override
  public int hashCode() {
    return Objects.hash(onTheRun, bidAskBp, dailyVolumeMm);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("onTheRun", onTheRun)
        .add("bidAskBp", bidAskBp)
        .add("dailyVolumeMm", dailyVolumeMm)
        .toString();
  }

}
