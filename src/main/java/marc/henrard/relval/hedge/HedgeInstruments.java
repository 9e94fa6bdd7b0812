/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.hedge;

import java.util.Locale;

import com.opengamma.strata.basics.schedule.Frequency;
import com.opengamma.strata.collect.ArgChecker;

import marc.henrard.relval.basics.TenorUtils;
import marc.henrard.relval.market.curve.YieldCurve;

/**
 * Builds the usual hedge instruments: bond futures and receiver swaps.
 */
public final class HedgeInstruments {

  /** The futures quantity increment, one contract. */
  public static final double CONTRACT_INCREMENT = 1d;
  /** The default swap notional increment. */
  public static final double SWAP_NOTIONAL_INCREMENT = 1_000_000d;

  /** Private constructor. */
  private HedgeInstruments() {
  }

  /**
   * Returns the bond future of a symbol.
   * <p>
   * An unknown symbol gives an instrument with a NaN DV01, rejected by {@link HedgeSizer}.
   *
   * @param symbol  the future symbol, like "FGBL"
   * @param table  the DV01 per contract table
   * @return the instrument
   */
  public static HedgeInstrument future(String symbol, FuturesDv01Table table) {
    ArgChecker.notBlank(symbol, "symbol");
    ArgChecker.notNull(table, "table");
    return HedgeInstrument.of(
        symbol.trim().toUpperCase(Locale.ENGLISH), table.findDv01(symbol).orElse(Double.NaN), CONTRACT_INCREMENT);
  }

  /**
   * Returns the receiver swap at the grid tenor of the swap curve closest to a maturity.
   *
   * @param swapZeroCurve  the zero swap curve
   * @param maturity  the maturity to hedge, in years
   * @param fixedLegFrequency  the fixed leg frequency of the currency
   * @param notionalIncrement  the notional increment
   * @return the instrument, with DV01 per unit of notional
   */
  public static HedgeInstrument swap(
      YieldCurve swapZeroCurve,
      double maturity,
      Frequency fixedLegFrequency,
      double notionalIncrement) {

    ArgChecker.notNull(swapZeroCurve, "swapZeroCurve");
    double tenor = swapZeroCurve.nearestTenor(maturity);
    double dv01 = Dv01Calculator.swapDv01PerUnitNotional(swapZeroCurve, tenor, fixedLegFrequency);
    return HedgeInstrument.of(swapIdentifier(swapZeroCurve, tenor), dv01, notionalIncrement);
  }

  static String swapIdentifier(YieldCurve swapZeroCurve, double tenor) {
    String currency = swapZeroCurve.getCurrency().map(c -> c.getCode()).orElse(swapZeroCurve.getIdentifier());
    return currency + "-IRS-" + TenorUtils.label(tenor);
  }

}
