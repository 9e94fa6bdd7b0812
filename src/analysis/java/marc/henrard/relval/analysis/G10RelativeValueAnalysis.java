/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.analysis;

import java.time.Instant;
import java.util.List;
import java.util.OptionalDouble;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.opengamma.strata.basics.date.Tenor;
import com.opengamma.strata.basics.schedule.Frequency;
import com.opengamma.strata.collect.io.ResourceLocator;
import com.opengamma.strata.collect.result.FailureItem;
import com.opengamma.strata.collect.result.ValueWithFailures;

import marc.henrard.relval.basics.RateUnit;
import marc.henrard.relval.carry.CarryRollEntry;
import marc.henrard.relval.engine.RelativeValueEngine;
import marc.henrard.relval.engine.RelativeValueReport;
import marc.henrard.relval.hedge.BondPosition;
import marc.henrard.relval.hedge.FuturesDv01Table;
import marc.henrard.relval.hedge.HedgeInstrument;
import marc.henrard.relval.hedge.HedgeProposal;
import marc.henrard.relval.market.quote.CsvQuoteProvider;
import marc.henrard.relval.market.quote.QuoteSnapshot;
import marc.henrard.relval.shape.ShapeMetric;
import marc.henrard.relval.spread.SpreadMatrix;
import marc.henrard.relval.spread.SpreadMode;
import marc.henrard.relval.spread.SpreadPoint;
import marc.henrard.relval.spread.SpreadSeries;

/**
 * Relative value snapshot of the G10 government and swap curves.
 * Prints the government spread matrix, asset swap and swap spreads, curve shapes, carry and roll-down
 * and the DV01 hedges of a BTP position.
 * 
 * @author Marc Henrard
 */
public class G10RelativeValueAnalysis {

  private static final Instant SNAPSHOT_TIME = Instant.parse("2026-10-16T21:00:00Z");
  private static final String FILE_BOND_QUOTES = "src/analysis/resources/quotes/g10-bond-quotes-2026-10-16.csv";
  private static final RelativeValueEngine ENGINE = RelativeValueEngine.standard();
  private static final BondPosition BTP_10Y =
      BondPosition.of("Italy", 25_000_000d, 3.5d, RateUnit.PERCENT, 10d, Frequency.P6M);

  @Test
  public void relative_value_snapshot() {

    long start, end;

    /* Quotes and cycle */
    start = System.currentTimeMillis();
    QuoteSnapshot snapshot = QuoteSnapshot.of(SNAPSHOT_TIME,
        CsvQuoteProvider.load(ResourceLocator.of(FILE_BOND_QUOTES)), CsvQuoteProvider.swapStub());
    RelativeValueReport report = ENGINE.run(snapshot);
    end = System.currentTimeMillis();
    System.out.println("Cycle computed in: " + (end - start) + " ms.");
    for (FailureItem failure : report.getFailures()) {
      System.out.println("Failure: " + failure.getMessage());
    }

    /* Matrix */
    SpreadMatrix matrix = report.getMatrix();
    StringBuilder header = new StringBuilder(String.format("%-16s", "Gov vs Bund"));
    for (Tenor tenor : matrix.getColumns()) {
      header.append(String.format("%8s", tenor));
    }
    System.out.println(header);
    for (String issuer : matrix.getRows()) {
      StringBuilder line = new StringBuilder(String.format("%-16s", issuer));
      for (Tenor tenor : matrix.getColumns()) {
        OptionalDouble spread = matrix.get(issuer, tenor);
        line.append(spread.isPresent() ? String.format("%8.1f", spread.getAsDouble()) : String.format("%8s", "-"));
      }
      System.out.println(line);
    }

    /* Asset swap and swap spreads */
    for (SpreadMode mode : ImmutableList.of(SpreadMode.ASSET_SWAP, SpreadMode.IRS_VS_EUR_IRS)) {
      System.out.println(mode);
      for (SpreadSeries series : report.getSpreads(mode)) {
        StringBuilder line = new StringBuilder(String.format("  %-16s", series.getSource()));
        for (SpreadPoint point : series.getPoints()) {
          line.append(String.format(" %s:%.1f", point.getTenorLabel(), point.getSpreadBp()));
        }
        System.out.println(line);
      }
    }

    /* Shapes and carry */
    for (String issuer : report.getBondParCurves().keySet()) {
      StringBuilder line = new StringBuilder(String.format("%-16s", issuer));
      for (ShapeMetric slope : report.getSlopes().get(issuer)) {
        line.append(String.format(" %s:%.1f", slope.getName(), slope.getValueBp()));
      }
      for (ShapeMetric fly : report.getFlies().get(issuer)) {
        line.append(String.format(" %s:%.1f", fly.getName(), fly.getValueBp()));
      }
      System.out.println(line);
    }
    for (CarryRollEntry entry : report.getCarryRoll().get("Italy")) {
      System.out.println(String.format("Italy %4s %-12s carry %6.2f roll %6.2f total %6.2f",
          entry.getTenorLabel(), entry.getHorizon(), entry.getCarryBp(), entry.getRollBp(), entry.getTotalBp()));
    }

    /* Hedges */
    ValueWithFailures<List<HedgeInstrument>> instruments = ENGINE.hedgeInstruments(
        BTP_10Y, report, ImmutableList.of("FGBL", "FGBM"), FuturesDv01Table.standard());
    ValueWithFailures<List<HedgeProposal>> proposals =
        ENGINE.proposeHedges(BTP_10Y, report, instruments.getValue());
    for (HedgeProposal proposal : proposals.getValue()) {
      System.out.println(String.format("%s: DV01 %.0f, %s quantity %.0f, residual %.0f, liquidity %.2f",
          proposal.getPositionDescription(), proposal.getPositionDv01(), proposal.getInstrumentIdentifier(),
          proposal.getQuantity(), proposal.getResidualDv01(), proposal.getLiquidityScore()));
    }
    System.out.println("Done!");
  }

}
