/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.engine;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import com.opengamma.strata.basics.currency.Currency;
import com.opengamma.strata.basics.schedule.Frequency;
import com.opengamma.strata.collect.ArgChecker;
import com.opengamma.strata.collect.result.FailureItem;
import com.opengamma.strata.collect.result.FailureReason;
import com.opengamma.strata.collect.result.ValueWithFailures;

import marc.henrard.relval.basics.CurveBootstrapException;
import marc.henrard.relval.basics.MissingReferenceCurveException;
import marc.henrard.relval.carry.CarryRollCalculator;
import marc.henrard.relval.carry.CarryRollEntry;
import marc.henrard.relval.hedge.BondPosition;
import marc.henrard.relval.hedge.Dv01Calculator;
import marc.henrard.relval.hedge.FuturesDv01Table;
import marc.henrard.relval.hedge.HedgeInstrument;
import marc.henrard.relval.hedge.HedgeInstruments;
import marc.henrard.relval.hedge.HedgeProposal;
import marc.henrard.relval.hedge.HedgeSizer;
import marc.henrard.relval.market.curve.CurveBootstrapSettings;
import marc.henrard.relval.market.curve.CurveBootstrapper;
import marc.henrard.relval.market.curve.CurveSnapshotCache;
import marc.henrard.relval.market.curve.IssuerConventions;
import marc.henrard.relval.market.curve.SwapCurveBootstrapper;
import marc.henrard.relval.market.curve.SwapFixedLegConventions;
import marc.henrard.relval.market.curve.YieldCurve;
import marc.henrard.relval.market.quote.Quote;
import marc.henrard.relval.market.quote.QuoteSnapshot;
import marc.henrard.relval.shape.FlyCalculator;
import marc.henrard.relval.shape.ShapeMetric;
import marc.henrard.relval.shape.TwoLegSpreadAnalyzer;
import marc.henrard.relval.spread.MatrixBuilder;
import marc.henrard.relval.spread.SpreadCalculator;
import marc.henrard.relval.spread.SpreadMatrix;
import marc.henrard.relval.spread.SpreadMode;
import marc.henrard.relval.spread.SpreadSeries;

/**
 * Runs a full relative value cycle on a snapshot of quotes.
 * <p>
 * The cycle builds the par curves of every issuer and currency, bootstraps the zero curves, computes the spreads
 * of the three modes, the curve shapes, carry and roll-down and the government spread matrix.
 * A failure is scoped to the smallest unit that can be skipped: one tenor, one issuer or one mode. It is logged
 * and reported in {@link RelativeValueReport#getFailures()}; the rest of the cycle proceeds.
 * <p>
 * The engine holds no state between cycles.
 *
 * @author Marc Henrard
 */
public final class RelativeValueEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(RelativeValueEngine.class);

  private final RelativeValueSettings settings;
  private final IssuerConventions issuerConventions;
  private final SwapCurveBootstrapper swapBootstrapper;
  private final SpreadCalculator spreadCalculator;

  private RelativeValueEngine(
      RelativeValueSettings settings,
      IssuerConventions issuerConventions,
      SwapFixedLegConventions swapConventions) {

    this.settings = ArgChecker.notNull(settings, "settings");
    this.issuerConventions = ArgChecker.notNull(issuerConventions, "issuerConventions");
    this.swapBootstrapper = SwapCurveBootstrapper.of(ArgChecker.notNull(swapConventions, "swapConventions"));
    this.spreadCalculator = SpreadCalculator.of(settings.getReferenceSwapCurrency());
  }

  /**
   * Obtains an engine.
   *
   * @param settings  the settings
   * @param issuerConventions  the currency and coupon frequency of each issuer
   * @param swapConventions  the fixed leg frequency of each swap currency
   * @return the engine
   */
  public static RelativeValueEngine of(
      RelativeValueSettings settings,
      IssuerConventions issuerConventions,
      SwapFixedLegConventions swapConventions) {

    return new RelativeValueEngine(settings, issuerConventions, swapConventions);
  }

  /**
   * Obtains an engine with the standard settings and conventions.
   *
   * @return the engine
   */
  public static RelativeValueEngine standard() {
    return of(RelativeValueSettings.standard(), IssuerConventions.standard(), SwapFixedLegConventions.standard());
  }

  //-------------------------------------------------------------------------
  /**
   * Runs one cycle.
   *
   * @param snapshot  the quotes of the cycle
   * @return the report
   */
  public RelativeValueReport run(QuoteSnapshot snapshot) {
    ArgChecker.notNull(snapshot, "snapshot");
    List<FailureItem> failures = new ArrayList<>();
    // curves
    Map<String, YieldCurve> bondPar = new LinkedHashMap<>();
    Map<String, YieldCurve> bondZero = new LinkedHashMap<>();
    for (Entry<String, ImmutableList<Quote>> entry : snapshot.getBondQuotes().entrySet()) {
      String issuer = entry.getKey();
      Optional<YieldCurve> par = parCurve(issuer, entry.getValue(), failures);
      if (!par.isPresent()) {
        continue;
      }
      bondPar.put(issuer, par.get());
      Optional<Frequency> frequency = issuerConventions.findCouponFrequency(issuer);
      if (!frequency.isPresent()) {
        fail(failures, FailureItem.of(FailureReason.MISSING_DATA,
            "No coupon frequency configured for issuer '{}', zero curve omitted", issuer));
        continue;
      }
      CurveBootstrapSettings bootstrapSettings = CurveBootstrapSettings.of(
          settings.getBondCompounding(), frequency.get(), settings.getBootstrapPolicy());
      try {
        bondZero.put(issuer, CurveBootstrapper.DEFAULT.bootstrap(par.get(), bootstrapSettings));
      } catch (CurveBootstrapException e) {
        fail(failures, e.toFailureItem());
      }
    }
    Map<String, YieldCurve> swapPar = new LinkedHashMap<>();
    Map<String, YieldCurve> swapZero = new LinkedHashMap<>();
    for (Entry<String, ImmutableList<Quote>> entry : snapshot.getSwapQuotes().entrySet()) {
      String code = entry.getKey();
      Optional<YieldCurve> par = parCurve(code, entry.getValue(), failures);
      if (!par.isPresent()) {
        continue;
      }
      YieldCurve parCurve;
      try {
        parCurve = par.get().withCurrency(Currency.of(code));
      } catch (IllegalArgumentException e) {
        fail(failures, FailureItem.of(FailureReason.INVALID, "Swap quotes identifier '{}' is not a currency", code));
        continue;
      }
      swapPar.put(code, parCurve);
      try {
        swapZero.put(code, swapBootstrapper.bootstrap(
            parCurve, settings.getSwapCompounding(), settings.getBootstrapPolicy()));
      } catch (CurveBootstrapException e) {
        fail(failures, e.toFailureItem());
      }
    }
    // spreads
    Map<SpreadMode, ImmutableList<SpreadSeries>> spreads = new EnumMap<>(SpreadMode.class);
    Optional<YieldCurve> bund = Optional.ofNullable(bondPar.get(settings.getReferenceIssuer()));
    List<SpreadSeries> govVsBund = new ArrayList<>();
    for (YieldCurve curve : bondPar.values()) {
      addSeries(govVsBund, failures,
          () -> spreadCalculator.govVsBund(curve, bund, settings.getGovVsBundPolicy()));
    }
    spreads.put(SpreadMode.GOV_VS_BUND, ImmutableList.copyOf(govVsBund));
    List<SpreadSeries> assetSwap = new ArrayList<>();
    for (YieldCurve curve : bondZero.values()) {
      Optional<Currency> currency = issuerConventions.findCurrency(curve.getIdentifier());
      if (!currency.isPresent()) {
        fail(failures, FailureItem.of(FailureReason.MISSING_DATA,
            "No currency configured for issuer '{}', {} omitted", curve.getIdentifier(), SpreadMode.ASSET_SWAP));
        continue;
      }
      Optional<YieldCurve> swap = Optional.ofNullable(swapZero.get(currency.get().getCode()));
      addSeries(assetSwap, failures,
          () -> spreadCalculator.assetSwap(curve, swap, settings.getAssetSwapPolicy()));
    }
    spreads.put(SpreadMode.ASSET_SWAP, ImmutableList.copyOf(assetSwap));
    List<SpreadSeries> swapSpreads = new ArrayList<>();
    Optional<YieldCurve> referenceSwap =
        Optional.ofNullable(swapZero.get(settings.getReferenceSwapCurrency().getCode()));
    for (YieldCurve curve : swapZero.values()) {
      addSeries(swapSpreads, failures,
          () -> spreadCalculator.irsVsReferenceIrs(curve, referenceSwap, settings.getSwapSpreadPolicy()));
    }
    spreads.put(SpreadMode.IRS_VS_EUR_IRS, ImmutableList.copyOf(swapSpreads));
    // shapes, carry and roll
    ImmutableMap.Builder<String, ImmutableList<ShapeMetric>> slopes = ImmutableMap.builder();
    ImmutableMap.Builder<String, ImmutableList<ShapeMetric>> flies = ImmutableMap.builder();
    ImmutableMap.Builder<String, ImmutableList<CarryRollEntry>> carryRoll = ImmutableMap.builder();
    for (YieldCurve curve : bondPar.values()) {
      ValueWithFailures<List<ShapeMetric>> curveSlopes =
          TwoLegSpreadAnalyzer.DEFAULT.analyze(curve, settings.getPairs(), settings.getShapePolicy());
      curveSlopes.getFailures().forEach(f -> fail(failures, f));
      slopes.put(curve.getIdentifier(), ImmutableList.copyOf(curveSlopes.getValue()));
      ValueWithFailures<List<ShapeMetric>> curveFlies =
          FlyCalculator.DEFAULT.calculateAll(curve, settings.getFlies(), settings.getShapePolicy());
      curveFlies.getFailures().forEach(f -> fail(failures, f));
      flies.put(curve.getIdentifier(), ImmutableList.copyOf(curveFlies.getValue()));
      carryRoll.put(curve.getIdentifier(),
          CarryRollCalculator.DEFAULT.calculate(curve, settings.getHorizons(), settings.getFundingRate()));
    }
    SpreadMatrix matrix = MatrixBuilder.build(govVsBund, settings.getMatrixTenors());
    LOGGER.info("Relative value cycle {}: {} issuers, {} currencies, {} zero curves, {} failures",
        snapshot.getTimestamp(), bondPar.size(), swapPar.size(), bondZero.size() + swapZero.size(), failures.size());
    return RelativeValueReport.of(
        snapshot.getTimestamp(),
        ImmutableMap.copyOf(bondPar),
        ImmutableMap.copyOf(bondZero),
        ImmutableMap.copyOf(swapPar),
        ImmutableMap.copyOf(swapZero),
        ImmutableMap.copyOf(spreads),
        slopes.build(),
        flies.build(),
        carryRoll.build(),
        matrix,
        ImmutableList.copyOf(failures));
  }

  // par curve of one identifier, empty if the quotes are inconsistent
  private static Optional<YieldCurve> parCurve(String identifier, List<Quote> quotes, List<FailureItem> failures) {
    try {
      return Optional.of(YieldCurve.ofQuotes(quotes));
    } catch (IllegalArgumentException e) {
      fail(failures, FailureItem.of(FailureReason.INVALID, "Quotes of '{}' rejected: {}", identifier, e.getMessage()));
      return Optional.empty();
    }
  }

  private static void addSeries(
      List<SpreadSeries> series,
      List<FailureItem> failures,
      Supplier<ValueWithFailures<SpreadSeries>> computation) {

    try {
      ValueWithFailures<SpreadSeries> result = computation.get();
      result.getFailures().forEach(f -> fail(failures, f));
      series.add(result.getValue());
    } catch (MissingReferenceCurveException e) {
      fail(failures, e.toFailureItem());
    }
  }

  private static void fail(List<FailureItem> failures, FailureItem failure) {
    LOGGER.warn("{}", failure.getMessage());
    failures.add(failure);
  }

  //-------------------------------------------------------------------------
  /**
   * Returns the hedge instruments of a bond position: the bond futures of the symbols and the receiver swap in
   * the currency of the issuer at the swap tenor closest to the bond maturity.
   * <p>
   * The swap is omitted, with a failure, when the report has no swap zero curve for the currency.
   *
   * @param position  the bond position
   * @param report  the report of the cycle
   * @param futureSymbols  the future symbols
   * @param futuresTable  the DV01 per contract of the futures
   * @return the instruments, with the failures
   */
  public ValueWithFailures<List<HedgeInstrument>> hedgeInstruments(
      BondPosition position,
      RelativeValueReport report,
      List<String> futureSymbols,
      FuturesDv01Table futuresTable) {

    ArgChecker.notNull(position, "position");
    ArgChecker.notNull(report, "report");
    ArgChecker.noNulls(futureSymbols, "futureSymbols");
    List<HedgeInstrument> instruments = new ArrayList<>();
    for (String symbol : futureSymbols) {
      instruments.add(HedgeInstruments.future(symbol, futuresTable));
    }
    Optional<YieldCurve> swapCurve = issuerConventions.findCurrency(position.getIssuer())
        .map(c -> report.getSwapZeroCurves().get(c.getCode()));
    if (!swapCurve.isPresent()) {
      FailureItem failure = FailureItem.of(FailureReason.MISSING_DATA,
          "No swap curve to hedge '{}' with a swap", position.getDescription());
      LOGGER.warn("{}", failure.getMessage());
      return ValueWithFailures.of(ImmutableList.copyOf(instruments), failure);
    }
    YieldCurve curve = swapCurve.get();
    instruments.add(HedgeInstruments.swap(
        curve, position.getMaturity(), curve.getFrequency().get(), HedgeInstruments.SWAP_NOTIONAL_INCREMENT));
    return ValueWithFailures.of(ImmutableList.copyOf(instruments));
  }

  /**
   * Proposes DV01 hedges of a bond position.
   * <p>
   * The DV01 of the position is computed on the zero curve of its issuer in the report.
   *
   * @param position  the bond position
   * @param report  the report of the cycle
   * @param instruments  the hedge instruments
   * @return the proposals, with the failures
   */
  public ValueWithFailures<List<HedgeProposal>> proposeHedges(
      BondPosition position,
      RelativeValueReport report,
      List<HedgeInstrument> instruments) {

    ArgChecker.notNull(position, "position");
    ArgChecker.notNull(report, "report");
    YieldCurve zeroCurve = report.getBondZeroCurves().get(position.getIssuer());
    if (zeroCurve == null) {
      FailureItem failure = FailureItem.of(FailureReason.MISSING_DATA,
          "No zero curve for '{}', hedges of '{}' omitted", position.getIssuer(), position.getDescription());
      LOGGER.warn("{}", failure.getMessage());
      return ValueWithFailures.of(ImmutableList.<HedgeProposal>of(), failure);
    }
    double dv01 = Dv01Calculator.bondDv01(position, zeroCurve);
    return HedgeSizer.proposeAll(position.getDescription(), dv01, instruments);
  }

  /**
   * Returns the realized change of the issuer par curves since the previous cached snapshot.
   * <p>
   * Issuers without a cached curve before the time of the report are left out. The cache is not updated.
   *
   * @param report  the report of the cycle
   * @param cache  the curves of previous cycles
   * @return the change in basis points by tenor, by issuer
   */
  public ImmutableMap<String, ImmutableSortedMap<Double, Double>> realizedChanges(
      RelativeValueReport report,
      CurveSnapshotCache cache) {

    ArgChecker.notNull(report, "report");
    ArgChecker.notNull(cache, "cache");
    ImmutableMap.Builder<String, ImmutableSortedMap<Double, Double>> changes = ImmutableMap.builder();
    for (YieldCurve curve : report.getBondParCurves().values()) {
      cache.findBefore(curve.getIdentifier(), report.getTimestamp())
          .ifPresent(previous -> changes.put(
              curve.getIdentifier(), CarryRollCalculator.DEFAULT.realizedChanges(previous, curve)));
    }
    return changes.build();
  }

  public RelativeValueSettings getSettings() {
    return settings;
  }

}
