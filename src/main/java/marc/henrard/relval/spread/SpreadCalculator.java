/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.spread;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.opengamma.strata.basics.currency.Currency;
import com.opengamma.strata.collect.ArgChecker;
import com.opengamma.strata.collect.array.DoubleArray;
import com.opengamma.strata.collect.result.FailureItem;
import com.opengamma.strata.collect.result.FailureReason;
import com.opengamma.strata.collect.result.ValueWithFailures;

import marc.henrard.relval.basics.MissingReferenceCurveException;
import marc.henrard.relval.basics.OutOfRangeInterpolationException;
import marc.henrard.relval.basics.RateUnit;
import marc.henrard.relval.basics.TenorUtils;
import marc.henrard.relval.market.curve.AlignmentPolicy;
import marc.henrard.relval.market.curve.GridInterpolator;
import marc.henrard.relval.market.curve.YieldCurve;

/**
 * Computes relative value spread series between a target curve and a reference curve.
 * <p>
 * For each tenor of the target grid, the spread is the target rate minus the reference rate interpolated at
 * that tenor, in basis points. The conversion to basis points follows the unit of the target curve; a reference
 * curve in another unit is converted first.
 * <p>
 * A tenor outside the reference grid under strict alignment is excluded from the series and reported as a
 * failure item; the rest of the series is computed. A missing reference curve fails the whole series with
 * {@link MissingReferenceCurveException}.
 *
 * @author Marc Henrard
 */
public final class SpreadCalculator {

  /** The default instance, with EUR as reference currency for swap spreads. */
  public static final SpreadCalculator DEFAULT = new SpreadCalculator(Currency.EUR);

  private static final GridInterpolator INTERPOLATOR = GridInterpolator.DEFAULT;

  /** The reference currency of the swap versus swap spreads. */
  private final Currency referenceSwapCurrency;

  private SpreadCalculator(Currency referenceSwapCurrency) {
    this.referenceSwapCurrency = ArgChecker.notNull(referenceSwapCurrency, "referenceSwapCurrency");
  }

  /**
   * Obtains a calculator with a given reference currency for swap versus swap spreads.
   *
   * @param referenceSwapCurrency  the reference currency
   * @return the calculator
   */
  public static SpreadCalculator of(Currency referenceSwapCurrency) {
    return new SpreadCalculator(referenceSwapCurrency);
  }

  //-------------------------------------------------------------------------
  /**
   * Computes the spread series of a mode.
   *
   * @param mode  the spread mode
   * @param target  the target curve
   * @param reference  the reference curve: the Bund curve, the swap curve of the target currency or the EUR swap curve
   * @param policy  the alignment policy on the reference grid
   * @return the series, with the excluded tenors as failures
   * @throws MissingReferenceCurveException if the reference curve is required and absent
   */
  public ValueWithFailures<SpreadSeries> calculate(
      SpreadMode mode,
      YieldCurve target,
      Optional<YieldCurve> reference,
      AlignmentPolicy policy) {

    ArgChecker.notNull(mode, "mode");
    switch (mode) {
      case GOV_VS_BUND:
        return govVsBund(target, reference, policy);
      case ASSET_SWAP:
        return assetSwap(target, reference, policy);
      case IRS_VS_EUR_IRS:
        return irsVsReferenceIrs(target, reference, policy);
      default:
        throw new IllegalArgumentException("Unknown spread mode " + mode);
    }
  }

  /**
   * Computes the government versus Bund spread series, with nearest alignment.
   *
   * @param target  the curve of the issuer
   * @param bund  the curve of the reference issuer
   * @return the series
   * @throws MissingReferenceCurveException if the reference curve is absent
   */
  public ValueWithFailures<SpreadSeries> govVsBund(YieldCurve target, Optional<YieldCurve> bund) {
    return govVsBund(target, bund, AlignmentPolicy.NEAREST);
  }

  /**
   * Computes the government versus Bund spread series.
   *
   * @param target  the curve of the issuer
   * @param bund  the curve of the reference issuer
   * @param policy  the alignment policy on the reference grid
   * @return the series
   * @throws MissingReferenceCurveException if the reference curve is absent
   */
  public ValueWithFailures<SpreadSeries> govVsBund(
      YieldCurve target,
      Optional<YieldCurve> bund,
      AlignmentPolicy policy) {

    return spreads(SpreadMode.GOV_VS_BUND, target, required(SpreadMode.GOV_VS_BUND, target, bund, "Bund"), policy);
  }

  /**
   * Computes the asset swap spread series: bond zero rate minus swap zero rate of the same currency.
   * <p>
   * The bond and swap grids generally differ, the swap curve is interpolated on the bond tenors.
   *
   * @param bondZero  the zero curve of the issuer
   * @param swapZero  the zero swap curve of the issuer currency
   * @param policy  the alignment policy on the swap grid
   * @return the series
   * @throws MissingReferenceCurveException if the swap curve is absent
   */
  public ValueWithFailures<SpreadSeries> assetSwap(
      YieldCurve bondZero,
      Optional<YieldCurve> swapZero,
      AlignmentPolicy policy) {

    YieldCurve swap = required(SpreadMode.ASSET_SWAP, bondZero, swapZero, "swap");
    return spreads(SpreadMode.ASSET_SWAP, bondZero, swap, policy);
  }

  /**
   * Computes the swap versus reference swap spread series.
   * <p>
   * When the target currency is the reference currency, the spread is zero at every tenor by construction;
   * the reference curve is then not used.
   *
   * @param swapZero  the zero swap curve of the target currency
   * @param referenceSwapZero  the zero swap curve of the reference currency
   * @param policy  the alignment policy on the reference grid
   * @return the series
   * @throws MissingReferenceCurveException if the reference curve is required and absent
   */
  public ValueWithFailures<SpreadSeries> irsVsReferenceIrs(
      YieldCurve swapZero,
      Optional<YieldCurve> referenceSwapZero,
      AlignmentPolicy policy) {

    ArgChecker.notNull(swapZero, "swapZero");
    String targetCurrency = swapZero.getCurrency().map(Currency::getCode).orElse(swapZero.getIdentifier());
    if (targetCurrency.equals(referenceSwapCurrency.getCode())) {
      List<SpreadPoint> points = new ArrayList<>();
      for (int i = 0; i < swapZero.size(); i++) {
        points.add(SpreadPoint.of(swapZero.getTenors().get(i), 0d));
      }
      return ValueWithFailures.of(SpreadSeries.of(
          swapZero.getIdentifier(), referenceSwapCurrency.getCode(), SpreadMode.IRS_VS_EUR_IRS, points,
          DoubleArray.EMPTY));
    }
    YieldCurve reference = required(SpreadMode.IRS_VS_EUR_IRS, swapZero, referenceSwapZero,
        referenceSwapCurrency.getCode());
    return spreads(SpreadMode.IRS_VS_EUR_IRS, swapZero, reference, policy);
  }

  //-------------------------------------------------------------------------
  private static YieldCurve required(
      SpreadMode mode,
      YieldCurve target,
      Optional<YieldCurve> reference,
      String referenceName) {

    ArgChecker.notNull(target, "target");
    ArgChecker.notNull(reference, "reference");
    return reference.orElseThrow(
        () -> new MissingReferenceCurveException(target.getIdentifier(), referenceName, mode.name()));
  }

  private static ValueWithFailures<SpreadSeries> spreads(
      SpreadMode mode,
      YieldCurve target,
      YieldCurve reference,
      AlignmentPolicy policy) {

    ArgChecker.notNull(policy, "policy");
    ArgChecker.isTrue(target.getKind() == reference.getKind(),
        "Spread between a {} curve and a {} curve", target.getKind(), reference.getKind());
    RateUnit unit = target.getUnit();
    YieldCurve alignedReference = reference.toUnit(unit);
    List<SpreadPoint> points = new ArrayList<>();
    List<Double> excluded = new ArrayList<>();
    List<FailureItem> failures = new ArrayList<>();
    for (int i = 0; i < target.size(); i++) {
      double tenor = target.getTenors().get(i);
      double referenceRate;
      try {
        referenceRate = INTERPOLATOR.interpolate(alignedReference, tenor, policy);
      } catch (OutOfRangeInterpolationException e) {
        excluded.add(tenor);
        failures.add(FailureItem.of(
            FailureReason.NOT_APPLICABLE,
            "Spread {} of '{}' versus '{}' excludes tenor {}: {}",
            mode, target.getIdentifier(), reference.getIdentifier(), TenorUtils.label(tenor), e.getMessage()));
        continue;
      }
      double targetRate = target.getRates().get(i);
      points.add(SpreadPoint.of(tenor, unit.toBasisPoints(targetRate - referenceRate)));
    }
    SpreadSeries series = SpreadSeries.of(
        target.getIdentifier(), reference.getIdentifier(), mode, points,
        DoubleArray.copyOf(excluded.stream().mapToDouble(Double::doubleValue).toArray()));
    return ValueWithFailures.of(series, failures);
  }

  public Currency getReferenceSwapCurrency() {
    return referenceSwapCurrency;
  }

}
