/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.spread;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.opengamma.strata.basics.currency.Currency;
import com.opengamma.strata.basics.schedule.Frequency;
import com.opengamma.strata.collect.array.DoubleArray;
import com.opengamma.strata.collect.result.FailureReason;
import com.opengamma.strata.collect.result.ValueWithFailures;

import marc.henrard.relval.basics.MissingReferenceCurveException;
import marc.henrard.relval.basics.RateUnit;
import marc.henrard.relval.dataset.RelativeValueDataSet;
import marc.henrard.relval.market.curve.AlignmentPolicy;
import marc.henrard.relval.market.curve.CompoundingConvention;
import marc.henrard.relval.market.curve.YieldCurve;

/**
 * Tests {@link SpreadCalculator}.
 */
public class SpreadCalculatorTest {

  private static final SpreadCalculator CALCULATOR = SpreadCalculator.DEFAULT;
  private static final double TOLERANCE_BP = 1.0E-9;

  private static final YieldCurve GERMANY = RelativeValueDataSet.germanyPar();
  private static final YieldCurve ITALY = RelativeValueDataSet.italyPar();
  private static final double[] ITALY_SPREADS = {50d, 70d, 100d, 140d};

  private static final YieldCurve BOND_ZERO = YieldCurve.ofZero("Italy", RateUnit.PERCENT,
      DoubleArray.of(2, 5, 10, 30), DoubleArray.of(2.5, 2.9, 3.6, 4.3),
      CompoundingConvention.CONTINUOUS, Frequency.P6M);
  private static final YieldCurve SWAP_ZERO = YieldCurve.ofZero("EUR", RateUnit.PERCENT,
      DoubleArray.of(2, 5, 10), DoubleArray.of(3.0, 2.7, 2.6), CompoundingConvention.CONTINUOUS, Frequency.P12M)
      .withCurrency(Currency.EUR);

  @Test
  public void gov_vs_bund() {
    ValueWithFailures<SpreadSeries> result = CALCULATOR.govVsBund(ITALY, Optional.of(GERMANY));
    SpreadSeries series = result.getValue();
    assertThat(result.getFailures()).isEmpty();
    assertThat(series.getSource()).isEqualTo("Italy");
    assertThat(series.getReference()).isEqualTo("Germany");
    assertThat(series.getMode()).isEqualTo(SpreadMode.GOV_VS_BUND);
    assertThat(series.size()).isEqualTo(4);
    for (int i = 0; i < 4; i++) {
      assertThat(series.getPoints().get(i).getTenor()).isEqualTo(RelativeValueDataSet.GOV_TENORS.get(i));
      assertThat(series.getPoints().get(i).getSpreadBp()).isCloseTo(ITALY_SPREADS[i], offset(TOLERANCE_BP));
    }
    assertThat(series.getExcludedTenors().size()).isEqualTo(0);
  }

  @Test
  public void reference_against_itself() {
    SpreadSeries series = CALCULATOR.govVsBund(GERMANY, Optional.of(GERMANY)).getValue();
    assertThat(series.getPoints()).extracting(SpreadPoint::getSpreadBp).containsOnly(0d);
  }

  /* Reference curve in another unit is converted first; basis points follow the unit of the target. */
  @Test
  public void mixed_units() {
    YieldCurve italyDecimal = ITALY.toUnit(RateUnit.DECIMAL);
    SpreadSeries series = CALCULATOR.govVsBund(italyDecimal, Optional.of(GERMANY)).getValue();
    for (int i = 0; i < 4; i++) {
      assertThat(series.getPoints().get(i).getSpreadBp()).isCloseTo(ITALY_SPREADS[i], offset(TOLERANCE_BP));
    }
    SpreadSeries reverse = CALCULATOR.govVsBund(ITALY, Optional.of(GERMANY.toUnit(RateUnit.DECIMAL))).getValue();
    assertThat(reverse.findSpread(10d).getAsDouble()).isCloseTo(100d, offset(TOLERANCE_BP));
  }

  @Test
  public void missing_reference() {
    assertThatThrownBy(() -> CALCULATOR.govVsBund(ITALY, Optional.empty()))
        .isInstanceOf(MissingReferenceCurveException.class)
        .hasMessageContaining("Italy");
    assertThatThrownBy(() -> CALCULATOR.assetSwap(BOND_ZERO, Optional.empty(), AlignmentPolicy.NEAREST))
        .isInstanceOf(MissingReferenceCurveException.class);
    YieldCurve usd = SWAP_ZERO.withCurrency(Currency.USD);
    assertThatThrownBy(() -> CALCULATOR.irsVsReferenceIrs(usd, Optional.empty(), AlignmentPolicy.NEAREST))
        .isInstanceOf(MissingReferenceCurveException.class);
  }

  @Test
  public void kind_mismatch() {
    assertThatIllegalArgumentException().isThrownBy(
        () -> CALCULATOR.assetSwap(ITALY, Optional.of(SWAP_ZERO), AlignmentPolicy.NEAREST));
  }

  /* Strict alignment: the 30Y bond tenor is outside the swap grid, excluded and reported. */
  @Test
  public void asset_swap_strict() {
    ValueWithFailures<SpreadSeries> result =
        CALCULATOR.assetSwap(BOND_ZERO, Optional.of(SWAP_ZERO), AlignmentPolicy.STRICT);
    SpreadSeries series = result.getValue();
    assertThat(series.size()).isEqualTo(3);
    assertThat(series.findSpread(30d)).isEmpty();
    assertThat(series.getExcludedTenors()).isEqualTo(DoubleArray.of(30));
    assertThat(result.getFailures()).hasSize(1);
    assertThat(result.getFailures().get(0).getReason()).isEqualTo(FailureReason.NOT_APPLICABLE);
    assertThat(result.getFailures().get(0).getMessage()).contains("Italy").contains("30Y");
    assertThat(series.findSpread(2d).getAsDouble()).isCloseTo(-50d, offset(TOLERANCE_BP));
    assertThat(series.findSpread(10d).getAsDouble()).isCloseTo(100d, offset(TOLERANCE_BP));
  }

  /* Nearest alignment: the 30Y bond tenor uses the 10Y swap rate. */
  @Test
  public void asset_swap_nearest() {
    ValueWithFailures<SpreadSeries> result =
        CALCULATOR.assetSwap(BOND_ZERO, Optional.of(SWAP_ZERO), AlignmentPolicy.NEAREST);
    SpreadSeries series = result.getValue();
    assertThat(result.getFailures()).isEmpty();
    assertThat(series.size()).isEqualTo(4);
    assertThat(series.findSpread(30d).getAsDouble()).isCloseTo(170d, offset(TOLERANCE_BP));
  }

  /* Swap tenor not on the swap grid but inside it: interpolated under both policies. */
  @Test
  public void asset_swap_interpolated() {
    YieldCurve bond = YieldCurve.ofZero("France", RateUnit.PERCENT, DoubleArray.of(7), DoubleArray.of(3.0),
        CompoundingConvention.CONTINUOUS, Frequency.P6M);
    SpreadSeries series = CALCULATOR.assetSwap(bond, Optional.of(SWAP_ZERO), AlignmentPolicy.STRICT).getValue();
    // swap at 7Y: 2.7 + (2.6 - 2.7) * 2 / 5 = 2.66
    assertThat(series.findSpread(7d).getAsDouble()).isCloseTo(34d, offset(TOLERANCE_BP));
  }

  /* The EUR swap curve against itself is exactly zero, with or without reference. */
  @Test
  public void eur_identity() {
    ValueWithFailures<SpreadSeries> result =
        CALCULATOR.irsVsReferenceIrs(SWAP_ZERO, Optional.empty(), AlignmentPolicy.STRICT);
    SpreadSeries series = result.getValue();
    assertThat(series.getReference()).isEqualTo("EUR");
    assertThat(series.size()).isEqualTo(SWAP_ZERO.size());
    for (SpreadPoint point : series.getPoints()) {
      assertThat(point.getSpreadBp()).isEqualTo(0d);
    }
    assertThat(CALCULATOR.irsVsReferenceIrs(SWAP_ZERO, Optional.of(SWAP_ZERO.shiftedBy(10d)), AlignmentPolicy.STRICT)
        .getValue().getPoints()).extracting(SpreadPoint::getSpreadBp).containsOnly(0d);
  }

  @Test
  public void irs_vs_eur() {
    YieldCurve usd = YieldCurve.ofZero("USD", RateUnit.PERCENT, DoubleArray.of(2, 5, 10, 30),
        DoubleArray.of(4.8, 4.2, 4.0, 3.9), CompoundingConvention.CONTINUOUS, Frequency.P6M).withCurrency(Currency.USD);
    ValueWithFailures<SpreadSeries> strict =
        CALCULATOR.irsVsReferenceIrs(usd, Optional.of(SWAP_ZERO), AlignmentPolicy.STRICT);
    assertThat(strict.getValue().size()).isEqualTo(3);
    assertThat(strict.getValue().findSpread(2d).getAsDouble()).isCloseTo(180d, offset(TOLERANCE_BP));
    assertThat(strict.getFailures()).hasSize(1);
    SpreadSeries custom = SpreadCalculator.of(Currency.USD)
        .irsVsReferenceIrs(usd, Optional.empty(), AlignmentPolicy.STRICT).getValue();
    assertThat(custom.getPoints()).extracting(SpreadPoint::getSpreadBp).containsOnly(0d);
  }

  @Test
  public void dispatch() {
    assertThat(CALCULATOR.calculate(SpreadMode.GOV_VS_BUND, ITALY, Optional.of(GERMANY), AlignmentPolicy.NEAREST)
        .getValue()).isEqualTo(CALCULATOR.govVsBund(ITALY, Optional.of(GERMANY)).getValue());
    assertThat(CALCULATOR.calculate(SpreadMode.ASSET_SWAP, BOND_ZERO, Optional.of(SWAP_ZERO), AlignmentPolicy.STRICT)
        .getValue().size()).isEqualTo(3);
    assertThat(CALCULATOR.calculate(SpreadMode.IRS_VS_EUR_IRS, SWAP_ZERO, Optional.empty(), AlignmentPolicy.STRICT)
        .getValue().getMode()).isEqualTo(SpreadMode.IRS_VS_EUR_IRS);
  }

}
