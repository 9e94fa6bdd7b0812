/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.shape;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.opengamma.strata.basics.date.Tenor;
import com.opengamma.strata.collect.array.DoubleArray;
import com.opengamma.strata.collect.result.FailureReason;
import com.opengamma.strata.collect.result.ValueWithFailures;

import marc.henrard.relval.basics.OutOfRangeInterpolationException;
import marc.henrard.relval.basics.RateUnit;
import marc.henrard.relval.dataset.RelativeValueDataSet;
import marc.henrard.relval.market.curve.AlignmentPolicy;
import marc.henrard.relval.market.curve.YieldCurve;

/**
 * Tests {@link TwoLegSpreadAnalyzer} and {@link TenorPair}.
 */
public class TwoLegSpreadAnalyzerTest {

  private static final TwoLegSpreadAnalyzer ANALYZER = TwoLegSpreadAnalyzer.DEFAULT;
  private static final YieldCurve GERMANY = RelativeValueDataSet.germanyPar();
  private static final YieldCurve SHORT_GRID =
      YieldCurve.ofPar("Spain", RateUnit.PERCENT, DoubleArray.of(2, 5, 10), DoubleArray.of(2.1, 2.4, 2.8));

  @Test
  public void names() {
    assertThat(TenorPair.TWOS_TENS.getName()).isEqualTo("2s10s");
    assertThat(TenorPair.FIVES_THIRTIES.getName()).isEqualTo("5s30s");
    assertThat(TenorPair.parse(" 2Y / 5Y ")).isEqualTo(TenorPair.TWOS_FIVES);
    assertThat(TenorPair.of(Tenor.TENOR_3M, Tenor.TENOR_2Y).getName()).isEqualTo("3Ms2s");
    assertThatIllegalArgumentException().isThrownBy(() -> TenorPair.parse("2Y"));
    assertThatIllegalArgumentException().isThrownBy(() -> TenorPair.of(Tenor.TENOR_10Y, Tenor.TENOR_2Y));
  }

  /* Long minus short: an upward sloping curve has positive slopes. */
  @Test
  public void slopes_on_grid() {
    assertThat(ANALYZER.slope(GERMANY, TenorPair.TWOS_TENS, AlignmentPolicy.STRICT).getValueBp())
        .isCloseTo(60d, offset(1.0E-9));
    ShapeMetric fivesThirties = ANALYZER.slope(GERMANY, TenorPair.FIVES_THIRTIES, AlignmentPolicy.STRICT);
    assertThat(fivesThirties.getName()).isEqualTo("5s30s");
    assertThat(fivesThirties.getTenors()).containsExactly(Tenor.TENOR_5Y, Tenor.TENOR_30Y);
    assertThat(fivesThirties.getValueBp()).isCloseTo(70d, offset(1.0E-9));
  }

  @Test
  public void slope_interpolated() {
    TenorPair twosSevens = TenorPair.of(Tenor.TENOR_2Y, Tenor.TENOR_7Y);
    // 7Y: 2.2 + (2.6 - 2.2) * 2 / 5 = 2.36
    assertThat(ANALYZER.slope(GERMANY, twosSevens, AlignmentPolicy.STRICT).getValueBp())
        .isCloseTo(36d, offset(1.0E-9));
  }

  @Test
  public void slope_decimal_curve() {
    YieldCurve decimal = GERMANY.toUnit(RateUnit.DECIMAL);
    assertThat(ANALYZER.slope(decimal, TenorPair.TWOS_TENS, AlignmentPolicy.STRICT).getValueBp())
        .isCloseTo(60d, offset(1.0E-9));
  }

  @Test
  public void strict_out_of_range() {
    assertThatThrownBy(() -> ANALYZER.slope(SHORT_GRID, TenorPair.FIVES_THIRTIES, AlignmentPolicy.STRICT))
        .isInstanceOf(OutOfRangeInterpolationException.class);
    assertThat(ANALYZER.slope(SHORT_GRID, TenorPair.FIVES_THIRTIES, AlignmentPolicy.NEAREST).getValueBp())
        .isCloseTo(40d, offset(1.0E-9));
  }

  /* A pair that cannot be computed is omitted, the others are kept in order. */
  @Test
  public void analyze_with_omission() {
    ValueWithFailures<List<ShapeMetric>> result =
        ANALYZER.analyze(SHORT_GRID, TwoLegSpreadAnalyzer.STANDARD_PAIRS, AlignmentPolicy.STRICT);
    assertThat(result.getValue()).extracting(ShapeMetric::getName).containsExactly("2s10s", "2s5s");
    assertThat(result.getValue().get(0).getValueBp()).isCloseTo(70d, offset(1.0E-9));
    assertThat(result.getFailures()).hasSize(1);
    assertThat(result.getFailures().get(0).getReason()).isEqualTo(FailureReason.NOT_APPLICABLE);
    assertThat(result.getFailures().get(0).getMessage()).contains("5s30s").contains("Spain");
  }

  @Test
  public void analyze_all() {
    ValueWithFailures<List<ShapeMetric>> result =
        ANALYZER.analyze(GERMANY, ImmutableList.of(TenorPair.TWOS_FIVES), AlignmentPolicy.NEAREST);
    assertThat(result.getFailures()).isEmpty();
    assertThat(result.getValue().get(0).getValueBp()).isCloseTo(20d, offset(1.0E-9));
  }

}
