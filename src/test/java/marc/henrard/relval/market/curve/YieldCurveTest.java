/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.market.curve;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.offset;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.opengamma.strata.basics.currency.Currency;
import com.opengamma.strata.basics.schedule.Frequency;
import com.opengamma.strata.collect.array.DoubleArray;

import marc.henrard.relval.basics.RateUnit;
import marc.henrard.relval.market.quote.Quote;

/**
 * Tests {@link YieldCurve}.
 */
public class YieldCurveTest {

  @Test
  public void of_quotes_sorted() {
    YieldCurve curve = YieldCurve.ofQuotes(ImmutableList.of(
        Quote.of("France", "10Y", 3.0, RateUnit.PERCENT),
        Quote.of("France", "6M", 2.1, RateUnit.PERCENT),
        Quote.of("France", "2Y", 2.4, RateUnit.PERCENT)));
    assertThat(curve.getIdentifier()).isEqualTo("France");
    assertThat(curve.getKind()).isEqualTo(CurveKind.PAR);
    assertThat(curve.getTenors()).isEqualTo(DoubleArray.of(0.5, 2, 10));
    assertThat(curve.getRates()).isEqualTo(DoubleArray.of(2.1, 2.4, 3.0));
    assertThat(curve.getCurrency()).isEmpty();
    assertThat(curve.getCompounding()).isEmpty();
  }

  @Test
  public void of_quotes_rejected() {
    assertThatIllegalArgumentException().isThrownBy(() -> YieldCurve.ofQuotes(ImmutableList.of(
        Quote.of("France", "2Y", 2.4, RateUnit.PERCENT),
        Quote.of("France", "5Y", 0.025, RateUnit.DECIMAL))));
    assertThatIllegalArgumentException().isThrownBy(() -> YieldCurve.ofQuotes(ImmutableList.of(
        Quote.of("France", "2Y", 2.4, RateUnit.PERCENT),
        Quote.of("France", "24M", 2.5, RateUnit.PERCENT))));
    assertThatIllegalArgumentException().isThrownBy(() -> YieldCurve.ofQuotes(ImmutableList.of(
        Quote.of("France", "2Y", 2.4, RateUnit.PERCENT),
        Quote.of("Spain", "5Y", 2.5, RateUnit.PERCENT))));
    assertThatIllegalArgumentException().isThrownBy(() -> YieldCurve.ofQuotes(ImmutableList.of()));
  }

  @Test
  public void invalid_grid() {
    assertThatIllegalArgumentException().isThrownBy(
        () -> YieldCurve.ofPar("X", RateUnit.PERCENT, DoubleArray.of(5, 2), DoubleArray.of(1, 2)));
    assertThatIllegalArgumentException().isThrownBy(
        () -> YieldCurve.ofPar("X", RateUnit.PERCENT, DoubleArray.of(2, 5), DoubleArray.of(1)));
    assertThatIllegalArgumentException().isThrownBy(
        () -> YieldCurve.ofPar("X", RateUnit.PERCENT, DoubleArray.of(0, 5), DoubleArray.of(1, 2)));
    assertThatIllegalArgumentException().isThrownBy(
        () -> YieldCurve.ofZero("X", RateUnit.PERCENT, DoubleArray.of(2, 5), DoubleArray.of(1, 2), null,
            Frequency.P12M));
  }

  @Test
  public void transformations() {
    YieldCurve curve = YieldCurve.ofPar("X", RateUnit.PERCENT, DoubleArray.of(2, 5, 10), DoubleArray.of(2, 2.5, 3));
    YieldCurve shifted = curve.shiftedBy(10d);
    assertThat(shifted.getRates().get(1)).isCloseTo(2.6, offset(1.0E-12));
    YieldCurve decimal = curve.toUnit(RateUnit.DECIMAL);
    assertThat(decimal.getUnit()).isEqualTo(RateUnit.DECIMAL);
    assertThat(decimal.getRates().get(2)).isCloseTo(0.03, offset(1.0E-15));
    assertThat(curve.toUnit(RateUnit.PERCENT)).isSameAs(curve);
    YieldCurve tagged = curve.withCurrency(Currency.EUR);
    assertThat(tagged.getCurrency()).hasValue(Currency.EUR);
    assertThat(tagged).isNotEqualTo(curve);
  }

  @Test
  public void lookups() {
    YieldCurve curve = YieldCurve.ofPar("X", RateUnit.PERCENT, DoubleArray.of(2, 5, 10), DoubleArray.of(2, 2.5, 3));
    assertThat(curve.indexOf(5d)).isEqualTo(1);
    assertThat(curve.indexOf(5d + 1.0E-10)).isEqualTo(1);
    assertThat(curve.indexOf(6d)).isEqualTo(-1);
    assertThat(curve.findRate(10d)).hasValue(3d);
    assertThat(curve.findRate(7d)).isEmpty();
    assertThat(curve.nearestTenor(6d)).isEqualTo(5d);
    assertThat(curve.nearestTenor(7.5)).isEqualTo(5d);
    assertThat(curve.nearestTenor(40d)).isEqualTo(10d);
    assertThat(curve.getFirstTenor()).isEqualTo(2d);
    assertThat(curve.getLastTenor()).isEqualTo(10d);
  }

}
