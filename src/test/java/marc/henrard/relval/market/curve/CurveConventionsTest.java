/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.market.curve;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.offset;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableMap;
import com.opengamma.strata.basics.currency.Currency;
import com.opengamma.strata.basics.schedule.Frequency;
import com.opengamma.strata.collect.io.ResourceLocator;

/**
 * Tests {@link IssuerConventions}, {@link SwapFixedLegConventions} and {@link CompoundingConvention}.
 */
public class CurveConventionsTest {

  @Test
  public void issuers() {
    IssuerConventions conventions = IssuerConventions.standard();
    assertThat(conventions.getCurrencies()).hasSize(10);
    assertThat(conventions.findCurrency("Germany")).hasValue(Currency.EUR);
    assertThat(conventions.findCurrency("United States")).hasValue(Currency.USD);
    assertThat(conventions.findCouponFrequency("Italy")).hasValue(Frequency.P6M);
    assertThat(conventions.findCurrency("Atlantis")).isEmpty();
    assertThat(conventions.findCouponFrequency("Atlantis")).isEmpty();
  }

  /* Coupon schedules are built in months; other frequencies are rejected when the conventions are loaded. */
  @Test
  public void frequency_not_month_based() {
    assertThatIllegalArgumentException()
        .isThrownBy(() -> IssuerConventions.load(
            ResourceLocator.ofClasspath("config/issuer-conventions-weekly-test.csv")))
        .withMessageContaining("Atlantis");
    assertThatIllegalArgumentException()
        .isThrownBy(() -> SwapFixedLegConventions.of(ImmutableMap.of(Currency.CHF, Frequency.P1W)))
        .withMessageContaining("CHF");
    assertThatIllegalArgumentException()
        .isThrownBy(() -> CurveBootstrapSettings.of(CompoundingConvention.CONTINUOUS, Frequency.ofDays(14)));
    assertThatIllegalArgumentException()
        .isThrownBy(() -> CurveBootstrapSettings.of(CompoundingConvention.CONTINUOUS, Frequency.TERM));
  }

  @Test
  public void compounding_inverse() {
    for (CompoundingConvention compounding : CompoundingConvention.values()) {
      double df = compounding.discountFactor(0.035, 7.5);
      assertThat(df).isLessThan(1d);
      assertThat(compounding.zeroRate(df, 7.5)).isCloseTo(0.035, offset(1.0E-14));
    }
    assertThat(CompoundingConvention.ANNUAL.discountFactor(0.03, 2d)).isCloseTo(1d / (1.03 * 1.03), offset(1.0E-15));
    assertThat(CompoundingConvention.SEMIANNUAL.discountFactor(0.03, 1d))
        .isCloseTo(1d / (1.015 * 1.015), offset(1.0E-15));
    assertThat(CompoundingConvention.CONTINUOUS.discountFactor(0.03, 1d)).isCloseTo(Math.exp(-0.03), offset(1.0E-15));
  }

}
