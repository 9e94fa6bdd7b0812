/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.market.quote;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import java.time.Instant;

import org.junit.jupiter.api.Test;

import com.opengamma.strata.basics.currency.Currency;
import com.opengamma.strata.basics.date.Tenor;

import marc.henrard.relval.basics.RateUnit;

/**
 * Tests {@link Quote} and {@link TickerUtils}.
 */
public class QuoteTest {

  @Test
  public void of() {
    Quote quote = Quote.of("Germany", "6m", 2.1, RateUnit.PERCENT);
    assertThat(quote.getTenorLabel()).isEqualTo("6M");
    assertThat(quote.getTenorYears()).isEqualTo(0.5);
    assertThat(quote.getRate()).isEqualTo(2.1);
    assertThat(quote.getUnit()).isEqualTo(RateUnit.PERCENT);
    assertThat(quote.getPrevious()).isEmpty();
    assertThat(quote.getTimestamp()).isEmpty();
  }

  @Test
  public void builder() {
    Instant time = Instant.parse("2026-10-16T16:00:00Z");
    Quote quote = Quote.builder()
        .identifier("Italy")
        .tenorLabel("10Y")
        .rate(3.6)
        .unit(RateUnit.PERCENT)
        .previous(3.55)
        .high(3.62)
        .low(3.50)
        .change(0.05)
        .timestamp(time)
        .build();
    assertThat(quote.getTenorYears()).isEqualTo(10d);
    assertThat(quote.getPrevious()).hasValue(3.55);
    assertThat(quote.getHigh()).hasValue(3.62);
    assertThat(quote.getLow()).hasValue(3.50);
    assertThat(quote.getChange()).hasValue(0.05);
    assertThat(quote.getTimestamp()).hasValue(time);
    assertThat(Quote.builder().identifier("Italy").tenorLabel("Odd").tenorYears(7.25).rate(3.2)
        .unit(RateUnit.PERCENT).build().getTenorYears()).isEqualTo(7.25);
  }

  @Test
  public void invalid() {
    assertThatIllegalArgumentException().isThrownBy(() -> Quote.of(" ", "2Y", 2d, RateUnit.PERCENT));
    assertThatIllegalArgumentException().isThrownBy(() -> Quote.of("Italy", "2Y", Double.NaN, RateUnit.PERCENT));
    assertThatIllegalArgumentException().isThrownBy(() -> Quote.of("Italy", "2Y", 2d, null));
    assertThatIllegalArgumentException().isThrownBy(
        () -> Quote.builder().identifier("Italy").tenorLabel("2Y").rate(2d).build());
  }

  @Test
  public void tickers() {
    assertThat(Quote.of("United States", "10Y", 4d, RateUnit.PERCENT).getTicker())
        .isEqualTo(TickerUtils.govBond("United States", Tenor.TENOR_10Y));
    assertThat(Quote.of("EUR", "5Y", 2.7, RateUnit.PERCENT).getTicker())
        .isEqualTo(TickerUtils.swap(Currency.EUR, Tenor.TENOR_5Y));
    assertThat(TickerUtils.swap(Currency.EUR, Tenor.TENOR_5Y).getStandardId().getScheme())
        .isEqualTo(TickerUtils.SCHEME);
    assertThat(TickerUtils.govBond("United States", Tenor.TENOR_10Y).getStandardId().getValue())
        .isEqualTo("United_States-GOV-10Y");
    assertThat(TickerUtils.parRate("Italy", "2Y")).isEqualTo(TickerUtils.govBond("Italy", Tenor.TENOR_2Y));
  }

}
