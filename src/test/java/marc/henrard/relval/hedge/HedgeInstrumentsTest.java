/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.hedge;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

import org.junit.jupiter.api.Test;

import com.opengamma.strata.basics.currency.Currency;
import com.opengamma.strata.basics.schedule.Frequency;

import marc.henrard.relval.basics.InsufficientHedgeDataException;
import marc.henrard.relval.dataset.RelativeValueDataSet;
import marc.henrard.relval.market.curve.CompoundingConvention;
import marc.henrard.relval.market.curve.YieldCurve;

/**
 * Tests {@link HedgeInstruments}.
 */
public class HedgeInstrumentsTest {

  private static final FuturesDv01Table TABLE = FuturesDv01Table.standard();
  private static final YieldCurve EUR_ZERO =
      RelativeValueDataSet.flatZero("EUR", 3d, CompoundingConvention.ANNUAL, Frequency.P12M)
          .withCurrency(Currency.EUR);

  @Test
  public void future() {
    HedgeInstrument bund = HedgeInstruments.future("fgbl", TABLE);
    assertThat(bund.getIdentifier()).isEqualTo("FGBL");
    assertThat(bund.getDv01PerUnit()).isEqualTo(85d);
    assertThat(bund.getIncrement()).isEqualTo(1d);
  }

  /* Unknown symbol: built, then rejected when sized. */
  @Test
  public void future_unknown() {
    HedgeInstrument unknown = HedgeInstruments.future("FGBX", TABLE);
    assertThat(unknown.getDv01PerUnit()).isNaN();
    assertThatThrownBy(() -> HedgeSizer.propose("Germany 2.5% 10Y", 1_000d, unknown))
        .isInstanceOf(InsufficientHedgeDataException.class);
  }

  @Test
  public void swap_nearest_tenor() {
    HedgeInstrument swap = HedgeInstruments.swap(
        EUR_ZERO, 9.3d, Frequency.P12M, HedgeInstruments.SWAP_NOTIONAL_INCREMENT);
    assertThat(swap.getIdentifier()).isEqualTo("EUR-IRS-10Y");
    assertThat(swap.getDv01PerUnit()).isCloseTo(0.00085259, offset(1.0E-8));
    assertThat(swap.getIncrement()).isEqualTo(1_000_000d);
    assertThat(HedgeInstruments.swap(EUR_ZERO, 2.2d, Frequency.P12M, 1d).getIdentifier()).isEqualTo("EUR-IRS-2Y");
  }

  @Test
  public void swap_without_currency() {
    YieldCurve untagged = RelativeValueDataSet.flatZero("GBP", 3d, CompoundingConvention.ANNUAL, Frequency.P12M);
    assertThat(HedgeInstruments.swapIdentifier(untagged, 5d)).isEqualTo("GBP-IRS-5Y");
  }

}
