/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.hedge;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

import java.util.List;
import java.util.OptionalDouble;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.opengamma.strata.collect.result.FailureReason;
import com.opengamma.strata.collect.result.ValueWithFailures;

import marc.henrard.relval.basics.InsufficientHedgeDataException;

/**
 * Tests {@link HedgeSizer}.
 */
public class HedgeSizerTest {

  private static final String POSITION = "Italy 3.5% 10Y";
  private static final HedgeInstrument FUTURE = HedgeInstrument.of("FGBL", 48d, HedgeInstruments.CONTRACT_INCREMENT);
  private static final HedgeInstrument SWAP =
      HedgeInstrument.of("EUR-IRS-10Y", 0.0008d, HedgeInstruments.SWAP_NOTIONAL_INCREMENT);

  @Test
  public void exact_hedge() {
    HedgeProposal proposal = HedgeSizer.propose(POSITION, 12_000d, FUTURE);
    assertThat(proposal.getPositionDescription()).isEqualTo(POSITION);
    assertThat(proposal.getInstrumentIdentifier()).isEqualTo("FGBL");
    assertThat(proposal.getHedgeRatio()).isEqualTo(250d);
    assertThat(proposal.getQuantity()).isEqualTo(250d);
    assertThat(proposal.getResidualDv01()).isEqualTo(0d);
  }

  /* The quantity is rounded, the residual carries the difference. */
  @Test
  public void rounded_hedge() {
    HedgeProposal proposal = HedgeSizer.propose(POSITION, 12_010d, FUTURE);
    assertThat(proposal.getHedgeRatio()).isCloseTo(250.2083333, offset(1.0E-6));
    assertThat(proposal.getQuantity()).isEqualTo(250d);
    assertThat(proposal.getResidualDv01()).isCloseTo(10d, offset(1.0E-9));
    HedgeProposal up = HedgeSizer.propose(POSITION, 12_030d, FUTURE);
    assertThat(up.getQuantity()).isEqualTo(251d);
    assertThat(up.getResidualDv01()).isCloseTo(-18d, offset(1.0E-9));
  }

  @Test
  public void swap_notional_increment() {
    HedgeProposal proposal = HedgeSizer.propose(POSITION, 1_000d, SWAP);
    assertThat(proposal.getHedgeRatio()).isCloseTo(1_250_000d, offset(1.0E-6));
    assertThat(proposal.getQuantity()).isEqualTo(1_000_000d);
    assertThat(proposal.getResidualDv01()).isCloseTo(200d, offset(1.0E-9));
    HedgeProposal large = HedgeSizer.propose(POSITION, 8_650d, SWAP);
    assertThat(large.getQuantity()).isEqualTo(11_000_000d);
    assertThat(large.getResidualDv01()).isCloseTo(-150d, offset(1.0E-9));
  }

  @Test
  public void invalid_dv01() {
    assertThatThrownBy(() -> HedgeSizer.propose(POSITION, 0d, FUTURE))
        .isInstanceOf(InsufficientHedgeDataException.class)
        .hasMessageContaining(POSITION);
    assertThatThrownBy(() -> HedgeSizer.propose(POSITION, -100d, FUTURE))
        .isInstanceOf(InsufficientHedgeDataException.class);
    assertThatThrownBy(() -> HedgeSizer.propose(POSITION, Double.NaN, FUTURE))
        .isInstanceOf(InsufficientHedgeDataException.class);
    assertThatThrownBy(() -> HedgeSizer.propose(POSITION, 100d, HedgeInstrument.of("FGBX", Double.NaN, 1d)))
        .isInstanceOf(InsufficientHedgeDataException.class)
        .hasMessageContaining("FGBX");
    assertThatThrownBy(() -> HedgeSizer.propose(POSITION, 100d, HedgeInstrument.of("FGBX", 0d, 1d)))
        .isInstanceOf(InsufficientHedgeDataException.class);
  }

  /* An instrument that cannot be sized is reported, the others are kept. */
  @Test
  public void propose_all() {
    HedgeInstrument unknown = HedgeInstrument.of("FGBX", Double.NaN, HedgeInstruments.CONTRACT_INCREMENT);
    ValueWithFailures<List<HedgeProposal>> result =
        HedgeSizer.proposeAll(POSITION, 12_000d, ImmutableList.of(FUTURE, unknown, SWAP));
    assertThat(result.getValue()).extracting(HedgeProposal::getInstrumentIdentifier)
        .containsExactly("FGBL", "EUR-IRS-10Y");
    assertThat(result.getValue()).extracting(HedgeProposal::getLiquidityScore)
        .containsOnly(LiquidityScore.STANDARD.score());
    assertThat(result.getFailures()).hasSize(1);
    assertThat(result.getFailures().get(0).getReason()).isEqualTo(FailureReason.INVALID);
    assertThat(result.getFailures().get(0).getMessage()).contains("FGBX");
  }

  /* The proposal scores the liquidity of its instrument. */
  @Test
  public void liquidity_score() {
    assertThat(HedgeSizer.propose(POSITION, 12_000d, FUTURE).getLiquidityScore()).isCloseTo(0.775, offset(1.0E-12));
    HedgeInstrument offTheRun = FUTURE.withLiquidity(
        LiquidityScore.of(false, OptionalDouble.of(4d), OptionalDouble.empty()));
    HedgeProposal proposal = HedgeSizer.propose(POSITION, 12_000d, offTheRun);
    assertThat(proposal.getLiquidityScore()).isCloseTo(0.15, offset(1.0E-12));
    assertThat(proposal.getQuantity()).isEqualTo(250d);
  }

}
