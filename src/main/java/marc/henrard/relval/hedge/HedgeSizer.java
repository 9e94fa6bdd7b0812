/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.hedge;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.opengamma.strata.collect.ArgChecker;
import com.opengamma.strata.collect.result.FailureItem;
import com.opengamma.strata.collect.result.ValueWithFailures;

import marc.henrard.relval.basics.InsufficientHedgeDataException;

/**
 * Sizes DV01 hedges.
 * <p>
 * The hedge ratio is the position DV01 divided by the instrument DV01 per unit. The proposed quantity is the
 * ratio rounded to the nearest multiple of the instrument increment and the residual DV01 is
 * {@code positionDv01 - quantity * dv01PerUnit}. The proposal carries the liquidity score of the instrument.
 *
 * @author Marc Henrard
 */
public final class HedgeSizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(HedgeSizer.class);

  /** Private constructor. */
  private HedgeSizer() {
  }

  /**
   * Proposes a hedge of a position with one instrument.
   *
   * @param positionDescription  the description of the position
   * @param positionDv01  the DV01 of the position, positive
   * @param instrument  the hedge instrument
   * @return the proposal
   * @throws InsufficientHedgeDataException if a DV01 is not positive or not a number
   */
  public static HedgeProposal propose(String positionDescription, double positionDv01, HedgeInstrument instrument) {
    ArgChecker.notBlank(positionDescription, "positionDescription");
    ArgChecker.notNull(instrument, "instrument");
    if (!(positionDv01 > 0d)) {
      throw new InsufficientHedgeDataException(positionDescription, instrument.getIdentifier(),
          "position DV01 " + positionDv01 + " is not positive");
    }
    double dv01PerUnit = instrument.getDv01PerUnit();
    if (!(dv01PerUnit > 0d)) {
      throw new InsufficientHedgeDataException(positionDescription, instrument.getIdentifier(),
          "instrument DV01 " + dv01PerUnit + " is not positive");
    }
    double ratio = positionDv01 / dv01PerUnit;
    double increment = instrument.getIncrement();
    double quantity = Math.round(ratio / increment) * increment;
    double residual = positionDv01 - quantity * dv01PerUnit;
    return HedgeProposal.of(positionDescription, instrument.getIdentifier(), positionDv01, dv01PerUnit,
        ratio, quantity, residual, instrument.getLiquidity().score());
  }

  /**
   * Proposes a hedge of a position with each of several instruments.
   * <p>
   * An instrument that cannot be sized is omitted and reported as a failure.
   *
   * @param positionDescription  the description of the position
   * @param positionDv01  the DV01 of the position
   * @param instruments  the hedge instruments
   * @return the proposals, in the order of the instruments, with the failures
   */
  public static ValueWithFailures<List<HedgeProposal>> proposeAll(
      String positionDescription,
      double positionDv01,
      List<HedgeInstrument> instruments) {

    ArgChecker.noNulls(instruments, "instruments");
    List<HedgeProposal> proposals = new ArrayList<>();
    List<FailureItem> failures = new ArrayList<>();
    for (HedgeInstrument instrument : instruments) {
      try {
        proposals.add(propose(positionDescription, positionDv01, instrument));
      } catch (InsufficientHedgeDataException e) {
        LOGGER.warn("Hedge of '{}' with '{}' omitted: {}", positionDescription, instrument.getIdentifier(),
            e.getMessage());
        failures.add(e.toFailureItem());
      }
    }
    return ValueWithFailures.of(ImmutableList.copyOf(proposals), failures);
  }

}
