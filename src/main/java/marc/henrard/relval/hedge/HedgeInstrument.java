/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.hedge;

import java.util.Objects;

import com.google.common.base.MoreObjects;
import com.opengamma.strata.collect.ArgChecker;

/**
 * An instrument used to hedge the DV01 of a position.
 * <p>
 * The DV01 is per unit of quantity: per contract for futures, per unit of notional for swaps.
 * The quantity is proposed in multiples of the increment.
 * The liquidity is scored on each proposal, {@link LiquidityScore#STANDARD} when not specified.
 */
public final class HedgeInstrument {

  private final String identifier;
  private final double dv01PerUnit;
  private final double increment;
  private final LiquidityScore liquidity;

  private HedgeInstrument(String identifier, double dv01PerUnit, double increment, LiquidityScore liquidity) {
    this.identifier = ArgChecker.notBlank(identifier, "identifier");
    this.dv01PerUnit = dv01PerUnit;
    this.increment = ArgChecker.notNegativeOrZero(increment, "increment");
    this.liquidity = ArgChecker.notNull(liquidity, "liquidity");
  }

  /**
   * Obtains an instrument.
   * <p>
   * The DV01 is not validated here; a non-positive or NaN DV01 fails when sizing.
   *
   * @param identifier  the identifier, like "FGBL" or "EUR-IRS-10Y"
   * @param dv01PerUnit  the DV01 per unit of quantity
   * @param increment  the quantity increment, 1 for contracts
   * @return the instrument
   */
  public static HedgeInstrument of(String identifier, double dv01PerUnit, double increment) {
    return new HedgeInstrument(identifier, dv01PerUnit, increment, LiquidityScore.STANDARD);
  }

  /**
   * Returns a copy of this instrument with the given liquidity.
   *
   * @param liquidity  the liquidity
   * @return the instrument
   */
  public HedgeInstrument withLiquidity(LiquidityScore liquidity) {
    return new HedgeInstrument(identifier, dv01PerUnit, increment, liquidity);
  }

  public String getIdentifier() {
    return identifier;
  }

  public double getDv01PerUnit() {
    return dv01PerUnit;
  }

  public double getIncrement() {
    return increment;
  }

  public LiquidityScore getLiquidity() {
    return liquidity;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || obj.getClass() != getClass()) {
      return false;
    }
    HedgeInstrument other = (HedgeInstrument) obj;
    return identifier.equals(other.identifier) &&
        Double.compare(dv01PerUnit, other.dv01PerUnit) == 0 &&
        Double.compare(increment, other.increment) == 0 &&
        liquidity.equals(other.liquidity);
  }

  @Override
  public int hashCode() {
    return Objects.hash(identifier, dv01PerUnit, increment, liquidity);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("identifier", identifier)
        .add("dv01PerUnit", dv01PerUnit)
        .add("increment", increment)
        .add("liquidity", liquidity)
        .toString();
  }

}
