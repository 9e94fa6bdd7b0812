/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.hedge;

import java.util.Objects;

import com.google.common.base.MoreObjects;

/**
 * A proposed DV01 hedge of a position with one instrument.
 * <p>
 * The residual DV01 is what remains after the quantity is rounded to the instrument increment.
 */
public final class HedgeProposal {

  private final String positionDescription;
  private final String instrumentIdentifier;
  private final double positionDv01;
  private final double instrumentDv01PerUnit;
  private final double hedgeRatio;
  private final double quantity;
  private final double residualDv01;
  private final double liquidityScore;

  private HedgeProposal(
      String positionDescription,
      String instrumentIdentifier,
      double positionDv01,
      double instrumentDv01PerUnit,
      double hedgeRatio,
      double quantity,
      double residualDv01,
      double liquidityScore) {

    this.positionDescription = positionDescription;
    this.instrumentIdentifier = instrumentIdentifier;
    this.positionDv01 = positionDv01;
    this.instrumentDv01PerUnit = instrumentDv01PerUnit;
    this.hedgeRatio = hedgeRatio;
    this.quantity = quantity;
    this.residualDv01 = residualDv01;
    this.liquidityScore = liquidityScore;
  }

  static HedgeProposal of(
      String positionDescription,
      String instrumentIdentifier,
      double positionDv01,
      double instrumentDv01PerUnit,
      double hedgeRatio,
      double quantity,
      double residualDv01,
      double liquidityScore) {

    return new HedgeProposal(positionDescription, instrumentIdentifier, positionDv01, instrumentDv01PerUnit,
        hedgeRatio, quantity, residualDv01, liquidityScore);
  }

  public String getPositionDescription() {
    return positionDescription;
  }

  public String getInstrumentIdentifier() {
    return instrumentIdentifier;
  }

  public double getPositionDv01() {
    return positionDv01;
  }

  public double getInstrumentDv01PerUnit() {
    return instrumentDv01PerUnit;
  }

  /**
   * Returns the unrounded hedge ratio, position DV01 over instrument DV01.
   *
   * @return the ratio
   */
  public double getHedgeRatio() {
    return hedgeRatio;
  }

  /**
   * Returns the proposed quantity: contract count or notional.
   *
   * @return the quantity
   */
  public double getQuantity() {
    return quantity;
  }

  public double getResidualDv01() {
    return residualDv01;
  }

  /**
   * Returns the liquidity score of the instrument, between 0 and 1.
   *
   * @return the score
   */
  public double getLiquidityScore() {
    return liquidityScore;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || obj.getClass() != getClass()) {
      return false;
    }
    HedgeProposal other = (HedgeProposal) obj;
    return positionDescription.equals(other.positionDescription) &&
        instrumentIdentifier.equals(other.instrumentIdentifier) &&
        Double.compare(positionDv01, other.positionDv01) == 0 &&
        Double.compare(instrumentDv01PerUnit, other.instrumentDv01PerUnit) == 0 &&
        Double.compare(hedgeRatio, other.hedgeRatio) == 0 &&
        Double.compare(quantity, other.quantity) == 0 &&
        Double.compare(residualDv01, other.residualDv01) == 0 &&
        Double.compare(liquidityScore, other.liquidityScore) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(positionDescription, instrumentIdentifier, positionDv01, instrumentDv01PerUnit,
        hedgeRatio, quantity, residualDv01, liquidityScore);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("position", positionDescription)
        .add("instrument", instrumentIdentifier)
        .add("positionDv01", positionDv01)
        .add("instrumentDv01PerUnit", instrumentDv01PerUnit)
        .add("quantity", quantity)
        .add("residualDv01", residualDv01)
        .add("liquidityScore", liquidityScore)
        .toString();
  }

}
