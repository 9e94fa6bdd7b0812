/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.market.curve;

import java.util.Objects;

import com.google.common.base.MoreObjects;
import com.opengamma.strata.basics.schedule.Frequency;
import com.opengamma.strata.collect.ArgChecker;

import marc.henrard.relval.basics.TenorUtils;

/**
 * The conventions passed to each bond curve bootstrap.
 * <p>
 * The compounding convention of the zero rates, the coupon frequency of the bonds and the alignment policy
 * used to obtain the discount factors of intermediate coupon dates.
 */
public final class CurveBootstrapSettings {

  private final CompoundingConvention compounding;
  private final Frequency frequency;
  private final AlignmentPolicy policy;

  private CurveBootstrapSettings(CompoundingConvention compounding, Frequency frequency, AlignmentPolicy policy) {
    this.compounding = ArgChecker.notNull(compounding, "compounding");
    this.frequency = TenorUtils.checkMonthBased(frequency, "frequency");
    this.policy = ArgChecker.notNull(policy, "policy");
  }

  /**
   * Obtains the settings.
   *
   * @param compounding  the compounding convention of the zero rates
   * @param frequency  the coupon frequency
   * @param policy  the alignment policy for intermediate coupon dates
   * @return the settings
   */
  public static CurveBootstrapSettings of(
      CompoundingConvention compounding,
      Frequency frequency,
      AlignmentPolicy policy) {

    return new CurveBootstrapSettings(compounding, frequency, policy);
  }

  /**
   * Obtains the settings with nearest alignment.
   *
   * @param compounding  the compounding convention of the zero rates
   * @param frequency  the coupon frequency
   * @return the settings
   */
  public static CurveBootstrapSettings of(CompoundingConvention compounding, Frequency frequency) {
    return new CurveBootstrapSettings(compounding, frequency, AlignmentPolicy.NEAREST);
  }

  public CompoundingConvention getCompounding() {
    return compounding;
  }

  public Frequency getFrequency() {
    return frequency;
  }

  public AlignmentPolicy getPolicy() {
    return policy;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || obj.getClass() != getClass()) {
      return false;
    }
    CurveBootstrapSettings other = (CurveBootstrapSettings) obj;
    return compounding == other.compounding && frequency.equals(other.frequency) && policy == other.policy;
  }

  @Override
  public int hashCode() {
    return Objects.hash(compounding, frequency, policy);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("compounding", compounding)
        .add("frequency", frequency)
        .add("policy", policy)
        .toString();
  }

}
