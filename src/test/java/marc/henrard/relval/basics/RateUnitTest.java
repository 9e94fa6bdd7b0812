/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.basics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

import org.junit.jupiter.api.Test;

/**
 * Tests {@link RateUnit}.
 */
public class RateUnitTest {

  private static final double TOLERANCE = 1.0E-12;

  @Test
  public void conversions() {
    assertThat(RateUnit.PERCENT.toDecimal(2.5)).isCloseTo(0.025, offset(TOLERANCE));
    assertThat(RateUnit.DECIMAL.toDecimal(0.025)).isEqualTo(0.025);
    assertThat(RateUnit.PERCENT.fromDecimal(0.025)).isCloseTo(2.5, offset(TOLERANCE));
    assertThat(RateUnit.DECIMAL.convert(0.031, RateUnit.PERCENT)).isCloseTo(3.1, offset(TOLERANCE));
    assertThat(RateUnit.PERCENT.convert(3.1, RateUnit.PERCENT)).isEqualTo(3.1);
  }

  @Test
  public void basis_points() {
    assertThat(RateUnit.PERCENT.toBasisPoints(0.5)).isCloseTo(50d, offset(TOLERANCE));
    assertThat(RateUnit.DECIMAL.toBasisPoints(0.005)).isCloseTo(50d, offset(TOLERANCE));
    assertThat(RateUnit.PERCENT.fromBasisPoints(1d)).isCloseTo(0.01, offset(TOLERANCE));
    assertThat(RateUnit.DECIMAL.fromBasisPoints(1d)).isCloseTo(0.0001, offset(TOLERANCE));
  }

}
