/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.market.curve;

import com.opengamma.strata.collect.ArgChecker;

/**
 * The compounding convention linking a zero rate to a discount factor.
 * <p>
 * Rates are in decimal and times in years.
 */
public enum CompoundingConvention {

  /** Annual compounding: DF = (1+z)^-t. */
  ANNUAL {
    @Override
    public double discountFactor(double zeroRate, double time) {
      return Math.pow(1d + zeroRate, -time);
    }

    @Override
    public double zeroRate(double discountFactor, double time) {
      return Math.pow(discountFactor, -1d / time) - 1d;
    }
  },
  /** Semi-annual compounding: DF = (1+z/2)^-2t. */
  SEMIANNUAL {
    @Override
    public double discountFactor(double zeroRate, double time) {
      return Math.pow(1d + 0.5 * zeroRate, -2d * time);
    }

    @Override
    public double zeroRate(double discountFactor, double time) {
      return 2d * (Math.pow(discountFactor, -0.5 / time) - 1d);
    }
  },
  /** Continuous compounding: DF = exp(-zt). */
  CONTINUOUS {
    @Override
    public double discountFactor(double zeroRate, double time) {
      return Math.exp(-zeroRate * time);
    }

    @Override
    public double zeroRate(double discountFactor, double time) {
      return -Math.log(discountFactor) / time;
    }
  };

  /**
   * Returns the discount factor for a zero rate.
   * 
   * @param zeroRate  the zero rate, in decimal
   * @param time  the time in years
   * @return the discount factor
   */
  public abstract double discountFactor(double zeroRate, double time);

  /**
   * Returns the zero rate implied by a discount factor.
   * 
   * @param discountFactor  the discount factor, strictly positive
   * @param time  the time in years, strictly positive
   * @return the zero rate, in decimal
   */
  public abstract double zeroRate(double discountFactor, double time);

  /**
   * Returns the zero rate implied by a discount factor, checking the inputs.
   * 
   * @param discountFactor  the discount factor
   * @param time  the time in years
   * @return the zero rate, in decimal
   */
  public double checkedZeroRate(double discountFactor, double time) {
    ArgChecker.notNegativeOrZero(discountFactor, "discountFactor");
    ArgChecker.notNegativeOrZero(time, "time");
    return zeroRate(discountFactor, time);
  }

}
