/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.market.quote;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

import com.google.common.base.MoreObjects;
import com.opengamma.strata.collect.ArgChecker;
import com.opengamma.strata.market.observable.QuoteId;

import marc.henrard.relval.basics.RateUnit;
import marc.henrard.relval.basics.TenorUtils;

/**
 * A par rate quote for one instrument in one snapshot.
 * <p>
 * The identifier is the issuer (for government bonds) or the currency (for swaps).
 * The rate is tagged with its unit. The market metadata (previous close, high, low, change, time) is optional.
 */
public final class Quote {

  private final String identifier;
  private final String tenorLabel;
  private final double tenorYears;
  private final double rate;
  private final RateUnit unit;
  private final Double previous;
  private final Double high;
  private final Double low;
  private final Double change;
  private final Instant timestamp;

  private Quote(Builder builder) {
    ArgChecker.notBlank(builder.identifier, "identifier");
    ArgChecker.notBlank(builder.tenorLabel, "tenorLabel");
    ArgChecker.notNull(builder.unit, "unit");
    ArgChecker.isFalse(Double.isNaN(builder.rate), "Rate of '{}' {} is not a number", builder.identifier,
        builder.tenorLabel);
    this.identifier = builder.identifier;
    this.tenorLabel = builder.tenorLabel.trim().toUpperCase();
    this.tenorYears = builder.tenorYears != null ? builder.tenorYears : TenorUtils.years(this.tenorLabel);
    ArgChecker.notNegativeOrZero(this.tenorYears, "tenorYears");
    this.rate = builder.rate;
    this.unit = builder.unit;
    this.previous = builder.previous;
    this.high = builder.high;
    this.low = builder.low;
    this.change = builder.change;
    this.timestamp = builder.timestamp;
  }

  /**
   * Obtains a quote without market metadata.
   * <p>
   * The tenor in years is derived from the label.
   *
   * @param identifier  the issuer or currency
   * @param tenorLabel  the tenor label, like "10Y"
   * @param rate  the par rate
   * @param unit  the unit of the rate
   * @return the quote
   */
  public static Quote of(String identifier, String tenorLabel, double rate, RateUnit unit) {
    return builder().identifier(identifier).tenorLabel(tenorLabel).rate(rate).unit(unit).build();
  }

  /**
   * Returns a builder.
   *
   * @return the builder
   */
  public static Builder builder() {
    return new Builder();
  }

  //-------------------------------------------------------------------------
  public String getIdentifier() {
    return identifier;
  }

  public String getTenorLabel() {
    return tenorLabel;
  }

  public double getTenorYears() {
    return tenorYears;
  }

  public double getRate() {
    return rate;
  }

  public RateUnit getUnit() {
    return unit;
  }

  public OptionalDouble getPrevious() {
    return optional(previous);
  }

  public OptionalDouble getHigh() {
    return optional(high);
  }

  public OptionalDouble getLow() {
    return optional(low);
  }

  public OptionalDouble getChange() {
    return optional(change);
  }

  public Optional<Instant> getTimestamp() {
    return Optional.ofNullable(timestamp);
  }

  /**
   * Returns the ticker of the quoted instrument.
   *
   * @return the ticker
   */
  public QuoteId getTicker() {
    return TickerUtils.parRate(identifier, tenorLabel);
  }

  private static OptionalDouble optional(Double value) {
    return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
  }

  //-------------------------------------------------------------------------
  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || obj.getClass() != getClass()) {
      return false;
    }
    Quote other = (Quote) obj;
    return identifier.equals(other.identifier) &&
        tenorLabel.equals(other.tenorLabel) &&
        Double.compare(tenorYears, other.tenorYears) == 0 &&
        Double.compare(rate, other.rate) == 0 &&
        unit == other.unit &&
        Objects.equals(previous, other.previous) &&
        Objects.equals(high, other.high) &&
        Objects.equals(low, other.low) &&
        Objects.equals(change, other.change) &&
        Objects.equals(timestamp, other.timestamp);
  }

  @Override
  public int hashCode() {
    return Objects.hash(identifier, tenorLabel, tenorYears, rate, unit, previous, high, low, change, timestamp);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("identifier", identifier)
        .add("tenor", tenorLabel)
        .add("rate", rate)
        .add("unit", unit)
        .add("previous", previous)
        .add("high", high)
        .add("low", low)
        .add("change", change)
        .add("timestamp", timestamp)
        .omitNullValues()
        .toString();
  }

  //-------------------------------------------------------------------------
  /**
   * Builder for {@link Quote}.
   */
  public static final class Builder {

    private String identifier;
    private String tenorLabel;
    private Double tenorYears;
    private double rate = Double.NaN;
    private RateUnit unit;
    private Double previous;
    private Double high;
    private Double low;
    private Double change;
    private Instant timestamp;

    private Builder() {
    }

    public Builder identifier(String identifier) {
      this.identifier = identifier;
      return this;
    }

    public Builder tenorLabel(String tenorLabel) {
      this.tenorLabel = tenorLabel;
      return this;
    }

    /**
     * Sets the tenor in years explicitly, instead of deriving it from the label.
     *
     * @param tenorYears  the tenor in years
     * @return this builder
     */
    public Builder tenorYears(double tenorYears) {
      this.tenorYears = tenorYears;
      return this;
    }

    public Builder rate(double rate) {
      this.rate = rate;
      return this;
    }

    public Builder unit(RateUnit unit) {
      this.unit = unit;
      return this;
    }

    public Builder previous(Double previous) {
      this.previous = previous;
      return this;
    }

    public Builder high(Double high) {
      this.high = high;
      return this;
    }

    public Builder low(Double low) {
      this.low = low;
      return this;
    }

    public Builder change(Double change) {
      this.change = change;
      return this;
    }

    public Builder timestamp(Instant timestamp) {
      this.timestamp = timestamp;
      return this;
    }

    public Quote build() {
      return new Quote(this);
    }
  }

}
