/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.engine;

import java.util.List;
import java.util.OptionalDouble;

import com.google.common.base.MoreObjects;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.opengamma.strata.basics.currency.Currency;
import com.opengamma.strata.basics.date.Tenor;
import com.opengamma.strata.collect.ArgChecker;
import com.opengamma.strata.collect.io.IniFile;
import com.opengamma.strata.collect.io.PropertySet;
import com.opengamma.strata.collect.io.ResourceLocator;

import marc.henrard.relval.carry.CarryRollHorizon;
import marc.henrard.relval.market.curve.AlignmentPolicy;
import marc.henrard.relval.market.curve.CompoundingConvention;
import marc.henrard.relval.shape.FlyDefinition;
import marc.henrard.relval.shape.TenorPair;

/**
 * The settings of a {@link RelativeValueEngine} cycle.
 * <p>
 * The standard settings are loaded from {@code config/relative-value.ini}; any value can be changed with
 * {@link #toBuilder()}.
 *
 * @author Marc Henrard
 */
public final class RelativeValueSettings {

  private static final String STANDARD_RESOURCE = "config/relative-value.ini";
  private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  private final String referenceIssuer;
  private final Currency referenceSwapCurrency;
  private final CompoundingConvention bondCompounding;
  private final CompoundingConvention swapCompounding;
  private final AlignmentPolicy bootstrapPolicy;
  private final AlignmentPolicy govVsBundPolicy;
  private final AlignmentPolicy assetSwapPolicy;
  private final AlignmentPolicy swapSpreadPolicy;
  private final AlignmentPolicy shapePolicy;
  private final ImmutableList<Tenor> matrixTenors;
  private final ImmutableList<TenorPair> pairs;
  private final ImmutableList<FlyDefinition> flies;
  private final ImmutableList<CarryRollHorizon> horizons;
  /** The carry funding rate, empty for the shortest rate of each curve. */
  private final OptionalDouble fundingRate;

  private RelativeValueSettings(Builder builder) {
    this.referenceIssuer = ArgChecker.notBlank(builder.referenceIssuer, "referenceIssuer");
    this.referenceSwapCurrency = ArgChecker.notNull(builder.referenceSwapCurrency, "referenceSwapCurrency");
    this.bondCompounding = ArgChecker.notNull(builder.bondCompounding, "bondCompounding");
    this.swapCompounding = ArgChecker.notNull(builder.swapCompounding, "swapCompounding");
    this.bootstrapPolicy = ArgChecker.notNull(builder.bootstrapPolicy, "bootstrapPolicy");
    this.govVsBundPolicy = ArgChecker.notNull(builder.govVsBundPolicy, "govVsBundPolicy");
    this.assetSwapPolicy = ArgChecker.notNull(builder.assetSwapPolicy, "assetSwapPolicy");
    this.swapSpreadPolicy = ArgChecker.notNull(builder.swapSpreadPolicy, "swapSpreadPolicy");
    this.shapePolicy = ArgChecker.notNull(builder.shapePolicy, "shapePolicy");
    this.matrixTenors = ImmutableList.copyOf(ArgChecker.notEmpty(builder.matrixTenors, "matrixTenors"));
    this.pairs = ImmutableList.copyOf(ArgChecker.noNulls(builder.pairs, "pairs"));
    this.flies = ImmutableList.copyOf(ArgChecker.noNulls(builder.flies, "flies"));
    this.horizons = ImmutableList.copyOf(ArgChecker.noNulls(builder.horizons, "horizons"));
    this.fundingRate = ArgChecker.notNull(builder.fundingRate, "fundingRate");
  }

  /**
   * Returns the standard settings.
   *
   * @return the settings
   */
  public static RelativeValueSettings standard() {
    return load(ResourceLocator.ofClasspath(STANDARD_RESOURCE));
  }

  /**
   * Loads the settings from an INI file.
   * <p>
   * The file has the sections {@code [curves]}, {@code [spreads]}, {@code [shape]} and {@code [carry]}.
   *
   * @param resource  the INI resource
   * @return the settings
   * @throws IllegalArgumentException if a key is missing or a value cannot be parsed
   */
  public static RelativeValueSettings load(ResourceLocator resource) {
    ArgChecker.notNull(resource, "resource");
    IniFile ini = IniFile.of(resource.getCharSource());
    PropertySet curves = ini.section("curves");
    PropertySet spreads = ini.section("spreads");
    PropertySet shape = ini.section("shape");
    PropertySet carry = ini.section("carry");
    Builder builder = new Builder()
        .referenceIssuer(curves.value("referenceIssuer"))
        .referenceSwapCurrency(Currency.of(curves.value("referenceSwapCurrency")))
        .bondCompounding(CompoundingConvention.valueOf(curves.value("bondCompounding")))
        .swapCompounding(CompoundingConvention.valueOf(curves.value("swapCompounding")))
        .bootstrapPolicy(AlignmentPolicy.valueOf(curves.value("bootstrapPolicy")))
        .govVsBundPolicy(AlignmentPolicy.valueOf(spreads.value("govVsBundPolicy")))
        .assetSwapPolicy(AlignmentPolicy.valueOf(spreads.value("assetSwapPolicy")))
        .swapSpreadPolicy(AlignmentPolicy.valueOf(spreads.value("swapSpreadPolicy")))
        .shapePolicy(AlignmentPolicy.valueOf(shape.value("shapePolicy")));
    ImmutableList.Builder<Tenor> tenors = ImmutableList.builder();
    for (String tenor : LIST_SPLITTER.split(spreads.value("matrixTenors"))) {
      tenors.add(Tenor.parse(tenor));
    }
    ImmutableList.Builder<TenorPair> pairs = ImmutableList.builder();
    for (String pair : LIST_SPLITTER.split(shape.value("pairs"))) {
      pairs.add(TenorPair.parse(pair));
    }
    ImmutableList.Builder<FlyDefinition> flies = ImmutableList.builder();
    for (String fly : LIST_SPLITTER.split(shape.value("flies"))) {
      flies.add(FlyDefinition.parse(fly));
    }
    ImmutableList.Builder<CarryRollHorizon> horizons = ImmutableList.builder();
    for (String horizon : LIST_SPLITTER.split(carry.value("horizons"))) {
      horizons.add(CarryRollHorizon.of(horizon));
    }
    String funding = carry.contains("fundingRate") ? carry.value("fundingRate").trim() : "";
    return builder
        .matrixTenors(tenors.build())
        .pairs(pairs.build())
        .flies(flies.build())
        .horizons(horizons.build())
        .fundingRate(funding.isEmpty() ? OptionalDouble.empty() : OptionalDouble.of(Double.parseDouble(funding)))
        .build();
  }

  /**
   * Returns a builder initialized with these settings.
   *
   * @return the builder
   */
  public Builder toBuilder() {
    return new Builder()
        .referenceIssuer(referenceIssuer)
        .referenceSwapCurrency(referenceSwapCurrency)
        .bondCompounding(bondCompounding)
        .swapCompounding(swapCompounding)
        .bootstrapPolicy(bootstrapPolicy)
        .govVsBundPolicy(govVsBundPolicy)
        .assetSwapPolicy(assetSwapPolicy)
        .swapSpreadPolicy(swapSpreadPolicy)
        .shapePolicy(shapePolicy)
        .matrixTenors(matrixTenors)
        .pairs(pairs)
        .flies(flies)
        .horizons(horizons)
        .fundingRate(fundingRate);
  }

  //-------------------------------------------------------------------------
  /**
   * The issuer of the reference curve for government spreads, like "Germany".
   *
   * @return the issuer
   */
  public String getReferenceIssuer() {
    return referenceIssuer;
  }

  /**
   * The currency of the reference swap curve for swap versus swap spreads.
   *
   * @return the currency
   */
  public Currency getReferenceSwapCurrency() {
    return referenceSwapCurrency;
  }

  public CompoundingConvention getBondCompounding() {
    return bondCompounding;
  }

  public CompoundingConvention getSwapCompounding() {
    return swapCompounding;
  }

  public AlignmentPolicy getBootstrapPolicy() {
    return bootstrapPolicy;
  }

  public AlignmentPolicy getGovVsBundPolicy() {
    return govVsBundPolicy;
  }

  public AlignmentPolicy getAssetSwapPolicy() {
    return assetSwapPolicy;
  }

  public AlignmentPolicy getSwapSpreadPolicy() {
    return swapSpreadPolicy;
  }

  public AlignmentPolicy getShapePolicy() {
    return shapePolicy;
  }

  public ImmutableList<Tenor> getMatrixTenors() {
    return matrixTenors;
  }

  public ImmutableList<TenorPair> getPairs() {
    return pairs;
  }

  public ImmutableList<FlyDefinition> getFlies() {
    return flies;
  }

  public ImmutableList<CarryRollHorizon> getHorizons() {
    return horizons;
  }

  public OptionalDouble getFundingRate() {
    return fundingRate;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("referenceIssuer", referenceIssuer)
        .add("referenceSwapCurrency", referenceSwapCurrency)
        .add("bondCompounding", bondCompounding)
        .add("swapCompounding", swapCompounding)
        .add("bootstrapPolicy", bootstrapPolicy)
        .add("govVsBundPolicy", govVsBundPolicy)
        .add("assetSwapPolicy", assetSwapPolicy)
        .add("swapSpreadPolicy", swapSpreadPolicy)
        .add("shapePolicy", shapePolicy)
        .add("matrixTenors", matrixTenors)
        .add("pairs", pairs)
        .add("flies", flies)
        .add("horizons", horizons)
        .add("fundingRate", fundingRate)
        .toString();
  }

  //-------------------------------------------------------------------------
  /**
   * Builder for {@link RelativeValueSettings}.
   */
  public static final class Builder {

    private String referenceIssuer;
    private Currency referenceSwapCurrency;
    private CompoundingConvention bondCompounding;
    private CompoundingConvention swapCompounding;
    private AlignmentPolicy bootstrapPolicy;
    private AlignmentPolicy govVsBundPolicy;
    private AlignmentPolicy assetSwapPolicy;
    private AlignmentPolicy swapSpreadPolicy;
    private AlignmentPolicy shapePolicy;
    private List<Tenor> matrixTenors;
    private List<TenorPair> pairs;
    private List<FlyDefinition> flies;
    private List<CarryRollHorizon> horizons;
    private OptionalDouble fundingRate = OptionalDouble.empty();

    private Builder() {
    }

    public Builder referenceIssuer(String referenceIssuer) {
      this.referenceIssuer = referenceIssuer;
      return this;
    }

    public Builder referenceSwapCurrency(Currency referenceSwapCurrency) {
      this.referenceSwapCurrency = referenceSwapCurrency;
      return this;
    }

    public Builder bondCompounding(CompoundingConvention bondCompounding) {
      this.bondCompounding = bondCompounding;
      return this;
    }

    public Builder swapCompounding(CompoundingConvention swapCompounding) {
      this.swapCompounding = swapCompounding;
      return this;
    }

    public Builder bootstrapPolicy(AlignmentPolicy bootstrapPolicy) {
      this.bootstrapPolicy = bootstrapPolicy;
      return this;
    }

    public Builder govVsBundPolicy(AlignmentPolicy govVsBundPolicy) {
      this.govVsBundPolicy = govVsBundPolicy;
      return this;
    }

    public Builder assetSwapPolicy(AlignmentPolicy assetSwapPolicy) {
      this.assetSwapPolicy = assetSwapPolicy;
      return this;
    }

    public Builder swapSpreadPolicy(AlignmentPolicy swapSpreadPolicy) {
      this.swapSpreadPolicy = swapSpreadPolicy;
      return this;
    }

    public Builder shapePolicy(AlignmentPolicy shapePolicy) {
      this.shapePolicy = shapePolicy;
      return this;
    }

    public Builder matrixTenors(List<Tenor> matrixTenors) {
      this.matrixTenors = matrixTenors;
      return this;
    }

    public Builder pairs(List<TenorPair> pairs) {
      this.pairs = pairs;
      return this;
    }

    public Builder flies(List<FlyDefinition> flies) {
      this.flies = flies;
      return this;
    }

    public Builder horizons(List<CarryRollHorizon> horizons) {
      this.horizons = horizons;
      return this;
    }

    public Builder fundingRate(OptionalDouble fundingRate) {
      this.fundingRate = fundingRate;
      return this;
    }

    public RelativeValueSettings build() {
      return new RelativeValueSettings(this);
    }
  }

}
