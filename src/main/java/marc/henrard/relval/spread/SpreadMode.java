/**
 * Copyright (C) 2026 - present by Marc Henrard.
 */
package marc.henrard.relval.spread;

/**
 * The relative value spread modes.
 */
public enum SpreadMode {

  /** Government yield of an issuer minus the Bund yield, on the issuer grid. */
  GOV_VS_BUND,
  /** Asset swap spread: government zero rate minus the zero swap rate of the same currency. */
  ASSET_SWAP,
  /** Zero swap rate of a currency minus the EUR zero swap rate. */
  IRS_VS_EUR_IRS;

}
