package eu.bde.sarchannel.metadata;

/**
 * Calibrated backscatter measures, related to each other through the incidence angle.
 */
public enum RadiometricQuantity {
    BETA_NOUGHT,
    SIGMA_NOUGHT,
    GAMMA_NOUGHT
}
