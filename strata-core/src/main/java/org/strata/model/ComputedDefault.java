package org.strata.model;

/**
 * Defaults that are computed by the row-insertion layer at write time.
 */
public enum ComputedDefault {
    NOW,
    TRUE,
    FALSE,
    EMPTY_ARRAY,
    EMPTY_OBJECT
}
