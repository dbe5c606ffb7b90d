package com.questrail.las.api;

/**
 * Which branch a derivation took for its destination curve.
 */
public enum DeriveOutcome
{
    /** A new curve was appended as the last column. */
    CREATED,

    /** An existing curve's data was replaced; identity and column kept. */
    OVERWRITTEN
}
