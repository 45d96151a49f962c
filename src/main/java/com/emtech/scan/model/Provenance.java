package com.emtech.scan.model;

/**
 * How a canonical token was chosen during the consensus merge.
 */
public enum Provenance {
    /** Both engines produced the same token. */
    AGREED,
    /** Engines disagreed and the token with the higher reported confidence won. */
    CONFIDENCE_PREFERRED,
    /** Engines disagreed without usable confidences and the primary engine won. */
    PRIMARY_PREFERRED,
    /** Only one engine produced the token. */
    EXCLUSIVE,
    /** The other engine could not be invoked for this page. */
    SINGLE_ENGINE
}
