package com.metadata.disambiguation.identifiers;

/**
 * Result of normalizing one identifier node.
 */
public enum NormalizationOutcome {
    /**
     * The URI was already canonical.
     */
    ACCEPTED,

    /**
     * The URI was rewritten to its canonical form.
     */
    CHANGED,

    /**
     * The URI was unparseable or disallowed; the node was removed from its graph.
     */
    REJECTED
}
