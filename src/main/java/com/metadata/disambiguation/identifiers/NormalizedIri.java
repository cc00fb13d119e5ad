package com.metadata.disambiguation.identifiers;

import java.util.Objects;

/**
 * Canonical form of an identifier URI and the components derived from it.
 *
 * @param iri       the canonical IRI
 * @param scheme    e.g. {@code http}, {@code urn}, {@code mailto}
 * @param authority host or naming authority, e.g. {@code dx.doi.org}, {@code issn}
 * @param path      the remainder after the authority
 */
public record NormalizedIri(String iri, String scheme, String authority, String path) {

    public NormalizedIri {
        Objects.requireNonNull(iri, "iri is required");
        Objects.requireNonNull(scheme, "scheme is required");
        authority = authority != null ? authority : "";
        path = path != null ? path : "";
    }
}
