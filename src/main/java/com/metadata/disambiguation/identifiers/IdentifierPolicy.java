package com.metadata.disambiguation.identifiers;

import java.util.Locale;
import java.util.Set;

/**
 * Acceptance rules for normalized identifiers of one kind.
 *
 * @param disallowedAuthorities authorities that may not stand in for the identified entity
 * @param disallowedSchemes     schemes that may not stand in for the identified entity
 */
public record IdentifierPolicy(Set<String> disallowedAuthorities, Set<String> disallowedSchemes) {

    public IdentifierPolicy {
        disallowedAuthorities = disallowedAuthorities != null ? Set.copyOf(disallowedAuthorities) : Set.of();
        disallowedSchemes = disallowedSchemes != null ? Set.copyOf(disallowedSchemes) : Set.of();
    }

    /**
     * Work identifiers may not be ISSNs, ORCIDs or e-mail addresses.
     */
    public static IdentifierPolicy forWorks() {
        return new IdentifierPolicy(Set.of("issn", "orcid.org"), Set.of("mailto"));
    }

    /**
     * Agent identifiers accept every recognizable IRI.
     */
    public static IdentifierPolicy acceptAll() {
        return new IdentifierPolicy(Set.of(), Set.of());
    }

    public boolean accepts(NormalizedIri iri) {
        return !disallowedAuthorities.contains(iri.authority().toLowerCase(Locale.ROOT))
                && !disallowedSchemes.contains(iri.scheme().toLowerCase(Locale.ROOT));
    }
}
