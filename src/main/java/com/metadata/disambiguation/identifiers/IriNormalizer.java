package com.metadata.disambiguation.identifiers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Canonicalizes raw identifier strings into IRIs by applying {@link IriRule}s in priority order.
 * Normalization is a fixed point: normalizing an already canonical IRI returns it unchanged.
 */
public class IriNormalizer {
    private static final Logger log = LoggerFactory.getLogger(IriNormalizer.class);

    private final List<IriRule> rules;

    public IriNormalizer(List<IriRule> rules) {
        this.rules = new ArrayList<>(rules);
        this.rules.sort(Comparator.comparingInt(IriRule::getPriority));
    }

    public List<IriRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Normalizes a raw identifier.
     *
     * @param raw the identifier as harvested
     * @return the canonical IRI with its derived scheme and authority
     * @throws InvalidIriException if no rule recognizes the input or the recognizing rule rejects it
     */
    public NormalizedIri normalize(String raw) throws InvalidIriException {
        if (raw == null || raw.isBlank()) {
            throw new InvalidIriException("Identifier must not be null or blank");
        }
        String input = raw.trim();
        for (IriRule rule : rules) {
            if (rule.matches(input)) {
                NormalizedIri result = rule.normalize(input);
                log.trace("Rule '{}' normalized '{}' -> '{}'", rule.getName(), input, result.iri());
                return result;
            }
        }
        throw new InvalidIriException("Unrecognized identifier: " + raw);
    }
}
