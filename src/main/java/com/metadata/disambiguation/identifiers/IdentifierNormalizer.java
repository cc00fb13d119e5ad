package com.metadata.disambiguation.identifiers;

import com.metadata.disambiguation.core.model.Node;
import com.metadata.disambiguation.core.model.NodeGraph;
import com.metadata.disambiguation.metrics.MetricsService;
import com.metadata.disambiguation.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Canonicalizes the URI of work and agent identifier nodes so they can serve as exact match keys.
 *
 * <p>An accepted node keeps exactly three attributes: {@code uri}, {@code host} and {@code scheme}.
 * A node whose URI cannot be parsed, or is disallowed for its kind, is removed from its graph.</p>
 */
public class IdentifierNormalizer {
    private static final Logger log = LoggerFactory.getLogger(IdentifierNormalizer.class);

    public static final String WORK_IDENTIFIER = "workidentifier";
    public static final String AGENT_IDENTIFIER = "agentidentifier";

    private final IriNormalizer iriNormalizer;
    private final Map<String, IdentifierPolicy> policies;
    private final MetricsService metrics;

    public IdentifierNormalizer() {
        this(DefaultIriRules.createDefaultNormalizer(), defaultPolicies(), new NoOpMetricsService());
    }

    public IdentifierNormalizer(IriNormalizer iriNormalizer, Map<String, IdentifierPolicy> policies,
                                MetricsService metrics) {
        this.iriNormalizer = Objects.requireNonNull(iriNormalizer, "iriNormalizer is required");
        this.policies = Map.copyOf(policies);
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
    }

    /**
     * Work identifiers use {@link IdentifierPolicy#forWorks()}, agent identifiers accept everything.
     */
    public static Map<String, IdentifierPolicy> defaultPolicies() {
        return Map.of(
                WORK_IDENTIFIER, IdentifierPolicy.forWorks(),
                AGENT_IDENTIFIER, IdentifierPolicy.acceptAll()
        );
    }

    public boolean handles(Node node) {
        return policies.containsKey(node.getType());
    }

    /**
     * Normalizes one identifier node in place, or removes it from the graph.
     *
     * @throws IllegalArgumentException if the node is not an identifier this normalizer handles
     */
    public NormalizationOutcome normalize(Node node, NodeGraph graph) {
        IdentifierPolicy policy = policies.get(node.getType());
        if (policy == null) {
            throw new IllegalArgumentException("Not an identifier node: " + node.getType());
        }

        String raw = node.attrString("uri");
        NormalizedIri iri;
        try {
            iri = iriNormalizer.normalize(raw);
        } catch (InvalidIriException e) {
            log.warn("Discarding invalid identifier {} with error {}", raw, e.getMessage());
            reject(node, graph, "invalid");
            return NormalizationOutcome.REJECTED;
        }

        if (!policy.accepts(iri)) {
            log.warn("Discarding {} {} as an invalid identifier for {}", iri.authority(), iri.iri(), node.getType());
            reject(node, graph, "disallowed");
            return NormalizationOutcome.REJECTED;
        }

        boolean changed = !iri.iri().equals(raw);
        if (changed) {
            log.debug("Normalized {} to {}", raw, iri.iri());
        }

        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("uri", iri.iri());
        attrs.put("host", iri.authority());
        attrs.put("scheme", iri.scheme());
        node.setAttrs(attrs);

        return changed ? NormalizationOutcome.CHANGED : NormalizationOutcome.ACCEPTED;
    }

    /**
     * Normalizes every identifier node of the graph.
     *
     * @return the number of nodes per outcome
     */
    public Map<NormalizationOutcome, Integer> normalizeAll(NodeGraph graph) {
        Map<NormalizationOutcome, Integer> counts = new EnumMap<>(NormalizationOutcome.class);
        for (NormalizationOutcome outcome : NormalizationOutcome.values()) {
            counts.put(outcome, 0);
        }
        for (Node node : graph) {
            if (handles(node)) {
                counts.merge(normalize(node, graph), 1, Integer::sum);
            }
        }
        log.debug("Identifier normalization: {}", counts);
        return counts;
    }

    private void reject(Node node, NodeGraph graph, String reason) {
        graph.remove(node);
        metrics.incrementIdentifierRejected(reason);
    }
}
