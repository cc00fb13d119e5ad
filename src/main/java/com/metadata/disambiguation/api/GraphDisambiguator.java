package com.metadata.disambiguation.api;

import com.metadata.disambiguation.core.model.MatchSet;
import com.metadata.disambiguation.core.model.Node;
import com.metadata.disambiguation.core.model.NodeGraph;
import com.metadata.disambiguation.graph.CandidateRepository;
import com.metadata.disambiguation.graph.FalkorDBConnection;
import com.metadata.disambiguation.graph.GraphConnection;
import com.metadata.disambiguation.identifiers.DefaultIriRules;
import com.metadata.disambiguation.identifiers.IdentifierNormalizer;
import com.metadata.disambiguation.identifiers.NormalizationOutcome;
import com.metadata.disambiguation.ids.GraphIdResolver;
import com.metadata.disambiguation.logging.LogContext;
import com.metadata.disambiguation.matching.DatabaseMatchingStrategy;
import com.metadata.disambiguation.matching.ManyToOneOutcome;
import com.metadata.disambiguation.matching.MatchingStrategy;
import com.metadata.disambiguation.metrics.MetricsService;
import com.metadata.disambiguation.metrics.NoOpMetricsService;
import com.metadata.disambiguation.names.CachingNameParser;
import com.metadata.disambiguation.names.HumanNameParser;
import com.metadata.disambiguation.names.NameParser;
import com.metadata.disambiguation.schema.SchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Main entry point: matches every node of a harvested graph to the persisted records it refers to.
 *
 * <p>Usage:</p>
 * <pre>
 * try (GraphDisambiguator disambiguator = GraphDisambiguator.builder()
 *         .falkorDB("localhost", 6379, "metadata")
 *         .build()) {
 *     DisambiguationResult result = disambiguator.disambiguate(graph);
 *     if (result instanceof DisambiguationResult.Resolved resolved) {
 *         resolved.matches().getMatches(node);
 *     }
 * }
 * </pre>
 *
 * <p>A run reads the store but never writes to it. The node graph is changed only by identifier
 * normalization, which rewrites identifier URIs and removes unusable identifiers.</p>
 */
public class GraphDisambiguator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(GraphDisambiguator.class);

    private final GraphConnection connection;
    private final boolean ownsConnection;
    private final SchemaRegistry schemas;
    private final MatchingStrategy strategy;
    private final IdentifierNormalizer identifierNormalizer;
    private final DisambiguationOptions options;
    private final MatchingPlan defaultPlan;

    private GraphDisambiguator(Builder builder, MatchingStrategy strategy) {
        this.connection = builder.connection;
        this.ownsConnection = builder.ownsConnection;
        this.schemas = builder.schemas;
        this.strategy = strategy;
        this.identifierNormalizer = builder.identifierNormalizer;
        this.options = builder.options;
        this.defaultPlan = MatchingPlan.defaults(builder.schemas);
    }

    /**
     * Disambiguates a graph with {@link MatchingPlan#defaults(SchemaRegistry)}.
     */
    public DisambiguationResult disambiguate(NodeGraph graph) {
        return disambiguate(graph, defaultPlan);
    }

    /**
     * Disambiguates a graph: normalizes identifiers if enabled, runs the initial pass, then
     * each step of the plan. Stops at the first ambiguous many-to-one match.
     */
    public DisambiguationResult disambiguate(NodeGraph graph, MatchingPlan plan) {
        String runId = LogContext.generateRunId();
        try (LogContext ctx = LogContext.forRun(runId)) {
            log.debug("Disambiguating {} nodes with {} steps", graph.size(), plan.size());

            if (options.isNormalizeIdentifiers()) {
                Map<NormalizationOutcome, Integer> outcomes = identifierNormalizer.normalizeAll(graph);
                if (outcomes.get(NormalizationOutcome.REJECTED) > 0) {
                    log.info("Removed {} unusable identifiers", outcomes.get(NormalizationOutcome.REJECTED));
                }
            }

            MatchSet matches = new MatchSet();
            List<Node> nodes = new ArrayList<>(graph.size());
            graph.forEach(nodes::add);
            strategy.initialPass(nodes, matches);

            for (MatchingStep step : plan.steps()) {
                Optional<ManyToOneOutcome.Ambiguous> conflict = step.run(strategy, graph, schemas, matches);
                if (conflict.isPresent()) {
                    log.warn("Run stopped at {}: {}", step, conflict.get().message());
                    return DisambiguationResult.ambiguous(conflict.get(), matches);
                }
            }

            log.info("Disambiguation complete: {} of {} nodes matched", matches.size(), graph.size());
            return DisambiguationResult.resolved(matches);
        }
    }

    public SchemaRegistry getSchemas() {
        return schemas;
    }

    public DisambiguationOptions getOptions() {
        return options;
    }

    public MatchingStrategy getStrategy() {
        return strategy;
    }

    /**
     * Gets the underlying graph connection, or null when the strategy was supplied directly.
     */
    public GraphConnection getConnection() {
        return connection;
    }

    @Override
    public void close() {
        if (ownsConnection && connection != null) {
            connection.close();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private GraphConnection connection;
        private boolean ownsConnection = false;
        private SchemaRegistry schemas;
        private DisambiguationOptions options = DisambiguationOptions.defaults();
        private NameParser nameParser;
        private IdentifierNormalizer identifierNormalizer;
        private MatchingStrategy matchingStrategy;
        private MetricsService metricsService;

        /**
         * Sets the graph connection to use. The caller keeps ownership of it.
         */
        public Builder graphConnection(GraphConnection connection) {
            this.connection = connection;
            this.ownsConnection = false;
            return this;
        }

        /**
         * Creates a FalkorDB connection with the given parameters.
         * The connection is closed when the disambiguator is closed.
         */
        public Builder falkorDB(String host, int port, String graphName) {
            this.connection = new FalkorDBConnection(host, port, graphName);
            this.ownsConnection = true;
            return this;
        }

        /**
         * Sets the schema registry. Defaults to {@link SchemaRegistry#defaults()}.
         */
        public Builder schemas(SchemaRegistry schemas) {
            this.schemas = schemas;
            return this;
        }

        public Builder options(DisambiguationOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Sets a custom name parser. It is wrapped in a cache according to the options.
         */
        public Builder nameParser(NameParser nameParser) {
            this.nameParser = nameParser;
            return this;
        }

        public Builder identifierNormalizer(IdentifierNormalizer identifierNormalizer) {
            this.identifierNormalizer = identifierNormalizer;
            return this;
        }

        /**
         * Uses the given strategy instead of one backed by the graph connection.
         */
        public Builder matchingStrategy(MatchingStrategy matchingStrategy) {
            this.matchingStrategy = matchingStrategy;
            return this;
        }

        /**
         * Sets a custom metrics service for recording operational metrics.
         * Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public GraphDisambiguator build() {
            if (options == null) {
                throw new IllegalStateException("Options must not be null");
            }
            if (schemas == null) {
                schemas = SchemaRegistry.defaults();
            }
            if (metricsService == null) {
                metricsService = new NoOpMetricsService();
            }
            if (identifierNormalizer == null) {
                identifierNormalizer = new IdentifierNormalizer(
                        DefaultIriRules.createDefaultNormalizer(),
                        IdentifierNormalizer.defaultPolicies(), metricsService);
            }

            MatchingStrategy strategy = matchingStrategy;
            if (strategy == null) {
                if (connection == null) {
                    throw new IllegalStateException("Graph connection or matching strategy must be configured");
                }
                if (!connection.isConnected()) {
                    log.warn("Graph {} is not reachable, lookups will fail until it is", connection.getGraphName());
                }
                CandidateRepository repository = new CandidateRepository(connection, schemas);
                NameParser parser = CachingNameParser.of(
                        nameParser != null ? nameParser : new HumanNameParser(), options.getNameCache());
                strategy = new DatabaseMatchingStrategy(repository, schemas,
                        new GraphIdResolver(repository, schemas), parser, options, metricsService);
            }

            log.info("GraphDisambiguator initialized: graph={} targets={}",
                    connection != null ? connection.getGraphName() : "n/a", schemas.all().size());
            return new GraphDisambiguator(this, strategy);
        }
    }
}
