package com.metadata.disambiguation.cdi;

import com.metadata.disambiguation.api.DisambiguationOptions;
import com.metadata.disambiguation.api.GraphDisambiguator;
import com.metadata.disambiguation.names.NameCacheConfig;
import com.metadata.disambiguation.schema.SchemaRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * CDI producer that wires the disambiguation library from MicroProfile Config properties.
 *
 * <p>When this class is on the classpath in a CDI container (e.g., Quarkus),
 * it reads configuration from {@code application.yaml} and produces the
 * {@link GraphDisambiguator} with its {@link SchemaRegistry} and {@link DisambiguationOptions}.</p>
 *
 * <h2>Configuration</h2>
 * <pre>
 * disambiguation:
 *   falkordb:
 *     host: localhost
 *     port: 6379
 *     graph-name: metadata
 *   max-agent-relations: 500
 *   max-name-length: 200
 *   taxonomy-source: my-source
 *   normalize-identifiers: true
 *   name-cache:
 *     enabled: true
 *     max-size: 50000
 *   schema-file: /etc/metadata/schema.json
 * </pre>
 */
@ApplicationScoped
public class DisambiguationProducer {

    private static final Logger log = LoggerFactory.getLogger(DisambiguationProducer.class);

    // ── FalkorDB ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "disambiguation.falkordb.host", defaultValue = "localhost")
    String falkordbHost;

    @Inject
    @ConfigProperty(name = "disambiguation.falkordb.port", defaultValue = "6379")
    int falkordbPort;

    @Inject
    @ConfigProperty(name = "disambiguation.falkordb.graph-name", defaultValue = "metadata")
    String falkordbGraphName;

    // ── Matching ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "disambiguation.max-agent-relations", defaultValue = "500")
    int maxAgentRelations;

    @Inject
    @ConfigProperty(name = "disambiguation.max-name-length", defaultValue = "200")
    int maxNameLength;

    @Inject
    @ConfigProperty(name = "disambiguation.taxonomy-source")
    Optional<String> taxonomySource;

    @Inject
    @ConfigProperty(name = "disambiguation.normalize-identifiers", defaultValue = "true")
    boolean normalizeIdentifiers;

    @Inject
    @ConfigProperty(name = "disambiguation.schema-file")
    Optional<String> schemaFile;

    // ── Name cache ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "disambiguation.name-cache.enabled", defaultValue = "true")
    boolean nameCacheEnabled;

    @Inject
    @ConfigProperty(name = "disambiguation.name-cache.max-size", defaultValue = "50000")
    int nameCacheMaxSize;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public SchemaRegistry schemaRegistry() {
        if (schemaFile.isEmpty()) {
            return SchemaRegistry.defaults();
        }
        Path path = Path.of(schemaFile.get());
        log.info("Loading target schemas from {}", path);
        try (InputStream in = Files.newInputStream(path)) {
            return SchemaRegistry.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read schema file " + path, e);
        }
    }

    @Produces
    @ApplicationScoped
    public DisambiguationOptions disambiguationOptions() {
        DisambiguationOptions options = DisambiguationOptions.builder()
                .maxAgentRelations(maxAgentRelations)
                .maxNameLength(maxNameLength)
                .taxonomySource(taxonomySource.orElse(null))
                .normalizeIdentifiers(normalizeIdentifiers)
                .nameCache(nameCacheEnabled
                        ? new NameCacheConfig(nameCacheMaxSize, true)
                        : NameCacheConfig.disabled())
                .build();
        log.info("Disambiguation options: maxAgentRelations={} maxNameLength={} taxonomySource={}",
                options.getMaxAgentRelations(), options.getMaxNameLength(),
                options.getTaxonomySource().orElse("<none>"));
        return options;
    }

    @Produces
    @ApplicationScoped
    public GraphDisambiguator graphDisambiguator(SchemaRegistry schemas, DisambiguationOptions options) {
        log.info("Producing GraphDisambiguator: falkordb={}:{}/{}", falkordbHost, falkordbPort, falkordbGraphName);
        return GraphDisambiguator.builder()
                .falkorDB(falkordbHost, falkordbPort, falkordbGraphName)
                .schemas(schemas)
                .options(options)
                .build();
    }

    public void closeDisambiguator(@Disposes GraphDisambiguator disambiguator) {
        log.info("Closing GraphDisambiguator");
        disambiguator.close();
    }
}
