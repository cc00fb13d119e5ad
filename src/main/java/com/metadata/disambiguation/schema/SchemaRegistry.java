package com.metadata.disambiguation.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of {@link TargetSchema}s, loaded from a JSON description.
 * Schemas are addressed by short name, by any of their subtypes, or by type code.
 */
public class SchemaRegistry {
    private static final Logger log = LoggerFactory.getLogger(SchemaRegistry.class);

    public static final String DEFAULT_RESOURCE = "/disambiguation-schema.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String appLabel;
    private final Map<String, TargetSchema> byName = new LinkedHashMap<>();
    private final Map<String, TargetSchema> bySubtype = new LinkedHashMap<>();
    private final Map<Integer, TargetSchema> byTypeCode = new LinkedHashMap<>();

    public SchemaRegistry(String appLabel, List<TargetSchema> schemas) {
        this.appLabel = appLabel;
        for (TargetSchema schema : schemas) {
            TargetSchema labelled = schema.withAppLabel(appLabel);
            if (byName.put(labelled.name(), labelled) != null) {
                throw new IllegalArgumentException("Duplicate schema: " + labelled.name());
            }
            if (byTypeCode.put(labelled.typeCode(), labelled) != null) {
                throw new IllegalArgumentException("Duplicate type code: " + labelled.typeCode());
            }
            for (String subtype : labelled.subtypes()) {
                bySubtype.put(subtype, labelled);
            }
        }
    }

    /**
     * Loads the bundled schema description.
     */
    public static SchemaRegistry defaults() {
        try (InputStream in = SchemaRegistry.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing schema resource " + DEFAULT_RESOURCE);
            }
            return load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read schema resource " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Loads a schema description from JSON.
     */
    public static SchemaRegistry load(InputStream in) throws IOException {
        SchemaDocument document = MAPPER.readValue(in, SchemaDocument.class);
        SchemaRegistry registry = new SchemaRegistry(document.appLabel(),
                document.targets() != null ? document.targets() : List.of());
        log.debug("Loaded {} target schemas for app '{}'", registry.byName.size(), document.appLabel());
        return registry;
    }

    public String getAppLabel() {
        return appLabel;
    }

    /**
     * Returns the schema with the given short name or subtype.
     *
     * @throws IllegalArgumentException if nothing matches
     */
    public TargetSchema get(String nameOrSubtype) {
        TargetSchema schema = byName.get(nameOrSubtype);
        if (schema == null) {
            schema = bySubtype.get(nameOrSubtype);
        }
        if (schema == null) {
            throw new IllegalArgumentException("Unknown target schema: " + nameOrSubtype);
        }
        return schema;
    }

    /**
     * Returns the schema storing nodes of the given concrete type.
     */
    public Optional<TargetSchema> forNodeType(String type) {
        return Optional.ofNullable(bySubtype.get(type));
    }

    public Optional<TargetSchema> byTypeCode(int typeCode) {
        return Optional.ofNullable(byTypeCode.get(typeCode));
    }

    public Collection<TargetSchema> all() {
        return List.copyOf(byName.values());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SchemaDocument(String appLabel, List<TargetSchema> targets) {
    }
}
