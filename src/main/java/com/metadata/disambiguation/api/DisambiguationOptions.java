package com.metadata.disambiguation.api;

import com.metadata.disambiguation.names.NameCacheConfig;

import java.util.Optional;

/**
 * Options for a disambiguation run.
 * Configures the size limits of fuzzy matching and the taxonomy scope of subject matching.
 */
public class DisambiguationOptions {

    private static final int DEFAULT_MAX_AGENT_RELATIONS = 500;
    private static final int DEFAULT_MAX_NAME_LENGTH = 200;

    private final int maxAgentRelations;
    private final int maxNameLength;
    private final String taxonomySource;
    private final boolean normalizeIdentifiers;
    private final NameCacheConfig nameCache;

    private DisambiguationOptions(Builder builder) {
        this.maxAgentRelations = builder.maxAgentRelations;
        this.maxNameLength = builder.maxNameLength;
        this.taxonomySource = builder.taxonomySource;
        this.normalizeIdentifiers = builder.normalizeIdentifiers;
        this.nameCache = builder.nameCache;
    }

    /**
     * Works with more persisted agent relations than this are skipped by fuzzy relation matching.
     */
    public int getMaxAgentRelations() {
        return maxAgentRelations;
    }

    /**
     * Names longer than this are never parsed or compared.
     */
    public int getMaxNameLength() {
        return maxNameLength;
    }

    /**
     * Source whose custom taxonomy is searched for non-central subjects, if any.
     */
    public Optional<String> getTaxonomySource() {
        return Optional.ofNullable(taxonomySource);
    }

    public boolean isNormalizeIdentifiers() {
        return normalizeIdentifiers;
    }

    public NameCacheConfig getNameCache() {
        return nameCache;
    }

    /**
     * Creates default options.
     */
    public static DisambiguationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxAgentRelations = DEFAULT_MAX_AGENT_RELATIONS;
        private int maxNameLength = DEFAULT_MAX_NAME_LENGTH;
        private String taxonomySource;
        private boolean normalizeIdentifiers = true;
        private NameCacheConfig nameCache = NameCacheConfig.defaults();

        public Builder maxAgentRelations(int maxAgentRelations) {
            this.maxAgentRelations = maxAgentRelations;
            return this;
        }

        public Builder maxNameLength(int maxNameLength) {
            this.maxNameLength = maxNameLength;
            return this;
        }

        public Builder taxonomySource(String taxonomySource) {
            this.taxonomySource = taxonomySource;
            return this;
        }

        public Builder normalizeIdentifiers(boolean normalizeIdentifiers) {
            this.normalizeIdentifiers = normalizeIdentifiers;
            return this;
        }

        public Builder nameCache(NameCacheConfig nameCache) {
            this.nameCache = nameCache;
            return this;
        }

        public DisambiguationOptions build() {
            if (maxAgentRelations < 0) {
                throw new IllegalArgumentException("maxAgentRelations must be >= 0");
            }
            if (maxNameLength <= 0) {
                throw new IllegalArgumentException("maxNameLength must be > 0");
            }
            if (nameCache == null) {
                throw new IllegalArgumentException("nameCache is required");
            }
            if (taxonomySource != null && taxonomySource.isBlank()) {
                taxonomySource = null;
            }
            return new DisambiguationOptions(this);
        }
    }
}
