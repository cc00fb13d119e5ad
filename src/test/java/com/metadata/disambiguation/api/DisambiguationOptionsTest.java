package com.metadata.disambiguation.api;

import com.metadata.disambiguation.names.NameCacheConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DisambiguationOptions Tests")
class DisambiguationOptionsTest {

    @Test
    @DisplayName("Defaults should match harvester limits")
    void defaults() {
        DisambiguationOptions options = DisambiguationOptions.defaults();

        assertEquals(500, options.getMaxAgentRelations());
        assertEquals(200, options.getMaxNameLength());
        assertEquals(Optional.empty(), options.getTaxonomySource());
        assertTrue(options.isNormalizeIdentifiers());
        assertEquals(NameCacheConfig.defaults(), options.getNameCache());
    }

    @Test
    @DisplayName("Builder should carry every option")
    void builder() {
        DisambiguationOptions options = DisambiguationOptions.builder()
                .maxAgentRelations(10)
                .maxNameLength(50)
                .taxonomySource("my-source")
                .normalizeIdentifiers(false)
                .nameCache(NameCacheConfig.disabled())
                .build();

        assertEquals(10, options.getMaxAgentRelations());
        assertEquals(50, options.getMaxNameLength());
        assertEquals(Optional.of("my-source"), options.getTaxonomySource());
        assertFalse(options.isNormalizeIdentifiers());
        assertEquals(NameCacheConfig.disabled(), options.getNameCache());
    }

    @Test
    @DisplayName("Blank taxonomy source should mean no source")
    void blankTaxonomySource() {
        DisambiguationOptions options = DisambiguationOptions.builder().taxonomySource("  ").build();

        assertTrue(options.getTaxonomySource().isEmpty());
    }

    @Test
    @DisplayName("Invalid limits should be refused")
    void invalidLimits() {
        assertThrows(IllegalArgumentException.class,
                () -> DisambiguationOptions.builder().maxAgentRelations(-1).build());
        assertThrows(IllegalArgumentException.class,
                () -> DisambiguationOptions.builder().maxNameLength(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> DisambiguationOptions.builder().nameCache(null).build());
    }
}
