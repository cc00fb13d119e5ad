package com.metadata.disambiguation.api;

import com.metadata.disambiguation.core.model.Candidate;
import com.metadata.disambiguation.core.model.Node;
import com.metadata.disambiguation.core.model.NodeGraph;
import com.metadata.disambiguation.graph.FakeGraphStore;
import com.metadata.disambiguation.matching.MatchingStrategy;
import com.metadata.disambiguation.metrics.MetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

@DisplayName("GraphDisambiguator Tests")
class GraphDisambiguatorTest {

    private FakeGraphStore store;
    private NodeGraph graph;

    @BeforeEach
    void setUp() {
        store = new FakeGraphStore();
        graph = new NodeGraph();
    }

    private Node node(String id, String type, Object... keyValues) {
        Node.Builder builder = Node.builder().id(id).type(type);
        for (int i = 0; i < keyValues.length; i += 2) {
            builder.attr((String) keyValues[i], keyValues[i + 1]);
        }
        return graph.add(builder.build());
    }

    private static Set<Long> ids(Set<Candidate> candidates) {
        Set<Long> ids = new HashSet<>();
        candidates.forEach(c -> ids.add(c.id()));
        return ids;
    }

    private GraphDisambiguator disambiguator(DisambiguationOptions options) {
        return GraphDisambiguator.builder()
                .graphConnection(store)
                .options(options)
                .build();
    }

    @Test
    @DisplayName("Should match works through their normalized identifiers")
    void resolvesThroughIdentifiers() {
        store.add("WorkIdentifier", 1, "share.workidentifier",
                        "uri", "http://example.com/Foo", "creative_work_id", 9L)
                .add("CreativeWork", 9, "share.article", "title", "A study");
        Node work = node("_:w", "article", "title", "A study");
        Node identifier = node("_:i", "workidentifier", "uri", "HTTP://Example.com/Foo");
        graph.connect(identifier, "creative_work", work, "identifiers");

        try (GraphDisambiguator disambiguator = disambiguator(DisambiguationOptions.defaults())) {
            DisambiguationResult result = disambiguator.disambiguate(graph);

            assertTrue(result.isResolved());
            assertEquals("http://example.com/Foo", identifier.attr("uri"));
            assertEquals(Set.of(1L), ids(result.matches().getMatches(identifier)));
            assertEquals(Set.of(9L), ids(result.matches().getMatches(work)));
        }
    }

    @Test
    @DisplayName("Should remove disallowed identifiers before matching")
    void removesDisallowedIdentifiers() {
        Node work = node("_:w", "article");
        Node mail = node("_:i", "workidentifier", "uri", "mailto:someone@example.com");
        graph.connect(mail, "creative_work", work, "identifiers");

        try (GraphDisambiguator disambiguator = disambiguator(DisambiguationOptions.defaults())) {
            DisambiguationResult result = disambiguator.disambiguate(graph);

            assertTrue(result.isResolved());
            assertFalse(graph.contains(mail));
            assertTrue(work.relatedMany("identifiers").isEmpty());
            assertTrue(result.matches().isEmpty());
        }
    }

    @Test
    @DisplayName("Should leave identifiers untouched when normalization is disabled")
    void normalizationDisabled() {
        store.add("WorkIdentifier", 1, "share.workidentifier",
                "uri", "http://example.com/Foo", "creative_work_id", 9L);
        Node identifier = node("_:i", "workidentifier", "uri", "HTTP://Example.com/Foo");

        DisambiguationOptions options = DisambiguationOptions.builder().normalizeIdentifiers(false).build();
        try (GraphDisambiguator disambiguator = disambiguator(options)) {
            DisambiguationResult result = disambiguator.disambiguate(graph);

            assertEquals("HTTP://Example.com/Foo", identifier.attr("uri"));
            assertFalse(result.matches().hasMatches(identifier));
        }
    }

    @Test
    @DisplayName("Should stop at the first ambiguous link")
    void stopsAtAmbiguity() {
        store.add("Tag", 5, "share.tag", "name", "physics")
                .add("Tag", 6, "share.tag", "name", "physics");
        Node tag = node("_:t", "tag", "name", "physics");
        Node work = node("_:w", "article");
        Node through = node("_:tt", "throughtags");
        graph.connect(through, "tag", tag, "work_relations");
        graph.connect(through, "creative_work", work, "tag_relations");
        Node creator = node("_:r", "creator", "cited_as", "Jane Doe");
        graph.connect(creator, "creative_work", work, "agent_relations");

        try (GraphDisambiguator disambiguator = disambiguator(DisambiguationOptions.defaults())) {
            DisambiguationResult result = disambiguator.disambiguate(graph);

            DisambiguationResult.Ambiguous ambiguous = assertInstanceOf(DisambiguationResult.Ambiguous.class, result);
            assertFalse(result.isResolved());
            assertEquals(through, ambiguous.node());
            assertEquals("tag", ambiguous.relation());
            assertEquals(tag, ambiguous.relatedNode());
            assertEquals(Set.of(5L, 6L), ids(ambiguous.candidates()));
            assertEquals(Set.of(5L, 6L), ids(ambiguous.matches().getMatches(tag)));
            assertTrue(store.getQueries().stream().noneMatch(q -> q.contains("count(r)")));
        }
    }

    @Test
    @DisplayName("Should run a custom plan with a supplied strategy")
    void customPlan() {
        MatchingStrategy strategy = mock(MatchingStrategy.class);
        node("_:t", "tag", "name", "physics");
        MatchingPlan plan = MatchingPlan.of(List.of(MatchingStep.byAttrs("tag", List.of("name"))));

        try (GraphDisambiguator disambiguator = GraphDisambiguator.builder().matchingStrategy(strategy).build()) {
            DisambiguationResult result = disambiguator.disambiguate(graph, plan);

            assertTrue(result.isResolved());
            verify(strategy).initialPass(anyList(), any());
            verify(strategy).matchByAttrs(anyList(), eq("tag"), eq(List.of("name")), any(), any());
            assertNull(disambiguator.getConnection());
        }
    }

    @Test
    @DisplayName("Should report rejected identifiers to the metrics service")
    void reportsRejections() {
        MetricsService metrics = mock(MetricsService.class);
        node("_:i", "workidentifier", "uri", "mailto:someone@example.com");

        try (GraphDisambiguator disambiguator = GraphDisambiguator.builder()
                .graphConnection(store)
                .metricsService(metrics)
                .build()) {
            disambiguator.disambiguate(graph);
        }

        verify(metrics).incrementIdentifierRejected("disallowed");
    }

    @Test
    @DisplayName("Build should fail without a connection or strategy")
    void buildRequiresConnection() {
        assertThrows(IllegalStateException.class, () -> GraphDisambiguator.builder().build());
    }

    @Test
    @DisplayName("Close should leave a caller-owned connection open")
    void closeKeepsCallerConnection() {
        GraphDisambiguator disambiguator = disambiguator(DisambiguationOptions.defaults());

        disambiguator.close();

        assertFalse(store.isClosed());
        assertSame(store, disambiguator.getConnection());
    }
}
