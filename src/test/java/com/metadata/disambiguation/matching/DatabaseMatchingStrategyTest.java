package com.metadata.disambiguation.matching;

import com.metadata.disambiguation.api.DisambiguationOptions;
import com.metadata.disambiguation.core.model.Candidate;
import com.metadata.disambiguation.core.model.MatchSet;
import com.metadata.disambiguation.core.model.Node;
import com.metadata.disambiguation.core.model.NodeGraph;
import com.metadata.disambiguation.graph.CandidateRepository;
import com.metadata.disambiguation.graph.FakeGraphStore;
import com.metadata.disambiguation.graph.InputSanitizer;
import com.metadata.disambiguation.ids.GraphIdResolver;
import com.metadata.disambiguation.ids.IdObfuscator;
import com.metadata.disambiguation.metrics.MetricsService;
import com.metadata.disambiguation.names.HumanNameParser;
import com.metadata.disambiguation.schema.SchemaRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@DisplayName("DatabaseMatchingStrategy Tests")
class DatabaseMatchingStrategyTest {

    private final SchemaRegistry schemas = SchemaRegistry.defaults();
    private FakeGraphStore store;
    private MetricsService metrics;
    private NodeGraph graph;
    private MatchSet matches;

    @BeforeEach
    void setUp() {
        store = new FakeGraphStore();
        metrics = mock(MetricsService.class);
        graph = new NodeGraph();
        matches = new MatchSet();
    }

    private DatabaseMatchingStrategy strategy(DisambiguationOptions options) {
        CandidateRepository repository = new CandidateRepository(store, schemas);
        return new DatabaseMatchingStrategy(repository, schemas, new GraphIdResolver(repository, schemas),
                new HumanNameParser(), options, metrics);
    }

    private DatabaseMatchingStrategy strategy() {
        return strategy(DisambiguationOptions.defaults());
    }

    private Node node(String id, String type, Object... keyValues) {
        Node.Builder builder = Node.builder().id(id).type(type);
        for (int i = 0; i < keyValues.length; i += 2) {
            builder.attr((String) keyValues[i], keyValues[i + 1]);
        }
        return graph.add(builder.build());
    }

    private static Candidate candidate(String label, long id, String type, Object... keyValues) {
        Map<String, Object> properties = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            properties.put((String) keyValues[i], keyValues[i + 1]);
        }
        return new Candidate(label, id, type, properties);
    }

    private static Set<Long> ids(Set<Candidate> candidates) {
        Set<Long> ids = new HashSet<>();
        candidates.forEach(c -> ids.add(c.id()));
        return ids;
    }

    @Nested
    @DisplayName("initialPass")
    class InitialPass {

        @Test
        @DisplayName("Should resolve obfuscated ids to existing records")
        void resolvesObfuscatedIds() {
            store.add("CreativeWork", 42, "share.article", "title", "A study");
            Node work = node(IdObfuscator.encode(1, 42), "article");

            int added = strategy().initialPass(List.of(work), matches);

            assertEquals(1, added);
            assertEquals(Set.of(42L), ids(matches.getMatches(work)));
        }

        @Test
        @DisplayName("Should skip local ids without querying")
        void skipsLocalIds() {
            Node work = node("_:w1", "article");

            strategy().initialPass(List.of(work), matches);

            assertFalse(matches.hasMatches(work));
            assertEquals(0, store.queryCount());
        }

        @Test
        @DisplayName("Should ignore malformed ids, unknown type codes and missing records")
        void ignoresUnresolvableIds() {
            Node malformed = node("not-an-id", "article");
            Node unknownType = node(IdObfuscator.encode(0xFF, 1), "article");
            Node missing = node(IdObfuscator.encode(1, 999), "article");

            int added = strategy().initialPass(List.of(malformed, unknownType, missing), matches);

            assertEquals(0, added);
            assertTrue(matches.isEmpty());
        }
    }

    @Nested
    @DisplayName("matchByAttrs")
    class MatchByAttrs {

        @Test
        @DisplayName("Should resolve 600 nodes with a single query")
        void singleQueryForLargeBatch() {
            store.add("WorkIdentifier", 1, "share.workidentifier", "uri", "http://example.com/7", "creative_work_id", 10L)
                    .add("WorkIdentifier", 2, "share.workidentifier", "uri", "http://example.com/300", "creative_work_id", 11L)
                    .add("WorkIdentifier", 3, "share.workidentifier", "uri", "http://example.com/599", "creative_work_id", 12L);
            List<Node> nodes = new ArrayList<>();
            for (int i = 0; i < 600; i++) {
                nodes.add(node("_:i" + i, "workidentifier", "uri", "http://example.com/" + i));
            }

            int added = strategy().matchByAttrs(nodes, "workidentifier", List.of("uri"), null, matches);

            assertEquals(1, store.queryCount());
            assertEquals(3, added);
            assertEquals(Set.of(1L), ids(matches.getMatches(nodes.get(7))));
            assertEquals(Set.of(2L), ids(matches.getMatches(nodes.get(300))));
            assertEquals(Set.of(3L), ids(matches.getMatches(nodes.get(599))));
            assertFalse(matches.hasMatches(nodes.get(8)));
            verify(metrics).recordLookupBatchSize(600);
        }

        @Test
        @DisplayName("Should only match exactly equal values")
        void exactEquality() {
            store.add("Tag", 1, "share.tag", "name", "Physics");
            Node lower = node("_:t1", "tag", "name", "physics");
            Node padded = node("_:t2", "tag", "name", "Physics ");
            Node exact = node("_:t3", "tag", "name", "Physics");

            strategy().matchByAttrs(List.of(lower, padded, exact), "tag", List.of("name"), null, matches);

            assertFalse(matches.hasMatches(lower));
            assertFalse(matches.hasMatches(padded));
            assertTrue(matches.hasMatches(exact));
        }

        @Test
        @DisplayName("Should keep every record that matches")
        void keepsAllMatchingRecords() {
            store.add("Tag", 1, "share.tag", "name", "physics")
                    .add("Tag", 2, "share.tag", "name", "physics");
            Node tag = node("_:t", "tag", "name", "physics");

            int added = strategy().matchByAttrs(List.of(tag), "tag", List.of("name"), null, matches);

            assertEquals(2, added);
            assertEquals(Set.of(1L, 2L), ids(matches.getMatches(tag)));
        }

        @Test
        @DisplayName("Should require every attribute to match")
        void allAttributesMustMatch() {
            store.add("CreativeWork", 1, "share.article", "title", "Title", "description", "One")
                    .add("CreativeWork", 2, "share.article", "title", "Title", "description", "Two");
            Node work = node("_:w", "article", "title", "Title", "description", "Two");

            strategy().matchByAttrs(List.of(work), "creativework", List.of("title", "description"), null, matches);

            assertEquals(Set.of(2L), ids(matches.getMatches(work)));
        }

        @Test
        @DisplayName("Should restrict matches to allowed subtypes")
        void restrictsToAllowedSubtypes() {
            store.add("CreativeWork", 1, "share.article", "title", "Title")
                    .add("CreativeWork", 2, "share.book", "title", "Title");
            Node work = node("_:w", "article", "title", "Title");

            strategy().matchByAttrs(List.of(work), "creativework", List.of("title"), List.of("article"), matches);

            assertEquals(Set.of(1L), ids(matches.getMatches(work)));
            assertTrue(store.getQueries().get(0).contains("$allowed_types"));
            assertEquals(List.of("share.article"), store.lastParams().get("allowed_types"));
        }

        @Test
        @DisplayName("Should not query for an empty batch")
        void emptyBatch() {
            assertEquals(0, strategy().matchByAttrs(List.of(), "tag", List.of("name"), null, matches));
            assertEquals(0, store.queryCount());
        }

        @Test
        @DisplayName("Should skip nodes with oversized values and still match the rest of the batch")
        void skipsOversizedValues() {
            store.add("Tag", 1, "share.tag", "name", "ok");
            Node ok = node("_:t1", "tag", "name", "ok");
            Node huge = node("_:t2", "tag", "name", "x".repeat(InputSanitizer.MAX_CYPHER_VALUE_LENGTH + 1));

            int added = strategy().matchByAttrs(List.of(ok, huge), "tag", List.of("name"), null, matches);

            assertEquals(1, added);
            assertEquals(Set.of(1L), ids(matches.getMatches(ok)));
            assertFalse(matches.hasMatches(huge));
            assertEquals(1, store.queryCount());
        }

        @Test
        @DisplayName("Should not query when every node is oversized")
        void onlyOversizedValues() {
            Node huge = node("_:t", "tag", "name", "x".repeat(InputSanitizer.MAX_CYPHER_VALUE_LENGTH + 1));

            assertEquals(0, strategy().matchByAttrs(List.of(huge), "tag", List.of("name"), null, matches));
            assertEquals(0, store.queryCount());
        }

        @Test
        @DisplayName("Should reject unknown attributes")
        void unknownAttribute() {
            Node tag = node("_:t", "tag", "name", "x");
            assertThrows(IllegalArgumentException.class, () ->
                    strategy().matchByAttrs(List.of(tag), "tag", List.of("color"), null, matches));
        }
    }

    @Nested
    @DisplayName("matchByManyToOne")
    class MatchByManyToOne {

        private Node tag;
        private Node work;
        private Node through;

        @BeforeEach
        void setUpGraph() {
            tag = node("_:t", "tag", "name", "physics");
            work = node("_:w", "article");
            through = node("_:tt", "throughtags");
            graph.connect(through, "tag", tag, "work_relations");
            graph.connect(through, "creative_work", work, "tag_relations");
        }

        @Test
        @DisplayName("Should match through the single matches of the related nodes")
        void matchesThroughRelatedNodes() {
            store.add("ThroughTags", 77, "share.throughtags", "tag_id", 5L, "creative_work_id", 9L)
                    .add("ThroughTags", 78, "share.throughtags", "tag_id", 5L, "creative_work_id", 10L);
            matches.addMatch(tag, candidate("Tag", 5, "share.tag"));
            matches.addMatch(work, candidate("CreativeWork", 9, "share.article"));

            ManyToOneOutcome outcome = strategy().matchByManyToOne(List.of(through), "throughtags",
                    List.of("tag", "creative_work"), null, matches);

            assertEquals(new ManyToOneOutcome.Matched(1), outcome);
            assertEquals(Set.of(77L), ids(matches.getMatches(through)));
            assertEquals(1, store.queryCount());
        }

        @Test
        @DisplayName("Should report ambiguity when a related node has several matches")
        void reportsAmbiguity() {
            matches.addMatch(tag, candidate("Tag", 5, "share.tag"));
            matches.addMatch(tag, candidate("Tag", 6, "share.tag"));
            matches.addMatch(work, candidate("CreativeWork", 9, "share.article"));

            ManyToOneOutcome outcome = strategy().matchByManyToOne(List.of(through), "throughtags",
                    List.of("tag", "creative_work"), null, matches);

            ManyToOneOutcome.Ambiguous ambiguous = assertInstanceOf(ManyToOneOutcome.Ambiguous.class, outcome);
            assertEquals(through, ambiguous.node());
            assertEquals("tag", ambiguous.relation());
            assertEquals(tag, ambiguous.relatedNode());
            assertEquals(Set.of(5L, 6L), ids(ambiguous.candidates()));
            assertFalse(matches.hasMatches(through));
            assertEquals(0, store.queryCount());
            verify(metrics).incrementAmbiguousMatch();
        }

        @Test
        @DisplayName("Should leave out nodes whose related node is unmatched")
        void excludesUnmatchedRelatedNodes() {
            store.add("ThroughTags", 77, "share.throughtags", "tag_id", 5L, "creative_work_id", 9L);
            matches.addMatch(tag, candidate("Tag", 5, "share.tag"));

            ManyToOneOutcome outcome = strategy().matchByManyToOne(List.of(through), "throughtags",
                    List.of("tag", "creative_work"), null, matches);

            assertEquals(new ManyToOneOutcome.Matched(0), outcome);
            assertFalse(matches.hasMatches(through));
            assertEquals(0, store.queryCount());
        }

        @Test
        @DisplayName("Should leave out nodes with a missing relation")
        void excludesMissingRelation() {
            Node orphan = node("_:tt2", "throughtags");
            matches.addMatch(tag, candidate("Tag", 5, "share.tag"));

            ManyToOneOutcome outcome = strategy().matchByManyToOne(List.of(orphan), "throughtags",
                    List.of("tag", "creative_work"), null, matches);

            assertEquals(new ManyToOneOutcome.Matched(0), outcome);
        }
    }

    @Nested
    @DisplayName("matchByOneToMany")
    class MatchByOneToMany {

        @Test
        @DisplayName("Should match works through the records their identifiers point at")
        void matchesThroughIdentifiers() {
            store.add("CreativeWork", 9, "share.article")
                    .add("CreativeWork", 10, "share.preprint");
            Node work = node("_:w", "article");
            Node doi = node("_:i1", "workidentifier", "uri", "http://dx.doi.org/10.1/X");
            Node url = node("_:i2", "workidentifier", "uri", "http://example.com/x");
            graph.connect(doi, "creative_work", work, "identifiers");
            graph.connect(url, "creative_work", work, "identifiers");
            matches.addMatch(doi, candidate("WorkIdentifier", 1, "share.workidentifier", "creative_work_id", 9L));
            matches.addMatch(url, candidate("WorkIdentifier", 2, "share.workidentifier", "creative_work_id", 10L));

            int added = strategy().matchByOneToMany(List.of(work), "creativework", "identifiers", matches);

            assertEquals(2, added);
            assertEquals(Set.of(9L, 10L), ids(matches.getMatches(work)));
            assertEquals(1, store.queryCount());
        }

        @Test
        @DisplayName("Should not query when no related node is matched")
        void noRelatedMatches() {
            Node agent = node("_:a", "person");
            Node orcid = node("_:i", "agentidentifier", "uri", "http://orcid.org/0000-0002-1825-0097");
            graph.connect(orcid, "agent", agent, "identifiers");

            int added = strategy().matchByOneToMany(List.of(agent), "agent", "identifiers", matches);

            assertEquals(0, added);
            assertEquals(0, store.queryCount());
        }
    }

    @Nested
    @DisplayName("matchSubjects")
    class MatchSubjects {

        @Test
        @DisplayName("Should match central subjects by URI before name")
        void centralByUri() {
            store.add("Subject", 1, "share.subject", "name", "Biology", "uri", "http://subjects/bio")
                    .add("Subject", 2, "share.subject", "name", "Life Sciences", "uri", "http://subjects/life");
            Node subject = node("_:s", "subject", "name", "Life Sciences", "uri", "http://subjects/bio");

            int added = strategy().matchSubjects(List.of(subject), matches);

            assertEquals(1, added);
            assertEquals(Set.of(1L), ids(matches.getMatches(subject)));
            assertEquals(1, store.queryCount());
        }

        @Test
        @DisplayName("Should fall back to the name when the URI does not match")
        void centralByName() {
            store.add("Subject", 1, "share.subject", "name", "Biology");
            Node subject = node("_:s", "subject", "name", "Biology", "uri", "http://unknown");

            strategy().matchSubjects(List.of(subject), matches);

            assertEquals(Set.of(1L), ids(matches.getMatches(subject)));
            assertEquals(2, store.queryCount());
        }

        @Test
        @DisplayName("Should ignore synonyms when matching central subjects")
        void ignoresSynonyms() {
            store.add("Subject", 1, "share.subject", "name", "Biology", "central_synonym_id", 50L);
            Node subject = node("_:s", "subject", "name", "Biology");

            strategy().matchSubjects(List.of(subject), matches);

            assertFalse(matches.hasMatches(subject));
        }

        @Test
        @DisplayName("Should pick the lowest id when several subjects match")
        void firstHit() {
            store.add("Subject", 8, "share.subject", "name", "Biology")
                    .add("Subject", 3, "share.subject", "name", "Biology");
            Node subject = node("_:s", "subject", "name", "Biology");

            strategy().matchSubjects(List.of(subject), matches);

            assertEquals(Set.of(3L), ids(matches.getMatches(subject)));
        }

        @Test
        @DisplayName("Should skip custom subjects when no taxonomy source is configured")
        void skipsCustomWithoutSource() {
            Node central = node("_:c", "subject", "name", "Biology");
            Node custom = node("_:s", "subject", "name", "Bio stuff");
            graph.connect(custom, "central_synonym", central, null);

            strategy().matchSubjects(List.of(custom), matches);

            assertFalse(matches.hasMatches(custom));
            assertEquals(0, store.queryCount());
        }

        @Test
        @DisplayName("Should match custom subjects within the source's taxonomy")
        void customInSourceTaxonomy() {
            store.add("SubjectTaxonomy", 3, "share.subjecttaxonomy", "source", "my-source")
                    .add("SubjectTaxonomy", 4, "share.subjecttaxonomy", "source", "other-source")
                    .add("Subject", 20, "share.subject", "name", "Bio stuff", "taxonomy_id", 4L, "central_synonym_id", 1L)
                    .add("Subject", 21, "share.subject", "name", "Bio stuff", "taxonomy_id", 3L, "central_synonym_id", 1L);
            Node central = node("_:c", "subject", "name", "Biology");
            Node custom = node("_:s", "subject", "name", "Bio stuff");
            graph.connect(custom, "central_synonym", central, null);

            strategy(DisambiguationOptions.builder().taxonomySource("my-source").build())
                    .matchSubjects(List.of(custom), matches);

            assertEquals(Set.of(21L), ids(matches.getMatches(custom)));
        }
    }

    @Nested
    @DisplayName("matchAgentWorkRelations")
    class MatchAgentWorkRelations {

        private Node work;

        @BeforeEach
        void setUpWork() {
            store.add("AgentWorkRelation", 100, "share.creator",
                            "creative_work_id", 9L, "agent_id", 200L, "cited_as", "John Doe", "order_cited", 0L)
                    .add("AgentWorkRelation", 101, "share.creator",
                            "creative_work_id", 9L, "agent_id", 201L, "cited_as", "Jane Roe", "order_cited", 1L)
                    .add("Agent", 200, "share.person", "name", "John Doe")
                    .add("Agent", 201, "share.person", "name", "Jane Roe");
            work = node("_:w", "article");
            matches.addMatch(work, candidate("CreativeWork", 9, "share.article"));
        }

        private Node relation(String id, String citedAs, String agentName) {
            Node relation = node(id, "creator", "cited_as", citedAs, "order_cited", 0);
            Node agent = node(id + "-agent", "person", "name", agentName);
            graph.connect(relation, "creative_work", work, "agent_relations");
            graph.connect(relation, "agent", agent, "work_relations");
            return relation;
        }

        @Test
        @DisplayName("Should match relation and agent to the best named persisted relation")
        void matchesByName() {
            Node relation = relation("_:r", "John Doe", "John Doe");

            int added = strategy().matchAgentWorkRelations(List.of(relation), matches);

            assertEquals(2, added);
            assertEquals(Set.of(100L), ids(matches.getMatches(relation)));
            assertEquals(Set.of(200L), ids(matches.getMatches(relation.related("agent"))));
        }

        @Test
        @DisplayName("Should accept an initial in place of the given name")
        void matchesByInitial() {
            Node relation = relation("_:r", "J. Roe", "J. Roe");

            strategy().matchAgentWorkRelations(List.of(relation), matches);

            assertEquals(Set.of(101L), ids(matches.getMatches(relation)));
        }

        @Test
        @DisplayName("Should not match when no name component agrees")
        void noValidMatch() {
            Node relation = relation("_:r", "Alice Smith", "Alice Smith");

            int added = strategy().matchAgentWorkRelations(List.of(relation), matches);

            assertEquals(0, added);
            assertFalse(matches.hasMatches(relation));
        }

        @Test
        @DisplayName("Sibling relations may select the same persisted relation")
        void siblingsShareBestCandidate() {
            Node full = relation("_:r1", "John Doe", "John Doe");
            Node initial = relation("_:r2", "J. Doe", "John Doe");

            strategy().matchAgentWorkRelations(List.of(full, initial), matches);

            assertEquals(Set.of(100L), ids(matches.getMatches(full)));
            assertEquals(Set.of(100L), ids(matches.getMatches(initial)));
            assertEquals(Set.of(200L), ids(matches.getMatches(full.related("agent"))));
            assertEquals(Set.of(200L), ids(matches.getMatches(initial.related("agent"))));
        }

        @Test
        @DisplayName("Should skip works with too many persisted relations")
        void skipsLargeWorks() {
            Node relation = relation("_:r", "John Doe", "John Doe");

            int added = strategy(DisambiguationOptions.builder().maxAgentRelations(1).build())
                    .matchAgentWorkRelations(List.of(relation), matches);

            assertEquals(0, added);
            verify(metrics).incrementWorkSkipped();
            assertTrue(store.getQueries().stream().noneMatch(q -> q.contains("agent_properties")));
        }

        @Test
        @DisplayName("Should skip names longer than the limit")
        void skipsLongNames() {
            Node relation = relation("_:r", "John Doe", "John Doe");

            int added = strategy(DisambiguationOptions.builder().maxNameLength(5).build())
                    .matchAgentWorkRelations(List.of(relation), matches);

            assertEquals(0, added);
            assertFalse(matches.hasMatches(relation));
        }

        @Test
        @DisplayName("Should leave already matched relations alone")
        void skipsMatchedRelations() {
            Node relation = relation("_:r", "John Doe", "John Doe");
            matches.addMatch(relation, candidate("AgentWorkRelation", 555, "share.creator"));

            strategy().matchAgentWorkRelations(List.of(relation), matches);

            assertEquals(Set.of(555L), ids(matches.getMatches(relation)));
            assertFalse(matches.hasMatches(relation.related("agent")));
        }

        @Test
        @DisplayName("Should do nothing for unmatched works")
        void unmatchedWork() {
            Node otherWork = node("_:w2", "article");
            Node relation = node("_:r", "creator", "cited_as", "John Doe");
            Node agent = node("_:a", "person", "name", "John Doe");
            graph.connect(relation, "creative_work", otherWork, "agent_relations");
            graph.connect(relation, "agent", agent, "work_relations");

            int added = strategy().matchAgentWorkRelations(List.of(relation), matches);

            assertEquals(0, added);
            assertEquals(0, store.queryCount());
            verify(metrics, never()).incrementWorkSkipped();
        }
    }

    @Test
    @DisplayName("Every pass should record its duration")
    void recordsPassDurations() {
        strategy().matchSubjects(List.of(), matches);
        verify(metrics).recordPassDuration(eq("match_subjects"), any());
        verify(metrics).incrementMatchesRecorded("match_subjects", 0);
    }
}
