package com.metadata.disambiguation.graph;

import com.metadata.disambiguation.core.model.Candidate;
import com.metadata.disambiguation.query.LookupQuery;
import com.metadata.disambiguation.query.QueryBuilder;
import com.metadata.disambiguation.schema.SchemaRegistry;
import com.metadata.disambiguation.schema.TargetSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only access to persisted records.
 * Records are stored as nodes labelled per {@link TargetSchema}, with columns as properties.
 */
public class CandidateRepository {
    private static final Logger log = LoggerFactory.getLogger(CandidateRepository.class);

    private static final String SUBJECT = "subject";
    private static final String AGENT_WORK_RELATION = "abstractagentworkrelation";
    private static final String AGENT = "agent";

    private final GraphConnection connection;
    private final SchemaRegistry schemas;

    public CandidateRepository(GraphConnection connection, SchemaRegistry schemas) {
        this.connection = connection;
        this.schemas = schemas;
    }

    /**
     * Executes a batched lookup built by a {@link QueryBuilder}: one round trip for the whole batch.
     */
    public List<LookupRow> lookup(LookupQuery query, String label) {
        List<Map<String, Object>> results = connection.query(query.cypher(), query.params());
        List<LookupRow> rows = new ArrayList<>(results.size());
        for (Map<String, Object> row : results) {
            rows.add(new LookupRow(String.valueOf(row.get(QueryBuilder.NODE_ID)), toCandidate(label, row, "")));
        }
        log.debug("Lookup of {} rows against {} returned {} matches", query.rowCount(), label, rows.size());
        return rows;
    }

    /**
     * Finds a record by id.
     */
    public Optional<Candidate> findById(TargetSchema schema, long id) {
        String query = """
                MATCH (t:%s)
                WHERE t.id = $id
                RETURN t.id AS id, t.type AS type, properties(t) AS properties
                """.formatted(InputSanitizer.validateIdentifier(schema.label()));
        List<Map<String, Object>> results = connection.query(query, Map.of("id", id));
        if (results.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(toCandidate(schema.label(), results.get(0), ""));
    }

    /**
     * Finds all records of a label whose id is in the given set.
     */
    public List<Candidate> findByIds(TargetSchema schema, Collection<Long> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        String query = """
                MATCH (t:%s)
                WHERE t.id IN $ids
                RETURN t.id AS id, t.type AS type, properties(t) AS properties
                ORDER BY t.id
                """.formatted(InputSanitizer.validateIdentifier(schema.label()));
        return connection.query(query, Map.of("ids", List.copyOf(ids))).stream()
                .map(row -> toCandidate(schema.label(), row, ""))
                .toList();
    }

    /**
     * Finds a subject of the central taxonomy, i.e. one that is not a synonym of another subject.
     *
     * @param field {@code uri} or {@code name}
     */
    public Optional<Candidate> findCentralSubject(String field, String value) {
        TargetSchema subject = schemas.get(SUBJECT);
        String query = """
                MATCH (s:%s)
                WHERE s.%s IS NULL AND s.%s = $value
                RETURN s.id AS id, s.type AS type, properties(s) AS properties
                ORDER BY s.id
                LIMIT 1
                """.formatted(
                InputSanitizer.validateIdentifier(subject.label()),
                subject.relationColumn("central_synonym"),
                InputSanitizer.validateIdentifier(subject.column(field)));
        return first(subject.label(), connection.query(query, Map.of("value", value)));
    }

    /**
     * Finds a subject of the taxonomy owned by the given source.
     *
     * @param field {@code uri} or {@code name}
     */
    public Optional<Candidate> findTaxonomySubject(String source, String field, String value) {
        TargetSchema subject = schemas.get(SUBJECT);
        String query = """
                MATCH (x:SubjectTaxonomy)
                WHERE x.source = $source
                MATCH (s:%s)
                WHERE s.%s = x.id AND s.%s = $value
                RETURN s.id AS id, s.type AS type, properties(s) AS properties
                ORDER BY s.id
                LIMIT 1
                """.formatted(
                InputSanitizer.validateIdentifier(subject.label()),
                subject.relationColumn("taxonomy"),
                InputSanitizer.validateIdentifier(subject.column(field)));
        return first(subject.label(), connection.query(query, Map.of("source", source, "value", value)));
    }

    /**
     * Counts the agent relations of a work.
     */
    public long countAgentWorkRelations(long workId) {
        TargetSchema relation = schemas.get(AGENT_WORK_RELATION);
        String query = """
                MATCH (r:%s)
                WHERE r.%s = $workId
                RETURN count(r) AS cnt
                """.formatted(
                InputSanitizer.validateIdentifier(relation.label()),
                relation.relationColumn("creative_work"));
        List<Map<String, Object>> results = connection.query(query, Map.of("workId", workId));
        if (results.isEmpty() || results.get(0).get("cnt") == null) {
            return 0;
        }
        return ((Number) results.get(0).get("cnt")).longValue();
    }

    /**
     * Fetches the agent relations of a work with the agents they credit.
     */
    public List<AgentWorkRelationRow> findAgentWorkRelations(long workId) {
        TargetSchema relation = schemas.get(AGENT_WORK_RELATION);
        TargetSchema agent = schemas.get(AGENT);
        String query = """
                MATCH (r:%s)
                WHERE r.%s = $workId
                MATCH (a:%s)
                WHERE a.id = r.%s
                RETURN r.id AS id, r.type AS type, properties(r) AS properties,
                       a.id AS agent_id, a.type AS agent_type, properties(a) AS agent_properties
                ORDER BY r.id
                """.formatted(
                InputSanitizer.validateIdentifier(relation.label()),
                relation.relationColumn("creative_work"),
                InputSanitizer.validateIdentifier(agent.label()),
                relation.relationColumn("agent"));
        return connection.query(query, Map.of("workId", workId)).stream()
                .map(row -> new AgentWorkRelationRow(
                        toCandidate(relation.label(), row, ""),
                        toCandidate(agent.label(), row, "agent_")))
                .toList();
    }

    private Optional<Candidate> first(String label, List<Map<String, Object>> results) {
        if (results.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(toCandidate(label, results.get(0), ""));
    }

    @SuppressWarnings("unchecked")
    private Candidate toCandidate(String label, Map<String, Object> row, String prefix) {
        Object id = row.get(prefix + "id");
        if (!(id instanceof Number)) {
            throw new GraphQueryException("Row for " + label + " has no numeric id: " + row);
        }
        Object properties = row.get(prefix + "properties");
        return new Candidate(
                label,
                ((Number) id).longValue(),
                (String) row.get(prefix + "type"),
                properties instanceof Map ? (Map<String, Object>) properties : Map.of());
    }
}
