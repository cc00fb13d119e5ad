package com.metadata.disambiguation.matching;

import com.metadata.disambiguation.api.DisambiguationOptions;
import com.metadata.disambiguation.core.model.Candidate;
import com.metadata.disambiguation.core.model.MatchSet;
import com.metadata.disambiguation.core.model.Node;
import com.metadata.disambiguation.graph.AgentWorkRelationRow;
import com.metadata.disambiguation.graph.CandidateRepository;
import com.metadata.disambiguation.graph.InputSanitizer;
import com.metadata.disambiguation.graph.LookupRow;
import com.metadata.disambiguation.ids.InvalidIdException;
import com.metadata.disambiguation.ids.ObfuscatedIdResolver;
import com.metadata.disambiguation.logging.LogContext;
import com.metadata.disambiguation.metrics.MetricsService;
import com.metadata.disambiguation.metrics.NoOpMetricsService;
import com.metadata.disambiguation.names.NameParser;
import com.metadata.disambiguation.query.LookupQuery;
import com.metadata.disambiguation.query.QueryBuilder;
import com.metadata.disambiguation.schema.SchemaRegistry;
import com.metadata.disambiguation.schema.TargetSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.IntSupplier;

/**
 * {@link MatchingStrategy} backed by read-only queries against the graph store.
 * Attribute and many-to-one matching resolve a whole batch of nodes in a single query.
 */
public class DatabaseMatchingStrategy implements MatchingStrategy {
    private static final Logger log = LoggerFactory.getLogger(DatabaseMatchingStrategy.class);

    static final String SUBJECT_CENTRAL_SYNONYM = "central_synonym";
    static final String RELATION_WORK = "creative_work";
    static final String RELATION_AGENT = "agent";
    static final String WORK_AGENT_RELATIONS = "agent_relations";

    private static final List<String> SUBJECT_FIELDS = List.of("uri", "name");

    private final CandidateRepository repository;
    private final SchemaRegistry schemas;
    private final ObfuscatedIdResolver idResolver;
    private final NameParser nameParser;
    private final DisambiguationOptions options;
    private final MetricsService metrics;

    public DatabaseMatchingStrategy(CandidateRepository repository, SchemaRegistry schemas,
                                    ObfuscatedIdResolver idResolver, NameParser nameParser,
                                    DisambiguationOptions options, MetricsService metrics) {
        this.repository = Objects.requireNonNull(repository, "repository is required");
        this.schemas = Objects.requireNonNull(schemas, "schemas is required");
        this.idResolver = Objects.requireNonNull(idResolver, "idResolver is required");
        this.nameParser = Objects.requireNonNull(nameParser, "nameParser is required");
        this.options = options != null ? options : DisambiguationOptions.defaults();
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
    }

    @Override
    public int initialPass(Collection<Node> nodes, MatchSet matches) {
        return timed("initial_pass", () -> {
            int added = 0;
            for (Node node : nodes) {
                if (node.isLocal()) {
                    continue;
                }
                try {
                    if (matches.addMatch(node, idResolver.resolve(node.getId()))) {
                        added++;
                    }
                } catch (InvalidIdException e) {
                    log.debug("Ignoring unresolvable id {}: {}", node.getId(), e.getMessage());
                }
            }
            return added;
        });
    }

    @Override
    public int matchByAttrs(Collection<Node> nodes, String target, List<String> attrNames,
                            Collection<String> allowedSubtypes, MatchSet matches) {
        TargetSchema schema = schemas.get(target);
        List<String> columns = schema.columns(attrNames);
        return timed("match_by_attrs", () -> matchQuery(nodes, schema, columns,
                node -> attrNames.stream().map(node::attr).toList(),
                allowedSubtypes, matches));
    }

    @Override
    public ManyToOneOutcome matchByManyToOne(Collection<Node> nodes, String target, List<String> relationNames,
                                             Collection<String> allowedSubtypes, MatchSet matches) {
        TargetSchema schema = schemas.get(target);
        List<String> columns = schema.relationColumns(relationNames);
        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forPass("match_by_many_to_one")) {
            Map<Node, List<Object>> nodeValues = new LinkedHashMap<>();
            for (Node node : nodes) {
                List<Object> keys = new ArrayList<>(relationNames.size());
                for (String relation : relationNames) {
                    Node related = node.related(relation);
                    Set<Candidate> relatedMatches = matches.getMatches(related);
                    if (relatedMatches.size() > 1) {
                        metrics.incrementAmbiguousMatch();
                        ManyToOneOutcome.Ambiguous ambiguous =
                                new ManyToOneOutcome.Ambiguous(node, relation, related, relatedMatches);
                        log.warn("{}", ambiguous.message());
                        return ambiguous;
                    }
                    if (relatedMatches.size() == 1) {
                        keys.add(relatedMatches.iterator().next().id());
                    }
                }
                if (keys.size() == relationNames.size()) {
                    nodeValues.put(node, keys);
                }
            }
            int added = matchQuery(nodeValues.keySet(), schema, columns, nodeValues::get, allowedSubtypes, matches);
            metrics.incrementMatchesRecorded("match_by_many_to_one", added);
            return new ManyToOneOutcome.Matched(added);
        } finally {
            metrics.recordPassDuration("match_by_many_to_one", Duration.ofNanos(System.nanoTime() - start));
        }
    }

    @Override
    public int matchByOneToMany(Collection<Node> nodes, String target, String relationName, MatchSet matches) {
        TargetSchema schema = schemas.get(target);
        String remoteColumn = schema.reverseRelationColumn(relationName);
        return timed("match_by_one_to_many", () -> {
            Map<Node, Set<Long>> nodeIds = new LinkedHashMap<>();
            Set<Long> allIds = new LinkedHashSet<>();
            for (Node node : nodes) {
                Set<Long> ids = new LinkedHashSet<>();
                for (Node related : node.relatedMany(relationName)) {
                    for (Candidate candidate : matches.getMatches(related)) {
                        Long id = candidate.longProperty(remoteColumn);
                        if (id != null) {
                            ids.add(id);
                        }
                    }
                }
                if (!ids.isEmpty()) {
                    nodeIds.put(node, ids);
                    allIds.addAll(ids);
                }
            }
            if (allIds.isEmpty()) {
                return 0;
            }

            Map<Long, Candidate> found = new HashMap<>();
            for (Candidate candidate : repository.findByIds(schema, allIds)) {
                found.put(candidate.id(), candidate);
            }
            int added = 0;
            for (Map.Entry<Node, Set<Long>> entry : nodeIds.entrySet()) {
                for (Long id : entry.getValue()) {
                    Candidate candidate = found.get(id);
                    if (candidate != null && matches.addMatch(entry.getKey(), candidate)) {
                        added++;
                    }
                }
            }
            return added;
        });
    }

    @Override
    public int matchSubjects(Collection<Node> nodes, MatchSet matches) {
        return timed("match_subjects", () -> {
            int added = 0;
            for (Node node : nodes) {
                boolean central = node.related(SUBJECT_CENTRAL_SYNONYM) == null;
                if (!central && options.getTaxonomySource().isEmpty()) {
                    continue;
                }
                for (String field : SUBJECT_FIELDS) {
                    String value = node.attrString(field);
                    if (value == null || value.isEmpty()) {
                        continue;
                    }
                    Optional<Candidate> match = central
                            ? repository.findCentralSubject(field, value)
                            : repository.findTaxonomySubject(options.getTaxonomySource().get(), field, value);
                    if (match.isPresent()) {
                        if (matches.addMatch(node, match.get())) {
                            added++;
                        }
                        break;
                    }
                }
            }
            return added;
        });
    }

    @Override
    public int matchAgentWorkRelations(Collection<Node> nodes, MatchSet matches) {
        return timed("match_agent_work_relations", () -> {
            Set<Node> workNodes = new LinkedHashSet<>();
            for (Node node : nodes) {
                Node work = node.related(RELATION_WORK);
                if (work != null) {
                    workNodes.add(work);
                }
            }

            int added = 0;
            for (Node workNode : workNodes) {
                for (Candidate work : matches.getMatches(workNode)) {
                    added += matchRelationsOfWork(workNode, work, matches);
                }
            }
            return added;
        });
    }

    private int matchRelationsOfWork(Node workNode, Candidate work, MatchSet matches) {
        long count = repository.countAgentWorkRelations(work.id());
        if (count > options.getMaxAgentRelations()) {
            log.info("Skipping work {} with {} agent relations (limit {})",
                    work.id(), count, options.getMaxAgentRelations());
            metrics.incrementWorkSkipped();
            return 0;
        }

        List<Node> relationNodes = new ArrayList<>();
        for (Node node : workNode.relatedMany(WORK_AGENT_RELATIONS)) {
            if (!matches.hasMatches(node)) {
                relationNodes.add(node);
            }
        }
        if (relationNodes.isEmpty()) {
            return 0;
        }

        List<RelationNames<AgentWorkRelationRow>> existing = new ArrayList<>();
        for (AgentWorkRelationRow row : repository.findAgentWorkRelations(work.id())) {
            if (withinLimit(row.citedAs()) && withinLimit(row.agentName())) {
                existing.add(new RelationNames<>(row,
                        nameParser.parse(row.citedAs()), nameParser.parse(row.agentName())));
            }
        }

        int added = 0;
        for (Node node : relationNodes) {
            Node agent = node.related(RELATION_AGENT);
            if (agent == null) {
                continue;
            }
            String citedAs = nullToEmpty(node.attrString("cited_as"));
            String agentName = nullToEmpty(agent.attrString("name"));
            if (!withinLimit(citedAs) || !withinLimit(agentName)) {
                continue;
            }

            RelationNames<Node> nodeNames = new RelationNames<>(node,
                    nameParser.parse(citedAs), nameParser.parse(agentName));
            List<ComparableAgentWorkRelation> ranked = new ArrayList<>();
            for (RelationNames<AgentWorkRelationRow> relationNames : existing) {
                ComparableAgentWorkRelation comparable = new ComparableAgentWorkRelation(nodeNames, relationNames);
                if (comparable.isValidMatch()) {
                    ranked.add(comparable);
                }
            }
            if (ranked.isEmpty()) {
                continue;
            }
            ranked.sort(ComparableAgentWorkRelation.BY_SORT_KEY.reversed());

            AgentWorkRelationRow best = ranked.get(0).getRelation();
            if (matches.addMatch(agent, best.agent())) {
                added++;
            }
            if (matches.addMatch(node, best.relation())) {
                added++;
            }
            log.debug("Matched relation {} ('{}') to {}", node.getId(), citedAs, best.relation());
        }
        return added;
    }

    private int matchQuery(Collection<Node> nodes, TargetSchema schema, List<String> columns,
                           Function<Node, List<?>> values, Collection<String> allowedSubtypes,
                           MatchSet matches) {
        List<Node> batch = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            if (fitsQuery(values.apply(node))) {
                batch.add(node);
            } else {
                log.warn("Skipping node {}: a lookup value exceeds {} characters",
                        node.getId(), InputSanitizer.MAX_CYPHER_VALUE_LENGTH);
            }
        }
        if (batch.isEmpty()) {
            return 0;
        }
        Set<String> allowedTypes = allowedSubtypes == null ? Set.of() : schema.qualifiedTypes(allowedSubtypes);
        QueryBuilder builder = QueryBuilder.forTarget(schema.label(), columns, values, allowedTypes);

        Map<String, Node> nodeMap = new HashMap<>();
        for (Node node : batch) {
            nodeMap.put(node.getId(), node);
        }
        LookupQuery query = builder.build(batch);
        metrics.recordLookupBatchSize(query.rowCount());

        int added = 0;
        for (LookupRow row : repository.lookup(query, schema.label())) {
            Node node = nodeMap.get(row.nodeId());
            if (node != null && matches.addMatch(node, row.candidate())) {
                added++;
            }
        }
        return added;
    }

    private static boolean fitsQuery(List<?> values) {
        if (values == null) {
            return true;
        }
        for (Object value : values) {
            if (value instanceof String s && !InputSanitizer.isWithinCypherLimit(s)) {
                return false;
            }
        }
        return true;
    }

    private int timed(String pass, IntSupplier body) {
        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forPass(pass)) {
            int added = body.getAsInt();
            metrics.incrementMatchesRecorded(pass, added);
            log.debug("Pass {} recorded {} new matches", pass, added);
            return added;
        } finally {
            metrics.recordPassDuration(pass, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private boolean withinLimit(String name) {
        return name.length() <= options.getMaxNameLength();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
