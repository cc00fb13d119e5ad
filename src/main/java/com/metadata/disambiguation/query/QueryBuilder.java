package com.metadata.disambiguation.query;

import com.metadata.disambiguation.core.model.Node;
import com.metadata.disambiguation.graph.InputSanitizer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Builds a single query that looks up a batch of nodes against one stored label.
 *
 * <p>Each node becomes one row {@code {node_id, v0, v1, ...}} of the {@code $rows} parameter.
 * The rows are unwound and joined against the label on equality of every column, and each
 * result carries the originating node id next to the matched record:</p>
 * <pre>
 * UNWIND $rows AS row
 * MATCH (t:WorkIdentifier)
 * WHERE t.uri = row.v0
 * RETURN row.node_id AS node_id, t.id AS id, t.type AS type, properties(t) AS properties
 * </pre>
 */
public class QueryBuilder {

    public static final String NODE_ID = "node_id";
    public static final String TYPE_COLUMN = "type";
    public static final String ROWS_PARAM = "rows";

    private static final String QUERY_TEMPLATE = """
            UNWIND $rows AS row
            MATCH (t:%s)
            WHERE %s
            RETURN row.node_id AS node_id, t.id AS id, t.type AS type, properties(t) AS properties
            """;

    private final String label;
    private final List<String> columns;
    private final Function<Node, List<?>> valueExtractor;

    /**
     * @param label          stored label to join against
     * @param columns        columns that must all be equal
     * @param valueExtractor lookup values of a node, one per column and in column order
     */
    public QueryBuilder(String label, List<String> columns, Function<Node, List<?>> valueExtractor) {
        this.label = InputSanitizer.validateIdentifier(label);
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("At least one column is required");
        }
        columns.forEach(InputSanitizer::validateIdentifier);
        this.columns = List.copyOf(columns);
        this.valueExtractor = Objects.requireNonNull(valueExtractor, "valueExtractor is required");
    }

    /**
     * Returns a plain builder, or a {@link ConstrainedTypeQueryBuilder} when allowed types are given.
     *
     * @param allowedTypes fully-qualified subtype tags, or null/empty for no constraint
     */
    public static QueryBuilder forTarget(String label, List<String> columns,
                                         Function<Node, List<?>> valueExtractor,
                                         Collection<String> allowedTypes) {
        if (allowedTypes == null || allowedTypes.isEmpty()) {
            return new QueryBuilder(label, columns, valueExtractor);
        }
        return new ConstrainedTypeQueryBuilder(label, columns, valueExtractor, allowedTypes);
    }

    public String getLabel() {
        return label;
    }

    public List<String> getColumns() {
        return columns;
    }

    /**
     * Builds the query for the given nodes.
     *
     * @throws IllegalArgumentException if there are no nodes, or a node yields the wrong number of values
     */
    public LookupQuery build(Collection<Node> nodes) {
        if (nodes == null || nodes.isEmpty()) {
            throw new IllegalArgumentException("At least one node is required");
        }
        String cypher = QUERY_TEMPLATE.formatted(label, String.join(" AND ", whereConditions()));
        return new LookupQuery(cypher, params(nodes), nodes.size());
    }

    protected List<String> whereConditions() {
        List<String> conditions = new ArrayList<>();
        for (int i = 0; i < columns.size(); i++) {
            conditions.add("t." + columns.get(i) + " = row.v" + i);
        }
        return conditions;
    }

    protected Map<String, Object> params(Collection<Node> nodes) {
        List<Map<String, Object>> rows = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            rows.add(row(node));
        }
        Map<String, Object> params = new LinkedHashMap<>();
        params.put(ROWS_PARAM, rows);
        return params;
    }

    private Map<String, Object> row(Node node) {
        List<?> values = valueExtractor.apply(node);
        if (values == null || values.size() != columns.size()) {
            throw new IllegalArgumentException("Node " + node.getId() + " yields " +
                    (values == null ? 0 : values.size()) + " values for " + columns.size() + " columns");
        }
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(NODE_ID, node.getId());
        for (int i = 0; i < values.size(); i++) {
            Object value = values.get(i);
            if (value instanceof String s) {
                InputSanitizer.sanitizeForCypher(s);
            }
            row.put("v" + i, value);
        }
        return row;
    }
}
