package com.metadata.disambiguation.query;

import com.metadata.disambiguation.core.model.Node;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * {@link QueryBuilder} that additionally restricts matched records to a set of concrete subtypes.
 * Adds one predicate on the type column and one bound parameter holding the allowed tags.
 */
public class ConstrainedTypeQueryBuilder extends QueryBuilder {

    public static final String ALLOWED_TYPES_PARAM = "allowed_types";

    private final List<String> allowedTypes;

    public ConstrainedTypeQueryBuilder(String label, List<String> columns,
                                       Function<Node, List<?>> valueExtractor,
                                       Collection<String> allowedTypes) {
        super(label, columns, valueExtractor);
        if (allowedTypes == null || allowedTypes.isEmpty()) {
            throw new IllegalArgumentException("At least one allowed type is required");
        }
        this.allowedTypes = List.copyOf(allowedTypes);
    }

    public List<String> getAllowedTypes() {
        return allowedTypes;
    }

    @Override
    protected List<String> whereConditions() {
        List<String> conditions = new ArrayList<>(super.whereConditions());
        conditions.add("t." + TYPE_COLUMN + " IN $" + ALLOWED_TYPES_PARAM);
        return conditions;
    }

    @Override
    protected Map<String, Object> params(Collection<Node> nodes) {
        Map<String, Object> params = super.params(nodes);
        params.put(ALLOWED_TYPES_PARAM, allowedTypes);
        return params;
    }
}
