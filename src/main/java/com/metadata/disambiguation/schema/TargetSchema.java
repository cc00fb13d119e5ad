package com.metadata.disambiguation.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Static description of one persisted relation that nodes can be matched against.
 *
 * @param name             short name, e.g. {@code creativework}
 * @param label            graph label the records are stored under, e.g. {@code CreativeWork}
 * @param typeCode         numeric code used in obfuscated ids
 * @param typeColumn       column holding the concrete subtype tag
 * @param subtypes         concrete subtypes stored under this label
 * @param attributes       attribute name to column
 * @param relations        to-one relation name to foreign-key column on this relation
 * @param reverseRelations to-many relation name to the foreign-key column on the related
 *                         relation that points back at this one
 * @param appLabel         namespace used to qualify subtype tags
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TargetSchema(
        String name,
        String label,
        int typeCode,
        String typeColumn,
        Set<String> subtypes,
        Map<String, String> attributes,
        Map<String, String> relations,
        Map<String, String> reverseRelations,
        String appLabel
) {
    public static final String DEFAULT_TYPE_COLUMN = "type";

    public TargetSchema {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(label, "label is required");
        typeColumn = typeColumn != null ? typeColumn : DEFAULT_TYPE_COLUMN;
        subtypes = subtypes != null ? Set.copyOf(subtypes) : Set.of(name);
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
        relations = relations != null ? Map.copyOf(relations) : Map.of();
        reverseRelations = reverseRelations != null ? Map.copyOf(reverseRelations) : Map.of();
    }

    TargetSchema withAppLabel(String appLabel) {
        return new TargetSchema(name, label, typeCode, typeColumn, subtypes, attributes, relations,
                reverseRelations, appLabel);
    }

    /**
     * Column holding an attribute.
     *
     * @throws IllegalArgumentException if the attribute is not described
     */
    public String column(String attribute) {
        return require(attributes, attribute, "attribute");
    }

    public List<String> columns(Collection<String> attributeNames) {
        return attributeNames.stream().map(this::column).toList();
    }

    /**
     * Foreign-key column of a to-one relation.
     *
     * @throws IllegalArgumentException if the relation is not described
     */
    public String relationColumn(String relation) {
        return require(relations, relation, "relation");
    }

    public List<String> relationColumns(Collection<String> relationNames) {
        return relationNames.stream().map(this::relationColumn).toList();
    }

    /**
     * Foreign-key column, on the related relation, behind a to-many relation.
     *
     * @throws IllegalArgumentException if the relation is not described
     */
    public String reverseRelationColumn(String relation) {
        return require(reverseRelations, relation, "reverse relation");
    }

    /**
     * Fully-qualified tag of a subtype, e.g. {@code share.article}.
     *
     * @throws IllegalArgumentException if the subtype is not stored under this label
     */
    public String qualifiedType(String subtype) {
        if (!subtypes.contains(subtype)) {
            throw new IllegalArgumentException("Unknown subtype '" + subtype + "' for " + name);
        }
        return appLabel != null ? appLabel + "." + subtype : subtype;
    }

    /**
     * Qualified tags for the given subtypes, in iteration order.
     */
    public Set<String> qualifiedTypes(Collection<String> subtypeNames) {
        Set<String> tags = new LinkedHashSet<>();
        for (String subtype : subtypeNames) {
            tags.add(qualifiedType(subtype));
        }
        return tags;
    }

    private String require(Map<String, String> map, String key, String kind) {
        String column = map.get(key);
        if (column == null) {
            throw new IllegalArgumentException("Unknown " + kind + " '" + key + "' for " + name);
        }
        return column;
    }
}
