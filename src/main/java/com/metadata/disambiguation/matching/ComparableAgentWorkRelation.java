package com.metadata.disambiguation.matching;

import com.metadata.disambiguation.core.model.Node;
import com.metadata.disambiguation.graph.AgentWorkRelationRow;
import com.metadata.disambiguation.names.HumanName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Ranks one persisted agent/work relation against one incoming relation node by how closely their names agree.
 *
 * <p>The sort key is the name vector of the cited-as names, the name vector of the agents'
 * canonical names, then whether the citation order agrees and whether the concrete relation
 * type agrees. A name vector is (full name equal, first and last equal, first initial and last equal).
 * Keys compare lexicographically with {@code false < true}.</p>
 */
public class ComparableAgentWorkRelation {

    /**
     * Orders by sort key, ascending. Reverse it to put the best candidate first.
     */
    public static final Comparator<ComparableAgentWorkRelation> BY_SORT_KEY =
            (a, b) -> compareKeys(a.sortKey, b.sortKey);

    private final AgentWorkRelationRow relation;
    private final Node node;
    private final List<Boolean> nameKey;
    private final List<Boolean> sortKey;

    public ComparableAgentWorkRelation(RelationNames<Node> nodeNames,
                                       RelationNames<AgentWorkRelationRow> relationNames) {
        this.node = nodeNames.source();
        this.relation = relationNames.source();
        this.nameKey = nameKey(relationNames.citedAs(), nodeNames.citedAs());

        List<Boolean> key = new ArrayList<>(nameKey);
        key.addAll(nameKey(relationNames.agentName(), nodeNames.agentName()));
        key.add(Objects.equals(relation.orderCited(), orderCited(node)));
        key.add(Objects.equals(relation.relation().modelName(), node.getType()));
        this.sortKey = Collections.unmodifiableList(key);
    }

    public AgentWorkRelationRow getRelation() {
        return relation;
    }

    public Node getNode() {
        return node;
    }

    public List<Boolean> getSortKey() {
        return sortKey;
    }

    /**
     * A candidate is only valid if at least one component of the cited-as name vector agrees.
     */
    public boolean isValidMatch() {
        return nameKey.contains(Boolean.TRUE);
    }

    static List<Boolean> nameKey(HumanName name, HumanName target) {
        return List.of(
                name.fullName().equals(target.fullName()),
                name.first().equals(target.first()) && name.last().equals(target.last()),
                Objects.equals(name.firstInitial(), target.firstInitial()) && name.last().equals(target.last())
        );
    }

    private static Long orderCited(Node node) {
        Object value = node.attr("order_cited");
        if (value instanceof Number n) {
            return n.longValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static int compareKeys(List<Boolean> a, List<Boolean> b) {
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int cmp = Boolean.compare(a.get(i), b.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(a.size(), b.size());
    }

    @Override
    public String toString() {
        return "ComparableAgentWorkRelation{" +
                "relation=" + relation.relation() +
                ", node=" + node.getId() +
                ", sortKey=" + sortKey +
                '}';
    }
}
