package com.metadata.disambiguation.matching;

import com.metadata.disambiguation.core.model.MatchSet;
import com.metadata.disambiguation.core.model.Node;

import java.util.Collection;
import java.util.List;

/**
 * Matching passes that map incoming nodes to persisted records.
 *
 * <p>Every pass reads and extends the {@link MatchSet} it is given. Passes depend on the matches
 * of earlier passes (many-to-one needs the related nodes matched first), so the caller runs them
 * in a fixed order. No pass mutates the node graph. Passes return the number of new matches.</p>
 */
public interface MatchingStrategy {

    /**
     * Resolves nodes whose id is an obfuscated reference to an existing record.
     * Local ids are skipped and malformed ids are ignored.
     */
    int initialPass(Collection<Node> nodes, MatchSet matches);

    /**
     * Matches nodes to records of the target whose named attributes are all exactly equal.
     *
     * @param allowedSubtypes restricts matched records to these subtypes; null or empty for none
     */
    int matchByAttrs(Collection<Node> nodes, String target, List<String> attrNames,
                     Collection<String> allowedSubtypes, MatchSet matches);

    /**
     * Matches nodes to records of the target whose foreign keys equal the single match of each named
     * relation's node. Nodes with an unmatched related node are left out.
     *
     * @return {@link ManyToOneOutcome.Ambiguous} if any related node has more than one match
     */
    ManyToOneOutcome matchByManyToOne(Collection<Node> nodes, String target, List<String> relationNames,
                                      Collection<String> allowedSubtypes, MatchSet matches);

    /**
     * Matches nodes to the records of the target that the matches of their to-many related nodes point back at.
     */
    int matchByOneToMany(Collection<Node> nodes, String target, String relationName, MatchSet matches);

    /**
     * Matches subject nodes by URI, then by name, within the central taxonomy or the configured source's taxonomy.
     */
    int matchSubjects(Collection<Node> nodes, MatchSet matches);

    /**
     * Matches agent/work relation nodes and their agents by comparing parsed names against the
     * relations already persisted on the matched work.
     */
    int matchAgentWorkRelations(Collection<Node> nodes, MatchSet matches);
}
