package org.kmerweaver.assembly;

import org.kmerweaver.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The ordered nodes of a walk through a {@link DeBruijnGraph}, and the sequence they spell.
 *
 * Consecutive nodes overlap by all but one character, so the sequence is the first node followed by the last
 * character of each subsequent node.
 */
public final class EulerianPath {

    private final List<String> nodes;
    private final String sequence;

    public EulerianPath(final List<String> nodes) {
        Utils.nonNull(nodes, "nodes");
        Utils.validateArg(!nodes.isEmpty(), "A path needs at least one node");
        Utils.containsNoNull(nodes, "A path cannot contain null nodes");
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
        this.sequence = spell(nodes);
    }

    private static String spell(final List<String> nodes) {
        final StringBuilder builder = new StringBuilder(nodes.get(0));
        for ( int i = 1; i < nodes.size(); i++ ) {
            final String node = nodes.get(i);
            builder.append(node.charAt(node.length() - 1));
        }
        return builder.toString();
    }

    public List<String> getNodes() {
        return nodes;
    }

    public String getSequence() {
        return sequence;
    }

    public String getFirstNode() {
        return nodes.get(0);
    }

    public String getLastNode() {
        return nodes.get(nodes.size() - 1);
    }

    /**
     * @return the number of edges walked
     */
    public int getEdgeCount() {
        return nodes.size() - 1;
    }

    /** @return true if the walk ends where it started and uses at least one edge */
    public boolean isCircuit() {
        return nodes.size() > 1 && getFirstNode().equals(getLastNode());
    }

    @Override
    public String toString() {
        return String.join("->", nodes);
    }
}
