package org.kmerweaver.assembly;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.kmerweaver.exceptions.UserException;
import org.kmerweaver.utils.Utils;

/**
 * Chooses the node an Eulerian walk of a {@link DeBruijnGraph} starts from.
 *
 * Nodes are scanned in the graph's iteration order. The unique node whose out-degree exceeds its in-degree
 * by exactly one (the source of an Eulerian path) wins. When no such node exists, the first balanced node
 * is used, which is correct when the graph is a single Eulerian circuit.
 */
public final class EulerianStartSelector {
    private static final Logger logger = LogManager.getLogger(EulerianStartSelector.class);

    private EulerianStartSelector() {}

    /**
     * @return the start node
     * @throws UserException.NoValidStartNode if the graph is empty or has neither a source nor a balanced node
     * @throws UserException.AmbiguousStartNode if more than one node has out-degree one greater than its in-degree
     */
    public static String selectStartNode(final DeBruijnGraph graph) {
        Utils.nonNull(graph, "graph");

        String source = null;
        String firstBalanced = null;
        for ( final String node : graph.getNodes() ) {
            final int imbalance = graph.getOutDegree(node) - graph.getInDegree(node);
            if ( imbalance == 1 ) {
                if ( source != null ) {
                    throw new UserException.AmbiguousStartNode(source, node);
                }
                source = node;
            } else if ( imbalance == 0 && firstBalanced == null ) {
                firstBalanced = node;
            }
        }

        if ( source != null ) {
            logger.debug("Starting Eulerian path at source node " + source);
            return source;
        }
        if ( firstBalanced != null ) {
            logger.debug("No source node found; starting Eulerian circuit at balanced node " + firstBalanced);
            return firstBalanced;
        }
        throw new UserException.NoValidStartNode(graph.getNodeCount());
    }
}
