package org.kmerweaver.assembly;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.kmerweaver.exceptions.UserException;
import org.kmerweaver.utils.Utils;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedList;

/**
 * Walks a {@link DeBruijnGraph} from a start node, consuming every reachable edge exactly once (Hierholzer's
 * algorithm), and returns the resulting {@link EulerianPath}.
 *
 * The walk keeps an explicit stack rather than recursing, so path length is bounded by heap, not by thread
 * stack size. The node on top of the stack follows its most recently added unconsumed edge; a node with no
 * edges left is popped and prepended to the path.
 *
 * The graph is consumed by the walk. Edges left over afterwards mean no single walk from the start node covers
 * the graph; this is an error unless the reconstructor is lenient, in which case the partial path is returned.
 */
public final class EulerianPathReconstructor {
    private static final Logger logger = LogManager.getLogger(EulerianPathReconstructor.class);

    private final boolean lenient;

    public EulerianPathReconstructor() {
        this(false);
    }

    /**
     * @param lenient if true, edges left unconsumed by the walk are reported as a warning instead of an error
     */
    public EulerianPathReconstructor(final boolean lenient) {
        this.lenient = lenient;
    }

    public boolean isLenient() {
        return lenient;
    }

    /**
     * @param graph graph to walk; it is consumed and cannot be walked again
     * @param startNode node of {@code graph} to start from
     * @throws IllegalStateException if {@code graph} has already been walked
     * @throws UserException.IncompleteEulerianPath if edges remain after the walk and this reconstructor is not lenient
     */
    public EulerianPath reconstruct(final DeBruijnGraph graph, final String startNode) {
        Utils.nonNull(graph, "graph");
        Utils.nonNull(startNode, "startNode");
        Utils.validateArg(graph.containsNode(startNode), () -> "Start node " + startNode + " is not in the graph");
        graph.markTraversed();

        final Deque<String> stack = new ArrayDeque<>();
        final LinkedList<String> path = new LinkedList<>();
        stack.push(startNode);
        while ( !stack.isEmpty() ) {
            final String current = stack.peek();
            final String next = graph.removeLastSuccessor(current);
            if ( next != null ) {
                stack.push(next);
            } else {
                path.addFirst(stack.pop());
            }
        }

        final long unconsumed = graph.getRemainingEdgeCount();
        if ( unconsumed > 0 ) {
            final UserException.IncompleteEulerianPath incomplete =
                    new UserException.IncompleteEulerianPath(startNode, unconsumed, graph.getEdgeCount());
            if ( !lenient ) {
                throw incomplete;
            }
            Utils.warnUser(logger, incomplete.getMessage());
        }

        final EulerianPath eulerianPath = new EulerianPath(new ArrayList<>(path));
        logger.debug(String.format("Walked %d of %d edges from %s to %s",
                eulerianPath.getEdgeCount(), graph.getEdgeCount(), eulerianPath.getFirstNode(), eulerianPath.getLastNode()));
        return eulerianPath;
    }
}
