package org.kmerweaver.assembly;

import org.kmerweaver.utils.Utils;

/**
 * The outcome of {@link KmerAssemblyEngine#assemble}: the walked path and the statistics of the graph it came from.
 */
public final class AssemblyResult {

    private final EulerianPath path;
    private final int kmerSize;
    private final int nodeCount;
    private final long edgeCount;
    private final long unconsumedEdgeCount;

    public AssemblyResult(final EulerianPath path, final DeBruijnGraph graph) {
        Utils.nonNull(path, "path");
        Utils.nonNull(graph, "graph");
        this.path = path;
        this.kmerSize = graph.getKmerSize();
        this.nodeCount = graph.getNodeCount();
        this.edgeCount = graph.getEdgeCount();
        this.unconsumedEdgeCount = graph.getRemainingEdgeCount();
    }

    public EulerianPath getPath() {
        return path;
    }

    public String getSequence() {
        return path.getSequence();
    }

    public String getStartNode() {
        return path.getFirstNode();
    }

    public int getKmerSize() {
        return kmerSize;
    }

    public int getNodeCount() {
        return nodeCount;
    }

    public long getEdgeCount() {
        return edgeCount;
    }

    public long getUnconsumedEdgeCount() {
        return unconsumedEdgeCount;
    }

    /** @return true if every k-mer was used by the walk */
    public boolean isComplete() {
        return unconsumedEdgeCount == 0;
    }

    public AssemblyMetrics toMetrics() {
        final AssemblyMetrics metrics = new AssemblyMetrics();
        metrics.KMER_COUNT = edgeCount;
        metrics.KMER_SIZE = kmerSize;
        metrics.NODE_COUNT = nodeCount;
        metrics.EDGE_COUNT = edgeCount;
        metrics.START_NODE = path.getFirstNode();
        metrics.END_NODE = path.getLastNode();
        metrics.CIRCUIT = path.isCircuit();
        metrics.SEQUENCE_LENGTH = path.getSequence().length();
        metrics.UNCONSUMED_EDGES = unconsumedEdgeCount;
        return metrics;
    }
}
