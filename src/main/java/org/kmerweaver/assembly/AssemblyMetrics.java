package org.kmerweaver.assembly;

import htsjdk.samtools.metrics.MetricBase;

/** Summary of one reconstruction of a sequence from k-mers */
public final class AssemblyMetrics extends MetricBase {

    // Fields must be public and upper case so that MetricsFile can find and write them.

    /** The number of k-mers read from the input */
    public long KMER_COUNT;

    /** The length of each k-mer */
    public int KMER_SIZE;

    /** The number of distinct (k-1)-mers in the de Bruijn graph */
    public int NODE_COUNT;

    /** The number of edges in the de Bruijn graph, one per k-mer */
    public long EDGE_COUNT;

    /** The node the Eulerian walk started from */
    public String START_NODE;

    /** The node the Eulerian walk ended at */
    public String END_NODE;

    /** Whether the walk is a circuit, i.e. ends where it started */
    public boolean CIRCUIT;

    /** The length of the reconstructed sequence */
    public long SEQUENCE_LENGTH;

    /** The number of edges the walk could not reach; only non-zero in lenient mode */
    public long UNCONSUMED_EDGES;
}
