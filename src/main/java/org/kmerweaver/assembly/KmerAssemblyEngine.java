package org.kmerweaver.assembly;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.kmerweaver.exceptions.UserException;
import org.kmerweaver.utils.Utils;

import java.util.List;

/**
 * Reconstructs a sequence from its k-mers: builds the de Bruijn graph, picks the start of the Eulerian walk
 * and walks it.
 *
 * An engine holds no state between calls apart from its leniency, so one instance can assemble any number of
 * k-mer lists. Each call builds a fresh graph.
 */
public final class KmerAssemblyEngine {
    private static final Logger logger = LogManager.getLogger(KmerAssemblyEngine.class);

    private final EulerianPathReconstructor reconstructor;

    public KmerAssemblyEngine() {
        this(false);
    }

    /**
     * @param lenient if true, k-mers that the Eulerian walk cannot reach are reported as a warning and the
     *                partial sequence is returned
     */
    public KmerAssemblyEngine(final boolean lenient) {
        this.reconstructor = new EulerianPathReconstructor(lenient);
    }

    /**
     * Checks that every k-mer has at least two characters and that all k-mers have the same length.
     * An empty list is valid.
     *
     * @throws UserException.MalformedKmers naming the first offending k-mer
     */
    public static void validateKmers(final List<String> kmers) {
        Utils.nonNull(kmers, "kmers");
        int expectedLength = -1;
        for ( int i = 0; i < kmers.size(); i++ ) {
            final String kmer = kmers.get(i);
            if ( kmer == null ) {
                throw new UserException.MalformedKmers(i, "null", "is missing");
            }
            if ( kmer.isEmpty() ) {
                throw new UserException.MalformedKmers(i, kmer, "is empty; check for doubled or trailing delimiters");
            }
            if ( kmer.length() < 2 ) {
                throw new UserException.MalformedKmers(i, kmer, "is shorter than two characters");
            }
            if ( expectedLength < 0 ) {
                expectedLength = kmer.length();
            } else if ( kmer.length() != expectedLength ) {
                throw new UserException.MalformedKmers(i, kmer,
                        String.format("has length %d but the first k-mer has length %d", kmer.length(), expectedLength));
            }
        }
    }

    /**
     * Validates {@code kmers} and builds their de Bruijn graph.
     */
    public DeBruijnGraph buildGraph(final List<String> kmers) {
        validateKmers(kmers);
        return DeBruijnGraphBuilder.build(kmers);
    }

    /**
     * Reconstructs the sequence spelled by an Eulerian walk of {@code graph}. The graph is consumed.
     * @throws IllegalStateException if {@code graph} has already been walked
     */
    public AssemblyResult assemble(final DeBruijnGraph graph) {
        Utils.nonNull(graph, "graph");
        final String startNode = EulerianStartSelector.selectStartNode(graph);
        final EulerianPath path = reconstructor.reconstruct(graph, startNode);
        final AssemblyResult result = new AssemblyResult(path, graph);
        logger.info(String.format("Reconstructed a sequence of length %d from %d k-mers (%d nodes), starting at %s",
                result.getSequence().length(), result.getEdgeCount(), result.getNodeCount(), startNode));
        return result;
    }

    /**
     * Validates {@code kmers}, builds their graph and reconstructs the sequence.
     */
    public AssemblyResult assemble(final List<String> kmers) {
        return assemble(buildGraph(kmers));
    }
}
