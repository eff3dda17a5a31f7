package org.kmerweaver.assembly;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.kmerweaver.utils.Utils;

import java.util.List;

/**
 * Builds a {@link DeBruijnGraph} from an ordered list of k-mers.
 *
 * Each k-mer adds one edge from its prefix (all but its last character) to its suffix (all but its first
 * character), in list order. The builder does not check that the k-mers share a length or an alphabet;
 * callers that need that guarantee use {@link KmerAssemblyEngine#validateKmers(List)} first.
 */
public final class DeBruijnGraphBuilder {
    private static final Logger logger = LogManager.getLogger(DeBruijnGraphBuilder.class);

    private DeBruijnGraphBuilder() {}

    public static DeBruijnGraph build(final List<String> kmers) {
        Utils.nonNull(kmers, "kmers");
        final DeBruijnGraph graph = new DeBruijnGraph();
        for ( final String kmer : kmers ) {
            graph.addKmer(kmer);
        }
        logger.debug(String.format("Built de Bruijn graph with %d nodes and %d edges from %d k-mers",
                graph.getNodeCount(), graph.getEdgeCount(), kmers.size()));
        return graph;
    }
}
