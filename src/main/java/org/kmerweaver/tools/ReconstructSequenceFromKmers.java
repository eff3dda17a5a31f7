package org.kmerweaver.tools;

import htsjdk.samtools.metrics.MetricsFile;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.barclay.argparser.PositionalArguments;
import org.broadinstitute.barclay.help.DocumentedFeature;
import org.kmerweaver.assembly.AssemblyMetrics;
import org.kmerweaver.assembly.AssemblyResult;
import org.kmerweaver.assembly.DeBruijnGraph;
import org.kmerweaver.assembly.KmerAssemblyEngine;
import org.kmerweaver.cmdline.CommandLineProgram;
import org.kmerweaver.cmdline.StandardArgumentDefinitions;
import org.kmerweaver.cmdline.programgroups.AssemblyProgramGroup;
import org.kmerweaver.exceptions.UserException;
import org.kmerweaver.utils.config.ConfigFactory;
import org.kmerweaver.utils.io.IOUtils;
import org.kmerweaver.utils.io.KmerListReader;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reconstruct a DNA sequence from the unordered collection of its overlapping k-mers.
 *
 * <p>The k-mers are turned into a de Bruijn graph whose nodes are (k-1)-mers and whose edges are the k-mers
 * themselves. The sequence is spelled by an Eulerian path of that graph, a walk that uses every k-mer exactly
 * once. The walk starts at the node with one more outgoing than incoming k-mer, or, if the k-mers come from a
 * circular sequence, at the first node that is balanced.</p>
 *
 * <p>If the k-mers cannot all be placed on a single walk the tool fails, unless --lenient is given, in which case
 * the sequence spelled by the part of the graph that was reached is written and a warning is logged.</p>
 *
 * <h3>Input</h3>
 * <ul>
 *     <li>A text file of k-mers of equal length separated by commas (or by --kmer-delimiter), optionally gzipped</li>
 * </ul>
 *
 * <h3>Output</h3>
 * <ul>
 *     <li>reconstructed_sequence.txt in the output directory, holding the sequence with no trailing newline</li>
 *     <li>Optionally, a metrics file summarizing the graph and the walk</li>
 *     <li>Optionally, the de Bruijn graph in Graphviz DOT format</li>
 * </ul>
 *
 * <h3>Example</h3>
 *
 * <pre>
 *   kmerweaver ReconstructSequenceFromKmers \
 *     kmers.txt \
 *     --output-directory results \
 *     --metrics-file results/assembly_metrics.txt
 * </pre>
 */
@CommandLineProgramProperties(
        summary = "Reconstructs a DNA sequence from its overlapping k-mers by finding an Eulerian path through " +
                "their de Bruijn graph, and writes it to " + ReconstructSequenceFromKmers.OUTPUT_FILE_NAME,
        oneLineSummary = "Reconstruct a sequence from its k-mers",
        programGroup = AssemblyProgramGroup.class
)
@DocumentedFeature
public final class ReconstructSequenceFromKmers extends CommandLineProgram {

    /** The name of the file the reconstructed sequence is written to. */
    public static final String OUTPUT_FILE_NAME = "reconstructed_sequence.txt";

    @PositionalArguments(minElements = 1, maxElements = 1, doc = "File of delimiter-separated k-mers")
    public List<File> inputs = new ArrayList<>();

    @Argument(fullName = StandardArgumentDefinitions.OUTPUT_DIRECTORY_LONG_NAME,
            shortName = StandardArgumentDefinitions.OUTPUT_DIRECTORY_SHORT_NAME,
            doc = "Directory to write " + OUTPUT_FILE_NAME + " to", optional = true)
    public File outputDirectory = new File(".");

    @Argument(fullName = StandardArgumentDefinitions.KMER_DELIMITER_LONG_NAME,
            shortName = StandardArgumentDefinitions.KMER_DELIMITER_SHORT_NAME,
            doc = "Separator between k-mers in the input file", optional = true)
    public String kmerDelimiter = ConfigFactory.getInstance().getKmerWeaverConfig().kmer_delimiter();

    @Argument(fullName = StandardArgumentDefinitions.LENIENT_LONG_NAME,
            shortName = StandardArgumentDefinitions.LENIENT_SHORT_NAME,
            doc = "Write the partial sequence, with a warning, when the k-mers cannot all be placed on one path",
            optional = true)
    public boolean lenient = false;

    @Argument(fullName = StandardArgumentDefinitions.METRICS_FILE_LONG_NAME,
            shortName = StandardArgumentDefinitions.METRICS_FILE_SHORT_NAME,
            doc = "File to write assembly metrics to", optional = true)
    public File metricsFile = null;

    @Argument(fullName = StandardArgumentDefinitions.GRAPH_OUTPUT_LONG_NAME,
            shortName = StandardArgumentDefinitions.GRAPH_OUTPUT_SHORT_NAME,
            doc = "File to write the de Bruijn graph to, in Graphviz DOT format", optional = true)
    public File graphOutput = null;

    @Override
    protected String[] customCommandLineValidation() {
        if (kmerDelimiter == null || kmerDelimiter.isEmpty()) {
            return new String[]{"The --" + StandardArgumentDefinitions.KMER_DELIMITER_LONG_NAME + " argument may not be empty"};
        }
        return null;
    }

    @Override
    protected Object doWork() {
        final Path inputPath = inputs.get(0).toPath();
        final KmerListReader reader = new KmerListReader(kmerDelimiter,
                ConfigFactory.getInstance().getKmerWeaverConfig().trim_kmer_whitespace());
        final List<String> kmers = reader.readKmers(inputPath);

        final KmerAssemblyEngine engine = new KmerAssemblyEngine(lenient);
        final DeBruijnGraph graph = engine.buildGraph(kmers);
        if (graphOutput != null) {
            writeGraph(graph, graphOutput);
        }

        final AssemblyResult result = engine.assemble(graph);

        final Path outputPath = outputDirectory.toPath().resolve(OUTPUT_FILE_NAME);
        IOUtils.writeStringToPath(outputPath, result.getSequence());
        logger.info("Reconstructed sequence saved to " + outputPath);

        if (metricsFile != null) {
            final MetricsFile<AssemblyMetrics, Integer> metrics = getMetricsFile();
            metrics.addMetric(result.toMetrics());
            metrics.write(metricsFile);
        }
        return outputPath.toString();
    }

    private static void writeGraph(final DeBruijnGraph graph, final File destination) {
        try ( final PrintStream out = new PrintStream(destination) ) {
            graph.printGraph(out);
        } catch ( final FileNotFoundException e ) {
            throw new UserException.CouldNotCreateOutputFile(destination.getAbsolutePath(), "it could not be opened", e);
        }
    }
}
