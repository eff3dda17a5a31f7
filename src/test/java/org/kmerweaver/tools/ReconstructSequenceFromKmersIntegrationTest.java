package org.kmerweaver.tools;

import htsjdk.samtools.metrics.MetricsFile;
import org.apache.commons.io.FileUtils;
import org.broadinstitute.barclay.argparser.CommandLineException;
import org.kmerweaver.CommandLineProgramTest;
import org.kmerweaver.assembly.AssemblyMetrics;
import org.kmerweaver.cmdline.StandardArgumentDefinitions;
import org.kmerweaver.exceptions.UserException;
import org.kmerweaver.testutils.ArgumentsBuilder;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.List;

public final class ReconstructSequenceFromKmersIntegrationTest extends CommandLineProgramTest {

    private static String readOutput(final File outputDir) throws IOException {
        return FileUtils.readFileToString(new File(outputDir, ReconstructSequenceFromKmers.OUTPUT_FILE_NAME), StandardCharsets.UTF_8);
    }

    @DataProvider(name = "inputs")
    public Object[][] inputs() {
        return new Object[][]{
                {"kmers.txt", "AABCDA"},
                {"alternating.txt", "ABAB"},
                {"circular.txt", "GCATGGCA"},
                {"shuffled.txt", "ATGGCGTGCA"},
        };
    }

    @Test(dataProvider = "inputs")
    public void testReconstruct(final String inputName, final String expectedSequence) throws IOException {
        final File outputDir = createTempDir("reconstruct");
        final ArgumentsBuilder args = new ArgumentsBuilder()
                .addPositional(getTestFile(inputName))
                .addOutputDirectory(outputDir);

        final Object result = runCommandLine(args);

        final File expectedOutput = new File(outputDir, ReconstructSequenceFromKmers.OUTPUT_FILE_NAME);
        Assert.assertEquals(result, expectedOutput.toPath().toString());
        // written exactly, with no trailing newline
        Assert.assertEquals(readOutput(outputDir), expectedSequence);
    }

    @Test
    public void testOverwritesExistingOutput() throws IOException {
        final File outputDir = createTempDir("overwrite");
        FileUtils.writeStringToFile(new File(outputDir, ReconstructSequenceFromKmers.OUTPUT_FILE_NAME), "stale contents\n", StandardCharsets.UTF_8);
        runCommandLine(new ArgumentsBuilder().addPositional(getTestFile("kmers.txt")).addOutputDirectory(outputDir));
        Assert.assertEquals(readOutput(outputDir), "AABCDA");
    }

    @Test
    public void testCustomDelimiter() throws IOException {
        final File outputDir = createTempDir("delimiter");
        runCommandLine(new ArgumentsBuilder()
                .addPositional(getTestFile("semicolon.txt"))
                .addOutputDirectory(outputDir)
                .add(StandardArgumentDefinitions.KMER_DELIMITER_LONG_NAME, ";"));
        Assert.assertEquals(readOutput(outputDir), "AABCDA");
    }

    @Test
    public void testMetricsAndGraphOutput() throws IOException {
        final File outputDir = createTempDir("metrics");
        final File metricsFile = new File(outputDir, "assembly_metrics.txt");
        final File graphFile = new File(outputDir, "graph.dot");
        runCommandLine(new ArgumentsBuilder()
                .addPositional(getTestFile("kmers.txt"))
                .addOutputDirectory(outputDir)
                .add(StandardArgumentDefinitions.METRICS_FILE_LONG_NAME, metricsFile)
                .add(StandardArgumentDefinitions.GRAPH_OUTPUT_LONG_NAME, graphFile));

        final MetricsFile<AssemblyMetrics, Integer> metrics = new MetricsFile<>();
        try ( final Reader reader = new FileReader(metricsFile) ) {
            metrics.read(reader);
        }
        final List<AssemblyMetrics> rows = metrics.getMetrics();
        Assert.assertEquals(rows.size(), 1);
        final AssemblyMetrics row = rows.get(0);
        Assert.assertEquals(row.KMER_COUNT, 4);
        Assert.assertEquals(row.KMER_SIZE, 3);
        Assert.assertEquals(row.NODE_COUNT, 5);
        Assert.assertEquals(row.START_NODE, "AA");
        Assert.assertEquals(row.END_NODE, "DA");
        Assert.assertEquals(row.SEQUENCE_LENGTH, 6);
        Assert.assertEquals(row.UNCONSUMED_EDGES, 0);

        final String dot = FileUtils.readFileToString(graphFile, StandardCharsets.UTF_8);
        assertContains(dot, "digraph deBruijnGraph {");
        assertContains(dot, "\"CD\" -> \"DA\" [label=\"CDA\"];");
    }

    @Test(expectedExceptions = UserException.IncompleteEulerianPath.class)
    public void testDisconnectedKmersFail() {
        runCommandLine(new ArgumentsBuilder()
                .addPositional(getTestFile("disconnected.txt"))
                .addOutputDirectory(createTempDir("disconnected")));
    }

    @Test
    public void testLenientWritesPartialSequence() throws IOException {
        final File outputDir = createTempDir("lenient");
        runCommandLine(new ArgumentsBuilder()
                .addPositional(getTestFile("disconnected.txt"))
                .addOutputDirectory(outputDir)
                .addFlag(StandardArgumentDefinitions.LENIENT_LONG_NAME));
        Assert.assertEquals(readOutput(outputDir), "ACAC");
    }

    @Test(expectedExceptions = UserException.NoValidStartNode.class)
    public void testEmptyInput() {
        runCommandLine(new ArgumentsBuilder()
                .addPositional(getTestFile("empty.txt"))
                .addOutputDirectory(createTempDir("empty")));
    }

    @Test(expectedExceptions = UserException.AmbiguousStartNode.class)
    public void testTwoSources() {
        runCommandLine(new ArgumentsBuilder()
                .addPositional(getTestFile("two_sources.txt"))
                .addOutputDirectory(createTempDir("twoSources")));
    }

    @Test(expectedExceptions = UserException.MalformedKmers.class)
    public void testMixedLengthKmers() {
        runCommandLine(new ArgumentsBuilder()
                .addPositional(getTestFile("mixed_lengths.txt"))
                .addOutputDirectory(createTempDir("mixed")));
    }

    @Test(expectedExceptions = UserException.CouldNotReadInputFile.class)
    public void testMissingInput() {
        runCommandLine(new ArgumentsBuilder()
                .addPositional(getSafeNonExistentFile("kmers.txt"))
                .addOutputDirectory(createTempDir("missing")));
    }

    @Test(expectedExceptions = CommandLineException.class)
    public void testNoInput() {
        runCommandLine(new ArgumentsBuilder().addOutputDirectory(createTempDir("noInput")));
    }

    @Test(expectedExceptions = CommandLineException.class)
    public void testTooManyInputs() {
        runCommandLine(new ArgumentsBuilder()
                .addPositional(getTestFile("kmers.txt"))
                .addPositional(getTestFile("circular.txt"))
                .addOutputDirectory(createTempDir("tooMany")));
    }
}
