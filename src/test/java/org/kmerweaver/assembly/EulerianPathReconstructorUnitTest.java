package org.kmerweaver.assembly;

import org.kmerweaver.KmerWeaverBaseTest;
import org.kmerweaver.exceptions.UserException;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.List;

public final class EulerianPathReconstructorUnitTest extends KmerWeaverBaseTest {

    @DataProvider(name = "reconstructions")
    public Object[][] reconstructions() {
        return new Object[][]{
                {Arrays.asList("AAB", "ABC", "BCD", "CDA"), "AA", Arrays.asList("AA", "AB", "BC", "CD", "DA")},
                {Arrays.asList("ABA", "BAB"), "AB", Arrays.asList("AB", "BA", "AB")},
                // two loops through A: the most recently added edge is followed first
                {Arrays.asList("AB", "BA", "AC", "CA"), "A", Arrays.asList("A", "C", "A", "B", "A")},
                // a repeated k-mer is walked once per occurrence
                {Arrays.asList("AAA", "AAA", "AAC"), "AA", Arrays.asList("AA", "AA", "AA", "AC")},
        };
    }

    @Test(dataProvider = "reconstructions")
    public void testReconstruct(final List<String> kmers, final String start, final List<String> expectedNodes) {
        final DeBruijnGraph graph = DeBruijnGraphBuilder.build(kmers);
        final EulerianPath path = new EulerianPathReconstructor().reconstruct(graph, start);
        Assert.assertEquals(path.getNodes(), expectedNodes);
        Assert.assertEquals(path.getEdgeCount(), kmers.size());
        Assert.assertEquals(graph.getRemainingEdgeCount(), 0);
        Assert.assertTrue(graph.isTraversed());
    }

    @Test
    public void testStartNodeWithoutEdges() {
        final DeBruijnGraph graph = new DeBruijnGraph();
        graph.addNode("AC");
        final EulerianPath path = new EulerianPathReconstructor().reconstruct(graph, "AC");
        Assert.assertEquals(path.getSequence(), "AC");
    }

    private static DeBruijnGraph twoDisjointCycles() {
        return DeBruijnGraphBuilder.build(Arrays.asList("ACA", "CAC", "GTG", "TGT"));
    }

    @Test
    public void testDisconnectedGraphFails() {
        try {
            new EulerianPathReconstructor().reconstruct(twoDisjointCycles(), "AC");
            Assert.fail("Expected IncompleteEulerianPath");
        } catch ( final UserException.IncompleteEulerianPath e ) {
            assertContains(e.getMessage(), "used only 2 of 4 k-mers");
            assertContains(e.getMessage(), "--lenient");
        }
    }

    @Test
    public void testLenientReturnsPartialPath() {
        final EulerianPathReconstructor reconstructor = new EulerianPathReconstructor(true);
        Assert.assertTrue(reconstructor.isLenient());
        final DeBruijnGraph graph = twoDisjointCycles();
        final EulerianPath path = reconstructor.reconstruct(graph, "AC");
        Assert.assertEquals(path.getSequence(), "ACAC");
        Assert.assertTrue(path.isCircuit());
        Assert.assertEquals(graph.getRemainingEdgeCount(), 2);
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testSecondReconstructionFails() {
        final DeBruijnGraph graph = DeBruijnGraphBuilder.build(Arrays.asList("ACG", "CGT"));
        final EulerianPathReconstructor reconstructor = new EulerianPathReconstructor();
        reconstructor.reconstruct(graph, "AC");
        reconstructor.reconstruct(graph, "AC");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testUnknownStartNode() {
        new EulerianPathReconstructor().reconstruct(DeBruijnGraphBuilder.build(Arrays.asList("ACG")), "GT");
    }

    @Test
    public void testLongPathDoesNotOverflowTheStack() {
        // a single node with a long run of self loops walks as deep as it is long
        final int loops = 200_000;
        final DeBruijnGraph graph = new DeBruijnGraph();
        for ( int i = 0; i < loops; i++ ) {
            graph.addKmer("AAA");
        }
        final EulerianPath path = new EulerianPathReconstructor().reconstruct(graph, "AA");
        Assert.assertEquals(path.getSequence().length(), loops + 2);
    }
}
