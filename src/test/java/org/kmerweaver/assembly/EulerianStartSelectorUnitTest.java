package org.kmerweaver.assembly;

import org.kmerweaver.KmerWeaverBaseTest;
import org.kmerweaver.exceptions.UserException;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public final class EulerianStartSelectorUnitTest extends KmerWeaverBaseTest {

    @DataProvider(name = "startNodes")
    public Object[][] startNodes() {
        return new Object[][]{
                // source node wins
                {Arrays.asList("AAB", "ABC", "BCD", "CDA"), "AA"},
                {Arrays.asList("ABA", "BAB"), "AB"},
                // source need not be first in iteration order
                {Arrays.asList("BCD", "ABC"), "AB"},
                // circuit: first balanced node in order of appearance
                {Arrays.asList("ACG", "CGA", "GAC"), "AC"},
                {Arrays.asList("GAC", "ACG", "CGA"), "GA"},
                // only the source is unbalanced by +1; sink and balanced nodes are skipped
                {Arrays.asList("AAA", "AAC"), "AA"},
        };
    }

    @Test(dataProvider = "startNodes")
    public void testSelectStartNode(final List<String> kmers, final String expectedStart) {
        Assert.assertEquals(EulerianStartSelector.selectStartNode(DeBruijnGraphBuilder.build(kmers)), expectedStart);
    }

    @Test(expectedExceptions = UserException.NoValidStartNode.class)
    public void testEmptyGraph() {
        EulerianStartSelector.selectStartNode(DeBruijnGraphBuilder.build(Collections.emptyList()));
    }

    @Test(expectedExceptions = UserException.NoValidStartNode.class)
    public void testNoSourceAndNoBalancedNode() {
        // every node has imbalance of -1, +2 or -1
        final DeBruijnGraph graph = new DeBruijnGraph();
        graph.addEdge("X", "Y");
        graph.addEdge("X", "Z");
        Assert.assertEquals(graph.getOutDegree("X") - graph.getInDegree("X"), 2);
        EulerianStartSelector.selectStartNode(graph);
    }

    @Test
    public void testTwoSourcesAreAmbiguous() {
        final DeBruijnGraph graph = DeBruijnGraphBuilder.build(Arrays.asList("ACG", "TCG"));
        try {
            EulerianStartSelector.selectStartNode(graph);
            Assert.fail("Expected AmbiguousStartNode");
        } catch ( final UserException.AmbiguousStartNode e ) {
            assertContains(e.getMessage(), "AC");
            assertContains(e.getMessage(), "TC");
        }
    }
}
