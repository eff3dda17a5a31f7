package org.kmerweaver.assembly;

import org.kmerweaver.utils.Utils;

import java.io.PrintStream;
import java.util.*;

/**
 * A de Bruijn graph over (k-1)-mers: each k-mer contributes one directed edge from its prefix to its suffix.
 *
 * Parallel edges are kept, since a repeated k-mer must be walked as many times as it occurs. Successors of
 * a node are stored in insertion order and consumed last-in-first-out by {@link #removeLastSuccessor(String)}.
 * In- and out-degrees describe the graph as built and are not changed by edge removal.
 *
 * Nodes are iterated in order of first appearance, with a k-mer's prefix registered before its suffix.
 *
 * A graph is traversed destructively and supports a single reconstruction; see {@link #markTraversed()}.
 */
public final class DeBruijnGraph {

    private final Map<String, Deque<String>> successors = new LinkedHashMap<>();
    private final Map<String, Integer> inDegrees = new HashMap<>();
    private final Map<String, Integer> outDegrees = new HashMap<>();

    private long edgeCount = 0;
    private long remainingEdgeCount = 0;
    private int kmerSize = -1;
    private boolean traversed = false;

    /**
     * Registers a node if it hasn't been seen before. Does nothing otherwise.
     * @return true if the node was new
     */
    public boolean addNode(final String node) {
        Utils.nonEmpty(node, "node");
        if (successors.containsKey(node)) {
            return false;
        }
        successors.put(node, new ArrayDeque<>());
        inDegrees.put(node, 0);
        outDegrees.put(node, 0);
        return true;
    }

    /**
     * Adds a directed edge between two nodes, registering them first (source before target) if needed.
     */
    public void addEdge(final String source, final String target) {
        Utils.nonEmpty(source, "source");
        Utils.nonEmpty(target, "target");
        Utils.validate(!traversed, "Cannot add edges to a graph that has already been traversed");
        addNode(source);
        addNode(target);
        successors.get(source).addLast(target);
        outDegrees.merge(source, 1, Integer::sum);
        inDegrees.merge(target, 1, Integer::sum);
        edgeCount++;
        remainingEdgeCount++;
    }

    /**
     * Adds the edge contributed by one k-mer.
     */
    public void addKmer(final String kmer) {
        Utils.nonNull(kmer, "kmer");
        Utils.validateArg(kmer.length() >= 2, () -> "k-mers must have at least two characters: '" + kmer + "'");
        if (kmerSize < 0) {
            kmerSize = kmer.length();
        }
        addEdge(kmer.substring(0, kmer.length() - 1), kmer.substring(1));
    }

    /**
     * Removes and returns the most recently added successor of {@code node} that has not been consumed yet.
     * @return the successor, or null if every out-edge of {@code node} has been consumed
     */
    public String removeLastSuccessor(final String node) {
        final Deque<String> targets = successors.get(node);
        Utils.validateArg(targets != null, () -> "Node " + node + " is not in the graph");
        final String next = targets.pollLast();
        if (next != null) {
            remainingEdgeCount--;
        }
        return next;
    }

    /**
     * @return true if {@code node} still has unconsumed out-edges
     */
    public boolean hasRemainingSuccessors(final String node) {
        final Deque<String> targets = successors.get(node);
        return targets != null && !targets.isEmpty();
    }

    /**
     * @return the unconsumed successors of {@code node} in insertion order, as an unmodifiable view
     */
    public Collection<String> getSuccessors(final String node) {
        final Deque<String> targets = successors.get(node);
        Utils.validateArg(targets != null, () -> "Node " + node + " is not in the graph");
        return Collections.unmodifiableCollection(targets);
    }

    /**
     * @return all nodes, in order of first appearance
     */
    public Set<String> getNodes() {
        return Collections.unmodifiableSet(successors.keySet());
    }

    public boolean containsNode(final String node) {
        return successors.containsKey(node);
    }

    public int getInDegree(final String node) {
        return inDegrees.getOrDefault(node, 0);
    }

    public int getOutDegree(final String node) {
        return outDegrees.getOrDefault(node, 0);
    }

    public int getNodeCount() {
        return successors.size();
    }

    public long getEdgeCount() {
        return edgeCount;
    }

    public long getRemainingEdgeCount() {
        return remainingEdgeCount;
    }

    public boolean isEmpty() {
        return successors.isEmpty();
    }

    /**
     * @return the length of the k-mers the graph was built from, or -1 if it was built from edges directly
     */
    public int getKmerSize() {
        return kmerSize;
    }

    public boolean isTraversed() {
        return traversed;
    }

    /**
     * Claims this graph for a reconstruction.
     * @throws IllegalStateException if the graph was already traversed
     */
    void markTraversed() {
        Utils.validate(!traversed, "This de Bruijn graph has already been traversed; build a new graph to reconstruct again");
        traversed = true;
    }

    /**
     * Print out the graph in the dot language for visualization.
     * Unconsumed edges are printed, so call this before traversal to see the whole graph.
     * @param destination a PrintStream where to write the graph
     */
    public void printGraph(final PrintStream destination) {
        Utils.nonNull(destination, "destination");
        destination.println("digraph deBruijnGraph {");
        destination.println("    rankdir=LR;");
        destination.println("    node [shape=box];");
        for (final String node : successors.keySet()) {
            destination.println(String.format("    \"%s\" [label=\"%s\\nin=%d out=%d\"];",
                    node, node, getInDegree(node), getOutDegree(node)));
        }
        for (final Map.Entry<String, Deque<String>> entry : successors.entrySet()) {
            for (final String target : entry.getValue()) {
                destination.println(String.format("    \"%s\" -> \"%s\" [label=\"%s\"];",
                        entry.getKey(), target, entry.getKey() + target.charAt(target.length() - 1)));
            }
        }
        destination.println("}");
    }

    @Override
    public String toString() {
        return "DeBruijnGraph{nodes=" + getNodeCount() + ", edges=" + edgeCount + ", remaining=" + remainingEdgeCount + "}";
    }
}
