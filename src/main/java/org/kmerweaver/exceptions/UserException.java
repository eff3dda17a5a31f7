package org.kmerweaver.exceptions;

import java.nio.file.Path;

/**
 * <p/>
 * Class UserException.
 * <p/>
 * This exception is for errors that are due to user mistakes, such as non-existent or malformed files,
 * or k-mer collections whose overlap graph cannot be traversed.
 */
public class UserException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public UserException(final String msg) {
        super(msg);
    }

    public UserException(final String message, final Throwable throwable) {
        super(message, throwable);
    }

    protected static String getMessage(final Throwable t) {
        final String message = t.getMessage();
        return message != null ? message : t.getClass().getName();
    }

    /**
     * Subtypes of UserException for common kinds of errors
     */

    /**
     * <p/>
     * Class UserException.CouldNotReadInputFile
     * <p/>
     * For generic errors opening/reading from input files
     */
    public static class CouldNotReadInputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotReadInputFile(Path file, String message) {
            super(String.format("Couldn't read file %s. Error was: %s", file.toAbsolutePath().toUri(), message));
        }

        public CouldNotReadInputFile(Path file, String message, Throwable cause) {
            super(String.format("Couldn't read file %s. Error was: %s", file.toAbsolutePath().toUri(), message), cause);
        }

        public CouldNotReadInputFile(Path path, Exception e) {
            this(path, getMessage(e), e);
        }
    }

    /**
     * <p/>
     * Class UserException.CouldNotCreateOutputFile
     * <p/>
     * For generic errors writing to output files
     */
    public static class CouldNotCreateOutputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotCreateOutputFile(String filename, String message, Exception e) {
            super(String.format("Couldn't write file %s because %s with exception %s", filename, message, getMessage(e)), e);
        }

        public CouldNotCreateOutputFile(Path path, Exception e) {
            super(String.format("Couldn't write file %s because exception %s", path.toAbsolutePath().toUri(), getMessage(e)), e);
        }
    }

    public static class BadTempDir extends UserException {
        private static final long serialVersionUID = 0L;

        private static final String MESSAGE_FORMAT_STRING = "Failure working with the tmp directory %s. Try changing the tmp dir with -Djava.io.tmpdir.  Exact error was %s";

        public BadTempDir(String message, Throwable cause) {
            super(String.format(MESSAGE_FORMAT_STRING, System.getProperties().get("java.io.tmpdir"), message), cause);
        }
    }

    public static class BadInput extends UserException {
        private static final long serialVersionUID = 0L;

        public BadInput(String message) {
            super(String.format("Bad input: %s", message));
        }
    }

    /**
     * <p/>
     * Class UserException.MalformedKmers
     * <p/>
     * For k-mer collections that cannot be turned into a de Bruijn graph: tokens shorter than two bases,
     * empty tokens, or k-mers of differing lengths.
     */
    public static class MalformedKmers extends BadInput {
        private static final long serialVersionUID = 0L;

        public MalformedKmers(final int index, final String kmer, final String message) {
            super(String.format("Malformed k-mer list: k-mer #%d ('%s') %s", index + 1, kmer, message));
        }
    }

    /**
     * Raised when no node of the de Bruijn graph can start an Eulerian path: the graph is empty, or
     * every node is unbalanced in a way that no single walk can explain.
     */
    public static class NoValidStartNode extends UserException {
        private static final long serialVersionUID = 0L;

        public NoValidStartNode(final int nodeCount) {
            super(nodeCount == 0 ?
                    "Unable to determine a starting point for reconstruction: the k-mer collection is empty." :
                    String.format("Unable to determine a starting point for reconstruction: none of the %d nodes of the " +
                            "de Bruijn graph has out-degree one greater than its in-degree, and none is balanced.", nodeCount));
        }
    }

    /**
     * Raised when more than one node has out-degree exactly one greater than its in-degree.
     * A graph admitting an Eulerian path has at most one such node.
     */
    public static class AmbiguousStartNode extends UserException {
        private static final long serialVersionUID = 0L;

        public AmbiguousStartNode(final String firstCandidate, final String secondCandidate) {
            super(String.format("Unable to determine a unique starting point for reconstruction: nodes %s and %s both " +
                    "have out-degree one greater than their in-degree, so the k-mers cannot come from a single sequence.",
                    firstCandidate, secondCandidate));
        }
    }

    /**
     * Raised when the Eulerian walk finishes with edges left untraversed, i.e. the de Bruijn graph is not
     * connected or the path cannot start at the selected node.
     */
    public static class IncompleteEulerianPath extends UserException {
        private static final long serialVersionUID = 0L;

        public IncompleteEulerianPath(final String startNode, final long unconsumedEdges, final long totalEdges) {
            super(String.format("Reconstruction starting at %s used only %d of %d k-mers; the remaining %d are not " +
                    "reachable in a single walk. Run with --lenient to keep the partial sequence.",
                    startNode, totalEdges - unconsumedEdges, totalEdges, unconsumedEdges));
        }
    }
}
