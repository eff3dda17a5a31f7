package org.kmerweaver.exceptions;

/**
 * <p/>
 * Class KmerWeaverException.
 * <p/>
 * This exception is for errors that are beyond the user's control, such as internal pre/post condition failures
 * and "this should never happen" kinds of scenarios.
 */
public class KmerWeaverException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public KmerWeaverException( String msg ) {
        super(msg);
    }

    public KmerWeaverException( String message, Throwable throwable ) {
        super(message, throwable);
    }

    /*
      Subtypes of KmerWeaverException for common kinds of errors
     */

    /**
     * <p/>
     * For wrapping errors that are believed to never be reachable
     */
    public static class ShouldNeverReachHereException extends KmerWeaverException {
        private static final long serialVersionUID = 0L;
        public ShouldNeverReachHereException( final String s ) {
            super(s);
        }
        public ShouldNeverReachHereException( final String s, final Throwable throwable ) {
            super(s, throwable);
        }
        public ShouldNeverReachHereException( final Throwable throwable) {this("Should never reach here.", throwable);}
    }
}
