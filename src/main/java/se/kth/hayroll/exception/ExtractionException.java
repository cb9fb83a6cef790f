package se.kth.hayroll.exception;

/**
 * Thrown when the instrumentation in a workspace violates the pairing or binding rules of seed
 * tags, e.g. an end tag without a begin tag or an argument that refers to no invocation. Any
 * program recovered past this point would be unsound, so the run is aborted.
 */
public class ExtractionException extends HayrollException {
    public ExtractionException(String s) {
        super(s);
    }

    public ExtractionException(String s, Throwable throwable) {
        super(s, throwable);
    }
}
