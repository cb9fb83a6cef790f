package se.kth.hayroll.exception;

/** Thrown when source text cannot be parsed into the requested construct, or edits conflict. */
public class SyntaxException extends HayrollException {
    public SyntaxException(String s) {
        super(s);
    }

    public SyntaxException(String s, Throwable throwable) {
        super(s, throwable);
    }
}
