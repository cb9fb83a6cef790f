package se.kth.hayroll.exception;

/** Base exception for Hayroll exceptions. */
public abstract class HayrollException extends RuntimeException {
    public HayrollException(String s) {
        super(s);
    }

    public HayrollException(String s, Throwable throwable) {
        super(s, throwable);
    }
}
