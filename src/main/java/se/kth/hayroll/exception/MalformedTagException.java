package se.kth.hayroll.exception;

/** Thrown when a seed tag payload lacks a required field or cannot be decoded. */
public class MalformedTagException extends HayrollException {
    public MalformedTagException(String s) {
        super(s);
    }

    public MalformedTagException(String s, Throwable throwable) {
        super(s, throwable);
    }
}
