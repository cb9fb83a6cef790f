package se.kth.hayroll.pipeline;

/** A recoverable condition met during a run. */
public class Diagnostic {

    /** What kind of degradation the diagnostic reports. */
    public enum Kind {
        INCOMPATIBLE_CLUSTER,
        UNUSED_ARGUMENT,
        UNSUPPORTED_SHAPE,
        SKIPPED_EDIT,
        UNRESOLVED_NESTING
    }

    private final Kind kind;
    private final String location;
    private final String message;

    public Diagnostic(Kind kind, String location, String message) {
        this.kind = kind;
        this.location = location;
        this.message = message;
    }

    public Kind getKind() {
        return kind;
    }

    /** @return The source location of the seed the diagnostic is about. */
    public String getLocation() {
        return location;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "warning[" + kind.name().toLowerCase() + "] " + location + ": " + message;
    }
}
