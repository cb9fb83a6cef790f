package se.kth.hayroll.pipeline;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import se.kth.hayroll.util.LazyLogger;

/**
 * Accumulates the diagnostics of a run. Every diagnostic is logged when it is reported and
 * printed once more in the summary at the end of the run.
 */
public class Diagnostics {
    private static final LazyLogger LOGGER = new LazyLogger(Diagnostics.class);

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public void report(Diagnostic.Kind kind, String location, String message) {
        Diagnostic diagnostic = new Diagnostic(kind, location, message);
        LOGGER.warn(diagnostic::toString);
        diagnostics.add(diagnostic);
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public List<Diagnostic> ofKind(Diagnostic.Kind kind) {
        return diagnostics.stream().filter(d -> d.getKind() == kind).collect(Collectors.toList());
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }

    /** Print all diagnostics, one per line. */
    public void printTo(PrintWriter out) {
        diagnostics.forEach(out::println);
    }
}
