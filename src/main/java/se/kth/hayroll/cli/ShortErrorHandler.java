package se.kth.hayroll.cli;

import picocli.CommandLine;
import se.kth.hayroll.exception.HayrollException;
import se.kth.hayroll.util.LazyLogger;

/**
 * Reports a failed run with a single line naming the cause. Stack traces only go to the debug
 * log.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    private static final LazyLogger LOGGER = new LazyLogger(ShortErrorHandler.class);

    static final int EXIT_FATAL = 1;

    @Override
    public int handleExecutionException(
            Exception ex, CommandLine commandLine, CommandLine.ParseResult parseResult) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getSimpleName();
        }
        String kind = ex instanceof HayrollException ? "error" : "internal error";
        commandLine.getErr().println(commandLine.getColorScheme().errorText(kind + ": " + message));
        LOGGER.debug(() -> "Run failed", ex);
        return EXIT_FATAL;
    }
}
