package se.kth.hayroll.pipeline;

import se.kth.hayroll.conditional.ConditionalReconstructor;
import se.kth.hayroll.util.LazyLogger;

/**
 * Runs the reconstruction passes over a workspace in order: tag repair, macro invocations,
 * conditionals and finally cleanup. Each pass re-extracts seeds from the trees the previous pass
 * left behind.
 */
public class Reaper {
    private static final LazyLogger LOGGER = new LazyLogger(Reaper.class);

    private final Diagnostics diagnostics;

    public Reaper(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    /** @return The number of rewrites made by all passes together. */
    public int reap(Workspace workspace, RunOptions options) {
        long start = System.nanoTime();

        LOGGER.info(() -> "Repairing unterminated statement spans");
        int repaired = TagRepairer.repair(workspace);

        LOGGER.info(() -> "Reconstructing macro invocations");
        int invocations = new InvocationPass(diagnostics).run(workspace);

        LOGGER.info(() -> "Reconstructing conditionals");
        int gates = ConditionalReconstructor.reconstruct(workspace);

        int cleaned = 0;
        if (options.isKeepScaffold()) {
            LOGGER.info(() -> "Keeping instrumentation scaffolding");
        } else {
            LOGGER.info(() -> "Removing instrumentation scaffolding");
            cleaned = Cleaner.clean(workspace);
        }

        LOGGER.info(
                () ->
                        "Reaping finished in "
                                + (double) (System.nanoTime() - start) / 1e9
                                + " seconds");
        return repaired + invocations + gates + cleaned;
    }
}
