package se.kth.hayroll.pipeline;

/** Switches shared by the commands. */
public class RunOptions {
    private final boolean dryRun;
    private final boolean keepScaffold;
    private final boolean stripSrcLoc;

    public RunOptions(boolean dryRun, boolean keepScaffold, boolean stripSrcLoc) {
        this.dryRun = dryRun;
        this.keepScaffold = keepScaffold;
        this.stripSrcLoc = stripSrcLoc;
    }

    public static RunOptions defaults() {
        return new RunOptions(false, false, false);
    }

    /** @return true if results are printed as a diff instead of written back. */
    public boolean isDryRun() {
        return dryRun;
    }

    /** @return true if the cleanup pass is skipped after reaping. */
    public boolean isKeepScaffold() {
        return keepScaffold;
    }

    /** @return true if location attributes are removed from merged output. */
    public boolean isStripSrcLoc() {
        return stripSrcLoc;
    }
}
