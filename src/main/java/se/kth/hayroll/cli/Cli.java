package se.kth.hayroll.cli;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import java.io.File;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.Callable;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import se.kth.hayroll.pipeline.Cleaner;
import se.kth.hayroll.pipeline.Diagnostics;
import se.kth.hayroll.pipeline.Inliner;
import se.kth.hayroll.pipeline.Reaper;
import se.kth.hayroll.pipeline.RunOptions;
import se.kth.hayroll.pipeline.VariantMerger;
import se.kth.hayroll.pipeline.Workspace;
import se.kth.hayroll.util.LazyLogger;

/** Command line interface for Hayroll. */
public class Cli {
    private static final LazyLogger LOGGER = new LazyLogger(Cli.class);

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    static CommandLine commandLine() {
        return new CommandLine(new Hayroll())
                .setExecutionExceptionHandler(new ShortErrorHandler());
    }

    @CommandLine.Command(
            name = "hayroll",
            mixinStandardHelpOptions = true,
            description = "Reconstructs C macros and conditionals in instrumented Rust code.",
            versionProvider = HayrollVersionProvider.class,
            subcommands = {Reap.class, Merge.class, Clean.class, Inline.class})
    static class Hayroll implements Callable<Integer> {
        @CommandLine.Spec CommandLine.Model.CommandSpec spec;

        @Override
        public Integer call() {
            throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand");
        }
    }

    /** Options and reporting shared by all commands that rewrite a workspace. */
    abstract static class WorkspaceCommand implements Callable<Integer> {
        @CommandLine.Spec CommandLine.Model.CommandSpec spec;

        @CommandLine.Option(
                names = {"--dry-run"},
                description = "Print a unified diff of the changes instead of writing them.")
        boolean dryRun;

        @CommandLine.Option(
                names = {"-l", "--logging"},
                description = "Enable debug logging output")
        boolean logging;

        final Diagnostics diagnostics = new Diagnostics();

        /** @return The transformed workspace, not yet written. */
        abstract Workspace transform() throws IOException;

        RunOptions options() {
            return new RunOptions(dryRun, false, false);
        }

        @Override
        public Integer call() throws IOException {
            if (logging) {
                setLogLevel("DEBUG");
            }
            Workspace workspace = transform();
            if (options().isDryRun()) {
                spec.commandLine().getOut().print(workspace.diff());
                spec.commandLine().getOut().flush();
            } else {
                workspace.write();
            }
            diagnostics.printTo(spec.commandLine().getErr());
            spec.commandLine().getErr().flush();
            return 0;
        }
    }

    @CommandLine.Command(
            name = "reap",
            mixinStandardHelpOptions = true,
            description = "Rebuild macros and conditionals from the seed tags of a workspace.")
    static class Reap extends WorkspaceCommand {
        @CommandLine.Parameters(
                index = "0",
                paramLabel = "WORKSPACE",
                description = "Rust file or directory of Rust files to rewrite in place")
        File workspace;

        @CommandLine.Option(
                names = {"--keep-scaffold"},
                description = "Keep tags, guards and location attributes after reconstruction.")
        boolean keepScaffold;

        @Override
        RunOptions options() {
            return new RunOptions(dryRun, keepScaffold, false);
        }

        @Override
        Workspace transform() throws IOException {
            Workspace ws = Workspace.load(workspace.toPath());
            new Reaper(diagnostics).reap(ws, options());
            return ws;
        }
    }

    @CommandLine.Command(
            name = "merge",
            mixinStandardHelpOptions = true,
            description = "Merge the live branches of a differently configured PATCH into BASE.")
    static class Merge extends WorkspaceCommand {
        @CommandLine.Parameters(
                index = "0",
                paramLabel = "BASE",
                description = "Workspace to merge into; it is rewritten in place")
        File base;

        @CommandLine.Parameters(
                index = "1",
                paramLabel = "PATCH",
                description = "Workspace translated under another configuration")
        File patch;

        @CommandLine.Option(
                names = {"--strip-src-loc"},
                description = "Remove c2rust::src_loc attributes from the merged output.")
        boolean stripSrcLoc;

        @Override
        RunOptions options() {
            return new RunOptions(dryRun, false, stripSrcLoc);
        }

        @Override
        Workspace transform() throws IOException {
            Workspace baseWs = Workspace.load(base.toPath());
            Workspace patchWs = Workspace.load(patch.toPath());
            new VariantMerger(diagnostics).merge(baseWs, patchWs, options().isStripSrcLoc());
            return baseWs;
        }
    }

    @CommandLine.Command(
            name = "clean",
            mixinStandardHelpOptions = true,
            description = "Remove the instrumentation scaffolding from a workspace.")
    static class Clean extends WorkspaceCommand {
        @CommandLine.Parameters(
                index = "0",
                paramLabel = "WORKSPACE",
                description = "Rust file or directory of Rust files to rewrite in place")
        File workspace;

        @Override
        Workspace transform() throws IOException {
            Workspace ws = Workspace.load(workspace.toPath());
            int removed = Cleaner.clean(ws);
            LOGGER.info(() -> "Removed " + removed + " pieces of scaffolding");
            return ws;
        }
    }

    @CommandLine.Command(
            name = "inline",
            mixinStandardHelpOptions = true,
            description = "Expand the invocations of single-arm macro_rules! templates.")
    static class Inline extends WorkspaceCommand {
        @CommandLine.Parameters(
                index = "0",
                paramLabel = "WORKSPACE",
                description = "Rust file or directory of Rust files to rewrite in place")
        File workspace;

        @Override
        Workspace transform() throws IOException {
            Workspace ws = Workspace.load(workspace.toPath());
            new Inliner(diagnostics).inline(ws);
            return ws;
        }
    }

    private static void setLogLevel(String level) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        JoranConfigurator jc = new JoranConfigurator();
        jc.setContext(context);
        context.reset();
        context.putProperty("root-level", level);
        try {
            jc.doConfigure(
                    Objects.requireNonNull(Cli.class.getClassLoader().getResource("logback.xml")));
        } catch (JoranException e) {
            LOGGER.error(() -> "Failed to set log level: " + e.getMessage());
        }
    }
}
