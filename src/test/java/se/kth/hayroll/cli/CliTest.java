package se.kth.hayroll.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import se.kth.hayroll.Util;

class CliTest {
    @TempDir Path dir;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String... args) {
        CommandLine cmd = Cli.commandLine();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    private Path write(String name, String text) throws IOException {
        Path file = dir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.write(file, text.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private static String conditionalSpan() {
        String begin = Util.conditional("FOO", "a.c:3:2").astKind("Stmts").literal();
        String end = Util.conditional("FOO", "a.c:3:2").end().literal();
        return "unsafe fn f(mut x: i32) {\n    "
                + Util.tagStmt(begin)
                + "\n    x += 1;\n    "
                + Util.tagStmt(end)
                + "\n}\n";
    }

    @Test
    void reap_shouldRewriteWorkspaceInPlace() throws IOException {
        Path file = write("src/main.rs", conditionalSpan());

        int exitCode = run("reap", dir.toString());

        assertEquals(0, exitCode, err.toString());
        assertEquals(
                "unsafe fn f(mut x: i32) {\n    #[cfg(FOO)]\n    (x += 1);\n}\n",
                Util.read(file));
    }

    @Test
    void reap_shouldPrintDiffAndKeepFiles_whenDryRun() throws IOException {
        String source = conditionalSpan();
        Path file = write("main.rs", source);

        int exitCode = run("reap", "--dry-run", dir.toString());

        assertEquals(0, exitCode, err.toString());
        assertEquals(source, Util.read(file));
        assertTrue(out.toString().contains("+++ b/main.rs"), out.toString());
        assertTrue(out.toString().contains("+    #[cfg(FOO)]"), out.toString());
    }

    @Test
    void reap_shouldFailWithShortError_whenTagsAreMalformed() throws IOException {
        String end = Util.conditional("FOO", "a.c:3:2").end().literal();
        write("main.rs", "fn f() {\n    " + Util.tagStmt(end) + "\n}\n");

        int exitCode = run("reap", dir.toString());

        assertEquals(ShortErrorHandler.EXIT_FATAL, exitCode);
        assertTrue(err.toString().contains("error: Unmatched end tag"), err.toString());
    }

    @Test
    void reap_shouldFail_whenWorkspaceDoesNotExist() {
        int exitCode = run("reap", dir.resolve("missing").toString());

        assertEquals(ShortErrorHandler.EXIT_FATAL, exitCode);
        assertTrue(err.toString().contains("No such workspace"), err.toString());
    }

    @Test
    void hayroll_shouldReportUsageError_whenSubcommandIsMissing() {
        assertEquals(2, run());
        assertEquals(2, run("harvest"));
    }

    @Test
    void hayroll_shouldPrintVersion() {
        assertEquals(0, run("--version"));
        assertTrue(out.toString().startsWith("hayroll "), out.toString());
    }

    @Test
    void clean_shouldStripScaffoldingOnly() throws IOException {
        Path file = write("main.rs", conditionalSpan());

        assertEquals(0, run("clean", file.toString()));

        assertEquals("unsafe fn f(mut x: i32) {\n    x += 1;\n}\n", Util.read(file));
    }

    @Test
    void merge_shouldWriteMergedBase_andStripLocations() throws IOException {
        Path base = write("base/main.rs", "#[c2rust::src_loc = \"1:0\"]\nunsafe fn f() {}\n");
        write("patch/main.rs", "#[c2rust::src_loc = \"1:0\"]\nunsafe fn f() {}\nfn g() {}\n");

        int exitCode =
                run(
                        "merge",
                        "--strip-src-loc",
                        dir.resolve("base").toString(),
                        dir.resolve("patch").toString());

        assertEquals(0, exitCode, err.toString());
        assertEquals("fn g() {}\n\nunsafe fn f() {}\n", Util.read(base));
    }

    @Test
    void inline_shouldExpandTemplateCalls() throws IOException {
        String template = "macro_rules! ONE\n{\n    () => {\n    1\n    }\n}\n";
        Path file = write("main.rs", template + "fn f() -> i32 {\n    ONE!()\n}\n");

        assertEquals(0, run("inline", file.toString()));

        assertEquals(template + "fn f() -> i32 {\n    1\n}\n", Util.read(file));
        assertFalse(err.toString().contains("error"), err.toString());
    }
}
