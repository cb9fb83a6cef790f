package se.kth.hayroll.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import se.kth.hayroll.Util;

class WorkspaceTest {

    private static void write(Path file, String text) throws IOException {
        Files.createDirectories(file.getParent());
        Files.write(file, text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void load_shouldFindRustFiles_andSkipBuildOutput(@TempDir Path dir) throws IOException {
        write(dir.resolve("src/main.rs"), "fn main() {}\n");
        write(dir.resolve("src/lib.rs"), "pub fn f() {}\n");
        write(dir.resolve("target/debug/build.rs"), "fn build() {}\n");
        write(dir.resolve("README.md"), "# readme\n");

        Workspace ws = Workspace.load(dir);

        assertEquals(
                Arrays.asList(Paths.get("src/lib.rs"), Paths.get("src/main.rs")), ws.getFiles());
    }

    @Test
    void load_shouldAcceptASingleFile(@TempDir Path dir) throws IOException {
        write(dir.resolve("one.rs"), "fn one() {}\n");

        Workspace ws = Workspace.load(dir.resolve("one.rs"));

        assertEquals(Collections.singletonList(Paths.get("one.rs")), ws.getFiles());
    }

    @Test
    void load_shouldThrow_whenPathDoesNotExist(@TempDir Path dir) {
        assertThrows(IOException.class, () -> Workspace.load(dir.resolve("missing")));
    }

    @Test
    void write_shouldOnlyWriteChangedFiles(@TempDir Path dir) throws IOException {
        write(dir.resolve("a.rs"), "fn a() {}\n");
        write(dir.resolve("b.rs"), "fn b() {}\n");
        Workspace ws = Workspace.load(dir);
        Files.delete(dir.resolve("b.rs"));

        ws.update(Paths.get("a.rs"), "fn a() { 1; }");
        ws.write();

        assertEquals("fn a() { 1; }\n", Util.read(dir.resolve("a.rs")));
        assertTrue(Files.notExists(dir.resolve("b.rs")));
    }

    @Test
    void diff_shouldRenderChangedAndCreatedFiles() {
        Workspace ws = Util.workspace("fn main() {}\n");

        ws.update(Util.MAIN_RS, "fn main() { work(); }\n");
        ws.create(Paths.get("extra.rs"), "fn extra() {}\n");
        String diff = ws.diff();

        assertTrue(diff.contains("--- a/main.rs\n+++ b/main.rs\n"), diff);
        assertTrue(diff.contains("-fn main() {}\n+fn main() { work(); }\n"), diff);
        assertTrue(diff.contains("+fn extra() {}\n"), diff);
    }

    @Test
    void getTree_shouldThrow_whenFileIsUnknown() {
        Workspace ws = Util.workspace("fn main() {}\n");

        assertThrows(IllegalArgumentException.class, () -> ws.getTree(Paths.get("nope.rs")));
        assertThrows(
                IllegalArgumentException.class, () -> ws.create(Util.MAIN_RS, "fn other() {}"));
    }
}
