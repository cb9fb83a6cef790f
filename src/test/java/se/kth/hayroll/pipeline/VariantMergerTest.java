package se.kth.hayroll.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import se.kth.hayroll.Util;
import se.kth.hayroll.seed.HayrollSeed;
import se.kth.hayroll.seed.SeedExtractor;
import se.kth.hayroll.syntax.TreeSitterParser;

class VariantMergerTest {
    private Diagnostics diagnostics;
    private VariantMerger merger;

    @BeforeEach
    void setUp() {
        diagnostics = new Diagnostics();
        merger = new VariantMerger(diagnostics);
    }

    private static String fn(String... statements) {
        return "unsafe fn f(mut x: i32) {\n    " + String.join("\n    ", statements) + "\n}\n";
    }

    private static String span(Util.TagBuilder begin, Util.TagBuilder end, String... body) {
        StringBuilder sb = new StringBuilder(Util.tagStmt(begin.astKind("Stmts").literal()));
        for (String stmt : body) {
            sb.append("\n    ").append(stmt);
        }
        return sb.append("\n    ").append(Util.tagStmt(end.end().literal())).toString();
    }

    private static String branch(String premise, String loc, String... body) {
        return span(Util.conditional(premise, loc), Util.conditional(premise, loc), body);
    }

    @Test
    void merge_shouldAppendPatchSpan_whenBothVariantsAreLive() {
        Workspace base = Util.workspace(fn(branch("FOO", "a.c:3:2", "x += 1;")));
        Workspace patch = Util.workspace(fn(branch("BAR", "a.c:5:2", "x -= 1;")));

        int merged = merger.merge(base, patch, false);

        assertEquals(1, merged);
        List<HayrollSeed> seeds = SeedExtractor.extract(base.getTrees()).requireMatched();
        assertEquals(2, seeds.size());
        assertEquals(Collections.singletonList("a.c:5:2"), seeds.get(0).mergedVariants());
        assertEquals("BAR", seeds.get(1).premise());
        assertEquals("x -= 1;", seeds.get(1).innerRegion().getText());
    }

    @Test
    void merge_shouldBeIdempotent() {
        Workspace base = Util.workspace(fn(branch("FOO", "a.c:3:2", "x += 1;")));
        Workspace patch = Util.workspace(fn(branch("BAR", "a.c:5:2", "x -= 1;")));
        merger.merge(base, patch, false);
        String once = base.getText(Util.MAIN_RS);

        int merged = merger.merge(base, patch, false);

        assertEquals(0, merged);
        assertEquals(once, base.getText(Util.MAIN_RS));
    }

    @Test
    void merge_shouldReplacePlaceholder_whenBaseBranchIsDead() {
        Util.TagBuilder placeholder = Util.conditional("FOO", "a.c:3:2").placeholder();
        Workspace base =
                Util.workspace(fn(span(placeholder, Util.conditional("FOO", "a.c:3:2"))));
        Workspace patch = Util.workspace(fn(branch("BAR", "a.c:5:2", "x -= 1;")));

        merger.merge(base, patch, false);

        assertEquals(patch.getText(Util.MAIN_RS), base.getText(Util.MAIN_RS));
        assertEquals(0, merger.merge(base, patch, false));
    }

    @Test
    void merge_shouldKeepBase_whenPatchBranchIsAPlaceholder() {
        String source = fn(branch("FOO", "a.c:3:2", "x += 1;"));
        Workspace base = Util.workspace(source);
        Util.TagBuilder placeholder = Util.conditional("BAR", "a.c:5:2").placeholder();
        Workspace patch =
                Util.workspace(fn(span(placeholder, Util.conditional("BAR", "a.c:5:2"))));

        assertEquals(0, merger.merge(base, patch, false));
        assertEquals(source, base.getText(Util.MAIN_RS));
    }

    @Test
    void merge_shouldChainPatchGuard_whenBranchesAreExpressions() {
        String baseLiteral = Util.conditional("FOO", "a.c:3:6").literal();
        String patchLiteral = Util.conditional("BAR", "a.c:5:6").literal();
        Workspace base = Util.workspace(fn("x = " + Util.exprGuard(baseLiteral, "1", "i32") + ";"));
        Workspace patch =
                Util.workspace(fn("x = " + Util.exprGuard(patchLiteral, "2", "i32") + ";"));

        merger.merge(base, patch, false);

        String text = base.getText(Util.MAIN_RS);
        assertTrue(text.contains("{ 1 } else if *("), text);
        assertTrue(text.contains("{ 2 } else { *(0 as *mut i32) }"), text);
        assertEquals(2, SeedExtractor.extract(base.getTrees()).requireMatched().size());
    }

    @Test
    void merge_shouldReport_whenBranchShapesDiffer() {
        String patchLiteral = Util.conditional("BAR", "a.c:5:6").literal();
        Workspace base = Util.workspace(fn(branch("FOO", "a.c:3:2", "x += 1;")));
        Workspace patch =
                Util.workspace(fn("x = " + Util.exprGuard(patchLiteral, "2", "i32") + ";"));

        assertEquals(0, merger.merge(base, patch, false));
        assertEquals(1, diagnostics.ofKind(Diagnostic.Kind.UNSUPPORTED_SHAPE).size());
    }

    @Test
    void merge_shouldCopyMissingDeclarations() {
        Workspace base =
                Util.workspace(
                        "unsafe fn f() {}\n"
                                + "extern \"C\" {\n"
                                + "    fn puts(s: *const i8) -> i32;\n"
                                + "}\n");
        Workspace patch =
                Util.workspace(
                        "#[c2rust::src_loc = \"3:0\"]\n"
                                + "pub static mut extra: i32 = 0;\n"
                                + "unsafe fn f() {}\n"
                                + "unsafe fn g() {}\n"
                                + "extern \"C\" {\n"
                                + "    fn puts(s: *const i8) -> i32;\n"
                                + "    fn abs(x: i32) -> i32;\n"
                                + "}\n");

        int merged = merger.merge(base, patch, false);

        assertEquals(3, merged);
        String text = base.getText(Util.MAIN_RS);
        assertTrue(text.startsWith("unsafe fn g() {}\n\nunsafe fn f() {}\n"), text);
        String externs = "fn puts(s: *const i8) -> i32;\n    fn abs(x: i32) -> i32;";
        assertTrue(text.contains(externs), text);
        String extra = "#[c2rust::src_loc = \"3:0\"]\npub static mut extra: i32 = 0;\n";
        assertTrue(text.endsWith("}\n\n" + extra), text);
        assertEquals(0, merger.merge(base, patch, false));
    }

    @Test
    void merge_shouldCreateExternBlock_whenBaseHasNone() {
        Workspace base = Util.workspace("unsafe fn f() {}\n");
        Workspace patch = Util.workspace("extern \"C\" {\n    fn abs(x: i32) -> i32;\n}\n");

        merger.merge(base, patch, false);

        assertEquals(
                "unsafe fn f() {}\n\nextern \"C\" {\n    fn abs(x: i32) -> i32;\n}\n",
                base.getText(Util.MAIN_RS));
    }

    @Test
    void merge_shouldCopyFilesThatOnlyThePatchHas_andStripLocations() {
        Workspace base = Util.workspace("unsafe fn f() {}\n");
        Map<Path, String> sources = new LinkedHashMap<>();
        sources.put(Util.MAIN_RS, "unsafe fn f() {}\n");
        sources.put(Paths.get("extra.rs"), "#[c2rust::src_loc = \"1:0\"]\npub fn extra() {}\n");
        Workspace patch = Workspace.of(Paths.get("patch"), sources);

        merger.merge(base, patch, true);

        assertEquals("pub fn extra() {}\n", base.getText(Paths.get("extra.rs")));
        assertEquals(Collections.singletonList(Paths.get("extra.rs")), base.getChangedFiles());
    }

    @Test
    void declarationKey_shouldIgnoreLocationAttributes_butNotOtherAttributes() {
        String located = VariantMerger.declarationKey(
                TreeSitterParser.parseItem(
                        "#[c2rust::src_loc = \"1:0\"]\npub static mut g: i32 = 0;"));
        String moved = VariantMerger.declarationKey(
                TreeSitterParser.parseItem(
                        "#[c2rust::src_loc = \"9:4\"]\npub static mut g: i32 = 0;"));
        String exported = VariantMerger.declarationKey(
                TreeSitterParser.parseItem("#[no_mangle]\npub static mut g: i32 = 0;"));

        assertEquals(located, moved);
        assertNotEquals(located, exported);
    }
}
