package se.kth.hayroll.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import se.kth.hayroll.Util;
import se.kth.hayroll.seed.SeedExtractor;

class ReaperTest {
    private Diagnostics diagnostics;
    private Reaper reaper;

    @BeforeEach
    void setUp() {
        diagnostics = new Diagnostics();
        reaper = new Reaper(diagnostics);
    }

    private static String fn(String header, String... statements) {
        return header + " {\n    " + String.join("\n    ", statements) + "\n}\n";
    }

    private static String letDouble(String target, Util.TagBuilder inv, String var, String type) {
        return "let " + target + ": " + type + " = " + Util.doubleCall(inv, var, type) + ";";
    }

    private static int occurrences(String text, String part) {
        int count = 0;
        for (int i = text.indexOf(part); i >= 0; i = text.indexOf(part, i + 1)) {
            count++;
        }
        return count;
    }

    @Test
    void reap_shouldReplaceCallsByOneFunction_whenCallsCanBeFunctions() {
        Util.TagBuilder first = Util.invocation("M", "a.c:5:10").canBeFn();
        Util.TagBuilder second = Util.invocation("M", "a.c:6:10").canBeFn();
        Workspace ws =
                Util.workspace(
                        fn(
                                "unsafe fn f(a: f32)",
                                letDouble("y", first, "a", "f32"),
                                letDouble("z", second, "a", "f32")));

        reaper.reap(ws, RunOptions.defaults());

        assertEquals(
                fn(
                                "unsafe fn f(a: f32)",
                                "let y: f32 = M_f32_f32({ a });",
                                "let z: f32 = M_f32_f32({ a });")
                        + "\nunsafe fn M_f32_f32(x: f32) -> f32 {\n    { (x) * 2.0 }\n}\n",
                ws.getText(Util.MAIN_RS));
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void reap_shouldShareOneTemplate_whenCallsDifferInType() {
        Workspace ws =
                Util.workspace(
                        fn(
                                "unsafe fn f(a: f32, b: f64)",
                                letDouble("y", Util.invocation("M", "a.c:5:10"), "a", "f32"),
                                letDouble("z", Util.invocation("M", "a.c:6:10"), "b", "f64")));

        reaper.reap(ws, RunOptions.defaults());

        String text = ws.getText(Util.MAIN_RS);
        assertTrue(
                text.startsWith("macro_rules! M\n{\n    ($x:expr) => {\n    { ($x) * 2.0 }\n"),
                text);
        assertTrue(text.contains("let y: f32 = M!({ a });"), text);
        assertTrue(text.contains("let z: f64 = M!({ b });"), text);
        assertEquals(1, occurrences(text, "macro_rules!"));
    }

    @Test
    void reap_shouldRewriteNestedCallsInnermostFirst() {
        Util.TagBuilder inner = Util.invocation("M", "a.c:5:23").canBeFn();
        Util.TagBuilder outer = Util.invocation("M", "a.c:5:20").canBeFn().argNames("x");
        String outerArg =
                Util.invocation("x", "a.c:5:22").arg().locRefBegin("a.c:5:20").literal();
        String nested = Util.exprGuard(outerArg, Util.doubleCall(inner, "a", "f32"), "f32");
        String call =
                Util.exprGuard(outer.literal(), "(" + nested + ") * 2.0", "f32");
        Workspace ws =
                Util.workspace(fn("unsafe fn f(a: f32)", "let y: f32 = " + call + ";"));

        reaper.reap(ws, RunOptions.defaults());

        String text = ws.getText(Util.MAIN_RS);
        assertTrue(text.contains("let y: f32 = M_f32_f32({ M_f32_f32({ a }) });"), text);
        assertEquals(1, occurrences(text, "unsafe fn M_f32_f32"));
    }

    @Test
    void reap_shouldGateStatements_andRepairSpanEndingInReturn() {
        String begin = Util.conditional("FOO", "a.c:3:2").astKind("Stmts").literal();
        Workspace ws =
                Util.workspace(
                        fn(
                                "unsafe fn f(mut x: i32) -> i32",
                                Util.tagStmt(begin),
                                "x += 1;",
                                "return x;"));

        reaper.reap(ws, RunOptions.defaults());

        assertEquals(
                fn(
                        "unsafe fn f(mut x: i32) -> i32",
                        "#[cfg(FOO)]",
                        "(x += 1);",
                        "#[cfg(FOO)]",
                        "return x;"),
                ws.getText(Util.MAIN_RS));
    }

    @Test
    void reap_shouldBeIdempotent() {
        String begin = Util.conditional("FOO", "a.c:3:2").astKind("Stmts").literal();
        String end = Util.conditional("FOO", "a.c:3:2").end().literal();
        Util.TagBuilder call = Util.invocation("M", "a.c:4:5").canBeFn();
        Workspace ws =
                Util.workspace(
                        fn(
                                "unsafe fn f(mut x: f32)",
                                Util.tagStmt(begin),
                                letDouble("y", call, "x", "f32"),
                                Util.tagStmt(end)));
        reaper.reap(ws, RunOptions.defaults());
        String once = ws.getText(Util.MAIN_RS);

        int rewrites = reaper.reap(ws, RunOptions.defaults());

        assertEquals(0, rewrites);
        assertEquals(once, ws.getText(Util.MAIN_RS));
        assertTrue(once.contains("#[cfg(FOO)]\n    let y: f32 = M_f32_f32({ x });"), once);
    }

    @Test
    void reap_shouldKeepTags_whenScaffoldIsKept() {
        String begin = Util.conditional("FOO", "a.c:3:2").astKind("Stmts").literal();
        String end = Util.conditional("FOO", "a.c:3:2").end().literal();
        Workspace ws =
                Util.workspace(
                        fn(
                                "unsafe fn f(mut x: i32)",
                                Util.tagStmt(begin),
                                "x += 1;",
                                Util.tagStmt(end)));

        reaper.reap(ws, new RunOptions(false, true, false));

        assertEquals(2, SeedExtractor.findTags(Util.MAIN_RS, ws.getTree(Util.MAIN_RS)).size());
        assertTrue(ws.getText(Util.MAIN_RS).contains("#[cfg(FOO)]"));
    }

    @Test
    void reap_shouldKeepEveryVariant_whenMergedExpressionBranchesAreReconstructed() {
        String baseLiteral = Util.conditional("FOO", "a.c:3:6").literal();
        String patchLiteral = Util.conditional("BAR", "a.c:5:6").literal();
        Workspace base =
                Util.workspace(
                        fn(
                                "unsafe fn f(mut x: i32)",
                                "x = " + Util.exprGuard(baseLiteral, "1", "i32") + ";"));
        Workspace patch =
                Util.workspace(
                        fn(
                                "unsafe fn f(mut x: i32)",
                                "x = " + Util.exprGuard(patchLiteral, "2", "i32") + ";"));
        new VariantMerger(diagnostics).merge(base, patch, false);

        reaper.reap(base, RunOptions.defaults());

        String text = base.getText(Util.MAIN_RS);
        assertTrue(text.contains("if cfg!(FOO) { 1 }"), text);
        assertTrue(text.contains("if cfg!(BAR) { 2 }"), text);
        assertFalse(text.contains("hayroll"), text);
    }

    @Test
    void reap_shouldGateBothVariants_whenMergedStatementBranchesAreReconstructed() {
        String foo = Util.conditional("FOO", "a.c:3:2").astKind("Stmts").literal();
        String fooEnd = Util.conditional("FOO", "a.c:3:2").end().literal();
        String bar = Util.conditional("BAR", "a.c:5:2").astKind("Stmts").literal();
        String barEnd = Util.conditional("BAR", "a.c:5:2").end().literal();
        String header = "unsafe fn f(mut x: i32)";
        Workspace base =
                Util.workspace(fn(header, Util.tagStmt(foo), "x += 1;", Util.tagStmt(fooEnd)));
        Workspace patch =
                Util.workspace(fn(header, Util.tagStmt(bar), "x -= 1;", Util.tagStmt(barEnd)));
        new VariantMerger(diagnostics).merge(base, patch, false);

        reaper.reap(base, RunOptions.defaults());

        assertEquals(
                fn(header, "#[cfg(FOO)]", "(x += 1);", "#[cfg(BAR)]", "(x -= 1);"),
                base.getText(Util.MAIN_RS));
    }
}
