package se.kth.hayroll.conditional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import se.kth.hayroll.Util;
import se.kth.hayroll.exception.MalformedTagException;
import se.kth.hayroll.pipeline.Workspace;

class ConditionalReconstructorTest {

    private static String fn(String... statements) {
        return "unsafe fn f(mut x: i32) {\n    " + String.join("\n    ", statements) + "\n}\n";
    }

    private static String span(String premise, String loc, String... statements) {
        String begin = Util.conditional(premise, loc).astKind("Stmts").literal();
        String end = Util.conditional(premise, loc).end().literal();
        return Util.tagStmt(begin)
                + "\n    " + String.join("\n    ", statements)
                + "\n    " + Util.tagStmt(end);
    }

    @Test
    void reconstruct_shouldGateEveryStatement_whenBranchIsAStatementSpan() {
        Workspace ws = Util.workspace(fn(span("FOO", "a.c:3:2", "x += 1;", "x *= 2;")));

        int gates = ConditionalReconstructor.reconstruct(ws);

        assertEquals(2, gates);
        String text = ws.getText(Util.MAIN_RS);
        assertTrue(text.contains("#[cfg(FOO)]\n    (x += 1);"), text);
        assertTrue(text.contains("#[cfg(FOO)]\n    (x *= 2);"), text);
    }

    @Test
    void reconstruct_shouldTurnGuardIntoCfgChoice_whenBranchIsAnExpression() {
        String literal = Util.conditional("BAR", "a.c:4:2").literal();
        Workspace ws = Util.workspace(fn("x = " + Util.exprGuard(literal, "1", "i32") + ";"));

        ConditionalReconstructor.reconstruct(ws);

        assertTrue(
                ws.getText(Util.MAIN_RS)
                        .contains("{ if cfg!(BAR) { 1 } else { *(0 as *mut i32) } }"),
                ws.getText(Util.MAIN_RS));
    }

    @Test
    void reconstruct_shouldGateDeclarations_whenBranchIsADeclarationTag() {
        String literal =
                Util.conditional("BAZ", "a.c:1:2").astKind("Decls").cuLnCol("2:0", "4:0").literal();
        Workspace ws =
                Util.workspace(
                        Util.tagItem("HAYROLL_TAG_0", literal) + "\n"
                                + "#[c2rust::src_loc = \"3:0\"]\n"
                                + "pub static mut counter: i32 = 0;\n");

        ConditionalReconstructor.reconstruct(ws);

        assertTrue(
                ws.getText(Util.MAIN_RS)
                        .contains("#[cfg(BAZ)]\n#[c2rust::src_loc = \"3:0\"]\npub static mut"),
                ws.getText(Util.MAIN_RS));
    }

    @Test
    void reconstruct_shouldBeIdempotent() {
        String literal = Util.conditional("BAR", "a.c:4:2").literal();
        Workspace ws =
                Util.workspace(
                        fn(
                                "x = " + Util.exprGuard(literal, "1", "i32") + ";",
                                span("FOO", "a.c:3:2", "x += 1;")));
        ConditionalReconstructor.reconstruct(ws);
        String once = ws.getText(Util.MAIN_RS);

        int gates = ConditionalReconstructor.reconstruct(ws);

        assertEquals(0, gates);
        assertEquals(once, ws.getText(Util.MAIN_RS));
    }

    @Test
    void reconstruct_shouldGateOnce_whenNestedSpansShareAPremise() {
        Workspace ws =
                Util.workspace(
                        fn(span("FOO", "a.c:3:2", span("FOO", "a.c:5:2", "x += 1;"))));

        ConditionalReconstructor.reconstruct(ws);

        String text = ws.getText(Util.MAIN_RS);
        assertEquals(text.indexOf("#[cfg(FOO)]"), text.lastIndexOf("#[cfg(FOO)]"), text);
    }

    @Test
    void reconstruct_shouldLeavePlaceholdersAlone() {
        String begin = Util.conditional("FOO", "a.c:3:2").astKind("Stmts").placeholder().literal();
        String end = Util.conditional("FOO", "a.c:3:2").end().literal();
        String source = fn(Util.tagStmt(begin), Util.tagStmt(end));
        Workspace ws = Util.workspace(source);

        assertEquals(0, ConditionalReconstructor.reconstruct(ws));
        assertEquals(source, ws.getText(Util.MAIN_RS));
    }

    @Test
    void reconstruct_shouldLeaveDeclarations_whenTheirTagIsAPlaceholder() {
        String literal =
                Util.conditional("BAZ", "a.c:1:2")
                        .astKind("Decls")
                        .cuLnCol("2:0", "4:0")
                        .placeholder()
                        .literal();
        String source =
                Util.tagItem("HAYROLL_TAG_0", literal) + "\n"
                        + "#[c2rust::src_loc = \"3:0\"]\n"
                        + "pub static mut counter: i32 = 0;\n";
        Workspace ws = Util.workspace(source);

        assertEquals(0, ConditionalReconstructor.reconstruct(ws));
        assertEquals(source, ws.getText(Util.MAIN_RS));
    }

    @Test
    void reconstruct_shouldThrow_whenPremiseIsMissing() {
        Workspace ws = Util.workspace(fn(span("", "a.c:3:2", "x += 1;")));

        assertThrows(MalformedTagException.class, () -> ConditionalReconstructor.reconstruct(ws));
    }
}
