package se.kth.hayroll.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import se.kth.hayroll.Util;

class CleanerTest {

    @Test
    void clean_shouldRemoveAllScaffolding() {
        String begin = Util.conditional("FOO", "a.c:3:2").astKind("Stmts").literal();
        String end = Util.conditional("FOO", "a.c:3:2").end().literal();
        String guard = Util.exprGuard(Util.invocation("ONE", "a.c:4:9").literal(), "1", "i32");
        Workspace ws =
                Util.workspace(
                        "#[c2rust::src_loc = \"1:0\"]\n"
                                + "unsafe fn f(mut x: i32) {\n"
                                + "    " + Util.tagStmt(begin) + "\n"
                                + "    x += 1;\n"
                                + "    " + Util.tagStmt(end) + "\n"
                                + "    x = " + guard + ";\n"
                                + "}\n");

        int removed = Cleaner.clean(ws);

        assertEquals(4, removed);
        assertEquals(
                "unsafe fn f(mut x: i32) {\n    x += 1;\n    x = { 1 };\n}\n",
                ws.getText(Util.MAIN_RS));
    }

    @Test
    void clean_shouldPeelInnermostGuardFirst_whenGuardsNest() {
        String inner = Util.exprGuard(Util.invocation("ONE", "a.c:4:13").literal(), "1", "i32");
        String outer =
                Util.exprGuard(
                        Util.invocation("INC", "a.c:4:9").literal(), "(" + inner + ") + 1", "i32");
        Workspace ws = Util.workspace("unsafe fn f(mut x: i32) {\n    x = " + outer + ";\n}\n");

        Cleaner.clean(ws);

        String text = ws.getText(Util.MAIN_RS);
        assertTrue(text.contains("x = { ({ 1 }) + 1 };"), text);
        assertFalse(text.contains("hayroll"), text);
    }

    @Test
    void clean_shouldDeleteDeclarationTagItem_andKeepDeclarations() {
        String literal =
                Util.invocation("DECL", "a.c:1:1").astKind("Decls").cuLnCol("2:0", "3:0").literal();
        Workspace ws =
                Util.workspace(
                        Util.tagItem("HAYROLL_TAG_0", literal) + "\n"
                                + "#[c2rust::src_loc = \"2:0\"]\n"
                                + "pub static mut counter: i32 = 0;\n");

        Cleaner.clean(ws);

        assertEquals("pub static mut counter: i32 = 0;\n", ws.getText(Util.MAIN_RS));
    }

    @Test
    void stripLocationAttrs_shouldOnlyRemoveLocationAttributes() {
        Workspace ws =
                Util.workspace(
                        "#[no_mangle]\n#[c2rust::src_loc = \"7:0\"]\npub static mut g: i32 = 0;\n");

        int stripped = Cleaner.stripLocationAttrs(ws);

        assertEquals(1, stripped);
        assertEquals("#[no_mangle]\npub static mut g: i32 = 0;\n", ws.getText(Util.MAIN_RS));
    }
}
