package se.kth.hayroll.syntax;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;
import se.kth.hayroll.exception.SyntaxException;

class SyntaxEditorTest {
    private static final String SOURCE =
            "fn f() {\n    let a = 1;\n    let b = 2;\n    let c = 3;\n}\n";

    private static List<SyntaxNode> statements(SyntaxTree tree) {
        SyntaxNode fn = tree.getRoot().getChildren().get(0);
        SyntaxNode block = fn.firstChild(SyntaxKind.BLOCK_EXPR).get();
        return RustAst.statements(RustAst.stmtList(block));
    }

    @Test
    void finish_shouldApplyEditsAgainstOriginalOffsets() {
        SyntaxTree tree = TreeSitterParser.parseSourceFile(SOURCE);
        List<SyntaxNode> stmts = statements(tree);
        SyntaxEditor editor = new SyntaxEditor(tree);

        editor.replace(stmts.get(2), "let c = 30;");
        editor.replace(stmts.get(0), "let a = 10;");

        assertEquals(
                "fn f() {\n    let a = 10;\n    let b = 2;\n    let c = 30;\n}\n", editor.finish());
    }

    @Test
    void delete_shouldRemoveWholeLine_whenNodeIsAloneOnIt() {
        SyntaxTree tree = TreeSitterParser.parseSourceFile(SOURCE);
        SyntaxEditor editor = new SyntaxEditor(tree);

        editor.delete(statements(tree).get(1));

        assertEquals("fn f() {\n    let a = 1;\n    let c = 3;\n}\n", editor.finish());
    }

    @Test
    void insert_shouldKeepRecordingOrder_whenOffsetsAreEqual() {
        SyntaxTree tree = TreeSitterParser.parseSourceFile(SOURCE);
        SyntaxNode last = statements(tree).get(2);
        SyntaxEditor editor = new SyntaxEditor(tree);

        editor.insertAfter(last, " // one");
        editor.insertAfter(last, " // two");

        assertTrue(editor.finish().contains("let c = 3; // one // two\n"));
    }

    @Test
    void replaceRange_shouldThrow_whenEditsOverlap() {
        SyntaxTree tree = TreeSitterParser.parseSourceFile(SOURCE);
        SyntaxNode fn = tree.getRoot().getChildren().get(0);
        SyntaxEditor editor = new SyntaxEditor(tree);
        editor.replace(statements(tree).get(1), "let b = 20;");

        assertThrows(SyntaxException.class, () -> editor.replace(fn, ""));
    }

    @Test
    void insert_shouldThrow_whenOffsetFallsInsideReplacement() {
        SyntaxTree tree = TreeSitterParser.parseSourceFile(SOURCE);
        SyntaxNode stmt = statements(tree).get(1);
        SyntaxEditor editor = new SyntaxEditor(tree);
        editor.replace(stmt, "let b = 20;");

        assertThrows(SyntaxException.class, () -> editor.insert(stmt.getStart() + 2, "x"));
    }

    @Test
    void finish_shouldReturnOnlyScope_whenEditorIsScopedToNode() {
        SyntaxTree tree = TreeSitterParser.parseSourceFile(SOURCE);
        List<SyntaxNode> stmts = statements(tree);
        SyntaxEditor editor = new SyntaxEditor(stmts.get(1));
        SyntaxNode literal =
                stmts.get(1).descendants().filter(n -> n.is(SyntaxKind.LITERAL)).findFirst().get();

        editor.replace(literal, "42");

        assertEquals("let b = 42;", editor.finish());
        assertThrows(SyntaxException.class, () -> editor.replace(stmts.get(0), ""));
    }

    @Test
    void overlaps_shouldIgnoreInsertions() {
        SyntaxTree tree = TreeSitterParser.parseSourceFile(SOURCE);
        SyntaxNode stmt = statements(tree).get(0);
        SyntaxEditor editor = new SyntaxEditor(tree);

        editor.insertBefore(stmt, "// note\n    ");

        assertFalse(editor.overlaps(stmt.getStart(), stmt.getEnd()));
        editor.replace(stmt, "let a = 5;");
        assertTrue(editor.overlaps(stmt.getStart() + 1, stmt.getStart() + 2));
    }

    @Test
    void lineIndent_shouldReturnLeadingWhitespaceOfLine() {
        assertEquals("    ", SyntaxEditor.lineIndent(SOURCE, SOURCE.indexOf("let b")));
        assertTrue(SyntaxEditor.isAtLineStart(SOURCE, SOURCE.indexOf("let b")));
        assertFalse(SyntaxEditor.isAtLineStart(SOURCE, SOURCE.indexOf("= 2")));
    }
}
