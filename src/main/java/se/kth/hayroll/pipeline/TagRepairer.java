package se.kth.hayroll.pipeline;

import java.util.List;
import se.kth.hayroll.exception.ExtractionException;
import se.kth.hayroll.seed.SeedExtractor;
import se.kth.hayroll.syntax.RustAst;
import se.kth.hayroll.syntax.SyntaxEditor;
import se.kth.hayroll.syntax.SyntaxKind;
import se.kth.hayroll.syntax.SyntaxNode;
import se.kth.hayroll.tag.HayrollTag;
import se.kth.hayroll.util.LazyLogger;

/**
 * Restores end tags that the translator dropped. A statement span that ends in a {@code return}
 * loses its end tag, because the tag follows unreachable code; the repaired end tag is a copy of
 * the begin tag statement with {@code begin} cleared, placed right after the first {@code
 * return} statement that follows the begin tag in the same statement list.
 */
public class TagRepairer {
    private static final LazyLogger LOGGER = new LazyLogger(TagRepairer.class);

    /**
     * Repair every unmatched begin tag of the workspace.
     *
     * @return The number of repaired spans.
     * @throws ExtractionException if a span has no return statement to end it.
     */
    public static int repair(Workspace workspace) {
        List<HayrollTag> unmatched =
                SeedExtractor.extract(workspace.getTrees()).getUnmatchedBeginTags();
        EditPlan plan = new EditPlan(workspace);
        for (HayrollTag tag : unmatched) {
            SyntaxNode begin =
                    RustAst.enclosingStatement(tag.getLiteral())
                            .orElseThrow(
                                    () -> new ExtractionException(
                                            "Begin tag " + tag + " is not a statement"));
            SyntaxNode ret = firstReturnAfter(begin);
            if (ret == null) {
                throw new ExtractionException(
                        "Cannot repair begin tag " + tag + ": no return statement follows it");
            }
            LOGGER.info(() -> "Repairing end tag of " + tag + " after " + ret);
            String text = ret.getTree().getText();
            String semicolon = ret.lastToken().isPunct(';') ? "" : ";";
            String indent = SyntaxEditor.lineIndent(text, begin.getStart());
            String endTag = endTagStatement(tag, begin);
            plan.insertAfter(tag.getFile(), ret, semicolon + "\n" + indent + endTag);
        }
        plan.apply();
        return unmatched.size();
    }

    private static SyntaxNode firstReturnAfter(SyntaxNode begin) {
        List<SyntaxNode> statements = RustAst.statements(begin.getParent());
        List<SyntaxNode> following =
                statements.subList(statements.indexOf(begin) + 1, statements.size());
        for (SyntaxNode statement : following) {
            if (statement.is(SyntaxKind.EXPR_STMT)
                    && RustAst.stmtExpr(statement).is(SyntaxKind.RETURN_EXPR)) {
                return statement;
            }
        }
        return null;
    }

    /** @return The begin tag statement with its literal replaced by an end tag literal. */
    static String endTagStatement(HayrollTag tag, SyntaxNode beginStatement) {
        SyntaxEditor editor = new SyntaxEditor(beginStatement);
        editor.replace(tag.getLiteral(), tag.withUpdatedBegin(false));
        String statement = editor.finish();
        return statement.trim().endsWith(";") ? statement : statement + ";";
    }
}
