package se.kth.hayroll.pipeline;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import se.kth.hayroll.seed.CodeRegion;
import se.kth.hayroll.syntax.SyntaxEditor;
import se.kth.hayroll.syntax.SyntaxKind;
import se.kth.hayroll.syntax.SyntaxNode;
import se.kth.hayroll.syntax.SyntaxTree;
import se.kth.hayroll.util.LazyLogger;
import se.kth.hayroll.util.Pair;

/**
 * The edits of one pass, planned against a single snapshot of the workspace and applied in one
 * transaction per file. Positions stay valid for the whole pass because nothing is applied
 * before {@link #apply()}.
 */
public class EditPlan {
    private static final LazyLogger LOGGER = new LazyLogger(EditPlan.class);

    private final Workspace workspace;
    private final Map<Path, SyntaxEditor> editors = new LinkedHashMap<>();
    private final Set<Path> appendedTo = new HashSet<>();

    public EditPlan(Workspace workspace) {
        this.workspace = workspace;
    }

    public Workspace getWorkspace() {
        return workspace;
    }

    private SyntaxEditor editor(Path file) {
        return editors.computeIfAbsent(file, f -> new SyntaxEditor(workspace.getTree(f)));
    }

    /** Replace an expression or statement region with text in a single bulk edit. */
    public void replace(Path file, CodeRegion region, String replacement) {
        Pair<SyntaxNode, SyntaxNode> range = region.flattenToRange();
        editor(file).replace(range.first, range.second, replacement);
    }

    public void replace(Path file, SyntaxNode node, String replacement) {
        editor(file).replace(node, replacement);
    }

    public void replaceRange(Path file, int start, int end, String replacement) {
        editor(file).replaceRange(start, end, replacement);
    }

    public void delete(Path file, SyntaxNode node) {
        editor(file).delete(node);
    }

    public void insertBefore(Path file, SyntaxNode node, String text) {
        editor(file).insertBefore(node, text);
    }

    public void insertAfter(Path file, SyntaxNode node, String text) {
        editor(file).insertAfter(node, text);
    }

    /** Insert a definition before the first item of a file, after any inner attributes. */
    public void insertAtTop(Path file, String definition) {
        SyntaxTree tree = workspace.getTree(file);
        int offset =
                tree.getRoot().getChildren().stream()
                        .filter(c -> !c.is(SyntaxKind.ATTR))
                        .findFirst()
                        .map(c -> lineStart(tree.getText(), c.getStart()))
                        .orElse(tree.getText().length());
        editor(file).insert(offset, definition + "\n\n");
    }

    /** Append a definition to the end of a file, separated by an empty line. */
    public void insertAtBottom(Path file, String definition) {
        String text = workspace.getText(file);
        boolean unterminated = !text.isEmpty() && !text.endsWith("\n");
        String separator = appendedTo.add(file) && unterminated ? "\n\n" : "\n";
        editor(file).insert(text.length(), separator + definition + "\n");
    }

    /** @return true if a planned replacement or deletion in the file overlaps the range. */
    public boolean overlaps(Path file, int start, int end) {
        SyntaxEditor editor = editors.get(file);
        return editor != null && editor.overlaps(start, end);
    }

    public boolean isEmpty() {
        return editors.values().stream().noneMatch(SyntaxEditor::hasEdits);
    }

    /**
     * Apply all planned edits and re-parse the edited files.
     *
     * @return The files that were edited.
     */
    public List<Path> apply() {
        List<Path> edited = new ArrayList<>();
        for (Map.Entry<Path, SyntaxEditor> entry : editors.entrySet()) {
            if (entry.getValue().hasEdits()) {
                workspace.update(entry.getKey(), entry.getValue().finish());
                edited.add(entry.getKey());
            }
        }
        LOGGER.debug(() -> "Applied edits to " + edited);
        editors.clear();
        appendedTo.clear();
        return edited;
    }

    private static int lineStart(String text, int offset) {
        return text.lastIndexOf('\n', offset - 1) + 1;
    }
}
