package se.kth.hayroll.syntax;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import se.kth.hayroll.exception.SyntaxException;

/**
 * An edit transaction over the text of a syntax tree. Edits are recorded against offsets of the
 * unmodified text and applied all at once by {@link #finish()}, so positions computed before any
 * edit stay valid for the whole transaction. Conflicting edits are rejected when recorded.
 *
 * <p>An editor can be scoped to one node, in which case all edits must fall inside the node and
 * {@link #finish()} returns only the rewritten text of that node.
 */
public class SyntaxEditor {
    private final String text;
    private final int scopeStart;
    private final int scopeEnd;
    private final List<Edit> edits = new ArrayList<>();
    private int seq;

    private static class Edit {
        final int start;
        final int end;
        final String replacement;
        final int seq;

        Edit(int start, int end, String replacement, int seq) {
            this.start = start;
            this.end = end;
            this.replacement = replacement;
            this.seq = seq;
        }

        boolean isInsert() {
            return start == end;
        }
    }

    /** Create an editor over the full text of a tree. */
    public SyntaxEditor(SyntaxTree tree) {
        this(tree.getText(), 0, tree.getText().length());
    }

    /** Create an editor scoped to the text of a single node. */
    public SyntaxEditor(SyntaxNode scope) {
        this(scope.getTree().getText(), scope.getStart(), scope.getEnd());
    }

    /** Create an editor scoped to an arbitrary range of a tree's text. */
    public SyntaxEditor(SyntaxTree tree, int scopeStart, int scopeEnd) {
        this(tree.getText(), scopeStart, scopeEnd);
    }

    private SyntaxEditor(String text, int scopeStart, int scopeEnd) {
        this.text = text;
        this.scopeStart = scopeStart;
        this.scopeEnd = scopeEnd;
    }

    public void replace(SyntaxNode node, String replacement) {
        replaceRange(node.getStart(), node.getEnd(), replacement);
    }

    /** Replace the text from the start of {@code first} to the end of {@code last}. */
    public void replace(SyntaxNode first, SyntaxNode last, String replacement) {
        replaceRange(first.getStart(), last.getEnd(), replacement);
    }

    public void replaceRange(int start, int end, String replacement) {
        checkScope(start, end);
        for (Edit e : edits) {
            boolean conflict =
                    e.isInsert()
                            ? start < e.start && e.start < end
                            : start < e.end && e.start < end;
            if (conflict) {
                throw new SyntaxException(
                        "Edit of " + describe(start, end) + " conflicts with edit of "
                                + describe(e.start, e.end));
            }
        }
        edits.add(new Edit(start, end, replacement, seq++));
    }

    public void insertBefore(SyntaxNode node, String insertion) {
        insert(node.getStart(), insertion);
    }

    public void insertAfter(SyntaxNode node, String insertion) {
        insert(node.getEnd(), insertion);
    }

    /**
     * Insert text at an offset. Insertions at the same offset keep the order in which they were
     * recorded and come before a replacement that starts at that offset.
     */
    public void insert(int offset, String insertion) {
        checkScope(offset, offset);
        for (Edit e : edits) {
            if (!e.isInsert() && e.start < offset && offset < e.end) {
                throw new SyntaxException(
                        "Insertion at " + offset + " falls inside edit of "
                                + describe(e.start, e.end));
            }
        }
        edits.add(new Edit(offset, offset, insertion, seq++));
    }

    /**
     * Delete a node. If the node is the only thing on its lines, the lines are removed entirely
     * so that no blank line is left behind.
     */
    public void delete(SyntaxNode node) {
        int start = node.getStart();
        int end = node.getEnd();
        int lineStart = text.lastIndexOf('\n', start - 1) + 1;
        int lineEnd = text.indexOf('\n', end);
        if (lineEnd < 0) {
            lineEnd = text.length();
        }
        boolean aloneOnLines =
                text.substring(lineStart, start).trim().isEmpty()
                        && text.substring(end, lineEnd).trim().isEmpty();
        if (aloneOnLines && lineStart >= scopeStart && lineEnd < scopeEnd) {
            replaceRange(lineStart, lineEnd + 1, "");
        } else if (aloneOnLines && lineEnd < scopeEnd) {
            // the line starts outside the scope, so pull the next line up instead
            int next = lineEnd;
            while (next < scopeEnd && Character.isWhitespace(text.charAt(next))) {
                next++;
            }
            replaceRange(start, next, "");
        } else {
            replaceRange(start, end, "");
        }
    }

    /** @return true if a replacement overlaps the given range. */
    public boolean overlaps(int start, int end) {
        return edits.stream().anyMatch(e -> !e.isInsert() && start < e.end && e.start < end);
    }

    public boolean hasEdits() {
        return !edits.isEmpty();
    }

    /** @return The text with all edits applied (only the scope's text for a scoped editor). */
    public String finish() {
        List<Edit> sorted = new ArrayList<>(edits);
        sorted.sort(
                Comparator.<Edit>comparingInt(e -> e.start)
                        .thenComparing(e -> !e.isInsert())
                        .thenComparingInt(e -> e.seq));
        StringBuilder sb = new StringBuilder();
        int cursor = scopeStart;
        for (Edit e : sorted) {
            if (e.start > cursor) {
                sb.append(text, cursor, e.start);
            }
            sb.append(e.replacement);
            cursor = Math.max(cursor, e.end);
        }
        sb.append(text, cursor, scopeEnd);
        return sb.toString();
    }

    /** @return The whitespace that indents the line containing the offset. */
    public static String lineIndent(String text, int offset) {
        int lineStart = text.lastIndexOf('\n', offset - 1) + 1;
        int i = lineStart;
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i++;
        }
        return text.substring(lineStart, i);
    }

    /** @return true if only whitespace precedes the offset on its line. */
    public static boolean isAtLineStart(String text, int offset) {
        int lineStart = text.lastIndexOf('\n', offset - 1) + 1;
        return text.substring(lineStart, offset).trim().isEmpty();
    }

    private void checkScope(int start, int end) {
        if (start < scopeStart || end > scopeEnd || start > end) {
            throw new SyntaxException(
                    "Edit of " + describe(start, end) + " is outside of the editor's scope "
                            + describe(scopeStart, scopeEnd));
        }
    }

    private static String describe(int start, int end) {
        return "[" + start + ", " + end + ")";
    }
}
