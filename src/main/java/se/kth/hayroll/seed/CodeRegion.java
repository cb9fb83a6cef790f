package se.kth.hayroll.seed;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import se.kth.hayroll.syntax.RustAst;
import se.kth.hayroll.syntax.SyntaxEditor;
import se.kth.hayroll.syntax.SyntaxKind;
import se.kth.hayroll.syntax.SyntaxNode;
import se.kth.hayroll.syntax.SyntaxTree;
import se.kth.hayroll.util.Pair;

/**
 * The code a seed covers in one tree snapshot. A region has exactly one of three shapes: a
 * single expression, a contiguous span of statements of one statement list, or a scattered set
 * of declarations. Regions are derived on demand from seeds and never outlive the snapshot they
 * were derived from.
 *
 * <p>The peel operations return text rather than nodes: the result is detached from the tree and
 * callers re-parse it when they need structure.
 */
public abstract class CodeRegion {

    /** The three region shapes. */
    public enum Shape {
        EXPR,
        STMTS,
        DECLS
    }

    private CodeRegion() {}

    public abstract Shape getShape();

    public abstract SyntaxTree getTree();

    /** @return Offset of the first character covered by the region. */
    public abstract int getStart();

    /** @return Offset one past the last character covered by the region. */
    public abstract int getEnd();

    /** @return The source text of the region, declarations separated by newlines. */
    public abstract String getText();

    /** @return The smallest node containing the whole region. */
    public abstract SyntaxNode lub();

    /** @return The region with its instrumentation scaffolding removed, as detached text. */
    public String peelTag() {
        return peelTag(Collections.emptyList());
    }

    /**
     * Peel the region while applying substitutions. Substitutions that do not lie within the
     * code kept by peeling are ignored.
     */
    public abstract String peelTag(List<Substitution> substitutions);

    /**
     * @return The first and last node of the region, for a single bulk replacement.
     * @throws IllegalStateException for declaration regions, which are not contiguous, and for
     *     empty statement spans.
     */
    public abstract Pair<SyntaxNode, SyntaxNode> flattenToRange();

    /** @return The nodes of the region. */
    public abstract List<SyntaxNode> flattenToList();

    /** @return true if the node lies within the region. */
    public boolean contains(SyntaxNode node) {
        return flattenToList().stream().anyMatch(n -> n.contains(node));
    }

    public boolean isEmpty() {
        return flattenToList().isEmpty();
    }

    public static CodeRegion.Expr expr(SyntaxNode node) {
        return new Expr(node);
    }

    public static CodeRegion.Stmts stmts(SyntaxNode stmtList, int first, int last) {
        return new Stmts(stmtList, first, last);
    }

    public static CodeRegion.Decls decls(List<SyntaxNode> items) {
        return new Decls(items);
    }

    private static String edit(SyntaxTree tree, int start, int end, List<Substitution> subs) {
        SyntaxEditor editor = new SyntaxEditor(tree, start, end);
        for (Substitution sub : subs) {
            if (sub.isWithin(start, end)) {
                editor.replaceRange(sub.getStart(), sub.getEnd(), sub.getText());
            }
        }
        return editor.finish();
    }

    /**
     * A single expression: the guarding {@code if} of a seed, or the dereference wrapping it
     * when the seed is an lvalue.
     */
    public static final class Expr extends CodeRegion {
        private final SyntaxNode node;

        private Expr(SyntaxNode node) {
            this.node = node;
        }

        public SyntaxNode getNode() {
            return node;
        }

        @Override
        public Shape getShape() {
            return Shape.EXPR;
        }

        @Override
        public SyntaxTree getTree() {
            return node.getTree();
        }

        @Override
        public int getStart() {
            return node.getStart();
        }

        @Override
        public int getEnd() {
            return node.getEnd();
        }

        @Override
        public String getText() {
            return node.getText();
        }

        @Override
        public SyntaxNode lub() {
            return node;
        }

        /**
         * Collapse the guard to its live branch. For a dereferenced guard ({@code *if T {&mut x}
         * else {..}}) the dereference is kept and applied directly to the live branch.
         */
        @Override
        public String peelTag(List<Substitution> substitutions) {
            SyntaxTree tree = node.getTree();
            if (node.is(SyntaxKind.IF_EXPR)) {
                SyntaxNode then = RustAst.thenBranch(node);
                return edit(tree, then.getStart(), then.getEnd(), substitutions);
            }
            SyntaxNode ifExpr =
                    node.descendants()
                            .filter(n -> n.is(SyntaxKind.IF_EXPR))
                            .findFirst()
                            .orElse(null);
            if (ifExpr == null) {
                return edit(tree, node.getStart(), node.getEnd(), substitutions);
            }
            SyntaxNode then = RustAst.thenBranch(ifExpr);
            return tree.getText().substring(node.getStart(), ifExpr.getStart())
                    + edit(tree, then.getStart(), then.getEnd(), substitutions)
                    + tree.getText().substring(ifExpr.getEnd(), node.getEnd());
        }

        @Override
        public Pair<SyntaxNode, SyntaxNode> flattenToRange() {
            return Pair.of(node, node);
        }

        @Override
        public List<SyntaxNode> flattenToList() {
            return Collections.singletonList(node);
        }
    }

    /**
     * A contiguous span of statements {@code [first, last]} (inclusive indices into the
     * statements of a statement list). The span is empty if {@code first > last}.
     */
    public static final class Stmts extends CodeRegion {
        private final SyntaxNode stmtList;
        private final int first;
        private final int last;

        private Stmts(SyntaxNode stmtList, int first, int last) {
            this.stmtList = stmtList;
            this.first = first;
            this.last = last;
        }

        public SyntaxNode getStmtList() {
            return stmtList;
        }

        public int getFirst() {
            return first;
        }

        public int getLast() {
            return last;
        }

        @Override
        public Shape getShape() {
            return Shape.STMTS;
        }

        @Override
        public SyntaxTree getTree() {
            return stmtList.getTree();
        }

        @Override
        public int getStart() {
            List<SyntaxNode> stmts = flattenToList();
            return stmts.isEmpty() ? anchor() : stmts.get(0).getStart();
        }

        @Override
        public int getEnd() {
            List<SyntaxNode> stmts = flattenToList();
            return stmts.isEmpty() ? anchor() : stmts.get(stmts.size() - 1).getEnd();
        }

        private int anchor() {
            List<SyntaxNode> all = RustAst.statements(stmtList);
            if (first > 0 && first - 1 < all.size()) {
                return all.get(first - 1).getEnd();
            }
            return stmtList.getStart() + 1;
        }

        @Override
        public String getText() {
            return getTree().getText().substring(getStart(), getEnd());
        }

        @Override
        public SyntaxNode lub() {
            return stmtList;
        }

        /** @return The same statement list with the span narrowed by one at both ends. */
        public Stmts inner() {
            return new Stmts(stmtList, first + 1, last - 1);
        }

        /** Drop the first and the last statement of the span, which carry the tags. */
        @Override
        public String peelTag(List<Substitution> substitutions) {
            if (last - first < 2) {
                return "";
            }
            Stmts inner = inner();
            return edit(getTree(), inner.getStart(), inner.getEnd(), substitutions);
        }

        @Override
        public Pair<SyntaxNode, SyntaxNode> flattenToRange() {
            List<SyntaxNode> stmts = flattenToList();
            if (stmts.isEmpty()) {
                throw new IllegalStateException("Empty statement span has no node range");
            }
            return Pair.of(stmts.get(0), stmts.get(stmts.size() - 1));
        }

        @Override
        public List<SyntaxNode> flattenToList() {
            if (first > last) {
                return Collections.emptyList();
            }
            return new ArrayList<>(RustAst.statements(stmtList).subList(first, last + 1));
        }
    }

    /** Declarations of one file, in document order, not necessarily adjacent. */
    public static final class Decls extends CodeRegion {
        private final List<SyntaxNode> items;

        private Decls(List<SyntaxNode> items) {
            this.items = Collections.unmodifiableList(new ArrayList<>(items));
        }

        public List<SyntaxNode> getItems() {
            return items;
        }

        @Override
        public Shape getShape() {
            return Shape.DECLS;
        }

        @Override
        public SyntaxTree getTree() {
            return items.isEmpty() ? null : items.get(0).getTree();
        }

        @Override
        public int getStart() {
            return items.isEmpty() ? 0 : items.get(0).getStart();
        }

        @Override
        public int getEnd() {
            return items.isEmpty() ? 0 : items.get(items.size() - 1).getEnd();
        }

        @Override
        public String getText() {
            return items.stream().map(SyntaxNode::getText).collect(Collectors.joining("\n"));
        }

        @Override
        public SyntaxNode lub() {
            if (items.isEmpty()) {
                throw new IllegalStateException("Empty declaration region");
            }
            return items.get(0).getTree().getRoot();
        }

        /** Declarations carry no scaffolding; only substitutions are applied. */
        @Override
        public String peelTag(List<Substitution> substitutions) {
            return items.stream()
                    .map(i -> edit(i.getTree(), i.getStart(), i.getEnd(), substitutions))
                    .collect(Collectors.joining("\n"));
        }

        /**
         * Give every declaration that lives in a shared {@code extern "C"} block a block of its
         * own, so that it can be moved without its siblings.
         */
        public List<String> individualizeDecls() {
            return items.stream()
                    .map(i -> individualize(i, i.getText()))
                    .collect(Collectors.toList());
        }

        /** @return The declarations with their {@code #[c2rust::src_loc]} attributes removed. */
        public List<String> peelLocationAttrs() {
            return items.stream().map(Decls::withoutLocationAttrs).collect(Collectors.toList());
        }

        /** @return Individualized declarations without location attributes, one per line. */
        public String toTemplateBody() {
            return items.stream()
                    .map(i -> individualize(i, withoutLocationAttrs(i)))
                    .collect(Collectors.joining("\n"));
        }

        private static String individualize(SyntaxNode item, String text) {
            boolean inExternC =
                    item.getParent() != null
                            && item.ancestors().skip(1).anyMatch(RustAst::isExternC);
            return inExternC ? "extern \"C\" {\n    " + text + "\n}" : text;
        }

        private static String withoutLocationAttrs(SyntaxNode item) {
            SyntaxEditor editor = new SyntaxEditor(item);
            for (SyntaxNode attr : RustAst.attrs(item)) {
                if (RustAst.isSrcLocAttr(attr)) {
                    editor.delete(attr);
                }
            }
            return editor.finish();
        }

        @Override
        public Pair<SyntaxNode, SyntaxNode> flattenToRange() {
            throw new IllegalStateException(
                    "Declaration regions are not contiguous; use flattenToList()");
        }

        @Override
        public List<SyntaxNode> flattenToList() {
            return items;
        }
    }
}
