package se.kth.hayroll.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A node of an immutable syntax tree. A node covers a contiguous run of significant tokens of its
 * {@link SyntaxTree}; its text is the source text between the first and the last of these tokens,
 * including any trivia in between. Nodes are compared by identity, so two nodes are equal only if
 * they are the same node of the same tree snapshot.
 */
public final class SyntaxNode {
    private final SyntaxKind kind;
    private final int firstToken;
    private final int lastToken;
    private final List<SyntaxNode> children;
    private SyntaxNode parent;
    private SyntaxTree tree;

    SyntaxNode(SyntaxKind kind, int firstToken, int lastToken, List<SyntaxNode> children) {
        this.kind = kind;
        this.firstToken = firstToken;
        this.lastToken = lastToken;
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
    }

    void attach(SyntaxTree tree, SyntaxNode parent) {
        this.tree = tree;
        this.parent = parent;
        for (SyntaxNode child : children) {
            child.attach(tree, this);
        }
    }

    public SyntaxKind getKind() {
        return kind;
    }

    public boolean is(SyntaxKind kind) {
        return this.kind == kind;
    }

    public SyntaxTree getTree() {
        return tree;
    }

    public SyntaxNode getParent() {
        return parent;
    }

    public List<SyntaxNode> getChildren() {
        return children;
    }

    public int getFirstTokenIndex() {
        return firstToken;
    }

    public int getLastTokenIndex() {
        return lastToken;
    }

    public boolean isEmpty() {
        return lastToken < firstToken;
    }

    /** @return Offset of the first character of this node in the source text. */
    public int getStart() {
        if (parent == null && kind == SyntaxKind.SOURCE_FILE) {
            return 0;
        }
        return tree.tokenStart(firstToken);
    }

    /** @return Offset one past the last character of this node in the source text. */
    public int getEnd() {
        if (parent == null && kind == SyntaxKind.SOURCE_FILE) {
            return tree.getText().length();
        }
        return isEmpty() ? getStart() : tree.token(lastToken).getEnd();
    }

    public String getText() {
        return tree.getText().substring(getStart(), getEnd());
    }

    /** @return The significant tokens covered by this node. */
    public List<Token> tokens() {
        if (isEmpty()) {
            return Collections.emptyList();
        }
        return tree.tokens().subList(firstToken, lastToken + 1);
    }

    public Token firstToken() {
        return tree.token(firstToken);
    }

    public Token lastToken() {
        return tree.token(lastToken);
    }

    /** @return True if the given node is this node or one of its descendants. */
    public boolean contains(SyntaxNode other) {
        for (SyntaxNode n = other; n != null; n = n.parent) {
            if (n == this) {
                return true;
            }
        }
        return false;
    }

    /** @return This node followed by all of its descendants in pre-order. */
    public Stream<SyntaxNode> descendants() {
        return Stream.concat(
                Stream.of(this), children.stream().flatMap(SyntaxNode::descendants));
    }

    /** @return This node followed by its parent, grandparent and so on. */
    public Stream<SyntaxNode> ancestors() {
        List<SyntaxNode> chain = new ArrayList<>();
        for (SyntaxNode n = this; n != null; n = n.parent) {
            chain.add(n);
        }
        return chain.stream();
    }

    /** Find the closest ancestor (or this node itself) matching the predicate. */
    public Optional<SyntaxNode> closest(Predicate<SyntaxNode> predicate) {
        for (SyntaxNode n = this; n != null; n = n.parent) {
            if (predicate.test(n)) {
                return Optional.of(n);
            }
        }
        return Optional.empty();
    }

    public Optional<SyntaxNode> closest(SyntaxKind kind) {
        return closest(n -> n.kind == kind);
    }

    public Optional<SyntaxNode> firstChild(SyntaxKind kind) {
        return children.stream().filter(c -> c.kind == kind).findFirst();
    }

    public List<SyntaxNode> children(SyntaxKind kind) {
        return children.stream().filter(c -> c.kind == kind).collect(Collectors.toList());
    }

    public int indexInParent() {
        return parent == null ? -1 : parent.children.indexOf(this);
    }

    @Override
    public String toString() {
        return kind + "@" + (tree == null ? "?" : getStart() + ".." + getEnd());
    }
}
