package se.kth.hayroll.syntax;

import java.util.Collections;
import java.util.List;

/**
 * An immutable parse of one source text. Edits never change a tree; they produce new text (see
 * {@link SyntaxEditor}) that is parsed into a fresh tree.
 */
public final class SyntaxTree {
    private final String text;
    private final List<Token> tokens;
    private final SyntaxNode root;

    SyntaxTree(String text, List<Token> tokens, SyntaxNode root) {
        this.text = text;
        this.tokens = Collections.unmodifiableList(tokens);
        this.root = root;
        root.attach(this, null);
    }

    public String getText() {
        return text;
    }

    public SyntaxNode getRoot() {
        return root;
    }

    /** @return The significant (non-trivia) tokens of the text. */
    public List<Token> tokens() {
        return tokens;
    }

    public Token token(int index) {
        return tokens.get(index);
    }

    int tokenStart(int index) {
        return index < tokens.size() ? tokens.get(index).getStart() : text.length();
    }
}
