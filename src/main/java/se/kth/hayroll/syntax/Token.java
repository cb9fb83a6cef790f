package se.kth.hayroll.syntax;

/**
 * A single lexical token. Punctuation is always one character long; {@link #isJoint()} tells
 * whether the next token is punctuation that follows without intervening trivia, which is how
 * multi-character operators such as {@code ::} or {@code >>=} are recognized.
 */
public final class Token {
    private final TokenKind kind;
    private final String text;
    private final int start;
    private boolean joint;

    Token(TokenKind kind, String text, int start) {
        this.kind = kind;
        this.text = text;
        this.start = start;
    }

    public TokenKind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return start + text.length();
    }

    public boolean isJoint() {
        return joint;
    }

    void setJoint(boolean joint) {
        this.joint = joint;
    }

    public boolean isPunct(char c) {
        return kind == TokenKind.PUNCT && text.charAt(0) == c;
    }

    public boolean isIdent(String name) {
        return kind == TokenKind.IDENT && text.equals(name);
    }

    @Override
    public String toString() {
        return kind + "(" + text + ")@" + start;
    }
}
