package se.kth.hayroll.syntax;

/** Lexical categories of the tokens a {@link TreeSitterParser} cuts source text into. */
public enum TokenKind {
    WHITESPACE,
    LINE_COMMENT,
    BLOCK_COMMENT,
    IDENT,
    LIFETIME,
    INT_NUMBER,
    FLOAT_NUMBER,
    CHAR,
    BYTE,
    STRING,
    BYTE_STRING,
    C_STRING,
    RAW_STRING,
    RAW_BYTE_STRING,
    PUNCT,
    UNKNOWN;

    public boolean isTrivia() {
        return this == WHITESPACE || this == LINE_COMMENT || this == BLOCK_COMMENT;
    }

    public boolean isLiteral() {
        switch (this) {
            case INT_NUMBER:
            case FLOAT_NUMBER:
            case CHAR:
            case BYTE:
            case STRING:
            case BYTE_STRING:
            case C_STRING:
            case RAW_STRING:
            case RAW_BYTE_STRING:
                return true;
            default:
                return false;
        }
    }
}
