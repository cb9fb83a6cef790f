package se.kth.hayroll.tag;

/**
 * The syntactic shape of the C construct a tag marks. End tags carry no kind ({@link #NONE});
 * unrecognized kinds map to {@link #OTHER}.
 */
public enum AstKind {
    EXPR("Expr"),
    STMT("Stmt"),
    STMTS("Stmts"),
    DECL("Decl"),
    DECLS("Decls"),
    NONE(""),
    OTHER(null);

    private final String wireName;

    AstKind(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public boolean isStatementLike() {
        return this == STMT || this == STMTS;
    }

    public boolean isDeclarationLike() {
        return this == DECL || this == DECLS;
    }

    public static AstKind fromWireName(String name) {
        for (AstKind kind : values()) {
            if (kind.wireName != null && kind.wireName.equals(name)) {
                return kind;
            }
        }
        return OTHER;
    }
}
