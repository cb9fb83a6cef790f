package se.kth.hayroll.syntax;

import java.util.EnumSet;
import java.util.Set;

/** Node kinds of the Rust syntax tree. */
public enum SyntaxKind {
    SOURCE_FILE,
    ERROR,

    // attributes and item parts
    ATTR,
    TOKEN_TREE,
    VISIBILITY,
    NAME,
    ABI,
    GENERIC_PARAMS,
    WHERE_CLAUSE,
    PARAM_LIST,
    PARAM,
    RET_TYPE,
    FIELD_LIST,
    EXTERN_ITEM_LIST,
    ITEM_LIST,

    // items
    FN,
    STATIC,
    CONST,
    TYPE_ALIAS,
    STRUCT,
    UNION,
    ENUM,
    EXTERN_BLOCK,
    EXTERN_CRATE,
    USE,
    MODULE,
    IMPL,
    TRAIT,
    MACRO_RULES,
    MACRO_CALL,

    // types
    PATH_TYPE,
    PTR_TYPE,
    REF_TYPE,
    ARRAY_TYPE,
    SLICE_TYPE,
    TUPLE_TYPE,
    PAREN_TYPE,
    FN_PTR_TYPE,
    NEVER_TYPE,
    INFER_TYPE,
    DYN_TRAIT_TYPE,
    GENERIC_ARG_LIST,
    PATH,

    // statements
    STMT_LIST,
    LET_STMT,
    EXPR_STMT,

    // expressions
    BLOCK_EXPR,
    IF_EXPR,
    WHILE_EXPR,
    LOOP_EXPR,
    FOR_EXPR,
    MATCH_EXPR,
    MATCH_ARM_LIST,
    MATCH_ARM,
    MATCH_GUARD,
    RETURN_EXPR,
    BREAK_EXPR,
    CONTINUE_EXPR,
    PREFIX_EXPR,
    REF_EXPR,
    PAREN_EXPR,
    TUPLE_EXPR,
    ARRAY_EXPR,
    CALL_EXPR,
    ARG_LIST,
    METHOD_CALL_EXPR,
    FIELD_EXPR,
    INDEX_EXPR,
    TRY_EXPR,
    CAST_EXPR,
    BIN_EXPR,
    RANGE_EXPR,
    RECORD_EXPR,
    RECORD_EXPR_FIELD_LIST,
    RECORD_EXPR_FIELD,
    CLOSURE_EXPR,
    LET_EXPR,
    LITERAL,
    PATH_EXPR,
    UNDERSCORE_EXPR,
    META_VAR,
    LABEL,
    PAT;

    private static final Set<SyntaxKind> ITEMS =
            EnumSet.of(
                    FN,
                    STATIC,
                    CONST,
                    TYPE_ALIAS,
                    STRUCT,
                    UNION,
                    ENUM,
                    EXTERN_BLOCK,
                    EXTERN_CRATE,
                    USE,
                    MODULE,
                    IMPL,
                    TRAIT,
                    MACRO_RULES,
                    MACRO_CALL);

    private static final Set<SyntaxKind> TYPES =
            EnumSet.of(
                    PATH_TYPE,
                    PTR_TYPE,
                    REF_TYPE,
                    ARRAY_TYPE,
                    SLICE_TYPE,
                    TUPLE_TYPE,
                    PAREN_TYPE,
                    FN_PTR_TYPE,
                    NEVER_TYPE,
                    INFER_TYPE,
                    DYN_TRAIT_TYPE);

    private static final Set<SyntaxKind> BLOCK_LIKE =
            EnumSet.of(BLOCK_EXPR, IF_EXPR, WHILE_EXPR, LOOP_EXPR, FOR_EXPR, MATCH_EXPR);

    /** @return true if nodes of this kind are items (MACRO_CALL is also an expression). */
    public boolean isItem() {
        return ITEMS.contains(this);
    }

    public boolean isType() {
        return TYPES.contains(this);
    }

    public boolean isStatement() {
        return this == LET_STMT || this == EXPR_STMT || (isItem() && this != MACRO_CALL);
    }

    /** @return true for expressions that end a statement without a trailing semicolon. */
    public boolean isBlockLike() {
        return BLOCK_LIKE.contains(this);
    }
}
