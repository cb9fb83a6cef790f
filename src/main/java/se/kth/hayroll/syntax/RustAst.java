package se.kth.hayroll.syntax;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Typed accessors over untyped {@link SyntaxNode}s. Each accessor expects a node of a specific
 * kind and returns the part of it that the Rust grammar names.
 */
public class RustAst {
    public static final String SRC_LOC_ATTR = "c2rust::src_loc";

    /** @return The children of a node, without its outer attributes and label. */
    public static List<SyntaxNode> parts(SyntaxNode node) {
        return node.getChildren().stream()
                .filter(c -> !c.is(SyntaxKind.ATTR) && !c.is(SyntaxKind.LABEL))
                .collect(Collectors.toList());
    }

    private static Optional<SyntaxNode> part(SyntaxNode node, int index) {
        List<SyntaxNode> parts = parts(node);
        return index < parts.size() ? Optional.of(parts.get(index)) : Optional.empty();
    }

    public static SyntaxNode ifCondition(SyntaxNode ifExpr) {
        expect(ifExpr, SyntaxKind.IF_EXPR);
        return parts(ifExpr).get(0);
    }

    public static SyntaxNode thenBranch(SyntaxNode ifExpr) {
        expect(ifExpr, SyntaxKind.IF_EXPR);
        return parts(ifExpr).get(1);
    }

    /** @return The else branch, which is either a block or another if expression. */
    public static Optional<SyntaxNode> elseBranch(SyntaxNode ifExpr) {
        expect(ifExpr, SyntaxKind.IF_EXPR);
        return part(ifExpr, 2);
    }

    public static SyntaxNode stmtList(SyntaxNode block) {
        expect(block, SyntaxKind.BLOCK_EXPR);
        return block.firstChild(SyntaxKind.STMT_LIST)
                .orElseThrow(() -> new IllegalStateException("block without statement list"));
    }

    /** @return The statements of a statement list, inner attributes excluded. */
    public static List<SyntaxNode> statements(SyntaxNode stmtList) {
        expect(stmtList, SyntaxKind.STMT_LIST);
        return stmtList.getChildren().stream()
                .filter(c -> !c.is(SyntaxKind.ATTR))
                .collect(Collectors.toList());
    }

    /** @return The expression of an expression statement. */
    public static SyntaxNode stmtExpr(SyntaxNode exprStmt) {
        expect(exprStmt, SyntaxKind.EXPR_STMT);
        return parts(exprStmt).get(0);
    }

    /** @return The operand of a prefix, reference or parenthesized expression. */
    public static SyntaxNode operand(SyntaxNode node) {
        return parts(node).get(0);
    }

    public static String prefixOp(SyntaxNode prefixExpr) {
        expect(prefixExpr, SyntaxKind.PREFIX_EXPR);
        return prefixExpr.firstToken().getText();
    }

    public static boolean isDeref(SyntaxNode node) {
        return node.is(SyntaxKind.PREFIX_EXPR) && prefixOp(node).equals("*");
    }

    /** @return The single element type of a pointer type. */
    public static SyntaxNode pointee(SyntaxNode ptrType) {
        expect(ptrType, SyntaxKind.PTR_TYPE);
        return ptrType.getChildren().get(0);
    }

    public static List<SyntaxNode> attrs(SyntaxNode node) {
        return node.children(SyntaxKind.ATTR);
    }

    /**
     * @return The path of an attribute, e.g. {@code c2rust::src_loc} for {@code
     *     #[c2rust::src_loc = "1:0"]}.
     */
    public static String attrPath(SyntaxNode attr) {
        expect(attr, SyntaxKind.ATTR);
        StringBuilder sb = new StringBuilder();
        for (Token t : attrBody(attr)) {
            if (t.getKind() == TokenKind.IDENT || t.isPunct(':')) {
                sb.append(t.getText());
            } else {
                break;
            }
        }
        return sb.toString();
    }

    /** @return The string value of a {@code #[path = "value"]} attribute, if it has one. */
    public static Optional<String> attrStringValue(SyntaxNode attr) {
        List<Token> body = attrBody(attr);
        for (int i = 0; i + 1 < body.size(); i++) {
            if (body.get(i).isPunct('=') && body.get(i + 1).getKind() == TokenKind.STRING) {
                String quoted = body.get(i + 1).getText();
                return Optional.of(quoted.substring(1, quoted.length() - 1));
            }
        }
        return Optional.empty();
    }

    private static List<Token> attrBody(SyntaxNode attr) {
        SyntaxNode tt = attr.firstChild(SyntaxKind.TOKEN_TREE).orElse(attr);
        List<Token> tokens = tt.tokens();
        // drop the surrounding brackets
        return tokens.size() >= 2 ? tokens.subList(1, tokens.size() - 1) : tokens;
    }

    public static boolean isSrcLocAttr(SyntaxNode attr) {
        return attr.is(SyntaxKind.ATTR) && attrPath(attr).equals(SRC_LOC_ATTR);
    }

    /** @return The declared name of an item, if it has one. */
    public static Optional<String> name(SyntaxNode item) {
        return item.firstChild(SyntaxKind.NAME).map(SyntaxNode::getText);
    }

    /**
     * @return The ABI string of an extern block or function, {@code "C"} for a bare {@code
     *     extern}, or empty if the node carries no ABI.
     */
    public static Optional<String> abi(SyntaxNode node) {
        return node.firstChild(SyntaxKind.ABI)
                .map(
                        abi -> {
                            List<Token> tokens = abi.tokens();
                            if (tokens.size() < 2) {
                                return "C";
                            }
                            String quoted = tokens.get(1).getText();
                            return quoted.substring(1, quoted.length() - 1);
                        });
    }

    public static boolean isExternC(SyntaxNode node) {
        return node.is(SyntaxKind.EXTERN_BLOCK) && abi(node).map("C"::equals).orElse(false);
    }

    /** @return The items of an extern block. */
    public static List<SyntaxNode> externItems(SyntaxNode externBlock) {
        expect(externBlock, SyntaxKind.EXTERN_BLOCK);
        return externBlock.firstChild(SyntaxKind.EXTERN_ITEM_LIST)
                .map(list -> list.getChildren().stream()
                        .filter(c -> !c.is(SyntaxKind.ATTR))
                        .collect(Collectors.toList()))
                .orElse(List.of());
    }

    /**
     * Render the tokens of a node with all trivia removed and a single space only where two
     * word-like tokens meet, so that {@code *const   libc::c_int} and {@code *const
     * libc::c_int} normalize to the same text.
     */
    public static String normalizedText(SyntaxNode node) {
        StringBuilder sb = new StringBuilder();
        Token prev = null;
        for (Token t : node.tokens()) {
            if (prev != null && isWordLike(prev) && isWordLike(t)) {
                sb.append(' ');
            }
            sb.append(t.getText());
            prev = t;
        }
        return sb.toString();
    }

    private static boolean isWordLike(Token t) {
        return t.getKind() != TokenKind.PUNCT;
    }

    /** @return The closest enclosing item, the node itself included. */
    public static Optional<SyntaxNode> enclosingItem(SyntaxNode node) {
        return node.closest(n -> n.getKind().isItem() && !n.is(SyntaxKind.MACRO_CALL));
    }

    /** @return The closest statement containing the node, the node itself included. */
    public static Optional<SyntaxNode> enclosingStatement(SyntaxNode node) {
        return node.closest(
                n -> n.getParent() != null
                        && n.getParent().is(SyntaxKind.STMT_LIST)
                        && !n.is(SyntaxKind.ATTR));
    }

    /** @return Strip any parentheses around an expression. */
    public static SyntaxNode unparenthesize(SyntaxNode expr) {
        SyntaxNode e = expr;
        while (e.is(SyntaxKind.PAREN_EXPR) && parts(e).size() == 1) {
            e = parts(e).get(0);
        }
        return e;
    }

    private static void expect(SyntaxNode node, SyntaxKind kind) {
        if (!node.is(kind)) {
            throw new IllegalArgumentException("expected " + kind + " but got " + node);
        }
    }
}
