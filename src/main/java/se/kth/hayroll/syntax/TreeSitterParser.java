package se.kth.hayroll.syntax;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterRust;
import se.kth.hayroll.exception.SyntaxException;
import se.kth.hayroll.util.LazyLogger;

/**
 * Builds {@link SyntaxTree}s from tree-sitter parses of Rust text. The concrete tree of the
 * tree-sitter-rust grammar is lowered onto the {@link SyntaxKind} shapes the rest of the tool
 * works with: outer attributes become children of the item or statement they precede, the tail
 * expression of a block becomes an expression statement, and every keyword, identifier, literal
 * and punctuation character becomes a {@link Token}.
 *
 * <p>Full files never fail to parse: tree-sitter's error nodes are kept as {@link
 * SyntaxKind#ERROR}. Fragment entry points are strict and throw {@link SyntaxException} if the
 * text is not exactly one construct of the requested kind.
 */
public class TreeSitterParser {
    private static final LazyLogger LOGGER = new LazyLogger(TreeSitterParser.class);

    private static final TSLanguage RUST = new TreeSitterRust();

    // fragments are parsed in a context where the grammar accepts them
    private static final String EXPR_PREFIX = "const HAYROLL_FRAGMENT: () =\n";
    private static final String TYPE_PREFIX = "type HayrollFragment =\n";
    private static final String FRAGMENT_SUFFIX = "\n;";

    private static final Set<String> ITEMS =
            Set.of(
                    "function_item",
                    "function_signature_item",
                    "static_item",
                    "const_item",
                    "type_item",
                    "associated_type",
                    "struct_item",
                    "union_item",
                    "enum_item",
                    "foreign_mod_item",
                    "extern_crate_declaration",
                    "use_declaration",
                    "mod_item",
                    "impl_item",
                    "trait_item",
                    "macro_definition");

    private static final Set<String> BLOCKS =
            Set.of("block", "unsafe_block", "async_block", "const_block", "try_block");

    private static final Set<String> LITERALS =
            Set.of(
                    "integer_literal",
                    "float_literal",
                    "string_literal",
                    "raw_string_literal",
                    "char_literal",
                    "boolean_literal");

    private static final Set<String> IDENTIFIERS =
            Set.of(
                    "identifier",
                    "field_identifier",
                    "type_identifier",
                    "primitive_type",
                    "shorthand_field_identifier");

    private static final Set<String> PATHS =
            Set.of("identifier", "self", "super", "crate", "scoped_identifier");

    private static final Set<String> TYPE_PATHS =
            Set.of(
                    "type_identifier",
                    "primitive_type",
                    "scoped_type_identifier",
                    "bracketed_type",
                    "qualified_type");

    private static final Set<String> COMMENTS = Set.of("line_comment", "block_comment");

    /** Where a run of items or statements appears, which decides how macro calls are wrapped. */
    private enum Context {
        ITEMS,
        STATEMENTS
    }

    private final String source;
    private final int windowStart;
    private final int windowEnd;
    private final int[] charIndex;
    private final TSTree tsTree;
    private final TSNode tsRoot;
    private final List<Token> toks = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();

    /**
     * @param source The text handed to tree-sitter.
     * @param windowStart Offset in the source of the text the tree is built for.
     * @param windowEnd Offset one past the end of that text.
     */
    private TreeSitterParser(String source, int windowStart, int windowEnd) {
        this.source = source;
        this.windowStart = windowStart;
        this.windowEnd = windowEnd;
        this.charIndex = charIndex(source);
        TSParser parser = new TSParser();
        parser.setLanguage(RUST);
        this.tsTree = parser.parseString(null, source);
        this.tsRoot = tsTree.getRootNode();
        collectTokens(tsRoot);
        markJoints();
        if (tsRoot.hasError()) {
            collectErrors(tsRoot);
        }
    }

    /**
     * Parse a complete source file. Syntax errors are logged and recovered from.
     *
     * @param text The source text.
     * @return A tree rooted in a {@link SyntaxKind#SOURCE_FILE} node.
     */
    public static SyntaxTree parseSourceFile(String text) {
        TreeSitterParser parser = new TreeSitterParser(text, 0, text.length());
        List<SyntaxNode> items = parser.sequence(parser.tsRoot, Context.ITEMS);
        SyntaxNode root = new SyntaxNode(SyntaxKind.SOURCE_FILE, 0, parser.toks.size() - 1, items);
        if (!parser.errors.isEmpty()) {
            LOGGER.warn(() -> "Recovered from syntax errors: " + parser.errors);
        }
        return new SyntaxTree(text, parser.toks, root);
    }

    /** Parse text that must consist of exactly one expression. */
    public static SyntaxNode parseExpr(String text) {
        return parseFragment(
                text, "expression", EXPR_PREFIX, p -> p.lower(p.wrappedPart("value")));
    }

    /** Parse text that must consist of exactly one item, attributes included. */
    public static SyntaxNode parseItem(String text) {
        return parseFragment(
                text,
                "item",
                "",
                p -> {
                    List<SyntaxNode> items = p.sequence(p.tsRoot, Context.ITEMS);
                    return items.size() == 1 ? items.get(0) : null;
                });
    }

    /** Parse text that must consist of exactly one type. */
    public static SyntaxNode parseType(String text) {
        return parseFragment(text, "type", TYPE_PREFIX, p -> p.lower(p.wrappedPart("type")));
    }

    /**
     * Parse a sequence of statements. The statements are wrapped in a block, so the returned
     * {@link SyntaxKind#STMT_LIST} node's text includes the surrounding braces.
     */
    public static SyntaxNode parseStmtList(String statements) {
        SyntaxNode block =
                parseFragment(
                        "{\n" + statements + "\n}",
                        "statement list",
                        EXPR_PREFIX,
                        p -> {
                            TSNode value = p.wrappedPart("value");
                            return value != null && value.getType().equals("block")
                                    ? p.block(value)
                                    : null;
                        });
        return RustAst.stmtList(block);
    }

    private static SyntaxNode parseFragment(
            String text, String what, String prefix, Function<TreeSitterParser, SyntaxNode> rule) {
        String suffix = prefix.isEmpty() ? "" : FRAGMENT_SUFFIX;
        TreeSitterParser parser =
                new TreeSitterParser(
                        prefix + text + suffix, prefix.length(), prefix.length() + text.length());
        if (parser.toks.isEmpty()) {
            throw new SyntaxException("Expected " + what + " but got empty text");
        }
        if (!parser.errors.isEmpty()) {
            throw new SyntaxException(
                    "Failed to parse " + what + " from `" + text + "`: " + parser.errors);
        }
        SyntaxNode node = rule.apply(parser);
        if (node == null
                || node.getFirstTokenIndex() != 0
                || node.getLastTokenIndex() != parser.toks.size() - 1) {
            throw new SyntaxException(
                    "Failed to parse " + what + " from `" + text + "`: not a single " + what);
        }
        new SyntaxTree(text, parser.toks, node);
        return node;
    }

    /** @return The named field of the single item a fragment was wrapped in. */
    private TSNode wrappedPart(String fieldName) {
        List<TSNode> items = namedChildren(tsRoot);
        return items.isEmpty() ? null : field(items.get(0), fieldName);
    }

    // ------------------------------------------------------------------ offsets and tokens

    /** Map every UTF-8 byte offset of the text to the index of the char it belongs to. */
    private static int[] charIndex(String text) {
        byte[] utf8 = text.getBytes(StandardCharsets.UTF_8);
        int[] index = new int[utf8.length + 1];
        int b = 0;
        int c = 0;
        while (c < text.length()) {
            int cp = text.codePointAt(c);
            // an unpaired surrogate is encoded as a single '?'
            boolean unpaired = cp >= Character.MIN_SURROGATE && cp <= Character.MAX_SURROGATE;
            int width = unpaired ? 1 : utf8Length(cp);
            for (int k = 0; k < width && b + k < utf8.length; k++) {
                index[b + k] = c;
            }
            b += width;
            c += Character.charCount(cp);
        }
        index[utf8.length] = text.length();
        return index;
    }

    private static int utf8Length(int cp) {
        if (cp < 0x80) {
            return 1;
        }
        if (cp < 0x800) {
            return 2;
        }
        return cp < 0x10000 ? 3 : 4;
    }

    private int charOf(int byteOffset) {
        if (byteOffset <= 0) {
            return 0;
        }
        return byteOffset >= charIndex.length ? source.length() : charIndex[byteOffset];
    }

    private void collectTokens(TSNode n) {
        String type = n.getType();
        if (COMMENTS.contains(type)) {
            return;
        }
        TokenKind atomic = atomicKind(n, type);
        if (atomic != null) {
            addToken(atomic, charOf(n.getStartByte()), charOf(n.getEndByte()));
            return;
        }
        int count = n.getChildCount();
        if (count == 0) {
            splitLeaf(charOf(n.getStartByte()), charOf(n.getEndByte()));
            return;
        }
        for (int i = 0; i < count; i++) {
            collectTokens(n.getChild(i));
        }
    }

    /** @return The kind of a node that becomes one token as a whole, or null to descend. */
    private TokenKind atomicKind(TSNode n, String type) {
        String text;
        switch (type) {
            case "integer_literal":
                return TokenKind.INT_NUMBER;
            case "float_literal":
                return TokenKind.FLOAT_NUMBER;
            case "char_literal":
                return textOf(n).startsWith("b") ? TokenKind.BYTE : TokenKind.CHAR;
            case "string_literal":
                text = textOf(n);
                if (text.startsWith("b")) {
                    return TokenKind.BYTE_STRING;
                }
                return text.startsWith("c") ? TokenKind.C_STRING : TokenKind.STRING;
            case "raw_string_literal":
                text = textOf(n);
                if (text.startsWith("br")) {
                    return TokenKind.RAW_BYTE_STRING;
                }
                return text.startsWith("cr") ? TokenKind.C_STRING : TokenKind.RAW_STRING;
            case "lifetime":
            case "label":
                return TokenKind.LIFETIME;
            default:
                return n.isNamed() && IDENTIFIERS.contains(type) ? TokenKind.IDENT : null;
        }
    }

    /**
     * Split the text of a leaf into tokens: words stay whole, punctuation is one token per
     * character. Leaves such as {@code macro_rules!} or {@code $x} thus become two tokens.
     */
    private void splitLeaf(int start, int end) {
        int i = start;
        while (i < end) {
            char c = source.charAt(i);
            int tokenStart = i;
            TokenKind kind;
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            } else if (c == '_' || Character.isLetter(c)) {
                while (i < end && isWordChar(source.charAt(i))) i++;
                kind = TokenKind.IDENT;
            } else if (Character.isDigit(c)) {
                while (i < end && isWordChar(source.charAt(i))) i++;
                kind = TokenKind.INT_NUMBER;
            } else {
                i++;
                kind = c < 0x80 ? TokenKind.PUNCT : TokenKind.UNKNOWN;
            }
            addToken(kind, tokenStart, i);
        }
    }

    private static boolean isWordChar(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }

    private void addToken(TokenKind kind, int start, int end) {
        if (start < windowStart || end > windowEnd || start == end) {
            return;
        }
        toks.add(new Token(kind, source.substring(start, end), start - windowStart));
    }

    private void markJoints() {
        for (int i = 0; i + 1 < toks.size(); i++) {
            Token cur = toks.get(i);
            Token nxt = toks.get(i + 1);
            cur.setJoint(
                    cur.getKind() == TokenKind.PUNCT
                            && nxt.getKind() == TokenKind.PUNCT
                            && cur.getEnd() == nxt.getStart());
        }
    }

    private String textOf(TSNode n) {
        return source.substring(charOf(n.getStartByte()), charOf(n.getEndByte()));
    }

    /** @return Index of the first token at or after the offset, relative to the window. */
    private int tokenAtOrAfter(int offset) {
        int lo = 0;
        int hi = toks.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (toks.get(mid).getStart() < offset) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    private int firstToken(TSNode n) {
        return tokenAtOrAfter(charOf(n.getStartByte()) - windowStart);
    }

    private int lastToken(TSNode n) {
        return tokenAtOrAfter(charOf(n.getEndByte()) - windowStart) - 1;
    }

    // ------------------------------------------------------------------ errors

    private void collectErrors(TSNode n) {
        if (n.isMissing()) {
            errors.add(lineCol(n) + ": missing `" + n.getType() + "`");
        } else if (n.isError()) {
            String text = textOf(n).trim();
            String near = text.length() > 20 ? text.substring(0, 20) + "..." : text;
            errors.add(lineCol(n) + ": unexpected `" + near + "`");
        } else if (n.hasError()) {
            for (int i = 0; i < n.getChildCount(); i++) {
                collectErrors(n.getChild(i));
            }
        }
    }

    private String lineCol(TSNode n) {
        int offset = Math.min(charOf(n.getStartByte()), windowEnd);
        int line = 1;
        int col = 1;
        for (int i = windowStart; i < offset; i++) {
            if (source.charAt(i) == '\n') {
                line++;
                col = 1;
            } else {
                col++;
            }
        }
        return line + ":" + col;
    }

    // ------------------------------------------------------------------ tree helpers

    private static TSNode field(TSNode n, String name) {
        if (n == null) {
            return null;
        }
        TSNode child = n.getChildByFieldName(name);
        return child == null || child.isNull() ? null : child;
    }

    /** @return The named children of a node, comments excluded. */
    private static List<TSNode> namedChildren(TSNode n) {
        if (n == null) {
            return Collections.emptyList();
        }
        List<TSNode> children = new ArrayList<>();
        for (int i = 0; i < n.getNamedChildCount(); i++) {
            TSNode child = n.getNamedChild(i);
            if (!child.isExtra()) {
                children.add(child);
            }
        }
        return children;
    }

    /** @return The first direct child of the given type, named or anonymous. */
    private static TSNode childOfType(TSNode n, String type) {
        if (n == null) {
            return null;
        }
        for (int i = 0; i < n.getChildCount(); i++) {
            TSNode child = n.getChild(i);
            if (child.getType().equals(type)) {
                return child;
            }
        }
        return null;
    }

    private SyntaxNode node(SyntaxKind kind, TSNode n, List<SyntaxNode> children) {
        return span(kind, n, n, children);
    }

    private SyntaxNode node(SyntaxKind kind, TSNode n, SyntaxNode... children) {
        List<SyntaxNode> list = new ArrayList<>();
        for (SyntaxNode child : children) {
            if (child != null) {
                list.add(child);
            }
        }
        return node(kind, n, list);
    }

    /** @return A node covering the tokens from the start of one node to the end of another. */
    private SyntaxNode span(SyntaxKind kind, TSNode from, TSNode to, List<SyntaxNode> children) {
        return new SyntaxNode(kind, firstToken(from), lastToken(to), children);
    }

    private SyntaxNode optional(SyntaxKind kind, TSNode n) {
        return n == null ? null : node(kind, n);
    }

    private static SyntaxNode withAttrs(List<SyntaxNode> attrs, SyntaxNode node) {
        if (attrs.isEmpty()) {
            return node;
        }
        List<SyntaxNode> children = new ArrayList<>(attrs);
        children.addAll(node.getChildren());
        return new SyntaxNode(
                node.getKind(),
                attrs.get(0).getFirstTokenIndex(),
                node.getLastTokenIndex(),
                children);
    }

    /** Lower the named children of a node, attaching attributes to the child that follows. */
    private List<SyntaxNode> lowerAll(TSNode n, Function<TSNode, SyntaxNode> lowering) {
        List<SyntaxNode> out = new ArrayList<>();
        List<SyntaxNode> attrs = new ArrayList<>();
        for (TSNode child : namedChildren(n)) {
            if (child.getType().equals("attribute_item")) {
                attrs.add(attr(child));
            } else if (!child.getType().equals("label")) {
                out.add(withAttrs(attrs, lowering.apply(child)));
                attrs.clear();
            }
        }
        out.addAll(attrs);
        return out;
    }

    private SyntaxNode lowerFirst(TSNode n) {
        List<TSNode> children = namedChildren(n);
        for (TSNode child : children) {
            if (!child.getType().equals("label")) {
                return lower(child);
            }
        }
        return null;
    }

    // ------------------------------------------------------------------ items and statements

    private List<SyntaxNode> sequence(TSNode container, Context context) {
        List<SyntaxNode> out = new ArrayList<>();
        List<SyntaxNode> attrs = new ArrayList<>();
        for (TSNode child : namedChildren(container)) {
            String type = child.getType();
            if (type.equals("attribute_item")) {
                attrs.add(attr(child));
            } else if (type.equals("inner_attribute_item")) {
                out.add(attr(child));
            } else if (type.equals("empty_statement")) {
                absorbSemicolon(out, child);
            } else if (!type.equals("label")) {
                SyntaxNode lowered = context == Context.ITEMS ? item(child) : statement(child);
                out.add(withAttrs(attrs, lowered));
                attrs.clear();
            }
        }
        out.addAll(attrs);
        return out;
    }

    /** A {@code ;} right after a macro call ends that call's item or statement. */
    private void absorbSemicolon(List<SyntaxNode> out, TSNode semicolon) {
        if (out.isEmpty()) {
            return;
        }
        int last = out.size() - 1;
        SyntaxNode prev = out.get(last);
        boolean macro =
                prev.is(SyntaxKind.MACRO_CALL)
                        || prev.is(SyntaxKind.EXPR_STMT)
                                && RustAst.stmtExpr(prev).is(SyntaxKind.MACRO_CALL);
        int semi = firstToken(semicolon);
        if (macro && !prev.lastToken().isPunct(';') && prev.getLastTokenIndex() + 1 == semi) {
            out.set(
                    last,
                    new SyntaxNode(
                            prev.getKind(), prev.getFirstTokenIndex(), semi, prev.getChildren()));
        }
    }

    private SyntaxNode item(TSNode n) {
        if (n.getType().equals("expression_statement")) {
            List<TSNode> parts = namedChildren(n);
            if (parts.size() == 1 && parts.get(0).getType().equals("macro_invocation")) {
                SyntaxNode call = macroCall(parts.get(0));
                return node(SyntaxKind.MACRO_CALL, n, call.getChildren());
            }
        }
        return statement(n);
    }

    private SyntaxNode statement(TSNode n) {
        String type = n.getType();
        switch (type) {
            case "expression_statement":
                return node(SyntaxKind.EXPR_STMT, n, lowerFirst(n));
            case "let_declaration":
                return letStmt(n);
            case "macro_invocation":
                return node(SyntaxKind.EXPR_STMT, n, macroCall(n));
            default:
                if (ITEMS.contains(type) || n.isError()) {
                    return lower(n);
                }
                // the tail expression of a block
                return node(SyntaxKind.EXPR_STMT, n, lower(n));
        }
    }

    private SyntaxNode attr(TSNode n) {
        TSNode open = childOfType(n, "[");
        TSNode close = childOfType(n, "]");
        SyntaxNode tt =
                open != null && close != null
                        ? span(SyntaxKind.TOKEN_TREE, open, close, Collections.emptyList())
                        : null;
        return node(SyntaxKind.ATTR, n, tt);
    }

    private SyntaxNode visibility(TSNode n) {
        return optional(SyntaxKind.VISIBILITY, childOfType(n, "visibility_modifier"));
    }

    private SyntaxNode name(TSNode n) {
        return optional(SyntaxKind.NAME, n);
    }

    private SyntaxNode abi(TSNode externModifier) {
        return optional(SyntaxKind.ABI, externModifier);
    }

    private SyntaxNode fn(TSNode n) {
        List<SyntaxNode> children = new ArrayList<>();
        TSNode modifiers = childOfType(n, "function_modifiers");
        addIfPresent(children, visibility(n));
        addIfPresent(children, abi(childOfType(modifiers, "extern_modifier")));
        addIfPresent(children, name(field(n, "name")));
        addIfPresent(
                children, optional(SyntaxKind.GENERIC_PARAMS, field(n, "type_parameters")));
        addIfPresent(children, paramList(field(n, "parameters"), false));
        addIfPresent(children, retType(n));
        addIfPresent(children, optional(SyntaxKind.WHERE_CLAUSE, childOfType(n, "where_clause")));
        addIfPresent(children, block(field(n, "body")));
        return node(SyntaxKind.FN, n, children);
    }

    private static void addIfPresent(List<SyntaxNode> children, SyntaxNode child) {
        if (child != null) {
            children.add(child);
        }
    }

    private SyntaxNode paramList(TSNode params, boolean closure) {
        if (params == null) {
            return null;
        }
        return node(SyntaxKind.PARAM_LIST, params, lowerAll(params, p -> param(p, closure)));
    }

    private SyntaxNode param(TSNode p, boolean closure) {
        switch (p.getType()) {
            case "parameter":
                return node(
                        SyntaxKind.PARAM, p, pat(field(p, "pattern")), lower(field(p, "type")));
            case "variadic_parameter":
                return node(SyntaxKind.PARAM, p, pat(field(p, "pattern")));
            case "self_parameter":
                return node(SyntaxKind.PARAM, p);
            default:
                // a bare pattern in a closure, a bare type in a function pointer type
                return node(SyntaxKind.PARAM, p, closure ? pat(p) : lower(p));
        }
    }

    /** @return The {@code -> T} part of a function, function type or closure. */
    private SyntaxNode retType(TSNode n) {
        TSNode type = field(n, "return_type");
        if (type == null) {
            return null;
        }
        TSNode arrow = childOfType(n, "->");
        List<SyntaxNode> children = new ArrayList<>();
        children.add(lower(type));
        return span(SyntaxKind.RET_TYPE, arrow != null ? arrow : type, type, children);
    }

    private SyntaxNode pat(TSNode n) {
        return optional(SyntaxKind.PAT, n);
    }

    private SyntaxNode itemList(SyntaxKind kind, TSNode body) {
        return body == null ? null : node(kind, body, sequence(body, Context.ITEMS));
    }

    private SyntaxNode macroRules(TSNode n) {
        TSNode open = null;
        TSNode close = null;
        for (int i = 0; i < n.getChildCount(); i++) {
            String type = n.getChild(i).getType();
            if (open == null && (type.equals("{") || type.equals("(") || type.equals("["))) {
                open = n.getChild(i);
            } else if (type.equals("}") || type.equals(")") || type.equals("]")) {
                close = n.getChild(i);
            }
        }
        SyntaxNode tt =
                open != null && close != null
                        ? span(SyntaxKind.TOKEN_TREE, open, close, Collections.emptyList())
                        : null;
        return node(SyntaxKind.MACRO_RULES, n, name(field(n, "name")), tt);
    }

    private SyntaxNode macroCall(TSNode n) {
        return node(
                SyntaxKind.MACRO_CALL,
                n,
                optional(SyntaxKind.PATH, field(n, "macro")),
                optional(SyntaxKind.TOKEN_TREE, childOfType(n, "token_tree")));
    }

    private SyntaxNode letStmt(TSNode n) {
        return node(
                SyntaxKind.LET_STMT,
                n,
                pat(field(n, "pattern")),
                lower(field(n, "type")),
                lower(field(n, "value")),
                lower(field(n, "alternative")));
    }

    // ------------------------------------------------------------------ expressions and types

    /** Lower a block, or a block behind {@code unsafe}, {@code async} or {@code const}. */
    private SyntaxNode block(TSNode n) {
        if (n == null) {
            return null;
        }
        TSNode body = n.getType().equals("block") ? n : childOfType(n, "block");
        if (body == null) {
            return node(SyntaxKind.BLOCK_EXPR, n);
        }
        TSNode open = childOfType(body, "{");
        SyntaxNode stmts =
                span(
                        SyntaxKind.STMT_LIST,
                        open != null ? open : body,
                        body,
                        sequence(body, Context.STATEMENTS));
        return node(
                SyntaxKind.BLOCK_EXPR,
                n,
                optional(SyntaxKind.LABEL, childOfType(body, "label")),
                stmts);
    }

    private SyntaxNode ifExpr(TSNode n) {
        SyntaxNode otherwise = null;
        TSNode alternative = field(n, "alternative");
        if (alternative != null) {
            otherwise = lowerFirst(alternative);
        }
        return node(
                SyntaxKind.IF_EXPR,
                n,
                lower(field(n, "condition")),
                block(field(n, "consequence")),
                otherwise);
    }

    private SyntaxNode callExpr(TSNode n) {
        TSNode callee = field(n, "function");
        TSNode typeArgs = null;
        SyntaxNode args = optionalList(SyntaxKind.ARG_LIST, field(n, "arguments"));
        if (callee != null && callee.getType().equals("generic_function")) {
            TSNode inner = field(callee, "function");
            if (inner != null && inner.getType().equals("field_expression")) {
                typeArgs = field(callee, "type_arguments");
                callee = inner;
            }
        }
        if (callee != null && callee.getType().equals("field_expression")) {
            return node(
                    SyntaxKind.METHOD_CALL_EXPR,
                    n,
                    lower(field(callee, "value")),
                    name(field(callee, "field")),
                    optional(SyntaxKind.GENERIC_ARG_LIST, typeArgs),
                    args);
        }
        return node(SyntaxKind.CALL_EXPR, n, lower(callee), args);
    }

    private SyntaxNode optionalList(SyntaxKind kind, TSNode n) {
        return n == null ? null : node(kind, n, lowerAll(n, this::lower));
    }

    private SyntaxNode matchArm(TSNode arm) {
        List<SyntaxNode> children = new ArrayList<>();
        for (TSNode child : namedChildren(arm)) {
            if (child.getType().equals("attribute_item")) {
                children.add(attr(child));
            }
        }
        TSNode pattern = field(arm, "pattern");
        if (pattern != null && pattern.getChildCount() > 0) {
            children.add(node(SyntaxKind.PAT, pattern.getChild(0)));
            TSNode guard = field(pattern, "condition");
            if (guard != null) {
                TSNode keyword = childOfType(pattern, "if");
                List<SyntaxNode> condition = new ArrayList<>();
                condition.add(lower(guard));
                children.add(
                        span(
                                SyntaxKind.MATCH_GUARD,
                                keyword != null ? keyword : guard,
                                guard,
                                condition));
            }
        }
        addIfPresent(children, lower(field(arm, "value")));
        return node(SyntaxKind.MATCH_ARM, arm, children);
    }

    private SyntaxNode recordField(TSNode f) {
        switch (f.getType()) {
            case "field_initializer":
                return node(
                        SyntaxKind.RECORD_EXPR_FIELD,
                        f,
                        name(field(f, "field")),
                        lower(field(f, "value")));
            case "shorthand_field_initializer":
                List<TSNode> parts = namedChildren(f);
                return node(
                        SyntaxKind.RECORD_EXPR_FIELD,
                        f,
                        parts.isEmpty() ? null : name(parts.get(parts.size() - 1)));
            default:
                return node(SyntaxKind.RECORD_EXPR_FIELD, f, lowerFirst(f));
        }
    }

    private SyntaxNode pathType(TSNode n, TSNode typeArgs) {
        return node(
                SyntaxKind.PATH_TYPE,
                n,
                node(SyntaxKind.PATH, n, optional(SyntaxKind.GENERIC_ARG_LIST, typeArgs)));
    }

    private SyntaxNode lower(TSNode n) {
        if (n == null) {
            return null;
        }
        String type = n.getType();
        if (n.isError()) {
            return node(SyntaxKind.ERROR, n);
        }
        if (LITERALS.contains(type)) {
            return node(SyntaxKind.LITERAL, n);
        }
        if (BLOCKS.contains(type)) {
            return block(n);
        }
        if (PATHS.contains(type)) {
            return node(SyntaxKind.PATH_EXPR, n, node(SyntaxKind.PATH, n));
        }
        if (TYPE_PATHS.contains(type)) {
            return pathType(n, null);
        }
        switch (type) {
            // items
            case "function_item":
            case "function_signature_item":
                return fn(n);
            case "static_item":
            case "const_item":
                return node(
                        type.equals("static_item") ? SyntaxKind.STATIC : SyntaxKind.CONST,
                        n,
                        visibility(n),
                        name(field(n, "name")),
                        lower(field(n, "type")),
                        lower(field(n, "value")));
            case "type_item":
            case "associated_type":
                return node(
                        SyntaxKind.TYPE_ALIAS,
                        n,
                        visibility(n),
                        name(field(n, "name")),
                        optional(SyntaxKind.GENERIC_PARAMS, field(n, "type_parameters")),
                        lower(field(n, "type")));
            case "struct_item":
            case "union_item":
            case "enum_item":
                SyntaxKind adt =
                        type.equals("struct_item")
                                ? SyntaxKind.STRUCT
                                : type.equals("union_item") ? SyntaxKind.UNION : SyntaxKind.ENUM;
                return node(
                        adt,
                        n,
                        visibility(n),
                        name(field(n, "name")),
                        optional(SyntaxKind.GENERIC_PARAMS, field(n, "type_parameters")),
                        optional(SyntaxKind.WHERE_CLAUSE, childOfType(n, "where_clause")),
                        optional(SyntaxKind.FIELD_LIST, field(n, "body")));
            case "foreign_mod_item":
                return node(
                        SyntaxKind.EXTERN_BLOCK,
                        n,
                        visibility(n),
                        abi(childOfType(n, "extern_modifier")),
                        itemList(SyntaxKind.EXTERN_ITEM_LIST, field(n, "body")));
            case "extern_crate_declaration":
                return node(
                        SyntaxKind.EXTERN_CRATE,
                        n,
                        visibility(n),
                        name(field(n, "name")),
                        name(field(n, "alias")));
            case "use_declaration":
                return node(SyntaxKind.USE, n, visibility(n));
            case "mod_item":
                return node(
                        SyntaxKind.MODULE,
                        n,
                        visibility(n),
                        name(field(n, "name")),
                        itemList(SyntaxKind.ITEM_LIST, field(n, "body")));
            case "impl_item":
                return node(SyntaxKind.IMPL, n, itemList(SyntaxKind.ITEM_LIST, field(n, "body")));
            case "trait_item":
                return node(
                        SyntaxKind.TRAIT,
                        n,
                        visibility(n),
                        name(field(n, "name")),
                        itemList(SyntaxKind.ITEM_LIST, field(n, "body")));
            case "macro_definition":
                return macroRules(n);
            case "macro_invocation":
                return macroCall(n);
            case "attribute_item":
            case "inner_attribute_item":
                return attr(n);
            case "let_declaration":
                return letStmt(n);
            case "expression_statement":
                return statement(n);

            // expressions
            case "if_expression":
                return ifExpr(n);
            case "let_condition":
                return node(
                        SyntaxKind.LET_EXPR, n, pat(field(n, "pattern")), lower(field(n, "value")));
            case "let_chain":
            case "binary_expression":
            case "assignment_expression":
            case "compound_assignment_expr":
                return node(SyntaxKind.BIN_EXPR, n, lowerAll(n, this::lower));
            case "while_expression":
                return node(
                        SyntaxKind.WHILE_EXPR,
                        n,
                        optional(SyntaxKind.LABEL, childOfType(n, "label")),
                        lower(field(n, "condition")),
                        block(field(n, "body")));
            case "loop_expression":
                return node(
                        SyntaxKind.LOOP_EXPR,
                        n,
                        optional(SyntaxKind.LABEL, childOfType(n, "label")),
                        block(field(n, "body")));
            case "for_expression":
                return node(
                        SyntaxKind.FOR_EXPR,
                        n,
                        optional(SyntaxKind.LABEL, childOfType(n, "label")),
                        pat(field(n, "pattern")),
                        lower(field(n, "value")),
                        block(field(n, "body")));
            case "match_expression":
                TSNode arms = field(n, "body");
                return node(
                        SyntaxKind.MATCH_EXPR,
                        n,
                        lower(field(n, "value")),
                        arms == null
                                ? null
                                : node(
                                        SyntaxKind.MATCH_ARM_LIST,
                                        arms,
                                        lowerAll(arms, this::matchArm)));
            case "return_expression":
                return node(SyntaxKind.RETURN_EXPR, n, lowerFirst(n));
            case "break_expression":
                return node(SyntaxKind.BREAK_EXPR, n, lowerFirst(n));
            case "continue_expression":
                return node(SyntaxKind.CONTINUE_EXPR, n);
            case "unary_expression":
                return node(SyntaxKind.PREFIX_EXPR, n, lowerFirst(n));
            case "reference_expression":
                return node(SyntaxKind.REF_EXPR, n, lower(field(n, "value")));
            case "parenthesized_expression":
                return node(SyntaxKind.PAREN_EXPR, n, lowerFirst(n));
            case "tuple_expression":
            case "unit_expression":
                return node(SyntaxKind.TUPLE_EXPR, n, lowerAll(n, this::lower));
            case "array_expression":
                return node(SyntaxKind.ARRAY_EXPR, n, lowerAll(n, this::lower));
            case "call_expression":
                return callExpr(n);
            case "field_expression":
                return node(
                        SyntaxKind.FIELD_EXPR,
                        n,
                        lower(field(n, "value")),
                        name(field(n, "field")));
            case "index_expression":
                return node(SyntaxKind.INDEX_EXPR, n, lowerAll(n, this::lower));
            case "try_expression":
                return node(SyntaxKind.TRY_EXPR, n, lowerFirst(n));
            case "type_cast_expression":
                return node(
                        SyntaxKind.CAST_EXPR, n, lower(field(n, "value")), lower(field(n, "type")));
            case "range_expression":
                return node(SyntaxKind.RANGE_EXPR, n, lowerAll(n, this::lower));
            case "struct_expression":
                TSNode fields = field(n, "body");
                return node(
                        SyntaxKind.RECORD_EXPR,
                        n,
                        optional(SyntaxKind.PATH, field(n, "name")),
                        fields == null
                                ? null
                                : node(
                                        SyntaxKind.RECORD_EXPR_FIELD_LIST,
                                        fields,
                                        lowerAll(fields, this::recordField)));
            case "closure_expression":
                return node(
                        SyntaxKind.CLOSURE_EXPR,
                        n,
                        paramList(field(n, "parameters"), true),
                        retType(n),
                        lower(field(n, "body")));
            case "generic_function":
                return node(
                        SyntaxKind.PATH_EXPR,
                        n,
                        node(
                                SyntaxKind.PATH,
                                n,
                                optional(SyntaxKind.GENERIC_ARG_LIST, field(n, "type_arguments"))));
            case "metavariable":
                return node(SyntaxKind.META_VAR, n);
            case "_":
                return node(SyntaxKind.UNDERSCORE_EXPR, n);

            // types
            case "pointer_type":
                return node(SyntaxKind.PTR_TYPE, n, lower(field(n, "type")));
            case "reference_type":
                return node(SyntaxKind.REF_TYPE, n, lower(field(n, "type")));
            case "array_type":
                TSNode length = field(n, "length");
                return node(
                        length == null ? SyntaxKind.SLICE_TYPE : SyntaxKind.ARRAY_TYPE,
                        n,
                        lower(field(n, "element")),
                        lower(length));
            case "tuple_type":
            case "unit_type":
                return node(SyntaxKind.TUPLE_TYPE, n, lowerAll(n, this::lower));
            case "function_type":
                return node(
                        SyntaxKind.FN_PTR_TYPE,
                        n,
                        abi(childOfType(childOfType(n, "function_modifiers"), "extern_modifier")),
                        paramList(field(n, "parameters"), false),
                        retType(n));
            case "never_type":
                return node(SyntaxKind.NEVER_TYPE, n);
            case "generic_type":
                return pathType(n, field(n, "type_arguments"));
            case "abstract_type":
            case "dynamic_type":
            case "bounded_type":
                return node(SyntaxKind.DYN_TRAIT_TYPE, n);
            default:
                LOGGER.debug(() -> "No lowering for `" + type + "`, keeping it opaque");
                return node(SyntaxKind.ERROR, n);
        }
    }
}
