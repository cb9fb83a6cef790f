package se.kth.hayroll.seed;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import se.kth.hayroll.exception.ExtractionException;
import se.kth.hayroll.syntax.RustAst;
import se.kth.hayroll.syntax.SyntaxKind;
import se.kth.hayroll.syntax.SyntaxNode;
import se.kth.hayroll.tag.HayrollMeta;
import se.kth.hayroll.tag.HayrollTag;

/**
 * A tagged region of instrumented code, recovered from one or two tags. The shape is closed:
 * every seed is exactly one of {@link Expr}, {@link Stmts} or {@link Decls}, which
 * {@link #getShape()} reports for exhaustive switching.
 */
public abstract class HayrollSeed implements HayrollMeta {
    private final HayrollTag tag;

    private HayrollSeed(HayrollTag tag) {
        this.tag = tag;
    }

    @Override
    public HayrollTag hayrollTag() {
        return tag;
    }

    public abstract CodeRegion.Shape getShape();

    /**
     * Locate the minimal construct that holds the seed, scaffolding included.
     *
     * @param withDeref For lvalue expressions, include the dereference wrapping the guard.
     */
    public abstract CodeRegion rawRegion(boolean withDeref);

    /** @return The region without the tag-bearing scaffold around it. */
    public abstract CodeRegion innerRegion();

    /**
     * @return For expressions, the pointer type in the guard's fallback branch if the seed is an
     *     lvalue and its pointee otherwise; empty for other shapes.
     */
    public Optional<SyntaxNode> ptrOrBaseType() {
        return Optional.empty();
    }

    /** @return For expressions, the value type; empty for other shapes. */
    public Optional<SyntaxNode> baseType() {
        return Optional.empty();
    }

    public boolean isStructurallyCompatibleWith(HayrollSeed other) {
        return getShape() == other.getShape();
    }

    /** Structural compatibility, plus identical value types for expressions. */
    public boolean isTypeCompatibleWith(HayrollSeed other) {
        if (!isStructurallyCompatibleWith(other)) {
            return false;
        }
        if (getShape() != CodeRegion.Shape.EXPR) {
            return true;
        }
        return baseTypeText().equals(other.baseTypeText());
    }

    /** @return The normalized text of {@link #baseType()}, or the empty string. */
    public String baseTypeText() {
        return baseType().map(RustAst::normalizedText).orElse("");
    }

    @Override
    public String toString() {
        return getShape() + "(" + tag + ")";
    }

    /** A single expression guarded by {@code if TAG {live} else {fallback}}. */
    public static final class Expr extends HayrollSeed {
        public Expr(HayrollTag tag) {
            super(tag);
        }

        @Override
        public CodeRegion.Shape getShape() {
            return CodeRegion.Shape.EXPR;
        }

        /** @return The guarding if expression, the closest one around the tag literal. */
        public SyntaxNode guard() {
            return hayrollTag()
                    .getLiteral()
                    .closest(SyntaxKind.IF_EXPR)
                    .orElseThrow(
                            () -> new ExtractionException(
                                    "Expression tag " + hayrollTag() + " is not inside an if"));
        }

        @Override
        public CodeRegion.Expr rawRegion(boolean withDeref) {
            SyntaxNode guard = guard();
            if (withDeref && isLvalue()) {
                SyntaxNode deref =
                        guard.closest(RustAst::isDeref)
                                .orElseThrow(
                                        () -> new ExtractionException(
                                                "Lvalue tag " + hayrollTag()
                                                        + " is not dereferenced"));
                return CodeRegion.expr(deref);
            }
            return CodeRegion.expr(guard);
        }

        @Override
        public CodeRegion.Expr innerRegion() {
            return CodeRegion.expr(RustAst.thenBranch(guard()));
        }

        @Override
        public Optional<SyntaxNode> ptrOrBaseType() {
            Optional<SyntaxNode> ptr =
                    RustAst.elseBranch(guard())
                            .flatMap(
                                    e -> e.descendants()
                                            .filter(n -> n.is(SyntaxKind.PTR_TYPE))
                                            .findFirst());
            if (!ptr.isPresent()) {
                throw new ExtractionException(
                        "No pointer type in the fallback branch of " + hayrollTag());
            }
            return isLvalue() ? ptr : ptr.map(RustAst::pointee);
        }

        @Override
        public Optional<SyntaxNode> baseType() {
            return ptrOrBaseType().map(t -> isLvalue() ? RustAst.pointee(t) : t);
        }
    }

    /**
     * A span of statements delimited by a begin and an end tag statement. A seed whose end tag
     * was never found pairs the begin tag with itself.
     */
    public static final class Stmts extends HayrollSeed {
        private final HayrollTag endTag;

        public Stmts(HayrollTag beginTag, HayrollTag endTag) {
            super(beginTag);
            this.endTag = endTag;
        }

        public HayrollTag getBeginTag() {
            return hayrollTag();
        }

        public HayrollTag getEndTag() {
            return endTag;
        }

        public boolean isMatched() {
            return endTag != hayrollTag();
        }

        @Override
        public CodeRegion.Shape getShape() {
            return CodeRegion.Shape.STMTS;
        }

        public SyntaxNode beginStatement() {
            return statementOf(getBeginTag());
        }

        public SyntaxNode endStatement() {
            return statementOf(endTag);
        }

        private static SyntaxNode statementOf(HayrollTag tag) {
            return RustAst.enclosingStatement(tag.getLiteral())
                    .orElseThrow(
                            () -> new ExtractionException(
                                    "Statement tag " + tag + " is not inside a statement list"));
        }

        @Override
        public CodeRegion.Stmts rawRegion(boolean withDeref) {
            SyntaxNode begin = beginStatement();
            SyntaxNode end = endStatement();
            SyntaxNode list = begin.getParent();
            if (end.getParent() != list) {
                throw new ExtractionException(
                        "Begin tag " + getBeginTag() + " and end tag " + endTag
                                + " are not in the same statement list");
            }
            List<SyntaxNode> statements = RustAst.statements(list);
            return CodeRegion.stmts(list, statements.indexOf(begin), statements.indexOf(end));
        }

        @Override
        public CodeRegion.Stmts innerRegion() {
            return rawRegion(false).inner();
        }
    }

    /**
     * Declarations identified by the compilation-unit range {@code [cuLnColBegin, cuLnColEnd]}
     * of the tag, matched against the {@code #[c2rust::src_loc]} attribute of every item.
     */
    public static final class Decls extends HayrollSeed {
        public Decls(HayrollTag tag) {
            super(tag);
        }

        @Override
        public CodeRegion.Shape getShape() {
            return CodeRegion.Shape.DECLS;
        }

        /** @return The item that carries the tag literal itself. */
        public SyntaxNode declsTagItem() {
            return RustAst.enclosingItem(hayrollTag().getLiteral())
                    .orElseThrow(
                            () -> new ExtractionException(
                                    "Declaration tag " + hayrollTag() + " is not inside an item"));
        }

        @Override
        public CodeRegion.Decls rawRegion(boolean withDeref) {
            LnCol begin = LnCol.parse(cuLnColBegin());
            LnCol end = LnCol.parse(cuLnColEnd());
            SyntaxNode tagItem = declsTagItem();
            SyntaxNode root = tagItem.getTree().getRoot();
            List<SyntaxNode> items =
                    root.descendants()
                            .filter(n -> n.getKind().isItem() && !n.is(SyntaxKind.MACRO_CALL))
                            .filter(n -> n != tagItem)
                            .filter(n -> srcLoc(n).map(l -> l.isWithin(begin, end)).orElse(false))
                            .collect(Collectors.toList());
            List<SyntaxNode> outermost = new ArrayList<>();
            for (SyntaxNode item : items) {
                boolean nested = items.stream().anyMatch(o -> o != item && o.contains(item));
                if (!nested) {
                    outermost.add(item);
                }
            }
            return CodeRegion.decls(outermost);
        }

        @Override
        public CodeRegion.Decls innerRegion() {
            return rawRegion(false);
        }

        private static Optional<LnCol> srcLoc(SyntaxNode item) {
            return RustAst.attrs(item).stream()
                    .filter(RustAst::isSrcLocAttr)
                    .findFirst()
                    .flatMap(RustAst::attrStringValue)
                    .map(LnCol::parse);
        }
    }
}
