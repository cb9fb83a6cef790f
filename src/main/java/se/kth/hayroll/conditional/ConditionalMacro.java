package se.kth.hayroll.conditional;

import java.util.ArrayList;
import java.util.List;
import se.kth.hayroll.exception.ExtractionException;
import se.kth.hayroll.exception.MalformedTagException;
import se.kth.hayroll.seed.CodeRegion;
import se.kth.hayroll.seed.HayrollSeed;
import se.kth.hayroll.syntax.RustAst;
import se.kth.hayroll.syntax.SyntaxKind;
import se.kth.hayroll.syntax.SyntaxNode;
import se.kth.hayroll.tag.HayrollMeta;
import se.kth.hayroll.tag.HayrollTag;

/** One branch of a preprocessor conditional, recovered from a conditional seed. */
public class ConditionalMacro implements HayrollMeta {
    private final HayrollSeed seed;

    public ConditionalMacro(HayrollSeed seed) {
        this.seed = seed;
    }

    @Override
    public HayrollTag hayrollTag() {
        return seed.hayrollTag();
    }

    public HayrollSeed getSeed() {
        return seed;
    }

    /** @return The premise, which a conditional seed must carry. */
    public String requirePremise() {
        String premise = premise();
        if (premise.trim().isEmpty()) {
            throw new MalformedTagException("Conditional tag " + hayrollTag() + " has no premise");
        }
        return premise;
    }

    /** @return The gate attached to statements and declarations. */
    public String cfgAttr() {
        return "#[cfg(" + requirePremise() + ")]";
    }

    /** @return The guard of an expression branch. */
    public SyntaxNode guard() {
        return ((HayrollSeed.Expr) seed).guard();
    }

    /**
     * @return true if the then-branch of the guard already is a {@code cfg!} choice, i.e. the
     *     branch was reconstructed by an earlier run.
     */
    public boolean isReconstructed() {
        SyntaxNode then = RustAst.thenBranch(guard());
        List<SyntaxNode> statements = RustAst.statements(RustAst.stmtList(then));
        if (statements.size() != 1 || !statements.get(0).is(SyntaxKind.EXPR_STMT)) {
            return false;
        }
        SyntaxNode inner = RustAst.stmtExpr(statements.get(0));
        if (!inner.is(SyntaxKind.IF_EXPR)) {
            return false;
        }
        SyntaxNode condition = RustAst.ifCondition(inner);
        return condition.is(SyntaxKind.MACRO_CALL)
                && condition.firstToken().isIdent("cfg");
    }

    /**
     * @return The configuration-gated choice that replaces the then-branch of the guard: the
     *     live branch when the premise holds and the fallback branch otherwise.
     */
    public String cfgChoice() {
        SyntaxNode guard = guard();
        SyntaxNode then = RustAst.thenBranch(guard);
        SyntaxNode fallback =
                RustAst.elseBranch(guard)
                        .orElseThrow(
                                () -> new ExtractionException(
                                        "Conditional guard of " + hayrollTag()
                                                + " has no else branch"));
        return "{ if cfg!(" + requirePremise() + ") " + then.getText() + " else "
                + fallback.getText() + " }";
    }

    /**
     * @return The statements or declarations that receive the gate. Statements that are
     *     themselves tag scaffolding are left out.
     */
    public List<SyntaxNode> gatedNodes() {
        List<SyntaxNode> nodes = new ArrayList<>();
        if (seed.getShape() == CodeRegion.Shape.DECLS) {
            nodes.addAll(seed.rawRegion(false).flattenToList());
        } else if (seed.getShape() == CodeRegion.Shape.STMTS) {
            for (SyntaxNode statement : seed.innerRegion().flattenToList()) {
                if (statement.is(SyntaxKind.EXPR_STMT) && HayrollTag.containsTag(statement)) {
                    continue;
                }
                nodes.add(statement);
            }
        }
        return nodes;
    }

    @Override
    public String toString() {
        return "cfg(" + premise() + ")@" + seed;
    }
}
