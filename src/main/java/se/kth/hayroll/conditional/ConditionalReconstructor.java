package se.kth.hayroll.conditional;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import se.kth.hayroll.pipeline.EditPlan;
import se.kth.hayroll.pipeline.Workspace;
import se.kth.hayroll.seed.CodeRegion;
import se.kth.hayroll.seed.HayrollSeed;
import se.kth.hayroll.seed.SeedExtractor;
import se.kth.hayroll.syntax.RustAst;
import se.kth.hayroll.syntax.SyntaxEditor;
import se.kth.hayroll.syntax.SyntaxKind;
import se.kth.hayroll.syntax.SyntaxNode;
import se.kth.hayroll.syntax.TreeSitterParser;
import se.kth.hayroll.util.LazyLogger;

/**
 * Re-introduces configuration gates for the conditional seeds of a workspace.
 *
 * <p>Expression branches are rewritten into {@code cfg!} choices, innermost first, one round per
 * nesting level. Statements and declarations then receive {@code #[cfg(..)]} attributes in a
 * single transaction; gates are accumulated per node so that a node covered by several branches
 * is rewritten once.
 */
public class ConditionalReconstructor {
    private static final LazyLogger LOGGER = new LazyLogger(ConditionalReconstructor.class);
    private static final int MAX_ROUNDS = 64;

    // expressions that cannot carry an attribute without parentheses
    private static final Set<SyntaxKind> NEEDS_PARENS =
            EnumSet.of(SyntaxKind.BIN_EXPR, SyntaxKind.CAST_EXPR, SyntaxKind.RANGE_EXPR);

    /**
     * Reconstruct every non-placeholder conditional seed.
     *
     * @return The number of gates that were introduced.
     */
    public static int reconstruct(Workspace workspace) {
        int gates = 0;
        for (int round = 0; round < MAX_ROUNDS; round++) {
            int planned = planExpressionRound(workspace);
            if (planned == 0) {
                break;
            }
            gates += planned;
        }
        return gates + planAttributes(workspace);
    }

    /** @return The conditional branches of the current workspace snapshot that need work. */
    static List<ConditionalMacro> conditionals(Workspace workspace) {
        return SeedExtractor.extract(workspace.getTrees()).requireMatched().stream()
                .filter(HayrollSeed::isConditional)
                // placeholders of every shape are skipped, declaration placeholders included
                .filter(s -> !s.isPlaceholder())
                .map(ConditionalMacro::new)
                .collect(Collectors.toList());
    }

    private static int planExpressionRound(Workspace workspace) {
        List<ConditionalMacro> pending =
                conditionals(workspace).stream()
                        .filter(c -> c.getSeed().getShape() == CodeRegion.Shape.EXPR)
                        .filter(c -> !c.isReconstructed())
                        .collect(Collectors.toList());
        EditPlan plan = new EditPlan(workspace);
        int planned = 0;
        for (ConditionalMacro conditional : pending) {
            SyntaxNode then = RustAst.thenBranch(conditional.guard());
            boolean hasInner =
                    pending.stream()
                            .anyMatch(o -> o != conditional && then.contains(o.guard()));
            if (hasInner) {
                continue;
            }
            LOGGER.debug(() -> "Gating expression " + conditional);
            plan.replace(conditional.file(), then, conditional.cfgChoice());
            planned++;
        }
        plan.apply();
        return planned;
    }

    private static int planAttributes(Workspace workspace) {
        Map<SyntaxNode, Set<String>> gates = new LinkedHashMap<>();
        Map<SyntaxNode, Path> files = new LinkedHashMap<>();
        for (ConditionalMacro conditional : conditionals(workspace)) {
            if (conditional.getSeed().getShape() == CodeRegion.Shape.EXPR) {
                continue;
            }
            for (SyntaxNode node : conditional.gatedNodes()) {
                gates.computeIfAbsent(node, n -> new LinkedHashSet<>()).add(conditional.cfgAttr());
                files.put(node, conditional.file());
            }
        }
        EditPlan plan = new EditPlan(workspace);
        int planned = 0;
        for (Map.Entry<SyntaxNode, Set<String>> entry : gates.entrySet()) {
            planned += planGates(plan, files.get(entry.getKey()), entry.getKey(), entry.getValue());
        }
        plan.apply();
        return planned;
    }

    private static int planGates(EditPlan plan, Path file, SyntaxNode node, Set<String> attrs) {
        Set<String> existing =
                RustAst.attrs(node).stream()
                        .map(RustAst::normalizedText)
                        .collect(Collectors.toSet());
        List<String> missing = new ArrayList<>();
        for (String attr : attrs) {
            if (!existing.contains(normalize(attr))) {
                missing.add(attr);
            }
        }
        if (missing.isEmpty()) {
            return 0;
        }
        String text = node.getTree().getText();
        String separator =
                SyntaxEditor.isAtLineStart(text, node.getStart())
                        ? "\n" + SyntaxEditor.lineIndent(text, node.getStart())
                        : " ";
        plan.insertBefore(file, node, String.join(separator, missing) + separator);
        if (node.is(SyntaxKind.EXPR_STMT)) {
            SyntaxNode expr = RustAst.stmtExpr(node);
            if (NEEDS_PARENS.contains(expr.getKind())) {
                plan.insertBefore(file, expr, "(");
                plan.insertAfter(file, expr, ")");
            }
        }
        return missing.size();
    }

    private static String normalize(String attr) {
        SyntaxNode item = TreeSitterParser.parseItem(attr + " fn gated() {}");
        return RustAst.normalizedText(RustAst.attrs(item).get(0));
    }
}
