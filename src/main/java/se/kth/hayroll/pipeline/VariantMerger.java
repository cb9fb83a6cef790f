package se.kth.hayroll.pipeline;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import se.kth.hayroll.seed.CodeRegion;
import se.kth.hayroll.seed.HayrollSeed;
import se.kth.hayroll.seed.SeedExtractor;
import se.kth.hayroll.syntax.RustAst;
import se.kth.hayroll.syntax.SyntaxEditor;
import se.kth.hayroll.syntax.SyntaxKind;
import se.kth.hayroll.syntax.SyntaxNode;
import se.kth.hayroll.syntax.SyntaxTree;
import se.kth.hayroll.util.LazyLogger;

/**
 * Merges a patch workspace, translated under one configuration, into a base workspace translated
 * under another. Conditional branches are paired by the location of the directive they stem
 * from; the result keeps every live branch of both variants so that conditional reconstruction
 * can gate them afterwards.
 *
 * <p>Merging is idempotent: a variant that was merged before is recorded in the base tag's
 * {@code mergedVariants} list, and top-level declarations are only copied when no declaration
 * with the same key exists.
 */
public class VariantMerger {
    private static final LazyLogger LOGGER = new LazyLogger(VariantMerger.class);

    private final Diagnostics diagnostics;

    public VariantMerger(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Merge {@code patch} into {@code base}. Only {@code base} is modified.
     *
     * @return The number of merged branches and declarations.
     */
    public int merge(Workspace base, Workspace patch, boolean stripSrcLoc) {
        EditPlan plan = new EditPlan(base);
        int merged = mergeConditionals(base, patch, plan);
        merged += mergeDeclarations(base, patch, plan);
        plan.apply();
        if (stripSrcLoc) {
            Cleaner.stripLocationAttrs(base);
        }
        int total = merged;
        LOGGER.info(() -> "Merged " + total + " branches and declarations into " + base.getRoot());
        return total;
    }

    private int mergeConditionals(Workspace base, Workspace patch, EditPlan plan) {
        Map<String, HayrollSeed> baseByDirective = new LinkedHashMap<>();
        for (HayrollSeed seed : conditionals(base)) {
            baseByDirective.putIfAbsent(seed.locRefBegin(), seed);
        }
        Map<String, HayrollSeed> patchByDirective = new LinkedHashMap<>();
        for (HayrollSeed seed : conditionals(patch)) {
            patchByDirective.putIfAbsent(seed.locRefBegin(), seed);
        }

        int merged = 0;
        for (HayrollSeed baseSeed : baseByDirective.values()) {
            HayrollSeed patchSeed = patchByDirective.get(baseSeed.locRefBegin());
            if (patchSeed == null) {
                continue;
            }
            if (baseSeed.getShape() != patchSeed.getShape()) {
                diagnostics.report(
                        Diagnostic.Kind.UNSUPPORTED_SHAPE,
                        baseSeed.hayrollTag().toString(),
                        "base branch is " + baseSeed.getShape() + " but patch branch is "
                                + patchSeed.getShape());
                continue;
            }
            if (mergePair(baseSeed, patchSeed, plan)) {
                merged++;
            }
        }
        return merged;
    }

    private static List<HayrollSeed> conditionals(Workspace workspace) {
        return SeedExtractor.extract(workspace.getTrees()).requireMatched().stream()
                .filter(HayrollSeed::isConditional)
                .collect(Collectors.toList());
    }

    private boolean mergePair(HayrollSeed baseSeed, HayrollSeed patchSeed, EditPlan plan) {
        boolean basePlaceholder = baseSeed.isPlaceholder();
        boolean patchPlaceholder = patchSeed.isPlaceholder();
        if (patchPlaceholder) {
            // nothing live on the patch side
            return false;
        }
        if (baseSeed.getShape() == CodeRegion.Shape.DECLS) {
            // declarations are merged item by item
            return false;
        }
        String variant = patchSeed.locBegin();
        if (variant.equals(baseSeed.locBegin()) || baseSeed.mergedVariants().contains(variant)) {
            LOGGER.debug(() -> "Variant " + variant + " is already part of " + baseSeed);
            return false;
        }
        if (basePlaceholder) {
            CodeRegion region = baseSeed.rawRegion(true);
            if (!reserve(plan, baseSeed, region.getStart(), region.getEnd())) {
                return false;
            }
            plan.replace(baseSeed.file(), region, patchSeed.rawRegion(true).getText());
            return true;
        }
        if (baseSeed instanceof HayrollSeed.Expr) {
            return appendArm((HayrollSeed.Expr) baseSeed, (HayrollSeed.Expr) patchSeed, plan);
        }
        return appendStatements((HayrollSeed.Stmts) baseSeed, (HayrollSeed.Stmts) patchSeed, plan);
    }

    /** Hang the patch guard off the last else of the base guard chain. */
    private boolean appendArm(
            HayrollSeed.Expr baseSeed, HayrollSeed.Expr patchSeed, EditPlan plan) {
        SyntaxNode last = baseSeed.guard();
        Optional<SyntaxNode> elseBranch = RustAst.elseBranch(last);
        while (elseBranch.isPresent() && elseBranch.get().is(SyntaxKind.IF_EXPR)) {
            last = elseBranch.get();
            elseBranch = RustAst.elseBranch(last);
        }
        if (!elseBranch.isPresent()) {
            diagnostics.report(
                    Diagnostic.Kind.UNSUPPORTED_SHAPE,
                    baseSeed.hayrollTag().toString(),
                    "expression guard has no fallback branch");
            return false;
        }
        SyntaxNode fallback = elseBranch.get();
        SyntaxNode literal = baseSeed.hayrollTag().getLiteral();
        if (!reserve(plan, baseSeed, fallback.getStart(), fallback.getEnd())
                || !reserve(plan, baseSeed, literal.getStart(), literal.getEnd())) {
            return false;
        }
        plan.replace(baseSeed.file(), fallback, patchSeed.rawRegion(false).getText());
        markMerged(baseSeed, patchSeed, plan);
        return true;
    }

    /** Place the patch span, tags included, right after the base span. */
    private boolean appendStatements(
            HayrollSeed.Stmts baseSeed, HayrollSeed.Stmts patchSeed, EditPlan plan) {
        SyntaxNode end = baseSeed.endStatement();
        SyntaxNode literal = baseSeed.hayrollTag().getLiteral();
        if (!reserve(plan, baseSeed, end.getEnd(), end.getEnd())
                || !reserve(plan, baseSeed, literal.getStart(), literal.getEnd())) {
            return false;
        }
        String indent = SyntaxEditor.lineIndent(end.getTree().getText(), end.getStart());
        plan.insertAfter(baseSeed.file(), end, "\n" + indent + patchSeed.rawRegion(true).getText());
        markMerged(baseSeed, patchSeed, plan);
        return true;
    }

    private static void markMerged(HayrollSeed baseSeed, HayrollSeed patchSeed, EditPlan plan) {
        plan.replace(
                baseSeed.file(),
                baseSeed.hayrollTag().getLiteral(),
                baseSeed.hayrollTag().withAppendedMergedVariant(patchSeed.locBegin()));
    }

    private boolean reserve(EditPlan plan, HayrollSeed seed, int start, int end) {
        if (plan.overlaps(seed.file(), start, end)) {
            diagnostics.report(
                    Diagnostic.Kind.SKIPPED_EDIT,
                    seed.hayrollTag().toString(),
                    "merge edit overlaps an edit planned for another branch");
            return false;
        }
        return true;
    }

    private int mergeDeclarations(Workspace base, Workspace patch, EditPlan plan) {
        int merged = 0;
        for (Path file : patch.getFiles()) {
            if (!base.getTrees().containsKey(file)) {
                LOGGER.info(() -> "Copying " + file + " from the patch workspace");
                base.create(file, patch.getText(file));
                merged++;
                continue;
            }
            merged += mergeDeclarations(file, base.getTree(file), patch.getTree(file), plan);
        }
        return merged;
    }

    private static int mergeDeclarations(
            Path file, SyntaxTree baseTree, SyntaxTree patchTree, EditPlan plan) {
        Set<String> baseKeys = new HashSet<>();
        Set<String> baseExternKeys = new HashSet<>();
        Map<String, SyntaxNode> baseExternBlocks = new LinkedHashMap<>();
        for (SyntaxNode item : topLevelItems(baseTree)) {
            if (item.is(SyntaxKind.EXTERN_BLOCK)) {
                String abi = RustAst.abi(item).orElse("C");
                baseExternBlocks.putIfAbsent(abi, item);
                RustAst.externItems(item).forEach(m -> baseExternKeys.add(declarationKey(m)));
            } else {
                baseKeys.add(declarationKey(item));
            }
        }

        int merged = 0;
        Map<String, List<String>> newExternMembers = new LinkedHashMap<>();
        for (SyntaxNode item : topLevelItems(patchTree)) {
            if (item.is(SyntaxKind.EXTERN_BLOCK)) {
                String abi = RustAst.abi(item).orElse("C");
                for (SyntaxNode member : RustAst.externItems(item)) {
                    if (baseExternKeys.add(declarationKey(member))) {
                        newExternMembers
                                .computeIfAbsent(abi, a -> new ArrayList<>())
                                .add(member.getText());
                        merged++;
                    }
                }
                continue;
            }
            if (!baseKeys.add(declarationKey(item))) {
                continue;
            }
            if (item.is(SyntaxKind.FN) || item.is(SyntaxKind.MACRO_RULES)) {
                plan.insertAtTop(file, item.getText());
            } else {
                plan.insertAtBottom(file, item.getText());
            }
            merged++;
        }

        for (Map.Entry<String, List<String>> entry : newExternMembers.entrySet()) {
            SyntaxNode block = baseExternBlocks.get(entry.getKey());
            if (block != null) {
                insertIntoExternBlock(file, block, entry.getValue(), plan);
            } else {
                String members =
                        entry.getValue().stream()
                                .map(m -> "    " + m)
                                .collect(Collectors.joining("\n"));
                plan.insertAtBottom(
                        file, "extern \"" + entry.getKey() + "\" {\n" + members + "\n}");
            }
        }
        return merged;
    }

    private static void insertIntoExternBlock(
            Path file, SyntaxNode block, List<String> members, EditPlan plan) {
        List<SyntaxNode> existing = RustAst.externItems(block);
        StringBuilder sb = new StringBuilder();
        for (String member : members) {
            sb.append("\n    ").append(member);
        }
        if (existing.isEmpty()) {
            SyntaxNode list =
                    block.firstChild(SyntaxKind.EXTERN_ITEM_LIST)
                            .orElseThrow(
                                    () -> new IllegalStateException("extern block without items"));
            plan.replaceRange(file, list.getStart() + 1, list.getEnd() - 1, sb + "\n");
        } else {
            plan.insertAfter(file, existing.get(existing.size() - 1), sb.toString());
        }
    }

    private static List<SyntaxNode> topLevelItems(SyntaxTree tree) {
        return tree.getRoot().getChildren().stream()
                .filter(c -> c.getKind().isItem())
                .collect(Collectors.toList());
    }

    /**
     * Identify a declaration across variants by its kind, its name (or its text if it has none)
     * and its attributes other than the location attribute.
     */
    static String declarationKey(SyntaxNode item) {
        String attrs =
                RustAst.attrs(item).stream()
                        .filter(a -> !RustAst.isSrcLocAttr(a))
                        .map(RustAst::normalizedText)
                        .sorted()
                        .collect(Collectors.joining(","));
        String identity =
                RustAst.name(item)
                        .orElseGet(
                                () -> RustAst.parts(item).stream()
                                        .map(RustAst::normalizedText)
                                        .collect(Collectors.joining(" ")));
        return item.getKind() + ":" + identity + "[" + attrs + "]";
    }
}
