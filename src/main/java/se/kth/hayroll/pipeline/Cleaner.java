package se.kth.hayroll.pipeline;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import se.kth.hayroll.seed.HayrollSeed;
import se.kth.hayroll.seed.SeedExtractor;
import se.kth.hayroll.syntax.RustAst;
import se.kth.hayroll.syntax.SyntaxKind;
import se.kth.hayroll.syntax.SyntaxNode;
import se.kth.hayroll.syntax.SyntaxTree;
import se.kth.hayroll.util.LazyLogger;

/**
 * Removes the scaffolding that is left after reconstruction: expression guards are collapsed to
 * their live branch, tag statements and tag items are deleted and location attributes are
 * stripped.
 */
public class Cleaner {
    private static final LazyLogger LOGGER = new LazyLogger(Cleaner.class);

    /** @return The number of removed seeds and attributes. */
    public static int clean(Workspace workspace) {
        int removed = 0;
        for (int round = 0; round < InvocationPass.MAX_ROUNDS; round++) {
            int peeled = peelExpressions(workspace);
            if (peeled == 0) {
                break;
            }
            removed += peeled;
        }
        removed += deleteTags(workspace);
        removed += stripLocationAttrs(workspace);
        return removed;
    }

    /** Collapse expression guards that contain no other expression guard. */
    private static int peelExpressions(Workspace workspace) {
        List<HayrollSeed.Expr> exprs =
                SeedExtractor.extract(workspace.getTrees()).getSeeds().stream()
                        .filter(s -> s instanceof HayrollSeed.Expr)
                        .map(s -> (HayrollSeed.Expr) s)
                        .collect(Collectors.toList());
        EditPlan plan = new EditPlan(workspace);
        int planned = 0;
        for (HayrollSeed.Expr seed : exprs) {
            SyntaxNode region = seed.rawRegion(true).getNode();
            boolean innermost =
                    exprs.stream().noneMatch(o -> o != seed && region.contains(o.guard()));
            if (innermost) {
                plan.replace(seed.file(), seed.rawRegion(true), seed.rawRegion(true).peelTag());
                planned++;
            }
        }
        plan.apply();
        int peeled = planned;
        LOGGER.debug(() -> "Peeled " + peeled + " expression seeds");
        return peeled;
    }

    /** Delete the tag statements of statement seeds and the tag items of declaration seeds. */
    private static int deleteTags(Workspace workspace) {
        Map<SyntaxNode, Path> doomed = new LinkedHashMap<>();
        for (HayrollSeed seed : SeedExtractor.extract(workspace.getTrees()).getSeeds()) {
            if (seed instanceof HayrollSeed.Stmts) {
                HayrollSeed.Stmts stmts = (HayrollSeed.Stmts) seed;
                doomed.put(stmts.beginStatement(), seed.file());
                doomed.put(stmts.endStatement(), seed.file());
            } else if (seed instanceof HayrollSeed.Decls) {
                doomed.put(((HayrollSeed.Decls) seed).declsTagItem(), seed.file());
            }
        }
        EditPlan plan = new EditPlan(workspace);
        doomed.forEach((node, file) -> plan.delete(file, node));
        plan.apply();
        LOGGER.debug(() -> "Deleted " + doomed.size() + " tag statements and items");
        return doomed.size();
    }

    /** Delete every {@code #[c2rust::src_loc]} attribute. */
    static int stripLocationAttrs(Workspace workspace) {
        EditPlan plan = new EditPlan(workspace);
        int stripped = 0;
        for (Map.Entry<Path, SyntaxTree> entry : workspace.getTrees().entrySet()) {
            List<SyntaxNode> attrs =
                    entry.getValue().getRoot().descendants()
                            .filter(n -> n.is(SyntaxKind.ATTR))
                            .filter(RustAst::isSrcLocAttr)
                            .collect(Collectors.toList());
            for (SyntaxNode attr : attrs) {
                plan.delete(entry.getKey(), attr);
            }
            stripped += attrs.size();
        }
        plan.apply();
        return stripped;
    }
}
