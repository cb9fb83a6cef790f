package se.kth.hayroll.macro;

import java.util.ArrayList;
import java.util.List;
import se.kth.hayroll.pipeline.Diagnostic;
import se.kth.hayroll.pipeline.Diagnostics;
import se.kth.hayroll.pipeline.EditPlan;
import se.kth.hayroll.seed.CodeRegion;
import se.kth.hayroll.seed.HayrollSeed;
import se.kth.hayroll.seed.Substitution;
import se.kth.hayroll.syntax.SyntaxNode;
import se.kth.hayroll.util.LazyLogger;

/**
 * Turns a cluster of invocations into a definition and rewrites every call site to use it.
 *
 * <p>A cluster that is type compatible and carries the function hint becomes an {@code unsafe
 * fn} appended to the declaring file. A cluster that is only structurally compatible becomes a
 * single-arm {@code macro_rules!} placed at the top of the declaring file. Anything else is left
 * instrumented and reported.
 */
public class MacroSynthesizer {
    private static final LazyLogger LOGGER = new LazyLogger(MacroSynthesizer.class);

    private final Diagnostics diagnostics;

    public MacroSynthesizer(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    /** The kind of definition a cluster is turned into. */
    public enum Strategy {
        FUNCTION,
        TEMPLATE,
        SKIP
    }

    public Strategy strategyFor(MacroCluster cluster) {
        if (cluster.canBeFn()) {
            return Strategy.FUNCTION;
        }
        if (!cluster.invsInternallyStructurallyCompatible()) {
            return Strategy.SKIP;
        }
        boolean declArgs =
                cluster.getInvocations().stream()
                        .flatMap(i -> i.getArgs().values().stream())
                        .flatMap(List::stream)
                        .anyMatch(s -> s.getShape() == CodeRegion.Shape.DECLS);
        return declArgs ? Strategy.SKIP : Strategy.TEMPLATE;
    }

    /**
     * Plan the definition and the call-site rewrites of a whole cluster.
     *
     * @return The strategy that was applied.
     */
    public Strategy plan(MacroCluster cluster, EditPlan plan) {
        Strategy strategy = strategyFor(cluster);
        if (planDefinition(cluster, cluster.first(), strategy, plan)) {
            List<Boolean> lvalues = cluster.argsRequireLvalue();
            for (MacroInvocation inv : cluster.getInvocations()) {
                planCallSite(cluster, inv, strategy, lvalues, plan);
            }
        }
        return strategy;
    }

    /**
     * Plan the definition of a cluster: a function appended to the declaring file or a template
     * at its top. A skipped cluster is reported instead.
     *
     * @param reference The invocation whose body becomes the body of the definition.
     * @return false if the cluster is skipped.
     */
    public boolean planDefinition(
            MacroCluster cluster, MacroInvocation reference, Strategy strategy, EditPlan plan) {
        switch (strategy) {
            case FUNCTION:
                LOGGER.debug(() -> "Synthesizing function " + cluster.getName());
                plan.insertAtBottom(cluster.file(), functionDefinition(cluster, reference));
                return true;
            case TEMPLATE:
                LOGGER.debug(() -> "Synthesizing template " + cluster.getName());
                plan.insertAtTop(cluster.file(), templateDefinition(cluster, reference));
                return true;
            default:
                diagnostics.report(
                        Diagnostic.Kind.INCOMPATIBLE_CLUSTER,
                        cluster.locBegin(),
                        "macro " + cluster.name()
                                + " cannot be converted: incompatible argument usage; skipping");
                return false;
        }
    }

    /**
     * Plan the rewrite of one call site. Declaration call sites are relocated: their
     * declarations and the tag item are deleted and the template call is appended to the file.
     *
     * @param lvalues Which arguments the synthesized function takes by pointer.
     */
    public void planCallSite(
            MacroCluster cluster,
            MacroInvocation inv,
            Strategy strategy,
            List<Boolean> lvalues,
            EditPlan plan) {
        HayrollSeed seed = inv.getSeed();
        if (strategy == Strategy.FUNCTION) {
            plan.replace(inv.file(), seed.rawRegion(true), functionCall(cluster, inv, lvalues));
        } else if (seed instanceof HayrollSeed.Decls) {
            HayrollSeed.Decls decls = (HayrollSeed.Decls) seed;
            for (SyntaxNode item : decls.rawRegion(true).flattenToList()) {
                plan.delete(inv.file(), item);
            }
            plan.delete(inv.file(), decls.declsTagItem());
            plan.insertAtBottom(inv.file(), templateCall(cluster, inv));
        } else {
            plan.replace(inv.file(), seed.rawRegion(true), templateCall(cluster, inv));
        }
    }

    /** @return The text of the function synthesized from the cluster's first invocation. */
    public String functionDefinition(MacroCluster cluster) {
        return functionDefinition(cluster, cluster.first());
    }

    private String functionDefinition(MacroCluster cluster, MacroInvocation inv) {
        List<Boolean> lvalues = cluster.argsRequireLvalue();
        List<String> params = new ArrayList<>();
        List<String> argNames = inv.getArgNames();
        for (int i = 0; i < argNames.size(); i++) {
            List<HayrollSeed> occurrences = inv.occurrences(i);
            if (occurrences.isEmpty()) {
                reportUnused(cluster, argNames.get(i));
                continue;
            }
            HayrollSeed first = occurrences.get(0);
            SyntaxNode type =
                    (lvalues.get(i) ? first.ptrOrBaseType() : first.baseType())
                            .orElseThrow(() -> new IllegalStateException("no type for " + first));
            params.add(argNames.get(i) + ": " + type.getText());
        }
        String returnType =
                inv.getSeed().ptrOrBaseType().map(t -> " -> " + t.getText()).orElse("");

        List<Substitution> substitutions = new ArrayList<>();
        for (int i = 0; i < argNames.size(); i++) {
            for (HayrollSeed occurrence : inv.occurrences(i)) {
                substitutions.add(
                        Substitution.of(occurrence.rawRegion(!lvalues.get(i)), occurrence.name()));
            }
        }
        String body = inv.getSeed().rawRegion(false).peelTag(substitutions);
        return "unsafe fn " + cluster.getName() + "(" + String.join(", ", params) + ")"
                + returnType + " {\n    " + body + "\n}";
    }

    /**
     * @return A call of the synthesized function. Lvalue invocations dereference the returned
     *     pointer; statement invocations end with a semicolon.
     */
    public String functionCall(MacroCluster cluster, MacroInvocation inv, List<Boolean> lvalues) {
        List<String> args = new ArrayList<>();
        List<String> argNames = inv.getArgNames();
        for (int i = 0; i < argNames.size(); i++) {
            List<HayrollSeed> occurrences = inv.occurrences(i);
            if (occurrences.isEmpty()) {
                reportUnused(cluster, argNames.get(i));
                continue;
            }
            args.add(occurrences.get(0).rawRegion(!lvalues.get(i)).peelTag());
        }
        String call = cluster.getName() + "(" + String.join(", ", args) + ")";
        if (inv.getSeed().getShape() != CodeRegion.Shape.EXPR) {
            return call + ";";
        }
        return inv.isLvalue() ? "*" + call : call;
    }

    /** @return The text of the template synthesized from the cluster's first invocation. */
    public String templateDefinition(MacroCluster cluster) {
        return templateDefinition(cluster, cluster.first());
    }

    private String templateDefinition(MacroCluster cluster, MacroInvocation inv) {
        List<String> matchers = new ArrayList<>();
        List<Substitution> substitutions = new ArrayList<>();
        List<String> argNames = inv.getArgNames();
        for (int i = 0; i < argNames.size(); i++) {
            List<HayrollSeed> occurrences = inv.occurrences(i);
            if (occurrences.isEmpty()) {
                reportUnused(cluster, argNames.get(i));
                continue;
            }
            boolean stmt = occurrences.get(0).getShape() == CodeRegion.Shape.STMTS;
            matchers.add("$" + argNames.get(i) + (stmt ? ":stmt" : ":expr"));
            for (HayrollSeed occurrence : occurrences) {
                String ref = "$" + occurrence.name();
                boolean stmtOccurrence = occurrence.getShape() == CodeRegion.Shape.STMTS;
                substitutions.add(
                        Substitution.of(
                                occurrence.rawRegion(true), stmtOccurrence ? ref + ";" : ref));
            }
        }
        HayrollSeed seed = inv.getSeed();
        String body =
                seed instanceof HayrollSeed.Decls
                        ? ((HayrollSeed.Decls) seed).rawRegion(true).toTemplateBody()
                        : seed.rawRegion(true).peelTag(substitutions);
        return "macro_rules! " + cluster.getName() + "\n{\n    (" + String.join(", ", matchers)
                + ") => {\n    " + body + "\n    }\n}";
    }

    /** @return An invocation of the synthesized template, passing the peeled arguments. */
    public String templateCall(MacroCluster cluster, MacroInvocation inv) {
        List<String> args = new ArrayList<>();
        List<String> argNames = inv.getArgNames();
        for (int i = 0; i < argNames.size(); i++) {
            List<HayrollSeed> occurrences = inv.occurrences(i);
            if (occurrences.isEmpty()) {
                reportUnused(cluster, argNames.get(i));
                continue;
            }
            args.add(templateArgument(occurrences.get(0)));
        }
        String call = cluster.getName() + "!(" + String.join(", ", args) + ")";
        return inv.getSeed().getShape() == CodeRegion.Shape.EXPR ? call : call + ";";
    }

    private static String templateArgument(HayrollSeed occurrence) {
        if (!(occurrence instanceof HayrollSeed.Stmts)) {
            return occurrence.rawRegion(true).peelTag();
        }
        CodeRegion.Stmts region = ((HayrollSeed.Stmts) occurrence).rawRegion(true);
        String peeled = region.peelTag().trim();
        int count = region.inner().flattenToList().size();
        if (count == 1) {
            return peeled.endsWith(";") ? peeled.substring(0, peeled.length() - 1).trim() : peeled;
        }
        // a statement matcher takes exactly one statement, so several become a block
        return "{ " + peeled + " }";
    }

    private void reportUnused(MacroCluster cluster, String argName) {
        diagnostics.report(
                Diagnostic.Kind.UNUSED_ARGUMENT,
                cluster.locBegin(),
                "argument " + argName + " of macro " + cluster.name()
                        + " is never used; omitting it");
    }
}
