package se.kth.hayroll.pipeline;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import se.kth.hayroll.macro.InvocationExtractor;
import se.kth.hayroll.macro.MacroCluster;
import se.kth.hayroll.macro.MacroDatabase;
import se.kth.hayroll.macro.MacroInvocation;
import se.kth.hayroll.macro.MacroSynthesizer;
import se.kth.hayroll.macro.MacroSynthesizer.Strategy;
import se.kth.hayroll.seed.CodeRegion;
import se.kth.hayroll.seed.HayrollSeed;
import se.kth.hayroll.seed.SeedExtractor;
import se.kth.hayroll.util.LazyLogger;
import se.kth.hayroll.util.Pair;

/**
 * Extracts invocations, clusters them and replaces every compatible cluster by a synthesized
 * definition.
 *
 * <p>Nested invocations are rewritten innermost first. The pass runs in rounds; in each round a
 * call site is rewritten only if it contains no call site that is still pending. A cluster's
 * strategy and calling convention are decided once, from all of its invocations, the first time
 * any of them is ready, so call sites rewritten in later rounds agree with the definition.
 */
public class InvocationPass {
    private static final LazyLogger LOGGER = new LazyLogger(InvocationPass.class);
    static final int MAX_ROUNDS = 64;

    private final Diagnostics diagnostics;
    private final MacroSynthesizer synthesizer;

    private static class Decision {
        final Strategy strategy;
        final List<Boolean> lvalues;

        Decision(Strategy strategy, List<Boolean> lvalues) {
            this.strategy = strategy;
            this.lvalues = lvalues;
        }
    }

    public InvocationPass(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
        this.synthesizer = new MacroSynthesizer(diagnostics);
    }

    /** @return The number of call sites that were rewritten. */
    public int run(Workspace workspace) {
        Map<Pair<String, String>, Decision> decisions = new HashMap<>();
        int rewritten = 0;
        for (int round = 0; round < MAX_ROUNDS; round++) {
            List<HayrollSeed> seeds =
                    SeedExtractor.extract(workspace.getTrees()).requireMatched();
            MacroDatabase db = MacroDatabase.fromInvocations(InvocationExtractor.extract(seeds));
            List<MacroCluster> pending =
                    db.getClusters().stream()
                            .filter(c -> !isSkipped(decisions.get(key(c))))
                            .collect(Collectors.toList());
            if (pending.isEmpty()) {
                break;
            }
            int currentRound = round;
            LOGGER.info(
                    () -> "Round " + currentRound + ": " + pending.size() + " pending clusters");

            List<MacroInvocation> roots =
                    pending.stream()
                            .flatMap(c -> c.getInvocations().stream())
                            .collect(Collectors.toList());
            EditPlan plan = new EditPlan(workspace);
            int planned = 0;
            for (MacroCluster cluster : pending) {
                List<MacroInvocation> ready = new ArrayList<>();
                boolean blocked = false;
                for (MacroInvocation inv : cluster.getInvocations()) {
                    List<MacroInvocation> nested = nestedRoots(inv, roots);
                    if (nested.isEmpty()) {
                        ready.add(inv);
                    } else if (!cluster.getInvocations().containsAll(nested)) {
                        blocked = true;
                    }
                }
                if (blocked || ready.isEmpty()) {
                    LOGGER.debug(() -> "Deferring " + cluster.getName() + " to a later round");
                    continue;
                }
                Decision decision = decisions.get(key(cluster));
                if (decision == null) {
                    decision =
                            new Decision(
                                    synthesizer.strategyFor(cluster), cluster.argsRequireLvalue());
                    decisions.put(key(cluster), decision);
                    if (!synthesizer.planDefinition(
                            cluster, ready.get(0), decision.strategy, plan)) {
                        planned++;
                        continue;
                    }
                }
                for (MacroInvocation inv : ready) {
                    synthesizer.planCallSite(
                            cluster, inv, decision.strategy, decision.lvalues, plan);
                }
                planned += ready.size();
                rewritten += ready.size();
            }
            if (planned == 0) {
                for (MacroCluster cluster : pending) {
                    diagnostics.report(
                            Diagnostic.Kind.UNRESOLVED_NESTING,
                            cluster.locBegin(),
                            "call sites of macro " + cluster.name()
                                    + " could not be ordered; leaving them instrumented");
                }
                break;
            }
            plan.apply();
        }
        return rewritten;
    }

    private static boolean isSkipped(Decision decision) {
        return decision != null && decision.strategy == Strategy.SKIP;
    }

    private static Pair<String, String> key(MacroCluster cluster) {
        return Pair.of(cluster.locRefBegin(), cluster.getSignature());
    }

    /** @return The pending invocations nested inside the call site of the given one. */
    private static List<MacroInvocation> nestedRoots(
            MacroInvocation inv, List<MacroInvocation> roots) {
        CodeRegion region = inv.getSeed().rawRegion(true);
        return roots.stream()
                .filter(other -> other != inv && other.file().equals(inv.file()))
                .filter(other -> region.contains(other.hayrollTag().getLiteral()))
                .collect(Collectors.toList());
    }
}
