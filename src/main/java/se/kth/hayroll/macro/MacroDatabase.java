package se.kth.hayroll.macro;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import se.kth.hayroll.util.Pair;

/** Clusters of invocations keyed by the declaring macro's location and the cluster signature. */
public class MacroDatabase {
    private final Map<Pair<String, String>, MacroCluster> clusters = new LinkedHashMap<>();

    public static MacroDatabase fromInvocations(List<MacroInvocation> invocations) {
        MacroDatabase db = new MacroDatabase();
        for (MacroInvocation invocation : invocations) {
            String signature = invocation.clusterSignature();
            db.clusters
                    .computeIfAbsent(
                            Pair.of(invocation.locRefBegin(), signature),
                            k -> new MacroCluster(signature))
                    .add(invocation);
        }
        return db;
    }

    /** @return The clusters in the order their first invocation was seen. */
    public List<MacroCluster> getClusters() {
        return new ArrayList<>(clusters.values());
    }

    public MacroCluster get(String locRefBegin, String signature) {
        return clusters.get(Pair.of(locRefBegin, signature));
    }

    public int size() {
        return clusters.size();
    }
}
