package se.kth.hayroll.macro;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import se.kth.hayroll.exception.ExtractionException;
import se.kth.hayroll.seed.HayrollSeed;
import se.kth.hayroll.util.LazyLogger;

/** Builds invocations from seeds by binding every argument seed to its call site. */
public class InvocationExtractor {
    private static final LazyLogger LOGGER = new LazyLogger(InvocationExtractor.class);

    /**
     * Invocation seeds that are not arguments become call sites. An argument seed is bound to
     * the most recently created call site whose {@code locBegin} equals the argument's {@code
     * locRefBegin}.
     *
     * @throws ExtractionException if an argument has no call site or names an undeclared slot.
     */
    public static List<MacroInvocation> extract(List<HayrollSeed> seeds) {
        List<MacroInvocation> invocations = new ArrayList<>();
        Map<String, MacroInvocation> openByLoc = new HashMap<>();
        for (HayrollSeed seed : seeds) {
            if (!seed.isInvocation()) {
                continue;
            }
            if (!seed.isArg()) {
                MacroInvocation invocation = new MacroInvocation(seed);
                invocations.add(invocation);
                openByLoc.put(seed.locBegin(), invocation);
            } else {
                MacroInvocation owner = openByLoc.get(seed.locRefBegin());
                if (owner == null) {
                    throw new ExtractionException(
                            "No invocation at " + seed.locRefBegin() + " for argument "
                                    + seed.name() + " at " + seed.hayrollTag());
                }
                owner.addArgOccurrence(seed);
            }
        }
        LOGGER.debug(() -> "Found " + invocations.size() + " macro invocations");
        return invocations;
    }
}
