package se.kth.hayroll.macro;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import se.kth.hayroll.tag.HayrollMeta;
import se.kth.hayroll.tag.HayrollTag;

/**
 * Invocations believed to be call sites of the same macro under the same argument types. The
 * first invocation is the reference every other invocation is compared against.
 */
public class MacroCluster implements HayrollMeta {
    private final String signature;
    private final List<MacroInvocation> invocations = new ArrayList<>();

    MacroCluster(String signature) {
        this.signature = signature;
    }

    void add(MacroInvocation invocation) {
        invocations.add(invocation);
    }

    public List<MacroInvocation> getInvocations() {
        return Collections.unmodifiableList(invocations);
    }

    public MacroInvocation first() {
        return invocations.get(0);
    }

    @Override
    public HayrollTag hayrollTag() {
        return first().hayrollTag();
    }

    public String getSignature() {
        return signature;
    }

    /** @return The name shared by the synthesized definition and all call sites. */
    public String getName() {
        return first().withSignature(signature);
    }

    public boolean invsInternallyStructurallyCompatible() {
        return invocations.stream().allMatch(i -> i.isStructurallyCompatibleWith(first()));
    }

    public boolean invsInternallyTypeCompatible() {
        return invocations.stream().allMatch(i -> i.isTypeCompatibleWith(first()));
    }

    /**
     * @return true if the cluster is type compatible, every invocation carries the translator's
     *     function hint and nothing in the cluster is shaped like a declaration or statement
     *     argument.
     */
    @Override
    public boolean canBeFn() {
        return invsInternallyTypeCompatible()
                && invocations.stream().allMatch(i -> i.canBeFn() && i.hasFnShape());
    }

    /** @return Per argument, true if every invocation needs the argument as an lvalue. */
    public List<Boolean> argsRequireLvalue() {
        List<Boolean> result = new ArrayList<>(first().argsRequireLvalue());
        for (MacroInvocation invocation : invocations) {
            List<Boolean> own = invocation.argsRequireLvalue();
            for (int i = 0; i < result.size() && i < own.size(); i++) {
                result.set(i, result.get(i) && own.get(i));
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return getName() + invocations;
    }
}
