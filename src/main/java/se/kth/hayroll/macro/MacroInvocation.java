package se.kth.hayroll.macro;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import se.kth.hayroll.exception.ExtractionException;
import se.kth.hayroll.seed.CodeRegion;
import se.kth.hayroll.seed.HayrollSeed;
import se.kth.hayroll.tag.HayrollMeta;
import se.kth.hayroll.tag.HayrollTag;

/**
 * A macro call site: the seed of the expansion together with the seeds of every argument
 * occurrence, grouped per declared argument in declaration order.
 */
public class MacroInvocation implements HayrollMeta {
    static final String STMT_MARKER = "stmt";
    static final String UNUSED_MARKER = "unused";

    private final HayrollSeed seed;
    private final Map<String, List<HayrollSeed>> args = new LinkedHashMap<>();

    public MacroInvocation(HayrollSeed seed) {
        this.seed = seed;
        for (String argName : seed.argNames()) {
            args.put(argName, new ArrayList<>());
        }
    }

    @Override
    public HayrollTag hayrollTag() {
        return seed.hayrollTag();
    }

    public HayrollSeed getSeed() {
        return seed;
    }

    /** @return Argument name to occurrences; an empty list means the argument is unused here. */
    public Map<String, List<HayrollSeed>> getArgs() {
        return Collections.unmodifiableMap(args);
    }

    public List<String> getArgNames() {
        return new ArrayList<>(args.keySet());
    }

    /** @return The occurrences of the argument at the given position. */
    public List<HayrollSeed> occurrences(int index) {
        return args.get(getArgNames().get(index));
    }

    void addArgOccurrence(HayrollSeed argSeed) {
        List<HayrollSeed> slot = args.get(argSeed.name());
        if (slot == null) {
            throw new ExtractionException(
                    "Argument '" + argSeed.name() + "' of " + argSeed.hayrollTag()
                            + " is not declared by invocation " + hayrollTag()
                            + " (declared: " + args.keySet() + ")");
        }
        slot.add(argSeed);
    }

    /**
     * The type-mangled signature used to tell instantiations of one macro apart: the value type
     * of an expression invocation followed by one part per argument, joined by underscores.
     * Declaration invocations have an empty signature.
     */
    public String signature() {
        if (seed.getShape() == CodeRegion.Shape.DECLS) {
            return "";
        }
        List<String> parts = new ArrayList<>();
        if (seed.getShape() == CodeRegion.Shape.EXPR) {
            parts.add(sanitize(seed.baseTypeText()));
        }
        for (List<HayrollSeed> occurrences : args.values()) {
            if (occurrences.isEmpty()) {
                parts.add(UNUSED_MARKER);
            } else if (occurrences.stream().anyMatch(s -> s.getShape() == CodeRegion.Shape.STMTS)) {
                parts.add(STMT_MARKER);
            } else {
                parts.add(sanitize(occurrences.get(0).baseTypeText()));
            }
        }
        return String.join("_", parts);
    }

    /** Keep the last path segment of a type and drop every character not allowed in a name. */
    static String sanitize(String type) {
        int sep = type.lastIndexOf("::");
        String last = sep < 0 ? type : type.substring(sep + 2);
        StringBuilder sb = new StringBuilder();
        for (char c : last.toCharArray()) {
            if (c < 128 && (Character.isLetterOrDigit(c) || c == '_')) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /** @return The macro name suffixed by the signature, if there is one. */
    public String nameWithSignature() {
        return withSignature(signature());
    }

    String withSignature(String signature) {
        return signature.isEmpty() ? name() : name() + "_" + signature;
    }

    /**
     * @return The signature under which the invocation is clustered. Invocations that can never
     *     become a function all share the empty signature, so one template serves every
     *     instantiation of the macro.
     */
    public String clusterSignature() {
        return canBeFn() && hasFnShape() ? signature() : "";
    }

    public boolean argsInternallyStructurallyCompatible() {
        return args.values().stream()
                .allMatch(s -> s.stream().allMatch(o -> o.isStructurallyCompatibleWith(s.get(0))));
    }

    public boolean argsInternallyTypeCompatible() {
        return args.values().stream()
                .allMatch(s -> s.stream().allMatch(o -> o.isTypeCompatibleWith(s.get(0))));
    }

    /**
     * Both invocations have the same body shape and, slot by slot, the same argument shapes.
     * A slot that is empty on both sides matches anything.
     */
    public boolean isStructurallyCompatibleWith(MacroInvocation other) {
        return seed.isStructurallyCompatibleWith(other.seed)
                && argsInternallyStructurallyCompatible()
                && other.argsInternallyStructurallyCompatible()
                && slotsMatch(other, false);
    }

    /** Structural compatibility, and identical value types for every expression shape. */
    public boolean isTypeCompatibleWith(MacroInvocation other) {
        return seed.isTypeCompatibleWith(other.seed)
                && argsInternallyTypeCompatible()
                && other.argsInternallyTypeCompatible()
                && slotsMatch(other, true);
    }

    private boolean slotsMatch(MacroInvocation other, boolean byType) {
        if (args.size() != other.args.size()) {
            return false;
        }
        List<List<HayrollSeed>> mine = new ArrayList<>(args.values());
        List<List<HayrollSeed>> theirs = new ArrayList<>(other.args.values());
        for (int i = 0; i < mine.size(); i++) {
            List<HayrollSeed> a = mine.get(i);
            List<HayrollSeed> b = theirs.get(i);
            if (a.isEmpty() && b.isEmpty()) {
                continue;
            }
            if (a.isEmpty() != b.isEmpty()) {
                return false;
            }
            boolean compatible =
                    byType
                            ? a.get(0).isTypeCompatibleWith(b.get(0))
                            : a.get(0).isStructurallyCompatibleWith(b.get(0));
            if (!compatible) {
                return false;
            }
        }
        return true;
    }

    /** @return Per argument, true if the slot is empty or every occurrence is an lvalue. */
    public List<Boolean> argsRequireLvalue() {
        return args.values().stream()
                .map(s -> s.stream().allMatch(HayrollSeed::isLvalue))
                .collect(Collectors.toList());
    }

    /** @return true if the body and every argument occurrence can live in a function. */
    public boolean hasFnShape() {
        return seed.getShape() != CodeRegion.Shape.DECLS
                && args.values().stream()
                        .flatMap(List::stream)
                        .allMatch(s -> s.getShape() == CodeRegion.Shape.EXPR);
    }

    @Override
    public String toString() {
        return nameWithSignature() + "@" + locBegin();
    }
}
