package se.kth.hayroll;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import se.kth.hayroll.pipeline.Workspace;
import se.kth.hayroll.tag.TagCodec;

/** Utility methods for the test suite: seed tag literals and instrumented code snippets. */
public class Util {
    public static final Path MAIN_RS = Paths.get("main.rs");

    private static final ObjectMapper JSON = new ObjectMapper();

    /** @return A workspace with a single file {@code main.rs}. */
    public static Workspace workspace(String text) {
        Map<Path, String> sources = new LinkedHashMap<>();
        sources.put(MAIN_RS, text);
        return Workspace.of(Paths.get("ws"), sources);
    }

    public static String read(Path path) throws IOException {
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }

    /** Start a tag for a macro invocation seed. */
    public static TagBuilder invocation(String name, String locBegin) {
        return new TagBuilder("invocation", name, locBegin);
    }

    /** Start a tag for a conditional branch seed. */
    public static TagBuilder conditional(String premise, String locBegin) {
        return new TagBuilder("conditional", "", locBegin).premise(premise);
    }

    /** {@code if TAG { LIVE } else { *(0 as *mut TYPE) }} */
    public static String exprGuard(String literal, String live, String type) {
        return "if *(" + literal + " as *const u8 as *const libc::c_char) as libc::c_int != 0 { "
                + live + " } else { *(0 as *mut " + type + ") }";
    }

    /** {@code *if TAG { LIVE } else { 0 as *mut TYPE }} for a seed that is assigned to. */
    public static String lvalueGuard(String literal, String live, String type) {
        return "*if *(" + literal + " as *const u8 as *const libc::c_char) as libc::c_int != 0 { "
                + live + " } else { 0 as *mut " + type + " }";
    }

    /**
     * An expression invocation of a one-argument macro {@code NAME(x)} that expands to {@code
     * (x) * 2.0}, with {@code x} bound to the variable {@code var}.
     */
    public static String doubleCall(TagBuilder invocation, String var, String type) {
        String loc = invocation.argNames("x").payload().get("locBegin").asText();
        String arg = invocation("x", loc + ":x").arg().locRefBegin(loc).literal();
        return exprGuard(invocation.literal(), "(" + exprGuard(arg, var, type) + ") * 2.0", type);
    }

    /** A tag statement that opens or closes a statement span. */
    public static String tagStmt(String literal) {
        return "*(" + literal + " as *const u8 as *const libc::c_char);";
    }

    /** A static item that carries a declaration tag. */
    public static String tagItem(String itemName, String literal) {
        return "pub static mut " + itemName + ": *const libc::c_char = " + literal
                + " as *const u8 as *const libc::c_char;";
    }

    /** Fluent builder of the payload of a seed tag, rendered as a byte-string literal. */
    public static class TagBuilder {
        private final ObjectNode payload = JSON.createObjectNode();

        TagBuilder(String seedType, String name, String locBegin) {
            payload.put("hayroll", true);
            payload.put("seedType", seedType);
            payload.put("astKind", "Expr");
            payload.put("begin", true);
            payload.put("name", name);
            payload.putArray("argNames");
            payload.put("isArg", false);
            payload.put("isLvalue", false);
            payload.put("canBeFn", false);
            payload.put("isPlaceholder", false);
            payload.put("premise", "");
            payload.putArray("mergedVariants");
            payload.put("locBegin", locBegin);
            payload.put("locEnd", locBegin);
            payload.put("locRefBegin", "def.c:1:9");
            payload.put("cuLnColBegin", "0:0");
            payload.put("cuLnColEnd", "0:0");
        }

        public TagBuilder astKind(String astKind) {
            payload.put("astKind", astKind);
            return this;
        }

        /** Turn the tag into the end tag of a statement span. */
        public TagBuilder end() {
            payload.put("begin", false);
            payload.put("astKind", "");
            return this;
        }

        public TagBuilder argNames(String... names) {
            ArrayNode array = payload.putArray("argNames");
            for (String name : names) {
                array.add(name);
            }
            return this;
        }

        /** Mark the tag as an occurrence of the named argument. */
        public TagBuilder arg() {
            payload.put("isArg", true);
            return this;
        }

        public TagBuilder lvalue() {
            payload.put("isLvalue", true);
            return this;
        }

        public TagBuilder canBeFn() {
            payload.put("canBeFn", true);
            return this;
        }

        public TagBuilder placeholder() {
            payload.put("isPlaceholder", true);
            return this;
        }

        public TagBuilder premise(String premise) {
            payload.put("premise", premise);
            return this;
        }

        public TagBuilder locRefBegin(String locRefBegin) {
            payload.put("locRefBegin", locRefBegin);
            return this;
        }

        public TagBuilder cuLnCol(String begin, String end) {
            payload.put("cuLnColBegin", begin);
            payload.put("cuLnColEnd", end);
            return this;
        }

        public TagBuilder mergedVariants(String... variants) {
            ArrayNode array = payload.putArray("mergedVariants");
            for (String variant : variants) {
                array.add(variant);
            }
            return this;
        }

        public ObjectNode payload() {
            return payload.deepCopy();
        }

        /** @return The NUL-terminated byte-string literal carrying the payload. */
        public String literal() {
            return TagCodec.encode(payload);
        }
    }
}
