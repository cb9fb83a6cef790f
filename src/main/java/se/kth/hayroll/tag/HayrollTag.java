package se.kth.hayroll.tag;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import se.kth.hayroll.exception.MalformedTagException;
import se.kth.hayroll.syntax.SyntaxKind;
import se.kth.hayroll.syntax.SyntaxNode;
import se.kth.hayroll.syntax.TokenKind;

/**
 * A seed tag: a byte-string literal in the instrumented source together with its decoded
 * payload and the workspace file it was found in.
 */
public class HayrollTag implements HayrollMeta {
    private static final String[] REQUIRED_FIELDS = {
        "seedType", "astKind", "begin", "name", "locBegin"
    };

    private final SyntaxNode literal;
    private final ObjectNode payload;
    private final Path file;

    public HayrollTag(SyntaxNode literal, ObjectNode payload, Path file) {
        for (String field : REQUIRED_FIELDS) {
            if (!payload.has(field)) {
                throw new MalformedTagException(
                        "Tag in " + file + " lacks required field '" + field + "': " + payload);
            }
        }
        this.literal = literal;
        this.payload = payload;
        this.file = file;
    }

    /**
     * Decode a literal node into a tag.
     *
     * @return The tag, or empty if the node is not a byte string carrying a seed tag.
     */
    public static Optional<HayrollTag> fromLiteral(SyntaxNode literal, Path file) {
        if (!literal.is(SyntaxKind.LITERAL)
                || literal.firstToken().getKind() != TokenKind.BYTE_STRING) {
            return Optional.empty();
        }
        return TagCodec.decode(literal.getText()).map(p -> new HayrollTag(literal, p, file));
    }

    /** @return true if the node (typically a statement) contains a seed tag literal. */
    public static boolean containsTag(SyntaxNode node) {
        return node.descendants()
                .filter(n -> n.is(SyntaxKind.LITERAL))
                .anyMatch(n -> fromLiteral(n, null).isPresent());
    }

    @Override
    public HayrollTag hayrollTag() {
        return this;
    }

    public SyntaxNode getLiteral() {
        return literal;
    }

    public Path getFile() {
        return file;
    }

    /** @return A copy of the decoded payload. */
    public ObjectNode getPayload() {
        return payload.deepCopy();
    }

    /** @return Text of a new literal whose mergedVariants list has the id appended. */
    public String withAppendedMergedVariant(String variantId) {
        ObjectNode updated = payload.deepCopy();
        ArrayNode variants = updated.putArray("mergedVariants");
        for (String v : mergedVariants()) {
            variants.add(v);
        }
        variants.add(variantId);
        return TagCodec.encode(updated);
    }

    /** @return Text of a new literal that is identical except for the begin flag. */
    public String withUpdatedBegin(boolean begin) {
        ObjectNode updated = payload.deepCopy();
        updated.put("begin", begin);
        return TagCodec.encode(updated);
    }

    String requireString(String field) {
        JsonNode value = payload.get(field);
        if (value == null || !value.isTextual()) {
            throw new MalformedTagException(
                    "Tag field '" + field + "' is missing or not a string: " + payload);
        }
        return value.asText();
    }

    boolean requireBoolean(String field) {
        JsonNode value = payload.get(field);
        if (value == null || !value.isBoolean()) {
            throw new MalformedTagException(
                    "Tag field '" + field + "' is missing or not a boolean: " + payload);
        }
        return value.asBoolean();
    }

    String optionalString(String field) {
        JsonNode value = payload.get(field);
        return value == null || value.isNull() ? "" : value.asText();
    }

    boolean optionalBoolean(String field) {
        JsonNode value = payload.get(field);
        return value != null && value.asBoolean(false);
    }

    List<String> optionalStrings(String field) {
        List<String> result = new ArrayList<>();
        JsonNode value = payload.get(field);
        if (value != null && value.isArray()) {
            value.forEach(v -> result.add(v.asText()));
        }
        return result;
    }

    @Override
    public String toString() {
        return payload.path("locBegin").asText() + "@" + file;
    }
}
