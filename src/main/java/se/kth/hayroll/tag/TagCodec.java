package se.kth.hayroll.tag;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import se.kth.hayroll.exception.MalformedTagException;
import se.kth.hayroll.util.LazyLogger;

/**
 * Converts between Rust byte-string literals and the JSON payload of seed tags. A tag literal
 * has the form {@code b"{...}\0"}: a JSON object with {@code "hayroll": true}, terminated by a
 * NUL byte so that the instrumented program can read it as a C string.
 */
public class TagCodec {
    private static final LazyLogger LOGGER = new LazyLogger(TagCodec.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    /**
     * Decode a literal into a tag payload.
     *
     * @param literalText Source text of a byte-string literal, including the {@code b"} prefix.
     * @return The payload if the literal holds a JSON object marked as a seed tag.
     */
    public static Optional<ObjectNode> decode(String literalText) {
        if (!literalText.startsWith("b\"") || !literalText.endsWith("\"")) {
            return Optional.empty();
        }
        String content = unescape(literalText.substring(2, literalText.length() - 1));
        int end = content.length();
        while (end > 0 && content.charAt(end - 1) == '\0') {
            end--;
        }
        content = content.substring(0, end);
        if (!content.startsWith("{")) {
            return Optional.empty();
        }
        JsonNode node;
        try {
            node = JSON.readTree(content);
        } catch (JsonProcessingException e) {
            String finalContent = content;
            LOGGER.trace(() -> "Byte string is not JSON: " + finalContent);
            return Optional.empty();
        }
        if (node instanceof ObjectNode && node.path("hayroll").asBoolean(false)) {
            return Optional.of((ObjectNode) node);
        }
        return Optional.empty();
    }

    /** Encode a payload as the text of a NUL-terminated byte-string literal. */
    public static String encode(ObjectNode payload) {
        String json;
        try {
            json = JSON.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new MalformedTagException("Could not serialize tag " + payload, e);
        }
        StringBuilder sb = new StringBuilder("b\"");
        for (byte b : json.getBytes(StandardCharsets.UTF_8)) {
            int c = b & 0xff;
            switch (c) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\'':
                    sb.append("\\'");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                default:
                    if (c < 0x20 || c >= 0x7f) {
                        sb.append(String.format("\\x%02x", c));
                    } else {
                        sb.append((char) c);
                    }
            }
        }
        return sb.append("\\0\"").toString();
    }

    /** Resolve the escapes of a byte-string body and decode the bytes as UTF-8. */
    static String unescape(String body) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                byte[] bytes = String.valueOf(c).getBytes(StandardCharsets.UTF_8);
                out.write(bytes, 0, bytes.length);
                i++;
                continue;
            }
            char e = body.charAt(i + 1);
            i += 2;
            switch (e) {
                case 'n':
                    out.write('\n');
                    break;
                case 'r':
                    out.write('\r');
                    break;
                case 't':
                    out.write('\t');
                    break;
                case '0':
                    out.write(0);
                    break;
                case 'x':
                    if (i + 2 <= body.length()) {
                        out.write(Integer.parseInt(body.substring(i, i + 2), 16));
                        i += 2;
                    }
                    break;
                case '\n':
                    // line continuation swallows the leading whitespace of the next line
                    while (i < body.length() && Character.isWhitespace(body.charAt(i))) i++;
                    break;
                default:
                    out.write(e);
            }
        }
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }

    static ObjectMapper mapper() {
        return JSON;
    }
}
