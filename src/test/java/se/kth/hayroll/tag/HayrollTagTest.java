package se.kth.hayroll.tag;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.Test;
import se.kth.hayroll.Util;
import se.kth.hayroll.exception.MalformedTagException;
import se.kth.hayroll.syntax.SyntaxNode;
import se.kth.hayroll.syntax.TreeSitterParser;

class HayrollTagTest {
    private static final Path FILE = Paths.get("main.rs");

    private static HayrollTag tag(String literal) {
        SyntaxNode node = TreeSitterParser.parseExpr(literal);
        return HayrollTag.fromLiteral(node, FILE).get();
    }

    @Test
    void accessors_shouldExposeTypedFields() {
        HayrollTag tag =
                tag(
                        Util.invocation("M", "a.c:3:5")
                                .astKind("Stmts")
                                .argNames("x", "y")
                                .canBeFn()
                                .locRefBegin("a.c:1:9")
                                .literal());

        assertEquals(SeedType.INVOCATION, tag.seedType());
        assertTrue(tag.isInvocation());
        assertEquals(AstKind.STMTS, tag.astKind());
        assertTrue(tag.begin());
        assertEquals("M", tag.name());
        assertEquals(Arrays.asList("x", "y"), tag.argNames());
        assertTrue(tag.canBeFn());
        assertFalse(tag.isLvalue());
        assertEquals("a.c:3:5", tag.locBegin());
        assertEquals("a.c:1:9", tag.locRefBegin());
        assertEquals(FILE, tag.file());
    }

    @Test
    void optionalFields_shouldDefault_whenAbsent() {
        HayrollTag tag =
                tag("b\"{\\\"hayroll\\\":true,\\\"seedType\\\":\\\"conditional\\\","
                        + "\\\"astKind\\\":\\\"Expr\\\",\\\"begin\\\":true,"
                        + "\\\"name\\\":\\\"\\\",\\\"locBegin\\\":\\\"a.c:1:1\\\"}\\0\"");

        assertFalse(tag.isPlaceholder());
        assertEquals("", tag.premise());
        assertEquals(Collections.emptyList(), tag.mergedVariants());
        assertEquals(Collections.emptyList(), tag.argNames());
    }

    @Test
    void constructor_shouldThrow_whenRequiredFieldIsMissing() {
        SyntaxNode node = TreeSitterParser.parseExpr("b\"{\\\"hayroll\\\":true}\\0\"");

        assertThrows(MalformedTagException.class, () -> HayrollTag.fromLiteral(node, FILE));
    }

    @Test
    void fromLiteral_shouldBeEmpty_whenLiteralIsNotAByteString() {
        SyntaxNode node = TreeSitterParser.parseExpr("\"{\\\"hayroll\\\":true}\"");

        assertFalse(HayrollTag.fromLiteral(node, FILE).isPresent());
    }

    @Test
    void withAppendedMergedVariant_shouldReturnNewLiteral_andLeaveTagUnchanged() {
        HayrollTag tag = tag(Util.conditional("FOO", "a.c:2:1").mergedVariants("v1").literal());

        HayrollTag updated = tag(tag.withAppendedMergedVariant("v2"));

        assertEquals(Arrays.asList("v1", "v2"), updated.mergedVariants());
        assertEquals(Collections.singletonList("v1"), tag.mergedVariants());
        assertEquals("FOO", updated.premise());
    }

    @Test
    void withUpdatedBegin_shouldOnlyFlipBeginFlag() {
        HayrollTag tag = tag(Util.invocation("M", "a.c:3:5").astKind("Stmts").literal());

        HayrollTag end = tag(tag.withUpdatedBegin(false));

        assertFalse(end.begin());
        assertEquals(tag.locBegin(), end.locBegin());
        assertEquals(tag.astKind(), end.astKind());
    }

    @Test
    void seedType_shouldBeOther_whenWireNameIsUnknown() {
        assertEquals(SeedType.OTHER, SeedType.fromWireName("something"));
        assertEquals(AstKind.OTHER, AstKind.fromWireName("Weird"));
        assertEquals(AstKind.NONE, AstKind.fromWireName(""));
    }
}
