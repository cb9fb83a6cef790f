package se.kth.hayroll.seed;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import se.kth.hayroll.exception.MalformedTagException;

class LnColTest {

    @Test
    void parse_shouldReadLineAndColumn() {
        LnCol pos = LnCol.parse(" 12:4 ");

        assertEquals(12, pos.getLine());
        assertEquals(4, pos.getCol());
        assertEquals(new LnCol(12, 4), pos);
        assertEquals("12:4", pos.toString());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "12", "a:b", "1:2:3"})
    void parse_shouldThrow_whenTextIsNotLineColon(String text) {
        assertThrows(MalformedTagException.class, () -> LnCol.parse(text));
    }

    @Test
    void isWithin_shouldIncludeBothEnds() {
        LnCol begin = new LnCol(10, 5);
        LnCol end = new LnCol(20, 0);

        assertTrue(begin.isWithin(begin, end));
        assertTrue(end.isWithin(begin, end));
        assertTrue(new LnCol(15, 99).isWithin(begin, end));
        assertFalse(new LnCol(10, 4).isWithin(begin, end));
        assertFalse(new LnCol(20, 1).isWithin(begin, end));
        assertFalse(new LnCol(9, 50).isWithin(begin, end));
    }
}
