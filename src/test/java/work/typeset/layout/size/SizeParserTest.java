package work.typeset.layout.size;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class SizeParserTest {
    @Test
    void parsesPoints() {
        Optional<Size> size = SizeParser.parse("12pt");
        assertTrue(size.isPresent());
        assertEquals(Size.pt(12), size.get());
    }

    @Test
    void parsesBareNumbersAsPoints() {
        assertEquals(Size.pt(10.5), SizeParser.parse(" 10.5 ").orElseThrow());
    }

    @Test
    void parsesInches() {
        assertEquals(Size.pt(72), SizeParser.parse("1in").orElseThrow());
    }

    @Test
    void parsesMetricUnits() {
        assertEquals(Size.mm(5).toPt(), SizeParser.parse("5mm").orElseThrow().toPt(), 1e-9);
        assertEquals(Size.cm(2.5).toPt(), SizeParser.parse("2.5CM").orElseThrow().toPt(), 1e-9);
    }

    @Test
    void returnsEmptyForBlankInput() {
        assertTrue(SizeParser.parse("  ").isEmpty());
        assertTrue(SizeParser.parse(null).isEmpty());
    }

    @Test
    void rejectsGarbage() {
        assertThrows(IllegalArgumentException.class, () -> SizeParser.parse("twelve"));
        assertThrows(IllegalArgumentException.class, () -> SizeParser.parse("NaNpt"));
        assertThrows(IllegalArgumentException.class, () -> SizeParser.parse("12f"));
        assertThrows(IllegalArgumentException.class, () -> SizeParser.parse("5dpt"));
        assertThrows(IllegalArgumentException.class, () -> SizeParser.parse("0x1p3mm"));
        assertThrows(IllegalArgumentException.class, () -> SizeParser.parse("Infinity"));
    }

    @Test
    void acceptsSignsFractionsAndExponents() {
        assertEquals(Size.pt(-3), SizeParser.parse("-3pt").orElseThrow());
        assertEquals(Size.pt(0.5), SizeParser.parse(".5").orElseThrow());
        assertEquals(Size.pt(1200), SizeParser.parse("1.2e3pt").orElseThrow());
        assertEquals(Size.pt(72), SizeParser.parse("1. in").orElseThrow());
    }
}
