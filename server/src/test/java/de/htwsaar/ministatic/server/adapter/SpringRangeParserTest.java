package de.htwsaar.ministatic.server.adapter;

import static org.junit.jupiter.api.Assertions.*;

import de.htwsaar.ministatic.server.domain.ByteRange;
import de.htwsaar.ministatic.server.domain.RangeParseResult;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SpringRangeParserTest {

    private final SpringRangeParser parser = new SpringRangeParser();

    @Test
    void parsesAllThreeForms() {
        assertEquals(List.of(new ByteRange(0, 99)), parser.parse(1000, "bytes=0-99").ranges());
        assertEquals(List.of(new ByteRange(900, 999)), parser.parse(1000, "bytes=900-").ranges());
        assertEquals(List.of(new ByteRange(950, 999)), parser.parse(1000, "bytes=-50").ranges());
    }

    @Test
    void clampsEndAndSuffixToFileSize() {
        assertEquals(List.of(new ByteRange(10, 19)), parser.parse(20, "bytes=10-5000").ranges());
        assertEquals(List.of(new ByteRange(0, 19)), parser.parse(20, "bytes=-500").ranges());
    }

    @Test
    void keepsRequestOrderAndOverlaps() {
        RangeParseResult result = parser.parse(100, "bytes=50-59, 0-9,5-14");

        assertTrue(result.satisfiable());
        assertEquals(List.of(new ByteRange(50, 59), new ByteRange(0, 9), new ByteRange(5, 14)), result.ranges());
    }

    @Test
    void dropsRangesBeyondEndButKeepsTheRest() {
        assertEquals(List.of(new ByteRange(0, 4)), parser.parse(100, "bytes=0-4,200-300").ranges());
    }

    @Test
    void onlyRangesBeyondEndAreUnsatisfiable() {
        assertEquals(RangeParseResult.Status.UNSATISFIABLE, parser.parse(100, "bytes=999999-1000000").status());
        assertEquals(RangeParseResult.Status.UNSATISFIABLE, parser.parse(100, "bytes=100-").status());
        assertEquals(RangeParseResult.Status.UNSATISFIABLE, parser.parse(0, "bytes=0-").status());
        assertEquals(RangeParseResult.Status.UNSATISFIABLE, parser.parse(0, "bytes=-10").status());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "bytes", "bytes=", "bytes=a-b", "bytes=10", "lines=0-5", "bytes=9-3", "0-5"})
    void syntaxErrorsAreMalformed(String header) {
        assertEquals(RangeParseResult.Status.MALFORMED, parser.parse(100, header).status(), header);
    }

    @Test
    void nullIsMalformed() {
        assertEquals(RangeParseResult.Status.MALFORMED, parser.parse(100, null).status());
    }

    @Test
    void tooManyRangesAreMalformed() {
        String header = "bytes=" + IntStream.range(0, 101).mapToObj(i -> i + "-" + i).collect(Collectors.joining(","));

        assertEquals(RangeParseResult.Status.MALFORMED, parser.parse(1000, header).status());
    }
}
