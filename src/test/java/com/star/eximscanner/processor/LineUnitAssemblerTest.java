package com.star.eximscanner.processor;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LineUnitAssemblerTest {

    private LineUnitAssembler assembler;

    @BeforeEach
    void setUp() {
        assembler = new LineUnitAssembler(line -> line.startsWith("2016-"));
    }

    @Test
    @DisplayName("Should complete a unit when the next record starts")
    void shouldCompleteOnNextRecord() {
        assertTrue(assembler.offer("2016-05-12 first", 1).isEmpty());

        Optional<LineUnit> unit = assembler.offer("2016-05-12 second", 2);

        assertEquals(new LineUnit("2016-05-12 first", 1, 1), unit.orElseThrow());
        assertTrue(assembler.hasPending());
        assertEquals(new LineUnit("2016-05-12 second", 2, 1), assembler.flush().orElseThrow());
        assertFalse(assembler.hasPending());
    }

    @Test
    @DisplayName("Should join continuation lines")
    void shouldJoinContinuationLines() {
        assembler.offer("2016-05-12 first", 10);
        assembler.offer("  continued", 11);
        assembler.offer("  and again", 12);

        LineUnit unit = assembler.flush().orElseThrow();

        assertEquals("2016-05-12 first\n  continued\n  and again", unit.getText());
        assertEquals(10, unit.getFirstLineNumber());
        assertEquals(3, unit.getLineCount());
        assertTrue(unit.isMultiLine());
    }

    @Test
    @DisplayName("Should drop trailing blank lines but keep trailing spaces")
    void shouldDropTrailingBlankLines() {
        assembler.offer("2016-05-12 first  ", 1);
        assembler.offer("", 2);
        assembler.offer("   ", 3);

        LineUnit unit = assembler.flush().orElseThrow();

        assertEquals("2016-05-12 first  ", unit.getText());
        assertEquals(1, unit.getLineCount());
    }

    @Test
    @DisplayName("Should keep blank lines inside a unit")
    void shouldKeepInnerBlankLines() {
        assembler.offer("2016-05-12 first", 1);
        assembler.offer("", 2);
        assembler.offer("tail", 3);

        assertEquals("2016-05-12 first\n\ntail", assembler.flush().orElseThrow().getText());
    }

    @Test
    @DisplayName("Should emit stray lines on their own and drop stray blanks")
    void shouldEmitStrayLines() {
        assertTrue(assembler.offer("", 1).isEmpty());

        LineUnit stray = assembler.offer("garbage", 2).orElseThrow();

        assertEquals(new LineUnit("garbage", 2, 1), stray);
        assertFalse(assembler.hasPending());
    }

    @Test
    @DisplayName("Should strip carriage returns")
    void shouldStripCarriageReturns() {
        assembler.offer("2016-05-12 first\r", 1);
        assembler.offer("next\r", 2);

        assertEquals("2016-05-12 first\nnext", assembler.flush().orElseThrow().getText());
    }

    @Test
    @DisplayName("Should flush nothing when empty")
    void shouldFlushNothingWhenEmpty() {
        assertTrue(assembler.flush().isEmpty());

        assembler.offer("2016-05-12 first", 1);
        assembler.reset();

        assertTrue(assembler.flush().isEmpty());
    }
}
