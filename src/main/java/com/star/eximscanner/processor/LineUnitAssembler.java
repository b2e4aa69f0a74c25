package com.star.eximscanner.processor;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * Groups physical lines into {@link LineUnit}s.
 *
 * <p>A line accepted by the record-start predicate opens a new unit; any
 * other line is appended to the open unit. A line that arrives while no
 * unit is open becomes a unit of its own so the parser can reject it, and
 * blank lines outside a unit are dropped. Trailing blank lines are not part
 * of a unit.
 */
public class LineUnitAssembler {

    private final Predicate<String> recordStart;

    private final StringBuilder buffer = new StringBuilder();
    private long firstLineNumber = -1;
    private int lineCount = 0;
    private int trailingBlankLines = 0;
    private int contentLength = 0;

    public LineUnitAssembler(Predicate<String> recordStart) {
        this.recordStart = recordStart;
    }

    /**
     * Adds a line and returns the unit it completed, if any.
     */
    public Optional<LineUnit> offer(String line, long lineNumber) {
        String content = stripCarriageReturn(line);

        if (recordStart.test(content)) {
            Optional<LineUnit> completed = flush();
            start(content, lineNumber);
            return completed;
        }

        if (lineCount == 0) {
            if (content.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(new LineUnit(content, lineNumber, 1));
        }

        append(content);
        return Optional.empty();
    }

    /**
     * Completes the open unit, typically at end of input.
     */
    public Optional<LineUnit> flush() {
        if (lineCount == 0) {
            return Optional.empty();
        }

        LineUnit unit = new LineUnit(buffer.substring(0, contentLength),
                firstLineNumber, lineCount - trailingBlankLines);
        reset();
        return Optional.of(unit);
    }

    public boolean hasPending() {
        return lineCount > 0;
    }

    public void reset() {
        buffer.setLength(0);
        firstLineNumber = -1;
        lineCount = 0;
        trailingBlankLines = 0;
        contentLength = 0;
    }

    private void start(String content, long lineNumber) {
        buffer.append(content);
        firstLineNumber = lineNumber;
        lineCount = 1;
        trailingBlankLines = 0;
        contentLength = buffer.length();
    }

    private void append(String content) {
        buffer.append('\n').append(content);
        lineCount++;
        if (content.isBlank()) {
            trailingBlankLines++;
        } else {
            trailingBlankLines = 0;
            contentLength = buffer.length();
        }
    }

    private static String stripCarriageReturn(String line) {
        if (line != null && line.endsWith("\r")) {
            return line.substring(0, line.length() - 1);
        }
        return line != null ? line : "";
    }
}
