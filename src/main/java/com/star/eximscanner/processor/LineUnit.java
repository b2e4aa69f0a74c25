package com.star.eximscanner.processor;

import lombok.Value;

/**
 * One line that starts a record joined with its continuation lines.
 */
@Value
public class LineUnit {
    String text;
    long firstLineNumber;
    int lineCount;

    public boolean isMultiLine() {
        return lineCount > 1;
    }
}
