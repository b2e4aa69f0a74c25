package com.star.eximscanner.parser;

import com.star.eximscanner.dispatch.DispatchOutcome;
import lombok.Builder;
import lombok.Getter;

/**
 * Encapsulates the result of parsing one line unit.
 *
 * <p>Ordinary data problems (a unit that does not fit the grammar, a date
 * that does not exist) are reported here instead of being thrown.
 *
 * @author Eshmamatov Obidjon
 */
@Getter
@Builder
public class ParseResult {

    public enum Status {
        SUCCESS,
        FAILED,
        SKIPPED,
        ABORTED
    }

    private final Status status;
    private final ParsedRecord record;
    private final DispatchOutcome dispatchOutcome;
    private final String errorMessage;
    private final long lineNumber;
    private final String rawLine;
    private final String additionalInfo;

    public static ParseResult success(ParsedRecord record, DispatchOutcome outcome, long lineNumber) {
        return ParseResult.builder()
                .status(Status.SUCCESS)
                .record(record)
                .dispatchOutcome(outcome)
                .lineNumber(lineNumber)
                .build();
    }

    public static ParseResult failed(long lineNumber, String rawLine, String errorMessage) {
        return ParseResult.builder()
                .status(Status.FAILED)
                .lineNumber(lineNumber)
                .rawLine(rawLine)
                .errorMessage(errorMessage)
                .build();
    }

    public static ParseResult skipped(long lineNumber, String rawLine, String reason) {
        return ParseResult.builder()
                .status(Status.SKIPPED)
                .lineNumber(lineNumber)
                .rawLine(rawLine)
                .additionalInfo(reason)
                .build();
    }

    public static ParseResult aborted(long lineNumber) {
        return ParseResult.builder()
                .status(Status.ABORTED)
                .lineNumber(lineNumber)
                .build();
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    public boolean isSkipped() {
        return status == Status.SKIPPED;
    }

    public boolean isAborted() {
        return status == Status.ABORTED;
    }

    @Override
    public String toString() {
        return String.format("ParseResult{status=%s, line=%d, error='%s'}",
                status, lineNumber, errorMessage != null ? errorMessage : "none");
    }
}
