package com.star.eximscanner.entity;

import com.star.eximscanner.dispatch.DispatchOutcome;
import lombok.Data;

import java.util.EnumMap;
import java.util.Map;

@Data
public class ParseSummary {

    public enum Status {
        COMPLETED,
        NOT_SUPPORTED,   // first line failed verification, nothing parsed
        ABORTED,
        TOO_MANY_FAILURES
    }

    private String fileName;
    private String parserFormat;
    private Status status;

    private long totalLines;
    private long totalUnits;
    private long successfulUnits;
    private long failedUnits;
    private long skippedUnits;
    private long multiLineUnits;

    private long eventsProduced;
    private long processingTimeMs;

    private Map<DispatchOutcome, Long> dispatchCounts = new EnumMap<>(DispatchOutcome.class);

    public void recordDispatch(DispatchOutcome outcome) {
        if (outcome != null) {
            dispatchCounts.merge(outcome, 1L, Long::sum);
        }
    }

    public long getDispatchCount(DispatchOutcome outcome) {
        return dispatchCounts.getOrDefault(outcome, 0L);
    }

    public static ParseSummary notSupported(String fileName, String parserFormat) {
        ParseSummary summary = new ParseSummary();
        summary.setFileName(fileName);
        summary.setParserFormat(parserFormat);
        summary.setStatus(Status.NOT_SUPPORTED);
        return summary;
    }
}
