package com.star.eximscanner.parser;

import com.star.eximscanner.event.EventSink;
import com.star.eximscanner.event.NormalizedEvent;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Default {@link ParserMediator}: holds the configuration of one parse pass,
 * forwards events to an {@link EventSink} and keeps processing statistics.
 *
 * <p>This class supports:
 * <ul>
 *   <li>Timezone configuration for offset-less timestamps</li>
 *   <li>Cooperative abort through {@link #requestAbort()}</li>
 *   <li>Processing statistics tracking</li>
 * </ul>
 *
 * <p>A context belongs to a single parse pass and is not thread-safe.
 *
 * @author Eshmamatov Obidjon
 */
@Data
@Slf4j
public class ParseContext implements ParserMediator {

    private ZoneId timezone = ZoneOffset.UTC;

    private String fileName;

    private EventSink sink;

    private boolean abortOnInvalidTimestamp = false;

    private int maxLineLength = 100_000;

    private volatile boolean abortRequested = false;

    private long totalUnitsProcessed = 0;

    private long successfulUnits = 0;

    private long failedUnits = 0;

    private long skippedUnits = 0;

    private long multiLineUnits = 0;

    private long eventsProduced = 0;

    public ParseContext() {
        this(null, null);
    }

    public ParseContext(EventSink sink) {
        this(sink, null);
    }

    public ParseContext(EventSink sink, String timezone) {
        this.sink = sink;
        if (timezone != null && !timezone.isEmpty()) {
            try {
                this.timezone = ZoneId.of(timezone);
            } catch (DateTimeException e) {
                log.warn("Invalid timezone '{}', will use UTC", timezone);
            }
        }
    }

    @Override
    public void produceEvent(NormalizedEvent event) {
        eventsProduced++;
        if (sink != null) {
            sink.produceEvent(event);
        } else {
            log.debug("No sink configured, dropping {} event", event.getDataType());
        }
    }

    @Override
    public ZoneId getTimezone() {
        return timezone != null ? timezone : ZoneOffset.UTC;
    }

    @Override
    public boolean isAbortRequested() {
        return abortRequested;
    }

    public void requestAbort() {
        if (!abortRequested) {
            log.info("Abort requested for {}", fileName != null ? fileName : "current parse");
        }
        abortRequested = true;
    }

    public void recordSuccess() {
        totalUnitsProcessed++;
        successfulUnits++;
    }

    public void recordFailure() {
        totalUnitsProcessed++;
        failedUnits++;
    }

    public void recordSkipped() {
        totalUnitsProcessed++;
        skippedUnits++;
    }

    public void recordMultiLine() {
        multiLineUnits++;
    }

    public static class Builder {
        private EventSink sink;
        private String timezone;
        private String fileName;
        private boolean abortOnInvalidTimestamp = false;
        private int maxLineLength = 100_000;

        public Builder sink(EventSink sink) {
            this.sink = sink;
            return this;
        }

        public Builder timezone(String timezone) {
            this.timezone = timezone;
            return this;
        }

        public Builder fileName(String fileName) {
            this.fileName = fileName;
            return this;
        }

        public Builder abortOnInvalidTimestamp(boolean abort) {
            this.abortOnInvalidTimestamp = abort;
            return this;
        }

        public Builder maxLineLength(int maxLength) {
            this.maxLineLength = maxLength;
            return this;
        }

        public ParseContext build() {
            ParseContext ctx = new ParseContext(sink, timezone);
            ctx.setFileName(fileName);
            ctx.setAbortOnInvalidTimestamp(abortOnInvalidTimestamp);
            ctx.setMaxLineLength(maxLineLength);
            return ctx;
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}
