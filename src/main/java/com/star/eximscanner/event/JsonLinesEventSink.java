package com.star.eximscanner.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.star.eximscanner.exception.LogProcessingException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
 * Writes every event as one JSON document per line.
 */
@Slf4j
public class JsonLinesEventSink implements EventSink {

    private final ObjectMapper objectMapper;
    private final Writer writer;

    private long written = 0;

    public JsonLinesEventSink(ObjectMapper objectMapper, Writer writer) {
        this.objectMapper = objectMapper;
        this.writer = writer;
    }

    @Override
    public void produceEvent(NormalizedEvent event) {
        String json;
        try {
            json = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new LogProcessingException("Failed to serialize " + event.getDataType() + " event", e);
        }

        try {
            writer.write(json);
            writer.write('\n');
            written++;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write event", e);
        }
    }

    public void flush() {
        try {
            writer.flush();
            log.debug("Flushed {} events", written);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to flush events", e);
        }
    }

    public long getWritten() {
        return written;
    }
}
