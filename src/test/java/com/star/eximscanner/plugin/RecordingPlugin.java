package com.star.eximscanner.plugin;

import com.star.eximscanner.event.NormalizedEvent;
import com.star.eximscanner.parser.ParserMediator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Test plugin that records its invocations and either accepts or declines
 * every record.
 */
public class RecordingPlugin implements ReporterPlugin {

    public static final String ACCEPTED_DATA_TYPE = "test:accepted";

    private final String name;
    private final String reporter;
    private final PluginOutcome outcome;

    private final List<Instant> timestamps = new ArrayList<>();
    private final List<Map<String, Object>> attributes = new ArrayList<>();

    public RecordingPlugin(String name, String reporter, PluginOutcome outcome) {
        this.name = name;
        this.reporter = reporter;
        this.outcome = outcome;
    }

    public static RecordingPlugin accepting(String name, String reporter) {
        return new RecordingPlugin(name, reporter, PluginOutcome.EMITTED);
    }

    public static RecordingPlugin declining(String name, String reporter) {
        return new RecordingPlugin(name, reporter, PluginOutcome.DECLINED);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getReporter() {
        return reporter;
    }

    @Override
    public PluginOutcome process(ParserMediator mediator, Instant timestamp, Map<String, Object> attributes) {
        this.timestamps.add(timestamp);
        this.attributes.add(attributes);
        if (outcome == PluginOutcome.EMITTED) {
            mediator.produceEvent(NormalizedEvent.builder()
                    .dataType(ACCEPTED_DATA_TYPE)
                    .timestamp(timestamp)
                    .attributes(attributes)
                    .build());
        }
        return outcome;
    }

    public int getInvocations() {
        return timestamps.size();
    }

    public List<Instant> getTimestamps() {
        return timestamps;
    }

    public List<Map<String, Object>> getAttributes() {
        return attributes;
    }
}
