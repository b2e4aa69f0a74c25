package com.star.eximscanner.plugin;

import com.star.eximscanner.event.NormalizedEvent;
import com.star.eximscanner.parser.ParserMediator;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Base for plugins that recognize their records with regular expressions and
 * emit the parsed attributes enriched with the captured groups.
 */
public abstract class AbstractReporterPlugin implements ReporterPlugin {

    protected static final String ATTRIBUTE_BODY = "body";

    private final String name;
    private final String reporter;

    protected AbstractReporterPlugin(String name, String reporter) {
        this.name = name;
        this.reporter = reporter;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getReporter() {
        return reporter;
    }

    protected static String body(Map<String, Object> attributes) {
        Object body = attributes.get(ATTRIBUTE_BODY);
        return body != null ? body.toString() : null;
    }

    /**
     * Copies {@code attributes}, adds every non-null named group of
     * {@code matcher} and produces the event.
     */
    protected PluginOutcome emit(ParserMediator mediator, String dataType, Instant timestamp,
                                 Map<String, Object> attributes, Matcher matcher, String... groups) {
        Map<String, Object> enriched = new LinkedHashMap<>(attributes);
        enriched.put("reporter", reporter);
        for (String group : groups) {
            String value = matcher.group(group);
            if (value != null) {
                enriched.put(group, value);
            }
        }

        mediator.produceEvent(NormalizedEvent.builder()
                .dataType(dataType)
                .timestamp(timestamp)
                .attributes(enriched)
                .build());
        return PluginOutcome.EMITTED;
    }
}
