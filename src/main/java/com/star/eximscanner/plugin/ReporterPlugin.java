package com.star.eximscanner.plugin;

import com.star.eximscanner.parser.ParserMediator;

import java.time.Instant;
import java.util.Map;

/**
 * Extension that may take over records written by one reporter.
 *
 * <p>{@link #process} either produces exactly one event through the mediator
 * and returns {@link PluginOutcome#EMITTED}, or produces nothing and returns
 * {@link PluginOutcome#DECLINED}, in which case the caller emits the generic
 * event. Plugins are invoked synchronously and should not block.
 */
public interface ReporterPlugin {

    /**
     * Name used in plugin include lists.
     */
    String getName();

    /**
     * Reporter value this plugin claims, e.g. {@code sshd}.
     */
    String getReporter();

    PluginOutcome process(ParserMediator mediator, Instant timestamp, Map<String, Object> attributes);

    default String getDescription() {
        return "Plugin for records reported by " + getReporter();
    }
}
