package com.star.eximscanner.dispatch;

import com.star.eximscanner.event.NormalizedEvent;
import com.star.eximscanner.parser.ParserMediator;
import com.star.eximscanner.plugin.EnabledPlugins;
import com.star.eximscanner.plugin.PluginOutcome;
import com.star.eximscanner.plugin.ReporterPlugin;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Routes a parsed record to the plugin registered for its reporter, or to
 * the generic event.
 *
 * <p>The generic event is produced when no plugin is enabled for the
 * reporter and also when the plugin declines the record, so plugins can
 * share a reporter speculatively.
 */
@Slf4j
public class EventDispatcher {

    public DispatchOutcome dispatch(ParserMediator mediator, EnabledPlugins plugins,
                                    String reporter, Instant timestamp,
                                    Map<String, Object> attributes) {
        Optional<ReporterPlugin> plugin = plugins.forReporter(reporter);
        if (plugin.isEmpty()) {
            mediator.produceEvent(NormalizedEvent.generic(timestamp, attributes));
            return DispatchOutcome.GENERIC;
        }

        PluginOutcome outcome = plugin.get().process(mediator, timestamp, attributes);
        if (outcome == PluginOutcome.EMITTED) {
            return DispatchOutcome.PLUGIN;
        }

        log.debug("Plugin {} declined record from {}, producing generic event",
                plugin.get().getName(), reporter);
        mediator.produceEvent(NormalizedEvent.generic(timestamp, attributes));
        return DispatchOutcome.PLUGIN_DECLINED;
    }
}
