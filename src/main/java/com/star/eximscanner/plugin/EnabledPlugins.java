package com.star.eximscanner.plugin;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable reporter to plugin index produced by
 * {@link PluginRegistry#enablePlugins(java.util.Collection)}.
 */
public final class EnabledPlugins {

    private static final EnabledPlugins NONE = new EnabledPlugins(Map.of());

    private final Map<String, ReporterPlugin> pluginsByReporter;

    EnabledPlugins(Map<String, ReporterPlugin> pluginsByReporter) {
        this.pluginsByReporter = Collections.unmodifiableMap(new LinkedHashMap<>(pluginsByReporter));
    }

    public static EnabledPlugins none() {
        return NONE;
    }

    public Optional<ReporterPlugin> forReporter(String reporter) {
        if (reporter == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(pluginsByReporter.get(reporter));
    }

    public Set<String> reporters() {
        return pluginsByReporter.keySet();
    }

    public int size() {
        return pluginsByReporter.size();
    }

    public boolean isEmpty() {
        return pluginsByReporter.isEmpty();
    }

    @Override
    public String toString() {
        return "EnabledPlugins" + pluginsByReporter.keySet();
    }
}
