package com.star.eximscanner.plugin;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Holds every known {@link ReporterPlugin} and builds the reporter index
 * for the subset a parse pass should use.
 */
@Component
@Slf4j
public class PluginRegistry {

    private final List<ReporterPlugin> plugins;

    public PluginRegistry(List<ReporterPlugin> plugins) {
        this.plugins = List.copyOf(plugins);

        log.info("PluginRegistry initialized with {} plugins: {}",
                plugins.size(),
                plugins.stream()
                       .map(p -> p.getName() + "(" + p.getReporter() + ")")
                       .collect(Collectors.joining(", ")));
    }

    /**
     * Builds a fresh index of the plugins named in {@code includes}.
     *
     * @param includes plugin names to enable; {@code null} or empty enables
     *                 every known plugin
     * @return the index; earlier indexes are unaffected
     */
    public EnabledPlugins enablePlugins(Collection<String> includes) {
        boolean includeAll = includes == null || includes.isEmpty();
        Set<String> wanted = includeAll ? Set.of() : new HashSet<>(includes);

        Map<String, ReporterPlugin> byReporter = new LinkedHashMap<>();
        Set<String> found = new HashSet<>();

        for (ReporterPlugin plugin : plugins) {
            if (!includeAll && !wanted.contains(plugin.getName())) {
                continue;
            }
            found.add(plugin.getName());

            ReporterPlugin previous = byReporter.put(plugin.getReporter(), plugin);
            if (previous != null) {
                log.warn("Plugins {} and {} both claim reporter '{}', using {}",
                        previous.getName(), plugin.getName(), plugin.getReporter(), plugin.getName());
            }
        }

        if (!includeAll) {
            for (String name : wanted) {
                if (!found.contains(name)) {
                    log.warn("Ignoring unknown plugin '{}'. Available plugins: {}", name, getAvailablePlugins());
                }
            }
        }

        EnabledPlugins enabled = new EnabledPlugins(byReporter);
        log.debug("Enabled plugins for reporters {}", enabled.reporters());
        return enabled;
    }

    public List<String> getAvailablePlugins() {
        return plugins.stream()
                .map(ReporterPlugin::getName)
                .collect(Collectors.toList());
    }
}
