package com.star.eximscanner.config;

import com.star.eximscanner.dispatch.EventDispatcher;
import com.star.eximscanner.parser.Exim4LogParser;
import com.star.eximscanner.parser.TimestampNormalizer;
import com.star.eximscanner.plugin.PluginRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Wires the parser and enables its plugins once, before any file is parsed.
 */
@Configuration
@Slf4j
public class ParserConfig {

    @Bean
    public TimestampNormalizer timestampNormalizer() {
        return new TimestampNormalizer();
    }

    @Bean
    public EventDispatcher eventDispatcher() {
        return new EventDispatcher();
    }

    @Bean
    public Exim4LogParser exim4LogParser(PluginRegistry pluginRegistry,
                                         TimestampNormalizer timestampNormalizer,
                                         EventDispatcher eventDispatcher,
                                         @Value("${eximscanner.parser.enabled-plugins:}") String[] enabledPlugins) {
        Exim4LogParser parser = new Exim4LogParser(pluginRegistry, timestampNormalizer, eventDispatcher);
        parser.enablePlugins(parsePluginList(enabledPlugins));
        return parser;
    }

    static List<String> parsePluginList(String[] enabledPlugins) {
        if (enabledPlugins == null) {
            return List.of();
        }
        return Arrays.stream(enabledPlugins)
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .collect(Collectors.toList());
    }
}
