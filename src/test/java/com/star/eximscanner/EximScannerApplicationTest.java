package com.star.eximscanner;

import com.star.eximscanner.parser.Exim4LogParser;
import com.star.eximscanner.plugin.PluginRegistry;
import com.star.eximscanner.service.LogParsingService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class EximScannerApplicationTest {

    @Autowired
    private Exim4LogParser parser;

    @Autowired
    private PluginRegistry pluginRegistry;

    @Autowired
    private LogParsingService logParsingService;

    @Test
    @DisplayName("Should enable the configured plugins at startup")
    void shouldEnableConfiguredPlugins() {
        assertEquals(List.of("cron", "ssh"), pluginRegistry.getAvailablePlugins().stream().sorted().toList());
        assertEquals(Set.of("sshd"), parser.getEnabledPlugins().reporters());
        assertNotNull(logParsingService);
    }
}
