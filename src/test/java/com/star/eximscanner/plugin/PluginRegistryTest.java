package com.star.eximscanner.plugin;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PluginRegistryTest {

    private PluginRegistry registry;
    private SshdPlugin sshd;
    private CronPlugin cron;

    @BeforeEach
    void setUp() {
        sshd = new SshdPlugin();
        cron = new CronPlugin();
        registry = new PluginRegistry(List.of(sshd, cron));
    }

    @Nested
    @DisplayName("Enable Tests")
    class EnableTests {

        @Test
        @DisplayName("Should enable all plugins for an empty list")
        void shouldEnableAllForEmptyList() {
            EnabledPlugins enabled = registry.enablePlugins(List.of());

            assertEquals(Set.of("sshd", "CRON"), enabled.reporters());
            assertSame(sshd, enabled.forReporter("sshd").orElseThrow());
            assertSame(cron, enabled.forReporter("CRON").orElseThrow());
        }

        @Test
        @DisplayName("Should enable all plugins for a null list")
        void shouldEnableAllForNull() {
            assertEquals(2, registry.enablePlugins(null).size());
        }

        @Test
        @DisplayName("Should enable only the listed plugins")
        void shouldEnableOnlyListed() {
            EnabledPlugins all = registry.enablePlugins(List.of());
            EnabledPlugins onlySsh = registry.enablePlugins(List.of(SshdPlugin.NAME));

            assertEquals(Set.of("sshd"), onlySsh.reporters());
            assertTrue(onlySsh.forReporter("CRON").isEmpty());
            assertEquals(2, all.size());
        }

        @Test
        @DisplayName("Should ignore unknown plugin names")
        void shouldIgnoreUnknownNames() {
            EnabledPlugins enabled = registry.enablePlugins(List.of("nope", CronPlugin.NAME));

            assertEquals(Set.of("CRON"), enabled.reporters());
        }

        @Test
        @DisplayName("Should enable nothing when no listed name is known")
        void shouldEnableNothingForUnknownNamesOnly() {
            assertTrue(registry.enablePlugins(List.of("nope")).isEmpty());
        }

        @Test
        @DisplayName("Should let the later plugin win a shared reporter")
        void shouldLetLaterPluginWinSharedReporter() {
            RecordingPlugin first = RecordingPlugin.declining("first", "shared");
            RecordingPlugin second = RecordingPlugin.accepting("second", "shared");
            PluginRegistry shared = new PluginRegistry(List.of(first, second));

            assertSame(second, shared.enablePlugins(List.of()).forReporter("shared").orElseThrow());
            assertSame(first, shared.enablePlugins(List.of("first")).forReporter("shared").orElseThrow());
        }
    }

    @Nested
    @DisplayName("Registry Info Tests")
    class InfoTests {

        @Test
        @DisplayName("Should list available plugins in registration order")
        void shouldListAvailablePlugins() {
            assertEquals(List.of("ssh", "cron"), registry.getAvailablePlugins());
        }

        @Test
        @DisplayName("Should not look up a null reporter")
        void shouldNotLookUpNullReporter() {
            assertTrue(registry.enablePlugins(List.of()).forReporter(null).isEmpty());
            assertTrue(EnabledPlugins.none().isEmpty());
        }
    }
}
