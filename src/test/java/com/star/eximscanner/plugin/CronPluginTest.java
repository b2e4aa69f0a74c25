package com.star.eximscanner.plugin;

import com.star.eximscanner.event.NormalizedEvent;
import com.star.eximscanner.parser.ParseContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CronPluginTest {

    private static final Instant TIMESTAMP = Instant.parse("2016-05-12T10:17:01Z");

    private CronPlugin plugin;
    private List<NormalizedEvent> events;
    private ParseContext context;

    @BeforeEach
    void setUp() {
        plugin = new CronPlugin();
        events = new ArrayList<>();
        context = new ParseContext(events::add);
    }

    @Test
    @DisplayName("Should emit a task run event")
    void shouldEmitTaskRun() {
        PluginOutcome outcome = plugin.process(context, TIMESTAMP,
                Map.of("body", "(root) CMD (   cd / && run-parts --report /etc/cron.hourly)"));

        assertEquals(PluginOutcome.EMITTED, outcome);
        NormalizedEvent event = events.get(0);
        assertEquals(CronPlugin.TASK_RUN, event.getDataType());
        assertEquals("root", event.getAttribute("username"));
        assertEquals("   cd / && run-parts --report /etc/cron.hourly", event.getAttribute("command"));
        assertEquals("CRON", event.getAttribute("reporter"));
    }

    @Test
    @DisplayName("Should decline other cron records")
    void shouldDeclineOtherRecords() {
        PluginOutcome outcome = plugin.process(context, TIMESTAMP,
                Map.of("body", "pam_unix(cron:session): session opened for user root by (uid=0)"));

        assertEquals(PluginOutcome.DECLINED, outcome);
        assertTrue(events.isEmpty());
    }

    @Test
    @DisplayName("Should expose name and reporter")
    void shouldExposeIdentity() {
        assertEquals("cron", plugin.getName());
        assertEquals("CRON", plugin.getReporter());
    }
}
