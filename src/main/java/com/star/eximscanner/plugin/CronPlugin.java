package com.star.eximscanner.plugin;

import com.star.eximscanner.parser.ParserMediator;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Task runs written by {@code CRON}: {@code (user) CMD (command)}.
 */
@Component
public class CronPlugin extends AbstractReporterPlugin {

    public static final String NAME = "cron";

    public static final String TASK_RUN = "syslog:cron:task_run";

    private static final Pattern TASK_RUN_PATTERN = Pattern.compile(
            "^\\((?<username>[^)]+)\\) CMD \\((?<command>.+)\\)$", Pattern.DOTALL
    );

    public CronPlugin() {
        super(NAME, "CRON");
    }

    @Override
    public PluginOutcome process(ParserMediator mediator, Instant timestamp, Map<String, Object> attributes) {
        String body = body(attributes);
        if (body == null) {
            return PluginOutcome.DECLINED;
        }

        Matcher matcher = TASK_RUN_PATTERN.matcher(body);
        if (!matcher.matches()) {
            return PluginOutcome.DECLINED;
        }
        return emit(mediator, TASK_RUN, timestamp, attributes, matcher, "username", "command");
    }

    @Override
    public String getDescription() {
        return "Cron task runs";
    }
}
