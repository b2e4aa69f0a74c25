package com.star.eximscanner.plugin;

import com.star.eximscanner.parser.ParserMediator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Login, failed login and connection records written by {@code sshd}.
 */
@Component
@Slf4j
public class SshdPlugin extends AbstractReporterPlugin {

    public static final String NAME = "ssh";

    public static final String LOGIN = "syslog:ssh:login";
    public static final String FAILED_CONNECTION = "syslog:ssh:failed_connection";
    public static final String OPENED_CONNECTION = "syslog:ssh:opened_connection";

    private static final Pattern LOGIN_PATTERN = Pattern.compile(
            "^Accepted (?<authenticationMethod>\\S+) for (?<username>\\S+) " +
            "from (?<address>\\S+) port (?<port>\\d+)(?: (?<protocol>ssh\\d?))?" +
            "(?:: (?<fingerprint>.+))?$"
    );

    private static final Pattern FAILED_PATTERN = Pattern.compile(
            "^Failed (?<authenticationMethod>\\S+) for (?:invalid user )?(?<username>\\S+) " +
            "from (?<address>\\S+) port (?<port>\\d+)(?: (?<protocol>ssh\\d?))?$"
    );

    private static final Pattern CONNECTION_PATTERN = Pattern.compile(
            "^Connection from (?<address>\\S+) port (?<port>\\d+)(?: on \\S+ port \\d+)?$"
    );

    public SshdPlugin() {
        super(NAME, "sshd");
    }

    @Override
    public PluginOutcome process(ParserMediator mediator, Instant timestamp, Map<String, Object> attributes) {
        String body = body(attributes);
        if (body == null) {
            return PluginOutcome.DECLINED;
        }

        Matcher matcher = LOGIN_PATTERN.matcher(body);
        if (matcher.matches()) {
            return emit(mediator, LOGIN, timestamp, attributes, matcher,
                    "authenticationMethod", "username", "address", "port", "protocol", "fingerprint");
        }

        matcher = FAILED_PATTERN.matcher(body);
        if (matcher.matches()) {
            return emit(mediator, FAILED_CONNECTION, timestamp, attributes, matcher,
                    "authenticationMethod", "username", "address", "port", "protocol");
        }

        matcher = CONNECTION_PATTERN.matcher(body);
        if (matcher.matches()) {
            return emit(mediator, OPENED_CONNECTION, timestamp, attributes, matcher,
                    "address", "port");
        }

        log.debug("Unrecognized sshd record: {}", body);
        return PluginOutcome.DECLINED;
    }

    @Override
    public String getDescription() {
        return "SSH login and connection records";
    }
}
