package com.star.eximscanner.parser;

import com.star.eximscanner.dispatch.DispatchOutcome;
import com.star.eximscanner.dispatch.EventDispatcher;
import com.star.eximscanner.exception.InvalidTimestampException;
import com.star.eximscanner.exception.UnableToParseFileException;
import com.star.eximscanner.parser.grammar.LineGrammar;
import com.star.eximscanner.plugin.EnabledPlugins;
import com.star.eximscanner.plugin.PluginRegistry;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static com.star.eximscanner.parser.grammar.GrammarComponents.*;

/**
 * Parser for exim4 formatted log files.
 *
 * <p>Example lines:
 * <ul>
 *   <li>{@code 2016-05-12 10:15:30 1azZ5T-0003ZU-9c <= user@example.com H=mail.example.com}</li>
 *   <li>{@code 2016-05-12 10:15:31 sshd[4121]: Accepted password for root from 10.0.0.1 port 2222 ssh2}</li>
 * </ul>
 *
 * <p>A record starts with a {@code yyyy-MM-dd HH:mm:ss} prefix and its body
 * may continue over following lines, up to the next line that starts with a
 * date. When the body begins with {@code reporter[pid]:} the reporter selects
 * a {@link com.star.eximscanner.plugin.ReporterPlugin}; every other record
 * becomes a generic {@code exim4:line} event.
 *
 * <p>Call {@link #enablePlugins(Collection)} before parsing. Enabling and
 * parsing must not overlap.
 *
 * @author Eshmamatov Obidjon
 */
@Slf4j
public class Exim4LogParser implements LogParser {

    public static final String FORMAT = "EXIM4";

    public static final String EXIM4_LINE = "exim4_line";

    public static final String ATTRIBUTE_BODY = "body";
    public static final String ATTRIBUTE_PID = "pid";
    public static final String ATTRIBUTE_FACILITY = "facility";

    private static final String VERIFICATION_REGEX =
            "^\\d{4}-\\d{2}-\\d{2}\\s\\d{2}:\\d{2}:\\d{2}\\s";

    private static final Pattern RECORD_START = Pattern.compile(
            "^(?:" + ISO_DATE_TIME_PREFIX + "|" + MONTH_NAME_DATE_TIME_PREFIX + ")");

    private static final LineGrammar EXIM4_LINE_GRAMMAR = LineGrammar.of(
            EXIM4_LINE,
            dateTime(),
            ":?[ \\t]*",
            optionalFacility(),
            optionalReporter(),
            body(ISO_DATE_TIME_PREFIX, MONTH_NAME_DATE_TIME_PREFIX));

    private static final List<LineGrammar> LINE_STRUCTURES = List.of(EXIM4_LINE_GRAMMAR);

    private static final Set<String> SUPPORTED_KEYS = LINE_STRUCTURES.stream()
            .map(LineGrammar::getKey)
            .collect(Collectors.toUnmodifiableSet());

    private final PluginRegistry pluginRegistry;
    private final TimestampNormalizer timestampNormalizer;
    private final EventDispatcher eventDispatcher;
    private final FormatVerifier formatVerifier;

    @Getter
    private EnabledPlugins enabledPlugins = EnabledPlugins.none();

    public Exim4LogParser(PluginRegistry pluginRegistry,
                          TimestampNormalizer timestampNormalizer,
                          EventDispatcher eventDispatcher) {
        this.pluginRegistry = pluginRegistry;
        this.timestampNormalizer = timestampNormalizer;
        this.eventDispatcher = eventDispatcher;
        this.formatVerifier = new FormatVerifier(VERIFICATION_REGEX);
    }

    @Override
    public boolean verifyStructure(String line) {
        return formatVerifier.verify(line);
    }

    @Override
    public void enablePlugins(Collection<String> pluginIncludes) {
        this.enabledPlugins = pluginRegistry.enablePlugins(pluginIncludes);
        log.info("{} parser enabled plugins for reporters {}", FORMAT, enabledPlugins.reporters());
    }

    @Override
    public void parseRecord(ParserMediator mediator, String structureKey, ParsedRecord record) {
        dispatchRecord(mediator, structureKey, record);
    }

    /**
     * Parses the first record of {@code unit}. A unit is one line that starts
     * a record plus the continuation lines that belong to its body.
     */
    @Override
    public ParseResult parseLineUnit(String unit, long lineNumber, ParseContext context) {
        if (context.isAbortRequested()) {
            return ParseResult.aborted(lineNumber);
        }

        if (unit == null || unit.isBlank()) {
            context.recordSkipped();
            return ParseResult.skipped(lineNumber, unit, "Empty line");
        }

        String text = unit;
        int maxLength = context.getMaxLineLength();
        if (text.length() > maxLength) {
            log.warn("Line {} exceeds maximum length ({} > {}), truncating",
                    lineNumber, text.length(), maxLength);
            text = text.substring(0, maxLength);
        }

        for (LineGrammar grammar : LINE_STRUCTURES) {
            Optional<ParsedRecord> match = grammar.match(text);
            if (match.isEmpty()) {
                continue;
            }

            ParsedRecord record = match.get();
            if (record.getEnd() < text.length()) {
                log.debug("Line {} holds more than one record, ignoring text after offset {}",
                        lineNumber, record.getEnd());
            }

            try {
                DispatchOutcome outcome = dispatchRecord(context, grammar.getKey(), record);
                context.recordSuccess();
                return ParseResult.success(record, outcome, lineNumber);
            } catch (InvalidTimestampException e) {
                log.debug("Skipping line {}: {}", lineNumber, e.getMessage());
                context.recordSkipped();
                return ParseResult.skipped(lineNumber, unit, e.getMessage());
            }
        }

        context.recordFailure();
        return ParseResult.failed(lineNumber, unit, "Line does not match any " + FORMAT + " structure");
    }

    @Override
    public boolean isRecordStart(String line) {
        return line != null && RECORD_START.matcher(line).lookingAt();
    }

    @Override
    public List<String> getSupportedKeys() {
        return LINE_STRUCTURES.stream()
                .map(LineGrammar::getKey)
                .collect(Collectors.toList());
    }

    @Override
    public String getSupportedFormat() {
        return FORMAT;
    }

    @Override
    public String getDescription() {
        return "Exim4 log parser";
    }

    public Optional<LineGrammar> getGrammar(String structureKey) {
        return LINE_STRUCTURES.stream()
                .filter(g -> g.getKey().equals(structureKey))
                .findFirst();
    }

    private DispatchOutcome dispatchRecord(ParserMediator mediator, String structureKey, ParsedRecord record) {
        if (!SUPPORTED_KEYS.contains(structureKey)) {
            throw UnableToParseFileException.unsupportedKey(structureKey);
        }

        Instant timestamp = timestampNormalizer.normalize(record, mediator.getTimezone());

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(ATTRIBUTE_BODY, record.getBody());
        if (record.getPid() != null) {
            attributes.put(ATTRIBUTE_PID, record.getPid());
        }
        if (record.getFacility() != null) {
            attributes.put(ATTRIBUTE_FACILITY, record.getFacility());
        }

        return eventDispatcher.dispatch(mediator, enabledPlugins, record.getReporter(),
                timestamp, Collections.unmodifiableMap(attributes));
    }
}
