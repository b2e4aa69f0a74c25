package com.star.eximscanner.parser.grammar;

import com.star.eximscanner.parser.ParsedRecord;
import lombok.Getter;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.star.eximscanner.parser.grammar.GrammarComponents.*;

/**
 * Immutable grammar for one line structure, built from an ordered list of
 * {@link GrammarComponents} fragments.
 *
 * <p>The fragments must capture the {@code year}, {@code month}, {@code day},
 * {@code hour}, {@code minute}, {@code second} and {@code body} groups; the
 * {@code reporter}, {@code pid} and {@code facility} groups are optional.
 * Matching never throws for input that does not fit the grammar.
 *
 * @author Eshmamatov Obidjon
 */
public final class LineGrammar {

    @Getter
    private final String key;

    private final Pattern pattern;

    private final boolean hasReporter;
    private final boolean hasPid;
    private final boolean hasFacility;

    private LineGrammar(String key, List<String> components) {
        this.key = key;
        this.pattern = Pattern.compile(String.join("", components));

        String regex = pattern.pattern();
        this.hasReporter = regex.contains("(?<" + REPORTER + ">");
        this.hasPid = regex.contains("(?<" + PID + ">");
        this.hasFacility = regex.contains("(?<" + FACILITY + ">");
    }

    public static LineGrammar of(String key, String... components) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Grammar key must not be empty");
        }
        if (components.length == 0) {
            throw new IllegalArgumentException("Grammar " + key + " has no components");
        }
        return new LineGrammar(key, List.of(components));
    }

    /**
     * Matches a record that starts at the beginning of {@code text}.
     */
    public Optional<ParsedRecord> match(CharSequence text) {
        return matchAt(text, 0);
    }

    /**
     * Matches a record that starts exactly at {@code offset}.
     *
     * <p>The body of the returned record runs up to the next date-bearing
     * line or the end of {@code text}; {@link ParsedRecord#getEnd()} points
     * past the line break that terminates it, which is where the next record
     * of a buffered chunk begins.
     */
    public Optional<ParsedRecord> matchAt(CharSequence text, int offset) {
        if (text == null || offset < 0 || offset >= text.length()) {
            return Optional.empty();
        }

        Matcher matcher = pattern.matcher(text);
        matcher.region(offset, text.length());
        if (!matcher.lookingAt()) {
            return Optional.empty();
        }

        return Optional.of(ParsedRecord.builder()
                .structureKey(key)
                .year(Integer.parseInt(matcher.group(YEAR)))
                .month(Integer.parseInt(matcher.group(MONTH)))
                .day(Integer.parseInt(matcher.group(DAY)))
                .hour(Integer.parseInt(matcher.group(HOUR)))
                .minute(Integer.parseInt(matcher.group(MINUTE)))
                .second(Integer.parseInt(matcher.group(SECOND)))
                .facility(hasFacility ? matcher.group(FACILITY) : null)
                .reporter(hasReporter ? matcher.group(REPORTER) : null)
                .pid(hasPid ? matcher.group(PID) : null)
                .body(matcher.group(BODY))
                .start(offset)
                .end(skipLineBreak(text, matcher.end()))
                .build());
    }

    public boolean matches(CharSequence text) {
        return match(text).isPresent();
    }

    public String pattern() {
        return pattern.pattern();
    }

    private static int skipLineBreak(CharSequence text, int position) {
        int pos = position;
        if (pos < text.length() && text.charAt(pos) == '\r') {
            pos++;
        }
        if (pos < text.length() && text.charAt(pos) == '\n') {
            pos++;
        }
        return pos;
    }

    @Override
    public String toString() {
        return "LineGrammar{key=" + key + ", pattern=" + pattern.pattern() + "}";
    }
}
