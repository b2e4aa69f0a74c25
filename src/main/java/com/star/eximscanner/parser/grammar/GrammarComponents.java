package com.star.eximscanner.parser.grammar;

import java.util.Set;

/**
 * Reusable regex fragments that line grammars are composed from.
 *
 * <p>Every fragment is a self-contained regex source string. Fragments that
 * capture use named groups so a {@link LineGrammar} can read fields back
 * by name regardless of how the fragments were combined.
 *
 * @author Eshmamatov Obidjon
 */
public final class GrammarComponents {

    public static final String YEAR = "year";
    public static final String MONTH = "month";
    public static final String DAY = "day";
    public static final String HOUR = "hour";
    public static final String MINUTE = "minute";
    public static final String SECOND = "second";
    public static final String FACILITY = "facility";
    public static final String REPORTER = "reporter";
    public static final String PID = "pid";
    public static final String BODY = "body";

    /**
     * ASCII printables without the space: {@code 0x21} through {@code 0x7E}.
     */
    public static final String PRINTABLES = printables();

    // Reporter and facility may hold any printable character, except the
    // delimiters syslog-like formats put around them.
    public static final String REPORTER_CHARACTERS = printablesExcept(':', '[', '<');

    public static final String FACILITY_CHARACTERS = printablesExcept(':', '>');

    private static final String DATE_TIME_SEPARATOR = "[ \\t]+";

    /**
     * {@code yyyy-MM-dd HH:mm:ss} without captures, used for boundaries and probes.
     */
    public static final String ISO_DATE_TIME_PREFIX = "\\d{4}-\\d{2}-\\d{2}" + DATE_TIME_SEPARATOR + "\\d{2}:\\d{2}:\\d{2}";

    /**
     * {@code MMM d HH:mm:ss}, the three-letter-month prefix of syslog-style lines.
     */
    public static final String MONTH_NAME_DATE_TIME_PREFIX = "\\w{3}\\s+\\d{1,2}\\s\\d{2}:\\d{2}:\\d{2}";

    private GrammarComponents() {
    }

    public static String fourDigits(String name) {
        return "(?<" + name + ">\\d{4})";
    }

    public static String twoDigits(String name) {
        return "(?<" + name + ">\\d{2})";
    }

    /**
     * {@code yyyy-MM-dd HH:mm:ss} with every field captured.
     */
    public static String dateTime() {
        return fourDigits(YEAR) + "-" + twoDigits(MONTH) + "-" + twoDigits(DAY)
                + DATE_TIME_SEPARATOR
                + twoDigits(HOUR) + ":" + twoDigits(MINUTE) + ":" + twoDigits(SECOND);
    }

    /**
     * Optional {@code <facility>} token followed by blanks.
     */
    public static String optionalFacility() {
        return "(?:<(?<" + FACILITY + ">" + characterClass(FACILITY_CHARACTERS) + "+)>[ \\t]*)?";
    }

    /**
     * Optional {@code reporter[pid]:} prefix. The colon must be followed by
     * a blank or the end of the line, otherwise the text belongs to the body.
     */
    public static String optionalReporter() {
        return "(?:(?<" + REPORTER + ">" + characterClass(REPORTER_CHARACTERS) + "+)"
                + "(?:\\[(?<" + PID + ">\\d+)\\])?"
                + ":(?=[ \\t]|\\r?\\n|\\z)[ \\t]*)?";
    }

    /**
     * Non-greedy, multi-line body. It stops before end of input (one trailing
     * line break is left outside the body) or before a line break that is
     * followed by one of the given record prefixes.
     */
    public static String body(String... nextRecordPrefixes) {
        StringBuilder boundary = new StringBuilder("(?=\\r?\\n?\\z");
        for (String prefix : nextRecordPrefixes) {
            boundary.append("|\\r?\\n(?:").append(prefix).append(")");
        }
        boundary.append(")");
        return "(?s:(?<" + BODY + ">.*?))" + boundary;
    }

    /**
     * Builds a regex character class holding exactly the given characters,
     * quoting every one of them.
     */
    public static String characterClass(String characters) {
        StringBuilder sb = new StringBuilder("[");
        for (char c : characters.toCharArray()) {
            if (Character.isLetterOrDigit(c)) {
                sb.append(c);
            } else {
                sb.append('\\').append(c);
            }
        }
        return sb.append(']').toString();
    }

    public static String printablesExcept(Character... excluded) {
        Set<Character> skip = Set.of(excluded);
        StringBuilder sb = new StringBuilder();
        for (char c : PRINTABLES.toCharArray()) {
            if (!skip.contains(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static String printables() {
        StringBuilder sb = new StringBuilder();
        for (char c = 0x21; c <= 0x7E; c++) {
            sb.append(c);
        }
        return sb.toString();
    }
}
