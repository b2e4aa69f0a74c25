package com.star.eximscanner.parser;

import lombok.Builder;
import lombok.Value;

/**
 * Fields extracted from one line unit by a line grammar.
 *
 * <p>Date and time fields are raw values; whether they form a valid calendar
 * date is decided later by the timestamp normalizer. {@code start} and
 * {@code end} delimit the matched record within the text it was matched in.
 */
@Value
@Builder
public class ParsedRecord {

    String structureKey;

    int year;
    int month;
    int day;
    int hour;
    int minute;
    int second;

    String facility;

    String reporter;

    String pid;

    String body;

    int start;

    int end;
}
