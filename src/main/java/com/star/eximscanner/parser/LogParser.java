package com.star.eximscanner.parser;

import java.util.Collection;
import java.util.List;

public interface LogParser {

    boolean verifyStructure(String line);

    void enablePlugins(Collection<String> pluginIncludes);

    /**
     * Produces the event for an already matched record.
     *
     * @throws com.star.eximscanner.exception.UnableToParseFileException if
     *         {@code structureKey} is not one of {@link #getSupportedKeys()}
     */
    void parseRecord(ParserMediator mediator, String structureKey, ParsedRecord record);

    ParseResult parseLineUnit(String unit, long lineNumber, ParseContext context);

    /**
     * Whether {@code line} starts a new record, as opposed to continuing the
     * body of the previous one.
     */
    boolean isRecordStart(String line);

    List<String> getSupportedKeys();

    String getSupportedFormat();

    default String getDescription() {
        return "Log parser for " + getSupportedFormat() + " format";
    }
}
