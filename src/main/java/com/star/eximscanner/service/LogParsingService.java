package com.star.eximscanner.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.star.eximscanner.entity.ParseSummary;
import com.star.eximscanner.event.EventSink;
import com.star.eximscanner.event.JsonLinesEventSink;
import com.star.eximscanner.exception.LogProcessingException;
import com.star.eximscanner.parser.LogParser;
import com.star.eximscanner.parser.ParseContext;
import com.star.eximscanner.parser.ParseResult;
import com.star.eximscanner.processor.FileStreamProcessor;
import com.star.eximscanner.processor.LineUnit;
import com.star.eximscanner.processor.LineUnitAssembler;
import lombok.RequiredArgsConstructor;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.file.Path;

/**
 * Service for running a parser over a whole log file.
 *
 * <p>This service is responsible ONLY for:
 * <ul>
 *   <li>Verifying the first line before committing to a full parse</li>
 *   <li>Streaming the file and assembling line units</li>
 *   <li>Applying the skip/abort policy to failed and skipped units</li>
 *   <li>Summarizing the pass</li>
 * </ul>
 * Events go straight from the parser to the context's sink.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LogParsingService {

    private final LogParser parser;
    private final ObjectMapper objectMapper;

    @Setter
    @Value("${eximscanner.parser.timezone:UTC}")
    private String timezone = "UTC";

    @Setter
    @Value("${eximscanner.parser.encoding:UTF-8}")
    private String encoding = "UTF-8";

    @Setter
    @Value("${eximscanner.parser.max-line-length:100000}")
    private int maxLineLength = 100_000;

    @Setter
    @Value("${eximscanner.parser.max-consecutive-failures:20}")
    private int maxConsecutiveFailures = 20;

    @Setter
    @Value("${eximscanner.parser.abort-on-invalid-timestamp:false}")
    private boolean abortOnInvalidTimestamp = false;

    public ParseSummary parseFile(Path filePath, EventSink sink) {
        ParseContext context = ParseContext.builder()
                .sink(sink)
                .timezone(timezone)
                .fileName(filePath.getFileName().toString())
                .maxLineLength(maxLineLength)
                .abortOnInvalidTimestamp(abortOnInvalidTimestamp)
                .build();
        return parseFile(filePath, context);
    }

    /**
     * Parses {@code filePath} and writes every event to {@code output} as one
     * JSON document per line. The writer is flushed but not closed.
     */
    public ParseSummary parseFileToJsonLines(Path filePath, Writer output) {
        JsonLinesEventSink sink = new JsonLinesEventSink(objectMapper, output);
        ParseSummary summary = parseFile(filePath, sink);
        sink.flush();
        log.debug("Wrote {} events of {} as JSON lines", sink.getWritten(), filePath.getFileName());
        return summary;
    }

    public ParseSummary parseFile(Path filePath, ParseContext context) {
        long startTime = System.currentTimeMillis();
        String fileName = filePath.getFileName().toString();

        Charset charset = FileStreamProcessor.detectEncoding(filePath, Charset.forName(encoding));
        FileStreamProcessor fileProcessor = FileStreamProcessor.builder()
                .charset(charset)
                .stopCondition(context::isAbortRequested)
                .build();

        if (!fileProcessor.isReadable(filePath)) {
            throw new LogProcessingException("Cannot read log file: " + filePath);
        }

        try {
            String firstLine = fileProcessor.readFirstLine(filePath);
            if (!parser.verifyStructure(firstLine)) {
                log.info("Skipping {}: not in {} format", fileName, parser.getSupportedFormat());
                return ParseSummary.notSupported(fileName, parser.getSupportedFormat());
            }

            log.info("Parsing {} with {} parser ({})", fileName, parser.getSupportedFormat(), charset);

            ParseSummary summary = new ParseSummary();
            summary.setFileName(fileName);
            summary.setParserFormat(parser.getSupportedFormat());
            summary.setStatus(ParseSummary.Status.COMPLETED);

            LineUnitAssembler assembler = new LineUnitAssembler(parser::isRecordStart);
            int[] consecutiveFailures = {0}; // Array for lambda capture

            FileStreamProcessor.ProcessingStats stats = fileProcessor.processFile(filePath,
                    (line, lineNumber) -> assembler.offer(line, lineNumber)
                            .ifPresent(unit -> handleUnit(unit, context, summary, consecutiveFailures)));

            if (!context.isAbortRequested()) {
                assembler.flush().ifPresent(unit -> handleUnit(unit, context, summary, consecutiveFailures));
            }

            summary.setTotalLines(stats.getTotalLines());
            summary.setTotalUnits(context.getTotalUnitsProcessed());
            summary.setSuccessfulUnits(context.getSuccessfulUnits());
            summary.setFailedUnits(context.getFailedUnits());
            summary.setSkippedUnits(context.getSkippedUnits());
            summary.setMultiLineUnits(context.getMultiLineUnits());
            summary.setEventsProduced(context.getEventsProduced());
            if (context.isAbortRequested() && summary.getStatus() == ParseSummary.Status.COMPLETED) {
                summary.setStatus(ParseSummary.Status.ABORTED);
            }
            summary.setProcessingTimeMs(System.currentTimeMillis() - startTime);

            log.info("Finished {}: status={}, units={}, events={}, failed={}, skipped={}",
                    fileName, summary.getStatus(), summary.getTotalUnits(),
                    summary.getEventsProduced(), summary.getFailedUnits(), summary.getSkippedUnits());

            return summary;

        } catch (IOException e) {
            log.error("Failed to read {}: {}", fileName, e.getMessage(), e);
            throw new LogProcessingException("Failed to parse log file: " + fileName, e);
        }
    }

    private void handleUnit(LineUnit unit, ParseContext context,
                            ParseSummary summary, int[] consecutiveFailures) {
        if (unit.isMultiLine()) {
            context.recordMultiLine();
        }

        ParseResult result = parser.parseLineUnit(unit.getText(), unit.getFirstLineNumber(), context);

        switch (result.getStatus()) {
            case SUCCESS -> {
                consecutiveFailures[0] = 0;
                summary.recordDispatch(result.getDispatchOutcome());
            }

            case FAILED -> {
                consecutiveFailures[0]++;
                log.debug("Parse failed at line {}: {}",
                        result.getLineNumber(), result.getErrorMessage());
                if (maxConsecutiveFailures > 0 && consecutiveFailures[0] >= maxConsecutiveFailures) {
                    log.warn("Stopping {} after {} consecutive unparsable lines (last at line {})",
                            summary.getFileName(), consecutiveFailures[0], result.getLineNumber());
                    summary.setStatus(ParseSummary.Status.TOO_MANY_FAILURES);
                    context.requestAbort();
                }
            }

            case SKIPPED -> {
                log.debug("Skipped line {}: {}",
                        result.getLineNumber(), result.getAdditionalInfo());
                if (context.isAbortOnInvalidTimestamp()) {
                    log.warn("Aborting {} at line {}: {}",
                            summary.getFileName(), result.getLineNumber(), result.getAdditionalInfo());
                    summary.setStatus(ParseSummary.Status.ABORTED);
                    context.requestAbort();
                }
            }

            case ABORTED -> {
                // Abort was requested by the caller; nothing more to do.
            }
        }
    }
}
