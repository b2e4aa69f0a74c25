package com.star.eximscanner.processor;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.BiConsumer;
import java.util.function.BooleanSupplier;

@Slf4j
public class FileStreamProcessor {

    private static final int PROGRESS_INTERVAL = 10_000; // Log progress every N lines

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final Charset charset;
    private final BooleanSupplier stopCondition;
    private final int progressInterval;

    @Getter
    public static class ProcessingStats {
        private long totalLines;
        private long processingTimeMs;
        private boolean stopped;

        public double getLinesPerSecond() {
            return processingTimeMs > 0 ? (totalLines * 1000.0) / processingTimeMs : 0;
        }

        @Override
        public String toString() {
            return String.format(
                    "ProcessingStats{lines=%d, timeMs=%d, lps=%.2f, stopped=%s}",
                    totalLines, processingTimeMs, getLinesPerSecond(), stopped);
        }
    }

    private FileStreamProcessor(Builder builder) {
        this.charset = builder.charset;
        this.stopCondition = builder.stopCondition;
        this.progressInterval = builder.progressInterval;
    }

    // Process a file line by line, polling the stop condition before every line.
    public ProcessingStats processFile(Path filePath,
                                       BiConsumer<String, Long> lineHandler) throws IOException {
        if (!Files.exists(filePath)) {
            throw new IOException("File not found: " + filePath);
        }

        ProcessingStats stats = new ProcessingStats();
        long startTime = System.currentTimeMillis();
        long lineNumber = 0;

        try (BufferedReader reader = openReader(filePath)) {
            String line;

            while ((line = reader.readLine()) != null) {
                if (stopCondition.getAsBoolean()) {
                    stats.stopped = true;
                    break;
                }

                lineNumber++;
                if (lineNumber == 1) {
                    line = stripByteOrderMark(line);
                }

                lineHandler.accept(line, lineNumber);

                if (lineNumber % progressInterval == 0) {
                    log.debug("Read {} lines of {}", lineNumber, filePath.getFileName());
                }
            }
        }

        stats.totalLines = lineNumber;
        stats.processingTimeMs = System.currentTimeMillis() - startTime;

        log.info("Processed {} lines in {} ms ({} lines/sec)",
                lineNumber, stats.processingTimeMs,
                String.format("%.2f", stats.getLinesPerSecond()));

        return stats;
    }

    /**
     * Returns the first non-blank line, or {@code null} for a file without one.
     */
    public String readFirstLine(Path filePath) throws IOException {
        try (BufferedReader reader = openReader(filePath)) {
            String line;
            boolean first = true;
            while ((line = reader.readLine()) != null) {
                if (first) {
                    line = stripByteOrderMark(line);
                    first = false;
                }
                if (!line.isBlank()) {
                    return line;
                }
            }
            return null;
        }
    }

    public boolean isReadable(Path filePath) {
        return Files.exists(filePath) && Files.isReadable(filePath);
    }

    // Detect file encoding from its byte order mark, falling back to the default.
    public static Charset detectEncoding(Path filePath, Charset fallback) {
        byte[] bytes = new byte[3];
        int read;
        try (InputStream in = Files.newInputStream(filePath)) {
            read = in.readNBytes(bytes, 0, bytes.length);
        } catch (IOException e) {
            log.debug("Could not detect encoding, using {}: {}", fallback, e.getMessage());
            return fallback;
        }

        if (read >= 3 &&
            bytes[0] == (byte) 0xEF &&
            bytes[1] == (byte) 0xBB &&
            bytes[2] == (byte) 0xBF) {
            return StandardCharsets.UTF_8;
        }

        if (read >= 2) {
            if (bytes[0] == (byte) 0xFE && bytes[1] == (byte) 0xFF) {
                return StandardCharsets.UTF_16BE;
            }
            if (bytes[0] == (byte) 0xFF && bytes[1] == (byte) 0xFE) {
                return StandardCharsets.UTF_16LE;
            }
        }

        return fallback;
    }

    // Malformed bytes become U+FFFD so one bad line cannot fail the whole file.
    private BufferedReader openReader(Path filePath) throws IOException {
        CharsetDecoder decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        return new BufferedReader(new InputStreamReader(Files.newInputStream(filePath), decoder));
    }

    private static String stripByteOrderMark(String line) {
        if (!line.isEmpty() && line.charAt(0) == BYTE_ORDER_MARK) {
            return line.substring(1);
        }
        return line;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Charset charset = StandardCharsets.UTF_8;
        private BooleanSupplier stopCondition = () -> false;
        private int progressInterval = PROGRESS_INTERVAL;

        // Set character encoding.
        public Builder charset(Charset charset) {
            this.charset = charset != null ? charset : StandardCharsets.UTF_8;
            return this;
        }

        public Builder stopCondition(BooleanSupplier stopCondition) {
            this.stopCondition = stopCondition != null ? stopCondition : () -> false;
            return this;
        }

        public Builder progressInterval(int interval) {
            this.progressInterval = Math.max(1, interval);
            return this;
        }

        public FileStreamProcessor build() {
            return new FileStreamProcessor(this);
        }
    }
}
