package com.edgesentinel.core.io;

import com.edgesentinel.core.model.FlowRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Reads flow records from a delimited table.
 *
 * <p>
 * Columns, in order: {@code timestamp, source, destination[, label]}.
 * Blank lines and lines starting with {@code #} are skipped. Cells are
 * trimmed. The first data line is skipped when the table has a header.
 * </p>
 *
 * <pre>
 * timestamp,src,dst,label
 * 1,10.0.0.1,10.0.0.2,normal
 * 2,10.0.0.1,10.0.0.3,attack
 * </pre>
 *
 * @since 1.0.0
 */
public class FlowTableReader {

    private static final Logger LOG = LoggerFactory.getLogger(FlowTableReader.class);

    private final Pattern delimiter;
    private final boolean header;

    /**
     * @param delimiter literal column separator; must not be empty
     * @param header    whether the first data line is a header
     */
    public FlowTableReader(String delimiter, boolean header) {
        Objects.requireNonNull(delimiter, "delimiter must not be null");
        if (delimiter.isEmpty()) {
            throw new IllegalArgumentException("delimiter must not be empty");
        }
        this.delimiter = Pattern.compile(Pattern.quote(delimiter));
        this.header = header;
    }

    /**
     * Comma-separated table with a header line.
     *
     * @return reader
     */
    public static FlowTableReader csv() {
        return new FlowTableReader(",", true);
    }

    /**
     * Read every record of a UTF-8 table file.
     *
     * @param path table file; must not be {@code null}
     * @return records in file order
     * @throws IllegalArgumentException if the file does not exist or a line is
     *                                  malformed
     * @throws UncheckedIOException     if reading fails
     */
    public List<FlowRecord> read(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            List<FlowRecord> records = read(reader);
            LOG.info("Read {} flow record(s) from {}", records.size(), path);
            return records;
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Flow table not found: " + path, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read flow table: " + path, e);
        }
    }

    /**
     * Read every record from a character stream. The reader is not closed.
     *
     * @param reader source of table lines
     * @return records in input order
     * @throws IllegalArgumentException if a line is malformed
     * @throws UncheckedIOException     if reading fails
     */
    public List<FlowRecord> read(Reader reader) {
        Objects.requireNonNull(reader, "reader must not be null");
        BufferedReader lines = reader instanceof BufferedReader br ? br : new BufferedReader(reader);
        List<FlowRecord> records = new ArrayList<>();
        boolean headerPending = header;
        int lineNumber = 0;
        try {
            String line;
            while ((line = lines.readLine()) != null) {
                lineNumber++;
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                if (headerPending) {
                    headerPending = false;
                    continue;
                }
                records.add(parseLine(trimmed, lineNumber));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read flow table at line " + lineNumber, e);
        }
        return records;
    }

    /**
     * Parse one data line.
     *
     * @param line       the line without its terminator
     * @param lineNumber 1-based line number, used in error messages
     * @return the record
     * @throws IllegalArgumentException if the line has too few or too many
     *                                  columns or a bad timestamp
     */
    public FlowRecord parseLine(String line, int lineNumber) {
        String[] cells = delimiter.split(line, -1);
        if (cells.length < 3 || cells.length > 4) {
            throw new IllegalArgumentException("Line " + lineNumber
                    + ": expected 3 or 4 columns (timestamp, src, dst[, label]), got "
                    + cells.length);
        }
        double timestamp;
        try {
            timestamp = Double.parseDouble(cells[0].trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Line " + lineNumber
                    + ": invalid timestamp '" + cells[0].trim() + "'", e);
        }
        if (!Double.isFinite(timestamp)) {
            throw new IllegalArgumentException("Line " + lineNumber
                    + ": timestamp must be finite, got '" + cells[0].trim() + "'");
        }
        String src = cells[1].trim();
        String dst = cells[2].trim();
        if (src.isEmpty() || dst.isEmpty()) {
            throw new IllegalArgumentException("Line " + lineNumber
                    + ": source and destination must not be blank");
        }
        String label = cells.length == 4 && !cells[3].isBlank() ? cells[3].trim() : null;
        return new FlowRecord(src, dst, timestamp, 1L, label);
    }
}
