package com.mikov.bulkcsvvalidator.csv;

import com.mikov.bulkcsvvalidator.config.PipelineSettings;
import com.mikov.bulkcsvvalidator.dtos.ParsedTable;
import com.mikov.bulkcsvvalidator.dtos.TableSplit;
import com.mikov.bulkcsvvalidator.exception.ColumnNotEmailException;
import com.mikov.bulkcsvvalidator.exception.InvalidColumnException;
import com.mikov.bulkcsvvalidator.exception.MalformedTableException;
import com.mikov.bulkcsvvalidator.model.EmailRecord;
import com.mikov.bulkcsvvalidator.validation.AddressPreFilter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Parses delimited text into header and rows, locates the address column and splits it out.
 *
 * @author zahari.mikov
 */
@Slf4j
@Component
public class TabularSplitter {
    public static final String EMAIL_HEADER = "email";

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setIgnoreEmptyLines(true)
        .build();
    private static final CSVFormat EXTRACT_FORMAT = CSVFormat.DEFAULT.builder()
        .setIgnoreEmptyLines(false)
        .build();
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final int columnSampleSize;

    public TabularSplitter(final PipelineSettings settings) {
        this.columnSampleSize = settings.getColumnSampleSize();
    }

    /**
     * Parses the whole input. The first non-empty line is the header.
     */
    public ParsedTable parse(final byte[] content) {
        if (content == null || content.length == 0) {
            throw new MalformedTableException("CSV file is empty");
        }
        final var reader = new InputStreamReader(new ByteArrayInputStream(content), StandardCharsets.UTF_8);
        try (var parser = CSVParser.parse(reader, FORMAT)) {
            List<String> header = null;
            final var rows = new ArrayList<List<String>>();
            for (final CSVRecord record : parser) {
                final var fields = new ArrayList<String>(record.size());
                record.forEach(fields::add);
                if (header == null) {
                    header = stripByteOrderMark(fields);
                } else {
                    rows.add(fields);
                }
            }
            if (header == null) {
                throw new MalformedTableException("CSV file has no header row");
            }
            final var table = new ParsedTable(header, rows);
            if (table.isInconsistentColumns()) {
                log.warn("CSV file has rows whose column count differs from the header ({} columns)", header.size());
            }
            log.debug("Parsed CSV with {} columns and {} data rows", table.fieldCount(), table.rowCount());
            return table;
        } catch (final IOException | UncheckedIOException | IllegalStateException e) {
            throw new MalformedTableException("CSV file could not be parsed: " + e.getMessage(), e);
        }
    }

    /**
     * Parses an extract written by {@link CsvTableWriter}. Every line is a record: a blank line is a
     * row without fields, which is what a residual extract holds once its only column was removed.
     */
    public ParsedTable parseExtract(final byte[] content) {
        if (content == null || content.length == 0) {
            throw new MalformedTableException("Stored extract is empty");
        }
        final var text = new String(content, StandardCharsets.UTF_8);
        try (var parser = CSVParser.parse(text, EXTRACT_FORMAT)) {
            List<String> header = null;
            final var rows = new ArrayList<List<String>>();
            for (final CSVRecord record : parser) {
                final var fields = new ArrayList<String>(record.size());
                if (!isBlankLine(text, record.getCharacterPosition())) {
                    record.forEach(fields::add);
                }
                if (header == null) {
                    header = fields;
                } else {
                    rows.add(fields);
                }
            }
            if (header == null) {
                throw new MalformedTableException("Stored extract has no header row");
            }
            return new ParsedTable(header, rows);
        } catch (final IOException | UncheckedIOException | IllegalStateException e) {
            throw new MalformedTableException("Stored extract could not be parsed: " + e.getMessage(), e);
        }
    }

    /**
     * Checks that {@code declaredIndex} names an email column and returns its header text.
     *
     * @throws InvalidColumnException when the index is outside the header
     * @throws ColumnNotEmailException when neither the header name nor the sampled values look like emails
     */
    public String locateAddressColumn(final ParsedTable table, final int declaredIndex) {
        if (declaredIndex < 0 || declaredIndex >= table.fieldCount()) {
            throw InvalidColumnException.outOfBounds(declaredIndex, table.fieldCount());
        }
        final var columnName = table.getHeader().get(declaredIndex);
        if (isEmailColumn(table, declaredIndex)) {
            return columnName;
        }
        throw new ColumnNotEmailException(declaredIndex, columnName, suggestColumns(table));
    }

    /**
     * Indices of all columns that pass the name or content heuristic.
     */
    public List<Integer> suggestColumns(final ParsedTable table) {
        final var suggestions = new ArrayList<Integer>();
        for (var i = 0; i < table.fieldCount(); i++) {
            if (isEmailColumn(table, i)) {
                suggestions.add(i);
            }
        }
        return suggestions;
    }

    /**
     * One record per data row, taken from the address column. Empty addresses are kept
     * so every row gets an outcome.
     */
    public List<EmailRecord> extractRecords(final ParsedTable table, final int columnIndex) {
        final var records = new ArrayList<EmailRecord>(table.rowCount());
        final var rows = table.getRows();
        for (var i = 0; i < rows.size(); i++) {
            records.add(new EmailRecord(ParsedTable.fieldAt(rows.get(i), columnIndex).trim(), i));
        }
        return records;
    }

    /**
     * Removes the address column into its own extract. When {@code removeEmptyEmails} is set,
     * rows without an address are dropped from both sides so the extracts stay aligned.
     */
    public TableSplit split(final ParsedTable table, final int columnIndex, final boolean removeEmptyEmails) {
        final var columnName = locateAddressColumn(table, columnIndex);
        final var residualHeader = withoutColumn(table.getHeader(), columnIndex);
        final var addresses = new ArrayList<EmailRecord>(table.rowCount());
        final var residualRows = new ArrayList<List<String>>(table.rowCount());
        var dropped = 0;
        for (final var row : table.getRows()) {
            final var address = ParsedTable.fieldAt(row, columnIndex).trim();
            if (removeEmptyEmails && AddressPreFilter.isEmptyAddress(address)) {
                dropped++;
                continue;
            }
            addresses.add(new EmailRecord(address, residualRows.size()));
            residualRows.add(padded(withoutColumn(row, columnIndex), residualHeader.size()));
        }
        if (dropped > 0) {
            log.info("Dropped {} rows without an email address", dropped);
        }
        return new TableSplit(columnName, addresses, residualHeader, residualRows, table.isInconsistentColumns());
    }

    private boolean isEmailColumn(final ParsedTable table, final int columnIndex) {
        final var name = table.getHeader().get(columnIndex);
        if (name != null && name.toLowerCase().contains(EMAIL_HEADER)) {
            return true;
        }
        var sampled = 0;
        var matching = 0;
        for (final var row : table.getRows()) {
            if (sampled >= columnSampleSize) {
                break;
            }
            final var value = ParsedTable.fieldAt(row, columnIndex);
            if (value.isBlank()) {
                continue;
            }
            sampled++;
            if (AddressPreFilter.looksLikeEmail(value)) {
                matching++;
            }
        }
        return sampled > 0 && matching * 2 >= sampled;
    }

    private static List<String> withoutColumn(final List<String> row, final int columnIndex) {
        final var copy = new ArrayList<String>(row);
        if (columnIndex < copy.size()) {
            copy.remove(columnIndex);
        }
        return copy;
    }

    /**
     * Number of distinct non-empty addresses, compared case-insensitively after trimming.
     * This is the count a preview reports and a job is charged for.
     */
    public static int countChargeableAddresses(final List<EmailRecord> records) {
        final var unique = new HashSet<String>();
        for (final var record : records) {
            if (!AddressPreFilter.isEmptyAddress(record.address())) {
                unique.add(AddressPreFilter.normalize(record.address()));
            }
        }
        return unique.size();
    }

    // short rows are widened so a residual row is never written as a blank line
    private static List<String> padded(final List<String> row, final int width) {
        while (row.size() < width) {
            row.add("");
        }
        return row;
    }

    private static boolean isBlankLine(final String text, final long position) {
        if (position >= text.length()) {
            return true;
        }
        final var first = text.charAt((int) position);
        return first == '\r' || first == '\n';
    }

    private static List<String> stripByteOrderMark(final List<String> header) {
        if (!header.isEmpty() && !header.get(0).isEmpty() && header.get(0).charAt(0) == BYTE_ORDER_MARK) {
            header.set(0, header.get(0).substring(1));
        }
        return header;
    }
}
