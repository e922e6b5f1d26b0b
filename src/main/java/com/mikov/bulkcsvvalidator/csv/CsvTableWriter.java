package com.mikov.bulkcsvvalidator.csv;

import com.mikov.bulkcsvvalidator.exception.StorageException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Serializes a header and rows back to comma separated bytes.
 */
@Component
public class CsvTableWriter {

    public byte[] write(final List<String> header, final List<List<String>> rows) {
        final var out = new ByteArrayOutputStream();
        try (var printer = new CSVPrinter(new OutputStreamWriter(out, StandardCharsets.UTF_8), CSVFormat.DEFAULT)) {
            printer.printRecord(header);
            for (final var row : rows) {
                printer.printRecord(row);
            }
        } catch (final IOException e) {
            throw new StorageException("Failed to serialize CSV output", e);
        }
        return out.toByteArray();
    }
}
