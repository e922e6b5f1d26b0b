package com.mikov.bulkcsvvalidator.services;

import com.mikov.bulkcsvvalidator.csv.CsvTableWriter;
import com.mikov.bulkcsvvalidator.csv.TabularSplitter;
import com.mikov.bulkcsvvalidator.model.CsvPreviewStats;
import com.mikov.bulkcsvvalidator.model.PreparedUpload;
import com.mikov.bulkcsvvalidator.storage.BlobStorageService;
import com.mikov.bulkcsvvalidator.validation.AddressPreFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Turns a raw upload into the two extracts the split-file pipeline consumes, and previews
 * what a validation run over it would cost.
 *
 * @author zahari.mikov
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UploadPreparationService {
    static final String INCONSISTENT_COLUMNS_WARNING = "The CSV file has inconsistent column counts. "
        + "The extracted emails are available, but the full file may be malformed.";

    private final TabularSplitter tabularSplitter;
    private final CsvTableWriter csvTableWriter;
    private final BlobStorageService blobStorageService;

    public CsvPreviewStats preview(final byte[] content, final int emailColumnIndex) {
        final var table = tabularSplitter.parse(content);
        final var columnName = tabularSplitter.locateAddressColumn(table, emailColumnIndex);

        final var records = tabularSplitter.extractRecords(table, emailColumnIndex);
        final var empty = (int) records.stream()
            .filter(record -> AddressPreFilter.isEmptyAddress(record.address()))
            .count();
        final var unique = TabularSplitter.countChargeableAddresses(records);
        return CsvPreviewStats.builder()
            .totalRows(table.rowCount())
            .totalEmails(unique)
            .totalEmptyEmails(empty)
            .totalDuplicateEmails(records.size() - empty - unique)
            .columnName(columnName)
            .inconsistentColumns(table.isInconsistentColumns())
            .build();
    }

    public PreparedUpload prepare(final byte[] content, final String originalFilename, final int emailColumnIndex,
                                  final boolean removeEmptyEmails) {
        final var split = tabularSplitter.split(tabularSplitter.parse(content), emailColumnIndex, removeEmptyEmails);

        final var uuid = UUID.randomUUID();
        final var baseName = baseName(originalFilename);
        final var fullFilename = baseName + "_full_" + uuid + ".csv";
        final var emailsFilename = baseName + "_emails_" + uuid + ".csv";

        final List<List<String>> emailRows = split.addresses().stream()
            .map(record -> List.of(record.address()))
            .collect(Collectors.toList());
        blobStorageService.upload(fullFilename, csvTableWriter.write(split.residualHeader(), split.residualRows()));
        blobStorageService.upload(emailsFilename, csvTableWriter.write(List.of(TabularSplitter.EMAIL_HEADER), emailRows));

        log.info("Prepared {} as {} and {} ({} emails from column {})", originalFilename, fullFilename,
            emailsFilename, emailRows.size(), split.columnName());
        final var warning = split.inconsistentColumns() ? INCONSISTENT_COLUMNS_WARNING : null;
        return new PreparedUpload(fullFilename, emailsFilename,
            TabularSplitter.countChargeableAddresses(split.addresses()), warning);
    }

    private static String baseName(final String filename) {
        final var name = filename == null || filename.isBlank() ? "upload" : filename;
        final var withoutPath = name.substring(Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\')) + 1);
        final var dot = withoutPath.lastIndexOf('.');
        final var base = dot > 0 ? withoutPath.substring(0, dot) : withoutPath;
        return base.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
