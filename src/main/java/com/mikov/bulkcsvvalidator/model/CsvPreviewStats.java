package com.mikov.bulkcsvvalidator.model;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class CsvPreviewStats {
    private final int totalRows;
    private final int totalEmails;
    private final int totalEmptyEmails;
    private final int totalDuplicateEmails;
    private final String columnName;
    private final boolean inconsistentColumns;
}
