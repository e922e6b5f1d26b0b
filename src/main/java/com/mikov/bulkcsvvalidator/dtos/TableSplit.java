package com.mikov.bulkcsvvalidator.dtos;

import com.mikov.bulkcsvvalidator.model.EmailRecord;

import java.util.List;

/**
 * Address-only extract and the residual rows left once the address column is removed.
 * Both sides hold the same number of rows in the same order.
 *
 * @param addresses one record per residual row, indexed by residual row position
 * @param residualHeader header without the address column
 * @param residualRows data rows without the address column
 * @param inconsistentColumns whether any source row differed in width from the header
 */
public record TableSplit(String columnName,
                         List<EmailRecord> addresses,
                         List<String> residualHeader,
                         List<List<String>> residualRows,
                         boolean inconsistentColumns) {
}
