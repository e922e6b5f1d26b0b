package com.mikov.bulkcsvvalidator.services;

import com.mikov.bulkcsvvalidator.dtos.MergeResult;
import com.mikov.bulkcsvvalidator.model.JobStats;
import com.mikov.bulkcsvvalidator.model.MergeMode;
import com.mikov.bulkcsvvalidator.model.VerifiedRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Re-attaches verification outcomes to the rows they came from and counts them.
 * Results are matched by source row index, never by their position in the result list,
 * so the output depends only on the inputs and not on which worker finished first.
 *
 * @author zahari.mikov
 */
@Component
public class ResultMerger {
    public static final String EMAIL_LABEL = "Email";
    public static final String VALIDATION_LABEL = "Email_Validation";

    public MergeResult merge(final List<String> header,
                             final List<List<String>> rows,
                             final List<VerifiedRecord> results,
                             final int columnIndex,
                             final MergeMode mode) {
        if (columnIndex < 0) {
            throw new IllegalArgumentException("Column index cannot be negative: " + columnIndex);
        }
        final var byRow = indexByRow(results, rows.size());
        final var insertAt = mode == MergeMode.ANNOTATE_IN_PLACE ? columnIndex + 1 : columnIndex;

        final var mergedHeader = insert(header, insertAt, mode == MergeMode.ANNOTATE_IN_PLACE
            ? List.of(VALIDATION_LABEL)
            : List.of(EMAIL_LABEL, VALIDATION_LABEL));

        final var stats = new JobStats(rows.size());
        final var mergedRows = new ArrayList<List<String>>(rows.size());
        for (var i = 0; i < rows.size(); i++) {
            final var verified = byRow[i];
            if (verified == null) {
                throw new IllegalStateException("No verification result for row " + i);
            }
            final var outcome = verified.outcome();
            final var inserted = mode == MergeMode.ANNOTATE_IN_PLACE
                ? List.of(outcome.getLabel())
                : List.of(verified.record().address(), outcome.getLabel());
            mergedRows.add(insert(rows.get(i), insertAt, inserted));
            stats.record(outcome.getStatus());
        }
        return new MergeResult(mergedHeader, mergedRows, stats);
    }

    private static VerifiedRecord[] indexByRow(final List<VerifiedRecord> results, final int rowCount) {
        if (results.size() != rowCount) {
            throw new IllegalStateException("Expected " + rowCount + " verification results but got " + results.size());
        }
        final var byRow = new VerifiedRecord[rowCount];
        for (final var result : results) {
            final var index = result.sourceRowIndex();
            if (index < 0 || index >= rowCount) {
                throw new IllegalStateException("Verification result points at unknown row " + index);
            }
            if (byRow[index] != null) {
                throw new IllegalStateException("Duplicate verification result for row " + index);
            }
            byRow[index] = result;
        }
        return byRow;
    }

    private static List<String> insert(final List<String> row, final int position, final List<String> values) {
        final var copy = new ArrayList<String>(Math.max(row.size(), position) + values.size());
        copy.addAll(row);
        // short rows are padded so the inserted columns line up with the header
        while (copy.size() < position) {
            copy.add("");
        }
        copy.addAll(position, values);
        return copy;
    }
}
