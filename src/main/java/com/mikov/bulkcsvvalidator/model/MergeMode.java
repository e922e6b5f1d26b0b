package com.mikov.bulkcsvvalidator.model;

/**
 * How verification results are attached to the rows they came from.
 */
public enum MergeMode {
    /**
     * Rows still hold the address; a status column is inserted right after it.
     */
    ANNOTATE_IN_PLACE,
    /**
     * The address column was extracted earlier; address and status are inserted back at the column index.
     */
    REJOIN_EXTRACTED
}
