package com.mikov.bulkcsvvalidator.model;

/**
 * Names of the two extracts stored for a split upload.
 *
 * @param totalEmails distinct non-empty addresses, the credits a validation of this upload costs
 * @param warning non-null when the source file had rows of differing width
 */
public record PreparedUpload(String fullFilename, String emailsFilename, int totalEmails, String warning) {
}
