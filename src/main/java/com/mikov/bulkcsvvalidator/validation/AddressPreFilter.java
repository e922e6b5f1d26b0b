package com.mikov.bulkcsvvalidator.validation;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Cheap structural checks that let obviously unusable addresses skip the verification service.
 * Not an RFC 5322 validator.
 *
 * @author zahari.mikov
 */
@Component
public class AddressPreFilter {

    private static final Pattern STRUCTURAL_PATTERN = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Set<String> PLACEHOLDERS = Set.of("null", "undefined");

    /**
     * Returns the reason the address is rejected locally, or empty when it should go to the service.
     */
    public Optional<String> rejectionReason(final String address) {
        if (isEmptyAddress(address)) {
            return Optional.of("Email is null or empty");
        }
        if (!looksLikeEmail(address)) {
            return Optional.of("Email fails structural check");
        }
        return Optional.empty();
    }

    /**
     * Blank, whitespace-only, or the textual placeholders {@code null} / {@code undefined}.
     */
    public static boolean isEmptyAddress(final String address) {
        if (address == null || address.isBlank()) {
            return true;
        }
        return PLACEHOLDERS.contains(address.trim().toLowerCase());
    }

    /**
     * Form used to compare addresses for duplicates.
     */
    public static String normalize(final String address) {
        return address == null ? "" : address.trim().toLowerCase();
    }

    public static boolean looksLikeEmail(final String value) {
        return value != null && STRUCTURAL_PATTERN.matcher(value.trim()).matches();
    }
}
