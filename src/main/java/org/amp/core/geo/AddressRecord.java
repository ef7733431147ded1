package org.amp.core.geo;

import lombok.Builder;
import lombok.Value;

/**
 * Read-only address input, one per correlation query.
 */
@Value
@Builder
public class AddressRecord {
    /** Address location. */
    @lombok.NonNull
    Point point;
    /** Street name, e.g. {@code Lilla Torg}. */
    String street;
    /** Street number including letter suffixes, e.g. {@code 12B}. */
    String number;
    /** Postal code as printed, e.g. {@code 211 34}. */
    String postalCode;

    /**
     * Returns {@code "street number"} or the street alone when no number is present.
     */
    public String displayName() {
        if (number == null || number.isBlank()) {
            return street;
        }
        return street + " " + number;
    }
}
