package com.ledgersync.venue;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Conversion of venue-supplied numbers. Venues emit NaN, infinities and "unset" markers
 * (values near {@link Double#MAX_VALUE}) in place of real figures; all of those convert to
 * empty.
 */
public final class VenueNumbers {

    private static final double UNSET_THRESHOLD = 1e300;

    private VenueNumbers() {}

    public static Optional<BigDecimal> toDecimal(Double value) {
        if (value == null || value.isNaN() || value.isInfinite() || Math.abs(value) >= UNSET_THRESHOLD) {
            return Optional.empty();
        }
        return Optional.of(BigDecimal.valueOf(value));
    }

    public static Optional<BigDecimal> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return toDecimal(Double.valueOf(value.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
