package com.ledgersync.unit.venue;

import static org.assertj.core.api.Assertions.assertThat;

import com.ledgersync.venue.VenueNumbers;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for VenueNumbers: venue placeholders convert to empty, real figures pass. */
class VenueNumbersTest {

    @Test
    @DisplayName("NaN, infinities, unset markers and null are empty")
    void placeholdersAreEmpty() {
        assertThat(VenueNumbers.toDecimal(null)).isEmpty();
        assertThat(VenueNumbers.toDecimal(Double.NaN)).isEmpty();
        assertThat(VenueNumbers.toDecimal(Double.POSITIVE_INFINITY)).isEmpty();
        assertThat(VenueNumbers.toDecimal(Double.MAX_VALUE)).isEmpty();
        assertThat(VenueNumbers.toDecimal(-Double.MAX_VALUE)).isEmpty();
    }

    @Test
    @DisplayName("Real figures convert without binary noise")
    void realFiguresConvert() {
        assertThat(VenueNumbers.toDecimal(100.1)).hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("100.1"));
        assertThat(VenueNumbers.toDecimal(-3.0)).hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("-3"));
    }

    @Test
    @DisplayName("Text values parse, garbage is empty")
    void parsesText() {
        assertThat(VenueNumbers.parse(" 1500.25 ")).hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("1500.25"));
        assertThat(VenueNumbers.parse("")).isEmpty();
        assertThat(VenueNumbers.parse("n/a")).isEmpty();
        assertThat(VenueNumbers.parse(null)).isEmpty();
    }
}
