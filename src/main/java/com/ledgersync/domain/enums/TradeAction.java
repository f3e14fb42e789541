package com.ledgersync.domain.enums;

/**
 * What a single trade did to the position it was applied to.
 * FULL_CLOSE and FLIP both archive the prior position; FLIP also opens a new one.
 */
public enum TradeAction {
    OPEN,
    ADD,
    PARTIAL_CLOSE,
    FULL_CLOSE,
    FLIP;

    public boolean archives() {
        return this == FULL_CLOSE || this == FLIP;
    }
}
