package com.ledgersync.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    READ_ONLY("READ_ONLY", 403),
    INSTRUMENT_NOT_FOUND("INSTRUMENT_NOT_FOUND", 404),
    INVALID_TRADE("INVALID_TRADE", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    STORAGE_ERROR("STORAGE_ERROR", 500),
    VENUE_ERROR("VENUE_ERROR", 502),
    VENUE_DISCONNECTED("VENUE_DISCONNECTED", 503),
    QUEUE_FULL("QUEUE_FULL", 503);

    private final String code;
    private final int httpStatus;
}
