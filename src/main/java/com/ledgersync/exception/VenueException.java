package com.ledgersync.exception;

/**
 * Failure talking to the trading venue. Thrown from inside a connected session it tears
 * the session down and sends the sync worker back into its reconnect loop.
 */
public class VenueException extends BaseException {

    public VenueException(String message) {
        super(ErrorCode.VENUE_ERROR, message);
    }

    public VenueException(String message, Throwable cause) {
        super(ErrorCode.VENUE_ERROR, message, cause);
    }

    public VenueException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
