package com.ledgersync.exception;

import java.util.Map;

/**
 * Raised by the cost-basis engine for trades it cannot account for (zero quantity or
 * zero price).
 */
public class InvalidTradeException extends BaseException {

    public InvalidTradeException(String message, Map<String, Object> details) {
        super(ErrorCode.INVALID_TRADE, message, details);
    }
}
