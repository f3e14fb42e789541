package com.ledgersync.venue.event;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * A fill reported by the venue. Numeric fields are carried as the venue sent them and
 * validated by the handler. {@code commissionReport} is set when the venue delivered the
 * commission together with the fill (execution replay does this).
 */
@Value
@Builder(toBuilder = true)
public class ExecutionEvent {

    String account;
    String execId;
    Long permId;
    Long contractId;
    String symbol;
    String exchange;
    String currency;

    /** Venue side label: BOT/SLD or BUY/SELL. */
    String side;

    Double quantity;
    Double price;
    Instant time;
    CommissionReportEvent commissionReport;
}
