package com.ledgersync.sync;

import com.ledgersync.config.SyncProperties;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import org.springframework.stereotype.Component;

/**
 * Maps instants to trading dates in the configured reference timezone, so daily PnL buckets
 * do not depend on the server or display timezone.
 */
@Component
public class TradingCalendar {

    private final Clock clock;
    private final SyncProperties syncProperties;

    public TradingCalendar(Clock clock, SyncProperties syncProperties) {
        this.clock = clock;
        this.syncProperties = syncProperties;
    }

    public LocalDate today() {
        return tradingDate(clock.instant());
    }

    public LocalDate tradingDate(Instant instant) {
        return instant.atZone(syncProperties.tradingZoneId()).toLocalDate();
    }
}
