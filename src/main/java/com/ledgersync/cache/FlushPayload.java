package com.ledgersync.cache;

import com.ledgersync.domain.enums.AccountSummaryField;
import com.ledgersync.domain.model.DailyPnLPoint;
import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;
import lombok.Value;

/**
 * What {@link LedgerCache#collectDirty()} found out of sync with durable storage.
 *
 * <p>Carries the version each dirty field had at collect time so that
 * {@link LedgerCache#clearDirty(FlushPayload)} only clears fields that were not written
 * again in the meantime.
 */
@Value
public class FlushPayload {

    Map<AccountSummaryField, BigDecimal> summaryValues;
    Map<AccountSummaryField, Long> summaryVersions;

    /** The previous trading date's final value, staged when the date rolled. Null if none. */
    DailyPnLPoint dailyPayload;

    public Set<AccountSummaryField> summaryFields() {
        return summaryVersions.keySet();
    }

    public boolean hasSummary() {
        return !summaryVersions.isEmpty();
    }

    public boolean hasDailyPayload() {
        return dailyPayload != null;
    }

    public boolean isEmpty() {
        return !hasSummary() && !hasDailyPayload();
    }
}
