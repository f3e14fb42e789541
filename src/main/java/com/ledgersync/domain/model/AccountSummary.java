package com.ledgersync.domain.model;

import com.ledgersync.domain.enums.AccountSummaryField;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Snapshot of the account valuation fields. Fields the venue has not reported are absent. */
@Value
@Builder
public class AccountSummary {

    Long accountId;
    String baseCurrency;
    Map<AccountSummaryField, BigDecimal> values;
    Instant asOf;

    public BigDecimal get(AccountSummaryField field) {
        return values.get(field);
    }
}
