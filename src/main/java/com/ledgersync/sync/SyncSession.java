package com.ledgersync.sync;

import com.ledgersync.venue.event.CommissionReportEvent;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.Getter;

/**
 * State of one connected session with the venue. Created after the account is resolved and
 * discarded on teardown; nothing here survives a reconnect.
 */
@Getter
public class SyncSession {

    private final String accountCode;
    private final long accountId;
    private final String baseCurrency;

    /** Commission reports that arrived before their trade row, by exec id. */
    private final Map<String, CommissionReportEvent> pendingReports = new HashMap<>();

    private final Set<Long> subscribedContracts = new HashSet<>();
    private final PositionValuationBuffer valuationBuffer = new PositionValuationBuffer();

    public SyncSession(String accountCode, long accountId, String baseCurrency) {
        this.accountCode = accountCode;
        this.accountId = accountId;
        this.baseCurrency = baseCurrency;
    }

    public void bufferReport(CommissionReportEvent report) {
        pendingReports.put(report.getExecId(), report);
    }

    public Optional<CommissionReportEvent> takePendingReport(String execId) {
        return Optional.ofNullable(pendingReports.remove(execId));
    }

    /** @return true if this is a new subscription */
    public boolean addSubscription(long contractId) {
        return subscribedContracts.add(contractId);
    }

    /** @return true if the contract was subscribed */
    public boolean removeSubscription(long contractId) {
        valuationBuffer.forget(contractId);
        return subscribedContracts.remove(contractId);
    }

    /** Foreign account codes are ignored; events without an account belong to this session. */
    public boolean isOwnAccount(String account) {
        return account == null || account.isEmpty() || accountCode.equals(account);
    }
}
