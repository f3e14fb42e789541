package com.ledgersync.sync;

import com.ledgersync.domain.model.PositionValuation;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-contract live valuations waiting for the periodic batch write. A value equal to the
 * last one accepted for the same contract is dropped.
 *
 * <p>Owned by one sync session and only touched from the worker thread.
 */
public class PositionValuationBuffer {

    private final Map<Long, PositionValuation> lastAccepted = new HashMap<>();
    private final Map<Long, PositionValuation> pending = new LinkedHashMap<>();

    /** @return false if the valuation repeats the last accepted one */
    public boolean offer(long contractId, PositionValuation valuation) {
        PositionValuation last = lastAccepted.get(contractId);
        if (last != null
                && Objects.equals(last.getUnrealizedPnl(), valuation.getUnrealizedPnl())
                && Objects.equals(last.getDailyPnl(), valuation.getDailyPnl())) {
            return false;
        }
        lastAccepted.put(contractId, valuation);
        pending.put(contractId, valuation);
        return true;
    }

    public boolean hasPending() {
        return !pending.isEmpty();
    }

    /** Copy of the pending batch; stays pending until {@link #clear(Map)}. */
    public Map<Long, PositionValuation> pending() {
        return new LinkedHashMap<>(pending);
    }

    /** Removes the flushed entries that have not been replaced since. */
    public void clear(Map<Long, PositionValuation> flushed) {
        flushed.forEach(pending::remove);
    }

    /** Forgets a contract, e.g. when its position is closed. */
    public void forget(long contractId) {
        lastAccepted.remove(contractId);
        pending.remove(contractId);
    }
}
