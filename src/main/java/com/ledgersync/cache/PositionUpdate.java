package com.ledgersync.cache;

import com.ledgersync.domain.vo.PositionKey;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Identity, quantity and cost fields for {@link LedgerCache#upsertPosition}. Null id, open
 * time or contract id keep whatever the cache already holds; valuation and realized fields
 * are never touched by an upsert.
 */
@Value
@Builder
public class PositionUpdate {

    Long id;
    PositionKey key;
    BigDecimal quantity;
    BigDecimal avgCost;
    BigDecimal totalCost;
    Instant openTime;
    Long contractId;
}
