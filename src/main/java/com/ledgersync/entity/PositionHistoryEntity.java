package com.ledgersync.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the positions_history table. The id is assigned, not generated: it is the
 * id the position had in the positions table.
 */
@Entity
@Table(name = "positions_history")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionHistoryEntity {

    @Id
    private Long id;

    @Column(name = "account_id", nullable = false)
    private Long accountId;

    @Column(length = 32, nullable = false)
    private String symbol;

    @Column(length = 16, nullable = false)
    private String exchange;

    @Column(length = 8, nullable = false)
    private String currency;

    @Column(precision = 20, scale = 6)
    private BigDecimal quantity;

    @Column(name = "avg_cost", precision = 24, scale = 10)
    private BigDecimal avgCost;

    @Column(name = "total_cost", precision = 24, scale = 10)
    private BigDecimal totalCost;

    @Column(name = "realized_pnl", precision = 24, scale = 10)
    private BigDecimal realizedPnl;

    @Column(name = "open_time")
    private Instant openTime;

    @Column(name = "close_time")
    private Instant closeTime;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
