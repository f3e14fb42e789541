package com.ledgersync.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the positions table: open positions only, at most one per
 * (account, symbol, exchange, currency). Rows move to positions_history when closed.
 */
@Entity
@Table(
        name = "positions",
        uniqueConstraints =
                @UniqueConstraint(
                        name = "uk_positions_key",
                        columnNames = {"account_id", "symbol", "exchange", "currency"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
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

    @Column(name = "unrealized_pnl", precision = 24, scale = 10)
    private BigDecimal unrealizedPnl;

    @Column(name = "daily_pnl", precision = 24, scale = 10)
    private BigDecimal dailyPnl;

    @Column(name = "contract_id")
    private Long contractId;

    @Column(name = "open_time")
    private Instant openTime;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
