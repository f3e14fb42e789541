package com.ledgersync.entity;

import com.ledgersync.domain.enums.OrderSide;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the trades table: the append-only execution log.
 * The unique exec_id makes re-delivered executions a no-op insert.
 */
@Entity
@Table(
        name = "trades",
        indexes = @Index(name = "idx_trades_instrument", columnList = "account_id, symbol, currency, trade_time"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_id", nullable = false)
    private Long accountId;

    @Column(name = "position_id")
    private Long positionId;

    @Column(length = 32, nullable = false)
    private String symbol;

    @Column(length = 16, nullable = false)
    private String exchange;

    @Column(length = 8, nullable = false)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(4)")
    private OrderSide side;

    @Column(precision = 20, scale = 6)
    private BigDecimal quantity;

    @Column(precision = 20, scale = 6)
    private BigDecimal price;

    @Column(precision = 24, scale = 10)
    private BigDecimal commission;

    @Column(name = "realized_pnl", precision = 24, scale = 10)
    private BigDecimal realizedPnl;

    @Column(name = "trade_time")
    private Instant tradeTime;

    @Column(name = "exec_id", unique = true, length = 64)
    private String execId;

    @Column(name = "perm_id")
    private Long permId;

    @Column(name = "created_at")
    private Instant createdAt;
}
