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

/** JPA entity for the account_summary table. One row per account, keyed by account id. */
@Entity
@Table(name = "account_summary")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AccountSummaryEntity {

    @Id
    @Column(name = "account_id")
    private Long accountId;

    @Column(name = "net_liquidation", precision = 20, scale = 6)
    private BigDecimal netLiquidation;

    @Column(name = "total_cash_value", precision = 20, scale = 6)
    private BigDecimal totalCashValue;

    @Column(name = "available_funds", precision = 20, scale = 6)
    private BigDecimal availableFunds;

    @Column(name = "excess_liquidity", precision = 20, scale = 6)
    private BigDecimal excessLiquidity;

    @Column(name = "init_margin_req", precision = 20, scale = 6)
    private BigDecimal initMarginReq;

    @Column(name = "maint_margin_req", precision = 20, scale = 6)
    private BigDecimal maintMarginReq;

    @Column(name = "gross_position_value", precision = 20, scale = 6)
    private BigDecimal grossPositionValue;

    @Column(name = "short_market_value", precision = 20, scale = 6)
    private BigDecimal shortMarketValue;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
