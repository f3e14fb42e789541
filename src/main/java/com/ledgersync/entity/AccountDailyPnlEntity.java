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
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the account_daily_pnl table. One row per account and trading date, written
 * once the date is final.
 */
@Entity
@Table(
        name = "account_daily_pnl",
        uniqueConstraints =
                @UniqueConstraint(
                        name = "uk_account_daily_pnl_date",
                        columnNames = {"account_id", "trade_date"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AccountDailyPnlEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_id", nullable = false)
    private Long accountId;

    @Column(name = "trade_date", nullable = false)
    private LocalDate tradeDate;

    @Column(name = "daily_pnl", precision = 20, scale = 6)
    private BigDecimal dailyPnl;

    @Column(name = "cumulative_pnl", precision = 20, scale = 6)
    private BigDecimal cumulativePnl;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
