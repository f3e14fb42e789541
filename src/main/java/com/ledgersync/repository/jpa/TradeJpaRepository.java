package com.ledgersync.repository.jpa;

import com.ledgersync.entity.TradeEntity;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the trades table.
 * Aggregates are scoped by account, symbol and currency, ignoring the exchange label, so
 * trades booked under different exchange labels for the same instrument sum together.
 */
@Repository
public interface TradeJpaRepository extends JpaRepository<TradeEntity, Long> {

    boolean existsByExecId(String execId);

    Optional<TradeEntity> findByExecId(String execId);

    List<TradeEntity> findByAccountIdAndExecIdIsNotNull(Long accountId);

    @Query("SELECT COALESCE(SUM(t.realizedPnl), 0) FROM TradeEntity t WHERE t.accountId = :accountId")
    BigDecimal sumRealizedByAccount(@Param("accountId") Long accountId);

    @Query("SELECT COALESCE(SUM(t.realizedPnl), 0) FROM TradeEntity t "
            + "WHERE t.accountId = :accountId AND t.symbol = :symbol AND t.currency = :currency "
            + "AND t.tradeTime >= :from AND t.tradeTime <= :to")
    BigDecimal sumRealizedBetween(
            @Param("accountId") Long accountId,
            @Param("symbol") String symbol,
            @Param("currency") String currency,
            @Param("from") Instant from,
            @Param("to") Instant to);

    @Query("SELECT COALESCE(SUM(t.realizedPnl), 0) FROM TradeEntity t "
            + "WHERE t.accountId = :accountId AND t.symbol = :symbol AND t.currency = :currency "
            + "AND t.tradeTime <= :to")
    BigDecimal sumRealizedUntil(
            @Param("accountId") Long accountId,
            @Param("symbol") String symbol,
            @Param("currency") String currency,
            @Param("to") Instant to);

    @Query("SELECT MIN(t.tradeTime) FROM TradeEntity t "
            + "WHERE t.accountId = :accountId AND t.symbol = :symbol AND t.currency = :currency")
    Optional<Instant> findFirstTradeTime(
            @Param("accountId") Long accountId, @Param("symbol") String symbol, @Param("currency") String currency);

    @Query("SELECT MIN(t.tradeTime) FROM TradeEntity t "
            + "WHERE t.accountId = :accountId AND t.symbol = :symbol AND t.currency = :currency "
            + "AND t.tradeTime > :after")
    Optional<Instant> findFirstTradeTimeAfter(
            @Param("accountId") Long accountId,
            @Param("symbol") String symbol,
            @Param("currency") String currency,
            @Param("after") Instant after);

    @Query("SELECT MAX(t.tradeTime) FROM TradeEntity t "
            + "WHERE t.accountId = :accountId AND t.symbol = :symbol AND t.currency = :currency")
    Optional<Instant> findLastTradeTime(
            @Param("accountId") Long accountId, @Param("symbol") String symbol, @Param("currency") String currency);
}
