package com.ledgersync.repository.jpa;

import com.ledgersync.entity.PositionEntity;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/** JPA repository for the positions table (open positions). */
@Repository
public interface PositionJpaRepository extends JpaRepository<PositionEntity, Long> {

    List<PositionEntity> findByAccountId(Long accountId);

    Optional<PositionEntity> findByAccountIdAndSymbolAndExchangeAndCurrency(
            Long accountId, String symbol, String exchange, String currency);

    @Modifying
    @Transactional
    @Query("UPDATE PositionEntity p SET p.unrealizedPnl = :unrealized, p.updatedAt = :now "
            + "WHERE p.accountId = :accountId AND p.contractId = :contractId")
    int updateUnrealized(
            @Param("accountId") Long accountId,
            @Param("contractId") Long contractId,
            @Param("unrealized") BigDecimal unrealized,
            @Param("now") Instant now);

    @Modifying
    @Transactional
    @Query("UPDATE PositionEntity p SET p.unrealizedPnl = :unrealized, p.dailyPnl = :daily, p.updatedAt = :now "
            + "WHERE p.accountId = :accountId AND p.contractId = :contractId")
    int updateUnrealizedAndDaily(
            @Param("accountId") Long accountId,
            @Param("contractId") Long contractId,
            @Param("unrealized") BigDecimal unrealized,
            @Param("daily") BigDecimal daily,
            @Param("now") Instant now);
}
