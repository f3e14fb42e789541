package com.ledgersync.repository.jpa;

import com.ledgersync.entity.PositionHistoryEntity;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** JPA repository for the positions_history table (closed positions). */
@Repository
public interface PositionHistoryJpaRepository extends JpaRepository<PositionHistoryEntity, Long> {

    List<PositionHistoryEntity> findByAccountIdOrderByCloseTimeDesc(Long accountId);

    Optional<PositionHistoryEntity> findFirstByAccountIdAndSymbolAndCurrencyOrderByCloseTimeDesc(
            Long accountId, String symbol, String currency);

    @Query("SELECT MAX(h.closeTime) FROM PositionHistoryEntity h "
            + "WHERE h.accountId = :accountId AND h.symbol = :symbol AND h.currency = :currency")
    Optional<Instant> findLastCloseTime(
            @Param("accountId") Long accountId, @Param("symbol") String symbol, @Param("currency") String currency);
}
