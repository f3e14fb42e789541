package com.ledgersync.repository.jpa;

import com.ledgersync.entity.AccountDailyPnlEntity;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the account_daily_pnl table.
 * One row per account and trading date, written when the date is final.
 */
@Repository
public interface AccountDailyPnlJpaRepository extends JpaRepository<AccountDailyPnlEntity, Long> {

    Optional<AccountDailyPnlEntity> findByAccountIdAndTradeDate(Long accountId, LocalDate tradeDate);

    List<AccountDailyPnlEntity> findByAccountIdOrderByTradeDateAsc(Long accountId);
}
