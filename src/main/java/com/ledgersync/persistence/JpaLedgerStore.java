package com.ledgersync.persistence;

import com.ledgersync.domain.enums.AccountSummaryField;
import com.ledgersync.domain.model.Account;
import com.ledgersync.domain.model.DailyPnLPoint;
import com.ledgersync.domain.model.HistoryEntry;
import com.ledgersync.domain.model.LedgerSnapshot;
import com.ledgersync.domain.model.Position;
import com.ledgersync.domain.model.PositionValuation;
import com.ledgersync.domain.model.TradeRecord;
import com.ledgersync.domain.vo.PositionKey;
import com.ledgersync.entity.AccountDailyPnlEntity;
import com.ledgersync.entity.AccountEntity;
import com.ledgersync.entity.AccountSummaryEntity;
import com.ledgersync.entity.PositionEntity;
import com.ledgersync.entity.PositionHistoryEntity;
import com.ledgersync.entity.TradeEntity;
import com.ledgersync.exception.StorageException;
import com.ledgersync.mapper.AccountMapper;
import com.ledgersync.mapper.PositionHistoryMapper;
import com.ledgersync.mapper.PositionMapper;
import com.ledgersync.mapper.TradeMapper;
import com.ledgersync.repository.jpa.AccountDailyPnlJpaRepository;
import com.ledgersync.repository.jpa.AccountJpaRepository;
import com.ledgersync.repository.jpa.AccountSummaryJpaRepository;
import com.ledgersync.repository.jpa.PositionHistoryJpaRepository;
import com.ledgersync.repository.jpa.PositionJpaRepository;
import com.ledgersync.repository.jpa.TradeJpaRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link LedgerStore} over Spring Data JPA.
 *
 * <p>Trade appends run in the repository's own transaction so that a unique-key violation
 * on exec_id rolls back only that insert and is reported as a duplicate. Multi-row writes
 * (archive, valuation batches) run in one transaction each.
 */
@Service
public class JpaLedgerStore implements LedgerStore {

    private static final Logger log = LoggerFactory.getLogger(JpaLedgerStore.class);

    private final AccountJpaRepository accountJpaRepository;
    private final TradeJpaRepository tradeJpaRepository;
    private final PositionJpaRepository positionJpaRepository;
    private final PositionHistoryJpaRepository positionHistoryJpaRepository;
    private final AccountSummaryJpaRepository accountSummaryJpaRepository;
    private final AccountDailyPnlJpaRepository accountDailyPnlJpaRepository;
    private final Clock clock;

    private final AccountMapper accountMapper = Mappers.getMapper(AccountMapper.class);
    private final TradeMapper tradeMapper = Mappers.getMapper(TradeMapper.class);
    private final PositionMapper positionMapper = Mappers.getMapper(PositionMapper.class);
    private final PositionHistoryMapper positionHistoryMapper = Mappers.getMapper(PositionHistoryMapper.class);

    public JpaLedgerStore(
            AccountJpaRepository accountJpaRepository,
            TradeJpaRepository tradeJpaRepository,
            PositionJpaRepository positionJpaRepository,
            PositionHistoryJpaRepository positionHistoryJpaRepository,
            AccountSummaryJpaRepository accountSummaryJpaRepository,
            AccountDailyPnlJpaRepository accountDailyPnlJpaRepository,
            Clock clock) {
        this.accountJpaRepository = accountJpaRepository;
        this.tradeJpaRepository = tradeJpaRepository;
        this.positionJpaRepository = positionJpaRepository;
        this.positionHistoryJpaRepository = positionHistoryJpaRepository;
        this.accountSummaryJpaRepository = accountSummaryJpaRepository;
        this.accountDailyPnlJpaRepository = accountDailyPnlJpaRepository;
        this.clock = clock;
    }

    // ===== Accounts =====

    @Override
    @Transactional
    public long upsertAccount(String externalAccount, String baseCurrency) {
        return accountJpaRepository
                .findByExternalAccount(externalAccount)
                .map(AccountEntity::getId)
                .orElseGet(() -> {
                    AccountEntity saved = accountJpaRepository.save(AccountEntity.builder()
                            .externalAccount(externalAccount)
                            .baseCurrency(baseCurrency)
                            .createdAt(clock.instant())
                            .build());
                    log.info("Created account {} (id={})", externalAccount, saved.getId());
                    return saved.getId();
                });
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Account> findDefaultAccount() {
        return accountJpaRepository.findFirstByOrderByIdAsc().map(accountMapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public LedgerSnapshot loadSnapshot(long accountId, String baseCurrency) {
        try {
            List<Position> positions = positionMapper.toDomainList(positionJpaRepository.findByAccountId(accountId));
            List<HistoryEntry> history = positionHistoryMapper.toDomainList(
                    positionHistoryJpaRepository.findByAccountIdOrderByCloseTimeDesc(accountId));

            Map<AccountSummaryField, BigDecimal> summary = new EnumMap<>(AccountSummaryField.class);
            Optional<AccountSummaryEntity> summaryEntity = accountSummaryJpaRepository.findById(accountId);
            summaryEntity.ifPresent(entity -> {
                for (AccountSummaryField field : AccountSummaryField.values()) {
                    BigDecimal value = readField(entity, field);
                    if (value != null) {
                        summary.put(field, value);
                    }
                }
            });

            Map<LocalDate, BigDecimal> daily = new TreeMap<>();
            for (AccountDailyPnlEntity row : accountDailyPnlJpaRepository.findByAccountIdOrderByTradeDateAsc(accountId)) {
                daily.put(row.getTradeDate(), orZero(row.getDailyPnl()));
            }

            return LedgerSnapshot.builder()
                    .accountId(accountId)
                    .baseCurrency(baseCurrency)
                    .realizedTotal(orZero(tradeJpaRepository.sumRealizedByAccount(accountId)))
                    .positions(positions)
                    .history(history)
                    .accountSummary(summary)
                    .accountSummaryAsOf(summaryEntity.map(AccountSummaryEntity::getUpdatedAt).orElse(null))
                    .dailyPnl(daily)
                    .bookedTrades(tradeMapper.toDomainList(
                            tradeJpaRepository.findByAccountIdAndExecIdIsNotNull(accountId)))
                    .build();
        } catch (DataAccessException e) {
            throw new StorageException("Failed to load ledger snapshot for account " + accountId, e);
        }
    }

    // ===== Trades =====

    @Override
    public boolean appendTrade(TradeRecord trade) {
        if (trade.getExecId() != null && tradeJpaRepository.existsByExecId(trade.getExecId())) {
            log.debug("Trade {} already stored", trade.getExecId());
            return false;
        }
        TradeEntity entity = tradeMapper.toEntity(trade);
        entity.setId(null);
        entity.setCreatedAt(clock.instant());
        try {
            tradeJpaRepository.saveAndFlush(entity);
            return true;
        } catch (DataIntegrityViolationException e) {
            log.debug("Duplicate trade {} ignored", trade.getExecId());
            return false;
        }
    }

    @Override
    public boolean hasTrade(String execId) {
        return tradeJpaRepository.existsByExecId(execId)
                || tradeJpaRepository.existsByExecId(execId + TradeRecord.CLOSE_LEG_SUFFIX);
    }

    @Override
    public Optional<TradeRecord> findTradeByExecId(String execId) {
        return tradeJpaRepository.findByExecId(execId).map(tradeMapper::toDomain);
    }

    @Override
    @Transactional
    public void updateTradeReport(long tradeId, BigDecimal commission, BigDecimal realizedPnl) {
        TradeEntity entity = tradeJpaRepository
                .findById(tradeId)
                .orElseThrow(() -> new StorageException("Trade " + tradeId + " not found"));
        entity.setCommission(commission);
        entity.setRealizedPnl(realizedPnl);
        tradeJpaRepository.save(entity);
    }

    @Override
    public BigDecimal sumRealized(long accountId, String symbol, String currency, Instant from, Instant to) {
        BigDecimal sum = from == null
                ? tradeJpaRepository.sumRealizedUntil(accountId, symbol, currency, to)
                : tradeJpaRepository.sumRealizedBetween(accountId, symbol, currency, from, to);
        return orZero(sum);
    }

    @Override
    public Optional<Instant> findFirstTradeTime(long accountId, String symbol, String currency, Instant after) {
        return after == null
                ? tradeJpaRepository.findFirstTradeTime(accountId, symbol, currency)
                : tradeJpaRepository.findFirstTradeTimeAfter(accountId, symbol, currency, after);
    }

    @Override
    public Optional<Instant> findLastTradeTime(long accountId, String symbol, String currency) {
        return tradeJpaRepository.findLastTradeTime(accountId, symbol, currency);
    }

    @Override
    public Optional<Instant> findLastCloseTime(long accountId, String symbol, String currency) {
        return positionHistoryJpaRepository.findLastCloseTime(accountId, symbol, currency);
    }

    // ===== Open positions =====

    @Override
    @Transactional
    public Position saveOpenPosition(long accountId, Position position) {
        Instant now = clock.instant();
        PositionEntity entity = positionJpaRepository
                .findByAccountIdAndSymbolAndExchangeAndCurrency(
                        accountId, position.getSymbol(), position.getExchange(), position.getCurrency())
                .map(existing -> {
                    existing.setQuantity(position.getQuantity());
                    existing.setAvgCost(position.getAvgCost());
                    existing.setTotalCost(position.getTotalCost());
                    if (position.getContractId() != null) {
                        existing.setContractId(position.getContractId());
                    }
                    if (existing.getOpenTime() == null) {
                        existing.setOpenTime(position.getOpenTime());
                    }
                    return existing;
                })
                .orElseGet(() -> {
                    PositionEntity created = positionMapper.toEntity(position);
                    created.setId(null);
                    created.setAccountId(accountId);
                    return created;
                });
        entity.setUpdatedAt(now);
        return positionMapper.toDomain(positionJpaRepository.save(entity));
    }

    @Override
    @Transactional
    public void updatePositionRealized(long accountId, PositionKey key, BigDecimal realizedPnl) {
        positionJpaRepository
                .findByAccountIdAndSymbolAndExchangeAndCurrency(
                        accountId, key.getSymbol(), key.getExchange(), key.getCurrency())
                .ifPresent(entity -> {
                    entity.setRealizedPnl(realizedPnl);
                    entity.setUpdatedAt(clock.instant());
                    positionJpaRepository.save(entity);
                });
    }

    @Override
    @Transactional
    public void updatePositionOpenTime(long positionId, Instant openTime) {
        positionJpaRepository.findById(positionId).ifPresent(entity -> {
            entity.setOpenTime(openTime);
            entity.setUpdatedAt(clock.instant());
            positionJpaRepository.save(entity);
        });
    }

    // ===== History =====

    @Override
    @Transactional
    public HistoryEntry archivePosition(long accountId, Position position, Instant closeTime, BigDecimal realizedPnl) {
        PositionEntity open = (position.getId() != null
                        ? positionJpaRepository.findById(position.getId())
                        : positionJpaRepository.findByAccountIdAndSymbolAndExchangeAndCurrency(
                                accountId, position.getSymbol(), position.getExchange(), position.getCurrency()))
                .orElseThrow(() -> new StorageException("No open position to archive for " + position.positionKey()));

        PositionHistoryEntity history = PositionHistoryEntity.builder()
                .id(open.getId())
                .accountId(accountId)
                .symbol(open.getSymbol())
                .exchange(open.getExchange())
                .currency(open.getCurrency())
                .quantity(open.getQuantity())
                .avgCost(open.getAvgCost())
                .totalCost(open.getTotalCost())
                .realizedPnl(realizedPnl)
                .openTime(open.getOpenTime())
                .closeTime(closeTime)
                .updatedAt(clock.instant())
                .build();
        positionHistoryJpaRepository.save(history);
        positionJpaRepository.delete(open);
        log.info(
                "Archived position id={} {} {} realized={}",
                open.getId(),
                open.getSymbol(),
                open.getExchange(),
                realizedPnl);
        return positionHistoryMapper.toDomain(history);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<HistoryEntry> findLatestHistory(long accountId, String symbol, String currency) {
        return positionHistoryJpaRepository
                .findFirstByAccountIdAndSymbolAndCurrencyOrderByCloseTimeDesc(accountId, symbol, currency)
                .map(positionHistoryMapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<HistoryEntry> findHistory(long historyId) {
        return positionHistoryJpaRepository.findById(historyId).map(positionHistoryMapper::toDomain);
    }

    @Override
    @Transactional
    public void updateHistory(long historyId, Instant openTime, Instant closeTime, BigDecimal realizedPnl) {
        positionHistoryJpaRepository.findById(historyId).ifPresent(entity -> {
            entity.setOpenTime(openTime);
            entity.setCloseTime(closeTime);
            entity.setRealizedPnl(realizedPnl);
            entity.setUpdatedAt(clock.instant());
            positionHistoryJpaRepository.save(entity);
        });
    }

    // ===== Write-back =====

    @Override
    @Transactional
    public void updatePositionValuations(long accountId, Map<Long, PositionValuation> valuations) {
        Instant now = clock.instant();
        valuations.forEach((contractId, valuation) -> {
            if (valuation.getDailyPnl() == null) {
                positionJpaRepository.updateUnrealized(accountId, contractId, valuation.getUnrealizedPnl(), now);
            } else {
                positionJpaRepository.updateUnrealizedAndDaily(
                        accountId, contractId, valuation.getUnrealizedPnl(), valuation.getDailyPnl(), now);
            }
        });
    }

    @Override
    @Transactional
    public void upsertAccountSummary(long accountId, Map<AccountSummaryField, BigDecimal> values) {
        AccountSummaryEntity entity = accountSummaryJpaRepository
                .findById(accountId)
                .orElseGet(() -> AccountSummaryEntity.builder().accountId(accountId).build());
        values.forEach((field, value) -> writeField(entity, field, value));
        entity.setUpdatedAt(clock.instant());
        accountSummaryJpaRepository.save(entity);
    }

    @Override
    @Transactional
    public void upsertDailyPnL(long accountId, DailyPnLPoint point) {
        AccountDailyPnlEntity entity = accountDailyPnlJpaRepository
                .findByAccountIdAndTradeDate(accountId, point.getTradeDate())
                .orElseGet(() -> AccountDailyPnlEntity.builder()
                        .accountId(accountId)
                        .tradeDate(point.getTradeDate())
                        .build());
        entity.setDailyPnl(point.getDailyPnl());
        entity.setCumulativePnl(point.getCumulativePnl());
        entity.setUpdatedAt(clock.instant());
        accountDailyPnlJpaRepository.save(entity);
    }

    // ===== Helpers =====

    private static BigDecimal readField(AccountSummaryEntity entity, AccountSummaryField field) {
        return switch (field) {
            case NET_LIQUIDATION -> entity.getNetLiquidation();
            case TOTAL_CASH_VALUE -> entity.getTotalCashValue();
            case AVAILABLE_FUNDS -> entity.getAvailableFunds();
            case EXCESS_LIQUIDITY -> entity.getExcessLiquidity();
            case INIT_MARGIN_REQ -> entity.getInitMarginReq();
            case MAINT_MARGIN_REQ -> entity.getMaintMarginReq();
            case GROSS_POSITION_VALUE -> entity.getGrossPositionValue();
            case SHORT_MARKET_VALUE -> entity.getShortMarketValue();
        };
    }

    private static void writeField(AccountSummaryEntity entity, AccountSummaryField field, BigDecimal value) {
        switch (field) {
            case NET_LIQUIDATION -> entity.setNetLiquidation(value);
            case TOTAL_CASH_VALUE -> entity.setTotalCashValue(value);
            case AVAILABLE_FUNDS -> entity.setAvailableFunds(value);
            case EXCESS_LIQUIDITY -> entity.setExcessLiquidity(value);
            case INIT_MARGIN_REQ -> entity.setInitMarginReq(value);
            case MAINT_MARGIN_REQ -> entity.setMaintMarginReq(value);
            case GROSS_POSITION_VALUE -> entity.setGrossPositionValue(value);
            case SHORT_MARKET_VALUE -> entity.setShortMarketValue(value);
        }
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
