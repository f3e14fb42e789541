package com.ledgersync.repository.jpa;

import com.ledgersync.entity.AccountSummaryEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** JPA repository for the account_summary table, keyed by account id. */
@Repository
public interface AccountSummaryJpaRepository extends JpaRepository<AccountSummaryEntity, Long> {}
