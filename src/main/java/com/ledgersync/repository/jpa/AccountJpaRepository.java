package com.ledgersync.repository.jpa;

import com.ledgersync.entity.AccountEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** JPA repository for the accounts table. */
@Repository
public interface AccountJpaRepository extends JpaRepository<AccountEntity, Long> {

    Optional<AccountEntity> findByExternalAccount(String externalAccount);

    /** The oldest account; used to warm the cache before the venue reports an account code. */
    Optional<AccountEntity> findFirstByOrderByIdAsc();
}
