package com.ledgersync.mapper;

import com.ledgersync.domain.model.Account;
import com.ledgersync.entity.AccountEntity;
import org.mapstruct.Mapper;

/** MapStruct mapper from accounts rows to Account. */
@Mapper
public interface AccountMapper {

    Account toDomain(AccountEntity entity);
}
