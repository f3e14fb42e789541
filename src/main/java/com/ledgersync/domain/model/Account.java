package com.ledgersync.domain.model;

import lombok.Builder;
import lombok.Value;

/** A stored venue account: internal id, the venue's account code and its base currency. */
@Value
@Builder
public class Account {

    Long id;
    String externalAccount;
    String baseCurrency;
}
