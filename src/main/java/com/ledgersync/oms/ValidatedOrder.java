package com.ledgersync.oms;

import com.ledgersync.domain.model.Instrument;
import com.ledgersync.venue.VenueOrder;
import lombok.Builder;
import lombok.Value;

/** A normalized order: the unqualified instrument and the order to place on it. */
@Value
@Builder
public class ValidatedOrder {

    Instrument instrument;
    VenueOrder order;
}
