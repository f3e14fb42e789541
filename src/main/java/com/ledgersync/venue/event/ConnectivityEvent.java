package com.ledgersync.venue.event;

import lombok.Builder;
import lombok.Value;

/** Error or notice about the venue's own upstream session, identified by a numeric code. */
@Value
@Builder
public class ConnectivityEvent {

    int code;
    String message;
}
