package com.ledgersync.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.time.ZoneId;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Settings of the venue sync worker, bound to {@code ledgersync.sync.*}.
 *
 * <p>Durations accept Spring's format ({@code 3s}, {@code 1h}). Defaults match a typical
 * broker gateway: reconnect between 3s and 60s, liveness probe every 15s, write-back every
 * 30s, at most 50 queued orders.
 */
@Configuration
@ConfigurationProperties(prefix = "ledgersync.sync")
@Validated
@Getter
@Setter
public class SyncProperties {

    /** Fixed venue account code. When unset the first managed account is used, else LOCAL. */
    private String account;

    @NotBlank
    private String baseCurrency = "USD";

    /** Start the sync worker with the application context. */
    private boolean autoStart = true;

    /** Reject all order submissions. */
    private boolean readOnly = false;

    @NotNull
    private Duration reconnectMinDelay = Duration.ofSeconds(3);

    @NotNull
    private Duration reconnectMaxDelay = Duration.ofSeconds(60);

    private Duration keepaliveInterval = Duration.ofSeconds(15);

    private Duration cacheFlushInterval = Duration.ofSeconds(30);

    /** How long each loop iteration waits for venue events. */
    private Duration tickInterval = Duration.ofSeconds(1);

    private Duration queueLogInterval = Duration.ofSeconds(5);

    @Min(1)
    private int orderQueueCapacity = 50;

    /** Default time a submitting caller waits before getting a "queued" answer. */
    private Duration orderTimeout = Duration.ofSeconds(8);

    /** Wait after placing an order before reading its initial status. */
    private Duration orderStatusWait = Duration.ofSeconds(1);

    private Duration orderIdempotencyTtl = Duration.ofHours(1);

    /** Timezone of the trading calendar used to bucket daily PnL. */
    @NotBlank
    private String tradingZone = "America/New_York";

    /** Exchange labels that never win exchange resolution for an execution. */
    private Set<String> alternativeExchanges = new LinkedHashSet<>(List.of("IBKRATS", "OVERNIGHT"));

    /** Venue notice codes meaning the venue lost its upstream session. */
    private Set<Integer> degradedCodes = new LinkedHashSet<>(List.of(1100));

    /** Venue notice codes meaning the upstream session is back. */
    private Set<Integer> restoredCodes = new LinkedHashSet<>(List.of(1101, 1102));

    public ZoneId tradingZoneId() {
        return ZoneId.of(tradingZone);
    }
}
