package com.ledgersync.config;

import com.ledgersync.ledger.CostBasisEngine;
import com.ledgersync.venue.VenueGateway;
import com.ledgersync.venue.simulator.SimulatedVenueGateway;
import java.math.BigDecimal;
import java.time.Clock;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Venue wiring, bound to {@code ledgersync.venue.*}.
 *
 * <p>Provides the paper venue as the default {@link VenueGateway}. A real venue adapter
 * declared as its own bean replaces it.
 */
@Configuration
@ConfigurationProperties(prefix = "ledgersync.venue")
@Getter
@Setter
public class VenueConfig {

    private static final Logger log = LoggerFactory.getLogger(VenueConfig.class);

    private Simulator simulator = new Simulator();

    @Bean
    @ConditionalOnMissingBean(VenueGateway.class)
    public VenueGateway venueGateway(CostBasisEngine costBasisEngine, Clock clock) {
        log.info(
                "Using simulated venue: account={}, startingCash={}, defaultPrice={}",
                simulator.getAccount(),
                simulator.getStartingCash(),
                simulator.getDefaultPrice());
        return new SimulatedVenueGateway(simulator, costBasisEngine, clock);
    }

    @Getter
    @Setter
    public static class Simulator {

        private String account = "SIM-0001";

        private String currency = "USD";

        private BigDecimal startingCash = new BigDecimal("100000");

        /** Fill price for symbols without an explicit mark. */
        private BigDecimal defaultPrice = new BigDecimal("100");

        private BigDecimal commissionPerShare = new BigDecimal("0.005");

        private BigDecimal minCommission = new BigDecimal("1.00");
    }
}
