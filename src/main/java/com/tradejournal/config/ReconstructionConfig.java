package com.tradejournal.config;

import com.tradejournal.domain.enums.BrokerKind;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for trade reconstruction.
 *
 * <p>Properties are read from the {@code tradejournal.reconstruction} prefix.
 */
@Configuration
@ConfigurationProperties(prefix = "tradejournal.reconstruction")
@Getter
@Setter
public class ReconstructionConfig {

    /**
     * Stable sort of legs by timestamp before grouping and matching; ties keep export order.
     * FIFO results are only defined for time-ordered input.
     */
    private boolean sortLegs = true;

    /** Account label written to every trade, per broker. */
    private Map<BrokerKind, String> accounts = defaultAccounts();

    private Robinhood robinhood = new Robinhood();

    public String accountFor(BrokerKind broker) {
        return accounts.getOrDefault(broker, broker.name());
    }

    @Getter
    @Setter
    public static class Robinhood {

        /** Description fragments marking cash, interest and subscription rows. */
        private List<String> excludedDescriptions = new ArrayList<>(List.of(
                "ACH Deposit",
                "ACH Withdrawal",
                "Cash reward",
                "Interest Payment",
                "Gold Deposit Boost Payment",
                "Gold Plan Credit",
                "Gold Subscription Fee"));
    }

    private static Map<BrokerKind, String> defaultAccounts() {
        Map<BrokerKind, String> accounts = new EnumMap<>(BrokerKind.class);
        accounts.put(BrokerKind.ROBINHOOD, "Robinhood");
        accounts.put(BrokerKind.TASTYTRADE, "Tastytrade");
        return accounts;
    }
}
