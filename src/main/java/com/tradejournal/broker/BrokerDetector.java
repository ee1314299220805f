package com.tradejournal.broker;

import com.tradejournal.domain.enums.BrokerKind;
import com.tradejournal.exception.UnsupportedBrokerFormatException;
import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Identifies the broker export format from its header set.
 *
 * <p>Robinhood activity exports carry the Activity Date / Trans Code / Instrument triple.
 * Tastytrade exports carry an explicit {@code Order #} column linking legs of one order.
 * Header matching is case-insensitive and ignores surrounding whitespace.
 */
@Component
public class BrokerDetector {

    private static final Set<String> ROBINHOOD_HEADERS = Set.of("activity date", "trans code", "instrument");
    private static final String ORDER_LINKAGE_HEADER = "order #";

    public BrokerKind detect(Collection<String> headers) {
        Set<String> normalized = headers.stream()
                .map(header -> header.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());

        if (normalized.containsAll(ROBINHOOD_HEADERS)) {
            return BrokerKind.ROBINHOOD;
        }
        if (normalized.contains(ORDER_LINKAGE_HEADER)) {
            return BrokerKind.TASTYTRADE;
        }
        throw new UnsupportedBrokerFormatException(headers);
    }
}
