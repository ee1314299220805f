package com.tradejournal.broker.normalizer;

import com.tradejournal.domain.enums.BrokerKind;
import com.tradejournal.domain.enums.LegDirection;
import com.tradejournal.domain.enums.OrderSide;
import com.tradejournal.domain.model.Leg;
import com.tradejournal.exception.NormalizationException;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Normalizes Tastytrade transaction history rows.
 *
 * <p>Columns used: {@code Date} (ISO-8601 with offset, e.g. {@code 2025-06-02T10:31:45-0400}),
 * {@code Type}, {@code Sub Type}, {@code Action}, {@code Symbol} (OCC code),
 * {@code Instrument Type}, {@code Value} (signed), {@code Quantity},
 * {@code Underlying Symbol}, {@code Order #}.
 *
 * <p>Only {@code Equity Option} rows are trades. Fills have {@code Type = Trade}; expirations
 * arrive as {@code Receive Deliver} rows with an expiration sub type and no order number.
 * The timestamp keeps the exchange-local wall time and drops the offset.
 */
@Component
public class TastytradeLegNormalizer implements LegNormalizer {

    static final String DATE = "Date";
    static final String TYPE = "Type";
    static final String SUB_TYPE = "Sub Type";
    static final String ACTION = "Action";
    static final String SYMBOL = "Symbol";
    static final String INSTRUMENT_TYPE = "Instrument Type";
    static final String VALUE = "Value";
    static final String QUANTITY = "Quantity";
    static final String UNDERLYING_SYMBOL = "Underlying Symbol";
    static final String ORDER_NUMBER = "Order #";

    private static final String EQUITY_OPTION = "Equity Option";
    private static final String TRADE = "Trade";
    private static final String RECEIVE_DELIVER = "Receive Deliver";

    /** Accepts both {@code -0400} and {@code -04:00} style offsets. */
    private static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss[.SSS][XXX][XX]");

    @Override
    public BrokerKind broker() {
        return BrokerKind.TASTYTRADE;
    }

    @Override
    public boolean isTradeRow(Map<String, String> row) {
        if (!EQUITY_OPTION.equalsIgnoreCase(RowFields.get(row, INSTRUMENT_TYPE))) {
            return false;
        }
        String type = RowFields.get(row, TYPE);
        return TRADE.equalsIgnoreCase(type) || (RECEIVE_DELIVER.equalsIgnoreCase(type) && isExpiration(row));
    }

    @Override
    public Leg normalize(Map<String, String> row) {
        OptionContract contract = OptionSymbolParser.parseOcc(RowFields.get(row, SYMBOL));
        String underlying = RowFields.get(row, UNDERLYING_SYMBOL);
        boolean expiration = isExpiration(row);

        Leg.LegBuilder builder = Leg.builder()
                .underlying(underlying != null ? underlying : contract.underlying())
                .optionType(contract.optionType())
                .strike(contract.strike())
                .expiry(contract.expiry())
                .quantity(RowFields.quantity(row, QUANTITY))
                .timestamp(parseTimestamp(RowFields.get(row, DATE)))
                .orderKey(RowFields.get(row, ORDER_NUMBER))
                .expiration(expiration);

        if (expiration) {
            return builder.direction(LegDirection.CLOSE).amount(BigDecimal.ZERO).build();
        }

        String action = RowFields.get(row, ACTION);
        if (action == null) {
            throw new NormalizationException(ACTION, null);
        }
        switch (action.toUpperCase().replace(' ', '_')) {
            case "BUY_TO_OPEN" -> builder.direction(LegDirection.OPEN).side(OrderSide.BUY);
            case "SELL_TO_OPEN" -> builder.direction(LegDirection.OPEN).side(OrderSide.SELL);
            case "BUY_TO_CLOSE" -> builder.direction(LegDirection.CLOSE).side(OrderSide.BUY);
            case "SELL_TO_CLOSE" -> builder.direction(LegDirection.CLOSE).side(OrderSide.SELL);
            default -> throw new NormalizationException(ACTION, action);
        }

        return builder.amount(RowFields.amount(row, VALUE)).build();
    }

    private boolean isExpiration(Map<String, String> row) {
        String subType = RowFields.get(row, SUB_TYPE);
        return subType != null && subType.toLowerCase().contains("expiration");
    }

    private LocalDateTime parseTimestamp(String value) {
        if (value == null) {
            throw new NormalizationException(DATE, null);
        }
        try {
            return OffsetDateTime.parse(value, DATE_FORMAT).toLocalDateTime();
        } catch (DateTimeParseException e) {
            throw new NormalizationException(DATE, value, e);
        }
    }
}
