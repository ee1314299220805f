package com.tradejournal.broker.normalizer;

import com.tradejournal.config.ReconstructionConfig;
import com.tradejournal.domain.enums.BrokerKind;
import com.tradejournal.domain.enums.LegDirection;
import com.tradejournal.domain.enums.OrderSide;
import com.tradejournal.domain.model.Leg;
import com.tradejournal.exception.NormalizationException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Normalizes Robinhood activity export rows.
 *
 * <p>Columns used: {@code Activity Date} (M/d/yyyy), {@code Instrument}, {@code Description}
 * ({@code SYMBOL M/D/YYYY Call|Put $Strike}), {@code Trans Code}, {@code Quantity},
 * {@code Amount} ({@code $42.94} / {@code ($70.04)}).
 *
 * <p>Trans codes: STO/BTO open, STC/BTC close, OEXP expiration. Expiration descriptions carry an
 * {@code Option Expiration for } prefix. Robinhood has no order identifier and only day-level
 * dates, so legs carry no order key and a midnight timestamp.
 */
@Component
public class RobinhoodLegNormalizer implements LegNormalizer {

    static final String ACTIVITY_DATE = "Activity Date";
    static final String INSTRUMENT = "Instrument";
    static final String DESCRIPTION = "Description";
    static final String TRANS_CODE = "Trans Code";
    static final String QUANTITY = "Quantity";
    static final String AMOUNT = "Amount";

    private static final String EXPIRATION_CODE = "OEXP";
    private static final String EXPIRATION_PREFIX = "option expiration for ";
    private static final Set<String> TRADE_CODES = Set.of("STO", "BTO", "STC", "BTC", EXPIRATION_CODE);
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("M/d/yyyy");

    private final ReconstructionConfig reconstructionConfig;

    public RobinhoodLegNormalizer(ReconstructionConfig reconstructionConfig) {
        this.reconstructionConfig = reconstructionConfig;
    }

    @Override
    public BrokerKind broker() {
        return BrokerKind.ROBINHOOD;
    }

    @Override
    public boolean isTradeRow(Map<String, String> row) {
        String transCode = RowFields.get(row, TRANS_CODE);
        if (transCode == null || !TRADE_CODES.contains(transCode.toUpperCase())) {
            return false;
        }
        String description = RowFields.get(row, DESCRIPTION);
        if (RowFields.get(row, INSTRUMENT) == null || description == null) {
            return false;
        }
        return reconstructionConfig.getRobinhood().getExcludedDescriptions().stream()
                .noneMatch(description::contains);
    }

    @Override
    public Leg normalize(Map<String, String> row) {
        String transCode = RowFields.get(row, TRANS_CODE).toUpperCase();
        boolean expiration = EXPIRATION_CODE.equals(transCode);

        OptionContract contract = OptionSymbolParser.parseDescription(stripExpirationPrefix(RowFields.get(row, DESCRIPTION)));

        Leg.LegBuilder builder = Leg.builder()
                .underlying(contract.underlying())
                .optionType(contract.optionType())
                .strike(contract.strike())
                .expiry(contract.expiry())
                .quantity(RowFields.quantity(row, QUANTITY))
                .timestamp(parseActivityDate(RowFields.get(row, ACTIVITY_DATE)).atStartOfDay())
                .expiration(expiration);

        if (expiration) {
            return builder.direction(LegDirection.CLOSE).amount(BigDecimal.ZERO).build();
        }

        return builder.direction(transCode.endsWith("O") ? LegDirection.OPEN : LegDirection.CLOSE)
                .side(transCode.startsWith("B") ? OrderSide.BUY : OrderSide.SELL)
                .amount(RowFields.amount(row, AMOUNT))
                .build();
    }

    private String stripExpirationPrefix(String description) {
        if (description.toLowerCase().startsWith(EXPIRATION_PREFIX)) {
            return description.substring(EXPIRATION_PREFIX.length());
        }
        return description;
    }

    private LocalDate parseActivityDate(String value) {
        if (value == null) {
            throw new NormalizationException(ACTIVITY_DATE, null);
        }
        try {
            return LocalDate.parse(value, DATE_FORMAT);
        } catch (DateTimeParseException e) {
            throw new NormalizationException(ACTIVITY_DATE, value, e);
        }
    }
}
