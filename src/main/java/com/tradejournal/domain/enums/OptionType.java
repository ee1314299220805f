package com.tradejournal.domain.enums;

/**
 * Call or put. Broker exports spell these differently ("Call", "CALL", "C"),
 * so parsing is centralised here.
 */
public enum OptionType {
    CALL("Call"),
    PUT("Put");

    private final String label;

    OptionType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Parses a broker label into an option type.
     *
     * @return the type, or null when the label is neither a call nor a put
     */
    public static OptionType fromLabel(String label) {
        if (label == null) {
            return null;
        }
        return switch (label.trim().toUpperCase()) {
            case "CALL", "C" -> CALL;
            case "PUT", "P" -> PUT;
            default -> null;
        };
    }
}
