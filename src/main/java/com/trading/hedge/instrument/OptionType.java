package com.trading.hedge.instrument;

public enum OptionType {
    CALL,
    PUT;

    public static OptionType fromString(String s) {
        if (s == null)
            return CALL;
        return switch (s.trim().toLowerCase()) {
            case "call", "c" -> CALL;
            case "put", "p" -> PUT;
            default -> throw new IllegalArgumentException("Unknown option type: " + s);
        };
    }
}
