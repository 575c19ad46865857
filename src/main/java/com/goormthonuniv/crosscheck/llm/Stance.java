package com.goormthonuniv.crosscheck.llm;

import java.util.Locale;

/** 후보가 주장에 대해 취하는 입장 */
public enum Stance {
    CRITICAL, SUPPORTIVE, NEUTRAL, MIXED, UNKNOWN;

    public static Stance parse(String raw) {
        if (raw == null) return UNKNOWN;
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "critical" -> CRITICAL;
            case "supportive" -> SUPPORTIVE;
            case "neutral" -> NEUTRAL;
            case "mixed" -> MIXED;
            default -> UNKNOWN;
        };
    }
}
