package com.goormthonuniv.crosscheck.verify;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum QueryIntent {
    MISINFORMATION("fact check false misleading"),
    ARGUMENTATION("claim context explained");

    private final String phrase;

    QueryIntent(String phrase) {
        this.phrase = phrase;
    }

    /** 변형 쿼리에 덧붙이는 의도별 구절 */
    public String phrase() {
        return phrase;
    }

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }
}
