package com.goormthonuniv.crosscheck.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public record VerificationStatus(
        Code code,
        String label,
        String reason,
        Confidence confidence
) {
    public enum Code {
        SUPPORTED, CONTRADICTED, CONTESTED, UNVERIFIED;

        @JsonValue
        public String wire() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum Confidence {
        HIGH, MEDIUM, LOW;

        @JsonValue
        public String wire() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
