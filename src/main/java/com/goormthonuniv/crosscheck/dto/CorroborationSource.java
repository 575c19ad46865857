package com.goormthonuniv.crosscheck.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CorroborationSource {
    WIKIPEDIA("Wikipedia"),
    WIKIDATA("Wikidata"),
    PUBMED("PubMed");

    private final String label;

    CorroborationSource(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
