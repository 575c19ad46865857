package com.goormthonuniv.crosscheck.dto;

import java.util.List;

public record Corroboration(
        List<CorroborationItem> wikipedia,
        List<CorroborationItem> wikidata,
        List<CorroborationItem> pubmed
) {
    public Corroboration {
        wikipedia = wikipedia == null ? List.of() : List.copyOf(wikipedia);
        wikidata = wikidata == null ? List.of() : List.copyOf(wikidata);
        pubmed = pubmed == null ? List.of() : List.copyOf(pubmed);
    }

    public static Corroboration empty() {
        return new Corroboration(List.of(), List.of(), List.of());
    }

    /** 비어 있지 않은 참고 출처 종류 수(0~3) */
    public int nonEmptySources() {
        int n = 0;
        if (!wikipedia.isEmpty()) n++;
        if (!wikidata.isEmpty()) n++;
        if (!pubmed.isEmpty()) n++;
        return n;
    }

    public int size() {
        return wikipedia.size() + wikidata.size() + pubmed.size();
    }
}
