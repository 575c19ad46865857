package com.goormthonuniv.crosscheck.dto;

import java.util.List;

/**
 * 판정 전 증거 묶음. 분류기와 재정렬기가 같은 모양으로 주고받는다.
 */
public record EvidenceSet(
        List<FactCheckMatch> factChecks,
        Corroboration corroboration,
        List<NewsArticle> newsArticles
) {
    public EvidenceSet {
        factChecks = factChecks == null ? List.of() : List.copyOf(factChecks);
        corroboration = corroboration == null ? Corroboration.empty() : corroboration;
        newsArticles = newsArticles == null ? List.of() : List.copyOf(newsArticles);
    }

    public static EvidenceSet empty() {
        return new EvidenceSet(List.of(), Corroboration.empty(), List.of());
    }

    public int size() {
        return factChecks.size() + corroboration.size() + newsArticles.size();
    }
}
