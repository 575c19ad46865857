package com.goormthonuniv.crosscheck.service;

import com.goormthonuniv.crosscheck.dto.Corroboration;
import com.goormthonuniv.crosscheck.dto.EvidenceSet;
import com.goormthonuniv.crosscheck.dto.NewsArticle;
import com.goormthonuniv.crosscheck.search.FactCheckResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 5갈래 조회가 모두 끝난 뒤의 원자료. errors 키는 실패한 파이프라인 이름.
 */
public record AggregatedEvidence(
        FactCheckResult factChecks,
        Corroboration corroboration,
        List<NewsArticle> newsArticles,
        Map<String, String> errors
) {
    public AggregatedEvidence {
        factChecks = factChecks == null ? FactCheckResult.notConfigured() : factChecks;
        corroboration = corroboration == null ? Corroboration.empty() : corroboration;
        newsArticles = newsArticles == null ? List.of() : List.copyOf(newsArticles);
        errors = errors == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public EvidenceSet evidence() {
        return new EvidenceSet(factChecks.matches(), corroboration, newsArticles);
    }
}
