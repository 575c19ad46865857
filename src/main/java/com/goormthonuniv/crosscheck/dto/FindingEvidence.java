package com.goormthonuniv.crosscheck.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

public record FindingEvidence(
        String findingId,
        String findingQuote,
        String query,                       // QueryPack 의 compact claim
        OffsetDateTime generatedAt,
        VerificationStatus status,
        List<FactCheckMatch> factChecks,
        Corroboration corroboration,
        List<NewsArticle> newsArticles,
        boolean factCheckConfigured,        // 자격증명 유무. "매치 0건"과 구분된다
        Map<String, String> errors          // factChecks | wikipedia | wikidata | pubmed | rerank | engine
) {
    public FindingEvidence {
        factChecks = factChecks == null ? List.of() : List.copyOf(factChecks);
        corroboration = corroboration == null ? Corroboration.empty() : corroboration;
        newsArticles = newsArticles == null ? List.of() : List.copyOf(newsArticles);
        errors = errors == null ? Map.of() : Map.copyOf(errors);
    }
}
