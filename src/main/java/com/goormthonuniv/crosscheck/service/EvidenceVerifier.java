package com.goormthonuniv.crosscheck.service;

import com.goormthonuniv.crosscheck.dto.*;
import com.goormthonuniv.crosscheck.llm.RelevanceReranker;
import com.goormthonuniv.crosscheck.verify.QueryPack;
import com.goormthonuniv.crosscheck.verify.QueryPackBuilder;
import com.goormthonuniv.crosscheck.verify.VerdictClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 검증 진입점: Finding → QueryPack → 5갈래 집계 → 1차 판정 → (LLM 키가 있으면) 재정렬 후 재판정.
 *
 * 절대 던지지 않는다. 예상 못한 실패는 errors.engine 으로 남기고 unverified/low 를 돌려준다.
 * 재정렬 실패는 errors.rerank 로 남기고 재정렬 전 증거와 판정을 그대로 쓴다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EvidenceVerifier {

    static final String RERANK = "rerank";
    static final String ENGINE = "engine";

    private final QueryPackBuilder queryPackBuilder;
    private final EvidenceAggregator aggregator;
    private final VerdictClassifier classifier;
    private final RelevanceReranker reranker;

    public FindingEvidence verify(Finding finding, PageContext pageContext, Credentials credentials) {
        Credentials creds = credentials == null ? Credentials.none() : credentials;
        String query = "";
        try {
            QueryPack pack = queryPackBuilder.build(finding, pageContext);
            query = pack.primary();

            AggregatedEvidence aggregated = aggregator.aggregate(pack, creds);
            Map<String, String> errors = new LinkedHashMap<>(aggregated.errors());
            EvidenceSet evidence = aggregated.evidence();
            VerificationStatus status = classifier.classify(evidence.factChecks(), evidence.corroboration());

            if (creds.hasLlmKey()) {
                try {
                    evidence = reranker.rerank(finding, pageContext, evidence, creds.llmKey());
                    status = classifier.classify(evidence.factChecks(), evidence.corroboration());
                } catch (RuntimeException e) {
                    String msg = EvidenceAggregator.message(e);
                    errors.put(RERANK, msg);
                    log.warn("rerank failed, keeping pre-rerank evidence: {}", msg);
                }
            }

            return new FindingEvidence(
                    finding.id(),
                    finding.quote(),
                    query,
                    OffsetDateTime.now(ZoneOffset.UTC),
                    status,
                    evidence.factChecks(),
                    evidence.corroboration(),
                    evidence.newsArticles(),
                    aggregated.factChecks().configured(),
                    errors);
        } catch (RuntimeException e) {
            String msg = EvidenceAggregator.message(e);
            log.error("verification failed for finding {}: {}", finding == null ? null : finding.id(), msg, e);
            return new FindingEvidence(
                    finding == null ? null : finding.id(),
                    finding == null ? null : finding.quote(),
                    query,
                    OffsetDateTime.now(ZoneOffset.UTC),
                    classifier.classify(List.of(), Corroboration.empty()),
                    List.of(),
                    Corroboration.empty(),
                    List.of(),
                    creds.hasFactCheckKey(),
                    Map.of(ENGINE, msg));
        }
    }
}
