package com.goormthonuniv.crosscheck.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.crosscheck.dto.*;
import com.goormthonuniv.crosscheck.llm.RelevanceOracle;
import com.goormthonuniv.crosscheck.llm.RelevanceReranker;
import com.goormthonuniv.crosscheck.search.*;
import com.goormthonuniv.crosscheck.verify.QueryPackBuilder;
import com.goormthonuniv.crosscheck.verify.VerdictClassifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class EvidenceVerifierTest {

    private final ObjectMapper om = new ObjectMapper();

    @Mock private FactCheckRegistryAdapter factChecks;
    @Mock private WikipediaAdapter wikipedia;
    @Mock private WikidataAdapter wikidata;
    @Mock private PubMedAdapter pubmed;
    @Mock private GdeltAdapter gdelt;
    @Mock private RelevanceOracle oracle;
    @Mock private EvidenceAggregator brokenAggregator;

    private final QueryPackBuilder queryPackBuilder = new QueryPackBuilder();
    private final VerdictClassifier classifier = new VerdictClassifier();

    private EvidenceVerifier verifier;

    private static final Finding BRIDGE = new Finding("f-1",
            "Officials said that the bridge collapsed because of sabotage, although engineers disagree.",
            "Investigators found the collapse was caused by a ship collision.",
            "Presents a disputed causal claim as settled.",
            List.of(IssueType.MISINFORMATION), 0.9, 0.8);

    private static final FactCheckMatch FALSE_RATING = new FactCheckMatch(
            "The bridge collapsed because of sabotage", null, "PolitiFact", "No evidence of sabotage",
            "False", "https://politifact.com/a", "2024-03-27", "en", NormalizedVerdict.CONTRADICTED);

    @BeforeEach
    void setUp() {
        EvidenceAggregator aggregator = new EvidenceAggregator(factChecks, wikipedia, wikidata, pubmed, gdelt, Runnable::run, Runnable::run);
        verifier = new EvidenceVerifier(queryPackBuilder, aggregator, classifier, new RelevanceReranker(oracle, om));
        given(factChecks.search(anyString(), any())).willReturn(FactCheckResult.notConfigured());
    }

    @Test
    @DisplayName("팩트체크가 전부 반박이면 contradicted/high")
    void contradictedByFactChecks() {
        // given
        given(factChecks.search(anyString(), eq("fc-key"))).willReturn(new FactCheckResult(true, List.of(FALSE_RATING)));

        // when
        FindingEvidence result = verifier.verify(BRIDGE, PageContext.empty(), new Credentials("fc-key", null));

        // then
        assertThat(result.status().code()).isEqualTo(VerificationStatus.Code.CONTRADICTED);
        assertThat(result.status().confidence()).isEqualTo(VerificationStatus.Confidence.HIGH);
        assertThat(result.factCheckConfigured()).isTrue();
        assertThat(result.findingId()).isEqualTo("f-1");
        assertThat(result.query()).isNotBlank();
        assertThat(result.generatedAt()).isNotNull();
        assertThat(result.errors()).isEmpty();
    }

    @Test
    @DisplayName("키가 없고 참고 출처가 2종 이상이면 unverified/low, 참고 출처 안내")
    void referencesOnlyWithoutKey() {
        given(wikipedia.search(anyString(), any())).willReturn(List.of(
                new CorroborationItem("Francis Scott Key Bridge collapse", "", "https://en.wikipedia.org/?curid=1", CorroborationSource.WIKIPEDIA)));
        given(wikidata.search(anyString(), any())).willReturn(List.of(
                new CorroborationItem("Francis Scott Key Bridge", "bridge in Maryland", "https://www.wikidata.org/wiki/Q1", CorroborationSource.WIKIDATA)));

        FindingEvidence result = verifier.verify(BRIDGE, null, Credentials.none());

        assertThat(result.status().code()).isEqualTo(VerificationStatus.Code.UNVERIFIED);
        assertThat(result.status().confidence()).isEqualTo(VerificationStatus.Confidence.LOW);
        assertThat(result.status().reason()).contains("reference sources");
        assertThat(result.factCheckConfigured()).isFalse();
    }

    @Test
    @DisplayName("뉴스 아카이브 실패는 에러로 남지 않는다")
    void newsArchiveFailureIsSilent() {
        given(gdelt.search(anyString(), any())).willThrow(new ProviderException("GDELT API", "GDELT API request failed."));

        FindingEvidence result = verifier.verify(BRIDGE, PageContext.empty(), Credentials.none());

        assertThat(result.errors()).isEmpty();
        assertThat(result.newsArticles()).isEmpty();
    }

    @Test
    @DisplayName("재정렬 결과로 증거를 걸러내고 판정을 다시 계산한다")
    void rerankFiltersAndReclassifies() throws Exception {
        // given
        given(factChecks.search(anyString(), eq("fc-key"))).willReturn(new FactCheckResult(true, List.of(FALSE_RATING)));
        given(wikipedia.search(anyString(), any())).willReturn(List.of(
                new CorroborationItem("John Doe (actor)", "American actor", "https://en.wikipedia.org/?curid=2", CorroborationSource.WIKIPEDIA)));
        given(oracle.completeJson(anyString(), eq("llm-key"))).willReturn(om.readTree("""
                {"items":[
                  {"id":"factcheck:0","relevance":0.9,"useful":true,"stance":"critical"},
                  {"id":"wikipedia:0","relevance":0.1,"useful":false,"stance":"neutral"}
                ]}
                """));

        // when
        FindingEvidence result = verifier.verify(BRIDGE, PageContext.empty(), new Credentials("fc-key", "llm-key"));

        // then
        assertThat(result.factChecks()).hasSize(1);
        assertThat(result.corroboration().wikipedia()).isEmpty();
        assertThat(result.status().code()).isEqualTo(VerificationStatus.Code.CONTRADICTED);
        assertThat(result.errors()).isEmpty();
    }

    @Test
    @DisplayName("재정렬이 실패하면 errors.rerank 를 남기고 재정렬 전 증거를 유지")
    void rerankFailureKeepsEvidence() {
        given(factChecks.search(anyString(), eq("fc-key"))).willReturn(new FactCheckResult(true, List.of(FALSE_RATING)));
        given(wikipedia.search(anyString(), any())).willReturn(List.of(
                new CorroborationItem("Bridge", "", "https://en.wikipedia.org/?curid=3", CorroborationSource.WIKIPEDIA)));
        given(oracle.completeJson(anyString(), eq("llm-key")))
                .willThrow(new ProviderException("OpenRouter API", 502, "OpenRouter API failed (502): bad gateway", null));

        FindingEvidence result = verifier.verify(BRIDGE, PageContext.empty(), new Credentials("fc-key", "llm-key"));

        assertThat(result.errors()).containsEntry(EvidenceVerifier.RERANK, "OpenRouter API failed (502): bad gateway");
        assertThat(result.factChecks()).hasSize(1);
        assertThat(result.corroboration().wikipedia()).hasSize(1);
        assertThat(result.status().code()).isEqualTo(VerificationStatus.Code.CONTRADICTED);
    }

    @Test
    @DisplayName("예상 못한 실패는 던지지 않고 errors.engine 과 unverified 로 돌려준다")
    void unexpectedFailureBecomesEngineError() {
        // given
        EvidenceVerifier fragile = new EvidenceVerifier(queryPackBuilder, brokenAggregator, classifier, new RelevanceReranker(oracle, om));
        given(brokenAggregator.aggregate(any(), any())).willThrow(new IllegalStateException("executor gone"));

        // when
        FindingEvidence result = fragile.verify(BRIDGE, PageContext.empty(), new Credentials("fc-key", null));

        // then
        assertThat(result.errors()).containsOnlyKeys(EvidenceVerifier.ENGINE);
        assertThat(result.errors().get(EvidenceVerifier.ENGINE)).isEqualTo("executor gone");
        assertThat(result.status().code()).isEqualTo(VerificationStatus.Code.UNVERIFIED);
        assertThat(result.factCheckConfigured()).isTrue();
        assertThat(result.query()).isNotBlank();
        assertThat(result.findingQuote()).isEqualTo(BRIDGE.quote());
    }
}
