package com.goormthonuniv.crosscheck.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.crosscheck.dto.*;
import com.goormthonuniv.crosscheck.search.ProviderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RelevanceRerankerTest {

    private final ObjectMapper om = new ObjectMapper();

    @Mock
    private RelevanceOracle oracle;

    private RelevanceReranker reranker;
    private EvidenceSet evidence;

    @BeforeEach
    void setUp() {
        reranker = new RelevanceReranker(oracle, om);
        evidence = new EvidenceSet(
                List.of(new FactCheckMatch("Bridge sabotage claim", null, "PolitiFact", "No, the bridge was not sabotaged",
                        "False", "https://politifact.example/1", null, "en", NormalizedVerdict.CONTRADICTED)),
                new Corroboration(
                        List.of(new CorroborationItem("Francis Scott Key Bridge collapse", "Ship allision", "https://w/1", CorroborationSource.WIKIPEDIA),
                                new CorroborationItem("John Doe (actor)", "American actor", "https://w/2", CorroborationSource.WIKIPEDIA)),
                        List.of(),
                        List.of()),
                List.of(new NewsArticle("Investigators rule out sabotage", "https://apnews.com/x", "apnews.com", -4.2, null, "English")));
    }

    private static Finding finding(IssueType type) {
        return new Finding("f-1", "The bridge collapsed because of sabotage", "It was a ship collision", "Unsupported causal claim",
                List.of(type), 0.9, 0.7);
    }

    @Test
    @DisplayName("keep 집합에 든 id 만 모든 컬렉션에서 남긴다")
    void filtersByKeepIds() {
        // given
        when(oracle.completeJson(anyString(), eq("llm-key"))).thenReturn(om.createObjectNode()
                .set("items", om.createArrayNode()
                        .add(om.createObjectNode().put("id", "factcheck:0").put("relevance", 0.9).put("useful", true).put("stance", "critical"))
                        .add(om.createObjectNode().put("id", "wikipedia:0").put("relevance", 0.8).put("useful", true).put("stance", "neutral"))
                        .add(om.createObjectNode().put("id", "wikipedia:1").put("relevance", 0.1).put("useful", false).put("stance", "unknown"))
                        .add(om.createObjectNode().put("id", "gdelt:0").put("relevance", "0.7").put("useful", true).put("stance", "critical"))));

        // when
        EvidenceSet result = reranker.rerank(finding(IssueType.MISINFORMATION), null, evidence, "llm-key");

        // then
        assertThat(result.factChecks()).hasSize(1);
        assertThat(result.corroboration().wikipedia()).extracting(CorroborationItem::title)
                .containsExactly("Francis Scott Key Bridge collapse");
        assertThat(result.newsArticles()).hasSize(1);
    }

    @Test
    @DisplayName("프롬프트에 후보 id, 인용문, 이슈 유형이 들어간다")
    void promptCarriesCandidates() {
        // given
        when(oracle.completeJson(anyString(), anyString())).thenReturn(om.createObjectNode().set("items", om.createArrayNode()));
        PageContext ctx = new PageContext("Coverage of the Baltimore bridge collapse", List.of("bridge", "ship"), List.of("Baltimore"));

        // when
        reranker.rerank(finding(IssueType.FALLACY), ctx, evidence, "llm-key");

        // then
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(oracle).completeJson(prompt.capture(), eq("llm-key"));
        assertThat(prompt.getValue())
                .contains("ISSUE_TYPES: fallacy")
                .contains("CLAIM_QUOTE: The bridge collapsed because of sabotage")
                .contains("PAGE_CONTEXT_TOPICS: bridge, ship")
                .contains("\"id\":\"factcheck:0\"")
                .contains("\"id\":\"wikipedia:1\"")
                .contains("\"id\":\"gdelt:0\"")
                .contains("tone=-4.2");
    }

    @Test
    @DisplayName("점수가 하나도 없으면 그대로 통과")
    void noUsableScoresPassThrough() {
        when(oracle.completeJson(anyString(), anyString())).thenReturn(om.createObjectNode().put("answer", "n/a"));

        EvidenceSet result = reranker.rerank(finding(IssueType.BIAS), null, evidence, "llm-key");

        assertThat(result).isEqualTo(evidence);
    }

    @Test
    @DisplayName("후보에 없는 id 만 돌아오면 증거를 지우지 않고 그대로 통과")
    void unknownIdsPassThrough() {
        // given
        when(oracle.completeJson(anyString(), anyString())).thenReturn(om.createObjectNode()
                .set("items", om.createArrayNode()
                        .add(om.createObjectNode().put("id", "1").put("relevance", 0.9).put("useful", true))
                        .add(om.createObjectNode().put("id", "wikipedia:7").put("relevance", 0.95).put("useful", true))));

        // when
        EvidenceSet result = reranker.rerank(finding(IssueType.BIAS), null, evidence, "llm-key");

        // then
        assertThat(result).isEqualTo(evidence);
        assertThat(result.corroboration().wikipedia()).hasSize(2);
        assertThat(result.newsArticles()).hasSize(1);
    }

    @Test
    @DisplayName("후보가 없으면 오라클을 부르지 않는다")
    void emptyEvidenceSkipsOracle() {
        EvidenceSet result = reranker.rerank(finding(IssueType.BIAS), null, EvidenceSet.empty(), "llm-key");

        assertThat(result.size()).isZero();
        verifyNoInteractions(oracle);
    }

    @Test
    @DisplayName("오라클 실패는 그대로 전파된다")
    void oracleFailurePropagates() {
        when(oracle.completeJson(anyString(), anyString()))
                .thenThrow(new ProviderException("OpenRouter API", 502, "OpenRouter API failed (502): bad gateway", null));

        assertThatThrownBy(() -> reranker.rerank(finding(IssueType.MISINFORMATION), null, evidence, "llm-key"))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("502");
    }
}
