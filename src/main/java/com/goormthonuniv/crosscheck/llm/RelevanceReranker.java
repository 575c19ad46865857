package com.goormthonuniv.crosscheck.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.goormthonuniv.crosscheck.dto.*;
import com.goormthonuniv.crosscheck.util.TextUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 수집된 모든 증거를 "kind:index" id 후보 목록으로 펼쳐 LLM 에 관련도/입장 점수를 받고,
 * {@link RerankPolicy} 가 고른 id 만 네 컬렉션 전체에 똑같이 남긴다.
 *
 * 오라클 실패는 그대로 던진다. 기록과 복구(재정렬 전 증거 유지)는 호출자 몫.
 * 후보 id 와 맞는 점수가 하나도 없는 응답이면 필터링 없이 그대로 돌려준다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RelevanceReranker {

    static final int SUMMARY_LEN = 260;
    private static final int CONTEXT_LEN = 220;
    private static final int MAX_CONTEXT_TOPICS = 8;

    private final RelevanceOracle oracle;
    private final ObjectMapper om;

    record Candidate(String id, String kind, String summary) {}

    public EvidenceSet rerank(Finding finding, PageContext pageContext, EvidenceSet evidence, String llmKey) {
        List<Candidate> candidates = candidates(evidence);
        if (candidates.isEmpty()) {
            return evidence;
        }

        JsonNode response = oracle.completeJson(prompt(finding, pageContext, candidates), llmKey);
        Set<String> candidateIds = candidates.stream().map(Candidate::id).collect(Collectors.toSet());
        // 후보에 없는 id 는 버린다
        List<ScoredCandidate> scored = scores(response).stream()
                .filter(s -> candidateIds.contains(s.id()))
                .toList();
        if (scored.isEmpty()) {
            log.info("rerank returned no usable scores; keeping {} candidates", candidates.size());
            return evidence;
        }

        Set<String> keep = RerankPolicy.keepSet(scored, finding.isMisinformation());
        EvidenceSet filtered = new EvidenceSet(
                keepOnly(evidence.factChecks(), "factcheck", keep),
                new Corroboration(
                        keepOnly(evidence.corroboration().wikipedia(), "wikipedia", keep),
                        keepOnly(evidence.corroboration().wikidata(), "wikidata", keep),
                        keepOnly(evidence.corroboration().pubmed(), "pubmed", keep)),
                keepOnly(evidence.newsArticles(), "gdelt", keep));
        log.info("rerank kept {}/{}", filtered.size(), candidates.size());
        return filtered;
    }

    // ----------------------------- candidates -----------------------------

    List<Candidate> candidates(EvidenceSet evidence) {
        List<Candidate> rows = new ArrayList<>();

        List<FactCheckMatch> factChecks = evidence.factChecks();
        for (int i = 0; i < factChecks.size(); i++) {
            FactCheckMatch m = factChecks.get(i);
            rows.add(new Candidate("factcheck:" + i, "factcheck", summary(
                    "publisher=" + TextUtils.nn(m.publisher()),
                    "title=" + TextUtils.nn(m.reviewTitle()),
                    TextUtils.isBlank(m.claimText()) ? "" : "claim=" + m.claimText(),
                    TextUtils.isBlank(m.textualRating()) ? "" : "rating=" + m.textualRating())));
        }
        addItems(rows, "wikipedia", evidence.corroboration().wikipedia());
        addItems(rows, "wikidata", evidence.corroboration().wikidata());
        addItems(rows, "pubmed", evidence.corroboration().pubmed());

        List<NewsArticle> articles = evidence.newsArticles();
        for (int i = 0; i < articles.size(); i++) {
            NewsArticle a = articles.get(i);
            rows.add(new Candidate("gdelt:" + i, "gdelt", summary(
                    "domain=" + TextUtils.nn(a.domain()),
                    "title=" + TextUtils.nn(a.title()),
                    a.tone() == null ? "" : "tone=" + String.format(Locale.ROOT, "%.1f", a.tone()))));
        }
        return rows;
    }

    private static void addItems(List<Candidate> rows, String kind, List<CorroborationItem> items) {
        for (int i = 0; i < items.size(); i++) {
            CorroborationItem item = items.get(i);
            rows.add(new Candidate(kind + ":" + i, kind,
                    summary("title=" + TextUtils.nn(item.title()), "snippet=" + TextUtils.nn(item.snippet()))));
        }
    }

    private static String summary(String... parts) {
        String joined = Arrays.stream(parts).filter(p -> !p.isEmpty()).collect(Collectors.joining(" | "));
        return TextUtils.ellipsize(joined, SUMMARY_LEN);
    }

    // ----------------------------- prompt -----------------------------

    String prompt(Finding finding, PageContext pageContext, List<Candidate> candidates) {
        PageContext ctx = pageContext == null ? PageContext.empty() : pageContext;
        String issueTypes = finding.issueTypes().stream().map(IssueType::wire).collect(Collectors.joining(", "));
        String correction = TextUtils.ellipsize(finding.correction(), CONTEXT_LEN);
        String contextSummary = TextUtils.ellipsize(ctx.summary(), CONTEXT_LEN);
        String contextTopics = ctx.topicKeywords().stream().limit(MAX_CONTEXT_TOPICS).collect(Collectors.joining(", "));

        ArrayNode json = om.createArrayNode();
        for (Candidate c : candidates) {
            json.addObject().put("id", c.id()).put("kind", c.kind()).put("summary", c.summary());
        }

        return String.join("\n",
                "You are a strict evidence relevance and stance filter for misinformation analysis.",
                "Task: score whether each candidate is truly relevant to evaluating the claim substance.",
                "Reject entity-only matches (e.g., person biography pages) when they do not address the claim topic.",
                "For misinformation findings, prefer critical/neutral/mixed verification context over supportive-only context.",
                "Return strict JSON only with shape:",
                "{\"items\":[{\"id\":\"string\",\"relevance\":0.0,\"useful\":true,\"stance\":\"critical|supportive|neutral|mixed|unknown\"}]}",
                "Scoring guidance:",
                "- relevance 0.0..1.0, where >=0.65 is strong topical match.",
                "- useful=true only when source helps verify, critique, or contextualize the claim topic directly.",
                "ISSUE_TYPES: " + issueTypes,
                "CLAIM_QUOTE: " + TextUtils.ellipsize(finding.quote(), SUMMARY_LEN),
                "RATIONALE: " + TextUtils.ellipsize(finding.rationale(), SUMMARY_LEN),
                "CORRECTION_HINT: " + orNone(correction),
                "PAGE_CONTEXT_SUMMARY: " + orNone(contextSummary),
                "PAGE_CONTEXT_TOPICS: " + orNone(contextTopics),
                "CANDIDATES_JSON: " + json);
    }

    private static String orNone(String s) {
        return s == null || s.isBlank() ? "none" : s;
    }

    // ----------------------------- response -----------------------------

    static List<ScoredCandidate> scores(JsonNode response) {
        if (response == null) return List.of();
        JsonNode items = response.isArray() ? response : response.path("items");
        if (!items.isArray()) return List.of();

        List<ScoredCandidate> out = new ArrayList<>();
        for (JsonNode item : items) {
            String id = item.path("id").asText("").trim();
            if (id.isEmpty()) continue;
            out.add(new ScoredCandidate(
                    id,
                    relevance(item.path("relevance")),
                    item.path("useful").asBoolean(false),
                    Stance.parse(item.path("stance").asText(null))));
        }
        return out;
    }

    private static double relevance(JsonNode node) {
        if (node.isNumber()) return node.asDouble();
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }

    private static <T> List<T> keepOnly(List<T> items, String kind, Set<String> keep) {
        List<T> out = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            if (keep.contains(kind + ":" + i)) out.add(items.get(i));
        }
        return out;
    }
}
