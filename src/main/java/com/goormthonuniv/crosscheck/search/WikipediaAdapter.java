package com.goormthonuniv.crosscheck.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.crosscheck.config.CrossCheckProperties;
import com.goormthonuniv.crosscheck.dto.CorroborationItem;
import com.goormthonuniv.crosscheck.dto.CorroborationSource;
import com.goormthonuniv.crosscheck.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.*;
import java.util.regex.Pattern;

/**
 * MediaWiki list=search.
 *
 * 자유 텍스트를 "intitle:앵커 나머지term" 형태로 바꾸고, 결과마다 term 겹침 점수를 매겨
 * 점수 하한을 넘는 것만 남긴다.
 * - 행정부/정책 총괄 문서("... administration", "domestic policy")는 감점
 * - 엔티티만 겹치고 토픽은 전혀 안 겹치는 결과(인물 약력 등)는 감점
 * - 호출자 토픽이 2개 이상인데 하한을 넘는 게 없으면 정렬 안 된 잡음 대신 빈 목록
 */
@Slf4j
@Component
public class WikipediaAdapter implements SourceAdapter<CorroborationItem> {

    static final String LABEL = "Wikipedia API";
    private static final int MAX_TERMS = 8;
    private static final int MAX_UNSCOPED = 5;

    private static final Pattern ADMINISTRATION_PAGE = Pattern.compile(
            "policy of the (first|second)|domestic policy|economic policy|administration");

    private static final Set<String> STOPWORDS = Set.of(
            "a", "an", "the", "and", "or", "but", "to", "of", "in", "for", "on", "with", "at", "by",
            "from", "is", "are", "was", "were", "be", "been", "being", "has", "have", "had", "can",
            "could", "would", "should", "that", "this", "these", "those", "it", "its", "they", "them",
            "their", "he", "she", "his", "her", "denied", "shown", "showed", "says", "said", "claim", "claims"
    );

    private final ProviderHttp http;
    private final String endpoint;
    private final CrossCheckProperties.Encyclopedic weights;

    public WikipediaAdapter(@Qualifier("providerRestClient") RestClient rest,
                            ObjectMapper om,
                            CrossCheckProperties props) {
        this.http = new ProviderHttp(rest, om);
        this.endpoint = props.getEndpoints().getWikipedia();
        this.weights = props.getScoring().getEncyclopedic();
    }

    @Override public String name() { return "wikipedia"; }

    @Override
    public List<CorroborationItem> search(String query, SearchHints hints) {
        SearchHints h = hints == null ? SearchHints.none() : hints;
        RewrittenQuery rq = rewrite(query);

        Map<String, String> params = new LinkedHashMap<>();
        params.put("action", "query");
        params.put("list", "search");
        params.put("srsearch", rq.apiQuery());
        params.put("utf8", "1");
        params.put("format", "json");
        params.put("srlimit", String.valueOf(weights.getMaxRawResults()));

        JsonNode root = http.getJson(ProviderHttp.url(endpoint, params), LABEL, 1);
        JsonNode results = root.path("query").path("search");
        if (!results.isArray() || results.isEmpty()) {
            return List.of();
        }

        List<Scored> scored = new ArrayList<>();
        for (JsonNode item : results) {
            String title = item.path("title").asText("Wikipedia page").trim();
            String snippet = TextUtils.stripHtml(item.path("snippet").asText(""));
            int score = score(title, snippet, rq.terms(), h);
            scored.add(new Scored(new CorroborationItem(
                    title.isEmpty() ? "Wikipedia page" : title,
                    snippet,
                    "https://en.wikipedia.org/?curid=" + item.path("pageid").asText(""),
                    CorroborationSource.WIKIPEDIA), score));
            if (scored.size() >= weights.getMaxRawResults()) break;
        }
        scored.sort(Comparator.comparingInt(Scored::score).reversed());

        int floor = rq.terms().size() >= weights.getRichQueryTerms() ? weights.getRichFloor() : weights.getBaseFloor();
        List<Scored> kept = scored.stream().filter(s -> s.score() >= floor).toList();
        if (kept.isEmpty()) {
            if (h.topicTerms().size() >= 2) {
                log.debug("wikipedia query=\"{}\" raw={} nothing above floor {}", rq.apiQuery(), scored.size(), floor);
                return List.of();
            }
            kept = scored;
        }

        List<CorroborationItem> out = kept.stream()
                .limit(weights.getMaxResults())
                .map(Scored::item)
                .toList();
        log.debug("wikipedia query=\"{}\" raw={} kept={}", rq.apiQuery(), scored.size(), out.size());
        return out;
    }

    // ----------------------------- helpers -----------------------------

    record RewrittenQuery(String apiQuery, List<String> terms) {}

    private record Scored(CorroborationItem item, int score) {}

    /** 토픽 앵커 하나는 intitle: 로 묶고 나머지 term 은 그대로 붙인다 */
    RewrittenQuery rewrite(String rawQuery) {
        List<String> terms = tokenize(TextUtils.searchKeywords(rawQuery)).stream()
                .distinct()
                .limit(MAX_TERMS)
                .toList();
        if (terms.isEmpty()) {
            return new RewrittenQuery(TextUtils.collapse(rawQuery), List.of());
        }

        String anchor = pickAnchor(terms);
        List<String> parts = new ArrayList<>();
        parts.add("intitle:" + anchor);
        terms.stream().filter(t -> !t.equals(anchor)).limit(MAX_UNSCOPED).forEach(parts::add);
        return new RewrittenQuery(String.join(" ", parts), terms);
    }

    int score(String title, String snippet, List<String> terms, SearchHints hints) {
        if (terms.isEmpty()) return 0;
        String t = title.toLowerCase(Locale.ROOT);
        String combined = t + " " + snippet.toLowerCase(Locale.ROOT);

        int overlap = 0;
        int titleOverlap = 0;
        for (String term : terms) {
            if (combined.contains(term)) overlap++;
            if (t.contains(term)) titleOverlap++;
        }
        int score = overlap * weights.getCombinedWeight() + titleOverlap * weights.getTitleWeight();

        int topicHits = 0;
        for (String term : hints.topicTerms()) {
            if (combined.contains(term)) topicHits++;
        }
        int entityHits = 0;
        for (String term : hints.entityTerms()) {
            if (combined.contains(term)) entityHits++;
        }
        score += (topicHits + entityHits) * weights.getHintBonus();

        if (ADMINISTRATION_PAGE.matcher(t).find()) {
            score -= weights.getAdministrationPenalty();
        }

        // 엔티티만 겹침: 질의 term 중 엔티티가 아닌 것과 토픽 힌트가 하나도 안 맞음
        boolean queryTopicHit = terms.stream()
                .filter(term -> !hints.entityTerms().contains(term))
                .anyMatch(combined::contains);
        if (entityHits > 0 && topicHits == 0 && !queryTopicHit) {
            score -= weights.getEntityOnlyPenalty();
        }
        return score;
    }

    private String pickAnchor(List<String> terms) {
        for (String candidate : weights.getTopicAnchors()) {
            if (terms.contains(candidate)) return candidate;
        }
        return terms.stream().max(Comparator.comparingInt(String::length)).orElse(terms.get(0));
    }

    private static List<String> tokenize(String text) {
        List<String> out = new ArrayList<>();
        for (String token : text.toLowerCase(Locale.ROOT).replaceAll("[^\\w\\s-]", " ").split("\\s+")) {
            if (token.length() > 2 && !STOPWORDS.contains(token)) out.add(token);
        }
        return out;
    }
}
