package com.goormthonuniv.crosscheck.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.crosscheck.config.CrossCheckProperties;
import com.goormthonuniv.crosscheck.dto.NewsArticle;
import com.goormthonuniv.crosscheck.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.net.URI;
import java.util.*;

/**
 * GDELT DOC 2.0 ArtList. 모든 요청은 {@link NewsRateGovernor} 를 거친다.
 *
 * 1차: 고신뢰 도메인 OR 필터로 범위 제한 → 0건이면 같은 키워드로 범위 없이 2차.
 * 429/깨진 응답/타임아웃은 "이 쿼리에 데이터 없음"으로 취급한다(예외를 던지지 않음).
 */
@Slf4j
@Component
public class GdeltAdapter implements SourceAdapter<NewsArticle> {

    static final String LABEL = "GDELT API";
    private static final int MAX_RESULTS = 5;

    private final RestClient rest;
    private final ObjectMapper om;
    private final NewsRateGovernor governor;
    private final NewsDomainPolicy domains;
    private final String endpoint;
    private final CrossCheckProperties.NewsArchive config;

    public GdeltAdapter(@Qualifier("newsArchiveRestClient") RestClient rest,
                        ObjectMapper om,
                        NewsRateGovernor governor,
                        NewsDomainPolicy domains,
                        CrossCheckProperties props) {
        this.rest = rest;
        this.om = om;
        this.governor = governor;
        this.domains = domains;
        this.endpoint = props.getEndpoints().getGdelt();
        this.config = props.getNewsArchive();
    }

    @Override public String name() { return "gdelt"; }

    @Override
    public List<NewsArticle> search(String query, SearchHints hints) {
        String keywords = TextUtils.searchKeywords(query);
        if (keywords.isBlank()) return List.of();

        JsonNode primary = fetch(buildUrl(keywords + " " + domains.trustedFilter()));
        if (primary == null) {
            return List.of();
        }
        List<NewsArticle> articles = mapArticles(primary);
        if (!articles.isEmpty()) {
            log.debug("gdelt trusted-scope query=\"{}\" hits={}", keywords, articles.size());
            return articles;
        }

        JsonNode fallback = fetch(buildUrl(keywords));
        if (fallback == null) {
            return List.of();
        }
        articles = mapArticles(fallback);
        log.debug("gdelt unscoped query=\"{}\" hits={}", keywords, articles.size());
        return articles;
    }

    // ----------------------------- helpers -----------------------------

    /** 가장 비판적인(음수) 톤부터 */
    private String buildUrl(String query) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("query", query);
        params.put("mode", "ArtList");
        params.put("format", "json");
        params.put("maxrecords", String.valueOf(config.getMaxRecords()));
        params.put("timespan", config.getTimespan());
        params.put("sort", "ToneAsc");
        return ProviderHttp.url(endpoint, params);
    }

    private JsonNode fetch(String url) {
        try {
            return governor.execute(() -> {
                try {
                    String body = rest.get()
                            .uri(URI.create(url))
                            .accept(MediaType.APPLICATION_JSON)
                            .retrieve()
                            .body(String.class);
                    if (body == null || body.isBlank()) return null;
                    return om.readTree(body);
                } catch (RestClientResponseException e) {
                    if (e.getStatusCode().value() == 429) {
                        log.debug("gdelt rate-limited (429); treating as no data");
                    } else {
                        log.debug("gdelt status {}; treating as no data", e.getStatusCode().value());
                    }
                    return null;
                } catch (Exception e) {
                    log.debug("gdelt unusable response: {}", e.getMessage());
                    return null;
                }
            });
        } catch (ProviderException e) {
            log.debug("gdelt skipped: {}", e.getMessage());
            return null;
        }
    }

    private List<NewsArticle> mapArticles(JsonNode root) {
        JsonNode raw = root.path("articles");
        if (!raw.isArray()) return List.of();

        List<NewsArticle> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (JsonNode a : raw) {
            String url = a.path("url").asText("").trim();
            if (url.isEmpty() || !seen.add(url)) continue;

            String domain = a.path("domain").asText("").trim();
            if (domain.isEmpty()) {
                String host = domains.normalizeHost(url);
                domain = host == null ? "unknown" : host;
            }
            String title = a.path("title").asText("").trim();

            out.add(new NewsArticle(
                    title.isEmpty() ? "Related article" : title,
                    url,
                    domain,
                    tone(a.path("tone")),
                    TextUtils.blankToNull(a.path("seendate").asText("")),
                    TextUtils.blankToNull(a.path("language").asText(""))
            ));
            if (out.size() >= MAX_RESULTS) break;
        }
        return out;
    }

    private static Double tone(JsonNode node) {
        if (node.isNumber()) {
            double v = node.asDouble();
            return Double.isFinite(v) ? v : null;
        }
        if (node.isTextual()) {
            try {
                double v = Double.parseDouble(node.asText().trim());
                return Double.isFinite(v) ? v : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
