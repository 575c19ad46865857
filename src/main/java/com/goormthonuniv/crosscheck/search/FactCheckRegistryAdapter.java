package com.goormthonuniv.crosscheck.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.crosscheck.config.CrossCheckProperties;
import com.goormthonuniv.crosscheck.dto.FactCheckMatch;
import com.goormthonuniv.crosscheck.dto.NormalizedVerdict;
import com.goormthonuniv.crosscheck.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Google Fact Check Tools claims:search.
 * 키가 없으면 요청 없이 configured=false 를 돌려준다(오류 아님).
 */
@Slf4j
@Component
public class FactCheckRegistryAdapter {

    static final String LABEL = "Google Fact Check API";
    private static final int MAX_MATCHES = 12;

    // 순서가 곧 우선순위: 반박 → 지지 → 논쟁
    private static final Pattern CONTRADICTED = Pattern.compile(
            "(false|pants on fire|incorrect|fake|hoax|scam|baseless|fabricated|debunked|not true|mostly false)");
    private static final Pattern SUPPORTED = Pattern.compile(
            "(true|correct|accurate|supported|mostly true|legitimate)");
    private static final Pattern CONTESTED = Pattern.compile(
            "(misleading|partly|partially|half true|mixed|out of context|disputed|unproven)");

    private final ProviderHttp http;
    private final String endpoint;

    public FactCheckRegistryAdapter(@Qualifier("providerRestClient") RestClient rest,
                                    ObjectMapper om,
                                    CrossCheckProperties props) {
        this.http = new ProviderHttp(rest, om);
        this.endpoint = props.getEndpoints().getFactCheck();
    }

    public FactCheckResult search(String query, String apiKey) {
        String key = apiKey == null ? "" : apiKey.trim();
        if (key.isEmpty()) {
            return FactCheckResult.notConfigured();
        }

        Map<String, String> params = new LinkedHashMap<>();
        params.put("query", query);
        params.put("languageCode", "en");
        params.put("pageSize", "10");
        params.put("key", key);

        JsonNode root = http.getJson(ProviderHttp.url(endpoint, params), LABEL, 1);
        JsonNode claims = root.path("claims");

        List<FactCheckMatch> raw = new ArrayList<>();
        if (claims.isArray()) {
            for (JsonNode claim : claims) {
                String claimText = TextUtils.collapse(claim.path("text").asText(query));
                String claimant = TextUtils.blankToNull(claim.path("claimant").asText(""));
                JsonNode reviews = claim.path("claimReview");
                if (!reviews.isArray()) continue;

                for (JsonNode review : reviews) {
                    String publisher = firstNonBlank(
                            review.path("publisher").path("name").asText(""),
                            review.path("publisher").path("site").asText(""),
                            "Unknown Publisher");
                    String reviewTitle = firstNonBlank(review.path("title").asText(""), "Fact-check review");
                    String rating = TextUtils.blankToNull(review.path("textualRating").asText(""));

                    raw.add(new FactCheckMatch(
                            claimText.isEmpty() ? query : claimText,
                            claimant,
                            publisher,
                            reviewTitle,
                            rating,
                            review.path("url").asText("").trim(),
                            TextUtils.blankToNull(review.path("reviewDate").asText("")),
                            TextUtils.blankToNull(review.path("languageCode").asText("")),
                            normalizeVerdict(TextUtils.nn(rating) + " " + reviewTitle)
                    ));
                }
            }
        }

        List<FactCheckMatch> deduped = dedupe(raw);
        log.debug("fact-check query=\"{}\" claims={} matches={}", query, claims.size(), deduped.size());
        return new FactCheckResult(true, deduped);
    }

    static NormalizedVerdict normalizeVerdict(String text) {
        String t = TextUtils.nn(text).toLowerCase(Locale.ROOT);
        if (CONTRADICTED.matcher(t).find()) return NormalizedVerdict.CONTRADICTED;
        if (SUPPORTED.matcher(t).find()) return NormalizedVerdict.SUPPORTED;
        if (CONTESTED.matcher(t).find()) return NormalizedVerdict.CONTESTED;
        return NormalizedVerdict.UNKNOWN;
    }

    /** 리뷰 URL 기준(없으면 발행처|제목|날짜), 최대 12건 */
    private static List<FactCheckMatch> dedupe(List<FactCheckMatch> raw) {
        Set<String> seen = new HashSet<>();
        List<FactCheckMatch> out = new ArrayList<>();
        for (FactCheckMatch m : raw) {
            String key = !m.reviewUrl().isEmpty() ? m.reviewUrl()
                    : m.publisher() + "|" + m.reviewTitle() + "|" + TextUtils.nn(m.reviewDate());
            if (!seen.add(key)) continue;
            out.add(m);
            if (out.size() >= MAX_MATCHES) break;
        }
        return out;
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v.trim();
        }
        return "";
    }
}
