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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * E-utilities 2단계 조회: ESearch(논설/코멘트/레터 제외 필터) → ESummary 일괄 조회.
 * 제목 기반 품질 점수 후 정규화 제목으로 중복 제거, 점수→연도 순 상위 5건.
 */
@Slf4j
@Component
public class PubMedAdapter implements SourceAdapter<CorroborationItem> {

    static final String SEARCH_LABEL = "PubMed ESearch API";
    static final String SUMMARY_LABEL = "PubMed ESummary API";

    private static final String PUBLICATION_TYPE_FILTER =
            " NOT (editorial[Publication Type] OR comment[Publication Type] OR letter[Publication Type])";
    private static final Pattern YEAR = Pattern.compile("(?:19|20)\\d{2}");

    private final ProviderHttp http;
    private final String searchEndpoint;
    private final String summaryEndpoint;
    private final CrossCheckProperties.Biomedical weights;

    public PubMedAdapter(@Qualifier("providerRestClient") RestClient rest,
                         ObjectMapper om,
                         CrossCheckProperties props) {
        this.http = new ProviderHttp(rest, om);
        this.searchEndpoint = props.getEndpoints().getPubmedSearch();
        this.summaryEndpoint = props.getEndpoints().getPubmedSummary();
        this.weights = props.getScoring().getBiomedical();
    }

    @Override public String name() { return "pubmed"; }

    @Override
    public List<CorroborationItem> search(String query, SearchHints hints) {
        // 1) ID 검색
        Map<String, String> searchParams = new LinkedHashMap<>();
        searchParams.put("db", "pubmed");
        searchParams.put("term", query + PUBLICATION_TYPE_FILTER);
        searchParams.put("retmode", "json");
        searchParams.put("retmax", String.valueOf(weights.getFetchLimit()));
        searchParams.put("sort", "relevance");

        JsonNode idList = http.getJson(ProviderHttp.url(searchEndpoint, searchParams), SEARCH_LABEL, 1)
                .path("esearchresult").path("idlist");
        List<String> ids = new ArrayList<>();
        if (idList.isArray()) {
            idList.forEach(n -> ids.add(n.asText()));
        }
        if (ids.isEmpty()) {
            return List.of();
        }

        // 2) 요약 일괄 조회
        Map<String, String> summaryParams = new LinkedHashMap<>();
        summaryParams.put("db", "pubmed");
        summaryParams.put("id", String.join(",", ids));
        summaryParams.put("retmode", "json");

        JsonNode result = http.getJson(ProviderHttp.url(summaryEndpoint, summaryParams), SUMMARY_LABEL, 1)
                .path("result");
        List<String> uids = new ArrayList<>();
        if (result.path("uids").isArray()) {
            result.path("uids").forEach(n -> uids.add(n.asText()));
        } else {
            uids.addAll(ids);
        }

        List<Ranked> ranked = new ArrayList<>();
        for (String uid : uids) {
            JsonNode item = result.path(uid);
            String title = item.path("title").asText("").trim();
            if (title.isEmpty()) continue;

            String journal = firstNonBlank(item.path("fulljournalname").asText(""), item.path("source").asText(""), "PubMed");
            String pubdate = item.path("pubdate").asText("").trim();
            int score = score(title, pubdate, query);
            if (score < weights.getMinKeptScore()) continue;

            ranked.add(new Ranked(new CorroborationItem(
                    title,
                    pubdate.isEmpty() ? journal : journal + " (" + pubdate + ")",
                    "https://pubmed.ncbi.nlm.nih.gov/" + uid + "/",
                    CorroborationSource.PUBMED), score, extractYear(pubdate), titleKey(title)));
        }

        ranked.sort(Comparator.comparingInt(Ranked::score).reversed()
                .thenComparing(Comparator.comparingInt(Ranked::year).reversed()));

        LinkedHashMap<String, Ranked> deduped = new LinkedHashMap<>();
        for (Ranked r : ranked) {
            deduped.putIfAbsent(r.titleKey(), r);   // 정렬 후라 먼저 온 쪽이 점수가 높다
        }
        List<CorroborationItem> out = deduped.values().stream()
                .limit(weights.getMaxResults())
                .map(Ranked::item)
                .toList();
        log.debug("pubmed query=\"{}\" ids={} kept={}", query, ids.size(), out.size());
        return out;
    }

    // ----------------------------- scoring -----------------------------

    private record Ranked(CorroborationItem item, int score, int year, String titleKey) {}

    int score(String title, String pubdate, String query) {
        String t = title.toLowerCase(Locale.ROOT);
        if (t.contains("retracted")) {
            return weights.getRetractedScore();
        }

        int score = 0;
        for (String term : weights.getStrongQualityTerms()) {
            if (t.contains(term)) score += weights.getStrongQualityBonus();
        }
        for (String term : weights.getQualityTerms()) {
            if (t.contains(term)) score += weights.getQualityBonus();
        }
        for (String term : weights.getLowSignalTerms()) {
            if (t.contains(term)) score -= weights.getLowSignalPenalty();
        }

        int year = extractYear(pubdate);
        if (year >= 2020) score += 3;
        else if (year >= 2014) score += 2;
        else if (year >= 2005) score += 1;

        // 쿼리를 거의 그대로 되풀이하는 제목은 대개 논쟁 대상 논문 자체
        if (tokenOverlap(TextUtils.lowerTokens(title, 3), TextUtils.lowerTokens(query, 3)) >= weights.getEchoOverlap()) {
            score -= weights.getEchoPenalty();
        }
        return score;
    }

    static double tokenOverlap(List<String> left, List<String> right) {
        if (left.isEmpty() || right.isEmpty()) return 0;
        Set<String> l = new HashSet<>(left);
        Set<String> r = new HashSet<>(right);
        int inter = 0;
        for (String token : l) {
            if (r.contains(token)) inter++;
        }
        return (double) inter / Math.max(1, Math.min(l.size(), r.size()));
    }

    static int extractYear(String value) {
        if (value == null) return 0;
        Matcher m = YEAR.matcher(value);
        int year = 0;
        while (m.find()) year = Integer.parseInt(m.group());
        return year;
    }

    private static String titleKey(String title) {
        return title.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9\\s]", " ").replaceAll("\\s+", " ").trim();
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v.trim();
        }
        return "";
    }
}
