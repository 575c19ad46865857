package com.goormthonuniv.crosscheck.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.crosscheck.config.CrossCheckProperties;
import com.goormthonuniv.crosscheck.dto.CorroborationItem;
import com.goormthonuniv.crosscheck.dto.CorroborationSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * wbsearchentities 단발 조회, 상위 5개. 제공자 순위 외 필터링 없음.
 */
@Slf4j
@Component
public class WikidataAdapter implements SourceAdapter<CorroborationItem> {

    static final String LABEL = "Wikidata API";
    private static final int LIMIT = 5;

    private final ProviderHttp http;
    private final String endpoint;

    public WikidataAdapter(@Qualifier("providerRestClient") RestClient rest,
                           ObjectMapper om,
                           CrossCheckProperties props) {
        this.http = new ProviderHttp(rest, om);
        this.endpoint = props.getEndpoints().getWikidata();
    }

    @Override public String name() { return "wikidata"; }

    @Override
    public List<CorroborationItem> search(String query, SearchHints hints) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("action", "wbsearchentities");
        params.put("search", query);
        params.put("language", "en");
        params.put("format", "json");
        params.put("limit", String.valueOf(LIMIT));

        JsonNode results = http.getJson(ProviderHttp.url(endpoint, params), LABEL, 1).path("search");
        if (!results.isArray()) return List.of();

        List<CorroborationItem> out = new ArrayList<>();
        for (JsonNode item : results) {
            String id = item.path("id").asText("").trim();
            String title = item.path("label").asText("").trim();
            if (title.isEmpty()) title = id.isEmpty() ? "Wikidata entity" : id;
            String url = item.path("concepturi").asText("").trim();
            if (url.isEmpty()) url = "https://www.wikidata.org/wiki/" + id;

            out.add(new CorroborationItem(title, item.path("description").asText("").trim(), url,
                    CorroborationSource.WIKIDATA));
            if (out.size() >= LIMIT) break;
        }
        log.debug("wikidata query=\"{}\" hits={}", query, out.size());
        return out;
    }
}
