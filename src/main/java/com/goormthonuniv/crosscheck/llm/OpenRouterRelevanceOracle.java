package com.goormthonuniv.crosscheck.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.crosscheck.config.CrossCheckProperties;
import com.goormthonuniv.crosscheck.search.ProviderException;
import com.goormthonuniv.crosscheck.search.ProviderHttp;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * OpenRouter chat completions 호출.
 * 1차는 temperature 0.1, 응답이 JSON 으로 복구되지 않으면 strict 모드(temperature 0, json_object)로 한 번 더.
 */
@Slf4j
@Component
public class OpenRouterRelevanceOracle implements RelevanceOracle {

    static final String LABEL = "OpenRouter API";
    static final String SYSTEM_PROMPT =
            "You are a JSON API. Return only strict RFC8259 JSON. No markdown, no explanations, no code fences.";
    private static final String STRICT_SUFFIX =
            "\n\nIMPORTANT: Return valid JSON only. Do not use markdown or comments.";
    private static final int SNIPPET_LEN = 220;

    private final RestClient rest;
    private final ObjectMapper om;
    private final String endpoint;
    private final CrossCheckProperties.Rerank config;

    public OpenRouterRelevanceOracle(@Qualifier("llmRestClient") RestClient rest,
                                     ObjectMapper om,
                                     CrossCheckProperties props) {
        this.rest = rest;
        this.om = om;
        this.endpoint = props.getEndpoints().getLlm();
        this.config = props.getRerank();
    }

    @Override
    public JsonNode completeJson(String prompt, String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ProviderException(LABEL, LABEL + " key is not configured.");
        }

        for (int attempt = 0; attempt < 2; attempt++) {
            boolean strict = attempt == 1;
            String text = responseText(post(strict ? prompt + STRICT_SUFFIX : prompt, apiKey, strict));

            Optional<JsonNode> parsed = JsonRecovery.parse(om, JsonRecovery.extractJsonBlock(text));
            if (parsed.isPresent()) {
                return parsed.get();
            }
            log.debug("openrouter answer was not JSON (strict={})", strict);
        }
        throw new ProviderException(LABEL, LABEL + " response was not valid JSON after strict retry.");
    }

    // ----------------------------- helpers -----------------------------

    private JsonNode post(String prompt, String apiKey, boolean strict) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", config.getModel());
        body.put("temperature", strict ? 0 : 0.1);
        body.put("max_tokens", config.getMaxTokens());
        if (strict) {
            body.put("response_format", Map.of("type", "json_object"));
        }
        body.put("messages", List.of(
                Map.of("role", "system", "content", SYSTEM_PROMPT),
                Map.of("role", "user", "content", prompt)
        ));

        String raw;
        try {
            raw = rest.post()
                    .uri(URI.create(endpoint))
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .header("X-Title", config.getTitle())
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            String detail = e.getResponseBodyAsString();
            if (detail.length() > SNIPPET_LEN) detail = detail.substring(0, SNIPPET_LEN);
            throw new ProviderException(LABEL, status, "%s failed (%d): %s".formatted(LABEL, status, detail), e);
        } catch (ResourceAccessException e) {
            String msg = ProviderHttp.isTimeout(e) ? LABEL + " request timed out." : LABEL + " request failed.";
            throw new ProviderException(LABEL, null, msg, e);
        }

        JsonNode root;
        try {
            root = om.readTree(raw == null ? "" : raw);
        } catch (Exception e) {
            throw new ProviderException(LABEL, null, LABEL + " returned invalid JSON.", e);
        }
        if (root == null || root.isMissingNode()) {
            throw new ProviderException(LABEL, LABEL + " returned invalid JSON.");
        }
        String error = root.path("error").path("message").asText("");
        if (!error.isBlank()) {
            throw new ProviderException(LABEL, "OpenRouter error: " + error);
        }
        return root;
    }

    /** content 가 문자열이거나 {type,text} 조각 배열 */
    private static String responseText(JsonNode root) {
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (content.isTextual() && !content.asText().isBlank()) {
            return content.asText();
        }
        if (content.isArray()) {
            StringBuilder sb = new StringBuilder();
            for (JsonNode part : content) {
                String t = part.path("text").asText("");
                if (!t.isEmpty()) {
                    if (sb.length() > 0) sb.append('\n');
                    sb.append(t);
                }
            }
            if (!sb.toString().isBlank()) return sb.toString();
        }
        throw new ProviderException(LABEL, LABEL + " response did not contain text content.");
    }
}
