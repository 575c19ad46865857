package com.goormthonuniv.crosscheck.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.StringJoiner;

/**
 * 제공자 공통 GET/JSON 호출. 429/5xx 와 I/O 실패만 재시도한다.
 */
@Slf4j
public final class ProviderHttp {

    private static final int SNIPPET_LEN = 220;

    private final RestClient rest;
    private final ObjectMapper om;

    public ProviderHttp(RestClient rest, ObjectMapper om) {
        this.rest = rest;
        this.om = om;
    }

    public JsonNode getJson(String url, String label, int retries) {
        ProviderException last = null;
        for (int attempt = 0; attempt <= retries; attempt++) {
            try {
                String body = rest.get()
                        .uri(URI.create(url))
                        .accept(MediaType.APPLICATION_JSON)
                        .retrieve()
                        .body(String.class);
                return parse(body, label);
            } catch (RestClientResponseException e) {
                int status = e.getStatusCode().value();
                last = new ProviderException(label, status,
                        "%s failed (%d): %s".formatted(label, status, snippet(e.getResponseBodyAsString())), e);
                if (attempt < retries && isRetryable(status)) {
                    log.debug("{} retrying {} after status {}", label, redact(url), status);
                    continue;
                }
                throw last;
            } catch (ResourceAccessException e) {
                String msg = isTimeout(e) ? label + " request timed out." : label + " request failed.";
                last = new ProviderException(label, null, msg, e);
                log.debug("{} {} attempt {} failed: {}", label, redact(url), attempt + 1, msg);
            } catch (ProviderException e) {
                last = e;
            }
        }
        throw last != null ? last : new ProviderException(label, label + " request failed.");
    }

    public JsonNode parse(String body, String label) {
        if (body == null || body.isBlank()) {
            throw new ProviderException(label, label + " returned invalid JSON.");
        }
        try {
            return om.readTree(body);
        } catch (Exception e) {
            throw new ProviderException(label, null, label + " returned invalid JSON.", e);
        }
    }

    /** URLSearchParams 처럼 순서를 유지해 인코딩한다 */
    public static String url(String base, Map<String, String> params) {
        StringJoiner qs = new StringJoiner("&");
        params.forEach((k, v) -> qs.add(enc(k) + "=" + enc(v)));
        return base + "?" + qs;
    }

    /** 로그용: 쿼리스트링(키 포함 가능) 제거 */
    public static String redact(String url) {
        int i = url == null ? -1 : url.indexOf('?');
        return i < 0 ? url : url.substring(0, i);
    }

    static boolean isRetryable(int status) {
        return status == 429 || status >= 500;
    }

    public static boolean isTimeout(Throwable e) {
        for (Throwable c = e; c != null; c = c.getCause()) {
            if (c instanceof SocketTimeoutException || c instanceof HttpTimeoutException) return true;
        }
        return false;
    }

    private static String snippet(String body) {
        if (body == null) return "";
        return body.length() <= SNIPPET_LEN ? body : body.substring(0, SNIPPET_LEN);
    }

    private static String enc(String s) {
        return URLEncoder.encode(s == null ? "" : s, StandardCharsets.UTF_8);
    }
}
