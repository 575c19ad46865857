package com.goormthonuniv.crosscheck.search;

import com.goormthonuniv.crosscheck.config.CrossCheckProperties;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.*;
import java.util.stream.Collectors;

/**
 * 뉴스 아카이브 1차 조회에 쓰는 고신뢰 도메인 허용 목록과 호스트 정규화.
 * 통신사, 팩트체크 매체, 주요 방송, 보건/과학 기관 위주.
 */
@Component
public class NewsDomainPolicy {

    private static final List<String> COMMON_PREFIXES = List.of("www.", "m.", "mobile.", "amp.");

    private final List<String> trustedDomains;

    public NewsDomainPolicy(CrossCheckProperties props) {
        this.trustedDomains = props.getNewsArchive().getTrustedDomains().stream()
                .map(d -> d.trim().toLowerCase(Locale.ROOT))
                .filter(d -> !d.isEmpty())
                .distinct()
                .toList();
    }

    public List<String> trustedDomains() {
        return trustedDomains;
    }

    /** "(domainis:a OR domainis:b ...)" */
    public String trustedFilter() {
        return trustedDomains.stream()
                .map(d -> "domainis:" + d)
                .collect(Collectors.joining(" OR ", "(", ")"));
    }

    /** URL 이든 호스트든 받아서 www./m. 등을 뗀 호스트. 파싱 불가면 null */
    public String normalizeHost(String urlOrHost) {
        if (urlOrHost == null || urlOrHost.isBlank()) return null;
        String raw = urlOrHost.trim().toLowerCase(Locale.ROOT);

        String host = raw;
        if (raw.contains("://")) {
            try {
                host = new URI(raw).getHost();
            } catch (URISyntaxException e) {
                return null;
            }
        }
        if (host == null || host.isBlank()) return null;

        for (String pref : COMMON_PREFIXES) {
            if (host.startsWith(pref)) {
                host = host.substring(pref.length());
                break;
            }
        }
        return host;
    }
}
