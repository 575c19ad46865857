package com.goormthonuniv.crosscheck.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.goormthonuniv.crosscheck.config.CrossCheckProperties;
import com.goormthonuniv.crosscheck.dto.Credentials;
import com.goormthonuniv.crosscheck.dto.EvidenceRequest;
import com.goormthonuniv.crosscheck.dto.Finding;
import com.goormthonuniv.crosscheck.dto.FindingEvidence;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 엔진을 부르는 쪽의 (탭, finding) 캐시.
 *
 * - 키: "tabId:findingId"
 * - staleAfter 보다 오래됐거나 생성 시각이 없으면 다시 검증
 * - forceRefresh 면 캐시를 건너뜀
 * - 같은 키로 동시에 들어온 요청은 진행 중인 검증 하나를 공유
 */
@Slf4j
@Service
public class EvidenceService {

    private final EvidenceVerifier verifier;
    private final CrossCheckProperties props;
    private final Clock clock;

    private final Cache<String, FindingEvidence> cache;
    private final ConcurrentMap<String, CompletableFuture<FindingEvidence>> inFlight = new ConcurrentHashMap<>();

    @Autowired
    public EvidenceService(EvidenceVerifier verifier, CrossCheckProperties props) {
        this(verifier, props, Clock.systemUTC());
    }

    EvidenceService(EvidenceVerifier verifier, CrossCheckProperties props, Clock clock) {
        this.verifier = verifier;
        this.props = props;
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .maximumSize(props.getCache().getMaximumSize())
                .build();
    }

    public FindingEvidence resolve(EvidenceRequest request) {
        String key = key(request.tabId(), request.finding());

        if (!request.forceRefresh()) {
            FindingEvidence cached = cache.getIfPresent(key);
            if (cached != null && !isStale(cached)) {
                log.debug("evidence cache hit {}", key);
                return cached;
            }
        }

        CompletableFuture<FindingEvidence> mine = new CompletableFuture<>();
        CompletableFuture<FindingEvidence> running = inFlight.putIfAbsent(key, mine);
        if (running != null) {
            log.debug("joining in-flight verification {}", key);
            return running.join();
        }

        try {
            FindingEvidence fresh = verifier.verify(request.finding(), request.pageContext(), credentials());
            cache.put(key, fresh);
            mine.complete(fresh);
            return fresh;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    /** 탭이 닫히거나 새로 스캔할 때 */
    public int clearTab(long tabId) {
        String prefix = tabId + ":";
        int removed = 0;
        for (String k : List.copyOf(cache.asMap().keySet())) {
            if (k.startsWith(prefix) && cache.asMap().remove(k) != null) removed++;
        }
        log.debug("cleared {} cached evidence entries for tab {}", removed, tabId);
        return removed;
    }

    boolean isStale(FindingEvidence evidence) {
        if (evidence.generatedAt() == null) return true;
        Duration age = Duration.between(evidence.generatedAt().toInstant(), clock.instant());
        return age.compareTo(props.getCache().getStaleAfter()) > 0;
    }

    static String key(long tabId, Finding finding) {
        String findingId = finding.id();
        if (findingId == null || findingId.isBlank()) {
            findingId = "q" + Integer.toHexString(finding.quote() == null ? 0 : finding.quote().hashCode());
        }
        return tabId + ":" + findingId;
    }

    private Credentials credentials() {
        CrossCheckProperties.Credentials c = props.getCredentials();
        return new Credentials(c.getFactCheckKey(), c.getLlmKey());
    }
}
