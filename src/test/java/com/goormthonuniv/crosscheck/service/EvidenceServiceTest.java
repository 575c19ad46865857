package com.goormthonuniv.crosscheck.service;

import com.goormthonuniv.crosscheck.config.CrossCheckProperties;
import com.goormthonuniv.crosscheck.dto.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.*;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class EvidenceServiceTest {

    @Mock
    private EvidenceVerifier verifier;

    private MutableClock clock;
    private EvidenceService service;

    /** 테스트에서 시간을 앞으로 돌리기 위한 시계 */
    static final class MutableClock extends Clock {
        private volatile Instant now;

        MutableClock(Instant now) { this.now = now; }

        void advance(Duration d) { now = now.plus(d); }

        @Override public ZoneId getZone() { return ZoneOffset.UTC; }

        @Override public Clock withZone(ZoneId zone) { return this; }

        @Override public Instant instant() { return now; }
    }

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-27T12:00:00Z"));
        service = new EvidenceService(verifier, new CrossCheckProperties(), clock);
    }

    private static Finding finding(String id) {
        return new Finding(id, "The bridge collapsed because of sabotage", null, "Unsupported causal claim",
                List.of(IssueType.MISINFORMATION), 0.9, 0.8);
    }

    private static EvidenceRequest request(long tabId, String findingId, boolean forceRefresh) {
        return new EvidenceRequest(tabId, finding(findingId), PageContext.empty(), forceRefresh);
    }

    private FindingEvidence evidenceAt(OffsetDateTime generatedAt) {
        return new FindingEvidence("f-1", "The bridge collapsed because of sabotage", "bridge collapsed sabotage",
                generatedAt,
                new VerificationStatus(VerificationStatus.Code.UNVERIFIED, "Unverified", "none", VerificationStatus.Confidence.LOW),
                List.of(), Corroboration.empty(), List.of(), false, Map.of());
    }

    private FindingEvidence freshEvidence() {
        return evidenceAt(OffsetDateTime.ofInstant(clock.instant(), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("같은 탭/finding 은 캐시에서 돌려준다")
    void cacheHit() {
        given(verifier.verify(any(), any(), any())).willReturn(freshEvidence());

        FindingEvidence first = service.resolve(request(7, "f-1", false));
        FindingEvidence second = service.resolve(request(7, "f-1", false));

        assertThat(second).isSameAs(first);
        verify(verifier, times(1)).verify(any(), any(), any());
    }

    @Test
    @DisplayName("10분이 지나면 다시 검증한다")
    void staleAfterTenMinutes() {
        given(verifier.verify(any(), any(), any())).willAnswer(inv -> freshEvidence());

        service.resolve(request(7, "f-1", false));
        clock.advance(Duration.ofMinutes(11));
        service.resolve(request(7, "f-1", false));

        verify(verifier, times(2)).verify(any(), any(), any());
    }

    @Test
    @DisplayName("생성 시각이 없는 캐시 항목은 항상 낡은 것으로 본다")
    void missingTimestampIsStale() {
        given(verifier.verify(any(), any(), any())).willReturn(evidenceAt(null));

        service.resolve(request(7, "f-1", false));
        service.resolve(request(7, "f-1", false));

        verify(verifier, times(2)).verify(any(), any(), any());
    }

    @Test
    @DisplayName("forceRefresh 는 캐시를 건너뛴다")
    void forceRefreshBypassesCache() {
        given(verifier.verify(any(), any(), any())).willAnswer(inv -> freshEvidence());

        service.resolve(request(7, "f-1", false));
        service.resolve(request(7, "f-1", true));

        verify(verifier, times(2)).verify(any(), any(), any());
    }

    @Test
    @DisplayName("탭 캐시 삭제는 그 탭의 항목만 지운다")
    void clearTabRemovesOnlyThatTab() {
        given(verifier.verify(any(), any(), any())).willAnswer(inv -> freshEvidence());
        service.resolve(request(7, "f-1", false));
        service.resolve(request(7, "f-2", false));
        service.resolve(request(8, "f-1", false));

        int removed = service.clearTab(7);
        service.resolve(request(8, "f-1", false));
        service.resolve(request(7, "f-1", false));

        assertThat(removed).isEqualTo(2);
        // 8번 탭은 캐시 유지, 7번 탭만 다시 검증
        verify(verifier, times(4)).verify(any(), any(), any());
    }

    @Test
    @DisplayName("id 가 없는 finding 은 인용문으로 키를 만든다")
    void keyFallsBackToQuote() {
        Finding noId = new Finding(null, "The bridge collapsed because of sabotage", null, null,
                List.of(IssueType.BIAS), 0.5, 0.5);

        assertThat(EvidenceService.key(3, noId)).startsWith("3:q");
        assertThat(EvidenceService.key(3, noId)).isEqualTo(EvidenceService.key(3, noId));
        assertThat(EvidenceService.key(3, finding("f-9"))).isEqualTo("3:f-9");
    }

    @Test
    @DisplayName("같은 키로 동시에 들어온 요청은 진행 중인 검증 하나를 공유한다")
    void concurrentRequestsShareInFlight() throws Exception {
        // given
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        given(verifier.verify(any(), any(), any())).willAnswer(inv -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return freshEvidence();
        });
        ExecutorService pool = Executors.newFixedThreadPool(2);

        // when
        Future<FindingEvidence> first = pool.submit(() -> service.resolve(request(7, "f-1", false)));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        Future<FindingEvidence> second = pool.submit(() -> service.resolve(request(7, "f-1", false)));
        Thread.sleep(100);
        release.countDown();

        // then
        assertThat(second.get(5, TimeUnit.SECONDS)).isSameAs(first.get(5, TimeUnit.SECONDS));
        verify(verifier, times(1)).verify(any(), any(), any());
        pool.shutdown();
    }
}
