package com.goormthonuniv.crosscheck.verify;

import com.goormthonuniv.crosscheck.dto.*;
import com.goormthonuniv.crosscheck.dto.VerificationStatus.Code;
import com.goormthonuniv.crosscheck.dto.VerificationStatus.Confidence;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class VerdictClassifierTest {

    private final VerdictClassifier classifier = new VerdictClassifier();

    private static FactCheckMatch match(NormalizedVerdict verdict) {
        return new FactCheckMatch("claim", null, "Publisher", "Review", "rating",
                "https://example.org/" + verdict.wire(), null, "en", verdict);
    }

    private static CorroborationItem item(CorroborationSource source) {
        return new CorroborationItem("title", "snippet", "https://example.org", source);
    }

    @Test
    @DisplayName("반박 판정만 있으면 contradicted/high")
    void onlyContradicted() {
        VerificationStatus status = classifier.classify(
                List.of(match(NormalizedVerdict.CONTRADICTED), match(NormalizedVerdict.UNKNOWN)), Corroboration.empty());

        assertThat(status.code()).isEqualTo(Code.CONTRADICTED);
        assertThat(status.confidence()).isEqualTo(Confidence.HIGH);
        assertThat(status.label()).isEqualTo("Contradicted");
    }

    @Test
    @DisplayName("지지 판정만 있으면 supported/high")
    void onlySupported() {
        VerificationStatus status = classifier.classify(List.of(match(NormalizedVerdict.SUPPORTED)), Corroboration.empty());

        assertThat(status.code()).isEqualTo(Code.SUPPORTED);
        assertThat(status.confidence()).isEqualTo(Confidence.HIGH);
    }

    @Test
    @DisplayName("서로 다른 판정이 섞이면 contested/medium")
    void mixedVerdicts() {
        VerificationStatus status = classifier.classify(
                List.of(match(NormalizedVerdict.SUPPORTED), match(NormalizedVerdict.CONTRADICTED)), Corroboration.empty());

        assertThat(status.code()).isEqualTo(Code.CONTESTED);
        assertThat(status.confidence()).isEqualTo(Confidence.MEDIUM);
    }

    @Test
    @DisplayName("논쟁 판정 하나만 있어도 contested")
    void contestedAlone() {
        VerificationStatus status = classifier.classify(List.of(match(NormalizedVerdict.CONTESTED)), Corroboration.empty());

        assertThat(status.code()).isEqualTo(Code.CONTESTED);
    }

    @Test
    @DisplayName("팩트체크 없고 참고 출처 2종 이상이면 unverified/low + 참고 출처 안내")
    void referenceSourcesOnly() {
        Corroboration corroboration = new Corroboration(
                List.of(item(CorroborationSource.WIKIPEDIA)), List.of(item(CorroborationSource.WIKIDATA)), List.of());

        VerificationStatus status = classifier.classify(List.of(), corroboration);

        assertThat(status.code()).isEqualTo(Code.UNVERIFIED);
        assertThat(status.confidence()).isEqualTo(Confidence.LOW);
        assertThat(status.reason()).isEqualTo(VerdictClassifier.REASON_REFERENCES).contains("reference sources");
    }

    @Test
    @DisplayName("unknown 판정과 참고 출처 1종은 신호 없음으로 본다")
    void unknownOnlyAndSingleSource() {
        Corroboration corroboration = new Corroboration(List.of(), List.of(), List.of(item(CorroborationSource.PUBMED)));

        VerificationStatus status = classifier.classify(List.of(match(NormalizedVerdict.UNKNOWN)), corroboration);

        assertThat(status.code()).isEqualTo(Code.UNVERIFIED);
        assertThat(status.reason()).isEqualTo(VerdictClassifier.REASON_NOTHING);
    }

    @Test
    @DisplayName("같은 입력을 두 번 분류하면 같은 결과")
    void idempotent() {
        List<FactCheckMatch> matches = List.of(match(NormalizedVerdict.CONTRADICTED), match(NormalizedVerdict.CONTESTED));
        Corroboration corroboration = new Corroboration(List.of(item(CorroborationSource.WIKIPEDIA)), List.of(), List.of());

        assertThat(classifier.classify(matches, corroboration)).isEqualTo(classifier.classify(matches, corroboration));
    }
}
