package com.goormthonuniv.crosscheck.verify;

import com.goormthonuniv.crosscheck.dto.Corroboration;
import com.goormthonuniv.crosscheck.dto.FactCheckMatch;
import com.goormthonuniv.crosscheck.dto.NormalizedVerdict;
import com.goormthonuniv.crosscheck.dto.VerificationStatus;
import com.goormthonuniv.crosscheck.dto.VerificationStatus.Code;
import com.goormthonuniv.crosscheck.dto.VerificationStatus.Confidence;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 팩트체크 판정과 참고 출처 수를 하나의 VerificationStatus 로 줄인다.
 * 순수 함수. 증거가 바뀌면 다시 호출한다(부분 갱신 금지).
 */
@Component
public class VerdictClassifier {

    static final String REASON_CONTRADICTED =
            "Independent fact-check publishers rate this claim as false or unsupported.";
    static final String REASON_SUPPORTED =
            "Independent fact-check publishers rate this claim as true or mostly true.";
    static final String REASON_CONTESTED =
            "Fact-check verdicts are mixed, nuanced, or context-dependent across publishers.";
    static final String REASON_REFERENCES =
            "No direct fact-check match found; trusted reference sources are provided for manual review.";
    static final String REASON_NOTHING =
            "No direct fact-check match or reliable corroboration was found for this claim.";

    public VerificationStatus classify(List<FactCheckMatch> factChecks, Corroboration corroboration) {
        Map<NormalizedVerdict, Integer> tally = new EnumMap<>(NormalizedVerdict.class);
        for (NormalizedVerdict v : NormalizedVerdict.values()) tally.put(v, 0);
        if (factChecks != null) {
            for (FactCheckMatch m : factChecks) {
                NormalizedVerdict v = m.normalizedVerdict() == null ? NormalizedVerdict.UNKNOWN : m.normalizedVerdict();
                tally.merge(v, 1, Integer::sum);
            }
        }
        int supported = tally.get(NormalizedVerdict.SUPPORTED);
        int contradicted = tally.get(NormalizedVerdict.CONTRADICTED);
        int contested = tally.get(NormalizedVerdict.CONTESTED);

        if (contradicted > 0 && supported == 0 && contested == 0) {
            return new VerificationStatus(Code.CONTRADICTED, "Contradicted", REASON_CONTRADICTED, Confidence.HIGH);
        }
        if (supported > 0 && contradicted == 0 && contested == 0) {
            return new VerificationStatus(Code.SUPPORTED, "Supported", REASON_SUPPORTED, Confidence.HIGH);
        }
        if (supported + contradicted + contested > 0) {
            return new VerificationStatus(Code.CONTESTED, "Contested", REASON_CONTESTED, Confidence.MEDIUM);
        }

        int signals = corroboration == null ? 0 : corroboration.nonEmptySources();
        if (signals >= 2) {
            return new VerificationStatus(Code.UNVERIFIED, "Unverified", REASON_REFERENCES, Confidence.LOW);
        }
        return new VerificationStatus(Code.UNVERIFIED, "Unverified", REASON_NOTHING, Confidence.LOW);
    }
}
