package com.goormthonuniv.crosscheck.controller;

import com.goormthonuniv.crosscheck.dto.EvidenceRequest;
import com.goormthonuniv.crosscheck.dto.FindingEvidence;
import com.goormthonuniv.crosscheck.service.EvidenceService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/evidence")
@RequiredArgsConstructor
public class EvidenceController {

    private final EvidenceService evidenceService;

    @Operation(summary = "finding 교차 검증",
            description = "flag 된 인용문 하나를 팩트체크/백과/위키데이터/PubMed/뉴스 아카이브로 교차 검증해 판정과 증거를 반환합니다. "
                    + "같은 탭의 같은 finding 은 10분간 캐시됩니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "검증 완료(일부 출처 실패는 errors 에 표시)"),
            @ApiResponse(responseCode = "400", description = "요청 형식 오류"),
            @ApiResponse(responseCode = "500", description = "서버 오류")
    })
    @PostMapping
    public ResponseEntity<FindingEvidence> verify(@Valid @RequestBody EvidenceRequest req) {
        return ResponseEntity.ok(evidenceService.resolve(req));
    }

    @Operation(summary = "탭 캐시 삭제", description = "탭이 닫히거나 새로 스캔할 때 해당 탭의 캐시된 증거를 모두 지웁니다.")
    @DeleteMapping("/tabs/{tabId}")
    public ResponseEntity<Map<String, Object>> clearTab(@PathVariable long tabId) {
        int removed = evidenceService.clearTab(tabId);
        return ResponseEntity.ok(Map.of("tabId", tabId, "removed", removed));
    }
}
