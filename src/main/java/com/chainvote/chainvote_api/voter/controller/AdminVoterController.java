package com.chainvote.chainvote_api.voter.controller;

import com.chainvote.chainvote_api.global.dto.ApiResult;
import com.chainvote.chainvote_api.voter.dto.request.EnrollVoterRequest;
import com.chainvote.chainvote_api.voter.dto.response.VoterResponse;
import com.chainvote.chainvote_api.voter.dto.response.VoterStatsResponse;
import com.chainvote.chainvote_api.voter.service.VoterService;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/admin/voters")
public class AdminVoterController {

    private final VoterService voterService;

    @Operation(summary = "투표자 등록 (로컬, 원장 등록 전 단계)")
    @PostMapping
    public ResponseEntity<ApiResult<VoterResponse>> enroll(@RequestBody @Valid EnrollVoterRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResult.of("voter_enrolled", voterService.enroll(request)));
    }

    @Operation(summary = "투표자 목록")
    @GetMapping
    public ResponseEntity<ApiResult<List<VoterResponse>>> getVoters(
            @RequestParam(defaultValue = "false") boolean registeredOnly
    ) {
        return ResponseEntity.ok(ApiResult.of("voters_loaded", voterService.getVoters(registeredOnly)));
    }

    @Operation(summary = "투표자 통계 (로컬 캐시 기준)")
    @GetMapping("/stats")
    public ResponseEntity<ApiResult<VoterStatsResponse>> getStats() {
        return ResponseEntity.ok(ApiResult.of("voter_stats_loaded", voterService.getStats()));
    }
}
