package com.chainvote.chainvote_api.voter.controller;

import com.chainvote.chainvote_api.global.dto.ApiResult;
import com.chainvote.chainvote_api.voter.dto.response.VoterStatusResponse;
import com.chainvote.chainvote_api.voter.service.VoterService;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/voter")
public class VoterController {

    private final VoterService voterService;

    @Operation(summary = "내 투표자 상태 조회 (원장 기준)")
    @GetMapping("/status")
    public ResponseEntity<ApiResult<VoterStatusResponse>> getStatus(
            @RequestHeader("X-User-Id") Long userId
    ) {
        return ResponseEntity.ok(ApiResult.of("voter_status_loaded", voterService.getStatus(userId)));
    }
}
