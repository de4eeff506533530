package com.chainvote.chainvote_api.vote.controller;

import com.chainvote.chainvote_api.global.dto.ApiResult;
import com.chainvote.chainvote_api.global.logging.ApiPerfLoggingFilter;
import com.chainvote.chainvote_api.vote.dto.request.CastVoteRequest;
import com.chainvote.chainvote_api.vote.dto.response.CastVoteResponse;
import com.chainvote.chainvote_api.vote.dto.response.VoteRecordResponse;
import com.chainvote.chainvote_api.vote.service.VoteService;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/voter")
public class VoteController {

    private final VoteService voteService;

    @Operation(summary = "투표하기 (블록 확정까지 대기)")
    @PostMapping("/vote")
    public ResponseEntity<ApiResult<CastVoteResponse>> castVote(
            @RequestHeader("X-User-Id") Long userId,
            @RequestBody @Valid CastVoteRequest request,
            HttpServletRequest httpRequest
    ) {
        CastVoteResponse response = voteService.castVote(
                userId,
                request,
                ApiPerfLoggingFilter.resolveClientIp(httpRequest),
                httpRequest.getHeader(HttpHeaders.USER_AGENT)
        );
        return ResponseEntity.ok(ApiResult.of("vote_cast", response));
    }

    @Operation(summary = "내 투표 기록 조회")
    @GetMapping("/my-vote")
    public ResponseEntity<ApiResult<VoteRecordResponse>> getMyVote(
            @RequestHeader("X-User-Id") Long userId
    ) {
        return ResponseEntity.ok(ApiResult.of("my_vote_loaded", voteService.getMyVote(userId)));
    }
}
