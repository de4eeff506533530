package com.chainvote.chainvote_api.vote.controller;

import com.chainvote.chainvote_api.global.dto.ApiResult;
import com.chainvote.chainvote_api.vote.dto.response.CandidateVoteCountResponse;
import com.chainvote.chainvote_api.vote.dto.response.HourlyVoteCountResponse;
import com.chainvote.chainvote_api.vote.dto.response.VoteRecordResponse;
import com.chainvote.chainvote_api.vote.dto.response.VoteStatisticsResponse;
import com.chainvote.chainvote_api.vote.service.VoteStatsService;
import io.swagger.v3.oas.annotations.Operation;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/admin/votes")
public class AdminVoteController {

    private final VoteStatsService voteStatsService;

    @Operation(summary = "후보별 기록된 투표 수")
    @GetMapping("/counts")
    public ResponseEntity<ApiResult<List<CandidateVoteCountResponse>>> getCountsByCandidate() {
        return ResponseEntity.ok(ApiResult.of("vote_counts_loaded", voteStatsService.getCountsByCandidate()));
    }

    @Operation(summary = "투표 기록 통계")
    @GetMapping("/statistics")
    public ResponseEntity<ApiResult<VoteStatisticsResponse>> getStatistics() {
        return ResponseEntity.ok(ApiResult.of("vote_statistics_loaded", voteStatsService.getStatistics()));
    }

    @Operation(summary = "시간대별 투표 수 (블록 시각 기준)")
    @GetMapping("/hourly")
    public ResponseEntity<ApiResult<List<HourlyVoteCountResponse>>> getHourlyHistogram() {
        return ResponseEntity.ok(ApiResult.of("vote_hourly_loaded", voteStatsService.getHourlyHistogram()));
    }

    @Operation(summary = "최근 투표 기록")
    @GetMapping("/recent")
    public ResponseEntity<ApiResult<List<VoteRecordResponse>>> getRecentVotes(
            @RequestParam(defaultValue = "10") int limit
    ) {
        return ResponseEntity.ok(ApiResult.of("recent_votes_loaded", voteStatsService.getRecentVotes(limit)));
    }

    @Operation(summary = "주소별 투표 기록")
    @GetMapping("/voters/{voterAddress}")
    public ResponseEntity<ApiResult<List<VoteRecordResponse>>> getVotesByVoter(@PathVariable String voterAddress) {
        return ResponseEntity.ok(ApiResult.of("voter_votes_loaded", voteStatsService.getVotesByVoter(voterAddress)));
    }

    @Operation(summary = "주소의 투표 기록 존재 여부")
    @GetMapping("/voters/{voterAddress}/exists")
    public ResponseEntity<ApiResult<Boolean>> hasVoted(@PathVariable String voterAddress) {
        return ResponseEntity.ok(ApiResult.of("voter_vote_checked", voteStatsService.hasVoted(voterAddress)));
    }

    @Operation(summary = "후보별 투표 기록")
    @GetMapping("/candidates/{candidateId}")
    public ResponseEntity<ApiResult<List<VoteRecordResponse>>> getVotesByCandidate(@PathVariable long candidateId) {
        return ResponseEntity.ok(ApiResult.of("candidate_votes_loaded", voteStatsService.getVotesByCandidate(candidateId)));
    }

    @Operation(summary = "트랜잭션 해시로 투표 기록 조회")
    @GetMapping("/tx/{txHash}")
    public ResponseEntity<ApiResult<VoteRecordResponse>> getByTxHash(@PathVariable String txHash) {
        return ResponseEntity.ok(ApiResult.of("vote_loaded", voteStatsService.getByTxHash(txHash)));
    }
}
