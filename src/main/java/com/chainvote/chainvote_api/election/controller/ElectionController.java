package com.chainvote.chainvote_api.election.controller;

import com.chainvote.chainvote_api.election.dto.response.ElectionOverviewResponse;
import com.chainvote.chainvote_api.election.dto.response.ElectionResultsResponse;
import com.chainvote.chainvote_api.election.service.ElectionQueryService;
import com.chainvote.chainvote_api.global.dto.ApiResult;
import com.chainvote.chainvote_api.ledger.model.Candidate;
import io.swagger.v3.oas.annotations.Operation;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/voter")
public class ElectionController {

    private final ElectionQueryService electionQueryService;

    @Operation(summary = "후보 목록")
    @GetMapping("/candidates")
    public ResponseEntity<ApiResult<List<Candidate>>> getCandidates() {
        return ResponseEntity.ok(ApiResult.of("candidates_loaded", electionQueryService.getCandidates()));
    }

    @Operation(summary = "선거 상태")
    @GetMapping("/election")
    public ResponseEntity<ApiResult<ElectionOverviewResponse>> getElection() {
        return ResponseEntity.ok(ApiResult.of("election_loaded", electionQueryService.getOverview()));
    }

    @Operation(summary = "선거 결과 (종료 후에만)")
    @GetMapping("/results")
    public ResponseEntity<ApiResult<ElectionResultsResponse>> getResults() {
        return ResponseEntity.ok(ApiResult.of("results_loaded", electionQueryService.getVoterResults()));
    }
}
