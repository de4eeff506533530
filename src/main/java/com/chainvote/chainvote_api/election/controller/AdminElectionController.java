package com.chainvote.chainvote_api.election.controller;

import com.chainvote.chainvote_api.election.archive.ArchiveResult;
import com.chainvote.chainvote_api.election.archive.ElectionArchiveService;
import com.chainvote.chainvote_api.election.dto.request.*;
import com.chainvote.chainvote_api.election.dto.response.*;
import com.chainvote.chainvote_api.election.service.ElectionAdminService;
import com.chainvote.chainvote_api.election.service.ElectionHistoryService;
import com.chainvote.chainvote_api.election.service.ElectionQueryService;
import com.chainvote.chainvote_api.global.dto.ApiResult;
import com.chainvote.chainvote_api.ledger.model.Candidate;
import com.chainvote.chainvote_api.ledger.model.LedgerReceipt;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/admin")
public class AdminElectionController {

    static final String MANUAL_ARCHIVE_ACTOR = "manual-archive";

    private final ElectionAdminService electionAdminService;
    private final ElectionQueryService electionQueryService;
    private final ElectionArchiveService electionArchiveService;
    private final ElectionHistoryService electionHistoryService;

    @Operation(summary = "후보 추가")
    @PostMapping("/candidates")
    public ResponseEntity<ApiResult<LedgerReceipt>> addCandidate(@RequestBody @Valid AddCandidateRequest request) {
        return ResponseEntity.ok(ApiResult.of("candidate_added", electionAdminService.addCandidate(request)));
    }

    @Operation(summary = "후보 목록")
    @GetMapping("/candidates")
    public ResponseEntity<ApiResult<List<Candidate>>> getCandidates() {
        return ResponseEntity.ok(ApiResult.of("candidates_loaded", electionQueryService.getCandidates()));
    }

    @Operation(summary = "투표자 원장 등록")
    @PostMapping("/voters/register")
    public ResponseEntity<ApiResult<LedgerReceipt>> registerVoter(@RequestBody @Valid RegisterVoterRequest request) {
        return ResponseEntity.ok(ApiResult.of("voter_registered", electionAdminService.registerVoter(request.userId())));
    }

    @Operation(summary = "투표자 원장 일괄 등록")
    @PostMapping("/voters/register-batch")
    public ResponseEntity<ApiResult<BatchRegistrationResponse>> registerVotersBatch(
            @RequestBody @Valid RegisterVotersBatchRequest request
    ) {
        return ResponseEntity.ok(ApiResult.of("voters_registered", electionAdminService.registerVotersBatch(request)));
    }

    @Operation(summary = "선거 시작")
    @PostMapping("/election/start")
    public ResponseEntity<ApiResult<LedgerReceipt>> startElection(@RequestBody @Valid StartElectionRequest request) {
        return ResponseEntity.ok(ApiResult.of("election_started", electionAdminService.startElection(request.electionName())));
    }

    @Operation(summary = "선거 종료 (아카이브 시도 포함)")
    @PostMapping("/election/end")
    public ResponseEntity<ApiResult<EndElectionResponse>> endElection() {
        return ResponseEntity.ok(ApiResult.of("election_ended", electionAdminService.endElection()));
    }

    @Operation(summary = "선거 초기화 (아카이브 후 초기화)")
    @PostMapping("/election/reset")
    public ResponseEntity<ApiResult<ResetElectionResponse>> resetElection(@RequestBody @Valid ResetElectionRequest request) {
        ResetElectionResponse response = electionAdminService.resetElection(request.newElectionName());
        String message = response.archiveWarning() == null ? "election_reset" : "election_reset_with_archive_warning";
        return ResponseEntity.ok(ApiResult.of(message, response));
    }

    @Operation(summary = "현재 선거 수동 아카이브")
    @PostMapping("/election/archive")
    public ResponseEntity<ApiResult<ArchiveResult>> archiveElection() {
        return ResponseEntity.ok(ApiResult.of("election_archive_checked", electionArchiveService.archive(MANUAL_ARCHIVE_ACTOR)));
    }

    @Operation(summary = "원장 관리자 변경")
    @PostMapping("/election/admin")
    public ResponseEntity<ApiResult<LedgerReceipt>> changeAdmin(@RequestBody @Valid ChangeAdminRequest request) {
        return ResponseEntity.ok(ApiResult.of("admin_changed", electionAdminService.changeAdmin(request.newAdminAddress())));
    }

    @Operation(summary = "선거 결과 (단계 무관)")
    @GetMapping("/election/results")
    public ResponseEntity<ApiResult<ElectionResultsResponse>> getResults() {
        return ResponseEntity.ok(ApiResult.of("results_loaded", electionQueryService.getAdminResults()));
    }

    @Operation(summary = "관리자 대시보드 통계")
    @GetMapping("/election/stats")
    public ResponseEntity<ApiResult<AdminStatsResponse>> getStats() {
        return ResponseEntity.ok(ApiResult.of("admin_stats_loaded", electionQueryService.getAdminStats()));
    }

    @Operation(summary = "선거 기록 목록 (최신순)")
    @GetMapping("/history")
    public ResponseEntity<ApiResult<List<ElectionHistorySummaryResponse>>> getHistories() {
        return ResponseEntity.ok(ApiResult.of("histories_loaded", electionHistoryService.getHistories()));
    }

    @Operation(summary = "선거 기록 통계")
    @GetMapping("/history/stats")
    public ResponseEntity<ApiResult<ElectionHistoryStatsResponse>> getHistoryStats() {
        return ResponseEntity.ok(ApiResult.of("history_stats_loaded", electionHistoryService.getStats()));
    }

    @Operation(summary = "선거 기록 상세")
    @GetMapping("/history/{electionNumber}")
    public ResponseEntity<ApiResult<ElectionHistoryDetailResponse>> getHistory(@PathVariable Integer electionNumber) {
        return ResponseEntity.ok(ApiResult.of("history_loaded", electionHistoryService.getHistory(electionNumber)));
    }

    @Operation(summary = "선거 기록 삭제")
    @DeleteMapping("/history/{electionNumber}")
    public ResponseEntity<ApiResult<Void>> deleteHistory(@PathVariable Integer electionNumber) {
        electionHistoryService.deleteHistory(electionNumber);
        return ResponseEntity.ok(ApiResult.of("history_deleted"));
    }
}
