package com.chainvote.chainvote_api.election.dto.response;

import com.chainvote.chainvote_api.voter.dto.response.VoterStatsResponse;
import io.swagger.v3.oas.annotations.media.Schema;

public record AdminStatsResponse(
	ElectionOverviewResponse election,
	VoterStatsResponse voters,
	@Schema(description = "로컬 투표 기록 수") long recordedVotes,
	long archivedElections
) {
}
