package com.chainvote.chainvote_api.election.dto.response;

import com.chainvote.chainvote_api.ledger.model.ElectionState;
import io.swagger.v3.oas.annotations.media.Schema;
import java.time.Instant;

public record ElectionOverviewResponse(
	@Schema(example = "Active") String phase,
	String electionName,
	Instant startTime,
	Instant endTime,
	long totalVotes,
	long candidateCount,
	long registeredVoterCount,
	boolean isActive,
	boolean isEnded
) {

	public static ElectionOverviewResponse from(ElectionState state) {
		return new ElectionOverviewResponse(
			state.phase().label(),
			state.name(),
			state.startTime(),
			state.endTime(),
			state.totalVotes(),
			state.candidateCount(),
			state.registeredVoterCount(),
			state.isActive(),
			state.isEnded()
		);
	}
}
