package com.chainvote.chainvote_api.election.dto.response;

import java.time.Instant;
import java.util.List;

public record ElectionHistoryDetailResponse(
	Integer electionNumber,
	String electionName,
	Instant startTime,
	Instant endTime,
	long totalVotes,
	long totalCandidates,
	long totalRegisteredVoters,
	int voterTurnout,
	List<ArchivedCandidateResponse> candidates,
	Winner winner,
	Instant archivedAt,
	String archivedBy
) {

	public record Winner(
		boolean isDraw,
		List<ArchivedCandidateResponse> candidates,
		long voteCount
	) {
	}
}
