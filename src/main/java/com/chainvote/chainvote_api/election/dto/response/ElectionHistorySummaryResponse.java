package com.chainvote.chainvote_api.election.dto.response;

import java.time.Instant;
import java.util.List;

public record ElectionHistorySummaryResponse(
	Integer electionNumber,
	String electionName,
	Instant startTime,
	Instant endTime,
	long totalVotes,
	int voterTurnout,
	boolean isDraw,
	List<String> winnerNames,
	Instant archivedAt
) {
}
