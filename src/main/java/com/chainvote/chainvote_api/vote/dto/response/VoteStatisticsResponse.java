package com.chainvote.chainvote_api.vote.dto.response;

import java.time.Instant;

public record VoteStatisticsResponse(
	long totalVotes,
	long uniqueVoters,
	Instant firstVoteAt,
	Instant lastVoteAt,
	Long averageBlockNumber
) {
}
