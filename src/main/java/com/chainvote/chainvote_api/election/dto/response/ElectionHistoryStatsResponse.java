package com.chainvote.chainvote_api.election.dto.response;

public record ElectionHistoryStatsResponse(
	long totalElections,
	long totalVotes,
	Integer latestElectionNumber
) {
}
