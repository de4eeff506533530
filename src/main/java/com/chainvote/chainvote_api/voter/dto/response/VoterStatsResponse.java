package com.chainvote.chainvote_api.voter.dto.response;

public record VoterStatsResponse(
	long totalVoters,
	long registeredVoters,
	long votedVoters,
	long pendingVoters,
	double turnoutPercentage
) {
}
