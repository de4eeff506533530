package com.chainvote.chainvote_api.election.dto.response;

public record CandidateResultResponse(
	long candidateId,
	String name,
	String party,
	long voteCount,
	double percentage
) {
}
