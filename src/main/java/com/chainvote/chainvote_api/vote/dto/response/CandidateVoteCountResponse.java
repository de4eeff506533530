package com.chainvote.chainvote_api.vote.dto.response;

public record CandidateVoteCountResponse(
	Long candidateId,
	String candidateName,
	String candidateParty,
	long voteCount
) {
}
