package com.chainvote.chainvote_api.election.dto.response;

import com.chainvote.chainvote_api.election.entity.ArchivedCandidate;

public record ArchivedCandidateResponse(
	Long candidateId,
	String name,
	String party,
	Long voteCount
) {

	public static ArchivedCandidateResponse from(ArchivedCandidate candidate) {
		return new ArchivedCandidateResponse(
			candidate.getCandidateId(),
			candidate.getName(),
			candidate.getParty(),
			candidate.getVoteCount()
		);
	}
}
