package com.chainvote.chainvote_api.ledger.model;

public record VoterStatus(
	boolean isRegistered,
	boolean hasVoted,
	Long votedCandidateId
) {
}
