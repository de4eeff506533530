package com.chainvote.chainvote_api.ledger.model;

import java.time.Instant;

public record ElectionState(
	ElectionPhase phase,
	String name,
	Instant startTime,
	Instant endTime,
	long totalVotes,
	long candidateCount,
	long registeredVoterCount
) {

	public boolean isEnded() {
		return phase == ElectionPhase.ENDED;
	}

	public boolean isActive() {
		return phase == ElectionPhase.ACTIVE;
	}
}
