package com.chainvote.chainvote_api.vote.service;

import com.chainvote.chainvote_api.vote.entity.Vote;

/**
 * @param vote INSERTED 면 방금 저장한 기록, DUPLICATE 면 먼저 저장된 기록
 */
public record VoteRecordResult(Status status, Vote vote) {

	public enum Status {
		INSERTED,
		DUPLICATE
	}

	public static VoteRecordResult inserted(Vote vote) {
		return new VoteRecordResult(Status.INSERTED, vote);
	}

	public static VoteRecordResult duplicate(Vote vote) {
		return new VoteRecordResult(Status.DUPLICATE, vote);
	}

	public boolean isDuplicate() {
		return status == Status.DUPLICATE;
	}
}
