package com.chainvote.chainvote_api.ledger.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "원장에 등록된 후보")
public record Candidate(
	long id,
	String name,
	String party,
	long voteCount
) {
}
