package com.chainvote.chainvote_api.vote.dto.response;

import java.time.Instant;

public record HourlyVoteCountResponse(
	Instant hour,
	long voteCount
) {
}
