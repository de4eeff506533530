package com.chainvote.chainvote_api.election.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record RegisterVoterRequest(
	@NotNull @Positive Long userId
) {
}
