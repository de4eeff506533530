package com.chainvote.chainvote_api.election.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record AddCandidateRequest(
	@NotBlank @Size(max = 100) String name,
	@NotBlank @Size(max = 100) String party
) {
}
