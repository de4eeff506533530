package com.chainvote.chainvote_api.election.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ResetElectionRequest(
	@NotBlank @Size(max = 200) String newElectionName
) {
}
