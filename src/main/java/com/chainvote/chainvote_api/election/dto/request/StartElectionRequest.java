package com.chainvote.chainvote_api.election.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record StartElectionRequest(
	@NotBlank @Size(max = 200) @Schema(example = "General Election 2025") String electionName
) {
}
