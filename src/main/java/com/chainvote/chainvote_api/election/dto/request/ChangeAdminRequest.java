package com.chainvote.chainvote_api.election.dto.request;

import jakarta.validation.constraints.NotBlank;

public record ChangeAdminRequest(
	@NotBlank String newAdminAddress
) {
}
