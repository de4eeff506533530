package com.chainvote.chainvote_api.voter.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record EnrollVoterRequest(
	@NotNull @Positive Long userId,
	@NotBlank @Schema(example = "0x627306090abaB3A6e1400e9345bC60c78a8BEf57") String ethAddress,
	@Size(max = 100) String displayName
) {
}
