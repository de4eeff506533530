package com.chainvote.chainvote_api.vote.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record CastVoteRequest(
	@NotNull @Positive Long candidateId,
	@NotBlank @Schema(description = "투표자 본인의 서명 키 (0x 접두사 선택)") String privateKey
) {

	@Override
	public String toString() {
		return "CastVoteRequest[candidateId=" + candidateId + ", privateKey=***]";
	}
}
