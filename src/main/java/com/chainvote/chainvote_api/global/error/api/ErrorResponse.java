package com.chainvote.chainvote_api.global.error.api;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "ErrorResponse")
public record ErrorResponse(
	@Schema(example = "LEDGER_REJECTED") String code,
	@Schema(example = "원장 컨트랙트가 요청을 거부했습니다.") String message,
    @Schema(description = "Validation 실패 시 주로 사용") List<FieldErrorData> errors,
    @Schema(description = "원장 revert 메시지 등 추가 정보") Object data
) { }
