package com.chainvote.chainvote_api.global.error.api;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "FieldErrorData")
public record FieldErrorData (
        @Schema(example = "voterAddress") String field,
        @Schema(example = "올바른 지갑 주소가 아닙니다.") String reason) {
}
