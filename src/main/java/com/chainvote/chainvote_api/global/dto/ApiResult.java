package com.chainvote.chainvote_api.global.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "ApiResult")
public record ApiResult<T>(
	@Schema(example = "vote_cast") String message,
	T data
) {

	public static <T> ApiResult<T> of(String message, T data) {
		return new ApiResult<>(message, data);
	}

	public static ApiResult<Void> of(String message) {
		return new ApiResult<>(message, null);
	}
}
