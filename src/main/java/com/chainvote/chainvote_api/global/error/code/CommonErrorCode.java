package com.chainvote.chainvote_api.global.error.code;

import org.springframework.http.HttpStatus;

public enum CommonErrorCode implements ErrorCode {

    // 400 에러
    VALIDATION_FAILED(HttpStatus.BAD_REQUEST, "요청 값이 올바르지 않습니다."),
    INVALID_JSON(HttpStatus.BAD_REQUEST, "요청 바디 형식이 올바르지 않습니다."),
    PARAMETER_MISSING(HttpStatus.BAD_REQUEST,  "필수 파라미터가 누락되었습니다."),
    TYPE_MISMATCH(HttpStatus.BAD_REQUEST, "파라미터 형식이 올바르지 않습니다."),
    INVALID_ADDRESS(HttpStatus.BAD_REQUEST, "올바른 지갑 주소가 아닙니다."),

    // 500 에러
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "서버 오류가 발생했습니다.");

    private final HttpStatus status;
    private final String message;

    CommonErrorCode(HttpStatus status, String message) {
        this.status = status;
        this.message = message;
    }

    @Override
    public HttpStatus getStatus() {
        return this.status;
    }

    @Override
    public String getMessage() {
        return this.message;
    }

    @Override
    public String getCode() {
        return this.name();
    }
}
