package com.chainvote.chainvote_api.global.error.api;

import com.chainvote.chainvote_api.global.error.code.ErrorCode;
import lombok.Getter;

import java.util.List;

@Getter
public class ApiException extends RuntimeException {

    private final ErrorCode errorCode;
    private final List<FieldErrorData> errors;
    private final Object data;

    public ApiException(ErrorCode errorCode) {
        this(errorCode, null, null);
    }

    public ApiException(ErrorCode errorCode, Object data) {
        this(errorCode, null, data);
    }

    public ApiException(ErrorCode errorCode, List<FieldErrorData> errors, Object data) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
        this.errors = errors;
        this.data = data;
    }

    public boolean is(ErrorCode candidate) {
        return this.errorCode == candidate;
    }

    /**
     * data 가 문자열(원장 revert 메시지 등)일 때만 반환한다.
     */
    public String getDetail() {
        return (data instanceof String s) ? s : null;
    }
}
