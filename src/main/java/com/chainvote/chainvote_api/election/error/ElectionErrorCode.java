package com.chainvote.chainvote_api.election.error;

import com.chainvote.chainvote_api.global.error.code.ErrorCode;
import org.springframework.http.HttpStatus;

public enum ElectionErrorCode implements ErrorCode {

    // 403
    ADMIN_PERMISSION_DENIED(HttpStatus.FORBIDDEN, "원장 관리자 권한이 없습니다."),

    // 404
    ELECTION_HISTORY_NOT_FOUND(HttpStatus.NOT_FOUND, "선거 기록을 찾을 수 없습니다."),

    // 409
    RESULTS_NOT_AVAILABLE(HttpStatus.CONFLICT, "선거가 종료된 후에 결과를 확인할 수 있습니다."),
    ELECTION_PHASE_CONFLICT(HttpStatus.CONFLICT, "현재 선거 단계에서 할 수 없는 요청입니다.");

    private final HttpStatus status;
    private final String message;

    ElectionErrorCode(HttpStatus status, String message) {
        this.status = status;
        this.message = message;
    }

    @Override public HttpStatus getStatus() { return status; }
    @Override public String getMessage() { return message; }
    @Override public String getCode() { return name(); }
}
