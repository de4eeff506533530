package com.chainvote.chainvote_api.ledger.error;

import com.chainvote.chainvote_api.global.error.code.ErrorCode;
import org.springframework.http.HttpStatus;

public enum LedgerErrorCode implements ErrorCode {

    // 409
    LEDGER_REJECTED(HttpStatus.CONFLICT, "원장 컨트랙트가 요청을 거부했습니다."),

    // 500
    LEDGER_NOT_CONFIGURED(HttpStatus.INTERNAL_SERVER_ERROR, "원장 관리자 키가 설정되지 않았습니다."),

    // 502
    LEDGER_RESPONSE_INVALID(HttpStatus.BAD_GATEWAY, "원장 응답 형식이 올바르지 않습니다."),

    // 503
    LEDGER_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "원장 노드에 연결할 수 없습니다."),
    LEDGER_CIRCUIT_OPEN(HttpStatus.SERVICE_UNAVAILABLE, "원장 호출이 일시적으로 차단되었습니다."),
    LEDGER_BULKHEAD_FULL(HttpStatus.SERVICE_UNAVAILABLE, "처리 중인 원장 트랜잭션이 너무 많습니다.");

    private final HttpStatus status;
    private final String message;

    LedgerErrorCode(HttpStatus status, String message) {
        this.status = status;
        this.message = message;
    }

    @Override public HttpStatus getStatus() { return status; }
    @Override public String getMessage() { return message; }
    @Override public String getCode() { return name(); }
}
