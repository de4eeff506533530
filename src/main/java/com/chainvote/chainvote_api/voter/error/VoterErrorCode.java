package com.chainvote.chainvote_api.voter.error;

import com.chainvote.chainvote_api.global.error.code.ErrorCode;
import org.springframework.http.HttpStatus;

public enum VoterErrorCode implements ErrorCode {

    // 403
    VOTER_NOT_REGISTERED(HttpStatus.FORBIDDEN, "선거인 명부에 등록되지 않은 투표자입니다."),
    VOTER_KEY_MISMATCH(HttpStatus.FORBIDDEN, "서명 키가 투표자 주소와 일치하지 않습니다."),

    // 404
    VOTER_NOT_FOUND(HttpStatus.NOT_FOUND, "투표자를 찾을 수 없습니다."),

    // 409
    VOTER_ALREADY_ENROLLED(HttpStatus.CONFLICT, "이미 등록된 사용자입니다."),
    VOTER_ADDRESS_IN_USE(HttpStatus.CONFLICT, "다른 사용자가 사용 중인 주소입니다."),
    VOTER_ALREADY_REGISTERED(HttpStatus.CONFLICT, "이미 선거인 명부에 등록된 투표자입니다.");

    private final HttpStatus status;
    private final String message;

    VoterErrorCode(HttpStatus status, String message) {
        this.status = status;
        this.message = message;
    }

    @Override public HttpStatus getStatus() { return status; }
    @Override public String getMessage() { return message; }
    @Override public String getCode() { return name(); }
}
