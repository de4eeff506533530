package com.chainvote.chainvote_api.vote.error;

import com.chainvote.chainvote_api.global.error.code.ErrorCode;
import org.springframework.http.HttpStatus;

public enum VoteErrorCode implements ErrorCode {

    // 404
    CANDIDATE_NOT_FOUND(HttpStatus.NOT_FOUND, "후보를 찾을 수 없습니다."),
    VOTE_RECORD_NOT_FOUND(HttpStatus.NOT_FOUND, "투표 기록을 찾을 수 없습니다."),

    // 409
    ALREADY_VOTED(HttpStatus.CONFLICT, "이미 투표하셨습니다."),
    ELECTION_NOT_ACTIVE(HttpStatus.CONFLICT, "현재 투표가 진행중이 아닙니다.");

    private final HttpStatus status;
    private final String message;

    VoteErrorCode(HttpStatus status, String message) {
        this.status = status;
        this.message = message;
    }

    @Override public HttpStatus getStatus() { return status; }
    @Override public String getMessage() { return message; }
    @Override public String getCode() { return name(); }
}
