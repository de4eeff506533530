package com.chainvote.chainvote_api.vote.entity;

// 어느 경로가 먼저 기록했는지
public enum VoteSource {
    API,
    EVENT_MONITOR
}
