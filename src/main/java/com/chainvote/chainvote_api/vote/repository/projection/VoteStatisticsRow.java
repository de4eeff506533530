package com.chainvote.chainvote_api.vote.repository.projection;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;

@Getter
@AllArgsConstructor
public class VoteStatisticsRow {
    private Long totalVotes;
    private Long uniqueVoters;
    private Instant firstVoteAt;
    private Instant lastVoteAt;
    private Double averageBlockNumber;
}
