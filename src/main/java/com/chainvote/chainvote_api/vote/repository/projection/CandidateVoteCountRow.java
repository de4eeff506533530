package com.chainvote.chainvote_api.vote.repository.projection;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class CandidateVoteCountRow {
    private Long candidateId;
    private String candidateName;
    private String candidateParty;
    private Long voteCount;
}
