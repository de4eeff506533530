package com.chainvote.chainvote_api.election.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class ArchivedCandidate {

    @Column(name = "candidate_id", nullable = false)
    private Long candidateId;

    @Column(name = "name")
    private String name;

    @Column(name = "party")
    private String party;

    @Column(name = "vote_count", nullable = false)
    private Long voteCount;
}
