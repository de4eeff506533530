package com.chainvote.chainvote_api.election.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 종료된 선거 하나의 최종 스냅샷. 생성 후 수정하지 않는다. 삭제는 관리자 명령으로만 한다.
 */
@Entity
@Table(
        name = "election_history",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_election_history_number", columnNames = "election_number"),
                @UniqueConstraint(name = "uk_election_history_identity",
                        columnNames = {"election_name", "start_time", "end_time"})
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@EntityListeners(AuditingEntityListener.class)
public class ElectionHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "election_history_seq_gen")
    @SequenceGenerator(name = "election_history_seq_gen", sequenceName = "election_history_seq", allocationSize = 1)
    private Long id;

    @Column(name = "election_number", nullable = false, updatable = false)
    private Integer electionNumber;

    @Column(name = "election_name", nullable = false, updatable = false)
    private String electionName;

    @Column(name = "start_time", updatable = false)
    private Instant startTime;

    @Column(name = "end_time", updatable = false)
    private Instant endTime;

    @Column(name = "total_votes", nullable = false, updatable = false)
    private long totalVotes;

    @Column(name = "total_candidates", nullable = false, updatable = false)
    private long totalCandidates;

    @Column(name = "total_registered_voters", nullable = false, updatable = false)
    private long totalRegisteredVoters;

    @Column(name = "voter_turnout", nullable = false, updatable = false)
    private int voterTurnout;

    @Builder.Default
    @ElementCollection
    @CollectionTable(name = "election_history_candidates", joinColumns = @JoinColumn(name = "election_history_id"))
    @OrderColumn(name = "position")
    private List<ArchivedCandidate> candidates = new ArrayList<>();

    @Column(name = "is_draw", nullable = false, updatable = false)
    private boolean draw;

    @Column(name = "winner_vote_count", nullable = false, updatable = false)
    private long winnerVoteCount;

    @Builder.Default
    @ElementCollection
    @CollectionTable(name = "election_history_winners", joinColumns = @JoinColumn(name = "election_history_id"))
    @OrderColumn(name = "position")
    private List<ArchivedCandidate> winners = new ArrayList<>();

    @CreatedDate
    @Column(name = "archived_at", updatable = false)
    private Instant archivedAt;

    @Column(name = "archived_by", length = 100, updatable = false)
    private String archivedBy;
}
