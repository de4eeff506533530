package com.chainvote.chainvote_api.vote.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.Instant;

/**
 * 확정된 투표 트랜잭션의 감사 기록. tx_hash 유니크 제약이 중복 기록을 막는 유일한 장치다.
 */
@Entity
@Table(
        name = "votes",
        uniqueConstraints = @UniqueConstraint(name = "uk_votes_tx_hash", columnNames = "tx_hash"),
        indexes = {
                @Index(name = "idx_votes_voter_address", columnList = "voter_address"),
                @Index(name = "idx_votes_candidate_id", columnList = "candidate_id")
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@EntityListeners(AuditingEntityListener.class)
public class Vote {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "votes_seq_gen")
    @SequenceGenerator(name = "votes_seq_gen", sequenceName = "votes_seq", allocationSize = 1)
    private Long id;

    @Column(name = "voter_address", nullable = false, length = 42, updatable = false)
    private String voterAddress;

    @Column(name = "user_id", updatable = false)
    private Long userId;

    @Column(name = "candidate_id", nullable = false, updatable = false)
    private Long candidateId;

    @Column(name = "candidate_name", updatable = false)
    private String candidateName;

    @Column(name = "candidate_party", updatable = false)
    private String candidateParty;

    @Column(name = "tx_hash", nullable = false, length = 66, updatable = false)
    private String txHash;

    @Column(name = "block_number", updatable = false)
    private Long blockNumber;

    @Column(name = "block_timestamp", updatable = false)
    private Instant blockTimestamp;

    @Column(name = "gas_used", length = 32, updatable = false)
    private String gasUsed;

    @Column(name = "election_tag", length = 100, updatable = false)
    private String electionTag;

    @Column(name = "is_verified", nullable = false)
    private boolean verified;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", length = 20, updatable = false)
    private VoteSource source;

    @Column(name = "ip_address", length = 64, updatable = false)
    private String ipAddress;

    @Column(name = "user_agent", length = 512, updatable = false)
    private String userAgent;

    @CreatedDate
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
}
