package com.chainvote.chainvote_api.voter.entity;

import com.chainvote.chainvote_api.ledger.model.VoterStatus;
import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.Instant;
import java.util.Objects;

/**
 * 원장 투표자 상태의 로컬 캐시. 권한 검사에만 쓰고, 사용자에게 보여줄 값은 원장에서 다시 읽는다.
 */
@Entity
@Table(
        name = "voters",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_voters_user_id", columnNames = "user_id"),
                @UniqueConstraint(name = "uk_voters_eth_address", columnNames = "eth_address")
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@EntityListeners(AuditingEntityListener.class)
public class Voter {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "voters_seq_gen")
    @SequenceGenerator(name = "voters_seq_gen", sequenceName = "voters_seq", allocationSize = 1)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "eth_address", nullable = false, length = 42)
    private String ethAddress;

    @Column(name = "display_name", length = 100)
    private String displayName;

    @Column(name = "is_registered", nullable = false)
    private boolean registered;

    @Column(name = "has_voted", nullable = false)
    private boolean hasVoted;

    @Column(name = "voted_candidate_id")
    private Long votedCandidateId;

    @CreatedDate
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @LastModifiedDate
    @Column(name = "updated_at")
    private Instant updatedAt;

    public boolean matches(VoterStatus status) {
        return registered == status.isRegistered()
                && hasVoted == status.hasVoted()
                && Objects.equals(votedCandidateId, status.votedCandidateId());
    }

    public void reconcile(VoterStatus status) {
        this.registered = status.isRegistered();
        this.hasVoted = status.hasVoted();
        this.votedCandidateId = status.votedCandidateId();
    }
}
