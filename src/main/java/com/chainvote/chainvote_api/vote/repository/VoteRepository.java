package com.chainvote.chainvote_api.vote.repository;

import com.chainvote.chainvote_api.vote.entity.Vote;
import com.chainvote.chainvote_api.vote.repository.projection.CandidateVoteCountRow;
import com.chainvote.chainvote_api.vote.repository.projection.VoteStatisticsRow;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface VoteRepository extends JpaRepository<Vote, Long> {

	Optional<Vote> findByTxHash(String txHash);

	boolean existsByTxHash(String txHash);

	boolean existsByVoterAddress(String voterAddress);

	Optional<Vote> findFirstByVoterAddressOrderByIdDesc(String voterAddress);

	List<Vote> findByVoterAddressOrderByIdDesc(String voterAddress);

	List<Vote> findByCandidateIdOrderByIdDesc(Long candidateId);

	List<Vote> findAllByOrderByIdDesc(Pageable pageable);

	@Query("""
		select new com.chainvote.chainvote_api.vote.repository.projection.CandidateVoteCountRow(
			v.candidateId, v.candidateName, v.candidateParty, count(v)
		)
		from Vote v
		group by v.candidateId, v.candidateName, v.candidateParty
		order by count(v) desc, v.candidateId asc
		""")
	List<CandidateVoteCountRow> countByCandidate();

	@Query("""
		select new com.chainvote.chainvote_api.vote.repository.projection.VoteStatisticsRow(
			count(v), count(distinct v.voterAddress), min(v.blockTimestamp), max(v.blockTimestamp), avg(v.blockNumber)
		)
		from Vote v
		""")
	VoteStatisticsRow aggregateStatistics();

	@Query("select v.blockTimestamp from Vote v where v.blockTimestamp is not null")
	List<Instant> findAllBlockTimestamps();
}
