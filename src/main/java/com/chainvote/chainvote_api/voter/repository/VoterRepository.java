package com.chainvote.chainvote_api.voter.repository;

import com.chainvote.chainvote_api.voter.entity.Voter;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface VoterRepository extends JpaRepository<Voter, Long> {

	Optional<Voter> findByUserId(Long userId);

	Optional<Voter> findByEthAddress(String ethAddress);

	List<Voter> findByUserIdIn(Collection<Long> userIds);

	boolean existsByUserId(Long userId);

	boolean existsByEthAddress(String ethAddress);

	List<Voter> findAllByOrderByIdAsc();

	List<Voter> findByRegisteredTrueOrderByIdAsc();

	long countByRegisteredTrue();

	long countByHasVotedTrue();

	@Modifying(clearAutomatically = true, flushAutomatically = true)
	@Query("update Voter v set v.registered = true where v.ethAddress = :address and v.registered = false")
	int markRegistered(@Param("address") String address);

	@Modifying(clearAutomatically = true, flushAutomatically = true)
	@Query("update Voter v set v.registered = true where v.ethAddress in :addresses and v.registered = false")
	int markRegisteredIn(@Param("addresses") Collection<String> addresses);

	@Modifying(clearAutomatically = true, flushAutomatically = true)
	@Query("""
		update Voter v
		set v.hasVoted = true, v.votedCandidateId = :candidateId
		where v.ethAddress = :address
		""")
	int markVoted(@Param("address") String address, @Param("candidateId") Long candidateId);

	@Modifying(clearAutomatically = true, flushAutomatically = true)
	@Query("""
		update Voter v
		set v.registered = false, v.hasVoted = false, v.votedCandidateId = null
		""")
	int resetAll();
}
