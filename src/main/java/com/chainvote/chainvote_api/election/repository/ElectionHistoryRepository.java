package com.chainvote.chainvote_api.election.repository;

import com.chainvote.chainvote_api.election.entity.ElectionHistory;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface ElectionHistoryRepository extends JpaRepository<ElectionHistory, Long> {

	Optional<ElectionHistory> findByElectionNameAndStartTimeAndEndTime(String electionName, Instant startTime, Instant endTime);

	Optional<ElectionHistory> findByElectionNumber(Integer electionNumber);

	List<ElectionHistory> findAllByOrderByElectionNumberDesc();

	@Query("select max(h.electionNumber) from ElectionHistory h")
	Integer findMaxElectionNumber();

	@Query("select coalesce(sum(h.totalVotes), 0) from ElectionHistory h")
	Long sumTotalVotes();
}
