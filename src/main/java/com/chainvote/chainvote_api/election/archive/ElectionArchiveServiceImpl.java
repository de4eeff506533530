package com.chainvote.chainvote_api.election.archive;

import com.chainvote.chainvote_api.election.entity.ArchivedCandidate;
import com.chainvote.chainvote_api.election.entity.ElectionHistory;
import com.chainvote.chainvote_api.election.repository.ElectionHistoryRepository;
import com.chainvote.chainvote_api.ledger.gateway.LedgerGateway;
import com.chainvote.chainvote_api.ledger.model.Candidate;
import com.chainvote.chainvote_api.ledger.model.ElectionState;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * 같은 프로세스 안의 아카이브 요청은 락으로 직렬화한다.
 * 프로세스가 여러 개면 election_history 유니크 제약이 최종 판정을 하고, 진 쪽은 alreadyExists 로 응답한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ElectionArchiveServiceImpl implements ElectionArchiveService {

	private final LedgerGateway ledgerGateway;
	private final ElectionHistoryRepository electionHistoryRepository;
	private final ElectionHistoryWriter electionHistoryWriter;

	private final ReentrantLock archiveLock = new ReentrantLock();

	@Override
	public ArchiveResult archive(String actor) {
		archiveLock.lock();
		try {
			return archiveLocked(actor);
		} finally {
			archiveLock.unlock();
		}
	}

	private ArchiveResult archiveLocked(String actor) {
		ElectionState state = ledgerGateway.getElectionState();
		List<Candidate> candidates = ledgerGateway.getAllCandidates();

		if (!state.isEnded()) {
			log.info("[Archive] skipped actor={}, phase={}", actor, state.phase().label());
			return ArchiveResult.skipped("election_not_ended");
		}
		if (state.totalVotes() == 0) {
			log.info("[Archive] skipped actor={}, election={} has no votes", actor, state.name());
			return ArchiveResult.skipped("no_votes");
		}

		Optional<ElectionHistory> existing = findSnapshot(state);
		if (existing.isPresent()) {
			int number = existing.get().getElectionNumber();
			log.info("[Archive] already archived actor={}, electionNumber={}", actor, number);
			return ArchiveResult.alreadyExists(number);
		}

		Integer maxNumber = electionHistoryRepository.findMaxElectionNumber();
		int electionNumber = (maxNumber == null ? 0 : maxNumber) + 1;

		WinnerResult winner = ElectionTally.computeWinner(candidates);
		int turnout = ElectionTally.voterTurnout(state.totalVotes(), state.registeredVoterCount());

		ElectionHistory snapshot = ElectionHistory.builder()
			.electionNumber(electionNumber)
			.electionName(state.name())
			.startTime(state.startTime())
			.endTime(state.endTime())
			.totalVotes(state.totalVotes())
			.totalCandidates(state.candidateCount())
			.totalRegisteredVoters(state.registeredVoterCount())
			.voterTurnout(turnout)
			.candidates(toArchived(candidates))
			.draw(winner.isDraw())
			.winnerVoteCount(winner.voteCount())
			.winners(toArchived(winner.candidates()))
			.archivedBy(actor)
			.build();

		try {
			electionHistoryWriter.insert(snapshot);
		} catch (DataIntegrityViolationException ex) {
			// 다른 인스턴스가 먼저 기록했다.
			ElectionHistory winnerSnapshot = findSnapshot(state).orElseThrow(() -> ex);
			log.info("[Archive] lost insert race actor={}, electionNumber={}", actor, winnerSnapshot.getElectionNumber());
			return ArchiveResult.alreadyExists(winnerSnapshot.getElectionNumber());
		}

		log.info("[Archive] archived actor={}, electionNumber={}, name={}, totalVotes={}, draw={}, turnout={}",
			actor, electionNumber, state.name(), state.totalVotes(), winner.isDraw(), turnout);
		return ArchiveResult.archived(electionNumber);
	}

	private Optional<ElectionHistory> findSnapshot(ElectionState state) {
		return electionHistoryRepository.findByElectionNameAndStartTimeAndEndTime(
			state.name(), state.startTime(), state.endTime());
	}

	private static List<ArchivedCandidate> toArchived(List<Candidate> candidates) {
		return candidates.stream()
			.map(candidate -> new ArchivedCandidate(
				candidate.id(), candidate.name(), candidate.party(), candidate.voteCount()))
			.collect(Collectors.toCollection(ArrayList::new));
	}
}
