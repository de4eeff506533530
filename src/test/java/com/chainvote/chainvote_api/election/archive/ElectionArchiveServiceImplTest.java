package com.chainvote.chainvote_api.election.archive;

import com.chainvote.chainvote_api.election.entity.ElectionHistory;
import com.chainvote.chainvote_api.election.repository.ElectionHistoryRepository;
import com.chainvote.chainvote_api.ledger.gateway.LedgerGateway;
import com.chainvote.chainvote_api.ledger.model.Candidate;
import com.chainvote.chainvote_api.ledger.model.ElectionPhase;
import com.chainvote.chainvote_api.ledger.model.ElectionState;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataIntegrityViolationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

// 단위 테스트: 원장/저장소를 mock 으로 두고 아카이브 판정 로직만 검증한다.
class ElectionArchiveServiceImplTest {

	private static final Instant START = Instant.parse("2025-03-01T09:00:00Z");
	private static final Instant END = Instant.parse("2025-03-01T18:00:00Z");

	private LedgerGateway ledgerGateway;
	private ElectionHistoryRepository repository;
	private ElectionHistoryWriter writer;
	private ElectionArchiveServiceImpl service;

	@BeforeEach
	void setUp() {
		ledgerGateway = mock(LedgerGateway.class);
		repository = mock(ElectionHistoryRepository.class);
		writer = mock(ElectionHistoryWriter.class);
		service = new ElectionArchiveServiceImpl(ledgerGateway, repository, writer);
	}

	private void givenLedger(ElectionPhase phase, long totalVotes, List<Candidate> candidates) {
		when(ledgerGateway.getElectionState()).thenReturn(
			new ElectionState(phase, "General Election 2025", START, END, totalVotes, candidates.size(), 150));
		when(ledgerGateway.getAllCandidates()).thenReturn(candidates);
	}

	private static List<Candidate> aliceBobCharlie() {
		return List.of(
			new Candidate(1, "Alice", "Blue", 45),
			new Candidate(2, "Bob", "Red", 35),
			new Candidate(3, "Charlie", "Green", 20));
	}

	@Test
	void activeElectionIsSkipped() {
		givenLedger(ElectionPhase.ACTIVE, 100, aliceBobCharlie());

		ArchiveResult result = service.archive("admin-end");

		assertThat(result.archived()).isFalse();
		assertThat(result.reason()).isEqualTo("election_not_ended");
		verify(writer, never()).insert(any());
	}

	@Test
	void endedElectionWithoutVotesIsSkipped() {
		givenLedger(ElectionPhase.ENDED, 0, List.of(new Candidate(1, "Alice", "Blue", 0)));

		ArchiveResult result = service.archive("admin-end");

		assertThat(result.reason()).isEqualTo("no_votes");
		verify(writer, never()).insert(any());
	}

	@Test
	void existingSnapshotIsReportedNotDuplicated() {
		givenLedger(ElectionPhase.ENDED, 100, aliceBobCharlie());
		when(repository.findByElectionNameAndStartTimeAndEndTime("General Election 2025", START, END))
			.thenReturn(Optional.of(ElectionHistory.builder().electionNumber(3).build()));

		ArchiveResult result = service.archive("event-monitor");

		assertThat(result.alreadyExists()).isTrue();
		assertThat(result.electionNumber()).isEqualTo(3);
		verify(writer, never()).insert(any());
	}

	@Test
	void snapshotCarriesTallyAndNextNumber() {
		// given: 이미 2건이 아카이브되어 있다
		givenLedger(ElectionPhase.ENDED, 100, aliceBobCharlie());
		when(repository.findByElectionNameAndStartTimeAndEndTime(any(), any(), any())).thenReturn(Optional.empty());
		when(repository.findMaxElectionNumber()).thenReturn(2);

		// when
		ArchiveResult result = service.archive("admin-end");

		// then
		assertThat(result.archived()).isTrue();
		assertThat(result.electionNumber()).isEqualTo(3);

		ArgumentCaptor<ElectionHistory> captor = ArgumentCaptor.forClass(ElectionHistory.class);
		verify(writer).insert(captor.capture());
		ElectionHistory snapshot = captor.getValue();
		assertThat(snapshot.getElectionNumber()).isEqualTo(3);
		assertThat(snapshot.getVoterTurnout()).isEqualTo(67);
		assertThat(snapshot.isDraw()).isFalse();
		assertThat(snapshot.getWinnerVoteCount()).isEqualTo(45L);
		assertThat(snapshot.getWinners()).extracting("name").containsExactly("Alice");
		assertThat(snapshot.getCandidates()).hasSize(3);
		assertThat(snapshot.getArchivedBy()).isEqualTo("admin-end");
	}

	@Test
	void firstSnapshotIsNumberOne() {
		givenLedger(ElectionPhase.ENDED, 20, List.of(
			new Candidate(1, "Alice", "Blue", 10),
			new Candidate(2, "Bob", "Red", 10)));
		when(repository.findByElectionNameAndStartTimeAndEndTime(any(), any(), any())).thenReturn(Optional.empty());
		when(repository.findMaxElectionNumber()).thenReturn(null);

		ArchiveResult result = service.archive("pre-reset");

		assertThat(result.electionNumber()).isEqualTo(1);
		ArgumentCaptor<ElectionHistory> captor = ArgumentCaptor.forClass(ElectionHistory.class);
		verify(writer).insert(captor.capture());
		assertThat(captor.getValue().isDraw()).isTrue();
		assertThat(captor.getValue().getWinners()).extracting("name").containsExactly("Alice", "Bob");
	}

	@Test
	void lostInsertRaceIsAlreadyExists() {
		// given: 존재 확인 때는 없었지만 insert 직전에 다른 인스턴스가 먼저 기록했다
		givenLedger(ElectionPhase.ENDED, 100, aliceBobCharlie());
		when(repository.findByElectionNameAndStartTimeAndEndTime(any(), any(), any()))
			.thenReturn(Optional.empty())
			.thenReturn(Optional.of(ElectionHistory.builder().electionNumber(1).build()));
		when(repository.findMaxElectionNumber()).thenReturn(null);
		when(writer.insert(any())).thenThrow(new DataIntegrityViolationException("uk_election_history_identity"));

		ArchiveResult result = service.archive("event-monitor");

		assertThat(result.alreadyExists()).isTrue();
		assertThat(result.electionNumber()).isEqualTo(1);
	}

	@Test
	void unrelatedConstraintViolationPropagates() {
		givenLedger(ElectionPhase.ENDED, 100, aliceBobCharlie());
		when(repository.findByElectionNameAndStartTimeAndEndTime(any(), any(), any())).thenReturn(Optional.empty());
		when(repository.findMaxElectionNumber()).thenReturn(null);
		when(writer.insert(any())).thenThrow(new DataIntegrityViolationException("not null"));

		assertThatThrownBy(() -> service.archive("admin-end")).isInstanceOf(DataIntegrityViolationException.class);
	}
}
