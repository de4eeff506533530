package com.chainvote.chainvote_api.election.archive;

import com.chainvote.chainvote_api.election.dto.response.ElectionHistorySummaryResponse;
import com.chainvote.chainvote_api.election.entity.ElectionHistory;
import com.chainvote.chainvote_api.election.repository.ElectionHistoryRepository;
import com.chainvote.chainvote_api.election.service.ElectionHistoryService;
import com.chainvote.chainvote_api.ledger.event.LedgerEventSource;
import com.chainvote.chainvote_api.ledger.gateway.LedgerGateway;
import com.chainvote.chainvote_api.ledger.model.Candidate;
import com.chainvote.chainvote_api.ledger.model.ElectionPhase;
import com.chainvote.chainvote_api.ledger.model.ElectionState;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

// 통합 테스트: 실제 JPA/H2 위에서 아카이브의 멱등성과 동시 요청 처리를 검증한다.
// 원장만 mock 으로 대체한다.
@SpringBootTest
class ElectionArchiveIntegrationTest {

	@Autowired
	private ElectionArchiveService electionArchiveService;

	@Autowired
	private ElectionHistoryService electionHistoryService;

	@Autowired
	private ElectionHistoryRepository electionHistoryRepository;

	@MockitoBean
	// 노드 없이 원장 상태를 테스트마다 지정한다.
	private LedgerGateway ledgerGateway;

	@MockitoBean
	private LedgerEventSource ledgerEventSource;

	@AfterEach
	void tearDown() {
		electionHistoryRepository.deleteAll();
	}

	private void givenEndedElection(String name, Instant start, Instant end) {
		when(ledgerGateway.getElectionState()).thenReturn(
			new ElectionState(ElectionPhase.ENDED, name, start, end, 100, 3, 150));
		when(ledgerGateway.getAllCandidates()).thenReturn(List.of(
			new Candidate(1, "Alice", "Blue", 45),
			new Candidate(2, "Bob", "Red", 35),
			new Candidate(3, "Charlie", "Green", 20)));
	}

	@Test
	void archivingTwiceKeepsOneSnapshot() {
		// given
		givenEndedElection("General Election 2025",
			Instant.parse("2025-03-01T09:00:00Z"), Instant.parse("2025-03-01T18:00:00Z"));

		// when: 모니터와 관리자 종료 처리가 차례로 아카이브를 요청한다
		ArchiveResult first = electionArchiveService.archive("event-monitor");
		ArchiveResult second = electionArchiveService.archive("admin-end");

		// then
		assertThat(first.archived()).isTrue();
		assertThat(second.alreadyExists()).isTrue();
		assertThat(second.electionNumber()).isEqualTo(first.electionNumber());
		assertThat(electionHistoryRepository.count()).isEqualTo(1);

		ElectionHistory saved = electionHistoryRepository.findByElectionNumber(first.electionNumber()).orElseThrow();
		assertThat(saved.getArchivedBy()).isEqualTo("event-monitor");
		assertThat(saved.getArchivedAt()).isNotNull();
	}

	@Test
	void distinctElectionsAreNumberedSequentially() {
		givenEndedElection("Spring", Instant.parse("2025-03-01T09:00:00Z"), Instant.parse("2025-03-01T18:00:00Z"));
		ArchiveResult spring = electionArchiveService.archive("admin-end");

		givenEndedElection("Autumn", Instant.parse("2025-09-01T09:00:00Z"), Instant.parse("2025-09-01T18:00:00Z"));
		ArchiveResult autumn = electionArchiveService.archive("admin-end");

		assertThat(spring.electionNumber()).isEqualTo(1);
		assertThat(autumn.electionNumber()).isEqualTo(2);
		assertThat(electionHistoryService.getHistories())
			.extracting(ElectionHistorySummaryResponse::electionNumber)
			.containsExactly(2, 1);
	}

	@Test
	void concurrentArchiveRequestsProduceOneSnapshot() throws Exception {
		// given
		givenEndedElection("General Election 2025",
			Instant.parse("2025-03-01T09:00:00Z"), Instant.parse("2025-03-01T18:00:00Z"));
		int threads = 8;
		ExecutorService executor = Executors.newFixedThreadPool(threads);
		CountDownLatch ready = new CountDownLatch(1);

		// when: 여러 스레드가 같은 순간에 아카이브를 요청한다
		List<CompletableFuture<ArchiveResult>> futures = new ArrayList<>();
		for (int i = 0; i < threads; i++) {
			futures.add(CompletableFuture.supplyAsync(() -> {
				try {
					ready.await(5, TimeUnit.SECONDS);
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}
				return electionArchiveService.archive("event-monitor");
			}, executor));
		}
		ready.countDown();
		List<ArchiveResult> results = new ArrayList<>();
		for (CompletableFuture<ArchiveResult> future : futures) {
			results.add(future.get(10, TimeUnit.SECONDS));
		}
		executor.shutdown();

		// then: 하나만 archived, 나머지는 같은 번호의 alreadyExists
		assertThat(results).filteredOn(ArchiveResult::archived).hasSize(1);
		assertThat(results).filteredOn(ArchiveResult::alreadyExists).hasSize(threads - 1);
		assertThat(results).extracting(ArchiveResult::electionNumber).containsOnly(1);
		assertThat(electionHistoryRepository.count()).isEqualTo(1);
	}

	@Test
	void deletingHighestSnapshotFreesItsNumber() {
		givenEndedElection("Spring", Instant.parse("2025-03-01T09:00:00Z"), Instant.parse("2025-03-01T18:00:00Z"));
		electionArchiveService.archive("admin-end");
		givenEndedElection("Autumn", Instant.parse("2025-09-01T09:00:00Z"), Instant.parse("2025-09-01T18:00:00Z"));
		electionArchiveService.archive("admin-end");

		// when: 가장 최근 스냅샷을 지운 뒤 새 선거를 아카이브한다
		electionHistoryService.deleteHistory(2);
		givenEndedElection("Winter", Instant.parse("2025-12-01T09:00:00Z"), Instant.parse("2025-12-01T18:00:00Z"));
		ArchiveResult winter = electionArchiveService.archive("admin-end");

		// then: 번호는 max+1 이라 2 가 다시 쓰인다
		assertThat(winter.electionNumber()).isEqualTo(2);
		assertThat(electionHistoryRepository.count()).isEqualTo(2);
	}
}
