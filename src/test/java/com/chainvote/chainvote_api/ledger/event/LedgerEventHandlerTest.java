package com.chainvote.chainvote_api.ledger.event;

import com.chainvote.chainvote_api.election.archive.ArchiveResult;
import com.chainvote.chainvote_api.election.archive.ElectionArchiveService;
import com.chainvote.chainvote_api.global.error.api.ApiException;
import com.chainvote.chainvote_api.ledger.error.LedgerErrorCode;
import com.chainvote.chainvote_api.ledger.gateway.LedgerGateway;
import com.chainvote.chainvote_api.ledger.model.Candidate;
import com.chainvote.chainvote_api.ledger.model.LedgerReceipt;
import com.chainvote.chainvote_api.vote.entity.VoteSource;
import com.chainvote.chainvote_api.vote.service.NewVoteRecord;
import com.chainvote.chainvote_api.vote.service.VoteRecordResult;
import com.chainvote.chainvote_api.vote.service.VoteRecordService;
import com.chainvote.chainvote_api.voter.entity.Voter;
import com.chainvote.chainvote_api.voter.service.VoterMirrorService;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LedgerEventHandlerTest {

	private static final String ADDRESS = "0x90f8bf6a479f320ead074411a4b0e7944ea8c9c1";
	private static final String TX_HASH = "0xfeed";

	private VoterMirrorService voterMirrorService;
	private VoteRecordService voteRecordService;
	private ElectionArchiveService electionArchiveService;
	private LedgerGateway ledgerGateway;
	private LedgerEventHandler handler;

	@BeforeEach
	void setUp() {
		voterMirrorService = mock(VoterMirrorService.class);
		voteRecordService = mock(VoteRecordService.class);
		electionArchiveService = mock(ElectionArchiveService.class);
		ledgerGateway = mock(LedgerGateway.class);
		handler = new LedgerEventHandler(voterMirrorService, voteRecordService, electionArchiveService, ledgerGateway);
	}

	private static Voter voter() {
		return Voter.builder().id(1L).userId(10L).ethAddress(ADDRESS).registered(true).build();
	}

	@Test
	void voterRegisteredMarksMirror() {
		when(voterMirrorService.findByAddress(ADDRESS)).thenReturn(Optional.of(voter()));

		handler.handle(new LedgerEvent.VoterRegistered(new LedgerEvent.Meta(TX_HASH, 5L), ADDRESS));

		verify(voterMirrorService).markRegistered(ADDRESS);
	}

	@Test
	void voterRegisteredForUnknownAddressIsIgnored() {
		when(voterMirrorService.findByAddress(ADDRESS)).thenReturn(Optional.empty());

		handler.handle(new LedgerEvent.VoterRegistered(new LedgerEvent.Meta(TX_HASH, 5L), ADDRESS));

		verify(voterMirrorService, never()).markRegistered(anyString());
	}

	@Test
	void voteCastAlreadyRecordedOnlyRefreshesMirror() {
		// given: API 경로가 먼저 기록을 남겼다
		when(voterMirrorService.findByAddress(ADDRESS)).thenReturn(Optional.of(voter()));
		when(voteRecordService.exists(TX_HASH)).thenReturn(true);

		// when
		handler.handle(new LedgerEvent.VoteCast(new LedgerEvent.Meta(TX_HASH, 7L), ADDRESS, 2L, "Bob"));

		// then: 원장을 다시 읽거나 기록을 시도하지 않는다
		verify(voteRecordService, never()).recordIfAbsent(any());
		verify(ledgerGateway, never()).getTransactionReceipt(anyString());
		verify(voterMirrorService).markVoted(ADDRESS, 2L);
	}

	@Test
	void voteCastNotYetRecordedIsRecordedFromEvent() {
		// given
		Instant blockTime = Instant.parse("2025-03-01T10:15:00Z");
		when(voterMirrorService.findByAddress(ADDRESS)).thenReturn(Optional.of(voter()));
		when(voteRecordService.exists(TX_HASH)).thenReturn(false);
		when(ledgerGateway.getTransactionReceipt(TX_HASH))
			.thenReturn(Optional.of(new LedgerReceipt(TX_HASH, 9L, "51234", ADDRESS)));
		when(ledgerGateway.getBlockTimestamp(9L)).thenReturn(blockTime);
		when(ledgerGateway.getCandidate(2L)).thenReturn(new Candidate(2L, "Bob", "Green", 1L));
		when(voteRecordService.recordIfAbsent(any())).thenReturn(VoteRecordResult.inserted(null));

		// when
		handler.handle(new LedgerEvent.VoteCast(new LedgerEvent.Meta(TX_HASH, 7L), ADDRESS, 2L, "Bob"));

		// then: 영수증의 블록 번호가 로그의 블록 번호보다 우선한다
		ArgumentCaptor<NewVoteRecord> captor = ArgumentCaptor.forClass(NewVoteRecord.class);
		verify(voteRecordService).recordIfAbsent(captor.capture());
		NewVoteRecord record = captor.getValue();
		assertThat(record.userId()).isEqualTo(10L);
		assertThat(record.blockNumber()).isEqualTo(9L);
		assertThat(record.blockTimestamp()).isEqualTo(blockTime);
		assertThat(record.gasUsed()).isEqualTo("51234");
		assertThat(record.candidateParty()).isEqualTo("Green");
		assertThat(record.source()).isEqualTo(VoteSource.EVENT_MONITOR);
		assertThat(record.ipAddress()).isNull();
		verify(voterMirrorService).markVoted(ADDRESS, 2L);
	}

	@Test
	void candidateLookupFailureStillRecordsVote() {
		when(voterMirrorService.findByAddress(ADDRESS)).thenReturn(Optional.of(voter()));
		when(ledgerGateway.getTransactionReceipt(TX_HASH)).thenReturn(Optional.empty());
		when(ledgerGateway.getBlockTimestamp(7L)).thenReturn(null);
		when(ledgerGateway.getCandidate(2L)).thenThrow(new ApiException(LedgerErrorCode.LEDGER_UNAVAILABLE));
		when(voteRecordService.recordIfAbsent(any())).thenReturn(VoteRecordResult.duplicate(null));

		handler.handle(new LedgerEvent.VoteCast(new LedgerEvent.Meta(TX_HASH, 7L), ADDRESS, 2L, "Bob"));

		ArgumentCaptor<NewVoteRecord> captor = ArgumentCaptor.forClass(NewVoteRecord.class);
		verify(voteRecordService).recordIfAbsent(captor.capture());
		assertThat(captor.getValue().blockNumber()).isEqualTo(7L);
		assertThat(captor.getValue().candidateParty()).isNull();
	}

	@Test
	void blockTimestampFailureStillRecordsVote() {
		// given: 영수증은 읽혔지만 블록 시각 조회가 일시적으로 실패한다
		when(voterMirrorService.findByAddress(ADDRESS)).thenReturn(Optional.of(voter()));
		when(ledgerGateway.getTransactionReceipt(TX_HASH))
			.thenReturn(Optional.of(new LedgerReceipt(TX_HASH, 9L, "51234", ADDRESS)));
		when(ledgerGateway.getBlockTimestamp(9L)).thenThrow(new ApiException(LedgerErrorCode.LEDGER_UNAVAILABLE));
		when(ledgerGateway.getCandidate(2L)).thenReturn(new Candidate(2L, "Bob", "Green", 1L));
		when(voteRecordService.recordIfAbsent(any())).thenReturn(VoteRecordResult.inserted(null));

		// when
		handler.handle(new LedgerEvent.VoteCast(new LedgerEvent.Meta(TX_HASH, 7L), ADDRESS, 2L, "Bob"));

		// then: 시각 없이 기록하고 캐시도 갱신한다
		ArgumentCaptor<NewVoteRecord> captor = ArgumentCaptor.forClass(NewVoteRecord.class);
		verify(voteRecordService).recordIfAbsent(captor.capture());
		assertThat(captor.getValue().blockNumber()).isEqualTo(9L);
		assertThat(captor.getValue().blockTimestamp()).isNull();
		assertThat(captor.getValue().gasUsed()).isEqualTo("51234");
		verify(voterMirrorService).markVoted(ADDRESS, 2L);
	}

	@Test
	void receiptFailureFallsBackToEventBlockNumber() {
		when(voterMirrorService.findByAddress(ADDRESS)).thenReturn(Optional.of(voter()));
		when(ledgerGateway.getTransactionReceipt(TX_HASH)).thenThrow(new ApiException(LedgerErrorCode.LEDGER_UNAVAILABLE));
		when(ledgerGateway.getBlockTimestamp(7L)).thenReturn(Instant.parse("2025-03-01T10:15:00Z"));
		when(ledgerGateway.getCandidate(2L)).thenReturn(new Candidate(2L, "Bob", "Green", 1L));
		when(voteRecordService.recordIfAbsent(any())).thenReturn(VoteRecordResult.inserted(null));

		handler.handle(new LedgerEvent.VoteCast(new LedgerEvent.Meta(TX_HASH, 7L), ADDRESS, 2L, "Bob"));

		ArgumentCaptor<NewVoteRecord> captor = ArgumentCaptor.forClass(NewVoteRecord.class);
		verify(voteRecordService).recordIfAbsent(captor.capture());
		assertThat(captor.getValue().blockNumber()).isEqualTo(7L);
		assertThat(captor.getValue().gasUsed()).isNull();
	}

	@Test
	void voteCastForUnknownAddressIsIgnored() {
		when(voterMirrorService.findByAddress(ADDRESS)).thenReturn(Optional.empty());

		handler.handle(new LedgerEvent.VoteCast(new LedgerEvent.Meta(TX_HASH, 7L), ADDRESS, 2L, "Bob"));

		verify(voteRecordService, never()).recordIfAbsent(any());
		verify(voterMirrorService, never()).markVoted(anyString(), anyLong());
	}

	@Test
	void electionEndedTriggersArchive() {
		when(electionArchiveService.archive(LedgerEventHandler.ARCHIVE_ACTOR)).thenReturn(ArchiveResult.archived(1));

		handler.handle(new LedgerEvent.ElectionEnded(new LedgerEvent.Meta(TX_HASH, 11L), "General Election 2025"));

		verify(electionArchiveService).archive("event-monitor");
	}

	@Test
	void informationalEventsTouchNothing() {
		handler.handle(new LedgerEvent.CandidateAdded(new LedgerEvent.Meta(TX_HASH, 1L), 1L, "Alice", "Blue"));
		handler.handle(new LedgerEvent.AdminChanged(new LedgerEvent.Meta(TX_HASH, 2L), ADDRESS, "0x01"));

		verify(electionArchiveService, never()).archive(anyString());
		verify(voteRecordService, never()).recordIfAbsent(any());
	}
}
