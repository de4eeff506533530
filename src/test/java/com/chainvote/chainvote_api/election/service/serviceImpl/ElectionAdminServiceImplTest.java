package com.chainvote.chainvote_api.election.service.serviceImpl;

import com.chainvote.chainvote_api.election.archive.ArchiveResult;
import com.chainvote.chainvote_api.election.archive.ElectionArchiveService;
import com.chainvote.chainvote_api.election.dto.request.RegisterVotersBatchRequest;
import com.chainvote.chainvote_api.election.dto.response.BatchRegistrationResponse;
import com.chainvote.chainvote_api.election.dto.response.EndElectionResponse;
import com.chainvote.chainvote_api.election.dto.response.ResetElectionResponse;
import com.chainvote.chainvote_api.election.error.ElectionErrorCode;
import com.chainvote.chainvote_api.global.error.api.ApiException;
import com.chainvote.chainvote_api.global.error.code.CommonErrorCode;
import com.chainvote.chainvote_api.ledger.error.LedgerErrorCode;
import com.chainvote.chainvote_api.ledger.gateway.LedgerGateway;
import com.chainvote.chainvote_api.ledger.model.LedgerReceipt;
import com.chainvote.chainvote_api.voter.entity.Voter;
import com.chainvote.chainvote_api.voter.error.VoterErrorCode;
import com.chainvote.chainvote_api.voter.service.VoterMirrorService;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

// 단위 테스트: 관리자 명령의 순서와 원장 거부 메시지 변환을 검증한다.
class ElectionAdminServiceImplTest {

	private static final LedgerReceipt RECEIPT = new LedgerReceipt("0xfeed", 12L, "30000", "0xadmin");

	private LedgerGateway ledgerGateway;
	private VoterMirrorService voterMirrorService;
	private ElectionArchiveService electionArchiveService;
	private ElectionAdminServiceImpl service;

	@BeforeEach
	void setUp() {
		ledgerGateway = mock(LedgerGateway.class);
		voterMirrorService = mock(VoterMirrorService.class);
		electionArchiveService = mock(ElectionArchiveService.class);
		service = new ElectionAdminServiceImpl(ledgerGateway, voterMirrorService, electionArchiveService);
	}

	private static Voter voter(long userId, String address, boolean registered) {
		return Voter.builder().id(userId).userId(userId).ethAddress(address).registered(registered).build();
	}

	@Test
	void resetArchivesBeforeResettingLedgerAndMirror() {
		// given
		when(electionArchiveService.archive("pre-reset")).thenReturn(ArchiveResult.archived(4));
		when(ledgerGateway.resetElection("Next")).thenReturn(RECEIPT);
		when(voterMirrorService.resetAll()).thenReturn(3);

		// when
		ResetElectionResponse response = service.resetElection(" Next ");

		// then: 아카이브 → 원장 초기화 → 캐시 초기화 순서
		InOrder order = inOrder(electionArchiveService, ledgerGateway, voterMirrorService);
		order.verify(electionArchiveService).archive("pre-reset");
		order.verify(ledgerGateway).resetElection("Next");
		order.verify(voterMirrorService).resetAll();
		assertThat(response.archive().electionNumber()).isEqualTo(4);
		assertThat(response.archiveWarning()).isNull();
		assertThat(response.votersReset()).isEqualTo(3);
	}

	@Test
	void resetProceedsWhenArchiveFails() {
		// given: 아카이브 중 원장 조회가 실패한다
		when(electionArchiveService.archive("pre-reset"))
			.thenThrow(new ApiException(LedgerErrorCode.LEDGER_UNAVAILABLE, "connection refused"));
		when(ledgerGateway.resetElection("Next")).thenReturn(RECEIPT);

		// when
		ResetElectionResponse response = service.resetElection("Next");

		// then: 초기화는 진행되고 경고만 남는다
		assertThat(response.receipt()).isEqualTo(RECEIPT);
		assertThat(response.archive()).isNull();
		assertThat(response.archiveWarning()).isEqualTo("archive_failed: LEDGER_UNAVAILABLE connection refused");
		verify(voterMirrorService).resetAll();
	}

	@Test
	void endReportsArchiveOutcome() {
		when(ledgerGateway.endElection()).thenReturn(RECEIPT);
		when(electionArchiveService.archive("admin-end")).thenReturn(ArchiveResult.alreadyExists(2));

		EndElectionResponse response = service.endElection();

		assertThat(response.receipt()).isEqualTo(RECEIPT);
		assertThat(response.archive().alreadyExists()).isTrue();
	}

	@Test
	void endSucceedsEvenIfArchiveFails() {
		when(ledgerGateway.endElection()).thenReturn(RECEIPT);
		when(electionArchiveService.archive("admin-end")).thenThrow(new IllegalStateException("db down"));

		EndElectionResponse response = service.endElection();

		assertThat(response.archive()).isNull();
		assertThat(response.archiveWarning()).isEqualTo("archive_failed: db down");
	}

	@Test
	void endRejectedByLedgerDoesNotArchive() {
		when(ledgerGateway.endElection())
			.thenThrow(new ApiException(LedgerErrorCode.LEDGER_REJECTED, "Election is not active"));

		assertThatThrownBy(() -> service.endElection())
			.isInstanceOf(ApiException.class)
			.satisfies(ex -> assertThat(((ApiException) ex).getErrorCode()).isEqualTo(ElectionErrorCode.ELECTION_PHASE_CONFLICT));
		verify(electionArchiveService, never()).archive(any());
	}

	@Test
	void registerVoterMarksMirror() {
		when(voterMirrorService.getByUserId(7L)).thenReturn(voter(7L, "0xaaa", false));
		when(ledgerGateway.registerVoter("0xaaa")).thenReturn(RECEIPT);

		LedgerReceipt receipt = service.registerVoter(7L);

		assertThat(receipt).isEqualTo(RECEIPT);
		verify(voterMirrorService).markRegistered("0xaaa");
	}

	@Test
	void alreadyRegisteredRevertIsConflict() {
		when(voterMirrorService.getByUserId(7L)).thenReturn(voter(7L, "0xaaa", true));
		when(ledgerGateway.registerVoter("0xaaa"))
			.thenThrow(new ApiException(LedgerErrorCode.LEDGER_REJECTED, "Voter already registered"));

		assertThatThrownBy(() -> service.registerVoter(7L))
			.satisfies(ex -> assertThat(((ApiException) ex).getErrorCode()).isEqualTo(VoterErrorCode.VOTER_ALREADY_REGISTERED));
	}

	@Test
	void nonAdminSignerIsPermissionDenied() {
		when(ledgerGateway.startElection("E"))
			.thenThrow(new ApiException(LedgerErrorCode.LEDGER_REJECTED, "Only admin can perform this action"));

		assertThatThrownBy(() -> service.startElection("E"))
			.satisfies(ex -> assertThat(((ApiException) ex).getErrorCode()).isEqualTo(ElectionErrorCode.ADMIN_PERMISSION_DENIED));
	}

	@Test
	void batchSkipsRegisteredVoters() {
		// given: 1 은 이미 등록, 2·3 은 미등록
		when(voterMirrorService.getByUserIds(any())).thenReturn(List.of(
			voter(1L, "0x01", true), voter(2L, "0x02", false), voter(3L, "0x03", false)));
		when(ledgerGateway.registerVotersBatch(List.of("0x02", "0x03"))).thenReturn(RECEIPT);
		when(voterMirrorService.markRegistered(List.of("0x02", "0x03"))).thenReturn(2);

		// when
		BatchRegistrationResponse response = service.registerVotersBatch(new RegisterVotersBatchRequest(List.of(1L, 2L, 3L)));

		// then
		assertThat(response.requested()).isEqualTo(3);
		assertThat(response.submitted()).isEqualTo(2);
		assertThat(response.skippedUserIds()).containsExactly(1L);
		assertThat(response.mirrorUpdated()).isEqualTo(2);
	}

	@Test
	void batchOfRegisteredVotersMakesNoLedgerCall() {
		when(voterMirrorService.getByUserIds(any())).thenReturn(List.of(voter(1L, "0x01", true)));

		BatchRegistrationResponse response = service.registerVotersBatch(new RegisterVotersBatchRequest(List.of(1L)));

		assertThat(response.submitted()).isZero();
		assertThat(response.receipt()).isNull();
		verify(ledgerGateway, never()).registerVotersBatch(anyList());
	}

	@Test
	void batchWithUnknownUserIsRejected() {
		when(voterMirrorService.getByUserIds(any())).thenReturn(List.of(voter(1L, "0x01", false)));

		assertThatThrownBy(() -> service.registerVotersBatch(new RegisterVotersBatchRequest(List.of(1L, 99L))))
			.satisfies(ex -> {
				ApiException api = (ApiException) ex;
				assertThat(api.getErrorCode()).isEqualTo(VoterErrorCode.VOTER_NOT_FOUND);
				assertThat(api.getDetail()).contains("99");
			});
		verify(voterMirrorService, never()).markRegistered(anyCollection());
	}

	@Test
	void changeAdminValidatesAddress() {
		when(ledgerGateway.isValidAddress("nope")).thenReturn(false);

		assertThatThrownBy(() -> service.changeAdmin("nope"))
			.satisfies(ex -> assertThat(((ApiException) ex).getErrorCode()).isEqualTo(CommonErrorCode.INVALID_ADDRESS));
	}
}
