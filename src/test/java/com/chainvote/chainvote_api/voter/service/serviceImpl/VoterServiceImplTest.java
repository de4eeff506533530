package com.chainvote.chainvote_api.voter.service.serviceImpl;

import com.chainvote.chainvote_api.global.error.api.ApiException;
import com.chainvote.chainvote_api.global.error.code.CommonErrorCode;
import com.chainvote.chainvote_api.ledger.gateway.LedgerGateway;
import com.chainvote.chainvote_api.ledger.model.VoterStatus;
import com.chainvote.chainvote_api.voter.dto.request.EnrollVoterRequest;
import com.chainvote.chainvote_api.voter.dto.response.VoterResponse;
import com.chainvote.chainvote_api.voter.dto.response.VoterStatusResponse;
import com.chainvote.chainvote_api.voter.entity.Voter;
import com.chainvote.chainvote_api.voter.error.VoterErrorCode;
import com.chainvote.chainvote_api.voter.repository.VoterRepository;
import com.chainvote.chainvote_api.voter.service.VoterMirrorService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class VoterServiceImplTest {

	private static final String CHECKSUM_ADDRESS = "0x627306090abaB3A6e1400e9345bC60c78a8BEf57";

	private VoterRepository voterRepository;
	private VoterMirrorService voterMirrorService;
	private LedgerGateway ledgerGateway;
	private VoterServiceImpl service;

	@BeforeEach
	void setUp() {
		voterRepository = mock(VoterRepository.class);
		voterMirrorService = mock(VoterMirrorService.class);
		ledgerGateway = mock(LedgerGateway.class);
		service = new VoterServiceImpl(voterRepository, voterMirrorService, ledgerGateway);
	}

	@Test
	void enrollStoresLowercaseAddressUnregistered() {
		when(ledgerGateway.isValidAddress(CHECKSUM_ADDRESS)).thenReturn(true);
		when(voterRepository.save(any(Voter.class))).thenAnswer(invocation -> invocation.getArgument(0));

		VoterResponse response = service.enroll(new EnrollVoterRequest(10L, CHECKSUM_ADDRESS, "Kim"));

		ArgumentCaptor<Voter> captor = ArgumentCaptor.forClass(Voter.class);
		verify(voterRepository).save(captor.capture());
		assertThat(captor.getValue().getEthAddress()).isEqualTo(CHECKSUM_ADDRESS.toLowerCase());
		assertThat(captor.getValue().isRegistered()).isFalse();
		assertThat(response.userId()).isEqualTo(10L);
	}

	@Test
	void enrollRejectsMalformedAddress() {
		when(ledgerGateway.isValidAddress("0x12")).thenReturn(false);

		assertThatThrownBy(() -> service.enroll(new EnrollVoterRequest(10L, "0x12", null)))
			.satisfies(ex -> assertThat(((ApiException) ex).getErrorCode()).isEqualTo(CommonErrorCode.INVALID_ADDRESS));
		verify(voterRepository, never()).save(any());
	}

	@Test
	void enrollRejectsDuplicates() {
		when(ledgerGateway.isValidAddress(CHECKSUM_ADDRESS)).thenReturn(true);
		when(voterRepository.existsByUserId(10L)).thenReturn(true);

		assertThatThrownBy(() -> service.enroll(new EnrollVoterRequest(10L, CHECKSUM_ADDRESS, null)))
			.satisfies(ex -> assertThat(((ApiException) ex).getErrorCode()).isEqualTo(VoterErrorCode.VOTER_ALREADY_ENROLLED));

		when(voterRepository.existsByUserId(11L)).thenReturn(false);
		when(voterRepository.existsByEthAddress(CHECKSUM_ADDRESS.toLowerCase())).thenReturn(true);

		assertThatThrownBy(() -> service.enroll(new EnrollVoterRequest(11L, CHECKSUM_ADDRESS, null)))
			.satisfies(ex -> assertThat(((ApiException) ex).getErrorCode()).isEqualTo(VoterErrorCode.VOTER_ADDRESS_IN_USE));
	}

	@Test
	void statusComesFromLedgerAndReconcilesMirror() {
		// given: 캐시는 미투표지만 원장은 이미 투표 완료
		Voter voter = Voter.builder().id(1L).userId(10L).ethAddress("0xaaa").registered(true).build();
		VoterStatus ledgerStatus = new VoterStatus(true, true, 2L);
		when(voterMirrorService.getByUserId(10L)).thenReturn(voter);
		when(ledgerGateway.getVoter("0xaaa")).thenReturn(ledgerStatus);
		when(voterMirrorService.reconcile(1L, ledgerStatus)).thenReturn(false);

		// when
		VoterStatusResponse status = service.getStatus(10L);

		// then: 응답은 원장 값, 캐시는 보정 대상
		assertThat(status.hasVoted()).isTrue();
		assertThat(status.votedCandidateId()).isEqualTo(2L);
		assertThat(status.mirrorInSync()).isFalse();
		verify(voterMirrorService).reconcile(1L, ledgerStatus);
	}
}
