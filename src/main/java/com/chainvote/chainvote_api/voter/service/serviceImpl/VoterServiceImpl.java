package com.chainvote.chainvote_api.voter.service.serviceImpl;

import com.chainvote.chainvote_api.global.error.api.ApiException;
import com.chainvote.chainvote_api.global.error.code.CommonErrorCode;
import com.chainvote.chainvote_api.ledger.gateway.LedgerGateway;
import com.chainvote.chainvote_api.ledger.model.LedgerHex;
import com.chainvote.chainvote_api.ledger.model.VoterStatus;
import com.chainvote.chainvote_api.voter.dto.request.EnrollVoterRequest;
import com.chainvote.chainvote_api.voter.dto.response.VoterResponse;
import com.chainvote.chainvote_api.voter.dto.response.VoterStatsResponse;
import com.chainvote.chainvote_api.voter.dto.response.VoterStatusResponse;
import com.chainvote.chainvote_api.voter.entity.Voter;
import com.chainvote.chainvote_api.voter.error.VoterErrorCode;
import com.chainvote.chainvote_api.voter.repository.VoterRepository;
import com.chainvote.chainvote_api.voter.service.VoterMirrorService;
import com.chainvote.chainvote_api.voter.service.VoterService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class VoterServiceImpl implements VoterService {

	private final VoterRepository voterRepository;
	private final VoterMirrorService voterMirrorService;
	private final LedgerGateway ledgerGateway;

	@Override
	@Transactional
	public VoterResponse enroll(EnrollVoterRequest request) {
		if (!ledgerGateway.isValidAddress(request.ethAddress())) {
			throw new ApiException(CommonErrorCode.INVALID_ADDRESS, request.ethAddress());
		}
		String address = LedgerHex.normalize(request.ethAddress());

		if (voterRepository.existsByUserId(request.userId())) {
			throw new ApiException(VoterErrorCode.VOTER_ALREADY_ENROLLED, "userId=" + request.userId());
		}
		if (voterRepository.existsByEthAddress(address)) {
			throw new ApiException(VoterErrorCode.VOTER_ADDRESS_IN_USE, address);
		}

		Voter saved = voterRepository.save(Voter.builder()
			.userId(request.userId())
			.ethAddress(address)
			.displayName(request.displayName())
			.registered(false)
			.hasVoted(false)
			.build());

		log.info("[Voter] enrolled userId={}, address={}", saved.getUserId(), saved.getEthAddress());
		return VoterResponse.from(saved);
	}

	// 원장 호출이 있으므로 트랜잭션 밖에서 읽고, 캐시 보정만 짧은 트랜잭션으로 처리한다.
	@Override
	public VoterStatusResponse getStatus(Long userId) {
		Voter voter = voterMirrorService.getByUserId(userId);
		VoterStatus status = ledgerGateway.getVoter(voter.getEthAddress());
		boolean inSync = voterMirrorService.reconcile(voter.getId(), status);

		return new VoterStatusResponse(
			voter.getUserId(),
			voter.getEthAddress(),
			status.isRegistered(),
			status.hasVoted(),
			status.votedCandidateId(),
			inSync
		);
	}

	@Override
	@Transactional(readOnly = true)
	public List<VoterResponse> getVoters(boolean registeredOnly) {
		List<Voter> voters = registeredOnly
			? voterRepository.findByRegisteredTrueOrderByIdAsc()
			: voterRepository.findAllByOrderByIdAsc();
		return voters.stream().map(VoterResponse::from).toList();
	}

	@Override
	public VoterStatsResponse getStats() {
		return voterMirrorService.stats();
	}
}
