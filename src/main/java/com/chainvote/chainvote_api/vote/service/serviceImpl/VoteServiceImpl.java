package com.chainvote.chainvote_api.vote.service.serviceImpl;

import com.chainvote.chainvote_api.global.error.api.ApiException;
import com.chainvote.chainvote_api.ledger.error.LedgerErrorCode;
import com.chainvote.chainvote_api.ledger.gateway.LedgerGateway;
import com.chainvote.chainvote_api.ledger.model.Candidate;
import com.chainvote.chainvote_api.ledger.model.LedgerReceipt;
import com.chainvote.chainvote_api.vote.dto.request.CastVoteRequest;
import com.chainvote.chainvote_api.vote.dto.response.CastVoteResponse;
import com.chainvote.chainvote_api.vote.dto.response.VoteRecordResponse;
import com.chainvote.chainvote_api.vote.entity.VoteSource;
import com.chainvote.chainvote_api.vote.error.VoteErrorCode;
import com.chainvote.chainvote_api.vote.repository.VoteRepository;
import com.chainvote.chainvote_api.vote.service.NewVoteRecord;
import com.chainvote.chainvote_api.vote.service.VoteRecordResult;
import com.chainvote.chainvote_api.vote.service.VoteRecordService;
import com.chainvote.chainvote_api.vote.service.VoteService;
import com.chainvote.chainvote_api.voter.entity.Voter;
import com.chainvote.chainvote_api.voter.error.VoterErrorCode;
import com.chainvote.chainvote_api.voter.service.VoterMirrorService;
import java.time.Instant;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 투표 트랜잭션은 확정까지 수십 초 걸릴 수 있으므로 DB 트랜잭션으로 감싸지 않는다.
 * 확정 이후 기록/캐시 갱신은 각각 자기 트랜잭션에서 끝난다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VoteServiceImpl implements VoteService {

	private final LedgerGateway ledgerGateway;
	private final VoterMirrorService voterMirrorService;
	private final VoteRecordService voteRecordService;
	private final VoteRepository voteRepository;

	@Override
	public CastVoteResponse castVote(Long userId, CastVoteRequest request, String ipAddress, String userAgent) {
		Voter voter = voterMirrorService.getByUserId(userId);

		// 캐시 기준 1차 차단. 최종 판단은 원장이 한다.
		if (!voter.isRegistered()) {
			throw new ApiException(VoterErrorCode.VOTER_NOT_REGISTERED);
		}
		if (voter.isHasVoted()) {
			throw new ApiException(VoteErrorCode.ALREADY_VOTED);
		}

		String signer = ledgerGateway.resolveAddress(request.privateKey());
		if (!signer.equals(voter.getEthAddress())) {
			throw new ApiException(VoterErrorCode.VOTER_KEY_MISMATCH, "signer=" + signer);
		}

		Candidate candidate = findCandidate(request.candidateId());

		LedgerReceipt receipt;
		try {
			receipt = ledgerGateway.castVote(request.privateKey(), request.candidateId());
		} catch (ApiException ex) {
			throw translateCastRejection(ex);
		}

		Instant blockTimestamp = lookupBlockTimestamp(receipt.blockNumber());

		VoteRecordResult result = voteRecordService.recordIfAbsent(new NewVoteRecord(
			voter.getEthAddress(),
			voter.getUserId(),
			candidate.id(),
			candidate.name(),
			candidate.party(),
			receipt.transactionHash(),
			receipt.blockNumber(),
			blockTimestamp,
			receipt.gasUsed(),
			VoteSource.API,
			ipAddress,
			userAgent
		));

		voterMirrorService.markVoted(voter.getEthAddress(), candidate.id());

		log.info("[Vote] cast userId={}, candidateId={}, txHash={}, record={}",
			userId, candidate.id(), receipt.transactionHash(), result.status());

		return new CastVoteResponse(
			receipt.transactionHash(),
			receipt.blockNumber(),
			receipt.gasUsed(),
			candidate.id(),
			candidate.name(),
			result.isDuplicate()
		);
	}

	@Override
	public VoteRecordResponse getMyVote(Long userId) {
		Voter voter = voterMirrorService.getByUserId(userId);
		return voteRepository.findFirstByVoterAddressOrderByIdDesc(voter.getEthAddress())
			.map(VoteRecordResponse::from)
			.orElseThrow(() -> new ApiException(VoteErrorCode.VOTE_RECORD_NOT_FOUND, "userId=" + userId));
	}

	private Candidate findCandidate(long candidateId) {
		try {
			return ledgerGateway.getCandidate(candidateId);
		} catch (ApiException ex) {
			if (ex.is(LedgerErrorCode.LEDGER_REJECTED)) {
				throw new ApiException(VoteErrorCode.CANDIDATE_NOT_FOUND, ex.getDetail());
			}
			throw ex;
		}
	}

	// 블록 시각은 보조 정보다. 조회 실패로 이미 확정된 투표를 실패 처리하지 않는다.
	private Instant lookupBlockTimestamp(long blockNumber) {
		try {
			return ledgerGateway.getBlockTimestamp(blockNumber);
		} catch (ApiException ex) {
			log.warn("[Vote] block timestamp lookup failed block={}, code={}", blockNumber, ex.getErrorCode().getCode());
			return null;
		}
	}

	private ApiException translateCastRejection(ApiException ex) {
		if (!ex.is(LedgerErrorCode.LEDGER_REJECTED) || ex.getDetail() == null) {
			return ex;
		}
		String detail = ex.getDetail();
		String reason = detail.toLowerCase(Locale.ROOT);
		if (reason.contains("already voted")) {
			return new ApiException(VoteErrorCode.ALREADY_VOTED, detail);
		}
		if (reason.contains("not registered")) {
			return new ApiException(VoterErrorCode.VOTER_NOT_REGISTERED, detail);
		}
		if (reason.contains("not active") || reason.contains("not started") || reason.contains("has ended")) {
			return new ApiException(VoteErrorCode.ELECTION_NOT_ACTIVE, detail);
		}
		if (reason.contains("invalid candidate") || reason.contains("candidate does not exist")) {
			return new ApiException(VoteErrorCode.CANDIDATE_NOT_FOUND, detail);
		}
		return ex;
	}
}
