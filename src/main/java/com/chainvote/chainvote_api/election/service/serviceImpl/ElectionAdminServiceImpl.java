package com.chainvote.chainvote_api.election.service.serviceImpl;

import com.chainvote.chainvote_api.election.archive.ArchiveResult;
import com.chainvote.chainvote_api.election.archive.ElectionArchiveService;
import com.chainvote.chainvote_api.election.dto.request.AddCandidateRequest;
import com.chainvote.chainvote_api.election.dto.request.RegisterVotersBatchRequest;
import com.chainvote.chainvote_api.election.dto.response.BatchRegistrationResponse;
import com.chainvote.chainvote_api.election.dto.response.EndElectionResponse;
import com.chainvote.chainvote_api.election.dto.response.ResetElectionResponse;
import com.chainvote.chainvote_api.election.error.ElectionErrorCode;
import com.chainvote.chainvote_api.election.service.ElectionAdminService;
import com.chainvote.chainvote_api.global.error.api.ApiException;
import com.chainvote.chainvote_api.global.error.code.CommonErrorCode;
import com.chainvote.chainvote_api.ledger.error.LedgerErrorCode;
import com.chainvote.chainvote_api.ledger.gateway.LedgerGateway;
import com.chainvote.chainvote_api.ledger.model.LedgerReceipt;
import com.chainvote.chainvote_api.voter.entity.Voter;
import com.chainvote.chainvote_api.voter.error.VoterErrorCode;
import com.chainvote.chainvote_api.voter.service.VoterMirrorService;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class ElectionAdminServiceImpl implements ElectionAdminService {

	static final String END_ACTOR = "admin-end";
	static final String RESET_ACTOR = "pre-reset";

	private final LedgerGateway ledgerGateway;
	private final VoterMirrorService voterMirrorService;
	private final ElectionArchiveService electionArchiveService;

	@Override
	public LedgerReceipt addCandidate(AddCandidateRequest request) {
		return submit(() -> ledgerGateway.addCandidate(request.name().trim(), request.party().trim()));
	}

	@Override
	public LedgerReceipt registerVoter(Long userId) {
		Voter voter = voterMirrorService.getByUserId(userId);
		LedgerReceipt receipt = submit(() -> ledgerGateway.registerVoter(voter.getEthAddress()));
		voterMirrorService.markRegistered(voter.getEthAddress());
		log.info("[ElectionAdmin] voter registered userId={}, txHash={}", userId, receipt.transactionHash());
		return receipt;
	}

	@Override
	public BatchRegistrationResponse registerVotersBatch(RegisterVotersBatchRequest request) {
		Set<Long> requestedIds = new LinkedHashSet<>(request.userIds());
		List<Voter> voters = voterMirrorService.getByUserIds(requestedIds);

		Set<Long> foundIds = voters.stream().map(Voter::getUserId).collect(Collectors.toSet());
		List<Long> missing = requestedIds.stream().filter(id -> !foundIds.contains(id)).toList();
		if (!missing.isEmpty()) {
			throw new ApiException(VoterErrorCode.VOTER_NOT_FOUND, "userIds=" + missing);
		}

		List<String> addresses = new ArrayList<>();
		List<Long> skipped = new ArrayList<>();
		for (Voter voter : voters) {
			if (voter.isRegistered()) {
				skipped.add(voter.getUserId());
			} else {
				addresses.add(voter.getEthAddress());
			}
		}

		if (addresses.isEmpty()) {
			log.info("[ElectionAdmin] batch registration skipped, all registered requested={}", requestedIds.size());
			return new BatchRegistrationResponse(requestedIds.size(), 0, skipped, null, 0);
		}

		LedgerReceipt receipt = submit(() -> ledgerGateway.registerVotersBatch(addresses));
		int updated = voterMirrorService.markRegistered(addresses);
		log.info("[ElectionAdmin] batch registered submitted={}, skipped={}, txHash={}",
			addresses.size(), skipped.size(), receipt.transactionHash());
		return new BatchRegistrationResponse(requestedIds.size(), addresses.size(), skipped, receipt, updated);
	}

	@Override
	public LedgerReceipt startElection(String electionName) {
		return submit(() -> ledgerGateway.startElection(electionName.trim()));
	}

	@Override
	public EndElectionResponse endElection() {
		LedgerReceipt receipt = submit(ledgerGateway::endElection);
		try {
			ArchiveResult archive = electionArchiveService.archive(END_ACTOR);
			return new EndElectionResponse(receipt, archive, null);
		} catch (RuntimeException ex) {
			// 이벤트 모니터가 ElectionEnded 를 받으면 다시 시도한다.
			log.warn("[ElectionAdmin] archive after end failed txHash={}", receipt.transactionHash(), ex);
			return new EndElectionResponse(receipt, null, archiveWarning(ex));
		}
	}

	@Override
	public ResetElectionResponse resetElection(String newElectionName) {
		ArchiveResult archive = null;
		String warning = null;
		try {
			archive = electionArchiveService.archive(RESET_ACTOR);
		} catch (RuntimeException ex) {
			log.warn("[ElectionAdmin] archive before reset failed, continuing reset", ex);
			warning = archiveWarning(ex);
		}

		LedgerReceipt receipt = submit(() -> ledgerGateway.resetElection(newElectionName.trim()));
		int votersReset = voterMirrorService.resetAll();

		log.info("[ElectionAdmin] election reset newName={}, txHash={}, votersReset={}, archiveWarning={}",
			newElectionName, receipt.transactionHash(), votersReset, warning);
		return new ResetElectionResponse(receipt, archive, warning, votersReset);
	}

	@Override
	public LedgerReceipt changeAdmin(String newAdminAddress) {
		if (!ledgerGateway.isValidAddress(newAdminAddress)) {
			throw new ApiException(CommonErrorCode.INVALID_ADDRESS, newAdminAddress);
		}
		return submit(() -> ledgerGateway.changeAdmin(newAdminAddress));
	}

	private LedgerReceipt submit(Supplier<LedgerReceipt> write) {
		try {
			return write.get();
		} catch (ApiException ex) {
			throw translateAdminRejection(ex);
		}
	}

	private ApiException translateAdminRejection(ApiException ex) {
		if (!ex.is(LedgerErrorCode.LEDGER_REJECTED) || ex.getDetail() == null) {
			return ex;
		}
		String detail = ex.getDetail();
		String reason = detail.toLowerCase(Locale.ROOT);
		if (reason.contains("only admin")) {
			return new ApiException(ElectionErrorCode.ADMIN_PERMISSION_DENIED, detail);
		}
		if (reason.contains("already registered")) {
			return new ApiException(VoterErrorCode.VOTER_ALREADY_REGISTERED, detail);
		}
		if (reason.contains("has not ended") || reason.contains("already started") || reason.contains("not active")) {
			return new ApiException(ElectionErrorCode.ELECTION_PHASE_CONFLICT, detail);
		}
		return ex;
	}

	private static String archiveWarning(RuntimeException ex) {
		if (ex instanceof ApiException apiException) {
			String detail = apiException.getDetail();
			return "archive_failed: " + apiException.getErrorCode().getCode() + (detail == null ? "" : " " + detail);
		}
		return "archive_failed: " + ex.getMessage();
	}
}
