package com.chainvote.chainvote_api.ledger.event;

import com.chainvote.chainvote_api.election.archive.ArchiveResult;
import com.chainvote.chainvote_api.election.archive.ElectionArchiveService;
import com.chainvote.chainvote_api.global.error.api.ApiException;
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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 원장 이벤트를 로컬 캐시/투표 기록에 반영한다. 모든 반영은 멱등이다.
 * 예외는 그대로 던지고, 격리는 {@link LedgerEventMonitor} 가 이벤트 단위로 한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LedgerEventHandler {

	static final String ARCHIVE_ACTOR = "event-monitor";

	private final VoterMirrorService voterMirrorService;
	private final VoteRecordService voteRecordService;
	private final ElectionArchiveService electionArchiveService;
	private final LedgerGateway ledgerGateway;

	public void handle(LedgerEvent event) {
		if (event instanceof LedgerEvent.VoterRegistered registered) {
			onVoterRegistered(registered);
		} else if (event instanceof LedgerEvent.VoteCast voteCast) {
			onVoteCast(voteCast);
		} else if (event instanceof LedgerEvent.ElectionEnded ended) {
			onElectionEnded(ended);
		} else if (event instanceof LedgerEvent.ElectionStarted started) {
			log.info("[LedgerEvent] election started name={}, txHash={}", started.electionName(), txHash(started));
		} else if (event instanceof LedgerEvent.CandidateAdded added) {
			log.info("[LedgerEvent] candidate added id={}, name={}, party={}", added.candidateId(), added.name(), added.party());
		} else if (event instanceof LedgerEvent.AdminChanged changed) {
			log.info("[LedgerEvent] admin changed from={}, to={}", changed.previousAdmin(), changed.newAdmin());
		}
	}

	private void onVoterRegistered(LedgerEvent.VoterRegistered event) {
		if (voterMirrorService.findByAddress(event.voterAddress()).isEmpty()) {
			log.warn("[LedgerEvent] voter registered but no local user address={}", event.voterAddress());
			return;
		}
		int updated = voterMirrorService.markRegistered(event.voterAddress());
		log.info("[LedgerEvent] voter registered address={}, updated={}", event.voterAddress(), updated);
	}

	private void onVoteCast(LedgerEvent.VoteCast event) {
		Optional<Voter> voter = voterMirrorService.findByAddress(event.voterAddress());
		if (voter.isEmpty()) {
			log.warn("[LedgerEvent] vote cast but no local user address={}, txHash={}", event.voterAddress(), txHash(event));
			return;
		}

		String txHash = txHash(event);
		if (voteRecordService.exists(txHash)) {
			// 동기 경로가 이미 기록했다. 캐시 갱신은 멱등이라 한 번 더 해도 된다.
			voterMirrorService.markVoted(event.voterAddress(), event.candidateId());
			log.debug("[LedgerEvent] vote already recorded txHash={}", txHash);
			return;
		}

		Optional<LedgerReceipt> receipt = transactionReceipt(txHash);
		Long blockNumber = receipt.map(LedgerReceipt::blockNumber).orElse(event.meta().blockNumber());
		Instant blockTimestamp = blockTimestamp(blockNumber);

		VoteRecordResult result = voteRecordService.recordIfAbsent(new NewVoteRecord(
			event.voterAddress(),
			voter.get().getUserId(),
			event.candidateId(),
			event.candidateName(),
			candidateParty(event.candidateId()),
			txHash,
			blockNumber,
			blockTimestamp,
			receipt.map(LedgerReceipt::gasUsed).orElse(null),
			VoteSource.EVENT_MONITOR,
			null,
			null
		));
		voterMirrorService.markVoted(event.voterAddress(), event.candidateId());

		log.info("[LedgerEvent] vote cast address={}, candidateId={}, txHash={}, record={}",
			event.voterAddress(), event.candidateId(), txHash, result.status());
	}

	private void onElectionEnded(LedgerEvent.ElectionEnded event) {
		log.info("[LedgerEvent] election ended name={}, txHash={}", event.electionName(), txHash(event));
		ArchiveResult result = electionArchiveService.archive(ARCHIVE_ACTOR);
		log.info("[LedgerEvent] archive after end archived={}, alreadyExists={}, electionNumber={}, reason={}",
			result.archived(), result.alreadyExists(), result.electionNumber(), result.reason());
	}

	// 영수증/블록 시각은 보조 정보다. 조회가 실패해도 이벤트의 블록 번호로 기록을 남긴다.
	private Optional<LedgerReceipt> transactionReceipt(String txHash) {
		try {
			return ledgerGateway.getTransactionReceipt(txHash);
		} catch (ApiException ex) {
			log.warn("[LedgerEvent] receipt lookup failed txHash={}, code={}", txHash, ex.getErrorCode().getCode());
			return Optional.empty();
		}
	}

	private Instant blockTimestamp(Long blockNumber) {
		if (blockNumber == null) {
			return null;
		}
		try {
			return ledgerGateway.getBlockTimestamp(blockNumber);
		} catch (ApiException ex) {
			log.warn("[LedgerEvent] block timestamp lookup failed block={}, code={}", blockNumber, ex.getErrorCode().getCode());
			return null;
		}
	}

	// 이벤트에는 정당이 없어서 원장에서 한 번 더 읽는다. 실패해도 기록 자체는 남긴다.
	private String candidateParty(long candidateId) {
		try {
			Candidate candidate = ledgerGateway.getCandidate(candidateId);
			return candidate.party();
		} catch (ApiException ex) {
			log.warn("[LedgerEvent] candidate lookup failed id={}, code={}", candidateId, ex.getErrorCode().getCode());
			return null;
		}
	}

	private static String txHash(LedgerEvent event) {
		return event.meta().transactionHash();
	}
}
