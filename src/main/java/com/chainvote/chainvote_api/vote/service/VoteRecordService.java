package com.chainvote.chainvote_api.vote.service;

import com.chainvote.chainvote_api.ledger.config.LedgerProperties;
import com.chainvote.chainvote_api.ledger.model.LedgerHex;
import com.chainvote.chainvote_api.vote.entity.Vote;
import com.chainvote.chainvote_api.vote.repository.VoteRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * 투표 기록의 단일 진입점.
 * <p>
 * API 경로와 이벤트 모니터가 같은 트랜잭션을 동시에 기록하려 할 수 있다.
 * 존재 여부를 먼저 조회하지 않고 바로 insert 하며, tx_hash 유니크 제약 위반을 중복 신호로 본다.
 * 중복은 실패가 아니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VoteRecordService {

	private final VoteRecordWriter voteRecordWriter;
	private final VoteRepository voteRepository;
	private final LedgerProperties ledgerProperties;

	public VoteRecordResult recordIfAbsent(NewVoteRecord record) {
		String txHash = LedgerHex.normalize(record.txHash());

		Vote vote = Vote.builder()
			.voterAddress(LedgerHex.normalize(record.voterAddress()))
			.userId(record.userId())
			.candidateId(record.candidateId())
			.candidateName(record.candidateName())
			.candidateParty(record.candidateParty())
			.txHash(txHash)
			.blockNumber(record.blockNumber())
			.blockTimestamp(record.blockTimestamp())
			.gasUsed(record.gasUsed())
			.electionTag(ledgerProperties.electionTag())
			.verified(true)
			.source(record.source())
			.ipAddress(record.ipAddress())
			.userAgent(record.userAgent())
			.build();

		try {
			Vote saved = voteRecordWriter.insert(vote);
			log.info("[VoteRecord] inserted txHash={}, candidateId={}, source={}",
				txHash, saved.getCandidateId(), saved.getSource());
			return VoteRecordResult.inserted(saved);
		} catch (DataIntegrityViolationException ex) {
			// tx_hash 가 아닌 다른 제약 위반이면 기존 기록이 없으므로 그대로 올린다.
			Vote existing = voteRepository.findByTxHash(txHash).orElseThrow(() -> ex);
			log.info("[VoteRecord] duplicate txHash={}, attemptedBy={}, recordedBy={}",
				txHash, record.source(), existing.getSource());
			return VoteRecordResult.duplicate(existing);
		}
	}

	public boolean exists(String txHash) {
		return voteRepository.existsByTxHash(LedgerHex.normalize(txHash));
	}
}
