package com.chainvote.chainvote_api.voter.service;

import com.chainvote.chainvote_api.global.error.api.ApiException;
import com.chainvote.chainvote_api.ledger.model.LedgerHex;
import com.chainvote.chainvote_api.ledger.model.VoterStatus;
import com.chainvote.chainvote_api.voter.dto.response.VoterStatsResponse;
import com.chainvote.chainvote_api.voter.entity.Voter;
import com.chainvote.chainvote_api.voter.error.VoterErrorCode;
import com.chainvote.chainvote_api.voter.repository.VoterRepository;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 로컬 투표자 캐시 갱신. 모든 갱신은 멱등이라 이벤트가 여러 번 와도 안전하다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VoterMirrorService {

	private final VoterRepository voterRepository;

	@Transactional(readOnly = true)
	public Optional<Voter> findByAddress(String address) {
		return voterRepository.findByEthAddress(LedgerHex.normalize(address));
	}

	@Transactional(readOnly = true)
	public Voter getByUserId(Long userId) {
		return voterRepository.findByUserId(userId)
			.orElseThrow(() -> new ApiException(VoterErrorCode.VOTER_NOT_FOUND, "userId=" + userId));
	}

	@Transactional(readOnly = true)
	public List<Voter> getByUserIds(Collection<Long> userIds) {
		return voterRepository.findByUserIdIn(userIds);
	}

	@Transactional
	public int markRegistered(String address) {
		int updated = voterRepository.markRegistered(LedgerHex.normalize(address));
		log.debug("[VoterMirror] markRegistered address={}, updated={}", address, updated);
		return updated;
	}

	@Transactional
	public int markRegistered(Collection<String> addresses) {
		if (addresses.isEmpty()) {
			return 0;
		}
		List<String> normalized = addresses.stream().map(LedgerHex::normalize).toList();
		int updated = voterRepository.markRegisteredIn(normalized);
		log.info("[VoterMirror] markRegistered batch size={}, updated={}", normalized.size(), updated);
		return updated;
	}

	@Transactional
	public int markVoted(String address, long candidateId) {
		int updated = voterRepository.markVoted(LedgerHex.normalize(address), candidateId);
		log.debug("[VoterMirror] markVoted address={}, candidateId={}, updated={}", address, candidateId, updated);
		return updated;
	}

	@Transactional
	public int resetAll() {
		int updated = voterRepository.resetAll();
		log.info("[VoterMirror] resetAll updated={}", updated);
		return updated;
	}

	/**
	 * 원장에서 읽은 상태로 캐시를 덮어쓴다.
	 *
	 * @return 캐시가 이미 원장과 같았으면 true
	 */
	@Transactional
	public boolean reconcile(Long voterId, VoterStatus status) {
		Voter voter = voterRepository.findById(voterId)
			.orElseThrow(() -> new ApiException(VoterErrorCode.VOTER_NOT_FOUND, "voterId=" + voterId));
		if (voter.matches(status)) {
			return true;
		}
		log.info("[VoterMirror] reconcile voterId={}, registered {}->{}, hasVoted {}->{}",
			voterId, voter.isRegistered(), status.isRegistered(), voter.isHasVoted(), status.hasVoted());
		voter.reconcile(status);
		return false;
	}

	@Transactional(readOnly = true)
	public VoterStatsResponse stats() {
		long total = voterRepository.count();
		long registered = voterRepository.countByRegisteredTrue();
		long voted = voterRepository.countByHasVotedTrue();
		double turnout = registered == 0 ? 0.0 : Math.round(voted * 10000.0 / registered) / 100.0;
		return new VoterStatsResponse(total, registered, voted, Math.max(registered - voted, 0), turnout);
	}
}
