package com.chainvote.chainvote_api.vote.service.serviceImpl;

import com.chainvote.chainvote_api.global.error.api.ApiException;
import com.chainvote.chainvote_api.global.error.code.CommonErrorCode;
import com.chainvote.chainvote_api.global.time.LedgerTime;
import com.chainvote.chainvote_api.ledger.model.LedgerHex;
import com.chainvote.chainvote_api.vote.dto.response.CandidateVoteCountResponse;
import com.chainvote.chainvote_api.vote.dto.response.HourlyVoteCountResponse;
import com.chainvote.chainvote_api.vote.dto.response.VoteRecordResponse;
import com.chainvote.chainvote_api.vote.dto.response.VoteStatisticsResponse;
import com.chainvote.chainvote_api.vote.error.VoteErrorCode;
import com.chainvote.chainvote_api.vote.repository.VoteRepository;
import com.chainvote.chainvote_api.vote.repository.projection.VoteStatisticsRow;
import com.chainvote.chainvote_api.vote.service.VoteStatsService;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class VoteStatsServiceImpl implements VoteStatsService {

	private static final int MAX_RECENT_LIMIT = 100;

	private final VoteRepository voteRepository;

	@Override
	public List<CandidateVoteCountResponse> getCountsByCandidate() {
		return voteRepository.countByCandidate().stream()
			.map(row -> new CandidateVoteCountResponse(
				row.getCandidateId(),
				row.getCandidateName(),
				row.getCandidateParty(),
				row.getVoteCount()
			))
			.toList();
	}

	@Override
	public long getTotalVotes() {
		return voteRepository.count();
	}

	@Override
	public VoteStatisticsResponse getStatistics() {
		VoteStatisticsRow row = voteRepository.aggregateStatistics();
		Long averageBlock = row.getAverageBlockNumber() == null ? null : Math.round(row.getAverageBlockNumber());
		return new VoteStatisticsResponse(
			row.getTotalVotes() == null ? 0L : row.getTotalVotes(),
			row.getUniqueVoters() == null ? 0L : row.getUniqueVoters(),
			row.getFirstVoteAt(),
			row.getLastVoteAt(),
			averageBlock
		);
	}

	// 시간 단위 버킷은 DB 함수 차이를 피하려고 애플리케이션에서 계산한다.
	@Override
	public List<HourlyVoteCountResponse> getHourlyHistogram() {
		Map<Instant, Long> buckets = new TreeMap<>();
		for (Instant timestamp : voteRepository.findAllBlockTimestamps()) {
			buckets.merge(LedgerTime.truncateToHour(timestamp), 1L, Long::sum);
		}
		return buckets.entrySet().stream()
			.map(entry -> new HourlyVoteCountResponse(entry.getKey(), entry.getValue()))
			.toList();
	}

	@Override
	public List<VoteRecordResponse> getRecentVotes(int limit) {
		if (limit < 1 || limit > MAX_RECENT_LIMIT) {
			throw new ApiException(CommonErrorCode.VALIDATION_FAILED, "limit=" + limit);
		}
		return voteRepository.findAllByOrderByIdDesc(PageRequest.of(0, limit)).stream()
			.map(VoteRecordResponse::from)
			.toList();
	}

	@Override
	public List<VoteRecordResponse> getVotesByVoter(String voterAddress) {
		return voteRepository.findByVoterAddressOrderByIdDesc(LedgerHex.normalize(voterAddress)).stream()
			.map(VoteRecordResponse::from)
			.toList();
	}

	@Override
	public List<VoteRecordResponse> getVotesByCandidate(long candidateId) {
		return voteRepository.findByCandidateIdOrderByIdDesc(candidateId).stream()
			.map(VoteRecordResponse::from)
			.toList();
	}

	@Override
	public VoteRecordResponse getByTxHash(String txHash) {
		return voteRepository.findByTxHash(LedgerHex.normalize(txHash))
			.map(VoteRecordResponse::from)
			.orElseThrow(() -> new ApiException(VoteErrorCode.VOTE_RECORD_NOT_FOUND, txHash));
	}

	@Override
	public boolean hasVoted(String voterAddress) {
		return voteRepository.existsByVoterAddress(LedgerHex.normalize(voterAddress));
	}
}
