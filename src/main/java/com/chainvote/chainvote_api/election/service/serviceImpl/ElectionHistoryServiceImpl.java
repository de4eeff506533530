package com.chainvote.chainvote_api.election.service.serviceImpl;

import com.chainvote.chainvote_api.election.dto.response.ArchivedCandidateResponse;
import com.chainvote.chainvote_api.election.dto.response.ElectionHistoryDetailResponse;
import com.chainvote.chainvote_api.election.dto.response.ElectionHistoryStatsResponse;
import com.chainvote.chainvote_api.election.dto.response.ElectionHistorySummaryResponse;
import com.chainvote.chainvote_api.election.entity.ArchivedCandidate;
import com.chainvote.chainvote_api.election.entity.ElectionHistory;
import com.chainvote.chainvote_api.election.error.ElectionErrorCode;
import com.chainvote.chainvote_api.election.repository.ElectionHistoryRepository;
import com.chainvote.chainvote_api.election.service.ElectionHistoryService;
import com.chainvote.chainvote_api.global.error.api.ApiException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ElectionHistoryServiceImpl implements ElectionHistoryService {

	private final ElectionHistoryRepository electionHistoryRepository;

	@Override
	@Transactional(readOnly = true)
	public List<ElectionHistorySummaryResponse> getHistories() {
		return electionHistoryRepository.findAllByOrderByElectionNumberDesc().stream()
			.map(history -> new ElectionHistorySummaryResponse(
				history.getElectionNumber(),
				history.getElectionName(),
				history.getStartTime(),
				history.getEndTime(),
				history.getTotalVotes(),
				history.getVoterTurnout(),
				history.isDraw(),
				history.getWinners().stream().map(ArchivedCandidate::getName).toList(),
				history.getArchivedAt()
			))
			.toList();
	}

	@Override
	@Transactional(readOnly = true)
	public ElectionHistoryDetailResponse getHistory(Integer electionNumber) {
		ElectionHistory history = findByNumber(electionNumber);
		return new ElectionHistoryDetailResponse(
			history.getElectionNumber(),
			history.getElectionName(),
			history.getStartTime(),
			history.getEndTime(),
			history.getTotalVotes(),
			history.getTotalCandidates(),
			history.getTotalRegisteredVoters(),
			history.getVoterTurnout(),
			toResponses(history.getCandidates()),
			new ElectionHistoryDetailResponse.Winner(
				history.isDraw(),
				toResponses(history.getWinners()),
				history.getWinnerVoteCount()
			),
			history.getArchivedAt(),
			history.getArchivedBy()
		);
	}

	// 번호는 max+1 로 매기므로 가장 큰 번호를 지우면 다음 아카이브가 같은 번호를 다시 쓴다.
	@Override
	@Transactional
	public void deleteHistory(Integer electionNumber) {
		ElectionHistory history = findByNumber(electionNumber);
		electionHistoryRepository.delete(history);
		log.info("[ElectionHistory] deleted electionNumber={}, name={}", electionNumber, history.getElectionName());
	}

	@Override
	@Transactional(readOnly = true)
	public ElectionHistoryStatsResponse getStats() {
		Long totalVotes = electionHistoryRepository.sumTotalVotes();
		return new ElectionHistoryStatsResponse(
			electionHistoryRepository.count(),
			totalVotes == null ? 0L : totalVotes,
			electionHistoryRepository.findMaxElectionNumber()
		);
	}

	private ElectionHistory findByNumber(Integer electionNumber) {
		return electionHistoryRepository.findByElectionNumber(electionNumber)
			.orElseThrow(() -> new ApiException(ElectionErrorCode.ELECTION_HISTORY_NOT_FOUND,
				"electionNumber=" + electionNumber));
	}

	private static List<ArchivedCandidateResponse> toResponses(List<ArchivedCandidate> candidates) {
		return candidates.stream().map(ArchivedCandidateResponse::from).toList();
	}
}
