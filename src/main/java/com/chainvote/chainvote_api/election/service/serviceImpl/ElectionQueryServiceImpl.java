package com.chainvote.chainvote_api.election.service.serviceImpl;

import com.chainvote.chainvote_api.election.archive.ElectionTally;
import com.chainvote.chainvote_api.election.dto.response.AdminStatsResponse;
import com.chainvote.chainvote_api.election.dto.response.CandidateResultResponse;
import com.chainvote.chainvote_api.election.dto.response.ElectionOverviewResponse;
import com.chainvote.chainvote_api.election.dto.response.ElectionResultsResponse;
import com.chainvote.chainvote_api.election.error.ElectionErrorCode;
import com.chainvote.chainvote_api.election.repository.ElectionHistoryRepository;
import com.chainvote.chainvote_api.election.service.ElectionQueryService;
import com.chainvote.chainvote_api.global.error.api.ApiException;
import com.chainvote.chainvote_api.ledger.gateway.LedgerGateway;
import com.chainvote.chainvote_api.ledger.model.Candidate;
import com.chainvote.chainvote_api.ledger.model.ElectionState;
import com.chainvote.chainvote_api.vote.service.VoteStatsService;
import com.chainvote.chainvote_api.voter.service.VoterMirrorService;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ElectionQueryServiceImpl implements ElectionQueryService {

	private final LedgerGateway ledgerGateway;
	private final VoterMirrorService voterMirrorService;
	private final VoteStatsService voteStatsService;
	private final ElectionHistoryRepository electionHistoryRepository;

	@Override
	public List<Candidate> getCandidates() {
		return ledgerGateway.getAllCandidates();
	}

	@Override
	public ElectionOverviewResponse getOverview() {
		return ElectionOverviewResponse.from(ledgerGateway.getElectionState());
	}

	@Override
	public ElectionResultsResponse getVoterResults() {
		ElectionState state = ledgerGateway.getElectionState();
		if (!state.isEnded()) {
			throw new ApiException(ElectionErrorCode.RESULTS_NOT_AVAILABLE, "phase=" + state.phase().label());
		}
		return buildResults(state, ledgerGateway.getResults());
	}

	@Override
	public ElectionResultsResponse getAdminResults() {
		ElectionState state = ledgerGateway.getElectionState();
		return buildResults(state, ledgerGateway.getResults());
	}

	@Override
	public AdminStatsResponse getAdminStats() {
		ElectionState state = ledgerGateway.getElectionState();
		return new AdminStatsResponse(
			ElectionOverviewResponse.from(state),
			voterMirrorService.stats(),
			voteStatsService.getTotalVotes(),
			electionHistoryRepository.count()
		);
	}

	private ElectionResultsResponse buildResults(ElectionState state, List<Candidate> candidates) {
		long totalVotes = state.totalVotes();
		List<CandidateResultResponse> sorted = candidates.stream()
			.sorted(Comparator.comparingLong(Candidate::voteCount).reversed()
				.thenComparingLong(Candidate::id))
			.map(candidate -> new CandidateResultResponse(
				candidate.id(),
				candidate.name(),
				candidate.party(),
				candidate.voteCount(),
				ElectionTally.percentage(candidate.voteCount(), totalVotes)
			))
			.toList();

		return new ElectionResultsResponse(
			state.name(),
			state.phase().label(),
			totalVotes,
			sorted,
			ElectionTally.computeWinner(candidates)
		);
	}
}
