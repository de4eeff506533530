package com.chainvote.chainvote_api.election.dto.response;

import com.chainvote.chainvote_api.election.archive.WinnerResult;
import java.util.List;

public record ElectionResultsResponse(
	String electionName,
	String phase,
	long totalVotes,
	List<CandidateResultResponse> candidates,
	WinnerResult winner
) {
}
