package com.chainvote.chainvote_api.election.service;

import com.chainvote.chainvote_api.election.dto.response.ElectionHistoryDetailResponse;
import com.chainvote.chainvote_api.election.dto.response.ElectionHistoryStatsResponse;
import com.chainvote.chainvote_api.election.dto.response.ElectionHistorySummaryResponse;
import java.util.List;

public interface ElectionHistoryService {

	List<ElectionHistorySummaryResponse> getHistories();

	ElectionHistoryDetailResponse getHistory(Integer electionNumber);

	void deleteHistory(Integer electionNumber);

	ElectionHistoryStatsResponse getStats();
}
