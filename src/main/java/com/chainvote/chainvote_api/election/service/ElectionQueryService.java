package com.chainvote.chainvote_api.election.service;

import com.chainvote.chainvote_api.election.dto.response.AdminStatsResponse;
import com.chainvote.chainvote_api.election.dto.response.ElectionOverviewResponse;
import com.chainvote.chainvote_api.election.dto.response.ElectionResultsResponse;
import com.chainvote.chainvote_api.ledger.model.Candidate;
import java.util.List;

/**
 * 원장을 직접 읽는 조회. 로컬 캐시는 쓰지 않는다.
 */
public interface ElectionQueryService {

	List<Candidate> getCandidates();

	ElectionOverviewResponse getOverview();

	/**
	 * 투표자용. 선거가 종료된 뒤에만 볼 수 있다.
	 */
	ElectionResultsResponse getVoterResults();

	ElectionResultsResponse getAdminResults();

	AdminStatsResponse getAdminStats();
}
