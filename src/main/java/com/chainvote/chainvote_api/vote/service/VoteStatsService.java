package com.chainvote.chainvote_api.vote.service;

import com.chainvote.chainvote_api.vote.dto.response.CandidateVoteCountResponse;
import com.chainvote.chainvote_api.vote.dto.response.HourlyVoteCountResponse;
import com.chainvote.chainvote_api.vote.dto.response.VoteRecordResponse;
import com.chainvote.chainvote_api.vote.dto.response.VoteStatisticsResponse;
import java.util.List;

/**
 * 투표 기록에서 매번 계산하는 읽기 모델. 별도 카운터를 유지하지 않는다.
 */
public interface VoteStatsService {

	List<CandidateVoteCountResponse> getCountsByCandidate();

	long getTotalVotes();

	VoteStatisticsResponse getStatistics();

	List<HourlyVoteCountResponse> getHourlyHistogram();

	List<VoteRecordResponse> getRecentVotes(int limit);

	List<VoteRecordResponse> getVotesByVoter(String voterAddress);

	List<VoteRecordResponse> getVotesByCandidate(long candidateId);

	VoteRecordResponse getByTxHash(String txHash);

	boolean hasVoted(String voterAddress);
}
