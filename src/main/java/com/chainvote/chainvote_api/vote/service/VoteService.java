package com.chainvote.chainvote_api.vote.service;

import com.chainvote.chainvote_api.vote.dto.request.CastVoteRequest;
import com.chainvote.chainvote_api.vote.dto.response.CastVoteResponse;
import com.chainvote.chainvote_api.vote.dto.response.VoteRecordResponse;

public interface VoteService {

	CastVoteResponse castVote(Long userId, CastVoteRequest request, String ipAddress, String userAgent);

	VoteRecordResponse getMyVote(Long userId);
}
