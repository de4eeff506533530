package com.chainvote.chainvote_api.voter.service;

import com.chainvote.chainvote_api.voter.dto.request.EnrollVoterRequest;
import com.chainvote.chainvote_api.voter.dto.response.VoterResponse;
import com.chainvote.chainvote_api.voter.dto.response.VoterStatsResponse;
import com.chainvote.chainvote_api.voter.dto.response.VoterStatusResponse;
import java.util.List;

public interface VoterService {

	VoterResponse enroll(EnrollVoterRequest request);

	VoterStatusResponse getStatus(Long userId);

	List<VoterResponse> getVoters(boolean registeredOnly);

	VoterStatsResponse getStats();
}
