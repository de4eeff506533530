package com.chainvote.chainvote_api.voter.dto.response;

import com.chainvote.chainvote_api.voter.entity.Voter;
import java.time.Instant;

public record VoterResponse(
	Long voterId,
	Long userId,
	String ethAddress,
	String displayName,
	boolean isRegistered,
	boolean hasVoted,
	Long votedCandidateId,
	Instant createdAt
) {

	public static VoterResponse from(Voter voter) {
		return new VoterResponse(
			voter.getId(),
			voter.getUserId(),
			voter.getEthAddress(),
			voter.getDisplayName(),
			voter.isRegistered(),
			voter.isHasVoted(),
			voter.getVotedCandidateId(),
			voter.getCreatedAt()
		);
	}
}
