package com.chainvote.chainvote_api.vote.dto.response;

import com.chainvote.chainvote_api.vote.entity.Vote;
import java.time.Instant;

public record VoteRecordResponse(
	Long voteId,
	String voterAddress,
	Long userId,
	Long candidateId,
	String candidateName,
	String candidateParty,
	String txHash,
	Long blockNumber,
	Instant blockTimestamp,
	String gasUsed,
	String electionTag,
	boolean isVerified,
	String source,
	Instant createdAt
) {

	public static VoteRecordResponse from(Vote vote) {
		return new VoteRecordResponse(
			vote.getId(),
			vote.getVoterAddress(),
			vote.getUserId(),
			vote.getCandidateId(),
			vote.getCandidateName(),
			vote.getCandidateParty(),
			vote.getTxHash(),
			vote.getBlockNumber(),
			vote.getBlockTimestamp(),
			vote.getGasUsed(),
			vote.getElectionTag(),
			vote.isVerified(),
			vote.getSource() == null ? null : vote.getSource().name(),
			vote.getCreatedAt()
		);
	}
}
