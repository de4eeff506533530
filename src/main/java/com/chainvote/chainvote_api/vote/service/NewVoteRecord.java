package com.chainvote.chainvote_api.vote.service;

import com.chainvote.chainvote_api.vote.entity.VoteSource;
import java.time.Instant;

/**
 * 확정된 투표 트랜잭션 하나를 기록하기 위한 입력. ipAddress/userAgent 는 API 경로에서만 채워진다.
 */
public record NewVoteRecord(
	String voterAddress,
	Long userId,
	long candidateId,
	String candidateName,
	String candidateParty,
	String txHash,
	Long blockNumber,
	Instant blockTimestamp,
	String gasUsed,
	VoteSource source,
	String ipAddress,
	String userAgent
) {
}
