package com.chainvote.chainvote_api.vote.dto.response;

import io.swagger.v3.oas.annotations.media.Schema;

public record CastVoteResponse(
	String transactionHash,
	long blockNumber,
	String gasUsed,
	long candidateId,
	String candidateName,
	@Schema(description = "이벤트 모니터가 먼저 기록했으면 true. 투표 자체는 성공이다.") boolean recordedByMonitor
) {
}
