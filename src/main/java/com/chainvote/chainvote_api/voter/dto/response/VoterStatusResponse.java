package com.chainvote.chainvote_api.voter.dto.response;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "원장에서 직접 읽은 투표자 상태")
public record VoterStatusResponse(
	Long userId,
	String ethAddress,
	boolean isRegistered,
	boolean hasVoted,
	Long votedCandidateId,
	@Schema(description = "조회 시점에 로컬 캐시가 이미 원장과 같았는지 여부") boolean mirrorInSync
) {
}
