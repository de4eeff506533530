package com.chainvote.chainvote_api.election.dto.response;

import com.chainvote.chainvote_api.ledger.model.LedgerReceipt;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;

public record BatchRegistrationResponse(
	int requested,
	int submitted,
	@Schema(description = "이미 등록되어 제외한 userId") List<Long> skippedUserIds,
	@Schema(description = "제출할 투표자가 없으면 null") LedgerReceipt receipt,
	int mirrorUpdated
) {
}
