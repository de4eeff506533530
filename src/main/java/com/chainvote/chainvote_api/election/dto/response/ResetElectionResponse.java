package com.chainvote.chainvote_api.election.dto.response;

import com.chainvote.chainvote_api.election.archive.ArchiveResult;
import com.chainvote.chainvote_api.ledger.model.LedgerReceipt;
import io.swagger.v3.oas.annotations.media.Schema;

public record ResetElectionResponse(
	LedgerReceipt receipt,
	@Schema(description = "아카이브 시도가 실패했으면 null") ArchiveResult archive,
	@Schema(description = "아카이브 실패 시 경고 메시지. 초기화 자체는 진행된다.") String archiveWarning,
	int votersReset
) {
}
