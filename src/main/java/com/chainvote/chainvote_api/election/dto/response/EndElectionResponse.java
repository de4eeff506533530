package com.chainvote.chainvote_api.election.dto.response;

import com.chainvote.chainvote_api.election.archive.ArchiveResult;
import com.chainvote.chainvote_api.ledger.model.LedgerReceipt;
import io.swagger.v3.oas.annotations.media.Schema;

public record EndElectionResponse(
	LedgerReceipt receipt,
	@Schema(description = "아카이브 시도가 실패했으면 null") ArchiveResult archive,
	String archiveWarning
) {
}
