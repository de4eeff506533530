package com.chainvote.chainvote_api.ledger.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "확정된 원장 트랜잭션 영수증")
public record LedgerReceipt(
	@Schema(example = "0x5c504ed432cb51138bcf09aa5e8a410dd4a1e204ef84bfed1be16dfba1b22060") String transactionHash,
	long blockNumber,
	@Schema(description = "소모된 gas (10진 문자열)") String gasUsed,
	@Schema(description = "서명한 주소") String from
) {
}
