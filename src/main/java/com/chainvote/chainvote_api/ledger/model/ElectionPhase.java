package com.chainvote.chainvote_api.ledger.model;

import com.chainvote.chainvote_api.global.error.api.ApiException;
import com.chainvote.chainvote_api.ledger.error.LedgerErrorCode;

public enum ElectionPhase {
	NOT_STARTED("NotStarted"),
	ACTIVE("Active"),
	ENDED("Ended");

	private final String label;

	ElectionPhase(String label) {
		this.label = label;
	}

	public String label() {
		return label;
	}

	// 컨트랙트 enum 의 uint8 값
	public static ElectionPhase fromOrdinal(int value) {
		ElectionPhase[] phases = values();
		if (value < 0 || value >= phases.length) {
			throw new ApiException(LedgerErrorCode.LEDGER_RESPONSE_INVALID, "unknown_phase=" + value);
		}
		return phases[value];
	}
}
