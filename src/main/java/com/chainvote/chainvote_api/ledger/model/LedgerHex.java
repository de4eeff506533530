package com.chainvote.chainvote_api.ledger.model;

import java.util.Locale;

public final class LedgerHex {

	private LedgerHex() {
	}

	// 주소와 트랜잭션 해시는 소문자로만 저장/비교한다.
	public static String normalize(String value) {
		if (value == null) return null;
		return value.trim().toLowerCase(Locale.ROOT);
	}
}
