package com.chainvote.chainvote_api.ledger.event;

public interface LedgerSubscription {

	/**
	 * 반환 시점 이후로는 더 이상 이벤트가 전달되지 않는다.
	 */
	void cancel();

	boolean isActive();
}
