package com.chainvote.chainvote_api.ledger.event;

import java.util.function.Consumer;

/**
 * 이벤트 종류별 구독을 여는 곳. 같은 종류 안에서는 원장 발행 순서대로 전달한다.
 * 스트림이 오류로 끝나면 onTerminated 가 한 번 호출되고 그 구독은 더 이상 active 가 아니다.
 */
public interface LedgerEventSource {

	LedgerSubscription subscribe(
		LedgerEventKind kind,
		Consumer<LedgerEvent> consumer,
		Consumer<Throwable> onTerminated
	);
}
