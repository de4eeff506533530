package com.chainvote.chainvote_api.ledger.gateway;

import com.chainvote.chainvote_api.global.error.api.ApiException;
import com.chainvote.chainvote_api.ledger.error.LedgerErrorCode;
import java.util.function.Predicate;

/**
 * 서킷브레이커 실패 판정. 컨트랙트 revert 는 노드가 정상 응답한 것이므로 실패로 세지 않는다.
 */
public class LedgerFailurePredicate implements Predicate<Throwable> {

	@Override
	public boolean test(Throwable throwable) {
		if (throwable instanceof ApiException apiException) {
			return !apiException.is(LedgerErrorCode.LEDGER_REJECTED);
		}
		return true;
	}
}
