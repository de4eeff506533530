package com.chainvote.chainvote_api.ledger.dto;

import com.chainvote.chainvote_api.ledger.event.LedgerEventKind;
import java.util.List;

public record LedgerMonitorStatusResponse(
	String state,
	int activeSubscriptions,
	List<LedgerEventKind> subscribedKinds
) {
}
