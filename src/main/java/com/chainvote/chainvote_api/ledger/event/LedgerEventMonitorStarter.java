package com.chainvote.chainvote_api.ledger.event;

import com.chainvote.chainvote_api.ledger.config.LedgerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class LedgerEventMonitorStarter {

	private final LedgerEventMonitor ledgerEventMonitor;
	private final LedgerProperties properties;

	@EventListener(ApplicationReadyEvent.class)
	public void startOnReady() {
		if (!properties.events().enabled()) {
			log.info("[LedgerEventMonitor] disabled by ledger.events.enabled=false");
			return;
		}
		try {
			ledgerEventMonitor.start();
		} catch (RuntimeException ex) {
			// 조회/쓰기 API 는 계속 동작한다. 관리자 restart 로 다시 시도할 수 있다.
			log.error("[LedgerEventMonitor] initial start failed, monitor stays STOPPED", ex);
		}
	}
}
