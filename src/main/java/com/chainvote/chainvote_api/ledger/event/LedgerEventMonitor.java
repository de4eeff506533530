package com.chainvote.chainvote_api.ledger.event;

import com.chainvote.chainvote_api.ledger.config.LedgerProperties;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 원장 이벤트 구독의 수명주기를 소유한다. STOPPED → LISTENING → STOPPED.
 * <p>
 * 종류마다 구독은 최대 하나다. stop() 은 모든 구독을 해제한 뒤에 반환하므로
 * stop/start 를 몇 번 반복해도 같은 이벤트가 두 번 전달되지 않는다.
 * 핸들러 예외는 이벤트 단위로 잡고 구독은 유지한다.
 * 스트림 자체가 오류로 끝나면 restartDelay 뒤에 그 종류만 다시 구독한다.
 */
@Slf4j
@Component
public class LedgerEventMonitor {

	public enum State {
		STOPPED,
		LISTENING
	}

	private final LedgerEventSource eventSource;
	private final LedgerEventHandler eventHandler;
	private final Duration restartDelay;
	private final ScheduledExecutorService resubscribeScheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
		Thread thread = new Thread(runnable, "ledger-event-resubscribe");
		thread.setDaemon(true);
		return thread;
	});

	private final Map<LedgerEventKind, LedgerSubscription> subscriptions = new EnumMap<>(LedgerEventKind.class);
	private volatile State state = State.STOPPED;

	public LedgerEventMonitor(
		LedgerEventSource eventSource,
		LedgerEventHandler eventHandler,
		LedgerProperties properties
	) {
		this.eventSource = eventSource;
		this.eventHandler = eventHandler;
		this.restartDelay = properties.events().restartDelay();
	}

	public synchronized void start() {
		if (state == State.LISTENING) {
			int replaced = replaceDeadSubscriptions();
			log.info("[LedgerEventMonitor] already listening subscriptions={}, replaced={}", subscriptions.size(), replaced);
			return;
		}

		try {
			for (LedgerEventKind kind : LedgerEventKind.values()) {
				subscriptions.put(kind, open(kind));
			}
		} catch (RuntimeException ex) {
			log.error("[LedgerEventMonitor] start failed, releasing partial subscriptions={}", subscriptions.size(), ex);
			cancelAll();
			throw ex;
		}

		state = State.LISTENING;
		log.info("[LedgerEventMonitor] started subscriptions={}", subscriptions.size());
	}

	public synchronized void stop() {
		if (state == State.STOPPED && subscriptions.isEmpty()) {
			return;
		}
		cancelAll();
		state = State.STOPPED;
		log.info("[LedgerEventMonitor] stopped");
	}

	@PreDestroy
	public void shutdown() {
		stop();
		resubscribeScheduler.shutdownNow();
	}

	public synchronized void restart() {
		stop();
		try {
			Thread.sleep(restartDelay.toMillis());
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			log.warn("[LedgerEventMonitor] restart delay interrupted");
		}
		start();
	}

	public State getState() {
		return state;
	}

	/**
	 * LISTENING 상태이면서 모든 종류의 구독이 살아 있을 때만 true.
	 */
	public boolean isListening() {
		return state == State.LISTENING && activeSubscriptionCount() == LedgerEventKind.values().length;
	}

	public synchronized int activeSubscriptionCount() {
		int active = 0;
		for (LedgerSubscription subscription : subscriptions.values()) {
			if (subscription.isActive()) {
				active++;
			}
		}
		return active;
	}

	public synchronized List<LedgerEventKind> subscribedKinds() {
		return new ArrayList<>(subscriptions.keySet());
	}

	void dispatch(LedgerEvent event) {
		try {
			eventHandler.handle(event);
		} catch (Exception ex) {
			log.error("[LedgerEventMonitor] handler failed kind={}, txHash={}",
				event.kind(), event.meta().transactionHash(), ex);
		}
	}

	private LedgerSubscription open(LedgerEventKind kind) {
		return eventSource.subscribe(kind, this::dispatch, error -> onStreamTerminated(kind, error));
	}

	void onStreamTerminated(LedgerEventKind kind, Throwable error) {
		log.warn("[LedgerEventMonitor] stream terminated kind={}, resubscribe in {}ms", kind, restartDelay.toMillis(), error);
		scheduleResubscribe(kind);
	}

	private void scheduleResubscribe(LedgerEventKind kind) {
		if (resubscribeScheduler.isShutdown()) {
			return;
		}
		try {
			resubscribeScheduler.schedule(() -> resubscribe(kind), restartDelay.toMillis(), TimeUnit.MILLISECONDS);
		} catch (RejectedExecutionException ex) {
			log.info("[LedgerEventMonitor] shutting down, resubscribe skipped kind={}", kind);
		}
	}

	synchronized void resubscribe(LedgerEventKind kind) {
		if (state != State.LISTENING) {
			return;
		}
		LedgerSubscription current = subscriptions.get(kind);
		if (current != null && current.isActive()) {
			return;
		}
		try {
			subscriptions.put(kind, open(kind));
			log.info("[LedgerEventMonitor] resubscribed kind={}", kind);
		} catch (RuntimeException ex) {
			log.error("[LedgerEventMonitor] resubscribe failed kind={}", kind, ex);
			scheduleResubscribe(kind);
		}
	}

	private int replaceDeadSubscriptions() {
		int replaced = 0;
		for (LedgerEventKind kind : LedgerEventKind.values()) {
			LedgerSubscription current = subscriptions.get(kind);
			if (current != null && current.isActive()) {
				continue;
			}
			subscriptions.put(kind, open(kind));
			replaced++;
		}
		return replaced;
	}

	private void cancelAll() {
		for (Map.Entry<LedgerEventKind, LedgerSubscription> entry : subscriptions.entrySet()) {
			try {
				entry.getValue().cancel();
			} catch (RuntimeException ex) {
				log.warn("[LedgerEventMonitor] cancel failed kind={}", entry.getKey(), ex);
			}
		}
		subscriptions.clear();
	}
}
