package com.chainvote.chainvote_api.global.logging;

/**
 * 요청 스레드 단위로 SQL 실행과 원장(JSON-RPC) 호출 횟수/시간을 누적한다.
 * 이벤트 모니터 스레드처럼 start() 가 호출되지 않은 스레드에서는 아무것도 기록하지 않는다.
 */
public final class RequestMetricsContext {

	private static final ThreadLocal<MetricsAccumulator> HOLDER = new ThreadLocal<>();

	private RequestMetricsContext() {
	}

	public static void start() {
		HOLDER.set(new MetricsAccumulator());
	}

	public static void addQueryMetrics(int queryCount, long elapsedMs) {
		MetricsAccumulator accumulator = HOLDER.get();
		if (accumulator == null) {
			return;
		}
		accumulator.queryCount += Math.max(queryCount, 0);
		accumulator.queryTimeMs += Math.max(elapsedMs, 0L);
	}

	public static void addLedgerCall(long elapsedMs) {
		MetricsAccumulator accumulator = HOLDER.get();
		if (accumulator == null) {
			return;
		}
		accumulator.ledgerCallCount++;
		accumulator.ledgerTimeMs += Math.max(elapsedMs, 0L);
	}

	public static Metrics snapshot() {
		MetricsAccumulator accumulator = HOLDER.get();
		if (accumulator == null) {
			return new Metrics(0, 0L, 0, 0L);
		}
		return new Metrics(
			accumulator.queryCount,
			accumulator.queryTimeMs,
			accumulator.ledgerCallCount,
			accumulator.ledgerTimeMs
		);
	}

	public static void clear() {
		HOLDER.remove();
	}

	public record Metrics(
		int queryCount,
		long queryTimeMs,
		int ledgerCallCount,
		long ledgerTimeMs
	) {
	}

	private static final class MetricsAccumulator {
		private int queryCount;
		private long queryTimeMs;
		private int ledgerCallCount;
		private long ledgerTimeMs;
	}
}
