package com.chainvote.chainvote_api.ledger.config;

import java.math.BigInteger;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ledger")
public record LedgerProperties(
	String rpcUrl,
	String contractAddress,
	String adminPrivateKey,
	Long chainId,
	BigInteger gasPrice,
	BigInteger gasLimit,
	Duration receiptPollInterval,
	Integer receiptPollAttempts,
	String electionTag,
	Events events
) {

	public LedgerProperties {
		if (rpcUrl == null || rpcUrl.isBlank()) {
			rpcUrl = "http://127.0.0.1:7545";
		}
		if (chainId == null) {
			chainId = 1337L;
		}
		if (gasPrice == null) {
			gasPrice = BigInteger.valueOf(20_000_000_000L);
		}
		if (gasLimit == null) {
			gasLimit = BigInteger.valueOf(6_721_975L);
		}
		if (receiptPollInterval == null) {
			receiptPollInterval = Duration.ofSeconds(1);
		}
		if (receiptPollAttempts == null) {
			receiptPollAttempts = 600;
		}
		if (electionTag == null || electionTag.isBlank()) {
			electionTag = "General Election 2025";
		}
		if (events == null) {
			events = new Events(true, Duration.ofSeconds(1));
		}
	}

	public boolean hasAdminKey() {
		return adminPrivateKey != null && !adminPrivateKey.isBlank();
	}

	/**
	 * @param enabled      프로세스 시작 시 구독을 자동으로 시작할지 여부
	 * @param restartDelay restart 시 stop 과 start 사이의 대기 시간
	 */
	public record Events(boolean enabled, Duration restartDelay) {

		public Events {
			if (restartDelay == null) {
				restartDelay = Duration.ofSeconds(1);
			}
		}
	}
}
