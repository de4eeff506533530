package com.chainvote.chainvote_api.ledger.event;

import com.chainvote.chainvote_api.global.error.api.ApiException;
import com.chainvote.chainvote_api.ledger.config.LedgerProperties;
import com.chainvote.chainvote_api.ledger.error.LedgerErrorCode;
import com.chainvote.chainvote_api.ledger.model.LedgerHex;
import io.reactivex.disposables.Disposable;
import java.math.BigInteger;
import java.util.List;
import java.util.function.Consumer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.abi.EventEncoder;
import org.web3j.abi.EventValues;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.EthFilter;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.tx.Contract;

@Slf4j
@Component
@RequiredArgsConstructor
public class Web3jLedgerEventSource implements LedgerEventSource {

	private final Web3j web3j;
	private final LedgerProperties properties;

	@Override
	public LedgerSubscription subscribe(
		LedgerEventKind kind,
		Consumer<LedgerEvent> consumer,
		Consumer<Throwable> onTerminated
	) {
		EthFilter filter = new EthFilter(
			DefaultBlockParameterName.LATEST,
			DefaultBlockParameterName.LATEST,
			properties.contractAddress()
		);
		filter.addSingleTopic(EventEncoder.encode(kind.abi()));

		Disposable disposable = web3j.ethLogFlowable(filter).subscribe(
			logEntry -> deliver(kind, logEntry, consumer),
			error -> {
				log.error("[LedgerEventSource] stream terminated kind={}", kind, error);
				onTerminated.accept(error);
			}
		);
		return new DisposableSubscription(disposable);
	}

	private void deliver(LedgerEventKind kind, Log logEntry, Consumer<LedgerEvent> consumer) {
		LedgerEvent event;
		try {
			event = decode(kind, logEntry);
		} catch (RuntimeException ex) {
			// 디코딩 실패가 Flowable 을 종료시키지 않도록 이 로그만 버린다.
			log.error("[LedgerEventSource] decode failed kind={}, txHash={}",
				kind, logEntry.getTransactionHash(), ex);
			return;
		}
		consumer.accept(event);
	}

	static LedgerEvent decode(LedgerEventKind kind, Log logEntry) {
		EventValues values = Contract.staticExtractEventParameters(kind.abi(), logEntry);
		if (values == null) {
			throw new ApiException(LedgerErrorCode.LEDGER_RESPONSE_INVALID, "topic_mismatch kind=" + kind);
		}
		List<Type> indexed = values.getIndexedValues();
		List<Type> data = values.getNonIndexedValues();
		LedgerEvent.Meta meta = new LedgerEvent.Meta(
			logEntry.getTransactionHash(),
			logEntry.getBlockNumber() == null ? null : logEntry.getBlockNumber().longValueExact()
		);

		return switch (kind) {
			case VOTER_REGISTERED -> new LedgerEvent.VoterRegistered(meta, address(indexed.get(0)));
			case VOTE_CAST -> new LedgerEvent.VoteCast(
				meta, address(indexed.get(0)), uint(indexed.get(1)), text(data.get(0)));
			case ELECTION_STARTED -> new LedgerEvent.ElectionStarted(meta, text(data.get(0)));
			case ELECTION_ENDED -> new LedgerEvent.ElectionEnded(meta, text(data.get(0)));
			case CANDIDATE_ADDED -> new LedgerEvent.CandidateAdded(
				meta, uint(indexed.get(0)), text(data.get(0)), text(data.get(1)));
			case ADMIN_CHANGED -> new LedgerEvent.AdminChanged(
				meta, address(indexed.get(0)), address(indexed.get(1)));
		};
	}

	private static String address(Type value) {
		return LedgerHex.normalize(((Address) value).getValue());
	}

	private static long uint(Type value) {
		BigInteger number = ((Uint256) value).getValue();
		return number.longValueExact();
	}

	private static String text(Type value) {
		return ((Utf8String) value).getValue();
	}

	private record DisposableSubscription(Disposable disposable) implements LedgerSubscription {

		@Override
		public void cancel() {
			disposable.dispose();
		}

		@Override
		public boolean isActive() {
			return !disposable.isDisposed();
		}
	}
}
