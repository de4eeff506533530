package com.chainvote.chainvote_api.ledger.event;

import com.chainvote.chainvote_api.global.error.api.ApiException;
import com.chainvote.chainvote_api.ledger.config.LedgerProperties;
import com.chainvote.chainvote_api.ledger.error.LedgerErrorCode;
import io.reactivex.Flowable;
import java.io.IOException;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.web3j.abi.EventEncoder;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.TypeEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.methods.request.EthFilter;
import org.web3j.protocol.core.methods.response.Log;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

// 노드 없이 로그 디코딩만 검증한다. 로그는 컨트랙트가 발행하는 형태 그대로 직접 인코딩해서 만든다.
class Web3jLedgerEventSourceTest {

	private static final String VOTER = "0x90F8bf6A479f320ead074411a4B0e7944Ea8c9C1";
	private static final String TX_HASH = "0xabc0000000000000000000000000000000000000000000000000000000000001";

	@Test
	void decodesVoteCastWithLowercaseAddress() {
		// given: VoteCast(address indexed voter, uint256 indexed candidateId, string candidateName)
		Log logEntry = log(
			List.of(
				EventEncoder.encode(LedgerEventKind.VOTE_CAST.abi()),
				topic(new Address(VOTER)),
				topic(new Uint256(BigInteger.valueOf(2)))
			),
			data(new Utf8String("Bob"))
		);

		// when
		LedgerEvent event = Web3jLedgerEventSource.decode(LedgerEventKind.VOTE_CAST, logEntry);

		// then
		assertThat(event).isInstanceOf(LedgerEvent.VoteCast.class);
		LedgerEvent.VoteCast voteCast = (LedgerEvent.VoteCast) event;
		assertThat(voteCast.voterAddress()).isEqualTo(VOTER.toLowerCase());
		assertThat(voteCast.candidateId()).isEqualTo(2L);
		assertThat(voteCast.candidateName()).isEqualTo("Bob");
		assertThat(voteCast.meta().transactionHash()).isEqualTo(TX_HASH);
		assertThat(voteCast.meta().blockNumber()).isEqualTo(42L);
	}

	@Test
	void decodesVoterRegistered() {
		Log logEntry = log(
			List.of(EventEncoder.encode(LedgerEventKind.VOTER_REGISTERED.abi()), topic(new Address(VOTER))),
			"0x"
		);

		LedgerEvent event = Web3jLedgerEventSource.decode(LedgerEventKind.VOTER_REGISTERED, logEntry);

		assertThat(event.kind()).isEqualTo(LedgerEventKind.VOTER_REGISTERED);
		assertThat(((LedgerEvent.VoterRegistered) event).voterAddress()).isEqualTo(VOTER.toLowerCase());
	}

	@Test
	void decodesElectionEndedName() {
		Log logEntry = log(
			List.of(EventEncoder.encode(LedgerEventKind.ELECTION_ENDED.abi())),
			data(new Utf8String("General Election 2025"))
		);

		LedgerEvent event = Web3jLedgerEventSource.decode(LedgerEventKind.ELECTION_ENDED, logEntry);

		assertThat(((LedgerEvent.ElectionEnded) event).electionName()).isEqualTo("General Election 2025");
	}

	@Test
	void streamErrorIsReportedAndSubscriptionIsNoLongerActive() {
		// given: 필터 폴링 중 노드 호출이 실패한다
		Web3j web3j = mock(Web3j.class);
		IOException nodeDown = new IOException("node unreachable");
		when(web3j.ethLogFlowable(any(EthFilter.class))).thenReturn(Flowable.error(nodeDown));
		LedgerProperties properties = new LedgerProperties(
			null, "0x5fbdb2315678afecb367f032d93f642f64180aa3", null, null, null, null, null, null, null, null
		);
		Web3jLedgerEventSource source = new Web3jLedgerEventSource(web3j, properties);
		AtomicReference<Throwable> terminated = new AtomicReference<>();

		// when
		LedgerSubscription subscription = source.subscribe(LedgerEventKind.VOTE_CAST, event -> { }, terminated::set);

		// then
		assertThat(terminated.get()).isSameAs(nodeDown);
		assertThat(subscription.isActive()).isFalse();
	}

	@Test
	void topicOfAnotherEventIsRejected() {
		// VoterRegistered 로그를 VoteCast 로 해석하려 하면 시그니처가 달라 실패해야 한다.
		Log logEntry = log(
			List.of(EventEncoder.encode(LedgerEventKind.VOTER_REGISTERED.abi()), topic(new Address(VOTER))),
			"0x"
		);

		assertThatThrownBy(() -> Web3jLedgerEventSource.decode(LedgerEventKind.VOTE_CAST, logEntry))
			.isInstanceOf(ApiException.class)
			.satisfies(ex -> assertThat(((ApiException) ex).getErrorCode()).isEqualTo(LedgerErrorCode.LEDGER_RESPONSE_INVALID));
	}

	private static Log log(List<String> topics, String data) {
		Log logEntry = new Log();
		logEntry.setTopics(topics);
		logEntry.setData(data);
		logEntry.setTransactionHash(TX_HASH);
		logEntry.setBlockNumber("0x2a");
		return logEntry;
	}

	private static String topic(Type<?> value) {
		return "0x" + TypeEncoder.encode(value);
	}

	@SuppressWarnings("rawtypes")
	private static String data(Type... values) {
		return "0x" + FunctionEncoder.encodeConstructor(Arrays.<Type>asList(values));
	}
}
