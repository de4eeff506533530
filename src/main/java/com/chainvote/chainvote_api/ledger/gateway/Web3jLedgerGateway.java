package com.chainvote.chainvote_api.ledger.gateway;

import com.chainvote.chainvote_api.global.error.api.ApiException;
import com.chainvote.chainvote_api.global.error.code.CommonErrorCode;
import com.chainvote.chainvote_api.global.logging.RequestMetricsContext;
import com.chainvote.chainvote_api.global.time.LedgerTime;
import com.chainvote.chainvote_api.ledger.config.LedgerProperties;
import com.chainvote.chainvote_api.ledger.contract.ElectionContractAbi;
import com.chainvote.chainvote_api.ledger.error.LedgerErrorCode;
import com.chainvote.chainvote_api.ledger.model.Candidate;
import com.chainvote.chainvote_api.ledger.model.ElectionPhase;
import com.chainvote.chainvote_api.ledger.model.ElectionState;
import com.chainvote.chainvote_api.ledger.model.LedgerHex;
import com.chainvote.chainvote_api.ledger.model.LedgerReceipt;
import com.chainvote.chainvote_api.ledger.model.VoterStatus;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import java.io.IOException;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.WalletUtils;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameter;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthBlock;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.exceptions.TransactionException;
import org.web3j.tx.FastRawTransactionManager;
import org.web3j.tx.RawTransactionManager;
import org.web3j.tx.TransactionManager;
import org.web3j.tx.response.PollingTransactionReceiptProcessor;
import org.web3j.tx.response.TransactionReceiptProcessor;

/**
 * web3j JSON-RPC 로 선거 컨트랙트를 호출한다.
 * - 조회: 서킷브레이커만 적용한다. 장애는 LEDGER_UNAVAILABLE 로 변환된다.
 * - 쓰기: SemaphoreBulkhead 로 동시 제출 수만 제한하고, 확정까지 호출 스레드에서 기다린다.
 * - 재시도는 어디에도 없다.
 */
@Slf4j
@Service
public class Web3jLedgerGateway implements LedgerGateway {

	private static final String LEDGER_CIRCUIT_BREAKER = "ledger";
	private static final String LEDGER_BULKHEAD = "ledger";

	private final LedgerProperties properties;
	private final Web3j web3j;
	private final Bulkhead ledgerBulkhead;
	private final TransactionReceiptProcessor receiptProcessor;
	// eth_call 의 from. 관리자 키가 없으면 null 로 보낸다.
	private final String callerAddress;

	// 관리자 nonce 를 로컬에서 순차 관리해야 하므로 인스턴스를 하나만 둔다.
	private volatile TransactionManager adminTransactionManager;

	public Web3jLedgerGateway(
		LedgerProperties properties,
		Web3j web3j,
		BulkheadRegistry bulkheadRegistry
	) {
		this.properties = properties;
		this.web3j = web3j;
		this.ledgerBulkhead = bulkheadRegistry.bulkhead(LEDGER_BULKHEAD);
		this.receiptProcessor = new PollingTransactionReceiptProcessor(
			web3j,
			properties.receiptPollInterval().toMillis(),
			properties.receiptPollAttempts()
		);
		this.callerAddress = deriveCallerAddress(properties);
	}

	private static String deriveCallerAddress(LedgerProperties properties) {
		if (!properties.hasAdminKey()) {
			return null;
		}
		if (!WalletUtils.isValidPrivateKey(properties.adminPrivateKey())) {
			log.warn("[Ledger] ledger.admin-private-key is not a valid key, eth_call is sent without from");
			return null;
		}
		return Credentials.create(properties.adminPrivateKey()).getAddress();
	}

	// ---------- 조회 ----------

	@Override
	@CircuitBreaker(name = LEDGER_CIRCUIT_BREAKER, fallbackMethod = "candidatesFallback")
	public List<Candidate> getAllCandidates() {
		List<Type> values = call(ElectionContractAbi.getAllCandidates());

		List<Uint256> ids = arrayValue(values.get(0));
		List<Utf8String> names = arrayValue(values.get(1));
		List<Utf8String> parties = arrayValue(values.get(2));
		List<Uint256> voteCounts = arrayValue(values.get(3));

		if (names.size() != ids.size() || parties.size() != ids.size() || voteCounts.size() != ids.size()) {
			throw new ApiException(LedgerErrorCode.LEDGER_RESPONSE_INVALID,
				"candidate_arrays_mismatch ids=" + ids.size() + ", names=" + names.size());
		}

		List<Candidate> candidates = new ArrayList<>(ids.size());
		for (int i = 0; i < ids.size(); i++) {
			candidates.add(new Candidate(
				ids.get(i).getValue().longValueExact(),
				names.get(i).getValue(),
				parties.get(i).getValue(),
				voteCounts.get(i).getValue().longValueExact()
			));
		}
		log.debug("[Ledger] fetched candidates size={}", candidates.size());
		return candidates;
	}

	@Override
	@CircuitBreaker(name = LEDGER_CIRCUIT_BREAKER, fallbackMethod = "candidateFallback")
	public Candidate getCandidate(long candidateId) {
		List<Type> values = call(ElectionContractAbi.getCandidate(candidateId));
		return new Candidate(
			uint(values.get(0)),
			((Utf8String) values.get(1)).getValue(),
			((Utf8String) values.get(2)).getValue(),
			uint(values.get(3))
		);
	}

	@Override
	@CircuitBreaker(name = LEDGER_CIRCUIT_BREAKER, fallbackMethod = "electionStateFallback")
	public ElectionState getElectionState() {
		List<Type> values = call(ElectionContractAbi.getElectionState());
		ElectionPhase phase = ElectionPhase.fromOrdinal(((Uint8) values.get(0)).getValue().intValueExact());
		return new ElectionState(
			phase,
			((Utf8String) values.get(1)).getValue(),
			LedgerTime.fromEpochSeconds(((Uint256) values.get(2)).getValue()),
			LedgerTime.fromEpochSeconds(((Uint256) values.get(3)).getValue()),
			uint(values.get(4)),
			uint(values.get(5)),
			uint(values.get(6))
		);
	}

	@Override
	@CircuitBreaker(name = LEDGER_CIRCUIT_BREAKER, fallbackMethod = "voterFallback")
	public VoterStatus getVoter(String voterAddress) {
		List<Type> values = call(ElectionContractAbi.getVoter(voterAddress));
		long votedCandidateId = uint(values.get(2));
		return new VoterStatus(
			((Bool) values.get(0)).getValue(),
			((Bool) values.get(1)).getValue(),
			votedCandidateId == 0L ? null : votedCandidateId
		);
	}

	/**
	 * 결과 집계는 후보 목록 getter 와 같은 컨트랙트 저장소를 읽는다.
	 */
	@Override
	@CircuitBreaker(name = LEDGER_CIRCUIT_BREAKER, fallbackMethod = "candidatesFallback")
	public List<Candidate> getResults() {
		return getAllCandidates();
	}

	@Override
	@CircuitBreaker(name = LEDGER_CIRCUIT_BREAKER, fallbackMethod = "receiptFallback")
	public Optional<LedgerReceipt> getTransactionReceipt(String transactionHash) {
		return timed(() -> web3j.ethGetTransactionReceipt(transactionHash).send())
			.getTransactionReceipt()
			.map(this::toReceipt);
	}

	@Override
	@CircuitBreaker(name = LEDGER_CIRCUIT_BREAKER, fallbackMethod = "blockTimestampFallback")
	public Instant getBlockTimestamp(long blockNumber) {
		EthBlock.Block block = timed(() -> web3j.ethGetBlockByNumber(
			DefaultBlockParameter.valueOf(BigInteger.valueOf(blockNumber)), false).send()
		).getBlock();
		return block == null ? null : LedgerTime.fromEpochSeconds(block.getTimestamp());
	}

	@Override
	@CircuitBreaker(name = LEDGER_CIRCUIT_BREAKER, fallbackMethod = "blockNumberFallback")
	public long getCurrentBlockNumber() {
		return timed(() -> web3j.ethBlockNumber().send()).getBlockNumber().longValueExact();
	}

	// ---------- 쓰기 ----------

	@Override
	public LedgerReceipt addCandidate(String name, String party) {
		log.info("[Ledger] addCandidate name={}, party={}", name, party);
		return submit(adminTransactionManager(), ElectionContractAbi.addCandidate(name, party), "addCandidate");
	}

	@Override
	public LedgerReceipt registerVoter(String voterAddress) {
		log.info("[Ledger] registerVoter address={}", voterAddress);
		return submit(adminTransactionManager(), ElectionContractAbi.registerVoter(voterAddress), "registerVoter");
	}

	@Override
	public LedgerReceipt registerVotersBatch(List<String> voterAddresses) {
		log.info("[Ledger] registerVotersBatch size={}", voterAddresses.size());
		return submit(adminTransactionManager(), ElectionContractAbi.registerVotersBatch(voterAddresses),
			"registerVotersBatch");
	}

	@Override
	public LedgerReceipt startElection(String electionName) {
		log.info("[Ledger] startElection name={}", electionName);
		return submit(adminTransactionManager(), ElectionContractAbi.startElection(electionName), "startElection");
	}

	@Override
	public LedgerReceipt endElection() {
		log.info("[Ledger] endElection");
		return submit(adminTransactionManager(), ElectionContractAbi.endElection(), "endElection");
	}

	@Override
	public LedgerReceipt resetElection(String newElectionName) {
		log.info("[Ledger] resetElection newName={}", newElectionName);
		return submit(adminTransactionManager(), ElectionContractAbi.resetElection(newElectionName), "resetElection");
	}

	@Override
	public LedgerReceipt castVote(String voterPrivateKey, long candidateId) {
		Credentials voter = credentialsOf(voterPrivateKey);
		log.info("[Ledger] castVote from={}, candidateId={}", voter.getAddress(), candidateId);
		TransactionManager voterManager = new RawTransactionManager(
			web3j, voter, properties.chainId(), receiptProcessor);
		return submit(voterManager, ElectionContractAbi.castVote(candidateId), "castVote");
	}

	@Override
	public LedgerReceipt changeAdmin(String newAdminAddress) {
		log.info("[Ledger] changeAdmin newAdmin={}", newAdminAddress);
		return submit(adminTransactionManager(), ElectionContractAbi.changeAdmin(newAdminAddress), "changeAdmin");
	}

	// ---------- 유틸 ----------

	@Override
	public boolean isValidAddress(String address) {
		return address != null && WalletUtils.isValidAddress(address);
	}

	@Override
	public String resolveAddress(String privateKey) {
		return LedgerHex.normalize(credentialsOf(privateKey).getAddress());
	}

	private Credentials credentialsOf(String privateKey) {
		if (privateKey == null || !WalletUtils.isValidPrivateKey(privateKey)) {
			throw new ApiException(CommonErrorCode.VALIDATION_FAILED, "invalid_private_key");
		}
		return Credentials.create(privateKey);
	}

	private TransactionManager adminTransactionManager() {
		TransactionManager manager = adminTransactionManager;
		if (manager != null) {
			return manager;
		}
		synchronized (this) {
			if (adminTransactionManager == null) {
				if (!properties.hasAdminKey()) {
					throw new ApiException(LedgerErrorCode.LEDGER_NOT_CONFIGURED, "ledger.admin-private-key");
				}
				Credentials admin = Credentials.create(properties.adminPrivateKey());
				log.info("[Ledger] admin signer={}", admin.getAddress());
				adminTransactionManager = new FastRawTransactionManager(
					web3j, admin, properties.chainId(), receiptProcessor);
			}
			return adminTransactionManager;
		}
	}

	private List<Type> call(Function function) {
		String data = FunctionEncoder.encode(function);
		Transaction transaction = Transaction.createEthCallTransaction(
			callerAddress, properties.contractAddress(), data);

		EthCall response = timed(() -> web3j.ethCall(transaction, DefaultBlockParameterName.LATEST).send());

		if (response.isReverted()) {
			throw new ApiException(LedgerErrorCode.LEDGER_REJECTED, response.getRevertReason());
		}
		if (response.hasError()) {
			throw new ApiException(LedgerErrorCode.LEDGER_REJECTED, response.getError().getMessage());
		}

		List<Type> values = FunctionReturnDecoder.decode(response.getValue(), function.getOutputParameters());
		if (values.size() != function.getOutputParameters().size()) {
			throw new ApiException(LedgerErrorCode.LEDGER_RESPONSE_INVALID,
				function.getName() + " returned " + values.size() + " values");
		}
		return values;
	}

	private LedgerReceipt submit(TransactionManager manager, Function function, String operation) {
		String data = FunctionEncoder.encode(function);
		try {
			return executeWithLedgerBulkhead(() -> {
				EthSendTransaction sent = timed(() -> manager.sendTransaction(
					properties.gasPrice(), properties.gasLimit(), properties.contractAddress(), data, BigInteger.ZERO));

				if (sent.hasError()) {
					log.warn("[Ledger] {} rejected message={}", operation, sent.getError().getMessage());
					throw new ApiException(LedgerErrorCode.LEDGER_REJECTED, sent.getError().getMessage());
				}

				String txHash = sent.getTransactionHash();
				log.info("[Ledger] {} submitted txHash={}", operation, txHash);

				TransactionReceipt receipt = awaitReceipt(txHash);
				if (!receipt.isStatusOK()) {
					String reason = receipt.getRevertReason() != null
						? receipt.getRevertReason()
						: "transaction_reverted status=" + receipt.getStatus();
					log.warn("[Ledger] {} reverted txHash={}, reason={}", operation, txHash, reason);
					throw new ApiException(LedgerErrorCode.LEDGER_REJECTED, reason);
				}

				log.info("[Ledger] {} confirmed txHash={}, block={}, gasUsed={}",
					operation, txHash, receipt.getBlockNumber(), receipt.getGasUsed());
				return toReceipt(receipt);
			});
		} catch (BulkheadFullException ex) {
			throw translateLedgerException(ex);
		}
	}

	private TransactionReceipt awaitReceipt(String txHash) {
		long startNs = System.nanoTime();
		try {
			return receiptProcessor.waitForTransactionReceipt(txHash);
		} catch (IOException ex) {
			throw new ApiException(LedgerErrorCode.LEDGER_UNAVAILABLE, ex.getMessage());
		} catch (TransactionException ex) {
			// 확정 대기 예산 소진: 트랜잭션은 여전히 반영될 수 있으므로 해시를 함께 돌려준다.
			throw new ApiException(LedgerErrorCode.LEDGER_UNAVAILABLE, "receipt_timeout txHash=" + txHash);
		} finally {
			RequestMetricsContext.addLedgerCall(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs));
		}
	}

	private LedgerReceipt toReceipt(TransactionReceipt receipt) {
		return new LedgerReceipt(
			receipt.getTransactionHash(),
			receipt.getBlockNumber().longValueExact(),
			receipt.getGasUsed() == null ? null : receipt.getGasUsed().toString(),
			LedgerHex.normalize(receipt.getFrom())
		);
	}

	private <T> T timed(LedgerCall<T> call) {
		long startNs = System.nanoTime();
		try {
			return call.execute();
		} catch (IOException ex) {
			throw new ApiException(LedgerErrorCode.LEDGER_UNAVAILABLE, ex.getMessage());
		} finally {
			RequestMetricsContext.addLedgerCall(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs));
		}
	}

	private <T> T executeWithLedgerBulkhead(Supplier<T> supplier) {
		return ledgerBulkhead.executeSupplier(supplier);
	}

	@SuppressWarnings("unchecked")
	private static <T extends Type> List<T> arrayValue(Type value) {
		return ((DynamicArray<T>) value).getValue();
	}

	private static long uint(Type value) {
		return ((Uint256) value).getValue().longValueExact();
	}

	// ---------- fallback ----------

	private List<Candidate> candidatesFallback(Throwable throwable) {
		throw translateLedgerException(throwable);
	}

	private Candidate candidateFallback(long candidateId, Throwable throwable) {
		throw translateLedgerException(throwable);
	}

	private ElectionState electionStateFallback(Throwable throwable) {
		throw translateLedgerException(throwable);
	}

	private VoterStatus voterFallback(String voterAddress, Throwable throwable) {
		throw translateLedgerException(throwable);
	}

	private Optional<LedgerReceipt> receiptFallback(String transactionHash, Throwable throwable) {
		throw translateLedgerException(throwable);
	}

	private Instant blockTimestampFallback(long blockNumber, Throwable throwable) {
		throw translateLedgerException(throwable);
	}

	private long blockNumberFallback(Throwable throwable) {
		throw translateLedgerException(throwable);
	}

	private ApiException translateLedgerException(Throwable throwable) {
		if (throwable instanceof CallNotPermittedException) {
			return new ApiException(LedgerErrorCode.LEDGER_CIRCUIT_OPEN);
		}
		if (throwable instanceof BulkheadFullException) {
			return new ApiException(LedgerErrorCode.LEDGER_BULKHEAD_FULL);
		}
		if (throwable instanceof ApiException apiException) {
			return apiException;
		}
		return new ApiException(LedgerErrorCode.LEDGER_UNAVAILABLE, throwable.getMessage());
	}

	@FunctionalInterface
	private interface LedgerCall<T> {
		T execute() throws IOException;
	}
}
