package com.chainvote.chainvote_api.ledger.gateway;

import com.chainvote.chainvote_api.ledger.model.Candidate;
import com.chainvote.chainvote_api.ledger.model.ElectionState;
import com.chainvote.chainvote_api.ledger.model.LedgerReceipt;
import com.chainvote.chainvote_api.ledger.model.VoterStatus;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 선거 컨트랙트와의 유일한 접점.
 * <p>
 * 조회는 네트워크 장애({@code LEDGER_UNAVAILABLE}) 외에는 실패하지 않는다.
 * 쓰기는 트랜잭션을 제출하고 블록 확정까지 동기로 기다린 뒤 영수증을 반환하며,
 * 컨트랙트 규칙 위반은 revert 메시지를 그대로 담은 {@code LEDGER_REJECTED} 로 던진다.
 * 재시도는 하지 않는다. 재시도 정책은 호출자 몫이다.
 */
public interface LedgerGateway {

	List<Candidate> getAllCandidates();

	Candidate getCandidate(long candidateId);

	ElectionState getElectionState();

	VoterStatus getVoter(String voterAddress);

	List<Candidate> getResults();

	Optional<LedgerReceipt> getTransactionReceipt(String transactionHash);

	Instant getBlockTimestamp(long blockNumber);

	long getCurrentBlockNumber();

	LedgerReceipt addCandidate(String name, String party);

	LedgerReceipt registerVoter(String voterAddress);

	LedgerReceipt registerVotersBatch(List<String> voterAddresses);

	LedgerReceipt startElection(String electionName);

	LedgerReceipt endElection();

	LedgerReceipt resetElection(String newElectionName);

	/**
	 * 관리자 키가 아닌 투표자 본인의 키로 서명한다.
	 */
	LedgerReceipt castVote(String voterPrivateKey, long candidateId);

	LedgerReceipt changeAdmin(String newAdminAddress);

	boolean isValidAddress(String address);

	/**
	 * 개인키에서 서명 주소(소문자)를 계산한다. 키 형식이 잘못되면 {@code VALIDATION_FAILED}.
	 */
	String resolveAddress(String privateKey);
}
