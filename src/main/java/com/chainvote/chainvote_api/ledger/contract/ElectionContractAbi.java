package com.chainvote.chainvote_api.ledger.contract;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint8;

/**
 * 선거 컨트랙트의 함수/이벤트 ABI 정의.
 * 컨트랙트 wrapper 를 생성하지 않고 필요한 시그니처만 직접 선언한다.
 */
public final class ElectionContractAbi {

	public static final Event VOTER_REGISTERED = new Event("VoterRegistered",
		Arrays.<TypeReference<?>>asList(new TypeReference<Address>(true) {}));

	public static final Event VOTE_CAST = new Event("VoteCast",
		Arrays.<TypeReference<?>>asList(
			new TypeReference<Address>(true) {},
			new TypeReference<Uint256>(true) {},
			new TypeReference<Utf8String>() {}));

	public static final Event ELECTION_STARTED = new Event("ElectionStarted",
		Arrays.<TypeReference<?>>asList(new TypeReference<Utf8String>() {}));

	public static final Event ELECTION_ENDED = new Event("ElectionEnded",
		Arrays.<TypeReference<?>>asList(new TypeReference<Utf8String>() {}));

	public static final Event CANDIDATE_ADDED = new Event("CandidateAdded",
		Arrays.<TypeReference<?>>asList(
			new TypeReference<Uint256>(true) {},
			new TypeReference<Utf8String>() {},
			new TypeReference<Utf8String>() {}));

	public static final Event ADMIN_CHANGED = new Event("AdminChanged",
		Arrays.<TypeReference<?>>asList(
			new TypeReference<Address>(true) {},
			new TypeReference<Address>(true) {}));

	private ElectionContractAbi() {
	}

	// ---------- view ----------

	public static Function getAllCandidates() {
		return new Function("getAllCandidates",
			Collections.<Type>emptyList(),
			Arrays.<TypeReference<?>>asList(
				new TypeReference<DynamicArray<Uint256>>() {},
				new TypeReference<DynamicArray<Utf8String>>() {},
				new TypeReference<DynamicArray<Utf8String>>() {},
				new TypeReference<DynamicArray<Uint256>>() {}));
	}

	public static Function getCandidate(long candidateId) {
		return new Function("getCandidate",
			Arrays.<Type>asList(new Uint256(BigInteger.valueOf(candidateId))),
			Arrays.<TypeReference<?>>asList(
				new TypeReference<Uint256>() {},
				new TypeReference<Utf8String>() {},
				new TypeReference<Utf8String>() {},
				new TypeReference<Uint256>() {}));
	}

	/**
	 * 반환 순서: state, name, startTime, endTime, totalVotes, candidateCount, registeredVoterCount
	 */
	public static Function getElectionState() {
		return new Function("getElectionState",
			Collections.<Type>emptyList(),
			Arrays.<TypeReference<?>>asList(
				new TypeReference<Uint8>() {},
				new TypeReference<Utf8String>() {},
				new TypeReference<Uint256>() {},
				new TypeReference<Uint256>() {},
				new TypeReference<Uint256>() {},
				new TypeReference<Uint256>() {},
				new TypeReference<Uint256>() {}));
	}

	public static Function getVoter(String voterAddress) {
		return new Function("getVoter",
			Arrays.<Type>asList(new Address(voterAddress)),
			Arrays.<TypeReference<?>>asList(
				new TypeReference<Bool>() {},
				new TypeReference<Bool>() {},
				new TypeReference<Uint256>() {}));
	}

	// ---------- transaction ----------

	public static Function addCandidate(String name, String party) {
		return transaction("addCandidate", new Utf8String(name), new Utf8String(party));
	}

	public static Function registerVoter(String voterAddress) {
		return transaction("registerVoter", new Address(voterAddress));
	}

	public static Function registerVotersBatch(List<String> voterAddresses) {
		List<Address> addresses = voterAddresses.stream().map(Address::new).toList();
		return transaction("registerVotersBatch", new DynamicArray<>(Address.class, addresses));
	}

	public static Function startElection(String electionName) {
		return transaction("startElection", new Utf8String(electionName));
	}

	public static Function endElection() {
		return transaction("endElection");
	}

	public static Function resetElection(String newElectionName) {
		return transaction("resetElection", new Utf8String(newElectionName));
	}

	public static Function castVote(long candidateId) {
		return transaction("castVote", new Uint256(BigInteger.valueOf(candidateId)));
	}

	public static Function changeAdmin(String newAdminAddress) {
		return transaction("changeAdmin", new Address(newAdminAddress));
	}

	@SuppressWarnings("rawtypes")
	private static Function transaction(String name, Type... inputs) {
		return new Function(name, Arrays.<Type>asList(inputs), Collections.<TypeReference<?>>emptyList());
	}
}
