package com.chainvote.chainvote_api.ledger.event;

import com.chainvote.chainvote_api.ledger.contract.ElectionContractAbi;
import org.web3j.abi.datatypes.Event;

public enum LedgerEventKind {
	VOTER_REGISTERED(ElectionContractAbi.VOTER_REGISTERED),
	VOTE_CAST(ElectionContractAbi.VOTE_CAST),
	ELECTION_STARTED(ElectionContractAbi.ELECTION_STARTED),
	ELECTION_ENDED(ElectionContractAbi.ELECTION_ENDED),
	CANDIDATE_ADDED(ElectionContractAbi.CANDIDATE_ADDED),
	ADMIN_CHANGED(ElectionContractAbi.ADMIN_CHANGED);

	private final Event abi;

	LedgerEventKind(Event abi) {
		this.abi = abi;
	}

	public Event abi() {
		return abi;
	}
}
