package com.chainvote.chainvote_api.ledger.event;

/**
 * 컨트랙트가 발행한 이벤트 하나. 주소는 모두 소문자로 정규화된 상태다.
 */
public interface LedgerEvent {

	LedgerEventKind kind();

	Meta meta();

	/**
	 * @param blockNumber pending 로그처럼 블록 정보가 없으면 null
	 */
	record Meta(String transactionHash, Long blockNumber) {
	}

	record VoterRegistered(Meta meta, String voterAddress) implements LedgerEvent {
		@Override
		public LedgerEventKind kind() {
			return LedgerEventKind.VOTER_REGISTERED;
		}
	}

	record VoteCast(Meta meta, String voterAddress, long candidateId, String candidateName) implements LedgerEvent {
		@Override
		public LedgerEventKind kind() {
			return LedgerEventKind.VOTE_CAST;
		}
	}

	record ElectionStarted(Meta meta, String electionName) implements LedgerEvent {
		@Override
		public LedgerEventKind kind() {
			return LedgerEventKind.ELECTION_STARTED;
		}
	}

	record ElectionEnded(Meta meta, String electionName) implements LedgerEvent {
		@Override
		public LedgerEventKind kind() {
			return LedgerEventKind.ELECTION_ENDED;
		}
	}

	record CandidateAdded(Meta meta, long candidateId, String name, String party) implements LedgerEvent {
		@Override
		public LedgerEventKind kind() {
			return LedgerEventKind.CANDIDATE_ADDED;
		}
	}

	record AdminChanged(Meta meta, String previousAdmin, String newAdmin) implements LedgerEvent {
		@Override
		public LedgerEventKind kind() {
			return LedgerEventKind.ADMIN_CHANGED;
		}
	}
}
