package com.chainvote.chainvote_api.election.archive;

import com.chainvote.chainvote_api.ledger.model.Candidate;
import java.util.List;

/**
 * 원장에서 방금 읽은 득표수로만 계산한다. 결과를 캐시하거나 저장된 값으로 다시 계산하지 않는다.
 */
public final class ElectionTally {

	private ElectionTally() {
	}

	public static WinnerResult computeWinner(List<Candidate> candidates) {
		long max = 0L;
		for (Candidate candidate : candidates) {
			max = Math.max(max, candidate.voteCount());
		}
		if (max == 0L) {
			return WinnerResult.none();
		}

		long top = max;
		List<Candidate> leaders = candidates.stream()
			.filter(candidate -> candidate.voteCount() == top)
			.toList();
		return new WinnerResult(leaders.size() > 1, leaders, max);
	}

	public static int voterTurnout(long totalVotes, long registeredVoterCount) {
		if (registeredVoterCount <= 0) {
			return 0;
		}
		return (int) Math.round(totalVotes * 100.0 / registeredVoterCount);
	}

	// 소수 둘째 자리까지
	public static double percentage(long voteCount, long totalVotes) {
		if (totalVotes <= 0) {
			return 0.0;
		}
		return Math.round(voteCount * 10000.0 / totalVotes) / 100.0;
	}
}
