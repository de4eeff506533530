package com.chainvote.chainvote_api.election.archive;

import com.chainvote.chainvote_api.ledger.model.Candidate;
import java.util.List;

/**
 * @param candidates 단독 당선이면 1명, 동률이면 동률 후보 전원, 득표가 없으면 빈 목록
 */
public record WinnerResult(boolean isDraw, List<Candidate> candidates, long voteCount) {

	public static WinnerResult none() {
		return new WinnerResult(false, List.of(), 0L);
	}
}
