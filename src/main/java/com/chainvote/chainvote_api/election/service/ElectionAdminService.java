package com.chainvote.chainvote_api.election.service;

import com.chainvote.chainvote_api.election.dto.request.AddCandidateRequest;
import com.chainvote.chainvote_api.election.dto.request.RegisterVotersBatchRequest;
import com.chainvote.chainvote_api.election.dto.response.BatchRegistrationResponse;
import com.chainvote.chainvote_api.election.dto.response.EndElectionResponse;
import com.chainvote.chainvote_api.election.dto.response.ResetElectionResponse;
import com.chainvote.chainvote_api.ledger.model.LedgerReceipt;

public interface ElectionAdminService {

	LedgerReceipt addCandidate(AddCandidateRequest request);

	LedgerReceipt registerVoter(Long userId);

	BatchRegistrationResponse registerVotersBatch(RegisterVotersBatchRequest request);

	LedgerReceipt startElection(String electionName);

	EndElectionResponse endElection();

	/**
	 * 아카이브를 먼저 시도하고, 실패해도 경고만 남긴 채 초기화를 진행한다.
	 */
	ResetElectionResponse resetElection(String newElectionName);

	LedgerReceipt changeAdmin(String newAdminAddress);
}
