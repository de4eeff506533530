package com.chainvote.chainvote_api.vote.service;

import com.chainvote.chainvote_api.vote.entity.Vote;
import com.chainvote.chainvote_api.vote.repository.VoteRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Component
@RequiredArgsConstructor
public class VoteRecordWriter {

    private final VoteRepository voteRepository;

    // 유니크 위반이 호출자 트랜잭션을 rollback-only 로 만들지 않도록 별도 트랜잭션에서 flush 까지 끝낸다.
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Vote insert(Vote vote) {
        return voteRepository.saveAndFlush(vote);
    }
}
