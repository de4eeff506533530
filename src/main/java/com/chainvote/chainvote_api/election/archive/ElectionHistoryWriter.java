package com.chainvote.chainvote_api.election.archive;

import com.chainvote.chainvote_api.election.entity.ElectionHistory;
import com.chainvote.chainvote_api.election.repository.ElectionHistoryRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Component
@RequiredArgsConstructor
public class ElectionHistoryWriter {

    private final ElectionHistoryRepository electionHistoryRepository;

    // 아카이브 락을 풀기 전에 커밋까지 끝나야 다음 호출이 이 스냅샷을 본다.
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ElectionHistory insert(ElectionHistory history) {
        return electionHistoryRepository.saveAndFlush(history);
    }
}
