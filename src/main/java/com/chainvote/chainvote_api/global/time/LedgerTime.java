package com.chainvote.chainvote_api.global.time;

import java.math.BigInteger;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

public final class LedgerTime {

    private LedgerTime() {}

    // 컨트랙트는 미설정 시각을 0 으로 돌려준다.
    public static Instant fromEpochSeconds(BigInteger epochSeconds) {
        if (epochSeconds == null || epochSeconds.signum() <= 0) return null;
        return Instant.ofEpochSecond(epochSeconds.longValueExact());
    }

    public static Instant truncateToHour(Instant instant) {
        if (instant == null) return null;
        return instant.truncatedTo(ChronoUnit.HOURS);
    }
}
