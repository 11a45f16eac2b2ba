package net.scanward.core.model;

import java.time.Duration;
import java.time.Instant;

/** 시간 창 기반의 소프트 락. 진짜 뮤텍스가 아니라 grace 가 지나면 스스로 만료된다. */
public record ScheduleLock(Instant lockedAt, String lockedBy) {

    public boolean isFresh(Instant now, Duration grace) {
        return lockedAt != null && lockedAt.plus(grace).isAfter(now);
    }
}
