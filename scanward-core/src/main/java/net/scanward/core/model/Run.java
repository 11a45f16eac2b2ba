package net.scanward.core.model;

import java.time.Instant;
import java.util.Locale;

/** 외부 스캔 작업. 이 엔진이 소유하지 않고 상태만 읽는다 (Janitor 만 예외적으로 timeout 기록). */
public record Run(
        String id,
        Status status,
        String trigger,
        Instant startedAt,
        Instant endedAt,
        String errorMessage
) {
    public enum Status {
        RUNNING, SUCCESS, HEALTHY, WARNING, CRITICAL, ERROR, CANCELLED, TIMEOUT, UNKNOWN;

        public static Status from(String s) {
            if (s == null) return UNKNOWN;
            try { return Status.valueOf(s.toUpperCase(Locale.ROOT)); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
        public String code() { return name().toLowerCase(Locale.ROOT); }

        /** UNKNOWN 은 종료로 보지 않는다 */
        public boolean terminal() { return this != RUNNING && this != UNKNOWN; }

        public boolean successLike() {
            return this == SUCCESS || this == HEALTHY || this == WARNING || this == CRITICAL;
        }
    }
}
