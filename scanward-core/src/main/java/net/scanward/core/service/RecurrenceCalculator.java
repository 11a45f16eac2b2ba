package net.scanward.core.service;

import net.scanward.core.model.Frequency;
import net.scanward.core.model.Recurrence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * 다음 발화 시각 계산기. I/O 없음.
 * 벽시계 연산은 전부 스케줄의 타임존에서 하고 마지막에 Instant 로 바꾼다 (DST 흡수).
 */
public final class RecurrenceCalculator {
    private static final Logger log = LoggerFactory.getLogger(RecurrenceCalculator.class);

    private static final int MAX_DAY_SCAN = 8;   // 오늘 + 7일 (주간 wrap 포함)

    /**
     * @param previousNextRunAt 직전 next_run_at. 첫 계산이면 null.
     *                          now 보다 미래면 기준 시각으로 쓰인다 (미리보기 체인).
     */
    public Instant computeNextRunAt(Recurrence r, Instant now, Instant previousNextRunAt) {
        Instant ref = previousNextRunAt != null && previousNextRunAt.isAfter(now) ? previousNextRunAt : now;
        ZoneId zone = r.zone();
        LocalTime at = r.timeOfDay() != null ? r.timeOfDay() : LocalTime.MIDNIGHT;
        if (r.timeOfDay() == null && r.frequency() != Frequency.CUSTOM_TIMES) {
            log.warn("time_of_day missing for {} recurrence; using 00:00", r.frequency().code());
        }

        switch (r.frequency()) {
            case HOURLY: {
                Integer interval = r.intervalMinutes();
                if (interval == null || interval <= 0) {
                    log.warn("hourly recurrence without positive interval_minutes ({}); falling back to daily at {}",
                            interval, at);
                    return scan(zone, ref, d -> true, List.of(at));
                }
                return nextHourly(at, zone, Duration.ofMinutes(interval), now, previousNextRunAt);
            }
            case WEEKLY: {
                Set<Integer> days = r.daysOfWeek().stream()
                        .filter(d -> d >= 0 && d <= 6)
                        .collect(Collectors.toSet());
                if (days.isEmpty()) {
                    log.warn("weekly recurrence without valid days_of_week {}; falling back to daily at {}",
                            r.daysOfWeek(), at);
                    return scan(zone, ref, d -> true, List.of(at));
                }
                return scan(zone, ref, d -> days.contains(d.getDayOfWeek().getValue() % 7), List.of(at));
            }
            case CUSTOM_TIMES: {
                if (r.timesOfDay().isEmpty()) {
                    log.warn("custom_times recurrence without times_of_day; falling back to daily at {}", at);
                    return scan(zone, ref, d -> true, List.of(at));
                }
                return scan(zone, ref, d -> true, new ArrayList<>(new TreeSet<>(r.timesOfDay())));
            }
            case DAILY:
            default:
                return scan(zone, ref, d -> true, List.of(at));
        }
    }

    /** 체인 계산: seed 를 시작으로 자기 출력을 다시 넣어 count 개 */
    public List<Instant> upcoming(Recurrence r, Instant now, Instant seed, int count) {
        List<Instant> out = new ArrayList<>(count);
        Instant prev = seed;
        for (int i = 0; i < count; i++) {
            prev = computeNextRunAt(r, now, prev);
            out.add(prev);
        }
        return out;
    }

    // 앵커 기반. 직전 값이 있으면 interval 만 더한다 (now 기준으로 다시 잡으면 드리프트가 쌓인다).
    private static Instant nextHourly(LocalTime anchor, ZoneId zone, Duration step, Instant now, Instant prev) {
        Instant base;
        if (prev != null) {
            Instant next = prev.plus(step);
            if (next.isAfter(now)) return next;
            base = prev;   // 오래 밀린 경우: 위상은 유지하고 과거 슬롯은 건너뛴다
        } else {
            base = now.atZone(zone).toLocalDate().atTime(anchor).atZone(zone).toInstant();
            if (base.isAfter(now)) return base;
        }
        long steps = Duration.between(base, now).toMillis() / step.toMillis() + 1;
        return base.plus(step.multipliedBy(steps));
    }

    // ref 의 현지 날짜부터 하루씩 보며 ref 보다 엄격히 뒤인 첫 (날짜, 시각) 조합
    private static Instant scan(ZoneId zone, Instant ref, Predicate<LocalDate> dayFilter, List<LocalTime> sortedTimes) {
        LocalDate start = ref.atZone(zone).toLocalDate();
        for (int i = 0; i < MAX_DAY_SCAN; i++) {
            LocalDate d = start.plusDays(i);
            if (!dayFilter.test(d)) continue;
            for (LocalTime t : sortedTimes) {
                Instant candidate = d.atTime(t).atZone(zone).toInstant();
                if (candidate.isAfter(ref)) return candidate;
            }
        }
        throw new IllegalStateException("no occurrence within " + MAX_DAY_SCAN + " days after " + ref);
    }
}
