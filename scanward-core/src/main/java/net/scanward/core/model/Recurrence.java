package net.scanward.core.model;

import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 반복 규칙. frequency 값에 따라 유효한 필드가 하나씩 정해진다.
 * - WEEKLY       → daysOfWeek (0=일요일 .. 6=토요일)
 * - HOURLY       → intervalMinutes (timeOfDay는 앵커)
 * - CUSTOM_TIMES → timesOfDay
 */
public record Recurrence(
        Frequency frequency,
        LocalTime timeOfDay,
        ZoneId zone,
        Set<Integer> daysOfWeek,
        Integer intervalMinutes,
        List<LocalTime> timesOfDay
) {
    public Recurrence {
        if (frequency == null) frequency = Frequency.DAILY;
        if (zone == null) zone = ZoneId.of("UTC");
        daysOfWeek = daysOfWeek == null ? Set.of() : Set.copyOf(daysOfWeek);
        timesOfDay = timesOfDay == null ? List.of() : List.copyOf(timesOfDay);
    }

    public static Recurrence daily(LocalTime at, ZoneId zone) {
        return new Recurrence(Frequency.DAILY, at, zone, null, null, null);
    }

    public static Recurrence weekly(LocalTime at, ZoneId zone, Set<Integer> days) {
        return new Recurrence(Frequency.WEEKLY, at, zone, days, null, null);
    }

    public static Recurrence hourly(LocalTime anchor, ZoneId zone, int intervalMinutes) {
        return new Recurrence(Frequency.HOURLY, anchor, zone, null, intervalMinutes, null);
    }

    public static Recurrence customTimes(ZoneId zone, List<LocalTime> times) {
        LocalTime first = times == null || times.isEmpty() ? null : times.get(0);
        return new Recurrence(Frequency.CUSTOM_TIMES, first, zone, null, null, times);
    }

    /** 설정 오류 목록. 비어 있으면 유효. */
    public List<String> problems() {
        List<String> out = new ArrayList<>();
        switch (frequency) {
            case WEEKLY -> {
                if (daysOfWeek.isEmpty()) out.add("weekly schedule requires days_of_week");
                for (Integer d : daysOfWeek) {
                    if (d == null || d < 0 || d > 6) out.add("days_of_week entry out of range 0-6: " + d);
                }
                if (timeOfDay == null) out.add("weekly schedule requires time_of_day");
            }
            case HOURLY -> {
                if (intervalMinutes == null || intervalMinutes <= 0) out.add("hourly schedule requires a positive interval_minutes");
                if (timeOfDay == null) out.add("hourly schedule requires time_of_day as anchor");
            }
            case CUSTOM_TIMES -> {
                if (timesOfDay.isEmpty()) out.add("custom_times schedule requires times_of_day");
            }
            case DAILY -> {
                if (timeOfDay == null) out.add("daily schedule requires time_of_day");
            }
        }
        return out;
    }
}
