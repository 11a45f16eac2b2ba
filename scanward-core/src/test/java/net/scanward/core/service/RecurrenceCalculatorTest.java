package net.scanward.core.service;

import net.scanward.core.model.Frequency;
import net.scanward.core.model.Recurrence;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class RecurrenceCalculatorTest {

    private static final ZoneId UTC = ZoneId.of("UTC");
    private static final ZoneId DENVER = ZoneId.of("America/Denver");

    private final RecurrenceCalculator calc = new RecurrenceCalculator();

    private static Instant at(String iso) { return Instant.parse(iso); }

    @Test
    void daily_later_today_when_time_not_yet_passed() {
        var r = Recurrence.daily(LocalTime.of(14, 0), DENVER);
        // 13:00 MDT
        assertThat(calc.computeNextRunAt(r, at("2024-03-20T19:00:00Z"), null))
                .isEqualTo(at("2024-03-20T20:00:00Z"));
    }

    @Test
    void daily_tomorrow_when_time_passed() {
        var r = Recurrence.daily(LocalTime.of(14, 0), DENVER);
        // 15:00 MDT
        assertThat(calc.computeNextRunAt(r, at("2024-03-20T21:00:00Z"), null))
                .isEqualTo(at("2024-03-21T20:00:00Z"));
    }

    @Test
    void daily_exactly_at_fire_time_moves_to_next_day() {
        var r = Recurrence.daily(LocalTime.of(9, 0), UTC);
        assertThat(calc.computeNextRunAt(r, at("2024-03-20T09:00:00Z"), null))
                .isEqualTo(at("2024-03-21T09:00:00Z"));
    }

    @Test
    void weekly_picks_next_listed_day() {
        var r = Recurrence.weekly(LocalTime.of(9, 0), UTC, Set.of(1, 3, 5));   // 월 수 금
        // 2024-03-19 화요일
        assertThat(calc.computeNextRunAt(r, at("2024-03-19T10:00:00Z"), null))
                .isEqualTo(at("2024-03-20T09:00:00Z"));
        // 월요일 09:00 전이면 당일
        assertThat(calc.computeNextRunAt(r, at("2024-03-18T08:00:00Z"), null))
                .isEqualTo(at("2024-03-18T09:00:00Z"));
    }

    @Test
    void weekly_wraps_to_next_week() {
        var r = Recurrence.weekly(LocalTime.of(9, 0), UTC, Set.of(1, 3, 5));
        // 금요일 발화 이후 → 다음 월요일
        assertThat(calc.computeNextRunAt(r, at("2024-03-22T10:00:00Z"), null))
                .isEqualTo(at("2024-03-25T09:00:00Z"));
    }

    @Test
    void weekly_single_day_after_that_day_passed_goes_seven_days_out() {
        var r = Recurrence.weekly(LocalTime.of(9, 0), UTC, Set.of(0));   // 일요일
        // 2024-03-24 일요일 10:00
        assertThat(calc.computeNextRunAt(r, at("2024-03-24T10:00:00Z"), null))
                .isEqualTo(at("2024-03-31T09:00:00Z"));
    }

    @Test
    void hourly_first_run_steps_from_anchor() {
        var r = Recurrence.hourly(LocalTime.MIDNIGHT, UTC, 60);
        assertThat(calc.computeNextRunAt(r, at("2024-03-20T10:15:00Z"), null))
                .isEqualTo(at("2024-03-20T11:00:00Z"));
    }

    @Test
    void hourly_anchor_later_today_is_first_run() {
        var r = Recurrence.hourly(LocalTime.of(23, 0), UTC, 90);
        assertThat(calc.computeNextRunAt(r, at("2024-03-20T10:15:00Z"), null))
                .isEqualTo(at("2024-03-20T23:00:00Z"));
    }

    @Test
    void hourly_chained_hundred_times_has_no_drift() {
        var r = Recurrence.hourly(LocalTime.of(0, 20), UTC, 45);
        Instant now = at("2024-03-20T10:00:00Z");
        Instant first = calc.computeNextRunAt(r, now, null);
        assertThat(first).isEqualTo(at("2024-03-20T10:05:00Z"));

        Instant prev = first;
        for (int i = 1; i <= 100; i++) {
            // 매 틱마다 now 가 약간씩 늦게 와도 앵커 위상은 그대로
            Instant tickNow = prev.plusSeconds(7);
            prev = calc.computeNextRunAt(r, tickNow, prev);
            assertThat(prev).isEqualTo(first.plus(Duration.ofMinutes(45L * i)));
        }
    }

    @Test
    void hourly_catch_up_skips_missed_slots_and_keeps_phase() {
        var r = Recurrence.hourly(LocalTime.MIDNIGHT, UTC, 60);
        // 02:00 발화가 8시간 넘게 밀림
        Instant next = calc.computeNextRunAt(r, at("2024-03-20T10:15:00Z"), at("2024-03-20T02:00:00Z"));
        assertThat(next).isEqualTo(at("2024-03-20T11:00:00Z"));
    }

    @Test
    void custom_times_pick_earliest_remaining_then_wrap() {
        var r = Recurrence.customTimes(UTC, List.of(LocalTime.of(18, 0), LocalTime.of(6, 30)));
        assertThat(calc.computeNextRunAt(r, at("2024-03-20T07:00:00Z"), null))
                .isEqualTo(at("2024-03-20T18:00:00Z"));
        assertThat(calc.computeNextRunAt(r, at("2024-03-20T19:00:00Z"), null))
                .isEqualTo(at("2024-03-21T06:30:00Z"));
        assertThat(calc.computeNextRunAt(r, at("2024-03-20T05:00:00Z"), null))
                .isEqualTo(at("2024-03-20T06:30:00Z"));
    }

    @Test
    void spring_forward_gap_shifts_to_first_valid_instant_then_resumes() {
        var r = Recurrence.daily(LocalTime.of(2, 30), DENVER);
        // 2024-03-10 01:00 MST, 02:30 은 존재하지 않음 → 03:30 MDT
        Instant first = calc.computeNextRunAt(r, at("2024-03-10T08:00:00Z"), null);
        assertThat(first).isEqualTo(at("2024-03-10T09:30:00Z"));

        Instant second = calc.computeNextRunAt(r, at("2024-03-10T08:00:00Z"), first);
        assertThat(second).isEqualTo(at("2024-03-11T08:30:00Z"));
        assertThat(second.atZone(DENVER).toLocalTime()).isEqualTo(LocalTime.of(2, 30));
    }

    @Test
    void fall_back_keeps_wall_clock_time() {
        var r = Recurrence.daily(LocalTime.of(14, 0), DENVER);
        // 2024-11-02 15:00 MDT → 11-03 14:00 MST
        Instant next = calc.computeNextRunAt(r, at("2024-11-02T21:00:00Z"), null);
        assertThat(next).isEqualTo(at("2024-11-03T21:00:00Z"));
        assertThat(next.atZone(DENVER).toLocalTime()).isEqualTo(LocalTime.of(14, 0));
    }

    @Test
    void ambiguous_fall_back_time_uses_earlier_offset() {
        var r = Recurrence.daily(LocalTime.of(1, 30), DENVER);
        // 2024-11-03 00:00 MDT
        assertThat(calc.computeNextRunAt(r, at("2024-11-03T06:00:00Z"), null))
                .isEqualTo(at("2024-11-03T07:30:00Z"));
    }

    @Test
    void degenerate_parameters_fall_back_to_daily() {
        Instant now = at("2024-03-20T10:00:00Z");
        Instant dailyAt9 = at("2024-03-21T09:00:00Z");

        var weeklyNoDays = Recurrence.weekly(LocalTime.of(9, 0), UTC, Set.of());
        var weeklyBadDays = Recurrence.weekly(LocalTime.of(9, 0), UTC, Set.of(7, 9));
        var hourlyZero = Recurrence.hourly(LocalTime.of(9, 0), UTC, 0);
        var customEmpty = new Recurrence(Frequency.CUSTOM_TIMES, LocalTime.of(9, 0), UTC, null, null, List.of());

        assertThat(calc.computeNextRunAt(weeklyNoDays, now, null)).isEqualTo(dailyAt9);
        assertThat(calc.computeNextRunAt(weeklyBadDays, now, null)).isEqualTo(dailyAt9);
        assertThat(calc.computeNextRunAt(hourlyZero, now, null)).isEqualTo(dailyAt9);
        assertThat(calc.computeNextRunAt(customEmpty, now, null)).isEqualTo(dailyAt9);
    }

    @Test
    void missing_time_of_day_means_midnight() {
        var r = new Recurrence(Frequency.DAILY, null, UTC, null, null, null);
        assertThat(calc.computeNextRunAt(r, at("2024-03-20T10:00:00Z"), null))
                .isEqualTo(at("2024-03-21T00:00:00Z"));
    }

    @Test
    void result_is_always_after_now_and_previous() {
        List<Recurrence> all = List.of(
                Recurrence.daily(LocalTime.of(2, 30), DENVER),
                Recurrence.weekly(LocalTime.of(23, 59), ZoneId.of("Asia/Seoul"), Set.of(0, 6)),
                Recurrence.hourly(LocalTime.of(1, 15), ZoneId.of("Europe/Berlin"), 37),
                Recurrence.customTimes(ZoneId.of("Australia/Sydney"), List.of(LocalTime.of(0, 0), LocalTime.of(12, 0))));

        Instant start = at("2024-03-01T00:00:00Z");
        for (Recurrence r : all) {
            for (int h = 0; h < 24 * 60; h += 7) {
                Instant now = start.plus(Duration.ofHours(h));
                Instant prev = calc.computeNextRunAt(r, now, null);
                assertThat(prev).isAfter(now);
                Instant next = calc.computeNextRunAt(r, now, prev);
                assertThat(next).isAfter(prev);
            }
        }
    }

    @Test
    void upcoming_chains_through_own_output() {
        var r = Recurrence.weekly(LocalTime.of(9, 0), UTC, Set.of(1, 3, 5));
        List<Instant> runs = calc.upcoming(r, at("2024-03-19T10:00:00Z"), null, 4);
        assertThat(runs).containsExactly(
                at("2024-03-20T09:00:00Z"),
                at("2024-03-22T09:00:00Z"),
                at("2024-03-25T09:00:00Z"),
                at("2024-03-27T09:00:00Z"));
    }
}
