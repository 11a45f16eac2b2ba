package net.scanward.bootstrap.catalog;

import net.scanward.bootstrap.props.ScanwardProperties;
import net.scanward.core.model.Frequency;
import net.scanward.core.model.Recurrence;
import net.scanward.core.model.RunConfig;
import net.scanward.core.model.Schedule;
import net.scanward.core.service.ScheduleAdminService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;

/** 설정에 선언된 스케줄을 기동 시 등록. 잘못된 정의는 기동 실패로 드러낸다. */
public class ScheduleCatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(ScheduleCatalogRegistrar.class);

    private final ScheduleAdminService admin;

    public ScheduleCatalogRegistrar(ScheduleAdminService admin) {
        this.admin = admin;
    }

    public void register(ScanwardProperties.Catalog catalog) throws Exception {
        // 전부 검증한 다음 등록 (일부만 반영된 상태로 죽지 않게)
        List<Schedule> parsed = catalog.getSchedules().stream().map(ScheduleCatalogRegistrar::toSchedule).toList();
        for (Schedule s : parsed) {
            admin.register(s);
        }
        log.info("Catalog registered: {} schedule(s)", parsed.size());
    }

    public static Schedule toSchedule(ScanwardProperties.ScheduleDef def) {
        if (def.getId() == null || def.getId().isBlank()) {
            throw new IllegalArgumentException("schedule.id is required: " + def);
        }
        Frequency frequency = parseFrequency(def);
        ZoneId zone;
        try {
            zone = ZoneId.of(def.getTimezone() == null ? "UTC" : def.getTimezone());
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("schedule " + def.getId() + ": unknown timezone " + def.getTimezone(), e);
        }
        LocalTime at = def.getTimeOfDay() == null ? null : parseTime(def.getId(), def.getTimeOfDay());
        List<LocalTime> times = def.getTimesOfDay() == null ? List.of()
                : def.getTimesOfDay().stream().map(t -> parseTime(def.getId(), t)).toList();
        if (at == null && frequency == Frequency.CUSTOM_TIMES && !times.isEmpty()) {
            at = times.get(0);
        }

        var recurrence = new Recurrence(frequency, at, zone,
                def.getDaysOfWeek() == null ? null : new LinkedHashSet<>(def.getDaysOfWeek()),
                def.getIntervalMinutes(), times);
        var problems = recurrence.problems();
        if (!problems.isEmpty()) {
            throw new IllegalArgumentException("schedule " + def.getId() + ": " + problems);
        }

        Instant stopAt = null;
        if (def.getStopAt() != null && !def.getStopAt().isBlank()) {
            try {
                stopAt = Instant.parse(def.getStopAt());
            } catch (DateTimeException e) {
                throw new IllegalArgumentException("schedule " + def.getId() + ": invalid stop-at " + def.getStopAt(), e);
            }
        }
        if (def.getMaxRuns() != null && def.getMaxRuns() <= 0) {
            throw new IllegalArgumentException("schedule " + def.getId() + ": max-runs must be positive");
        }

        String name = def.getName() == null ? def.getId() : def.getName();
        return new Schedule(def.getId(), def.getGroupId(), name, recurrence,
                new RunConfig(def.getMode(), def.getEntities()), def.isEnabled(),
                null, null, null, 0L, def.getMaxRuns(), stopAt, null, null, null);
    }

    private static Frequency parseFrequency(ScanwardProperties.ScheduleDef def) {
        String f = def.getFrequency() == null ? Frequency.DAILY.code() : def.getFrequency();
        return Arrays.stream(Frequency.values())
                .filter(v -> v.code().equalsIgnoreCase(f) || v.name().equalsIgnoreCase(f))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "schedule " + def.getId() + ": unknown frequency " + f));
    }

    private static LocalTime parseTime(String id, String hhmm) {
        try {
            return LocalTime.parse(hhmm);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("schedule " + id + ": invalid time " + hhmm + " (expected HH:mm)", e);
        }
    }
}
