package net.scanward.core.service;

import net.scanward.core.model.Schedule;
import net.scanward.core.spi.Clock;
import net.scanward.core.spi.ScheduleRepository;
import net.scanward.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** due 스케줄 폴러. 한 틱에 최대 batchSize 건만 처리하고 나머지는 다음 틱으로 넘긴다. */
public final class ScheduleTickService {
    private static final Logger log = LoggerFactory.getLogger(ScheduleTickService.class);

    private final ScheduleRepository schedules;
    private final ScheduleDispatchService dispatcher;
    private final TxRunner tx;
    private final Clock clock;

    public ScheduleTickService(ScheduleRepository schedules,
                               ScheduleDispatchService dispatcher,
                               TxRunner tx, Clock clock) {
        this.schedules = schedules;
        this.dispatcher = dispatcher;
        this.tx = tx;
        this.clock = clock;
    }

    /**
     * 조회 자체가 실패하면 예외로 틱 전체를 중단한다 (다음 틱이 처음부터 다시 본다).
     * 개별 후보의 실패는 기록만 하고 계속 진행.
     */
    public TickReport tickOnce(int batchSize) throws Exception {
        Instant now = clock.now();
        List<Schedule> due = tx.required(() -> schedules.findDue(now, batchSize));

        TickReport r = new TickReport(now, due.size(), due.size() >= batchSize);
        for (Schedule s : due) {
            try {
                r.add(dispatcher.claimAndDispatch(s.id()));
            } catch (Exception e) {
                r.failed++;
                log.warn("claim failed for schedule {}: {}", s.id(), e.getMessage(), e);
            }
        }
        if (r.candidates > 0) log.info("{}", r);
        return r;
    }

    public static final class TickReport {
        public final Instant timestamp;
        public final int candidates;
        /** 배치 상한에 걸림 → 남은 due 는 다음 틱 */
        public final boolean saturated;
        public final Map<ScheduleDispatchService.Outcome, Integer> outcomes =
                new EnumMap<>(ScheduleDispatchService.Outcome.class);
        public int failed;

        TickReport(Instant timestamp, int candidates, boolean saturated) {
            this.timestamp = timestamp;
            this.candidates = candidates;
            this.saturated = saturated;
        }

        void add(ScheduleDispatchService.Outcome o) { outcomes.merge(o, 1, Integer::sum); }

        public int count(ScheduleDispatchService.Outcome o) { return outcomes.getOrDefault(o, 0); }

        @Override public String toString() {
            return "TickReport{" +
                    "timestamp=" + timestamp +
                    ", candidates=" + candidates +
                    ", saturated=" + saturated +
                    ", outcomes=" + outcomes +
                    ", failed=" + failed +
                    '}';
        }
    }
}
