package net.scanward.bootstrap.props;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties("scanward")
public class ScanwardProperties {
    private Scheduler scheduler = new Scheduler();
    private Trigger trigger = new Trigger();
    private Catalog catalog = new Catalog();

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Trigger getTrigger() {
        return trigger;
    }

    public void setTrigger(Trigger trigger) {
        this.trigger = trigger;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public static class Scheduler {
        private boolean enabled = true;
        private long pollDelayMs = 60_000;
        private long reconcileDelayMs = 120_000;
        private long janitorDelayMs = 600_000;
        private int pollBatchSize = 25;
        private int reconcileBatchSize = 50;
        private int janitorBatchSize = 50;
        /** 소프트 락 유효 시간 */
        private Duration lockGrace = Duration.ofMinutes(5);
        /** 이보다 오래 running 인 run 은 timeout 처리 */
        private Duration runTimeout = Duration.ofMinutes(30);
        /** locked_by 에 남는 값. 비우면 hostname:pid:uuid8 */
        private String instanceId;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getPollDelayMs() {
            return pollDelayMs;
        }

        public void setPollDelayMs(long pollDelayMs) {
            this.pollDelayMs = pollDelayMs;
        }

        public long getReconcileDelayMs() {
            return reconcileDelayMs;
        }

        public void setReconcileDelayMs(long reconcileDelayMs) {
            this.reconcileDelayMs = reconcileDelayMs;
        }

        public long getJanitorDelayMs() {
            return janitorDelayMs;
        }

        public void setJanitorDelayMs(long janitorDelayMs) {
            this.janitorDelayMs = janitorDelayMs;
        }

        public int getPollBatchSize() {
            return pollBatchSize;
        }

        public void setPollBatchSize(int pollBatchSize) {
            this.pollBatchSize = pollBatchSize;
        }

        public int getReconcileBatchSize() {
            return reconcileBatchSize;
        }

        public void setReconcileBatchSize(int reconcileBatchSize) {
            this.reconcileBatchSize = reconcileBatchSize;
        }

        public int getJanitorBatchSize() {
            return janitorBatchSize;
        }

        public void setJanitorBatchSize(int janitorBatchSize) {
            this.janitorBatchSize = janitorBatchSize;
        }

        public Duration getLockGrace() {
            return lockGrace;
        }

        public void setLockGrace(Duration lockGrace) {
            this.lockGrace = lockGrace;
        }

        public Duration getRunTimeout() {
            return runTimeout;
        }

        public void setRunTimeout(Duration runTimeout) {
            this.runTimeout = runTimeout;
        }

        public String getInstanceId() {
            return instanceId;
        }

        public void setInstanceId(String instanceId) {
            this.instanceId = instanceId;
        }
    }

    public static class Trigger {
        private String baseUrl;
        private String path = "/integrity/run";
        private String authToken;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(60);

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public String getAuthToken() {
            return authToken;
        }

        public void setAuthToken(String authToken) {
            this.authToken = authToken;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }
    }

    public static class Catalog {
        private boolean enabled = true;
        private List<ScheduleDef> schedules = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<ScheduleDef> getSchedules() {
            return schedules;
        }

        public void setSchedules(List<ScheduleDef> schedules) {
            this.schedules = schedules;
        }
    }

    public static class ScheduleDef {
        private String id;
        private String groupId;
        private String name;
        private String frequency = "daily";
        /** HH:mm */
        private String timeOfDay;
        private String timezone = "UTC";
        /** 0=일요일 .. 6=토요일 */
        private List<Integer> daysOfWeek = new ArrayList<>();
        private Integer intervalMinutes;
        private List<String> timesOfDay = new ArrayList<>();
        private String mode = "incremental";
        private List<String> entities = new ArrayList<>();
        private Integer maxRuns;
        /** ISO-8601 instant */
        private String stopAt;
        private boolean enabled = true;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getGroupId() {
            return groupId;
        }

        public void setGroupId(String groupId) {
            this.groupId = groupId;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getFrequency() {
            return frequency;
        }

        public void setFrequency(String frequency) {
            this.frequency = frequency;
        }

        public String getTimeOfDay() {
            return timeOfDay;
        }

        public void setTimeOfDay(String timeOfDay) {
            this.timeOfDay = timeOfDay;
        }

        public String getTimezone() {
            return timezone;
        }

        public void setTimezone(String timezone) {
            this.timezone = timezone;
        }

        public List<Integer> getDaysOfWeek() {
            return daysOfWeek;
        }

        public void setDaysOfWeek(List<Integer> daysOfWeek) {
            this.daysOfWeek = daysOfWeek;
        }

        public Integer getIntervalMinutes() {
            return intervalMinutes;
        }

        public void setIntervalMinutes(Integer intervalMinutes) {
            this.intervalMinutes = intervalMinutes;
        }

        public List<String> getTimesOfDay() {
            return timesOfDay;
        }

        public void setTimesOfDay(List<String> timesOfDay) {
            this.timesOfDay = timesOfDay;
        }

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }

        public List<String> getEntities() {
            return entities;
        }

        public void setEntities(List<String> entities) {
            this.entities = entities;
        }

        public Integer getMaxRuns() {
            return maxRuns;
        }

        public void setMaxRuns(Integer maxRuns) {
            this.maxRuns = maxRuns;
        }

        public String getStopAt() {
            return stopAt;
        }

        public void setStopAt(String stopAt) {
            this.stopAt = stopAt;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        @Override
        public String toString() {
            return "ScheduleDef{" +
                    "id='" + id + '\'' +
                    ", name='" + name + '\'' +
                    ", frequency='" + frequency + '\'' +
                    ", timeOfDay='" + timeOfDay + '\'' +
                    ", timezone='" + timezone + '\'' +
                    ", mode='" + mode + '\'' +
                    ", enabled=" + enabled +
                    '}';
        }
    }
}
