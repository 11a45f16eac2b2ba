package net.scanward.core.spi;

import net.scanward.core.model.RunConfig;

/** 원격 스캔 작업 시작. 완료를 기다리지 않고 run id 만 돌려받는다. 멱등하지 않다. */
public interface RunTrigger {
    String trigger(RunRequest request) throws RunTriggerException;

    record RunRequest(String scheduleId, String executionId, RunConfig runConfig) {}
}
