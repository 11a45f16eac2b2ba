package net.scanward.core.model;

import java.util.List;

/** 외부 스캔 트리거에 그대로 전달되는 실행 설정 */
public record RunConfig(String mode, List<String> entities) {
    public static final String DEFAULT_MODE = "incremental";

    public RunConfig {
        if (mode == null || mode.isBlank()) mode = DEFAULT_MODE;
        entities = entities == null ? List.of() : List.copyOf(entities);
    }

    public static RunConfig defaults() { return new RunConfig(DEFAULT_MODE, List.of()); }
}
