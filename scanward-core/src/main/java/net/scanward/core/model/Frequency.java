package net.scanward.core.model;

public enum Frequency {
    DAILY("daily"), WEEKLY("weekly"), HOURLY("hourly"), CUSTOM_TIMES("custom_times");

    private final String code;

    Frequency(String code) { this.code = code; }

    public String code() { return code; }

    /** 알 수 없는 값은 DAILY로 본다 (time_of_day 기반 기본 동작) */
    public static Frequency from(String s) {
        if (s == null) return DAILY;
        for (Frequency f : values()) {
            if (f.code.equalsIgnoreCase(s) || f.name().equalsIgnoreCase(s)) return f;
        }
        return DAILY;
    }
}
