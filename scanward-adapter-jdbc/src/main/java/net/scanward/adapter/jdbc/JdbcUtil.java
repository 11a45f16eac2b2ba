package net.scanward.adapter.jdbc;

import java.nio.charset.StandardCharsets;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

public final class JdbcUtil {
    private JdbcUtil() {}

    /** VARCHAR2(4000) 은 BYTE 단위 (AL32UTF8) */
    public static final int MAX_VARCHAR_BYTES = 4000;

    /** TIMESTAMP 컬럼은 UTC 벽시계로 저장. JVM 기본 타임존을 거치지 않는다. */
    public static LocalDateTime utc(Instant i) { return i == null ? null : LocalDateTime.ofInstant(i, ZoneOffset.UTC); }

    public static void setInstant(PreparedStatement ps, int idx, Instant i) throws SQLException {
        if (i == null) ps.setNull(idx, Types.TIMESTAMP); else ps.setObject(idx, utc(i));
    }

    public static Instant getInstant(ResultSet rs, String column) throws SQLException {
        LocalDateTime v = rs.getObject(column, LocalDateTime.class);
        return v == null ? null : v.toInstant(ZoneOffset.UTC);
    }

    public static String yn(boolean b) { return b ? "Y" : "N"; }

    public static void setNullableInt(PreparedStatement ps, int idx, Integer v) throws SQLException {
        if (v == null) ps.setNull(idx, Types.INTEGER); else ps.setInt(idx, v);
    }

    /** 리스트 컬럼은 콤마 구분 문자열로 저장. 빈 리스트는 NULL (오라클은 ''==NULL). */
    public static String csv(Collection<?> values) {
        if (values == null || values.isEmpty()) return null;
        return values.stream().map(String::valueOf).collect(Collectors.joining(","));
    }

    public static List<String> splitCsv(String s) {
        if (s == null || s.isBlank()) return List.of();
        return Arrays.stream(s.split(","))
                .map(String::trim)
                .filter(v -> !v.isEmpty())
                .toList();
    }

    /** UTF-8 로 MAX_VARCHAR_BYTES 를 넘지 않게 자른다. 서로게이트 쌍은 쪼개지 않는다. */
    public static String clip(String s) {
        if (s == null || s.length() * 3 <= MAX_VARCHAR_BYTES) return s;
        if (s.getBytes(StandardCharsets.UTF_8).length <= MAX_VARCHAR_BYTES) return s;
        int bytes = 0;
        int end = 0;
        while (end < s.length()) {
            int cp = s.codePointAt(end);
            int len = cp < 0x80 ? 1 : cp < 0x800 ? 2 : cp < 0x10000 ? 3 : 4;
            if (bytes + len > MAX_VARCHAR_BYTES) break;
            bytes += len;
            end += Character.charCount(cp);
        }
        return s.substring(0, end);
    }
}
