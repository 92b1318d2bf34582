package com.kmg.gateway.repo;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

public final class SqlTime {
    private SqlTime() {
    }

    public static OffsetDateTime now() {
        return OffsetDateTime.now(ZoneOffset.UTC);
    }

    public static String nowText() {
        return now().toString();
    }

    public static String text(OffsetDateTime value) {
        return value == null ? null : value.withOffsetSameInstant(ZoneOffset.UTC).toString();
    }

    public static OffsetDateTime parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return OffsetDateTime.parse(value);
    }
}
