package com.di.datapipe.util;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Fresh, time-suffixed identifiers for warehouse jobs. Two attempts never share an id, even when
 * they start in the same millisecond.
 */
public final class JobIds {

    private static final DateTimeFormatter SUFFIX =
            DateTimeFormatter.ofPattern("yyyyMMddHHmmssSSS").withZone(ZoneOffset.UTC);

    private JobIds() {}

    /** {@code <kind>_<name>_<yyyyMMddHHmmssSSS>_<8 hex>}; BigQuery job ids allow [A-Za-z0-9_-]. */
    public static String next(String kind, String name, Clock clock) {
        String random = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return kind + "_" + name + "_" + SUFFIX.format(clock.instant()) + "_" + random;
    }
}
