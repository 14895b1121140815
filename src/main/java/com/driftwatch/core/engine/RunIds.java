package com.driftwatch.core.engine;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Generates run ids in the format {@code DRIFT-yyyyMMdd-HHmmss-n}.
 */
public final class RunIds {

    private static final DateTimeFormatter RUN_ID_TIME = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    private RunIds() {}

    public static String next() {
        int count = RUN_COUNTER.incrementAndGet();
        return "DRIFT-" + LocalDateTime.now().format(RUN_ID_TIME) + "-" + count;
    }
}
