package com.di.qualitygate.util;

import com.di.qualitygate.model.Rejection;
import com.di.qualitygate.model.RejectionReason;
import com.di.qualitygate.model.SourceEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Logging of quarantined rows on a dedicated logger ({@value #LOGGER_NAME},
 * routed by logback-spring.xml). The {@code runId} MDC key set by the batch
 * orchestrator is carried on every line.
 *
 * <p>Row-level logging is sampled: at most {@code maxToLog} rows per entity,
 * payloads truncated to {@code maxPayloadChars}.
 */
public final class QuarantineLogging {

    public static final String LOGGER_NAME = "QUARANTINE";

    private static final Logger log = LoggerFactory.getLogger(LOGGER_NAME);

    private QuarantineLogging() {}

    /** Counts per reason, in reason declaration order. */
    public static Map<RejectionReason, Long> countByReason(List<Rejection> rejections) {
        Map<RejectionReason, Long> counts = new EnumMap<>(RejectionReason.class);
        for (Rejection r : rejections) {
            counts.merge(r.reason(), 1L, Long::sum);
        }
        return counts;
    }

    /** One WARN line per reason that occurred. */
    public static void logCounts(SourceEntity entity, Map<RejectionReason, Long> counts) {
        counts.forEach((reason, count) ->
                log.warn("Quarantine summary: table={} reason={} count={}", entity.stagingTable(), reason, count));
    }

    /** Logs up to {@code maxToLog} rejected rows; returns the number logged. */
    public static int logSample(List<Rejection> rejections, int maxToLog, int maxPayloadChars) {
        int logged = 0;
        for (Rejection r : rejections) {
            if (logged >= maxToLog) break;
            log.warn("Quarantined table={} row={} column={} reason={} payload={}",
                    r.raw().getEntity().stagingTable(), r.raw().getOrdinal(), r.field(), r.reason(),
                    truncate(String.valueOf(r.raw().getFields()), maxPayloadChars));
            logged++;
        }
        return logged;
    }

    static String truncate(String payload, int maxPayloadChars) {
        if (maxPayloadChars > 0 && payload.length() > maxPayloadChars) {
            return payload.substring(0, maxPayloadChars) + "...";
        }
        return payload;
    }
}
