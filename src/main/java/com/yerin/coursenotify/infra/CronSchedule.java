package com.yerin.coursenotify.infra;

import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/** UNIX(5필드) cron 기반 다음 실행 시각 계산기 */
public final class CronSchedule {
    private static final CronParser PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    private static final Map<String, ExecutionTime> CACHE = new ConcurrentHashMap<>();

    private CronSchedule() {}

    /**
     * @throws IllegalArgumentException if the expression is not a valid UNIX cron
     */
    public static void validate(String cronExpr) {
        executionTime(cronExpr);
    }

    public static Instant next(String cronExpr, ZoneId zone, Instant from) {
        Objects.requireNonNull(zone); Objects.requireNonNull(from);

        var base = from.atZone(zone);
        return executionTime(cronExpr).nextExecution(base)
                .orElseThrow(() -> new IllegalStateException("No next execution for [" + cronExpr + "] at " + base))
                .toInstant();
    }

    private static ExecutionTime executionTime(String cronExpr) {
        Objects.requireNonNull(cronExpr);
        return CACHE.computeIfAbsent(cronExpr, expr -> ExecutionTime.forCron(PARSER.parse(expr).validate()));
    }
}
