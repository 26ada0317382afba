package io.cronqueue4j.cron;

import io.cronqueue4j.utils.CronExpressions;
import org.quartz.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Date;
import java.util.Objects;

/**
 * {@link CronExpressionEngine} backed by Quartz {@link CronExpression}.
 */
public class QuartzCronExpressionEngine implements CronExpressionEngine {

    private final ZoneId zone;

    public QuartzCronExpressionEngine() {
        this(ZoneId.systemDefault());
    }

    public QuartzCronExpressionEngine(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Instant next(String expression, Instant after, Instant bound) {
        Objects.requireNonNull(after, "after must not be null");

        CronExpression exp = CronExpressions.parse(expression, zone);
        Date nextDate = exp.getNextValidTimeAfter(Date.from(after));
        if (nextDate == null) {
            throw new IllegalArgumentException("Cron expression produced no next execution time: " + expression);
        }

        Instant next = nextDate.toInstant();
        if (bound != null && !next.isBefore(bound)) {
            throw new IllegalArgumentException(
                    "Cron expression has no execution time before " + bound + ": " + expression);
        }
        return next;
    }
}
