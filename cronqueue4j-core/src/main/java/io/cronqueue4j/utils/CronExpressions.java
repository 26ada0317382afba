package io.cronqueue4j.utils;

import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.TimeZone;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes cron specs into Quartz {@link CronExpression} syntax.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>5-field unix cron: "*&#47;5 * * * *" (seconds field "0" is prepended)</li>
 *   <li>6-field cron with seconds: "* * * * * *"</li>
 *   <li>Native Quartz expressions (containing '?', or with a year field)</li>
 * </ul>
 * <p>
 * Unix day-of-week numbers (0-7, Sunday = 0 or 7) are translated to Quartz numbering (1-7, Sunday = 1).
 */
public final class CronExpressions {
    private static final Pattern LEADING_NUMBER = Pattern.compile("^(\\d+)(.*)$");

    private CronExpressions() {
    }

    /**
     * Normalize cron expressions:
     * - Accepts 6-field cron (seconds first).
     * - Accepts 5-field cron by prepending seconds "0".
     * - Leaves Quartz-native expressions untouched.
     */
    public static String normalizeCron(String spec) {
        if (spec == null) {
            throw new IllegalArgumentException("spec must not be null");
        }
        String s = spec.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("spec must not be empty");
        }

        String[] parts = s.split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], parts[4]);
        }
        if (parts.length == 6 && !parts[3].contains("?") && !parts[5].contains("?")) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        return String.join(" ", parts);
    }

    private static String toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month, String dayOfWeek) {
        String dom = dayOfMonth;
        String dow = translateDayOfWeek(dayOfWeek);

        // Quartz requires exactly one of the two day fields to be '?'
        if ("*".equals(dow)) {
            dow = "?";
        } else if ("*".equals(dom)) {
            dom = "?";
        } else {
            throw new IllegalArgumentException(
                    "Cron expressions restricting both day-of-month and day-of-week are not supported: "
                            + String.join(" ", sec, min, hour, dayOfMonth, month, dayOfWeek));
        }

        return String.join(" ", sec, min, hour, dom, month, dow);
    }

    static String translateDayOfWeek(String dow) {
        if ("*".equals(dow)) {
            return dow;
        }
        List<String> items = new ArrayList<>();
        for (String item : dow.split(",")) {
            String base = item;
            String step = "";
            int slash = item.indexOf('/');
            if (slash >= 0) {
                base = item.substring(0, slash);
                step = item.substring(slash);
            }

            int dash = base.indexOf('-');
            if (dash > 0) {
                String from = translateDay(base.substring(0, dash));
                String rawTo = base.substring(dash + 1);
                // "5-7" / "5-0": Sunday closes the range, Quartz needs it split off
                if (step.isEmpty() && ("7".equals(rawTo) || "0".equals(rawTo))) {
                    items.add(from + "-7");
                    items.add("1");
                } else {
                    items.add(from + "-" + translateDay(rawTo) + step);
                }
            } else {
                items.add(translateDay(base) + step);
            }
        }
        return String.join(",", items);
    }

    private static String translateDay(String token) {
        Matcher m = LEADING_NUMBER.matcher(token);
        if (!m.matches()) {
            return token;
        }
        int n = Integer.parseInt(m.group(1));
        if (n > 7) {
            return token;
        }
        return (n % 7 + 1) + m.group(2);
    }

    /**
     * Returns true if the string can be parsed as a Quartz {@link CronExpression} after normalization.
     */
    public static boolean looksLikeCron(String spec) {
        try {
            return CronExpression.isValidExpression(normalizeCron(spec));
        } catch (Exception ignored) {
            return false;
        }
    }

    /**
     * Parse a spec into a Quartz expression evaluated in {@code zone}.
     *
     * @throws IllegalArgumentException when the spec is not a valid cron expression
     */
    public static CronExpression parse(String spec, ZoneId zone) {
        String cron = normalizeCron(spec);
        CronExpression exp;
        try {
            exp = new CronExpression(cron);
        } catch (ParseException ex) {
            throw new IllegalArgumentException("Invalid cron expression: " + spec, ex);
        }
        exp.setTimeZone(TimeZone.getTimeZone(zone));
        return exp;
    }
}
