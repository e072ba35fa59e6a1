package io.pactkit.core.generators;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders dates and times relative to now.
 *
 * <p>Expressions are a base ({@code now}, {@code today}, {@code tomorrow}, {@code yesterday})
 * followed by offsets such as {@code + 1 day} or {@code -2 hours}. An empty expression means now.
 */
public final class DateExpressions {

    /** What a format renders. */
    public enum Kind {
        DATE("yyyy-MM-dd"),
        TIME("HH:mm:ss"),
        DATE_TIME("yyyy-MM-dd'T'HH:mm:ss.SSSXXX");

        private final String defaultFormat;

        Kind(String defaultFormat) {
            this.defaultFormat = defaultFormat;
        }

        public String defaultFormat() {
            return defaultFormat;
        }
    }

    private static final Pattern OFFSET =
            Pattern.compile("([+-])\\s*(\\d+)\\s*(second|minute|hour|day|week|month|year|millisecond)s?");

    private DateExpressions() {}

    /**
     * Renders now, shifted by {@code expression}, with {@code format}.
     *
     * @param kind       default format to use when {@code format} is null
     * @param format     a {@link DateTimeFormatter} pattern, or {@code null}
     * @param expression offset expression, or {@code null}
     * @throws IllegalArgumentException if the format or expression is invalid
     */
    public static String render(Kind kind, String format, String expression) {
        return render(kind, format, expression, ZonedDateTime.now());
    }

    static String render(Kind kind, String format, String expression, ZonedDateTime now) {
        ZonedDateTime when = evaluate(expression, now);
        String pattern = format != null ? format : kind.defaultFormat();
        return DateTimeFormatter.ofPattern(pattern, Locale.ROOT).format(when);
    }

    static ZonedDateTime evaluate(String expression, ZonedDateTime now) {
        if (expression == null || expression.isBlank()) {
            return now;
        }
        String expr = expression.trim().toLowerCase(Locale.ROOT);
        ZonedDateTime base = now;
        if (expr.startsWith("now")) {
            expr = expr.substring(3);
        } else if (expr.startsWith("today")) {
            expr = expr.substring(5);
        } else if (expr.startsWith("tomorrow")) {
            base = now.plusDays(1);
            expr = expr.substring(8);
        } else if (expr.startsWith("yesterday")) {
            base = now.minusDays(1);
            expr = expr.substring(9);
        }
        expr = expr.trim();
        Matcher m = OFFSET.matcher(expr);
        int consumed = 0;
        while (m.find()) {
            if (!expr.substring(consumed, m.start()).isBlank()) {
                break;
            }
            long amount = Long.parseLong(m.group(2)) * ("-".equals(m.group(1)) ? -1 : 1);
            base = base.plus(amount, unit(m.group(3)));
            consumed = m.end();
        }
        if (!expr.substring(consumed).isBlank()) {
            throw new IllegalArgumentException("Invalid date expression: '" + expression + "'");
        }
        return base;
    }

    private static ChronoUnit unit(String name) {
        return switch (name) {
            case "millisecond" -> ChronoUnit.MILLIS;
            case "second" -> ChronoUnit.SECONDS;
            case "minute" -> ChronoUnit.MINUTES;
            case "hour" -> ChronoUnit.HOURS;
            case "day" -> ChronoUnit.DAYS;
            case "week" -> ChronoUnit.WEEKS;
            case "month" -> ChronoUnit.MONTHS;
            default -> ChronoUnit.YEARS;
        };
    }
}
