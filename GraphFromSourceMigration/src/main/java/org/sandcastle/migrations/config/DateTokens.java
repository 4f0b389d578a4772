package org.sandcastle.migrations.config;

import java.time.Clock;
import java.time.LocalDate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Placeholder values such as an opportunity's close date cannot be fixed in a config file.
 * {@code @today} becomes the current ISO date and {@code @today+30d} (or {@code -30d}) shifts it.
 * Any other value is returned unchanged.
 */
public class DateTokens {
    private static final Pattern TOKEN = Pattern.compile("@today(?:([+-])(\\d+)d)?");

    private final Clock clock;

    public DateTokens(Clock clock) {
        this.clock = clock;
    }

    public Object resolve(Object value) {
        if (!(value instanceof String)) {
            return value;
        }
        Matcher matcher = TOKEN.matcher(((String) value).trim());
        if (!matcher.matches()) {
            return value;
        }
        LocalDate today = LocalDate.now(clock);
        if (matcher.group(1) == null) {
            return today.toString();
        }
        long days = Long.parseLong(matcher.group(2));
        return ("-".equals(matcher.group(1)) ? today.minusDays(days) : today.plusDays(days)).toString();
    }
}
