package org.hypertrace.slo.service.api.promql;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Prometheus duration notation, e.g. {@code 5m}, {@code 1h30m}, {@code 4w}. */
public final class PromDuration {
  private static final long SECOND = 1000L;
  private static final long MINUTE = 60 * SECOND;
  private static final long HOUR = 60 * MINUTE;
  private static final long DAY = 24 * HOUR;
  private static final long WEEK = 7 * DAY;
  private static final long YEAR = 365 * DAY;

  private static final Pattern DURATION =
      Pattern.compile(
          "^(?:(\\d+)y)?(?:(\\d+)w)?(?:(\\d+)d)?(?:(\\d+)h)?(?:(\\d+)m)?(?:(\\d+)s)?(?:(\\d+)ms)?$");
  private static final long[] UNITS = {YEAR, WEEK, DAY, HOUR, MINUTE, SECOND, 1};

  private PromDuration() {}

  /**
   * Years, weeks and days are only used when they divide the duration evenly, so 30 days render as
   * {@code 30d} and 28 days as {@code 4w}.
   */
  public static String format(Duration duration) {
    long ms = duration.toMillis();
    if (ms == 0) {
      return "0s";
    }
    StringBuilder builder = new StringBuilder();
    ms = append(builder, ms, "y", YEAR, true);
    ms = append(builder, ms, "w", WEEK, true);
    ms = append(builder, ms, "d", DAY, true);
    ms = append(builder, ms, "h", HOUR, false);
    ms = append(builder, ms, "m", MINUTE, false);
    ms = append(builder, ms, "s", SECOND, false);
    append(builder, ms, "ms", 1, false);
    return builder.toString();
  }

  public static Duration parse(String value) {
    Matcher matcher = DURATION.matcher(value);
    if (value.isEmpty() || !matcher.matches()) {
      throw new IllegalArgumentException("not a valid duration string: \"" + value + "\"");
    }
    long ms = 0;
    for (int group = 1; group <= UNITS.length; group++) {
      String amount = matcher.group(group);
      if (amount != null) {
        ms += Long.parseLong(amount) * UNITS[group - 1];
      }
    }
    return Duration.ofMillis(ms);
  }

  private static long append(
      StringBuilder builder, long ms, String unit, long mult, boolean exact) {
    if (exact && ms % mult != 0) {
      return ms;
    }
    long amount = ms / mult;
    if (amount > 0) {
      builder.append(amount).append(unit);
      return ms - amount * mult;
    }
    return ms;
  }
}
