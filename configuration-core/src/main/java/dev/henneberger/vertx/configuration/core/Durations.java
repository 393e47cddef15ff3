package dev.henneberger.vertx.configuration.core;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Parses duration properties. Accepts unit strings such as {@code 500ms}, {@code 1m30s} or
 * {@code 1.5h} (units ns, us, µs, ms, s, m, h) as well as ISO-8601 values like {@code PT30S}.
 */
public final class Durations {

  private static final Map<String, Long> UNIT_NANOS = Map.of(
    "ns", 1L,
    "us", 1_000L,
    "µs", 1_000L,
    "μs", 1_000L,
    "ms", 1_000_000L,
    "s", 1_000_000_000L,
    "m", 60_000_000_000L,
    "h", 3_600_000_000_000L
  );

  private Durations() {
  }

  public static Duration parse(String text) {
    Objects.requireNonNull(text, "text");
    String value = text.trim();
    if (value.isEmpty()) {
      throw new IllegalArgumentException("empty duration");
    }
    String upper = value.toUpperCase(Locale.ROOT);
    if (upper.startsWith("P") || upper.startsWith("-P") || upper.startsWith("+P")) {
      try {
        return Duration.parse(value);
      } catch (DateTimeParseException e) {
        throw new IllegalArgumentException("invalid duration '" + text + "'", e);
      }
    }
    return parseUnits(value, text);
  }

  private static Duration parseUnits(String value, String original) {
    int pos = 0;
    boolean negative = false;
    char first = value.charAt(0);
    if (first == '-' || first == '+') {
      negative = first == '-';
      pos++;
    }
    if ("0".equals(value.substring(pos))) {
      return Duration.ZERO;
    }
    if (pos == value.length()) {
      throw new IllegalArgumentException("invalid duration '" + original + "'");
    }

    BigDecimal totalNanos = BigDecimal.ZERO;
    while (pos < value.length()) {
      int numberStart = pos;
      while (pos < value.length() && (Character.isDigit(value.charAt(pos)) || value.charAt(pos) == '.')) {
        pos++;
      }
      String number = value.substring(numberStart, pos);
      if (number.isEmpty() || ".".equals(number)) {
        throw new IllegalArgumentException("invalid duration '" + original + "'");
      }

      int unitStart = pos;
      while (pos < value.length() && !Character.isDigit(value.charAt(pos)) && value.charAt(pos) != '.') {
        pos++;
      }
      Long unit = UNIT_NANOS.get(value.substring(unitStart, pos));
      if (unit == null) {
        throw new IllegalArgumentException("missing or unknown unit in duration '" + original + "'");
      }

      try {
        totalNanos = totalNanos.add(new BigDecimal(number).multiply(BigDecimal.valueOf(unit)));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("invalid duration '" + original + "'", e);
      }
    }

    if (totalNanos.compareTo(BigDecimal.valueOf(Long.MAX_VALUE)) > 0) {
      throw new IllegalArgumentException("duration '" + original + "' is out of range");
    }
    long nanos = totalNanos.longValue();
    return negative ? Duration.ofNanos(-nanos) : Duration.ofNanos(nanos);
  }
}
