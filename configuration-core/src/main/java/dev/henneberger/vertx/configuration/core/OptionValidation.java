package dev.henneberger.vertx.configuration.core;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

public final class OptionValidation {

  private OptionValidation() {
  }

  public static void require(String fieldName, String value, ConfigurationException.Reason reason) {
    if (value == null || value.isEmpty()) {
      throw new ConfigurationException(reason, fieldName + " is required");
    }
  }

  public static void requireAscii(String fieldName, String value) {
    if (!StandardCharsets.US_ASCII.newEncoder().canEncode(value)) {
      throw new ConfigurationException(ConfigurationException.Reason.INVALID_CHARACTERS,
        "invalid " + fieldName + " '" + value + "'. non-ascii characters are not supported");
    }
  }

  public static void requireMaxLength(String fieldName, String value, int maxLength) {
    if (value.length() > maxLength) {
      throw new ConfigurationException(ConfigurationException.Reason.TOO_LONG_IDENTIFIER,
        "field name is too long - " + fieldName + " '" + value + "'. max allowed field length is " + maxLength);
    }
  }

  public static void requireMin(String fieldName, int value, int minInclusive) {
    if (value < minInclusive) {
      throw new ConfigurationException(ConfigurationException.Reason.INVALID_OPTION,
        fieldName + " must be >= " + minInclusive);
    }
  }

  public static void requirePositive(String fieldName, Duration value, ConfigurationException.Reason reason) {
    if (value == null || value.isZero() || value.isNegative()) {
      throw new ConfigurationException(reason, fieldName + " must be a positive duration");
    }
  }
}
