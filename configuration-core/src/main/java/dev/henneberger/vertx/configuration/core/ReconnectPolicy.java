package dev.henneberger.vertx.configuration.core;

import io.vertx.core.json.JsonObject;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;

/**
 * Decides whether a failed listener reconnects, and after how long.
 */
public final class ReconnectPolicy {
  private Duration initialDelay = Duration.ofSeconds(1);
  private Duration maxDelay = Duration.ofSeconds(30);
  private double multiplier = 2.0d;
  private double jitter = 0.2d;
  private long maxAttempts;
  private Predicate<Throwable> reconnectOn = err -> true;
  private final boolean enabled;

  private ReconnectPolicy(boolean enabled) {
    this.enabled = enabled;
  }

  public static ReconnectPolicy none() {
    return new ReconnectPolicy(false);
  }

  public static ReconnectPolicy exponentialBackoff() {
    return new ReconnectPolicy(true);
  }

  public static ReconnectPolicy fromJson(JsonObject json) {
    if (json == null || !json.getBoolean("enabled", true)) {
      return none();
    }
    return exponentialBackoff()
      .setInitialDelay(Duration.ofMillis(json.getLong("initialDelayMs", 1000L)))
      .setMaxDelay(Duration.ofMillis(json.getLong("maxDelayMs", 30000L)))
      .setMultiplier(json.getDouble("multiplier", 2.0d))
      .setJitter(json.getDouble("jitter", 0.2d))
      .setMaxAttempts(json.getLong("maxAttempts", 0L));
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("enabled", enabled)
      .put("initialDelayMs", initialDelay.toMillis())
      .put("maxDelayMs", maxDelay.toMillis())
      .put("multiplier", multiplier)
      .put("jitter", jitter)
      .put("maxAttempts", maxAttempts);
  }

  public ReconnectPolicy copy() {
    ReconnectPolicy copy = new ReconnectPolicy(enabled);
    copy.initialDelay = initialDelay;
    copy.maxDelay = maxDelay;
    copy.multiplier = multiplier;
    copy.jitter = jitter;
    copy.maxAttempts = maxAttempts;
    copy.reconnectOn = reconnectOn;
    return copy;
  }

  public ReconnectPolicy setInitialDelay(Duration initialDelay) {
    this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay");
    return this;
  }

  public ReconnectPolicy setMaxDelay(Duration maxDelay) {
    this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
    return this;
  }

  public ReconnectPolicy setMultiplier(double multiplier) {
    this.multiplier = multiplier;
    return this;
  }

  public ReconnectPolicy setJitter(double jitter) {
    if (jitter < 0.0d || jitter > 1.0d) {
      throw new ConfigurationException(ConfigurationException.Reason.INVALID_OPTION,
        "jitter must be between 0.0 and 1.0");
    }
    this.jitter = jitter;
    return this;
  }

  public ReconnectPolicy setMaxAttempts(long maxAttempts) {
    this.maxAttempts = maxAttempts;
    return this;
  }

  public ReconnectPolicy setReconnectOn(Predicate<Throwable> reconnectOn) {
    this.reconnectOn = Objects.requireNonNull(reconnectOn, "reconnectOn");
    return this;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public Duration getInitialDelay() {
    return initialDelay;
  }

  public Duration getMaxDelay() {
    return maxDelay;
  }

  public double getMultiplier() {
    return multiplier;
  }

  public double getJitter() {
    return jitter;
  }

  public long getMaxAttempts() {
    return maxAttempts;
  }

  /**
   * Returns true when a listener that failed on {@code attempt} (1-based) should connect again.
   * A {@code maxAttempts} of zero means unlimited.
   */
  public boolean allowsReconnect(Throwable error, long attempt) {
    if (!enabled || !reconnectOn.test(error)) {
      return false;
    }
    return maxAttempts == 0 || attempt < maxAttempts;
  }

  public long delayMillis(long attempt) {
    double base = initialDelay.toMillis() * Math.pow(Math.max(1.0d, multiplier), Math.max(0, attempt - 1));
    long capped = Math.min((long) base, maxDelay.toMillis());
    if (jitter == 0.0d || capped == 0L) {
      return capped;
    }
    long delta = (long) (capped * jitter);
    return ThreadLocalRandom.current().nextLong(Math.max(0L, capped - delta), capped + delta + 1);
  }

  public void validate() {
    if (initialDelay.isNegative()) {
      throw invalid("initialDelay must be >= 0");
    }
    if (maxDelay.compareTo(initialDelay) < 0) {
      throw invalid("maxDelay must be >= initialDelay");
    }
    if (multiplier < 1.0d) {
      throw invalid("multiplier must be >= 1.0");
    }
    if (maxAttempts < 0) {
      throw invalid("maxAttempts must be >= 0");
    }
  }

  private static ConfigurationException invalid(String message) {
    return new ConfigurationException(ConfigurationException.Reason.INVALID_OPTION, "reconnectPolicy." + message);
  }
}
