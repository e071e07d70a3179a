package com.quantori.eqp.core.configuration;

import com.typesafe.config.Config;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import lombok.Builder;
import lombok.Value;

/**
 * Exponential backoff applied to failed filing source calls.
 */
@Value
@Builder(toBuilder = true)
public class RetrySettings {
  /**
   * Total attempts including the first one.
   */
  @Builder.Default
  int maxAttempts = 3;
  @Builder.Default
  Duration initialBackoff = Duration.ofMillis(200);
  @Builder.Default
  Duration maxBackoff = Duration.ofSeconds(5);
  @Builder.Default
  double multiplier = 2.0;
  /**
   * Share of the delay added as random jitter, 0 disables jitter.
   */
  @Builder.Default
  double randomFactor = 0.2;

  static RetrySettings fromConfig(Config config) {
    return RetrySettings.builder()
        .maxAttempts(config.getInt("max-attempts"))
        .initialBackoff(config.getDuration("initial-backoff"))
        .maxBackoff(config.getDuration("max-backoff"))
        .multiplier(config.getDouble("multiplier"))
        .randomFactor(config.getDouble("random-factor"))
        .build();
  }

  /**
   * Delay before the attempt following the given failed attempt.
   *
   * @param failedAttempt number of the attempt that failed, starting at 1
   */
  public Duration backoff(int failedAttempt) {
    double base = initialBackoff.toMillis() * Math.pow(multiplier, failedAttempt - 1);
    double capped = Math.min(base, maxBackoff.toMillis());
    double jitter = randomFactor > 0 ? capped * randomFactor * ThreadLocalRandom.current().nextDouble() : 0;
    return Duration.ofMillis((long) Math.min(capped + jitter, maxBackoff.toMillis()));
  }
}
