package com.quantori.eqp.core.configuration;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/**
 * Tuning of the thematic search pipeline, read from the {@code eqp.pipeline} section of the
 * configuration.
 */
@Value
@Builder(toBuilder = true)
public class PipelineSettings {
  public static final String CONFIG_PATH = "eqp.pipeline";

  /**
   * Maximum number of concurrent filing source calls per stage.
   */
  @Builder.Default
  int parallelism = 4;
  @Builder.Default
  Duration fetchTimeout = Duration.ofSeconds(30);
  @Builder.Default
  int pageSize = 100;
  /**
   * A discovery partition gives up after this many failed pages in a row.
   */
  @Builder.Default
  int maxConsecutivePageFailures = 3;
  @Builder.Default
  int progressBufferSize = 256;
  /**
   * Term frequency saturation constant of the relevance score.
   */
  @Builder.Default
  double termSaturation = 1.2;
  @Builder.Default
  RetrySettings retry = RetrySettings.builder().build();

  public static PipelineSettings load() {
    return fromConfig(ConfigFactory.load());
  }

  public static PipelineSettings fromConfig(Config root) {
    Config config = root.getConfig(CONFIG_PATH);
    PipelineSettings settings = PipelineSettings.builder()
        .parallelism(config.getInt("parallelism"))
        .fetchTimeout(config.getDuration("fetch-timeout"))
        .pageSize(config.getInt("page-size"))
        .maxConsecutivePageFailures(config.getInt("max-consecutive-page-failures"))
        .progressBufferSize(config.getInt("progress-buffer-size"))
        .termSaturation(config.getDouble("term-saturation"))
        .retry(RetrySettings.fromConfig(config.getConfig("retry")))
        .build();
    settings.validate();
    return settings;
  }

  public void validate() {
    if (parallelism <= 0) {
      throw new IllegalArgumentException("Parallelism must be positive.");
    }
    if (pageSize <= 0) {
      throw new IllegalArgumentException("Page size must be positive.");
    }
    if (progressBufferSize <= 0) {
      throw new IllegalArgumentException("Progress buffer size must be positive.");
    }
    if (maxConsecutivePageFailures <= 0) {
      throw new IllegalArgumentException("Max consecutive page failures must be positive.");
    }
    if (fetchTimeout.isNegative() || fetchTimeout.isZero()) {
      throw new IllegalArgumentException("Fetch timeout must be positive.");
    }
    if (termSaturation <= 0) {
      throw new IllegalArgumentException("Term saturation must be positive.");
    }
    if (retry.getMaxAttempts() <= 0) {
      throw new IllegalArgumentException("Retry attempts must be positive.");
    }
  }
}
