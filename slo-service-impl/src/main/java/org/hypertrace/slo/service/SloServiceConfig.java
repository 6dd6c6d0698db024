package org.hypertrace.slo.service;

import com.typesafe.config.Config;
import java.time.Duration;
import lombok.Value;
import lombok.experimental.NonFinal;

@Value
@NonFinal
public class SloServiceConfig {

  private static final String CONFIG_PATH_PROMETHEUS = "prometheus";
  private static final String CONFIG_PATH_OBJECTIVES = "objectives";
  private static final String CONFIG_PATH_CACHE = "cache";

  EndpointConfig prometheusConfig;
  EndpointConfig objectivesConfig;
  CacheConfig cacheConfig;

  public SloServiceConfig(Config config) {
    Config resolved = config.resolve();
    this.prometheusConfig = new EndpointConfig(resolved.getConfig(CONFIG_PATH_PROMETHEUS));
    this.objectivesConfig = new EndpointConfig(resolved.getConfig(CONFIG_PATH_OBJECTIVES));
    this.cacheConfig = new CacheConfig(resolved.getConfig(CONFIG_PATH_CACHE));
  }

  /** An HTTP backend reached through OkHttp. */
  @Value
  @NonFinal
  public static class EndpointConfig {
    private static final String CONFIG_PATH_URL = "url";
    private static final String CONFIG_PATH_TIMEOUT = "timeout";

    String url;
    Duration timeout;

    private EndpointConfig(Config config) {
      this.url = config.getString(CONFIG_PATH_URL);
      this.timeout = config.getDuration(CONFIG_PATH_TIMEOUT);
    }
  }

  @Value
  @NonFinal
  public static class CacheConfig {
    private static final String CONFIG_PATH_MAX_COST = "maxCost";
    private static final String CONFIG_PATH_INSTANT_TTL = "instantTtl";
    private static final String CONFIG_PATH_RANGE_TTL = "rangeTtl";

    long maxCost;
    Duration instantTtl;
    Duration rangeTtl;

    private CacheConfig(Config config) {
      this.maxCost = config.getLong(CONFIG_PATH_MAX_COST);
      this.instantTtl = config.getDuration(CONFIG_PATH_INSTANT_TTL);
      this.rangeTtl = config.getDuration(CONFIG_PATH_RANGE_TTL);
    }
  }
}
