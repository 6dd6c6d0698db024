package org.hypertrace.slo.service.prometheus;

import javax.inject.Inject;
import javax.inject.Provider;
import org.hypertrace.slo.service.SloServiceConfig;

final class CachingPrometheusClientProvider implements Provider<PrometheusClient> {
  private final SloServiceConfig config;
  private final PrometheusRestClient restClient;
  private final QueryCache queryCache;

  @Inject
  CachingPrometheusClientProvider(
      SloServiceConfig config, PrometheusRestClient restClient, QueryCache queryCache) {
    this.config = config;
    this.restClient = restClient;
    this.queryCache = queryCache;
  }

  @Override
  public PrometheusClient get() {
    return new CachingPrometheusClient(
        restClient,
        queryCache,
        config.getCacheConfig().getInstantTtl(),
        config.getCacheConfig().getRangeTtl());
  }
}
