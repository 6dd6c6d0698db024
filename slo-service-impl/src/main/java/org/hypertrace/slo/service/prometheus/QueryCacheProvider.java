package org.hypertrace.slo.service.prometheus;

import javax.inject.Inject;
import javax.inject.Provider;
import org.hypertrace.slo.service.SloServiceConfig;

final class QueryCacheProvider implements Provider<QueryCache> {
  private final SloServiceConfig config;

  @Inject
  QueryCacheProvider(SloServiceConfig config) {
    this.config = config;
  }

  @Override
  public QueryCache get() {
    return new QueryCache(config.getCacheConfig().getMaxCost());
  }
}
