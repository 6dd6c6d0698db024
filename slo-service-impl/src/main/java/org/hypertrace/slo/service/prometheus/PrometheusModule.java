package org.hypertrace.slo.service.prometheus;

import com.google.inject.AbstractModule;
import com.google.inject.multibindings.Multibinder;
import java.io.Closeable;
import javax.inject.Singleton;
import org.hypertrace.slo.service.SloServiceConfig;

public class PrometheusModule extends AbstractModule {

  @Override
  protected void configure() {
    requireBinding(SloServiceConfig.class);
    bind(QueryCache.class).toProvider(QueryCacheProvider.class).in(Singleton.class);
    bind(PrometheusRestClient.class)
        .toProvider(PrometheusRestClientProvider.class)
        .in(Singleton.class);
    bind(PrometheusClient.class)
        .toProvider(CachingPrometheusClientProvider.class)
        .in(Singleton.class);
    Multibinder<Closeable> resources = Multibinder.newSetBinder(binder(), Closeable.class);
    resources.addBinding().to(PrometheusRestClient.class);
    resources.addBinding().to(QueryCache.class);
  }
}
