package org.hypertrace.slo.service;

import com.google.inject.AbstractModule;
import com.typesafe.config.Config;
import java.time.Clock;
import org.hypertrace.slo.service.api.ObjectivesApi;
import org.hypertrace.slo.service.objectives.ObjectiveStoreModule;
import org.hypertrace.slo.service.prometheus.PrometheusModule;

class SloServiceModule extends AbstractModule {

  private final SloServiceConfig config;

  SloServiceModule(Config config) {
    this.config = new SloServiceConfig(config);
  }

  @Override
  protected void configure() {
    bind(SloServiceConfig.class).toInstance(this.config);
    bind(Clock.class).toInstance(Clock.systemUTC());
    bind(ObjectivesApi.class).to(ObjectivesServiceImpl.class);
    install(new PrometheusModule());
    install(new ObjectiveStoreModule());
  }
}
