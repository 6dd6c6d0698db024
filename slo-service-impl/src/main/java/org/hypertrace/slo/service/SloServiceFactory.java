package org.hypertrace.slo.service;

import com.google.inject.Guice;
import com.typesafe.config.Config;

public final class SloServiceFactory {
  private static final String SLO_SERVICE_CONFIG = "service.config";

  private SloServiceFactory() {}

  /** Builds the service from the application config, the caller owns and closes the result. */
  public static ObjectivesServiceImpl build(Config appConfig) {
    return Guice.createInjector(new SloServiceModule(appConfig.getConfig(SLO_SERVICE_CONFIG)))
        .getInstance(ObjectivesServiceImpl.class);
  }
}
