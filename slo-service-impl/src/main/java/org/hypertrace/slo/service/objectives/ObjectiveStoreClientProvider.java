package org.hypertrace.slo.service.objectives;

import javax.inject.Inject;
import javax.inject.Provider;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.hypertrace.slo.service.SloServiceConfig;
import org.hypertrace.slo.service.SloServiceConfig.EndpointConfig;

final class ObjectiveStoreClientProvider implements Provider<RestObjectiveStoreClient> {
  private final SloServiceConfig config;

  @Inject
  ObjectiveStoreClientProvider(SloServiceConfig config) {
    this.config = config;
  }

  @Override
  public RestObjectiveStoreClient get() {
    EndpointConfig objectives = config.getObjectivesConfig();
    return new RestObjectiveStoreClient(
        HttpUrl.get(objectives.getUrl()),
        new OkHttpClient.Builder().callTimeout(objectives.getTimeout()).build());
  }
}
