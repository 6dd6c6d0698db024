package org.hypertrace.slo.service.prometheus;

import javax.inject.Inject;
import javax.inject.Provider;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.hypertrace.slo.service.SloServiceConfig;
import org.hypertrace.slo.service.SloServiceConfig.EndpointConfig;

final class PrometheusRestClientProvider implements Provider<PrometheusRestClient> {
  private final SloServiceConfig config;

  @Inject
  PrometheusRestClientProvider(SloServiceConfig config) {
    this.config = config;
  }

  @Override
  public PrometheusRestClient get() {
    EndpointConfig prometheus = config.getPrometheusConfig();
    OkHttpClient okHttpClient =
        new OkHttpClient.Builder()
            .addInterceptor(new ThanosQueryInterceptor())
            .callTimeout(prometheus.getTimeout())
            .build();
    return new PrometheusRestClient(directoryUrl(prometheus.getUrl()), okHttpClient);
  }

  /** API paths are resolved relative to the configured URL, which therefore has to end in '/'. */
  static HttpUrl directoryUrl(String url) {
    return HttpUrl.get(url.endsWith("/") ? url : url + "/");
  }
}
