package org.hypertrace.slo.service;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.TypeLiteral;
import java.io.Closeable;
import java.util.Set;
import org.hypertrace.slo.service.api.ObjectivesApi;
import org.hypertrace.slo.service.api.ObjectivesServiceException;
import org.hypertrace.slo.service.api.ObjectivesServiceException.Status;
import org.hypertrace.slo.service.prometheus.CachingPrometheusClient;
import org.hypertrace.slo.service.prometheus.PrometheusClient;
import org.junit.jupiter.api.Test;

class SloServiceModuleTest {

  @Test
  void resolvesBindings() {
    Injector injector =
        Guice.createInjector(
            new SloServiceModule(TestResources.applicationConfig().getConfig("service.config")));

    assertDoesNotThrow(injector::getAllBindings);
    assertEquals(
        CachingPrometheusClient.class, injector.getInstance(PrometheusClient.class).getClass());
    assertSame(
        injector.getInstance(ObjectivesApi.class),
        injector.getInstance(ObjectivesServiceImpl.class));
    // backend client, objective store client and query cache
    assertEquals(3, injector.getInstance(Key.get(new TypeLiteral<Set<Closeable>>() {})).size());
  }

  @Test
  void buildsServiceFromApplicationConfig() {
    ObjectivesServiceImpl service = SloServiceFactory.build(TestResources.applicationConfig());
    try {
      service
          .listObjectives("{job=")
          .test()
          .assertError(
              error ->
                  ((ObjectivesServiceException) error).getStatus() == Status.INVALID_ARGUMENT);
    } finally {
      service.close();
    }
  }
}
