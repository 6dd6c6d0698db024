package org.hypertrace.slo.service.objectives;

import com.google.inject.AbstractModule;
import com.google.inject.multibindings.Multibinder;
import java.io.Closeable;
import javax.inject.Singleton;
import org.hypertrace.slo.service.SloServiceConfig;

public class ObjectiveStoreModule extends AbstractModule {

  @Override
  protected void configure() {
    requireBinding(SloServiceConfig.class);
    bind(RestObjectiveStoreClient.class)
        .toProvider(ObjectiveStoreClientProvider.class)
        .in(Singleton.class);
    bind(ObjectiveStoreClient.class).to(RestObjectiveStoreClient.class);
    Multibinder.newSetBinder(binder(), Closeable.class)
        .addBinding()
        .to(RestObjectiveStoreClient.class);
  }
}
