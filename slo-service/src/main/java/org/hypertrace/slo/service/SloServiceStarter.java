package org.hypertrace.slo.service;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.undertow.Undertow;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.slo.service.http.HttpServerConfig;
import org.hypertrace.slo.service.http.ObjectivesHttpHandlers;

/** Serves the objectives API over HTTP until the process is terminated. */
@Slf4j
public class SloServiceStarter {
  private static final String SERVICE_CONFIG = "service";
  private static final String SERVICE_NAME = "service.name";

  private final ObjectivesServiceImpl objectivesService;
  private final Undertow undertow;

  SloServiceStarter(Config appConfig) {
    HttpServerConfig serverConfig = new HttpServerConfig(appConfig.getConfig(SERVICE_CONFIG));
    this.objectivesService = SloServiceFactory.build(appConfig);
    this.undertow =
        Undertow.builder()
            .addHttpListener(serverConfig.getPort(), serverConfig.getHost())
            .setHandler(
                new ObjectivesHttpHandlers(objectivesService).routes(serverConfig.getRoutePrefix()))
            .build();
  }

  void start() {
    undertow.start();
  }

  void stop() {
    undertow.stop();
    objectivesService.close();
  }

  public static void main(String[] args) {
    Config appConfig = ConfigFactory.load();
    SloServiceStarter starter = new SloServiceStarter(appConfig);
    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  log.info("Stopping {}", appConfig.getString(SERVICE_NAME));
                  starter.stop();
                }));
    starter.start();
    log.info(
        "Started {} on {}", appConfig.getString(SERVICE_NAME), starter.undertow.getListenerInfo());
  }
}
