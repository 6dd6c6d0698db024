package org.hypertrace.slo.service.http;

import com.typesafe.config.Config;
import lombok.Value;
import lombok.experimental.NonFinal;

@Value
@NonFinal
public class HttpServerConfig {
  private static final String CONFIG_PATH_HOST = "host";
  private static final String CONFIG_PATH_PORT = "port";
  private static final String CONFIG_PATH_ROUTE_PREFIX = "routePrefix";

  String host;
  int port;

  /** Empty or a path starting with '/' and without a trailing '/'. */
  String routePrefix;

  public HttpServerConfig(Config serviceConfig) {
    this.host = serviceConfig.getString(CONFIG_PATH_HOST);
    this.port = serviceConfig.getInt(CONFIG_PATH_PORT);
    this.routePrefix = normalizePrefix(serviceConfig.getString(CONFIG_PATH_ROUTE_PREFIX));
  }

  static String normalizePrefix(String prefix) {
    String trimmed = prefix.trim();
    while (trimmed.endsWith("/")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    if (trimmed.isEmpty()) {
      return "";
    }
    return trimmed.startsWith("/") ? trimmed : "/" + trimmed;
  }
}
