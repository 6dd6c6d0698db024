package org.hypertrace.slo.service.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.disposables.CompositeDisposable;
import io.reactivex.rxjava3.observers.DisposableSingleObserver;
import io.undertow.Handlers;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.RoutingHandler;
import io.undertow.server.ServerConnection;
import io.undertow.util.AttachmentKey;
import io.undertow.util.Headers;
import io.undertow.util.SameThreadExecutor;
import io.undertow.util.StatusCodes;
import java.time.Instant;
import java.util.Deque;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.slo.service.api.ObjectivesApi;
import org.hypertrace.slo.service.api.ObjectivesServiceException;
import org.hypertrace.slo.service.api.json.ObjectiveJsonModule;

/**
 * Routes {@code /api/v1/objectives} requests to an {@link ObjectivesApi}. Requests are answered
 * asynchronously and the backend calls of a request are cancelled when its connection closes.
 */
@Slf4j
public class ObjectivesHttpHandlers {
  private static final String OBJECTIVES_PATH = "/api/v1/objectives";
  private static final String OBJECTIVE_PATH = OBJECTIVES_PATH + "/{expr}";
  private static final String EXPR_PARAM = "expr";
  private static final String GROUPING_PARAM = "grouping";
  private static final String START_PARAM = "start";
  private static final String END_PARAM = "end";
  private static final String JSON_CONTENT_TYPE = "application/json";
  private static final AttachmentKey<CompositeDisposable> IN_FLIGHT =
      AttachmentKey.create(CompositeDisposable.class);

  private final ObjectivesApi objectivesApi;
  private final ObjectMapper objectMapper;

  public ObjectivesHttpHandlers(ObjectivesApi objectivesApi) {
    this.objectivesApi = objectivesApi;
    this.objectMapper = ObjectiveJsonModule.newObjectMapper();
  }

  public HttpHandler routes(String routePrefix) {
    RoutingHandler routing =
        Handlers.routing()
            .get(OBJECTIVES_PATH, handler(exchange -> objectivesApi.listObjectives(expr(exchange))))
            .get(
                OBJECTIVE_PATH + "/status",
                handler(
                    exchange ->
                        objectivesApi.getObjectiveStatus(expr(exchange), grouping(exchange))))
            .get(
                OBJECTIVE_PATH + "/errorbudget",
                handler(
                    exchange ->
                        objectivesApi.getObjectiveErrorBudget(
                            expr(exchange),
                            grouping(exchange),
                            time(exchange, START_PARAM),
                            time(exchange, END_PARAM))))
            .get(
                OBJECTIVE_PATH + "/alerts",
                handler(
                    exchange ->
                        objectivesApi.getMultiBurnrateAlerts(expr(exchange), grouping(exchange))))
            .get(
                OBJECTIVE_PATH + "/red/requests",
                handler(
                    exchange ->
                        objectivesApi.getREDRequests(
                            expr(exchange),
                            grouping(exchange),
                            time(exchange, START_PARAM),
                            time(exchange, END_PARAM))))
            .get(
                OBJECTIVE_PATH + "/red/errors",
                handler(
                    exchange ->
                        objectivesApi.getREDErrors(
                            expr(exchange),
                            grouping(exchange),
                            time(exchange, START_PARAM),
                            time(exchange, END_PARAM))));
    if (routePrefix.isEmpty()) {
      return routing;
    }
    return Handlers.path().addPrefixPath(routePrefix, routing);
  }

  private <T> HttpHandler handler(Function<HttpServerExchange, Single<T>> call) {
    return exchange ->
        exchange.dispatch(
            SameThreadExecutor.INSTANCE,
            () -> {
              CompositeDisposable inFlight = inFlight(exchange.getConnection());
              DisposableSingleObserver<T> request =
                  new DisposableSingleObserver<>() {
                    @Override
                    public void onSuccess(T result) {
                      inFlight.delete(this);
                      send(exchange, StatusCodes.OK, result);
                    }

                    @Override
                    public void onError(Throwable error) {
                      inFlight.delete(this);
                      sendError(exchange, error);
                    }
                  };
              inFlight.add(request);
              Single.defer(() -> call.apply(exchange)).subscribe(request);
            });
  }

  /**
   * Requests still waiting for the backend on this connection. A single close listener per
   * connection disposes them; finished requests remove themselves.
   */
  private static CompositeDisposable inFlight(ServerConnection connection) {
    CompositeDisposable inFlight = connection.getAttachment(IN_FLIGHT);
    if (inFlight == null) {
      CompositeDisposable created = new CompositeDisposable();
      connection.putAttachment(IN_FLIGHT, created);
      connection.addCloseListener(closed -> created.dispose());
      inFlight = created;
    }
    return inFlight;
  }

  static int inFlightRequests(ServerConnection connection) {
    CompositeDisposable inFlight = connection.getAttachment(IN_FLIGHT);
    return inFlight == null ? 0 : inFlight.size();
  }

  private void sendError(HttpServerExchange exchange, Throwable error) {
    int statusCode = statusCode(error);
    if (statusCode == StatusCodes.INTERNAL_SERVER_ERROR) {
      log.error("Request {} failed", exchange.getRequestURI(), error);
    } else {
      log.debug("Request {} rejected: {}", exchange.getRequestURI(), error.getMessage());
    }
    send(exchange, statusCode, Map.of("error", String.valueOf(error.getMessage())));
  }

  private void send(HttpServerExchange exchange, int statusCode, Object body) {
    String json;
    try {
      json = objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      log.error("Unable to serialize response of {}", exchange.getRequestURI(), e);
      statusCode = StatusCodes.INTERNAL_SERVER_ERROR;
      json = "{\"error\":\"unable to serialize response\"}";
    }
    exchange.setStatusCode(statusCode);
    exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, JSON_CONTENT_TYPE);
    exchange.getResponseSender().send(json);
  }

  static int statusCode(Throwable error) {
    if (!(error instanceof ObjectivesServiceException)) {
      return StatusCodes.INTERNAL_SERVER_ERROR;
    }
    switch (((ObjectivesServiceException) error).getStatus()) {
      case INVALID_ARGUMENT:
        return StatusCodes.BAD_REQUEST;
      case NOT_FOUND:
        return StatusCodes.NOT_FOUND;
      case INTERNAL:
      default:
        return StatusCodes.INTERNAL_SERVER_ERROR;
    }
  }

  private static String expr(HttpServerExchange exchange) {
    return parameter(exchange, EXPR_PARAM).orElse("");
  }

  private static String grouping(HttpServerExchange exchange) {
    return parameter(exchange, GROUPING_PARAM).orElse("");
  }

  /** Unix seconds, absent or 0 mean unset. */
  static Optional<Instant> time(HttpServerExchange exchange, String name) {
    Optional<String> value = parameter(exchange, name).filter(s -> !s.isEmpty());
    if (value.isEmpty()) {
      return Optional.empty();
    }
    long seconds;
    try {
      seconds = Long.parseLong(value.get());
    } catch (NumberFormatException e) {
      throw ObjectivesServiceException.invalidArgument(
          name + " is not a unix timestamp: " + value.get(), e);
    }
    return seconds == 0 ? Optional.empty() : Optional.of(Instant.ofEpochSecond(seconds));
  }

  private static Optional<String> parameter(HttpServerExchange exchange, String name) {
    Deque<String> values = exchange.getQueryParameters().get(name);
    return values == null ? Optional.empty() : Optional.ofNullable(values.peekFirst());
  }
}
