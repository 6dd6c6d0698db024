package org.hypertrace.slo.service.prometheus;

import io.reactivex.rxjava3.core.Single;
import java.io.Closeable;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.FormBody;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Sends form encoded POST requests to the query and query_range endpoints. */
public class PrometheusRestClient implements PrometheusClient, Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(PrometheusRestClient.class);

  private static final String INSTANT_QUERY = "api/v1/query";
  private static final String RANGE_QUERY = "api/v1/query_range";

  private final HttpUrl baseUrl;
  private final OkHttpClient okHttpClient;

  public PrometheusRestClient(HttpUrl baseUrl, OkHttpClient okHttpClient) {
    this.baseUrl = baseUrl;
    this.okHttpClient = okHttpClient;
  }

  @Override
  public Single<QueryResult> query(String query, Instant time) {
    FormBody body =
        new FormBody.Builder().add("query", query).add("time", formatTime(time)).build();
    return execute(INSTANT_QUERY, body);
  }

  @Override
  public Single<QueryResult> queryRange(String query, QueryRange range) {
    FormBody body =
        new FormBody.Builder()
            .add("query", query)
            .add("start", formatTime(range.getStart()))
            .add("end", formatTime(range.getEnd()))
            .add("step", formatDuration(range.getStep()))
            .build();
    return execute(RANGE_QUERY, body);
  }

  private Single<QueryResult> execute(String path, FormBody body) {
    return Single.create(
        emitter -> {
          Request request = new Request.Builder().url(baseUrl.resolve(path)).post(body).build();
          Call call = okHttpClient.newCall(request);
          emitter.setCancellable(call::cancel);
          call.enqueue(
              new Callback() {
                @Override
                public void onResponse(Call call, Response response) {
                  try (ResponseBody responseBody = response.body()) {
                    emitter.onSuccess(convertResponse(response, responseBody));
                  } catch (IOException e) {
                    emitter.tryOnError(e);
                  } catch (RuntimeException e) {
                    emitter.tryOnError(
                        new PrometheusQueryException(
                            "Unable to handle response of " + call.request().url(), e));
                  }
                }

                @Override
                public void onFailure(Call call, IOException e) {
                  emitter.tryOnError(e);
                }
              });
        });
  }

  private QueryResult convertResponse(Response response, ResponseBody body) throws IOException {
    String content = body == null ? "" : body.string();
    if (!response.isSuccessful()) {
      // error responses usually carry an envelope naming the error
      throw PrometheusResponseParser.parseError(content)
          .orElseGet(() -> new PrometheusQueryException("Unexpected code " + response));
    }
    QueryResult result = PrometheusResponseParser.parse(content);
    if (result.hasWarnings()) {
      LOG.warn("Query {} returned warnings: {}", response.request().url(), result.getWarnings());
    }
    return result;
  }

  @Override
  public void close() {
    okHttpClient.dispatcher().cancelAll();
    okHttpClient.dispatcher().executorService().shutdown();
    okHttpClient.connectionPool().evictAll();
  }

  static String formatTime(Instant time) {
    return BigDecimal.valueOf(time.toEpochMilli(), 3).stripTrailingZeros().toPlainString();
  }

  static String formatDuration(Duration duration) {
    return BigDecimal.valueOf(duration.toMillis(), 3).stripTrailingZeros().toPlainString();
  }
}
