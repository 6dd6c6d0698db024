package org.hypertrace.slo.service.prometheus;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.IOException;
import java.net.URLDecoder;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import okhttp3.FormBody;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okio.Buffer;

/**
 * Rewrites the form body of every query sent to the backend. Partial responses are always
 * disabled since an incomplete vector undercounts errors, and range queries spanning a week or more
 * ask for downsampled data to bound the backend load.
 */
public class ThanosQueryInterceptor implements Interceptor {
  static final String PARTIAL_RESPONSE = "partial_response";
  static final String MAX_SOURCE_RESOLUTION = "max_source_resolution";

  private static final String QUERY_PATH = "/api/v1/query";
  private static final String QUERY_RANGE_PATH = "/api/v1/query_range";

  private static final double WEEK_SECONDS = Duration.ofDays(7).toSeconds();
  private static final double FOUR_WEEKS_SECONDS = Duration.ofDays(28).toSeconds();

  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();
    String path = request.url().encodedPath();
    boolean rangeQuery = path.endsWith(QUERY_RANGE_PATH);
    if (request.body() == null || !(rangeQuery || path.endsWith(QUERY_PATH))) {
      return chain.proceed(request);
    }

    Map<String, String> form = readForm(request.body());
    form.put(PARTIAL_RESPONSE, "false");
    if (rangeQuery) {
      double start = parseSeconds(form, "start");
      double end = parseSeconds(form, "end");
      resolutionFor(end - start)
          .ifPresent(resolution -> form.put(MAX_SOURCE_RESOLUTION, resolution));
    }

    FormBody.Builder body = new FormBody.Builder(UTF_8);
    form.forEach(body::add);
    // FormBody computes the new content length
    return chain.proceed(request.newBuilder().method(request.method(), body.build()).build());
  }

  /** Downsample resolution for a range of the given length in seconds, if any. */
  static Optional<String> resolutionFor(double seconds) {
    if (seconds >= FOUR_WEEKS_SECONDS) {
      return Optional.of("1h");
    }
    if (seconds >= WEEK_SECONDS) {
      return Optional.of("5m");
    }
    return Optional.empty();
  }

  private static Map<String, String> readForm(RequestBody body) throws IOException {
    Buffer buffer = new Buffer();
    body.writeTo(buffer);
    String encoded = buffer.readUtf8();

    Map<String, String> form = new LinkedHashMap<>();
    if (encoded.isEmpty()) {
      return form;
    }
    try {
      for (String pair : encoded.split("&")) {
        if (pair.isEmpty()) {
          continue;
        }
        int separator = pair.indexOf('=');
        String name = separator < 0 ? pair : pair.substring(0, separator);
        String value = separator < 0 ? "" : pair.substring(separator + 1);
        form.put(URLDecoder.decode(name, UTF_8), URLDecoder.decode(value, UTF_8));
      }
    } catch (IllegalArgumentException e) {
      throw new IOException("malformed query request body: " + e.getMessage(), e);
    }
    return form;
  }

  private static double parseSeconds(Map<String, String> form, String field) throws IOException {
    String value = form.get(field);
    if (value == null) {
      throw new IOException("missing " + field + " parameter in range query");
    }
    try {
      return Double.parseDouble(value);
    } catch (NumberFormatException e) {
      throw new IOException("invalid " + field + " parameter in range query: " + value, e);
    }
  }
}
