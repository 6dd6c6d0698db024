package org.hypertrace.slo.service.objectives;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.reactivex.rxjava3.core.Single;
import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.hypertrace.slo.service.api.Objective;
import org.hypertrace.slo.service.api.json.ObjectiveJsonModule;

/** Lists objectives with {@code GET api/v1/objectives?expr=...} and decodes the JSON array. */
@Slf4j
public class RestObjectiveStoreClient implements ObjectiveStoreClient, Closeable {
  private static final String OBJECTIVES_PATH = "api/v1/objectives";
  private static final String EXPR_PARAM = "expr";
  private static final TypeReference<List<Objective>> OBJECTIVE_LIST = new TypeReference<>() {};

  private final HttpUrl baseUrl;
  private final OkHttpClient okHttpClient;
  private final ObjectMapper objectMapper;

  public RestObjectiveStoreClient(HttpUrl baseUrl, OkHttpClient okHttpClient) {
    this.baseUrl = baseUrl;
    this.okHttpClient = okHttpClient;
    this.objectMapper = ObjectiveJsonModule.newObjectMapper();
  }

  @Override
  public Single<List<Objective>> listObjectives(String expr) {
    return Single.create(
        emitter -> {
          HttpUrl url =
              baseUrl
                  .newBuilder()
                  .addPathSegments(OBJECTIVES_PATH)
                  .addQueryParameter(EXPR_PARAM, expr)
                  .build();
          Call call = okHttpClient.newCall(new Request.Builder().url(url).get().build());
          emitter.setCancellable(call::cancel);
          call.enqueue(
              new Callback() {
                @Override
                public void onResponse(Call call, Response response) {
                  try (ResponseBody body = response.body()) {
                    emitter.onSuccess(convertResponse(response, body));
                  } catch (IOException e) {
                    emitter.tryOnError(e);
                  } catch (RuntimeException e) {
                    emitter.tryOnError(
                        new ObjectiveStoreException("Unable to handle objectives response", e));
                  }
                }

                @Override
                public void onFailure(Call call, IOException e) {
                  emitter.tryOnError(
                      new ObjectiveStoreException(
                          "Objective store request to " + url + " failed", e));
                }
              });
        });
  }

  private List<Objective> convertResponse(Response response, ResponseBody body)
      throws IOException {
    if (!response.isSuccessful()) {
      throw new ObjectiveStoreException(
          response.code(),
          "Objective store returned " + response.code() + " " + response.message());
    }
    String content = body == null ? "" : body.string();
    try {
      List<Objective> objectives = objectMapper.readValue(content, OBJECTIVE_LIST);
      if (objectives == null) {
        throw new ObjectiveStoreException("Objective store returned no objective list", null);
      }
      log.debug("Objective store returned {} objectives", objectives.size());
      return objectives;
    } catch (JsonProcessingException e) {
      throw new ObjectiveStoreException("Unable to decode objectives", e);
    }
  }

  @Override
  public void close() {
    okHttpClient.dispatcher().cancelAll();
    okHttpClient.dispatcher().executorService().shutdown();
    okHttpClient.connectionPool().evictAll();
  }
}
