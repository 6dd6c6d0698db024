package org.hypertrace.slo.service.prometheus;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Parses the JSON envelope returned by the query and query_range endpoints. */
public class PrometheusResponseParser {
  private static final String STATUS_SUCCESS = "success";

  private static final Gson GSON =
      new GsonBuilder()
          .registerTypeAdapter(
              ParsedResponse.class,
              new TypeAdapter<ParsedResponse>() {
                @Override
                public ParsedResponse read(JsonReader reader) throws IOException {
                  return parseResponse(reader);
                }

                @Override
                public void write(JsonWriter writer, ParsedResponse response) {
                  throw new UnsupportedOperationException();
                }
              })
          .create();

  public static QueryResult parse(String jsonString) throws PrometheusQueryException {
    ParsedResponse response;
    try {
      response = GSON.fromJson(jsonString, ParsedResponse.class);
    } catch (RuntimeException e) {
      // well formed JSON of an unexpected shape fails with arbitrary unchecked exceptions
      throw new PrometheusQueryException("unable to parse response: " + e.getMessage(), e);
    }
    if (response == null) {
      throw new PrometheusQueryException("empty response");
    }
    if (!STATUS_SUCCESS.equals(response.status)) {
      throw new PrometheusQueryException(
          response.errorType, response.error == null ? "query failed" : response.error);
    }
    if (response.value == null) {
      throw new PrometheusQueryException("response carries no data");
    }
    return QueryResult.builder().value(response.value).warnings(response.warnings).build();
  }

  /** The error carried by a non-2xx response body, if the body is a parsable error envelope. */
  static Optional<PrometheusQueryException> parseError(String jsonString) {
    ParsedResponse response;
    try {
      response = GSON.fromJson(jsonString, ParsedResponse.class);
    } catch (RuntimeException e) {
      return Optional.empty();
    }
    if (response == null || response.error == null) {
      return Optional.empty();
    }
    return Optional.of(new PrometheusQueryException(response.errorType, response.error));
  }

  private static ParsedResponse parseResponse(JsonReader reader) throws IOException {
    ParsedResponse response = new ParsedResponse();

    // read response object
    reader.beginObject();
    while (reader.hasNext()) {
      String propertyName = reader.nextName();
      if (reader.peek() == JsonToken.NULL) {
        reader.nextNull();
        continue;
      }
      switch (propertyName) {
        case "status":
          response.status = reader.nextString();
          break;
        case "data":
          response.value = parseDataBlock(reader);
          break;
        case "warnings":
          reader.beginArray();
          while (reader.hasNext()) {
            response.warnings.add(reader.nextString());
          }
          reader.endArray();
          break;
        case "errorType":
          response.errorType = reader.nextString();
          break;
        case "error":
          response.error = reader.nextString();
          break;
        default:
          reader.skipValue();
      }
    }
    reader.endObject();
    return response;
  }

  private static QueryValue parseDataBlock(JsonReader reader) throws IOException {
    String resultType = null;
    JsonElement result = null;

    // read data block object, the result is buffered since its shape depends on the result type
    reader.beginObject();
    while (reader.hasNext()) {
      String propertyName = reader.nextName();
      if ("resultType".equals(propertyName)) {
        resultType = reader.nextString();
      } else if ("result".equals(propertyName)) {
        result = JsonParser.parseReader(reader);
      } else {
        reader.skipValue();
      }
    }
    reader.endObject();

    if (resultType == null || result == null) {
      throw new JsonParseException("data block without resultType or result");
    }
    switch (ResultType.fromName(resultType)) {
      case VECTOR:
        return parseVector(result.getAsJsonArray());
      case MATRIX:
        return parseMatrix(result.getAsJsonArray());
      case SCALAR:
        JsonArray scalar = result.getAsJsonArray();
        return new ScalarValue(parseTimestamp(scalar.get(0)), parseSampleValue(scalar.get(1)));
      case STRING:
        JsonArray string = result.getAsJsonArray();
        return new StringValue(parseTimestamp(string.get(0)), string.get(1).getAsString());
      default:
        throw new JsonParseException("unsupported result type " + resultType);
    }
  }

  private static VectorValue parseVector(JsonArray result) {
    List<Sample> samples = new ArrayList<>(result.size());
    for (JsonElement element : result) {
      JsonObject sample = element.getAsJsonObject();
      JsonArray value = sample.getAsJsonArray("value");
      samples.add(
          new Sample(
              parseMetric(sample.getAsJsonObject("metric")),
              parseTimestamp(value.get(0)),
              parseSampleValue(value.get(1))));
    }
    return new VectorValue(samples);
  }

  private static MatrixValue parseMatrix(JsonArray result) {
    List<SampleStream> streams = new ArrayList<>(result.size());
    for (JsonElement element : result) {
      JsonObject stream = element.getAsJsonObject();
      SampleStream.SampleStreamBuilder builder =
          SampleStream.builder().metric(parseMetric(stream.getAsJsonObject("metric")));
      JsonArray values = stream.getAsJsonArray("values");
      if (values != null) {
        for (JsonElement pair : values) {
          JsonArray sample = pair.getAsJsonArray();
          builder.value(
              new SamplePair(parseTimestamp(sample.get(0)), parseSampleValue(sample.get(1))));
        }
      }
      streams.add(builder.build());
    }
    return new MatrixValue(streams);
  }

  private static Labels parseMetric(JsonObject metric) {
    if (metric == null) {
      return Labels.empty();
    }
    Map<String, String> labels = new LinkedHashMap<>();
    metric.entrySet().forEach(entry -> labels.put(entry.getKey(), entry.getValue().getAsString()));
    return Labels.of(labels);
  }

  private static long parseTimestamp(JsonElement timestamp) {
    return Math.round(timestamp.getAsDouble() * 1000L);
  }

  static double parseSampleValue(JsonElement value) {
    String text = value.getAsString();
    switch (text) {
      case "+Inf":
      case "Inf":
        return Double.POSITIVE_INFINITY;
      case "-Inf":
        return Double.NEGATIVE_INFINITY;
      case "NaN":
        return Double.NaN;
      default:
        return Double.parseDouble(text);
    }
  }

  private static class ParsedResponse {
    private String status;
    private String errorType;
    private String error;
    private final List<String> warnings = new ArrayList<>();
    private QueryValue value;
  }
}
