package org.hypertrace.slo.service.api.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import java.io.IOException;
import java.time.Duration;
import org.hypertrace.slo.service.api.Metric;
import org.hypertrace.slo.service.api.promql.InvalidSelectorException;

/**
 * Wire format of the objective model: durations are integer milliseconds and indicator metrics are
 * objects holding the selector string, {@code {"metric": "http_requests_total{job=\"api\"}"}}.
 * {@code NaN} and infinite numbers have no JSON representation and are written as {@code null}.
 */
public class ObjectiveJsonModule extends SimpleModule {
  private static final String METRIC_FIELD = "metric";

  public ObjectiveJsonModule() {
    super("ObjectiveJsonModule");
    addSerializer(Duration.class, new DurationMillisSerializer());
    addDeserializer(Duration.class, new DurationMillisDeserializer());
    addSerializer(Metric.class, new MetricSerializer());
    addDeserializer(Metric.class, new MetricDeserializer());
    addSerializer(Double.class, new FiniteDoubleSerializer());
    addSerializer(Double.TYPE, new FiniteDoubleSerializer());
    addSerializer(double[].class, new FiniteDoubleArraySerializer());
  }

  public static ObjectMapper newObjectMapper() {
    return new ObjectMapper()
        .registerModule(new ObjectiveJsonModule())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  static class DurationMillisSerializer extends JsonSerializer<Duration> {
    @Override
    public void serialize(Duration value, JsonGenerator generator, SerializerProvider provider)
        throws IOException {
      generator.writeNumber(value.toMillis());
    }
  }

  static class DurationMillisDeserializer extends JsonDeserializer<Duration> {
    @Override
    public Duration deserialize(JsonParser parser, DeserializationContext context)
        throws IOException {
      return Duration.ofMillis(parser.getValueAsLong());
    }
  }

  static class FiniteDoubleSerializer extends JsonSerializer<Double> {
    @Override
    public void serialize(Double value, JsonGenerator generator, SerializerProvider provider)
        throws IOException {
      writeFinite(value, generator);
    }
  }

  static class FiniteDoubleArraySerializer extends JsonSerializer<double[]> {
    @Override
    public void serialize(double[] values, JsonGenerator generator, SerializerProvider provider)
        throws IOException {
      generator.writeStartArray(values, values.length);
      for (double value : values) {
        writeFinite(value, generator);
      }
      generator.writeEndArray();
    }
  }

  private static void writeFinite(double value, JsonGenerator generator) throws IOException {
    if (Double.isFinite(value)) {
      generator.writeNumber(value);
    } else {
      generator.writeNull();
    }
  }

  static class MetricSerializer extends JsonSerializer<Metric> {
    @Override
    public void serialize(Metric value, JsonGenerator generator, SerializerProvider provider)
        throws IOException {
      generator.writeStartObject();
      generator.writeStringField(METRIC_FIELD, value.toSelector());
      generator.writeEndObject();
    }
  }

  static class MetricDeserializer extends JsonDeserializer<Metric> {
    @Override
    public Metric deserialize(JsonParser parser, DeserializationContext context)
        throws IOException {
      JsonNode node = parser.getCodec().readTree(parser);
      JsonNode selector = node.get(METRIC_FIELD);
      if (selector == null || !selector.isTextual()) {
        throw context.instantiationException(Metric.class, "missing metric selector");
      }
      try {
        return Metric.parse(selector.asText());
      } catch (InvalidSelectorException e) {
        throw context.weirdStringException(selector.asText(), Metric.class, e.getMessage());
      }
    }
  }
}
