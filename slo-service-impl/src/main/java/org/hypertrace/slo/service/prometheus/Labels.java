package org.hypertrace.slo.service.prometheus;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;

/** Label set identifying a series, kept sorted by label name. */
@EqualsAndHashCode
public final class Labels {
  private static final HashFunction FINGERPRINT = Hashing.farmHashFingerprint64();
  private static final byte SEPARATOR = (byte) 0xff;
  private static final Labels EMPTY = new Labels(ImmutableSortedMap.of());

  private final ImmutableSortedMap<String, String> labels;

  private Labels(ImmutableSortedMap<String, String> labels) {
    this.labels = labels;
  }

  public static Labels of(Map<String, String> labels) {
    return labels.isEmpty() ? EMPTY : new Labels(ImmutableSortedMap.copyOf(labels));
  }

  public static Labels empty() {
    return EMPTY;
  }

  public Optional<String> get(String name) {
    return Optional.ofNullable(labels.get(name));
  }

  public Map<String, String> asMap() {
    return labels;
  }

  /** Stable hash over the sorted label pairs, used to join series returned by separate queries. */
  public long fingerprint() {
    Hasher hasher = FINGERPRINT.newHasher();
    labels.forEach(
        (name, value) ->
            hasher
                .putString(name, UTF_8)
                .putByte(SEPARATOR)
                .putString(value, UTF_8)
                .putByte(SEPARATOR));
    return hasher.hash().asLong();
  }

  @Override
  public String toString() {
    return labels.entrySet().stream()
        .map(entry -> entry.getKey() + "=" + quote(entry.getValue()))
        .collect(Collectors.joining(", ", "{", "}"));
  }

  private static String quote(String value) {
    return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + "\"";
  }
}
