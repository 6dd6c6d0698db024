package org.hypertrace.slo.service.api;

import java.util.regex.Pattern;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

@Getter
@EqualsAndHashCode(exclude = "pattern")
public class LabelMatcher {
  public static final String METRIC_NAME = "__name__";

  @NonNull private final String name;
  @NonNull private final MatchType type;
  @NonNull private final String value;
  private final Pattern pattern;

  private LabelMatcher(String name, MatchType type, String value) {
    this.name = name;
    this.type = type;
    this.value = value;
    // regex matchers are fully anchored
    this.pattern = type.isRegex() ? Pattern.compile("^(?:" + value + ")$") : null;
  }

  public static LabelMatcher of(String name, MatchType type, String value) {
    return new LabelMatcher(name, type, value);
  }

  public static LabelMatcher equal(String name, String value) {
    return new LabelMatcher(name, MatchType.EQUAL, value);
  }

  public boolean matches(String labelValue) {
    switch (type) {
      case EQUAL:
        return value.equals(labelValue);
      case NOT_EQUAL:
        return !value.equals(labelValue);
      case REGEX_MATCH:
        return pattern.matcher(labelValue).matches();
      case REGEX_NO_MATCH:
        return !pattern.matcher(labelValue).matches();
      default:
        throw new IllegalStateException("Unsupported match type " + type);
    }
  }

  @Override
  public String toString() {
    return name + type.getOperator() + quote(value);
  }

  static String quote(String value) {
    StringBuilder builder = new StringBuilder(value.length() + 2).append('"');
    for (char c : value.toCharArray()) {
      switch (c) {
        case '\\':
          builder.append("\\\\");
          break;
        case '"':
          builder.append("\\\"");
          break;
        case '\n':
          builder.append("\\n");
          break;
        case '\t':
          builder.append("\\t");
          break;
        default:
          builder.append(c);
      }
    }
    return builder.append('"').toString();
  }
}
