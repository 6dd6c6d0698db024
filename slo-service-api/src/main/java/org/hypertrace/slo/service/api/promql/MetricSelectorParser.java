package org.hypertrace.slo.service.api.promql;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.hypertrace.slo.service.api.LabelMatcher;
import org.hypertrace.slo.service.api.MatchType;

/**
 * Parses PromQL vector selectors such as {@code up}, {@code {job="api"}} or {@code
 * http_requests_total{code=~"5..", handler!="/health",}} into label matchers. A metric name is
 * returned as an equality matcher on {@code __name__}.
 */
public class MetricSelectorParser {

  private final String input;
  private int position;

  private MetricSelectorParser(String input) {
    this.input = input;
  }

  public static List<LabelMatcher> parse(String selector) {
    if (selector == null || selector.isBlank()) {
      throw new InvalidSelectorException(String.valueOf(selector), "empty selector");
    }
    return new MetricSelectorParser(selector).parseSelector();
  }

  private List<LabelMatcher> parseSelector() {
    List<LabelMatcher> matchers = new ArrayList<>();
    skipWhitespace();
    if (!atEnd() && isMetricNameStart(peek())) {
      matchers.add(LabelMatcher.equal(LabelMatcher.METRIC_NAME, readMetricName()));
      skipWhitespace();
    }
    if (!atEnd()) {
      expect('{');
      parseMatchers(matchers);
      expect('}');
      skipWhitespace();
    }
    if (!atEnd()) {
      throw error("unexpected character '" + peek() + "'");
    }
    validate(matchers);
    return matchers;
  }

  private void parseMatchers(List<LabelMatcher> matchers) {
    skipWhitespace();
    while (!atEnd() && peek() != '}') {
      matchers.add(parseMatcher());
      skipWhitespace();
      if (!atEnd() && peek() == ',') {
        position++;
        skipWhitespace();
      } else if (!atEnd() && peek() != '}') {
        throw error("expected ',' or '}'");
      }
    }
  }

  private LabelMatcher parseMatcher() {
    String name = readLabelName();
    skipWhitespace();
    MatchType type = readOperator();
    skipWhitespace();
    String value = readString();
    if (type.isRegex()) {
      try {
        Pattern.compile(value);
      } catch (PatternSyntaxException e) {
        throw new InvalidSelectorException(input, "invalid regular expression " + value);
      }
    }
    return LabelMatcher.of(name, type, value);
  }

  private MatchType readOperator() {
    if (input.startsWith("=~", position)) {
      position += 2;
      return MatchType.REGEX_MATCH;
    }
    if (input.startsWith("!~", position)) {
      position += 2;
      return MatchType.REGEX_NO_MATCH;
    }
    if (input.startsWith("!=", position)) {
      position += 2;
      return MatchType.NOT_EQUAL;
    }
    if (input.startsWith("=", position)) {
      position++;
      return MatchType.EQUAL;
    }
    throw error("expected label matching operator");
  }

  private String readString() {
    if (atEnd()) {
      throw error("expected quoted label value");
    }
    char quote = peek();
    if (quote != '"' && quote != '\'' && quote != '`') {
      throw error("expected quoted label value");
    }
    position++;
    StringBuilder value = new StringBuilder();
    while (!atEnd()) {
      char c = input.charAt(position++);
      if (c == quote) {
        return value.toString();
      }
      if (c == '\\' && quote != '`') {
        if (atEnd()) {
          break;
        }
        value.append(unescape(input.charAt(position++)));
      } else {
        value.append(c);
      }
    }
    throw error("unterminated quoted string");
  }

  private char unescape(char c) {
    switch (c) {
      case 'n':
        return '\n';
      case 't':
        return '\t';
      case 'r':
        return '\r';
      case '\\':
      case '"':
      case '\'':
      case '`':
        return c;
      default:
        throw error("unknown escape sequence \\" + c);
    }
  }

  private String readMetricName() {
    int start = position;
    while (!atEnd() && (isMetricNameStart(peek()) || isAsciiDigit(peek()))) {
      position++;
    }
    return input.substring(start, position);
  }

  private String readLabelName() {
    int start = position;
    if (atEnd() || !isLabelNameStart(peek())) {
      throw error("expected label name");
    }
    while (!atEnd() && (isLabelNameStart(peek()) || isAsciiDigit(peek()))) {
      position++;
    }
    return input.substring(start, position);
  }

  private void validate(List<LabelMatcher> matchers) {
    // a selector matching every series is rejected by the backend as well
    boolean selective = matchers.stream().anyMatch(matcher -> !matcher.matches(""));
    if (!selective) {
      throw new InvalidSelectorException(
          input, "vector selector must contain at least one non-empty matcher");
    }
  }

  private void expect(char expected) {
    if (atEnd() || peek() != expected) {
      throw error("expected '" + expected + "'");
    }
    position++;
  }

  private void skipWhitespace() {
    while (!atEnd() && Character.isWhitespace(peek())) {
      position++;
    }
  }

  private boolean atEnd() {
    return position >= input.length();
  }

  private char peek() {
    return input.charAt(position);
  }

  private InvalidSelectorException error(String reason) {
    return new InvalidSelectorException(input, position, reason);
  }

  private static boolean isMetricNameStart(char c) {
    return isLabelNameStart(c) || c == ':';
  }

  private static boolean isLabelNameStart(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
  }

  private static boolean isAsciiDigit(char c) {
    return c >= '0' && c <= '9';
  }
}
