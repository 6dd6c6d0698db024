package org.hypertrace.slo.service.api.promql;

public class InvalidSelectorException extends IllegalArgumentException {
  private final String selector;

  InvalidSelectorException(String selector, int position, String reason) {
    super(String.format("invalid selector %s at char %d: %s", selector, position + 1, reason));
    this.selector = selector;
  }

  InvalidSelectorException(String selector, String reason) {
    super(String.format("invalid selector %s: %s", selector, reason));
    this.selector = selector;
  }

  public String getSelector() {
    return selector;
  }
}
