package io.intellixity.restquery.spi.exec;

import java.time.Duration;

/** Per-call execution options; a null timeout means the adapter default. */
public record ExecutionOptions(Duration timeout) {
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  public static ExecutionOptions defaults() {
    return new ExecutionOptions(null);
  }

  public static ExecutionOptions withTimeout(Duration timeout) {
    return new ExecutionOptions(timeout);
  }

  public Duration timeoutOrDefault() {
    return timeout == null ? DEFAULT_TIMEOUT : timeout;
  }
}
