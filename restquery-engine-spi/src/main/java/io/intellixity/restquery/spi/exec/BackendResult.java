package io.intellixity.restquery.spi.exec;

import java.util.List;
import java.util.Map;

/** Raw outcome of one backend call, before the result envelope is built. */
public record BackendResult(List<Map<String, Object>> rows,
                            Long total,
                            Long insertedCount,
                            Long modifiedCount,
                            Long deletedCount,
                            Long matchedCount) {
  public BackendResult {
    rows = rows == null ? List.of() : List.copyOf(rows);
  }

  public static BackendResult rows(List<Map<String, Object>> rows) {
    return new BackendResult(rows, null, null, null, null, null);
  }

  public static BackendResult rows(List<Map<String, Object>> rows, Long total) {
    return new BackendResult(rows, total, null, null, null, null);
  }

  public static BackendResult inserted(List<Map<String, Object>> rows, long count) {
    return new BackendResult(rows, null, count, null, null, null);
  }

  public static BackendResult updated(long matched, long modified) {
    return new BackendResult(List.of(), null, null, modified, null, matched);
  }

  public static BackendResult deleted(long count) {
    return new BackendResult(List.of(), null, null, null, count, null);
  }
}
