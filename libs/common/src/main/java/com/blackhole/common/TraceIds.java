package com.blackhole.common;

import java.util.UUID;
import org.slf4j.MDC;

public final class TraceIds {

  public static final String TRACE_ID_KEY = "trace_id";

  private TraceIds() {}

  /** Returns a 32 character lowercase hex id, the shape the JSON log layout emits as trace_id. */
  public static String newTraceId() {
    return UUID.randomUUID().toString().replace("-", "");
  }

  /**
   * Runs {@code body} with {@code key} bound in the MDC and restores whatever value the key had
   * before, so nested scopes on pooled threads do not leak ids into unrelated log lines.
   */
  public static void runWith(String key, String value, Runnable body) {
    final String previous = MDC.get(key);
    MDC.put(key, value);
    try {
      body.run();
    } finally {
      if (previous == null) {
        MDC.remove(key);
      } else {
        MDC.put(key, previous);
      }
    }
  }
}
