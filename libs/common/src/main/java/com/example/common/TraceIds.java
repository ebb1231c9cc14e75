package com.example.common;

import java.util.UUID;
import org.slf4j.MDC;

public final class TraceIds {

  public static final String MDC_KEY = "trace_id";

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /**
   * Puts a fresh trace id into the MDC unless the current thread already carries one.
   *
   * @return true when this call created the entry and the caller must remove it
   */
  public static boolean putIfAbsent() {
    if (MDC.get(MDC_KEY) != null) {
      return false;
    }
    MDC.put(MDC_KEY, newTraceId());
    return true;
  }
}
