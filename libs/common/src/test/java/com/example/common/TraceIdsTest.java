package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.Timestamp;
import java.time.Instant;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class TraceIdsTest {

  @AfterEach
  void cleanup() {
    MDC.clear();
  }

  @Test
  void putIfAbsentCreatesTraceIdOnlyOnce() {
    assertThat(TraceIds.putIfAbsent()).isTrue();
    final String traceId = MDC.get(TraceIds.MDC_KEY);

    assertThat(TraceIds.putIfAbsent()).isFalse();
    assertThat(MDC.get(TraceIds.MDC_KEY)).isEqualTo(traceId);
  }

  @Test
  void timestampConversionKeepsNulls() {
    final Instant instant = Instant.parse("2026-03-01T00:00:00.123456Z");

    assertThat(JdbcTimestampUtils.toInstant(JdbcTimestampUtils.toTimestamp(instant)))
        .isEqualTo(instant);
    assertThat(JdbcTimestampUtils.toTimestamp(null)).isNull();
    assertThat(JdbcTimestampUtils.toInstant((Timestamp) null)).isNull();
  }
}
