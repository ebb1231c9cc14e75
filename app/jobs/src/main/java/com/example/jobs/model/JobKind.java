/*
 * Where: jobs domain model
 * What: distinguishes events raised for "now" from events raised for a future instant
 * Why: health details report the kind next to the event type
 */
package com.example.jobs.model;

import java.util.Locale;

public enum JobKind {
  EVENT,
  TIMER;

  public String columnValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static JobKind fromColumnValue(String value) {
    return valueOf(value.toUpperCase(Locale.ROOT));
  }
}
