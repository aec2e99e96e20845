/*
 * Where: Common utilities
 * What: Converts Slack "ts" strings (seconds.micros) to Instant
 * Why: Message ids double as creation timestamps and must be parsed without float rounding
 */
package com.blackhole.common;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;

public final class SlackTimestamps {

  private static final int NANOS_SCALE = 9;

  private SlackTimestamps() {}

  /**
   * Parses a Slack message timestamp such as {@code 1355517523.000005}.
   *
   * @throws IllegalArgumentException when the value is blank, not a decimal number or negative
   */
  public static Instant parse(String ts) {
    if (ts == null || ts.isBlank()) {
      throw new IllegalArgumentException("slack ts is blank");
    }
    final BigDecimal value;
    try {
      value = new BigDecimal(ts.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("slack ts is not a decimal number: " + ts, ex);
    }
    if (value.signum() < 0) {
      throw new IllegalArgumentException("slack ts is negative: " + ts);
    }
    final BigDecimal seconds = new BigDecimal(value.toBigInteger());
    final long nanos = value.subtract(seconds).movePointRight(NANOS_SCALE).longValue();
    try {
      return Instant.ofEpochSecond(seconds.longValueExact(), nanos);
    } catch (ArithmeticException | DateTimeException ex) {
      throw new IllegalArgumentException("slack ts is out of range: " + ts, ex);
    }
  }
}
