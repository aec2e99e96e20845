/*
 * Where: Sweeper API
 * What: Rejects an events request that fails verification or cannot be parsed
 * Why: Unsigned or stale requests must never reach the deletion path
 */
package com.blackhole.sweeper.api;

public class InvalidSlackRequestException extends RuntimeException {

  public enum Reason {
    UNAUTHORIZED,
    MALFORMED
  }

  private final Reason reason;

  public InvalidSlackRequestException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public InvalidSlackRequestException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
