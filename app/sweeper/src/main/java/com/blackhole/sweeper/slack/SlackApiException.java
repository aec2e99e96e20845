/*
 * Where: Slack client layer
 * What: Failure of one Slack Web API call, with a reason and the Slack error code if any
 * Why: Callers tell "already absent" and retryable failures apart from the error code
 */
package com.blackhole.sweeper.slack;

public class SlackApiException extends RuntimeException {

  public enum Reason {
    API_ERROR,
    RATE_LIMITED,
    TIMEOUT,
    INVALID_RESPONSE,
    BAD_GATEWAY
  }

  private final Reason reason;
  private final String method;
  private final String error;

  public SlackApiException(Reason reason, String method, String error, String message) {
    super(message);
    this.reason = reason;
    this.method = method;
    this.error = error;
  }

  public SlackApiException(
      Reason reason, String method, String error, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
    this.method = method;
    this.error = error;
  }

  public static SlackApiException apiError(String method, String error) {
    return new SlackApiException(
        Reason.API_ERROR, method, error, "slack " + method + " failed: " + error);
  }

  public Reason reason() {
    return reason;
  }

  public String method() {
    return method;
  }

  /** Slack error code such as {@code message_not_found}; null for transport failures. */
  public String error() {
    return error;
  }
}
