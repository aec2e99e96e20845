package com.blackhole.sweeper.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(InvalidSlackRequestException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidRequest(InvalidSlackRequestException ex) {
    logger.warn("slack request rejected reason={} message={}", ex.reason(), ex.getMessage());
    if (ex.reason() == InvalidSlackRequestException.Reason.UNAUTHORIZED) {
      return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
          .body(new ApiErrorResponse("SLACK_SIGNATURE_INVALID", ex.getMessage()));
    }
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("SLACK_BAD_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("SLACK_BAD_REQUEST", "request body is missing"));
  }

  @ExceptionHandler(EventQueueFullException.class)
  public ResponseEntity<ApiErrorResponse> handleQueueFull(EventQueueFullException ex) {
    logger.warn("slack event rejected because queue is full message={}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ApiErrorResponse("SWEEPER_EVENT_QUEUE_FULL", ex.getMessage()));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("slack event handling failed", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("SWEEPER_INTERNAL_ERROR", ex.getMessage()));
  }
}
