package com.blackhole.sweeper.api;

public class EventQueueFullException extends RuntimeException {

  public EventQueueFullException(String message) {
    super(message);
  }
}
