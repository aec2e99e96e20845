package com.blackhole.sweeper.model;

public enum DeletionOutcome {
  DELETED("deleted"),
  ALREADY_ABSENT("already_absent"),
  TRANSIENT_ERROR("transient_error");

  private final String value;

  DeletionOutcome(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
