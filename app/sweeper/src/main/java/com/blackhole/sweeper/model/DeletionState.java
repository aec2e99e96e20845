package com.blackhole.sweeper.model;

/** Lifecycle of one deletion task. DONE and FAILED are terminal. */
public enum DeletionState {
  WAITING,
  ATTEMPTING,
  BACKOFF,
  DONE,
  FAILED;

  public boolean isTerminal() {
    return this == DONE || this == FAILED;
  }
}
