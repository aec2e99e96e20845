package com.blackhole.sweeper.model;

import java.util.Set;

/** Kind of workspace item the sweeper deletes, with the Slack error codes meaning "already gone". */
public enum ItemKind {
  MESSAGE("message", Set.of("message_not_found")),
  FILE("file", Set.of("file_deleted", "file_not_found"));

  private final String value;
  private final Set<String> alreadyAbsentErrors;

  ItemKind(String value, Set<String> alreadyAbsentErrors) {
    this.value = value;
    this.alreadyAbsentErrors = alreadyAbsentErrors;
  }

  public String value() {
    return value;
  }

  public boolean isAlreadyAbsent(String slackError) {
    return slackError != null && alreadyAbsentErrors.contains(slackError);
  }
}
