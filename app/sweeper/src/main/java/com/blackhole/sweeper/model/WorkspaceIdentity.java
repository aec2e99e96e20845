package com.blackhole.sweeper.model;

/** Team and bot user the configured token authenticated as. */
public record WorkspaceIdentity(String teamId, String team, String userId, String user) {}
