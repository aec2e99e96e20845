package com.blackhole.sweeper.slack.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** A channel message. {@code ts} is both its id and its creation time. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SlackMessage(String type, String subtype, String ts, String user) {}
