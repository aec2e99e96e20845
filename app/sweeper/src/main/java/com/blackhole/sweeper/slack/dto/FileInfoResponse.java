package com.blackhole.sweeper.slack.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FileInfoResponse(boolean ok, String error, SlackFile file) implements SlackResponse {}
