package com.blackhole.sweeper.slack.dto;

/** Envelope fields every Slack Web API response carries. */
public interface SlackResponse {

  boolean ok();

  String error();
}
