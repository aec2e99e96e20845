package com.blackhole.sweeper.slack.dto;

public record ChatDeleteRequest(String channel, String ts) {}
