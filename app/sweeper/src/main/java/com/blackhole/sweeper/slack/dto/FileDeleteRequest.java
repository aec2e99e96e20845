package com.blackhole.sweeper.slack.dto;

public record FileDeleteRequest(String file) {}
