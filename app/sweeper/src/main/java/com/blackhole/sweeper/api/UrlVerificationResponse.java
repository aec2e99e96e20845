package com.blackhole.sweeper.api;

/** Echo of the {@code url_verification} challenge. */
public record UrlVerificationResponse(String challenge) {}
