/*
 * Where: Sweeper API
 * What: Standard error body of the events endpoint
 * Why: Every rejected webhook answers with the same response shape
 */
package com.blackhole.sweeper.api;

public record ApiErrorResponse(String code, String message) {}
