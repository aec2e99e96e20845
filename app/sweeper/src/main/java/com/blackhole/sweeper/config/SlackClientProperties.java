/*
 * Where: Sweeper configuration binding
 * What: Holds Slack Web API connection, credential and paging settings
 * Why: Token, signing secret and timeouts differ per workspace and environment
 */
package com.blackhole.sweeper.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "blackhole.slack")
@Validated
public record SlackClientProperties(
    @NotBlank String baseUrl,
    @NotBlank(message = "blackhole.slack.token (BLACKHOLE_SLACK_TOKEN) is not set") String token,
    String signingSecret,
    Duration connectTimeout,
    Duration readTimeout,
    @Positive Integer channelPageSize,
    @Positive Integer historyPageSize,
    @Positive Integer filePageSize,
    @NotBlank String channelTypes) {

  public SlackClientProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://slack.com/api" : baseUrl;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(30) : readTimeout;
    channelPageSize = channelPageSize == null ? 200 : channelPageSize;
    historyPageSize = historyPageSize == null ? 200 : historyPageSize;
    filePageSize = filePageSize == null ? 100 : filePageSize;
    channelTypes = channelTypes == null || channelTypes.isBlank() ? "public_channel" : channelTypes;
  }

  @AssertTrue(message = "blackhole.slack.connect-timeout and read-timeout must be positive")
  public boolean isTimeoutsPositive() {
    return isPositive(connectTimeout) && isPositive(readTimeout);
  }

  public boolean hasSigningSecret() {
    return signingSecret != null && !signingSecret.isBlank();
  }

  private boolean isPositive(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
