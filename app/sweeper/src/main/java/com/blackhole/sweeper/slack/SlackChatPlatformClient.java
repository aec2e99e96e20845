/*
 * Where: Slack client layer
 * What: Slack Web API implementation of ChatPlatformClient on RestClient
 * Why: Every request passes through the shared ApiCallThrottle before it is sent
 */
package com.blackhole.sweeper.slack;

import com.blackhole.sweeper.config.SlackClientProperties;
import com.blackhole.sweeper.service.ApiCallThrottle;
import com.blackhole.sweeper.slack.dto.AuthTestResponse;
import com.blackhole.sweeper.slack.dto.ChatDeleteRequest;
import com.blackhole.sweeper.slack.dto.ConversationsHistoryResponse;
import com.blackhole.sweeper.slack.dto.ConversationsListResponse;
import com.blackhole.sweeper.slack.dto.FileDeleteRequest;
import com.blackhole.sweeper.slack.dto.FileInfoResponse;
import com.blackhole.sweeper.slack.dto.FilesListResponse;
import com.blackhole.sweeper.slack.dto.SlackBasicResponse;
import com.blackhole.sweeper.slack.dto.SlackChannel;
import com.blackhole.sweeper.slack.dto.SlackFile;
import com.blackhole.sweeper.slack.dto.SlackResponse;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class SlackChatPlatformClient implements ChatPlatformClient {

  private static final Logger logger = LoggerFactory.getLogger(SlackChatPlatformClient.class);

  private final RestClient slackRestClient;
  private final SlackClientProperties properties;
  private final ApiCallThrottle throttle;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient and ApiCallThrottle are shared Spring components")
  public SlackChatPlatformClient(
      RestClient slackRestClient, SlackClientProperties properties, ApiCallThrottle throttle) {
    this.slackRestClient = slackRestClient;
    this.properties = properties;
    this.throttle = throttle;
  }

  @Override
  public AuthTestResponse authTest() {
    return call(
        "auth.test",
        () -> slackRestClient.post().uri("/auth.test").retrieve().body(AuthTestResponse.class));
  }

  @Override
  public List<SlackChannel> listChannels() {
    final List<SlackChannel> channels = new ArrayList<>();
    String cursor = null;
    do {
      final String pageCursor = cursor;
      final ConversationsListResponse page =
          call(
              "conversations.list",
              () ->
                  slackRestClient
                      .get()
                      .uri(
                          builder -> {
                            builder
                                .path("/conversations.list")
                                .queryParam("types", properties.channelTypes())
                                .queryParam("exclude_archived", true)
                                .queryParam("limit", properties.channelPageSize());
                            if (pageCursor != null) {
                              builder.queryParam("cursor", pageCursor);
                            }
                            return builder.build();
                          })
                      .retrieve()
                      .body(ConversationsListResponse.class));
      channels.addAll(page.channels());
      cursor = page.nextCursor();
    } while (cursor != null);
    logger.debug("slack conversations.list returned channels={}", channels.size());
    return channels;
  }

  @Override
  public ConversationsHistoryResponse listChannelHistory(String channelId, String latest) {
    requireText(channelId, "channelId");
    return call(
        "conversations.history",
        () ->
            slackRestClient
                .get()
                .uri(
                    builder -> {
                      builder
                          .path("/conversations.history")
                          .queryParam("channel", channelId)
                          .queryParam("limit", properties.historyPageSize());
                      if (latest != null) {
                        builder.queryParam("latest", latest);
                      }
                      return builder.build();
                    })
                .retrieve()
                .body(ConversationsHistoryResponse.class));
  }

  @Override
  public FilesListResponse listFiles(int page) {
    if (page < 1) {
      throw new IllegalArgumentException("page starts at 1");
    }
    return call(
        "files.list",
        () ->
            slackRestClient
                .get()
                .uri(
                    builder ->
                        builder
                            .path("/files.list")
                            .queryParam("page", page)
                            .queryParam("count", properties.filePageSize())
                            .build())
                .retrieve()
                .body(FilesListResponse.class));
  }

  @Override
  public SlackFile getFileInfo(String fileId) {
    requireText(fileId, "fileId");
    final FileInfoResponse response =
        call(
            "files.info",
            () ->
                slackRestClient
                    .get()
                    .uri(builder -> builder.path("/files.info").queryParam("file", fileId).build())
                    .retrieve()
                    .body(FileInfoResponse.class));
    if (response.file() == null) {
      throw new SlackApiException(
          SlackApiException.Reason.INVALID_RESPONSE,
          "files.info",
          null,
          "slack files.info response has no file");
    }
    return response.file();
  }

  @Override
  public void deleteMessage(String channelId, String ts) {
    requireText(channelId, "channelId");
    requireText(ts, "ts");
    call(
        "chat.delete",
        () ->
            slackRestClient
                .post()
                .uri("/chat.delete")
                .contentType(MediaType.APPLICATION_JSON)
                .body(new ChatDeleteRequest(channelId, ts))
                .retrieve()
                .body(SlackBasicResponse.class));
  }

  @Override
  public void deleteFile(String fileId) {
    requireText(fileId, "fileId");
    call(
        "files.delete",
        () ->
            slackRestClient
                .post()
                .uri("/files.delete")
                .contentType(MediaType.APPLICATION_JSON)
                .body(new FileDeleteRequest(fileId))
                .retrieve()
                .body(SlackBasicResponse.class));
  }

  private <T extends SlackResponse> T call(String method, Supplier<T> request) {
    throttle.acquire();
    try {
      return requireOk(method, request.get());
    } catch (RestClientResponseException ex) {
      throw mapResponseException(method, ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(method, ex);
    } catch (SlackApiException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("slack {} response parse failed", method, ex);
      throw new SlackApiException(
          SlackApiException.Reason.INVALID_RESPONSE,
          method,
          null,
          "slack " + method + " response parse failed",
          ex);
    }
  }

  private <T extends SlackResponse> T requireOk(String method, T response) {
    if (response == null) {
      throw new SlackApiException(
          SlackApiException.Reason.INVALID_RESPONSE,
          method,
          null,
          "slack " + method + " returned an empty body");
    }
    if (!response.ok()) {
      throw SlackApiException.apiError(method, response.error());
    }
    return response;
  }

  private SlackApiException mapResponseException(String method, RestClientResponseException ex) {
    logger.warn(
        "slack {} failed with http status={} statusText={}",
        method,
        ex.getStatusCode().value(),
        ex.getStatusText());
    if (ex.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
      return new SlackApiException(
          SlackApiException.Reason.RATE_LIMITED,
          method,
          "ratelimited",
          "slack " + method + " was rate limited",
          ex);
    }
    return new SlackApiException(
        SlackApiException.Reason.BAD_GATEWAY,
        method,
        null,
        "slack " + method + " request failed with status " + ex.getStatusCode().value(),
        ex);
  }

  private SlackApiException mapResourceException(String method, ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("slack {} timed out", method);
      return new SlackApiException(
          SlackApiException.Reason.TIMEOUT, method, null, "slack " + method + " timeout", ex);
    }
    logger.warn("slack {} connection failed", method, ex);
    return new SlackApiException(
        SlackApiException.Reason.BAD_GATEWAY,
        method,
        null,
        "slack " + method + " connection failed",
        ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " is required");
    }
  }
}
