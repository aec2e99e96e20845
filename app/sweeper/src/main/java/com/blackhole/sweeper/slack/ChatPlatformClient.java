/*
 * Where: Slack client layer
 * What: Operations the sweeper needs from the chat platform
 * Why: Scheduler, scanner and dispatcher depend on this seam instead of HTTP details
 */
package com.blackhole.sweeper.slack;

import com.blackhole.sweeper.slack.dto.AuthTestResponse;
import com.blackhole.sweeper.slack.dto.ConversationsHistoryResponse;
import com.blackhole.sweeper.slack.dto.FilesListResponse;
import com.blackhole.sweeper.slack.dto.SlackChannel;
import com.blackhole.sweeper.slack.dto.SlackFile;
import java.util.List;

/**
 * Chat platform operations. Every call counts against the shared API call budget; implementations
 * acquire one throttle token per outbound request. Failures surface as {@link SlackApiException}.
 */
public interface ChatPlatformClient {

  AuthTestResponse authTest();

  /** All channels visible to the token, across every page. */
  List<SlackChannel> listChannels();

  /**
   * One page of channel history, newest first.
   *
   * @param latest exclusive upper bound ts, or null for the newest page
   */
  ConversationsHistoryResponse listChannelHistory(String channelId, String latest);

  /** One page of the workspace file listing; pages are numbered from 1. */
  FilesListResponse listFiles(int page);

  SlackFile getFileInfo(String fileId);

  void deleteMessage(String channelId, String ts);

  void deleteFile(String fileId);
}
