/*
 * Where: Sweeper service layer
 * What: Resolves the single channel a file belongs to
 * Why: Listings and events often omit channel membership, which only files.info carries
 */
package com.blackhole.sweeper.service;

import com.blackhole.sweeper.slack.ChatPlatformClient;
import com.blackhole.sweeper.slack.SlackApiException;
import com.blackhole.sweeper.slack.dto.SlackFile;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class FileChannelResolver {

  private static final Logger logger = LoggerFactory.getLogger(FileChannelResolver.class);

  private final ChatPlatformClient client;

  /**
   * Returns {@code file} with its channel list filled in. When the list is empty, the file is
   * fetched again through {@code files.info}.
   *
   * @throws FileMetadataUnavailableException when the refetch fails
   */
  public SlackFile complete(SlackFile file) {
    if (!file.channels().isEmpty()) {
      return file;
    }
    try {
      final SlackFile fetched = client.getFileInfo(file.id());
      logger.debug("file metadata refetched file={} channels={}", file.id(), fetched.channels());
      return fetched;
    } catch (SlackApiException ex) {
      logger.error(
          "file metadata refetch failed file={} reason={} error={}",
          file.id(),
          ex.reason(),
          ex.error());
      throw new FileMetadataUnavailableException(file.id(), ex);
    }
  }

  /**
   * The owning channel of an already completed file, or empty when the file is shared to no
   * channel or to more than one.
   */
  public Optional<String> owningChannel(SlackFile completed) {
    if (completed.channels().size() != 1) {
      logger.debug(
          "file skipped because it is not in exactly one channel file={} channels={}",
          completed.id(),
          completed.channels().size());
      return Optional.empty();
    }
    return Optional.of(completed.channels().get(0));
  }
}
