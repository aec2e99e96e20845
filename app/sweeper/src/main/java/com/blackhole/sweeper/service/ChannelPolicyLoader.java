/*
 * Where: Sweeper service layer
 * What: Builds the channel policy table from YAML entries and the JSON retention file
 * Why: Overrides are written with channel names but looked up by channel id
 */
package com.blackhole.sweeper.service;

import com.blackhole.sweeper.config.RetentionProperties;
import com.blackhole.sweeper.config.RetentionProperties.ChannelEntry;
import com.blackhole.sweeper.model.ChannelPolicies;
import com.blackhole.sweeper.model.ChannelPolicy;
import com.blackhole.sweeper.slack.ChatPlatformClient;
import com.blackhole.sweeper.slack.dto.SlackChannel;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ChannelPolicyLoader {

  private static final Logger logger = LoggerFactory.getLogger(ChannelPolicyLoader.class);

  private final ChatPlatformClient client;
  private final RetentionProperties properties;
  private final ObjectMapper objectMapper;

  /**
   * Resolves every configured channel name to its id. Channel listing failures propagate and
   * abort startup; names that match no visible channel are skipped with a warning.
   */
  public ChannelPolicies load() {
    final List<ChannelEntry> entries = new ArrayList<>(properties.channels());
    if (properties.hasConfigFile()) {
      entries.addAll(readConfigFile(Path.of(properties.configFile())));
    }
    if (entries.isEmpty()) {
      logger.info(
          "no channel retention overrides configured defaultMessageTtl={} defaultFileTtl={}",
          properties.defaultMessageTtl(),
          properties.defaultFileTtl());
      return ChannelPolicies.empty();
    }
    final Map<String, String> channelIdsByName = new HashMap<>();
    for (SlackChannel channel : client.listChannels()) {
      logger.debug("channel resolved name={} id={}", channel.name(), channel.id());
      channelIdsByName.putIfAbsent(channel.name(), channel.id());
    }
    final List<ChannelPolicy> policies = new ArrayList<>();
    for (ChannelEntry entry : entries) {
      final String channelId = channelIdsByName.get(entry.channel());
      if (channelId == null) {
        logger.warn(
            "retention override ignored because channel is not visible channel={}",
            entry.channel());
        continue;
      }
      logger.info(
          "retention override channel={} channelId={} messageTtl={} fileTtl={}",
          entry.channel(),
          channelId,
          entry.messageTtl(),
          entry.fileTtl());
      policies.add(new ChannelPolicy(channelId, entry.messageTtl(), entry.fileTtl()));
    }
    return ChannelPolicies.of(policies);
  }

  /** Reads {@code [{"channel": "...", "message_ttl": 600, "file_ttl": 0}]}; TTLs in seconds. */
  @VisibleForTesting
  List<ChannelEntry> readConfigFile(Path path) {
    final List<FileEntry> fileEntries;
    try {
      fileEntries =
          objectMapper.readValue(Files.readAllBytes(path), new TypeReference<List<FileEntry>>() {});
    } catch (IOException ex) {
      throw new IllegalStateException("failed to read retention config file path=" + path, ex);
    }
    if (fileEntries == null) {
      return List.of();
    }
    final List<ChannelEntry> entries = new ArrayList<>(fileEntries.size());
    for (FileEntry fileEntry : fileEntries) {
      if (fileEntry.channel() == null || fileEntry.channel().isBlank()) {
        throw new IllegalStateException("retention config file entry without channel path=" + path);
      }
      if (fileEntry.messageTtl() < 0 || fileEntry.fileTtl() < 0) {
        throw new IllegalStateException(
            "retention config file has negative ttl channel=" + fileEntry.channel());
      }
      entries.add(
          new ChannelEntry(
              fileEntry.channel(),
              Duration.ofSeconds(fileEntry.messageTtl()),
              Duration.ofSeconds(fileEntry.fileTtl())));
    }
    logger.info("retention config file loaded path={} entries={}", path, entries.size());
    return entries;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  record FileEntry(String channel, long messageTtl, long fileTtl) {}
}
