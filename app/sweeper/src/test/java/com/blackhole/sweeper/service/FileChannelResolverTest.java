package com.blackhole.sweeper.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.blackhole.sweeper.slack.ChatPlatformClient;
import com.blackhole.sweeper.slack.SlackApiException;
import com.blackhole.sweeper.slack.dto.SlackFile;
import java.util.List;
import org.junit.jupiter.api.Test;

class FileChannelResolverTest {

  private final ChatPlatformClient client = mock(ChatPlatformClient.class);
  private final FileChannelResolver resolver = new FileChannelResolver(client);

  @Test
  void fileWithChannelsIsNotRefetched() {
    final SlackFile file = new SlackFile("F1", null, null, 1L, null, List.of("C1"));

    assertThat(resolver.complete(file)).isSameAs(file);
    assertThat(resolver.owningChannel(file)).contains("C1");
    verifyNoInteractions(client);
  }

  @Test
  void fileWithoutChannelsIsRefetched() {
    when(client.getFileInfo("F1"))
        .thenReturn(new SlackFile("F1", null, null, 1L, null, List.of("C2")));

    final SlackFile completed = resolver.complete(SlackFile.ofId("F1"));

    assertThat(completed.channels()).containsExactly("C2");
  }

  @Test
  void noOrSeveralChannelsHaveNoOwner() {
    assertThat(resolver.owningChannel(SlackFile.ofId("F1"))).isEmpty();
    assertThat(
            resolver.owningChannel(new SlackFile("F1", null, null, 1L, null, List.of("C1", "C2"))))
        .isEmpty();
  }

  @Test
  void refetchFailureCarriesFileId() {
    when(client.getFileInfo("F9"))
        .thenThrow(
            new SlackApiException(SlackApiException.Reason.TIMEOUT, "files.info", null, "timeout"));

    assertThatThrownBy(() -> resolver.complete(SlackFile.ofId("F9")))
        .isInstanceOf(FileMetadataUnavailableException.class)
        .extracting(ex -> ((FileMetadataUnavailableException) ex).fileId())
        .isEqualTo("F9");
  }
}
