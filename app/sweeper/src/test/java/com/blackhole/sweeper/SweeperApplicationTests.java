package com.blackhole.sweeper;

import static org.assertj.core.api.Assertions.assertThat;

import com.blackhole.sweeper.model.ChannelPolicies;
import com.blackhole.sweeper.model.WorkspaceIdentity;
import com.blackhole.sweeper.slack.ChatPlatformClient;
import com.blackhole.sweeper.slack.dto.AuthTestResponse;
import com.blackhole.sweeper.slack.dto.ConversationsHistoryResponse;
import com.blackhole.sweeper.slack.dto.FilesListResponse;
import com.blackhole.sweeper.slack.dto.SlackChannel;
import com.blackhole.sweeper.slack.dto.SlackFile;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest(properties = "blackhole.retention.channels[0].channel=dev_null")
@ActiveProfiles("test")
class SweeperApplicationTests {

  @Autowired private WorkspaceIdentity workspaceIdentity;

  @Autowired private ChannelPolicies channelPolicies;

  @Test
  void contextLoadsWithIdentityAndPolicies() {
    assertThat(workspaceIdentity.teamId()).isEqualTo("T1");
    assertThat(channelPolicies.find("C-DEV-NULL")).isPresent();
  }

  @TestConfiguration
  static class StubSlackConfiguration {

    @Bean
    @Primary
    ChatPlatformClient stubChatPlatformClient() {
      return new ChatPlatformClient() {
        @Override
        public AuthTestResponse authTest() {
          return new AuthTestResponse(true, null, null, "Acme", "sweeper", "T1", "U1");
        }

        @Override
        public List<SlackChannel> listChannels() {
          return List.of(new SlackChannel("C-DEV-NULL", "dev_null"));
        }

        @Override
        public ConversationsHistoryResponse listChannelHistory(String channelId, String latest) {
          return new ConversationsHistoryResponse(true, null, List.of(), false);
        }

        @Override
        public FilesListResponse listFiles(int page) {
          return new FilesListResponse(true, null, List.of(), null);
        }

        @Override
        public SlackFile getFileInfo(String fileId) {
          return SlackFile.ofId(fileId);
        }

        @Override
        public void deleteMessage(String channelId, String ts) {}

        @Override
        public void deleteFile(String fileId) {}
      };
    }
  }
}
