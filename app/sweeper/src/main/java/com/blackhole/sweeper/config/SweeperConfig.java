/*
 * Where: Sweeper configuration
 * What: Wires the API call throttle and the startup identity and policy checks
 * Why: The token must be valid and the channel policies resolved before any work starts
 */
package com.blackhole.sweeper.config;

import com.blackhole.sweeper.model.ChannelPolicies;
import com.blackhole.sweeper.model.WorkspaceIdentity;
import com.blackhole.sweeper.service.ApiCallThrottle;
import com.blackhole.sweeper.service.ChannelPolicyLoader;
import com.blackhole.sweeper.service.SweeperMetrics;
import com.blackhole.sweeper.slack.ChatPlatformClient;
import com.blackhole.sweeper.slack.dto.AuthTestResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;

@Configuration(proxyBeanMethods = false)
public class SweeperConfig {

  private static final Logger logger = LoggerFactory.getLogger(SweeperConfig.class);

  @Bean(destroyMethod = "close")
  ApiCallThrottle apiCallThrottle(ThrottleProperties properties, SweeperMetrics metrics) {
    return ApiCallThrottle.start(properties.interval(), metrics);
  }

  /** Fails startup when the token is rejected. */
  @Bean
  WorkspaceIdentity workspaceIdentity(ChatPlatformClient client) {
    final AuthTestResponse response = client.authTest();
    final WorkspaceIdentity identity =
        new WorkspaceIdentity(
            response.teamId(), response.team(), response.userId(), response.user());
    logger.info(
        "slack auth ok team={} teamId={} user={} userId={}",
        identity.team(),
        identity.teamId(),
        identity.user(),
        identity.userId());
    return identity;
  }

  @Bean
  @DependsOn("workspaceIdentity")
  ChannelPolicies channelPolicies(ChannelPolicyLoader loader, DeletionProperties deletion) {
    final ChannelPolicies policies = loader.load();
    logger.info(
        "channel policies loaded overrides={} dryRun={}", policies.size(), deletion.dryRun());
    return policies;
  }
}
