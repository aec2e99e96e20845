/*
 * Where: Sweeper configuration
 * What: Provides the RestClient used for Slack Web API calls
 * Why: Base URL, bearer token and timeouts are set once for every Slack request
 */
package com.blackhole.sweeper.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class SlackClientConfig {

  @Bean
  RestClient slackRestClient(RestClient.Builder builder, SlackClientProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder
        .baseUrl(properties.baseUrl())
        .requestFactory(requestFactory)
        .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.token())
        .build();
  }
}
