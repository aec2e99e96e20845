/*
 * Where: Sweeper web configuration
 * What: Applies RequestMdcInterceptor to the events endpoint
 * Why: Webhook log lines carry the request id and Slack retry headers
 */
package com.blackhole.sweeper.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final RequestMdcInterceptor requestMdcInterceptor;
  private final EventsProperties eventsProperties;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(requestMdcInterceptor).addPathPatterns(eventsProperties.path());
  }
}
